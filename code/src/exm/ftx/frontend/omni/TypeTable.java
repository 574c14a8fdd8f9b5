/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.ftx.frontend.omni;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import exm.ftx.ast.XmlParseNode;
import exm.ftx.ir.DataType.TypeAttr;

/**
 * Index of the XcodeML type table.  Type identifiers of basic types may
 * refer to other basic types (e.g. an array of a kind-qualified real), to
 * a struct type, or to one of the predefined Fortran types.
 */
public class TypeTable {

  private final Map<String, XmlParseNode> basicTypes =
                                  new HashMap<String, XmlParseNode>();
  private final Map<String, XmlParseNode> structTypes =
                                  new HashMap<String, XmlParseNode>();
  /** Struct type id to the name it is declared with */
  private final Map<String, String> structNames =
                                  new HashMap<String, String>();

  public static TypeTable build(XmlParseNode root) {
    TypeTable t = new TypeTable();
    XmlParseNode table = root.getTag().equals("typeTable") ? root :
                                                root.find("typeTable");
    if (table != null) {
      for (XmlParseNode n: table.children()) {
        String id = n.getAttribute("type");
        if (id == null) {
          continue;
        }
        if (n.getTag().equals("FbasicType")) {
          t.basicTypes.put(id, n);
        } else if (n.getTag().equals("FstructType")) {
          t.structTypes.put(id, n);
        }
      }
    }
    t.indexStructNames(root);
    return t;
  }

  private void indexStructNames(XmlParseNode node) {
    if (node.getTag().equals(OMNITag.STRUCT_DECL.tag())) {
      XmlParseNode name = node.find("name");
      if (name != null && name.getAttribute("type") != null) {
        structNames.put(name.getAttribute("type"), name.getText());
      }
    }
    for (XmlParseNode c: node.children()) {
      indexStructNames(c);
    }
  }

  /**
   * @return chain of basic type definitions starting at id, outermost
   *          first; empty for predefined or struct types
   */
  private List<XmlParseNode> chain(String id) {
    List<XmlParseNode> result = new ArrayList<XmlParseNode>();
    String curr = id;
    while (curr != null && basicTypes.containsKey(curr) &&
           result.size() <= basicTypes.size()) {
      XmlParseNode t = basicTypes.get(curr);
      result.add(t);
      curr = t.getAttribute("ref");
    }
    return result;
  }

  private String resolve(String id) {
    List<XmlParseNode> c = chain(id);
    if (c.isEmpty()) {
      return id;
    }
    return c.get(c.size() - 1).getAttribute("ref");
  }

  public boolean isStruct(String id) {
    return id != null && structTypes.containsKey(resolve(id));
  }

  public XmlParseNode getStruct(String id) {
    return structTypes.get(resolve(id));
  }

  /**
   * @return Fortran type name, or name of the derived type; null if the
   *          type cannot be resolved
   */
  public String typeName(String id) {
    if (id == null) {
      return null;
    }
    String base = resolve(id);
    if (base == null) {
      return null;
    }
    if (structTypes.containsKey(base)) {
      return structNames.get(base);
    }
    if (base.equals("Fint")) {
      return "INTEGER";
    } else if (base.equals("Freal")) {
      return "REAL";
    } else if (base.equals("Fcomplex")) {
      return "COMPLEX";
    } else if (base.equals("Flogical")) {
      return "LOGICAL";
    } else if (base.equals("Fcharacter")) {
      return "CHARACTER";
    }
    return null;
  }

  /**
   * @return kind parameter text, e.g. 8 or JPRB, or null
   */
  public String kind(String id) {
    for (XmlParseNode t: chain(id)) {
      XmlParseNode k = t.find("kind");
      if (k != null && k.childCount() > 0) {
        return k.child(0).getText();
      }
      XmlParseNode len = t.find("len");
      if (len != null && len.childCount() > 0) {
        return len.child(0).getText();
      }
    }
    return null;
  }

  public String intent(String id) {
    for (XmlParseNode t: chain(id)) {
      if (t.getAttribute("intent") != null) {
        return t.getAttribute("intent");
      }
    }
    return null;
  }

  public Set<TypeAttr> attributes(String id) {
    Set<TypeAttr> attrs = EnumSet.noneOf(TypeAttr.class);
    for (XmlParseNode t: chain(id)) {
      for (TypeAttr a: TypeAttr.values()) {
        if ("true".equals(t.getAttribute("is_" + a.name().toLowerCase()))) {
          attrs.add(a);
        }
      }
    }
    return attrs;
  }

  /**
   * @return index ranges of an array type, empty for scalars
   */
  public List<XmlParseNode> indexRanges(String id) {
    for (XmlParseNode t: chain(id)) {
      List<XmlParseNode> ranges = t.findAll("indexRange");
      if (!ranges.isEmpty()) {
        return ranges;
      }
    }
    return new ArrayList<XmlParseNode>();
  }
}
