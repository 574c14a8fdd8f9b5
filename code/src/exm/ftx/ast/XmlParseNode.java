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
package exm.ftx.ast;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import exm.ftx.common.exceptions.FTXRuntimeError;
import exm.ftx.common.exceptions.UserException;

/**
 * Parse tree node backed by an XML element, as produced by the XML-emitting
 * front ends.  Only element children are exposed.  Position metadata is read
 * from <code>line_begin/col_begin/line_end/col_end</code> attributes if
 * present, otherwise from a <code>lineno</code> attribute.
 */
public class XmlParseNode implements ParseNode {

  private final Element element;
  private List<XmlParseNode> children = null;
  private Map<String, String> attributes = null;

  public XmlParseNode(Element element) {
    this.element = element;
  }

  /**
   * Parse an XML document held in memory
   * @return the document's root element
   * @throws UserException if the document is not well-formed
   */
  public static XmlParseNode parse(String xml) throws UserException {
    try {
      DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
      factory.setNamespaceAware(false);
      factory.setExpandEntityReferences(false);
      DocumentBuilder builder = factory.newDocumentBuilder();
      Element root = builder.parse(new InputSource(new StringReader(xml)))
                            .getDocumentElement();
      return new XmlParseNode(root);
    } catch (SAXException e) {
      throw new UserException("Malformed parse tree XML: " + e.getMessage());
    } catch (IOException e) {
      throw new UserException("Could not read parse tree XML: " +
                              e.getMessage());
    } catch (ParserConfigurationException e) {
      throw new UserException("XML parser unavailable: " + e.getMessage());
    }
  }

  @Override
  public String getTag() {
    return element.getTagName();
  }

  @Override
  public List<XmlParseNode> children() {
    if (children == null) {
      List<XmlParseNode> result = new ArrayList<XmlParseNode>();
      NodeList nodes = element.getChildNodes();
      for (int i = 0; i < nodes.getLength(); i++) {
        Node n = nodes.item(i);
        if (n.getNodeType() == Node.ELEMENT_NODE) {
          result.add(new XmlParseNode((Element)n));
        }
      }
      children = Collections.unmodifiableList(result);
    }
    return children;
  }

  public int childCount() {
    return children().size();
  }

  public XmlParseNode child(int i) {
    return children().get(i);
  }

  @Override
  public String getAttribute(String key) {
    if (!element.hasAttribute(key)) {
      return null;
    }
    return element.getAttribute(key);
  }

  public boolean hasAttribute(String key) {
    return element.hasAttribute(key);
  }

  @Override
  public Map<String, String> getAttributes() {
    if (attributes == null) {
      Map<String, String> result = new LinkedHashMap<String, String>();
      NamedNodeMap attrs = element.getAttributes();
      for (int i = 0; i < attrs.getLength(); i++) {
        Node a = attrs.item(i);
        result.put(a.getNodeName(), a.getNodeValue());
      }
      attributes = Collections.unmodifiableMap(result);
    }
    return attributes;
  }

  /**
   * @return text content of the element, trimmed
   */
  public String getText() {
    return element.getTextContent().trim();
  }

  @Override
  public SourcePosition getPosition() {
    int lineBegin, lineEnd;
    int colBegin = SourcePosition.NO_COLUMN;
    int colEnd = SourcePosition.NO_COLUMN;
    if (hasAttribute("line_begin") && hasAttribute("line_end")) {
      lineBegin = intAttribute("line_begin");
      lineEnd = intAttribute("line_end");
      if (hasAttribute("col_begin")) {
        colBegin = intAttribute("col_begin");
      }
      if (hasAttribute("col_end")) {
        colEnd = intAttribute("col_end");
      }
    } else if (hasAttribute("lineno")) {
      lineBegin = intAttribute("lineno");
      lineEnd = lineBegin;
    } else {
      return null;
    }
    if (lineBegin < 1 || lineEnd < lineBegin) {
      throw new FTXRuntimeError("Invalid line range " + lineBegin + "-" +
                                lineEnd + " on <" + getTag() + ">");
    }
    return new SourcePosition(lineBegin, colBegin, lineEnd, colEnd);
  }

  private int intAttribute(String key) {
    String val = getAttribute(key);
    try {
      return Integer.parseInt(val.trim());
    } catch (NumberFormatException e) {
      throw new FTXRuntimeError("Invalid " + key + " '" + val + "' on <" +
                                getTag() + ">", e);
    }
  }

  /**
   * First node matching a slash-separated path of child tags, relative
   * to this node.
   * @return the node, or null if there is no match
   */
  public XmlParseNode find(String path) {
    List<XmlParseNode> matches = findAll(path, true);
    return matches.isEmpty() ? null : matches.get(0);
  }

  /**
   * All nodes matching a slash-separated path of child tags, in document
   * order.
   */
  public List<XmlParseNode> findAll(String path) {
    return findAll(path, false);
  }

  private List<XmlParseNode> findAll(String path, boolean firstOnly) {
    String[] steps = path.split("/");
    List<XmlParseNode> current = Collections.singletonList(this);
    for (String step: steps) {
      List<XmlParseNode> next = new ArrayList<XmlParseNode>();
      for (XmlParseNode n: current) {
        for (XmlParseNode c: n.children()) {
          if (c.getTag().equals(step)) {
            next.add(c);
          }
        }
      }
      current = next;
      if (current.isEmpty()) {
        break;
      }
    }
    if (firstOnly && current.size() > 1) {
      return current.subList(0, 1);
    }
    return current;
  }

  /**
   * @return index of the given node among this node's children, or -1
   */
  public int indexOf(XmlParseNode child) {
    List<XmlParseNode> cs = children();
    for (int i = 0; i < cs.size(); i++) {
      if (cs.get(i).element == child.element) {
        return i;
      }
    }
    return -1;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof XmlParseNode)) {
      return false;
    }
    return element == ((XmlParseNode)obj).element;
  }

  @Override
  public int hashCode() {
    return System.identityHashCode(element);
  }

  @Override
  public String toString() {
    return "<" + getTag() + " " + getAttributes() + ">";
  }
}
