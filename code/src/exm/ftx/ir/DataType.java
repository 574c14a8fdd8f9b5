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
package exm.ftx.ir;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import exm.ftx.ast.SourceSpan;

/**
 * Type descriptor of a declaration.  One instance is shared by every
 * variable a declaration introduces.
 */
public class DataType {

  public static enum TypeAttr {
    ALLOCATABLE,
    POINTER,
    OPTIONAL,
    PARAMETER,
    TARGET;

    /**
     * @return attribute named by a declaration keyword, or null
     */
    public static TypeAttr fromKeyword(String keyword) {
      String k = keyword.trim().toUpperCase();
      for (TypeAttr a: values()) {
        if (a.name().equals(k)) {
          return a;
        }
      }
      return null;
    }
  }

  private final String name;
  private final String kind;
  private final String intent;
  private final boolean derived;
  private final Set<TypeAttr> attrs;
  private final SourceSpan source;

  /**
   * @param name type name, e.g. REAL, or the name of a derived type
   * @param kind kind parameter, or null
   * @param intent dummy argument intent (in, out, inout), or null
   * @param derived true if name refers to a derived type
   * @param attrs attributes of the declaration
   * @param source
   */
  public DataType(String name, String kind, String intent, boolean derived,
                  Set<TypeAttr> attrs, SourceSpan source) {
    assert(name != null);
    this.name = name;
    this.kind = kind;
    this.intent = intent;
    this.derived = derived;
    this.attrs = attrs.isEmpty() ? Collections.<TypeAttr>emptySet() :
                        Collections.unmodifiableSet(EnumSet.copyOf(attrs));
    this.source = source;
  }

  public static DataType intrinsic(String name, String kind) {
    return new DataType(name, kind, null, false, EnumSet.noneOf(TypeAttr.class),
                        null);
  }

  public String getName() {
    return name;
  }

  public String getKind() {
    return kind;
  }

  public String getIntent() {
    return intent;
  }

  public boolean isDerived() {
    return derived;
  }

  public boolean is(TypeAttr attr) {
    return attrs.contains(attr);
  }

  public boolean isAllocatable() {
    return is(TypeAttr.ALLOCATABLE);
  }

  public boolean isPointer() {
    return is(TypeAttr.POINTER);
  }

  public Set<TypeAttr> getAttrs() {
    return attrs;
  }

  public SourceSpan getSource() {
    return source;
  }

  /**
   * Fortran declaration type spec and attributes, e.g.
   * <code>REAL(KIND=JPRB), INTENT(IN), ALLOCATABLE</code>
   */
  public void appendTo(StringBuilder sb) {
    if (derived) {
      sb.append("TYPE(").append(name).append(")");
    } else {
      sb.append(name.toUpperCase());
      if (kind != null) {
        if (name.equalsIgnoreCase("CHARACTER")) {
          sb.append("(LEN=").append(kind).append(")");
        } else {
          sb.append("(KIND=").append(kind).append(")");
        }
      }
    }
    if (intent != null) {
      sb.append(", INTENT(").append(intent.toUpperCase()).append(")");
    }
    for (TypeAttr attr: attrs) {
      sb.append(", ").append(attr.name());
    }
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    appendTo(sb);
    return sb.toString();
  }
}
