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
package exm.ftx.frontend.ofp;

import java.util.HashMap;
import java.util.Map;

/**
 * Element tags of the Open Fortran Parser XML output that lowering
 * knows about.  Every other tag maps to {@link #UNKNOWN}.
 */
public enum OFPTag {
  // Program units and structural wrappers
  OFP("ofp", true),
  FILE("file", true),
  PROGRAM("program"),
  MODULE("module"),
  SUBROUTINE("subroutine"),
  FUNCTION("function"),
  MEMBERS("members", true),
  BODY("body", true),
  HEADER("header", true),
  TARGET("target", true),
  VALUE("value", true),
  OPERAND("operand", true),
  LOWER_BOUND("lower-bound", true),
  UPPER_BOUND("upper-bound", true),
  STEP("step", true),
  EXPRESSION("expression", true),
  EXPRESSIONS("expressions", true),
  INITIAL_VALUE("initial-value", true),
  VARIABLES("variables", true),
  DIMENSIONS("dimensions", true),

  // Statements
  LOOP("loop"),
  IF("if"),
  SELECT("select"),
  COMMENT("comment"),
  STATEMENT("statement"),
  ELSEWHERE_STMT("elsewhere-stmt"),
  END_WHERE_STMT("end-where-stmt"),
  CYCLE("cycle"),
  EXIT("exit"),
  ASSIGNMENT("assignment"),
  POINTER_ASSIGNMENT("pointer-assignment"),
  SPECIFICATION("specification"),
  DECLARATION("declaration"),
  ASSOCIATE("associate"),
  ALLOCATE("allocate"),
  DEALLOCATE("deallocate"),
  USE("use"),
  DIRECTIVE("directive"),
  OPEN("open"),
  CLOSE("close"),
  READ("read"),
  WRITE("write"),
  FORMAT("format"),
  CALL("call"),
  ARGUMENT("argument"),

  // Expressions
  NAME("name"),
  VARIABLE("variable"),
  PART_REF("part-ref"),
  LITERAL("literal"),
  SUBSCRIPTS("subscripts"),
  SUBSCRIPT("subscript"),
  DIMENSION("dimension"),
  RANGE("range"),
  ARRAY_CONSTRUCTOR_VALUES("array-constructor-values"),
  OPERATION("operation"),

  UNKNOWN(null);

  private static final Map<String, OFPTag> byTag =
                                        new HashMap<String, OFPTag>();
  static {
    for (OFPTag t: values()) {
      if (t.tag != null) {
        byTag.put(t.tag, t);
      }
    }
  }

  private final String tag;
  private final boolean transparent;

  private OFPTag(String tag) {
    this(tag, false);
  }

  private OFPTag(String tag, boolean transparent) {
    this.tag = tag;
    this.transparent = transparent;
  }

  public String tag() {
    return tag;
  }

  /**
   * True for purely structural elements, whose children are lowered in
   * their place
   */
  public boolean isTransparent() {
    return transparent;
  }

  public static OFPTag fromTag(String tag) {
    OFPTag t = byTag.get(tag);
    return t == null ? UNKNOWN : t;
  }
}
