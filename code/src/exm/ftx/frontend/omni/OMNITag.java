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

import java.util.HashMap;
import java.util.Map;

/**
 * XcodeML elements understood by the OMNI lowering
 */
public enum OMNITag {
  // Structure
  XCODE_PROGRAM("XcodeProgram", true),
  GLOBAL_DECLARATIONS("globalDeclarations", true),
  DECLARATIONS("declarations", true),
  BODY("body", true),
  CONDITION("condition", true),
  VALUE("value", true),
  LOWER_BOUND("lowerBound", true),
  UPPER_BOUND("upperBound", true),
  STEP("step", true),
  ARRAY_INDEX("arrayIndex", true),
  VAR_REF("varRef", true),
  TYPE_TABLE("typeTable"),
  GLOBAL_SYMBOLS("globalSymbols"),
  SYMBOLS("symbols"),
  FUNCTION_DEFINITION("FfunctionDefinition"),
  MODULE_DEFINITION("FmoduleDefinition"),

  // Statements
  DO_STATEMENT("FdoStatement"),
  DO_WHILE_STATEMENT("FdoWhileStatement"),
  IF_STATEMENT("FifStatement"),
  SELECT_CASE_STATEMENT("FselectCaseStatement"),
  ASSIGN_STATEMENT("FassignStatement"),
  POINTER_ASSIGN_STATEMENT("FpointerAssignStatement"),
  WHERE_STATEMENT("FwhereStatement"),
  EXPR_STATEMENT("exprStatement"),
  CALL_STATEMENT("FcallStatement"),
  ALLOCATE_STATEMENT("FallocateStatement"),
  DEALLOCATE_STATEMENT("FdeallocateStatement"),
  NULLIFY_STATEMENT("FnullifyStatement"),
  PRAGMA_STATEMENT("FpragmaStatement"),
  COMMENT_LINE("FcommentLine"),
  CYCLE_STATEMENT("FcycleStatement"),
  EXIT_STATEMENT("FexitStatement"),
  RETURN_STATEMENT("FreturnStatement"),
  CONTINUE_STATEMENT("continueStatement"),

  // Declarations
  VAR_DECL("varDecl"),
  STRUCT_DECL("FstructDecl"),
  USE_DECL("FuseDecl"),
  USE_ONLY_DECL("FuseOnlyDecl"),
  DATA_DECL("FdataDecl"),

  // Expressions
  VAR("Var"),
  ARRAY_REF("FarrayRef"),
  MEMBER_REF("FmemberRef"),
  INT_CONSTANT("FintConstant"),
  REAL_CONSTANT("FrealConstant"),
  CHARACTER_CONSTANT("FcharacterConstant"),
  LOGICAL_CONSTANT("FlogicalConstant"),
  FUNCTION_CALL("functionCall"),
  ARRAY_CONSTRUCTOR("FarrayConstructor"),
  CONCAT_EXPR("FconcatExpr"),
  INDEX_RANGE("indexRange"),
  PLUS_EXPR("plusExpr", "+"),
  MINUS_EXPR("minusExpr", "-"),
  MUL_EXPR("mulExpr", "*"),
  DIV_EXPR("divExpr", "/"),
  POWER_EXPR("FpowerExpr", "**"),
  EQ_EXPR("logEQExpr", "=="),
  NEQ_EXPR("logNEQExpr", "/="),
  GE_EXPR("logGEExpr", ">="),
  GT_EXPR("logGTExpr", ">"),
  LE_EXPR("logLEExpr", "<="),
  LT_EXPR("logLTExpr", "<"),
  AND_EXPR("logAndExpr", ".and."),
  OR_EXPR("logOrExpr", ".or."),
  EQV_EXPR("logEQVExpr", ".eqv."),
  NEQV_EXPR("logNEQVExpr", ".neqv."),
  NOT_EXPR("logNotExpr", ".not."),
  UNARY_MINUS_EXPR("unaryMinusExpr", "-"),

  UNKNOWN(null);

  private static final Map<String, OMNITag> byTag =
                                        new HashMap<String, OMNITag>();
  static {
    for (OMNITag t: values()) {
      if (t.tag != null) {
        byTag.put(t.tag, t);
      }
    }
  }

  private final String tag;
  private final boolean transparent;
  /** Fortran operator for operator elements, otherwise null */
  private final String operator;

  private OMNITag(String tag) {
    this(tag, false, null);
  }

  private OMNITag(String tag, boolean transparent) {
    this(tag, transparent, null);
  }

  private OMNITag(String tag, String operator) {
    this(tag, false, operator);
  }

  private OMNITag(String tag, boolean transparent, String operator) {
    this.tag = tag;
    this.transparent = transparent;
    this.operator = operator;
  }

  public String tag() {
    return tag;
  }

  public boolean isTransparent() {
    return transparent;
  }

  public String operator() {
    return operator;
  }

  public boolean isOperator() {
    return operator != null;
  }

  public boolean isUnaryOperator() {
    return this == NOT_EXPR || this == UNARY_MINUS_EXPR;
  }

  public static OMNITag fromTag(String tag) {
    OMNITag t = byTag.get(tag);
    return t == null ? UNKNOWN : t;
  }
}
