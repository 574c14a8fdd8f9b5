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
package exm.ftx.frontend.fp;

import org.antlr.runtime.Token;

/**
 * Fortran 2003 syntax rules of the fparser-style front end.  Each tree
 * node carries one of these as its token type.
 *
 * Conventions for node text and children:
 * <ul>
 * <li>Names, literals, comments and passthrough statements: the text is
 *     the leaf string</li>
 * <li>Operator rules: the text is the operator, one child for a prefix
 *     operator and two for a binary one</li>
 * <li>Optional positional children, such as the bounds of a subscript
 *     triplet, are always present and hold a {@link #NONE} node when
 *     omitted</li>
 * </ul>
 */
public enum FPRule {
  // Structure
  PROGRAM("Program", true),
  SPECIFICATION_PART("Specification_Part", true),
  EXECUTION_PART("Execution_Part", true),
  BLOCK("Block", true),
  COMPONENT_PART("Component_Part", true),
  AC_VALUE_LIST("Ac_Value_List", true),
  NONE("None"),

  // Program units and their delimiting statements
  MAIN_PROGRAM("Main_Program"),
  MODULE("Module"),
  SUBROUTINE_SUBPROGRAM("Subroutine_Subprogram"),
  FUNCTION_SUBPROGRAM("Function_Subprogram"),
  PROGRAM_STMT("Program_Stmt"),
  MODULE_STMT("Module_Stmt"),
  SUBROUTINE_STMT("Subroutine_Stmt"),
  FUNCTION_STMT("Function_Stmt"),
  CONTAINS_STMT("Contains_Stmt"),
  END_PROGRAM_STMT("End_Program_Stmt"),
  END_MODULE_STMT("End_Module_Stmt"),
  END_SUBROUTINE_STMT("End_Subroutine_Stmt"),
  END_FUNCTION_STMT("End_Function_Stmt"),

  // Constructs
  BLOCK_NONLABEL_DO_CONSTRUCT("Block_Nonlabel_Do_Construct"),
  NONLABEL_DO_STMT("Nonlabel_Do_Stmt"),
  LOOP_CONTROL("Loop_Control"),
  END_DO_STMT("End_Do_Stmt"),
  IF_CONSTRUCT("If_Construct"),
  IF_THEN_STMT("If_Then_Stmt"),
  ELSE_IF_STMT("Else_If_Stmt"),
  ELSE_STMT("Else_Stmt"),
  END_IF_STMT("End_If_Stmt"),
  IF_STMT("If_Stmt"),
  CASE_CONSTRUCT("Case_Construct"),
  SELECT_CASE_STMT("Select_Case_Stmt"),
  CASE_STMT("Case_Stmt"),
  END_SELECT_STMT("End_Select_Stmt"),
  WHERE_CONSTRUCT("Where_Construct"),
  WHERE_CONSTRUCT_STMT("Where_Construct_Stmt"),
  ELSEWHERE_STMT("Elsewhere_Stmt"),
  END_WHERE_STMT("End_Where_Stmt"),
  WHERE_STMT("Where_Stmt"),

  // Statements
  ASSIGNMENT_STMT("Assignment_Stmt"),
  POINTER_ASSIGNMENT_STMT("Pointer_Assignment_Stmt"),
  CALL_STMT("Call_Stmt"),
  ACTUAL_ARG_SPEC_LIST("Actual_Arg_Spec_List"),
  ACTUAL_ARG_SPEC("Actual_Arg_Spec"),
  ALLOCATE_STMT("Allocate_Stmt"),
  DEALLOCATE_STMT("Deallocate_Stmt"),
  NULLIFY_STMT("Nullify_Stmt"),
  COMMENT("Comment"),
  CYCLE_STMT("Cycle_Stmt"),
  EXIT_STMT("Exit_Stmt"),
  RETURN_STMT("Return_Stmt"),
  CONTINUE_STMT("Continue_Stmt"),
  READ_STMT("Read_Stmt"),
  WRITE_STMT("Write_Stmt"),
  PRINT_STMT("Print_Stmt"),
  OPEN_STMT("Open_Stmt"),
  CLOSE_STMT("Close_Stmt"),
  FORMAT_STMT("Format_Stmt"),
  IMPLICIT_STMT("Implicit_Stmt"),
  SAVE_STMT("Save_Stmt"),
  ACCESS_STMT("Access_Stmt"),

  // Declarations
  TYPE_DECLARATION_STMT("Type_Declaration_Stmt"),
  DATA_COMPONENT_DEF_STMT("Data_Component_Def_Stmt"),
  INTRINSIC_TYPE_SPEC("Intrinsic_Type_Spec"),
  DECLARATION_TYPE_SPEC("Declaration_Type_Spec"),
  KIND_SELECTOR("Kind_Selector"),
  ATTR_SPEC_LIST("Attr_Spec_List"),
  ATTR_SPEC("Attr_Spec"),
  INTENT_ATTR_SPEC("Intent_Attr_Spec"),
  DIMENSION_ATTR_SPEC("Dimension_Attr_Spec"),
  ENTITY_DECL_LIST("Entity_Decl_List"),
  ENTITY_DECL("Entity_Decl"),
  EXPLICIT_SHAPE_SPEC("Explicit_Shape_Spec"),
  ASSUMED_SHAPE_SPEC("Assumed_Shape_Spec"),
  DEFERRED_SHAPE_SPEC("Deferred_Shape_Spec"),
  INITIALIZATION("Initialization"),
  DERIVED_TYPE_DEF("Derived_Type_Def"),
  DERIVED_TYPE_STMT("Derived_Type_Stmt"),
  END_TYPE_STMT("End_Type_Stmt"),
  USE_STMT("Use_Stmt"),
  ONLY_LIST("Only_List"),

  // Expressions
  NAME("Name"),
  DATA_REF("Data_Ref"),
  PART_REF("Part_Ref"),
  SECTION_SUBSCRIPT_LIST("Section_Subscript_List"),
  SUBSCRIPT_TRIPLET("Subscript_Triplet"),
  INT_LITERAL_CONSTANT("Int_Literal_Constant"),
  REAL_LITERAL_CONSTANT("Real_Literal_Constant"),
  LOGICAL_LITERAL_CONSTANT("Logical_Literal_Constant"),
  CHAR_LITERAL_CONSTANT("Char_Literal_Constant"),
  INTRINSIC_FUNCTION_REFERENCE("Intrinsic_Function_Reference"),
  ARRAY_CONSTRUCTOR("Array_Constructor"),
  PARENTHESIS("Parenthesis"),
  LEVEL_2_UNARY_EXPR("Level_2_Unary_Expr"),
  ADD_OPERAND("Add_Operand"),
  MULT_OPERAND("Mult_Operand"),
  LEVEL_2_EXPR("Level_2_Expr"),
  LEVEL_3_EXPR("Level_3_Expr"),
  LEVEL_4_EXPR("Level_4_Expr"),
  AND_OPERAND("And_Operand"),
  OR_OPERAND("Or_Operand"),
  EQUIV_OPERAND("Equiv_Operand"),
  LEVEL_5_EXPR("Level_5_Expr"),

  UNKNOWN("Unknown");

  private final String tag;
  private final boolean transparent;

  private FPRule(String tag) {
    this(tag, false);
  }

  private FPRule(String tag, boolean transparent) {
    this.tag = tag;
    this.transparent = transparent;
  }

  public String tag() {
    return tag;
  }

  public boolean isTransparent() {
    return transparent;
  }

  /**
   * Rules whose text is an operator applied to the children
   */
  public boolean isOperator() {
    switch (this) {
      case LEVEL_2_UNARY_EXPR:
      case ADD_OPERAND:
      case MULT_OPERAND:
      case LEVEL_2_EXPR:
      case LEVEL_3_EXPR:
      case LEVEL_4_EXPR:
      case AND_OPERAND:
      case OR_OPERAND:
      case EQUIV_OPERAND:
      case LEVEL_5_EXPR:
        return true;
      default:
        return false;
    }
  }

  /**
   * Statements copied to the output as written
   */
  public boolean isPassthrough() {
    switch (this) {
      case CYCLE_STMT:
      case EXIT_STMT:
      case RETURN_STMT:
      case CONTINUE_STMT:
      case READ_STMT:
      case WRITE_STMT:
      case PRINT_STMT:
      case OPEN_STMT:
      case CLOSE_STMT:
      case FORMAT_STMT:
      case IMPLICIT_STMT:
      case SAVE_STMT:
      case ACCESS_STMT:
        return true;
      default:
        return false;
    }
  }

  public int tokenType() {
    return ordinal() + Token.MIN_TOKEN_TYPE;
  }

  public static FPRule fromTokenType(int type) {
    int i = type - Token.MIN_TOKEN_TYPE;
    FPRule[] rules = values();
    if (i < 0 || i >= rules.length) {
      return UNKNOWN;
    }
    return rules[i];
  }
}
