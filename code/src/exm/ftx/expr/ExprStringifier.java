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
package exm.ftx.expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Map.Entry;

import exm.ftx.common.util.StringUtil;
import exm.ftx.ir.expr.ArrayRef;
import exm.ftx.ir.expr.Cast;
import exm.ftx.ir.expr.Expression;
import exm.ftx.ir.expr.Expression.ExprKind;
import exm.ftx.ir.expr.FloatLiteral;
import exm.ftx.ir.expr.InlineCall;
import exm.ftx.ir.expr.IntLiteral;
import exm.ftx.ir.expr.LiteralList;
import exm.ftx.ir.expr.LogicLiteral;
import exm.ftx.ir.expr.Operation;
import exm.ftx.ir.expr.RangeIndex;
import exm.ftx.ir.expr.StringConcat;
import exm.ftx.ir.expr.StringLiteral;
import exm.ftx.ir.expr.VariableRef;

/**
 * Render expressions as Fortran.  Parentheses are emitted where the
 * expression marks them, and where operator precedence requires them
 * for operations that were built programmatically.
 */
public class ExprStringifier extends ExprMapper<String> {

  private static final ExprStringifier INSTANCE = new ExprStringifier();

  /** Precedence of user-defined operators, which bind loosest */
  private static final int PREC_DEFINED = 1;

  public static String stringify(Expression e) {
    return INSTANCE.map(e);
  }

  public static List<String> stringifyAll(List<? extends Expression> es) {
    List<String> result = new ArrayList<String>(es.size());
    for (Expression e: es) {
      result.add(INSTANCE.map(e));
    }
    return result;
  }

  /**
   * @param op normalised operator
   * @return binding strength, higher binds tighter
   */
  public static int precedence(String op) {
    if (op.equals("**")) {
      return 10;
    } else if (op.equals("*") || op.equals("/")) {
      return 9;
    } else if (op.equals("+") || op.equals("-")) {
      return 8;
    } else if (op.equals("//")) {
      return 7;
    } else if (op.equals("==") || op.equals("/=") || op.equals("<") ||
               op.equals("<=") || op.equals(">") || op.equals(">=")) {
      return 6;
    } else if (op.equals(".not.")) {
      return 5;
    } else if (op.equals(".and.")) {
      return 4;
    } else if (op.equals(".or.")) {
      return 3;
    } else if (op.equals(".eqv.") || op.equals(".neqv.")) {
      return 2;
    }
    return PREC_DEFINED;
  }

  /**
   * Loosest binding operator at the top level of the operation
   */
  public static int precedence(Operation op) {
    int prec = Integer.MAX_VALUE;
    if (op.getUnaryOp() != null) {
      prec = precedence(op.getUnaryOp());
    }
    for (String o: op.getOps()) {
      prec = Math.min(prec, precedence(o));
    }
    return prec;
  }

  private static String opText(String op) {
    if (op.startsWith(".")) {
      return op.toUpperCase();
    }
    return op;
  }

  private static boolean tightOp(String op) {
    return op.equals("*") || op.equals("/") || op.equals("**");
  }

  @Override
  protected String mapVariable(VariableRef e) {
    StringBuilder sb = new StringBuilder();
    appendReference(sb, e);
    if (e.getInitial() != null) {
      sb.append(" = ");
      sb.append(map(e.getInitial()));
    }
    return sb.toString();
  }

  private void appendReference(StringBuilder sb, VariableRef e) {
    if (e.getParent() != null) {
      appendReference(sb, e.getParent());
      sb.append('%');
    }
    sb.append(e.getName());
    if (e.kind() == ExprKind.ARRAY) {
      ArrayRef arr = (ArrayRef)e;
      if (arr.hasDimensions()) {
        sb.append('(');
        sb.append(StringUtil.concat(",", stringifyAll(arr.getDimensions())));
        sb.append(')');
      }
    }
  }

  @Override
  protected String mapIntLiteral(IntLiteral e) {
    if (e.getKindParam() != null) {
      return e.getText() + "_" + e.getKindParam();
    }
    return e.getText();
  }

  @Override
  protected String mapFloatLiteral(FloatLiteral e) {
    if (e.getKindParam() != null) {
      return e.getValue() + "_" + e.getKindParam();
    }
    return e.getValue();
  }

  @Override
  protected String mapLogicLiteral(LogicLiteral e) {
    return e.getValue() ? ".TRUE." : ".FALSE.";
  }

  @Override
  protected String mapStringLiteral(StringLiteral e) {
    return StringUtil.fortranQuote(e.getValue());
  }

  @Override
  protected String mapRangeIndex(RangeIndex e) {
    StringBuilder sb = new StringBuilder();
    if (e.getLower() != null) {
      sb.append(map(e.getLower()));
    }
    sb.append(':');
    if (e.getUpper() != null) {
      sb.append(map(e.getUpper()));
    }
    if (e.getStep() != null) {
      sb.append(':');
      sb.append(map(e.getStep()));
    }
    return sb.toString();
  }

  @Override
  protected String mapOperation(Operation e) {
    StringBuilder sb = new StringBuilder();
    if (e.isParenthesized()) {
      sb.append('(');
    }
    List<Expression> operands = e.getOperands();
    List<String> ops = e.getOps();
    if (e.getUnaryOp() != null) {
      String u = e.getUnaryOp();
      sb.append(opText(u));
      if (u.startsWith(".")) {
        sb.append(' ');
      }
    }
    for (int i = 0; i < operands.size(); i++) {
      if (i > 0) {
        String op = ops.get(i - 1);
        if (tightOp(op)) {
          sb.append(opText(op));
        } else {
          sb.append(' ').append(opText(op)).append(' ');
        }
      }
      String left = i > 0 ? ops.get(i - 1) : e.getUnaryOp();
      String right = i < ops.size() ? ops.get(i) : null;
      appendOperand(sb, operands.get(i), left, right, i > 0);
    }
    if (e.isParenthesized()) {
      sb.append(')');
    }
    return sb.toString();
  }

  /**
   * @param left operator before the operand, or null
   * @param right operator after the operand, or null
   * @param afterBinary true if the operand follows a binary operator
   */
  private void appendOperand(StringBuilder sb, Expression operand,
                             String left, String right, boolean afterBinary) {
    if (operand.kind() != ExprKind.OPERATION ||
        ((Operation)operand).isParenthesized()) {
      sb.append(map(operand));
      return;
    }
    Operation inner = (Operation)operand;
    int prec = precedence(inner);
    boolean parens = false;
    if (afterBinary && inner.getUnaryOp() != null &&
        !inner.getUnaryOp().startsWith(".")) {
      // Fortran forbids a sign directly after a binary operator
      parens = true;
    }
    if (left != null) {
      int leftPrec = precedence(left);
      if (prec < leftPrec) {
        parens = true;
      } else if (prec == leftPrec) {
        parens = !afterBinary || !regroupable(left, inner);
      }
    }
    if (right != null) {
      int rightPrec = precedence(right);
      if (prec < rightPrec || (prec == rightPrec && right.equals("**"))) {
        parens = true;
      }
    }
    if (parens) {
      sb.append('(').append(map(inner)).append(')');
    } else {
      sb.append(map(inner));
    }
  }

  @Override
  protected String mapInlineCall(InlineCall e) {
    List<String> args = stringifyAll(e.getArgs());
    for (Entry<String, Expression> kw: e.getKwargs().entrySet()) {
      args.add(kw.getKey() + "=" + map(kw.getValue()));
    }
    return e.getName() + "(" + StringUtil.concat(", ", args) + ")";
  }

  @Override
  protected String mapCast(Cast e) {
    StringBuilder sb = new StringBuilder();
    sb.append(e.getFunction()).append('(');
    sb.append(map(e.getArgument()));
    if (e.getKindParam() != null) {
      sb.append(", kind=").append(e.getKindParam());
    }
    sb.append(')');
    return sb.toString();
  }

  @Override
  protected String mapLiteralList(LiteralList e) {
    return "[" + StringUtil.concat(",", stringifyAll(e.getElements())) + "]";
  }

  @Override
  protected String mapStringConcat(StringConcat e) {
    return StringUtil.concat(" // ", stringifyAll(e.getParts()));
  }

  /**
   * True if <code>x op (inner)</code> may be printed as
   * <code>x op inner</code>
   */
  private static boolean regroupable(String op, Operation inner) {
    if (inner.getUnaryOp() != null) {
      return false;
    }
    if (!op.equals("+") && !op.equals("*") && !op.equals("**") &&
        !op.equals("//") && !op.equals(".and.") && !op.equals(".or.")) {
      return false;
    }
    for (String o: inner.getOps()) {
      if (!o.equals(op)) {
        return false;
      }
    }
    return true;
  }
}
