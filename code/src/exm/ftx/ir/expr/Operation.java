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
package exm.ftx.ir.expr;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;

import exm.ftx.ast.SourceSpan;
import exm.ftx.common.exceptions.FTXRuntimeError;

/**
 * Flat operator expression <code>e0 op0 e1 op1 e2 ...</code>, with an
 * optional prefix operator applied to the first operand
 * (<code>-a + b</code>, <code>.NOT. l</code>).
 *
 * Operators are held lower-case: <code>+ - * / ** // == /= &lt; &lt;= &gt;
 * &gt;= .and. .or. .not. .eqv. .neqv.</code>.  Relational operators in
 * dotted form (<code>.lt.</code> etc.) are normalised to symbols.
 */
public class Operation extends Expression {

  private final String unaryOp;
  private final ImmutableList<String> ops;
  private final ImmutableList<Expression> operands;
  private final boolean parenthesized;

  public Operation(String unaryOp, List<String> ops,
                   List<Expression> operands, boolean parenthesized,
                   SourceSpan source) {
    super(source);
    if (operands.isEmpty()) {
      throw new FTXRuntimeError("Operation without operands");
    }
    if (ops.size() != operands.size() - 1) {
      throw new FTXRuntimeError("Operation with " + ops.size() +
            " operators for " + operands.size() + " operands");
    }
    this.unaryOp = unaryOp == null ? null : normalize(unaryOp);
    List<String> normOps = new ArrayList<String>(ops.size());
    for (String op: ops) {
      normOps.add(normalize(op));
    }
    this.ops = ImmutableList.copyOf(normOps);
    this.operands = ImmutableList.copyOf(operands);
    this.parenthesized = parenthesized;
  }

  public static Operation binary(String op, Expression lhs, Expression rhs) {
    return binary(op, lhs, rhs, null);
  }

  public static Operation binary(String op, Expression lhs, Expression rhs,
                                 SourceSpan source) {
    return new Operation(null, Arrays.asList(op), Arrays.asList(lhs, rhs),
                         false, source);
  }

  public static Operation unary(String op, Expression operand) {
    return unary(op, operand, null);
  }

  public static Operation unary(String op, Expression operand,
                                SourceSpan source) {
    return new Operation(op, new ArrayList<String>(),
                         Arrays.asList(operand), false, source);
  }

  /**
   * @return same operation marked as enclosed in parentheses
   */
  public Operation parenthesize() {
    return new Operation(unaryOp, ops, operands, true, getSource());
  }

  public static String normalize(String op) {
    String o = op.trim().toLowerCase();
    if (o.equals(".lt.")) {
      return "<";
    } else if (o.equals(".le.")) {
      return "<=";
    } else if (o.equals(".gt.")) {
      return ">";
    } else if (o.equals(".ge.")) {
      return ">=";
    } else if (o.equals(".eq.")) {
      return "==";
    } else if (o.equals(".ne.")) {
      return "/=";
    }
    return o;
  }

  /**
   * @return prefix operator, or null
   */
  public String getUnaryOp() {
    return unaryOp;
  }

  public List<String> getOps() {
    return ops;
  }

  public List<Expression> getOperands() {
    return operands;
  }

  public boolean isParenthesized() {
    return parenthesized;
  }

  @Override
  public ExprKind kind() {
    return ExprKind.OPERATION;
  }

  @Override
  public List<Expression> children() {
    return operands;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Operation)) {
      return false;
    }
    Operation other = (Operation)obj;
    return Objects.equal(unaryOp, other.unaryOp) &&
           ops.equals(other.ops) && operands.equals(other.operands) &&
           parenthesized == other.parenthesized;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(unaryOp, ops, operands, parenthesized);
  }
}
