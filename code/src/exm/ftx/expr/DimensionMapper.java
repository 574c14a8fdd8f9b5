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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import exm.ftx.common.lang.Intrinsics;
import exm.ftx.ir.expr.ArrayRef;
import exm.ftx.ir.expr.Cast;
import exm.ftx.ir.expr.Expression;
import exm.ftx.ir.expr.Expression.ExprKind;
import exm.ftx.ir.expr.InlineCall;
import exm.ftx.ir.expr.IntLiteral;
import exm.ftx.ir.expr.LiteralList;
import exm.ftx.ir.expr.Operation;
import exm.ftx.ir.expr.RangeIndex;
import exm.ftx.ir.expr.VariableRef;

/**
 * Infer the shape of an expression as a list of extents.  Scalars have
 * shape <code>(1)</code>; indexed array references drop singleton
 * dimensions, so a fully indexed element has the empty shape.
 *
 * The result is null when the shape depends on a declaration that was
 * not available.
 */
public class DimensionMapper extends ExprMapper<List<Expression>> {

  private static final DimensionMapper INSTANCE = new DimensionMapper();

  private static final IntLiteral ONE = new IntLiteral(1);

  public static List<Expression> shapeOf(Expression e) {
    return INSTANCE.map(e);
  }

  private static List<Expression> scalarShape() {
    return Collections.<Expression>singletonList(ONE);
  }

  /**
   * True for shapes of scalar expressions: empty or all-singleton
   */
  public static boolean isScalar(List<Expression> shape) {
    if (shape == null) {
      return false;
    }
    for (Expression e: shape) {
      if (!ONE.equals(e)) {
        return false;
      }
    }
    return true;
  }

  @Override
  protected List<Expression> mapLiteral(Expression e) {
    return scalarShape();
  }

  @Override
  protected List<Expression> mapVariable(VariableRef e) {
    return scalarShape();
  }

  @Override
  protected List<Expression> mapArray(ArrayRef e) {
    if (!e.hasDimensions()) {
      return e.getShape();
    }
    List<Expression> shape = e.getShape();
    List<Expression> dims = new ArrayList<Expression>();
    List<Expression> indices = e.getDimensions();
    for (int pos = 0; pos < indices.size(); pos++) {
      Expression index = indices.get(pos);
      if (index.kind() == ExprKind.RANGE_INDEX &&
          ((RangeIndex)index).getLower() == null &&
          ((RangeIndex)index).getUpper() == null) {
        // Bare : or ::s covers the declared extent
        Expression step = ((RangeIndex)index).getStep();
        if (shape == null || pos >= shape.size()) {
          dims.add(index);
        } else if (step == null) {
          dims.add(shape.get(pos));
        } else {
          dims.add(extent(new RangeIndex(null, shape.get(pos), step,
                                         index.getSource())));
        }
      } else {
        List<Expression> sub = map(index);
        if (sub == null) {
          dims.add(index);
        } else {
          dims.addAll(sub);
        }
      }
    }
    List<Expression> result = new ArrayList<Expression>(dims.size());
    for (Expression d: dims) {
      if (!ONE.equals(d)) {
        result.add(d);
      }
    }
    return result;
  }

  @Override
  protected List<Expression> mapRangeIndex(RangeIndex e) {
    return Collections.singletonList(extent(e));
  }

  /**
   * Number of elements of a section subscript,
   * <code>(upper - lower + step) / step</code>, with lower and step
   * defaulting to 1.  Literal bounds are evaluated; otherwise the extent
   * is built as an expression.  A subscript without upper bound has no
   * known extent and is returned unchanged.
   */
  public static Expression extent(RangeIndex e) {
    if (e.getUpper() == null) {
      return e;
    }
    Expression lower = e.getLower() == null ? ONE : e.getLower();
    Expression step = e.getStep() == null ? ONE : e.getStep();
    Expression upper = e.getUpper();
    if (upper.kind() == ExprKind.INT_LITERAL &&
        lower.kind() == ExprKind.INT_LITERAL &&
        step.kind() == ExprKind.INT_LITERAL) {
      long u = ((IntLiteral)upper).getValue();
      long l = ((IntLiteral)lower).getValue();
      long s = ((IntLiteral)step).getValue();
      if (s != 0) {
        long n = Math.floorDiv(u - l + s, s);
        return new IntLiteral(Math.max(0, n));
      }
    }
    if (ONE.equals(step)) {
      if (ONE.equals(lower)) {
        return upper;
      }
      return new Operation(null, Arrays.asList("-", "+"),
                           Arrays.asList(upper, lower, ONE), false, null);
    }
    Operation span = new Operation(null, Arrays.asList("-", "+"),
                         Arrays.asList(upper, lower, step), true, null);
    return new Operation(null, Arrays.asList("/"),
                         Arrays.<Expression>asList(span, step), false, null);
  }

  @Override
  protected List<Expression> mapOperation(Operation e) {
    return elementalShape(e.getOperands());
  }

  /**
   * Shape of the first non-scalar operand
   */
  private List<Expression> elementalShape(List<Expression> operands) {
    boolean unknown = false;
    for (Expression operand: operands) {
      List<Expression> s = map(operand);
      if (s == null) {
        unknown = true;
      } else if (!isScalar(s)) {
        return s;
      }
    }
    return unknown ? null : scalarShape();
  }

  @Override
  protected List<Expression> mapInlineCall(InlineCall e) {
    if (Intrinsics.isElemental(e.getName())) {
      return elementalShape(e.getArgs());
    }
    return scalarShape();
  }

  @Override
  protected List<Expression> mapCast(Cast e) {
    return map(e.getArgument());
  }

  @Override
  protected List<Expression> mapLiteralList(LiteralList e) {
    return Collections.<Expression>singletonList(
                        new IntLiteral(e.getElements().size()));
  }

  @Override
  protected List<Expression> mapDefault(Expression e) {
    return scalarShape();
  }
}
