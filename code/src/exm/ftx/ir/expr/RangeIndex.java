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
import java.util.List;

import com.google.common.base.Objects;

import exm.ftx.ast.SourceSpan;

/**
 * Array section subscript <code>lower:upper:step</code>.  Any part may be
 * absent; with all three absent this is the bare <code>:</code>.
 */
public class RangeIndex extends Expression {

  private final Expression lower;
  private final Expression upper;
  private final Expression step;

  public RangeIndex(Expression lower, Expression upper, Expression step,
                    SourceSpan source) {
    super(source);
    this.lower = lower;
    this.upper = upper;
    this.step = step;
  }

  public RangeIndex(Expression lower, Expression upper) {
    this(lower, upper, null, null);
  }

  /**
   * @return a bare <code>:</code>
   */
  public static RangeIndex full() {
    return new RangeIndex(null, null, null, null);
  }

  public Expression getLower() {
    return lower;
  }

  public Expression getUpper() {
    return upper;
  }

  public Expression getStep() {
    return step;
  }

  @Override
  public ExprKind kind() {
    return ExprKind.RANGE_INDEX;
  }

  @Override
  public List<Expression> children() {
    List<Expression> result = new ArrayList<Expression>(3);
    if (lower != null)
      result.add(lower);
    if (upper != null)
      result.add(upper);
    if (step != null)
      result.add(step);
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof RangeIndex)) {
      return false;
    }
    RangeIndex other = (RangeIndex)obj;
    return Objects.equal(lower, other.lower) &&
           Objects.equal(upper, other.upper) &&
           Objects.equal(step, other.step);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(lower, upper, step);
  }
}
