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

import java.util.Collections;
import java.util.List;

import com.google.common.base.Objects;

import exm.ftx.ast.SourceSpan;

/**
 * Type conversion intrinsic such as <code>REAL(x, KIND=JPRB)</code>
 */
public class Cast extends Expression {

  private final String function;
  private final Expression argument;
  private final String kindParam;

  public Cast(String function, Expression argument, String kindParam,
              SourceSpan source) {
    super(source);
    assert(function != null && argument != null);
    this.function = function;
    this.argument = argument;
    this.kindParam = kindParam;
  }

  public String getFunction() {
    return function;
  }

  public Expression getArgument() {
    return argument;
  }

  public String getKindParam() {
    return kindParam;
  }

  @Override
  public ExprKind kind() {
    return ExprKind.CAST;
  }

  @Override
  public List<Expression> children() {
    return Collections.singletonList(argument);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Cast)) {
      return false;
    }
    Cast other = (Cast)obj;
    return function.equalsIgnoreCase(other.function) &&
           argument.equals(other.argument) &&
           Objects.equal(kindParam, other.kindParam);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(function.toLowerCase(), argument, kindParam);
  }
}
