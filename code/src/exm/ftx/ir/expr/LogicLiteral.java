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

import exm.ftx.ast.SourceSpan;

public class LogicLiteral extends Expression {

  private final boolean value;

  public LogicLiteral(boolean value, SourceSpan source) {
    super(source);
    this.value = value;
  }

  public LogicLiteral(boolean value) {
    this(value, null);
  }

  public boolean getValue() {
    return value;
  }

  @Override
  public ExprKind kind() {
    return ExprKind.LOGIC_LITERAL;
  }

  @Override
  public List<Expression> children() {
    return Collections.emptyList();
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof LogicLiteral)) {
      return false;
    }
    return value == ((LogicLiteral)obj).value;
  }

  @Override
  public int hashCode() {
    return value ? 1231 : 1237;
  }
}
