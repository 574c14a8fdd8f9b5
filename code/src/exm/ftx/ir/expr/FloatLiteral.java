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
 * Real literal, kept as its source text so that no precision is lost
 * when it is printed back.
 */
public class FloatLiteral extends Expression {

  private final String value;
  private final String kindParam;

  public FloatLiteral(String value, String kindParam, SourceSpan source) {
    super(source);
    assert(value != null);
    this.value = value;
    this.kindParam = kindParam;
  }

  public FloatLiteral(String value) {
    this(value, null, null);
  }

  public String getValue() {
    return value;
  }

  public String getKindParam() {
    return kindParam;
  }

  @Override
  public ExprKind kind() {
    return ExprKind.FLOAT_LITERAL;
  }

  @Override
  public List<Expression> children() {
    return Collections.emptyList();
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof FloatLiteral)) {
      return false;
    }
    FloatLiteral other = (FloatLiteral)obj;
    return value.equalsIgnoreCase(other.value) &&
        (kindParam == null ? other.kindParam == null :
                             kindParam.equalsIgnoreCase(other.kindParam));
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(value.toLowerCase(),
                kindParam == null ? null : kindParam.toLowerCase());
  }
}
