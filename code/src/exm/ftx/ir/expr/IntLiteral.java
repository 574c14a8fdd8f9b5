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
 * Integer literal.  The source text is kept so that the literal prints as
 * written (<code>007</code>); equality is by value and kind.
 */
public class IntLiteral extends Expression {

  private final long value;
  /** digits as written, without kind suffix */
  private final String text;
  private final String kindParam;

  public IntLiteral(long value, String text, String kindParam,
                    SourceSpan source) {
    super(source);
    this.value = value;
    this.text = text != null ? text : Long.toString(value);
    this.kindParam = kindParam;
  }

  public IntLiteral(long value, String kindParam, SourceSpan source) {
    this(value, null, kindParam, source);
  }

  public IntLiteral(long value) {
    this(value, null, null, null);
  }

  public long getValue() {
    return value;
  }

  public String getText() {
    return text;
  }

  public String getKindParam() {
    return kindParam;
  }

  @Override
  public ExprKind kind() {
    return ExprKind.INT_LITERAL;
  }

  @Override
  public List<Expression> children() {
    return Collections.emptyList();
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof IntLiteral)) {
      return false;
    }
    IntLiteral other = (IntLiteral)obj;
    return value == other.value &&
           Objects.equal(kindParam, other.kindParam);
  }

  @Override
  public int hashCode() {
    return 31 * (int)(value ^ (value >>> 32)) + Objects.hashCode(kindParam);
  }
}
