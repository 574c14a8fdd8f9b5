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

import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.ftx.ast.SourceSpan;

public class StringConcat extends Expression {

  private final ImmutableList<Expression> parts;

  public StringConcat(List<Expression> parts, SourceSpan source) {
    super(source);
    this.parts = ImmutableList.copyOf(parts);
  }

  public List<Expression> getParts() {
    return parts;
  }

  @Override
  public ExprKind kind() {
    return ExprKind.STRING_CONCAT;
  }

  @Override
  public List<Expression> children() {
    return parts;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof StringConcat)) {
      return false;
    }
    return parts.equals(((StringConcat)obj).parts);
  }

  @Override
  public int hashCode() {
    return 17 + parts.hashCode();
  }
}
