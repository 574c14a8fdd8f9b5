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

/**
 * Array constructor <code>[e1, e2, ...]</code>
 */
public class LiteralList extends Expression {

  private final ImmutableList<Expression> elements;

  public LiteralList(List<Expression> elements, SourceSpan source) {
    super(source);
    this.elements = ImmutableList.copyOf(elements);
  }

  public List<Expression> getElements() {
    return elements;
  }

  @Override
  public ExprKind kind() {
    return ExprKind.LITERAL_LIST;
  }

  @Override
  public List<Expression> children() {
    return elements;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof LiteralList)) {
      return false;
    }
    return elements.equals(((LiteralList)obj).elements);
  }

  @Override
  public int hashCode() {
    return elements.hashCode();
  }
}
