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

import exm.ftx.ast.SourceSpan;
import exm.ftx.expr.ExprStringifier;
import exm.ftx.ir.IRNode;

/**
 * Base class of expression nodes.  Each subclass is one variant, identified
 * by {@link #kind()}, which is what the expression mappers switch on.
 *
 * Equality is structural and ignores source spans and type annotations;
 * names compare case-insensitively.
 */
public abstract class Expression extends IRNode {

  public static enum ExprKind {
    SCALAR,
    ARRAY,
    INT_LITERAL,
    FLOAT_LITERAL,
    LOGIC_LITERAL,
    STRING_LITERAL,
    RANGE_INDEX,
    OPERATION,
    INLINE_CALL,
    CAST,
    LITERAL_LIST,
    STRING_CONCAT,
  }

  protected Expression(SourceSpan source) {
    super(source);
  }

  public abstract ExprKind kind();

  @Override
  public abstract List<Expression> children();

  public boolean isLiteral() {
    switch (kind()) {
      case INT_LITERAL:
      case FLOAT_LITERAL:
      case LOGIC_LITERAL:
      case STRING_LITERAL:
        return true;
      default:
        return false;
    }
  }

  public boolean isVariable() {
    return kind() == ExprKind.SCALAR || kind() == ExprKind.ARRAY;
  }

  @Override
  public void appendTo(StringBuilder sb, int indent) {
    sb.append(ExprStringifier.stringify(this));
  }

  @Override
  public abstract boolean equals(Object obj);

  @Override
  public abstract int hashCode();
}
