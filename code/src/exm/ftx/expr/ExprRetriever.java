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
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import com.google.common.base.Predicate;

import exm.ftx.ir.expr.ArrayRef;
import exm.ftx.ir.expr.Expression;
import exm.ftx.ir.expr.Expression.ExprKind;
import exm.ftx.ir.expr.VariableRef;

/**
 * Collect the sub-expressions matching a predicate, in post-order: the
 * children of a node are searched before the node itself is tested.
 * References search their qualifier chain first, then their dimensions,
 * so <code>a(i) + b%c</code> yields <code>i, a(i), b, c</code> and the
 * operation last.
 */
public class ExprRetriever extends ExprMapper<Void> {

  /** Matches scalar and array references */
  public static final Predicate<Expression> VARIABLES =
                                          new Predicate<Expression>() {
    @Override
    public boolean apply(Expression e) {
      return e.isVariable();
    }
  };

  private final Predicate<? super Expression> query;
  private final List<Expression> found = new ArrayList<Expression>();

  public ExprRetriever(Predicate<? super Expression> query) {
    this.query = query;
  }

  public static List<Expression> retrieve(Expression root,
                                  Predicate<? super Expression> query) {
    ExprRetriever r = new ExprRetriever(query);
    r.map(root);
    return r.getFound();
  }

  public static Predicate<Expression> ofKind(ExprKind first,
                                             ExprKind ...rest) {
    final Set<ExprKind> kinds = EnumSet.of(first, rest);
    return new Predicate<Expression>() {
      @Override
      public boolean apply(Expression e) {
        return kinds.contains(e.kind());
      }
    };
  }

  /**
   * @return matches accumulated so far
   */
  public List<Expression> getFound() {
    return found;
  }

  private void test(Expression e) {
    if (query.apply(e)) {
      found.add(e);
    }
  }

  @Override
  protected Void mapVariable(VariableRef e) {
    if (e.getParent() != null) {
      map(e.getParent());
    }
    if (e.kind() == ExprKind.ARRAY && ((ArrayRef)e).hasDimensions()) {
      for (Expression dim: ((ArrayRef)e).getDimensions()) {
        map(dim);
      }
    }
    if (e.getInitial() != null) {
      map(e.getInitial());
    }
    test(e);
    return null;
  }

  @Override
  protected Void mapDefault(Expression e) {
    for (Expression child: e.children()) {
      map(child);
    }
    test(e);
    return null;
  }
}
