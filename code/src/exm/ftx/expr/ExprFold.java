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
import java.util.List;

import com.google.common.base.Function;

import exm.ftx.ir.expr.Expression;
import exm.ftx.ir.expr.VariableRef;

/**
 * Generic bottom-up fold.  Literals and variable references are leaves
 * and are passed to the leaf function; every other node combines the
 * results of its structural children, left to right.
 *
 * @param <T> result type
 */
public class ExprFold<T> extends ExprMapper<T> {

  private final Function<? super Expression, T> leaf;
  private final Function<List<T>, T> combine;

  public ExprFold(Function<? super Expression, T> leaf,
                  Function<List<T>, T> combine) {
    this.leaf = leaf;
    this.combine = combine;
  }

  public static <T> T fold(Expression e, Function<? super Expression, T> leaf,
                           Function<List<T>, T> combine) {
    return new ExprFold<T>(leaf, combine).map(e);
  }

  @Override
  protected T mapLiteral(Expression e) {
    return leaf.apply(e);
  }

  @Override
  protected T mapVariable(VariableRef e) {
    return leaf.apply(e);
  }

  @Override
  protected T mapDefault(Expression e) {
    List<Expression> children = e.children();
    List<T> results = new ArrayList<T>(children.size());
    for (Expression child: children) {
      results.add(map(child));
    }
    return combine.apply(results);
  }
}
