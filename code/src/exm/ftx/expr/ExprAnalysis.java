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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.google.common.base.Function;

import exm.ftx.ir.expr.Cast;
import exm.ftx.ir.expr.Expression;
import exm.ftx.ir.expr.Expression.ExprKind;
import exm.ftx.ir.expr.FloatLiteral;
import exm.ftx.ir.expr.IntLiteral;
import exm.ftx.ir.expr.VariableRef;

/**
 * Queries over expressions built on {@link ExprFold}.
 */
public class ExprAnalysis {

  private static final Function<List<Boolean>, Boolean> ANY =
                              new Function<List<Boolean>, Boolean>() {
    @Override
    public Boolean apply(List<Boolean> input) {
      for (Boolean b: input) {
        if (b) {
          return true;
        }
      }
      return false;
    }
  };

  private static final Function<List<Integer>, Integer> SUM_PLUS_ONE =
                              new Function<List<Integer>, Integer>() {
    @Override
    public Integer apply(List<Integer> input) {
      int total = 1;
      for (Integer i: input) {
        total += i;
      }
      return total;
    }
  };

  /**
   * True if the expression refers to the named variable anywhere,
   * including qualifiers of derived type members and array subscripts.
   * Comparison is case-insensitive.
   */
  public static boolean referencesVariable(Expression e, final String name) {
    Function<Expression, Boolean> leaf =
                        new Function<Expression, Boolean>() {
      @Override
      public Boolean apply(Expression input) {
        if (!input.isVariable()) {
          return false;
        }
        VariableRef ref = (VariableRef)input;
        if (ref.getName().equalsIgnoreCase(name)) {
          return true;
        }
        for (Expression child: ref.children()) {
          if (referencesVariable(child, name)) {
            return true;
          }
        }
        return ref.getParent() != null &&
               referencesVariable(ref.getParent(), name);
      }
    };
    return ExprFold.fold(e, leaf, ANY);
  }

  private static final Function<List<List<String>>, List<String>> CONCAT =
                  new Function<List<List<String>>, List<String>>() {
    @Override
    public List<String> apply(List<List<String>> input) {
      List<String> result = new ArrayList<String>();
      for (List<String> l: input) {
        result.addAll(l);
      }
      return result;
    }
  };

  /**
   * Kind parameters of all literals and casts, in order of appearance,
   * without duplicates
   */
  public static Set<String> kindParameters(Expression e) {
    Function<Expression, List<String>> leaf =
                        new Function<Expression, List<String>>() {
      @Override
      public List<String> apply(Expression input) {
        List<String> result = new ArrayList<String>();
        if (input.kind() == ExprKind.INT_LITERAL) {
          addIfSet(result, ((IntLiteral)input).getKindParam());
        } else if (input.kind() == ExprKind.FLOAT_LITERAL) {
          addIfSet(result, ((FloatLiteral)input).getKindParam());
        } else if (input.isVariable()) {
          VariableRef ref = (VariableRef)input;
          if (ref.getParent() != null) {
            result.addAll(kindParameters(ref.getParent()));
          }
          for (Expression child: ref.children()) {
            result.addAll(kindParameters(child));
          }
        }
        return result;
      }
    };
    ExprFold<List<String>> fold = new ExprFold<List<String>>(leaf, CONCAT) {
      @Override
      protected List<String> mapCast(Cast c) {
        List<String> result = new ArrayList<String>();
        addIfSet(result, c.getKindParam());
        result.addAll(super.mapCast(c));
        return result;
      }
    };
    return new LinkedHashSet<String>(fold.map(e));
  }

  private static void addIfSet(List<String> list, String kind) {
    if (kind != null) {
      list.add(kind);
    }
  }

  /**
   * Number of nodes in the expression tree, not counting qualifiers
   */
  public static int countNodes(Expression e) {
    Function<Expression, Integer> leaf = new Function<Expression, Integer>() {
      @Override
      public Integer apply(Expression input) {
        int total = 1;
        for (Expression child: input.children()) {
          total += countNodes(child);
        }
        return total;
      }
    };
    return ExprFold.fold(e, leaf, SUM_PLUS_ONE);
  }
}
