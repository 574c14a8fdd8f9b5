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
package exm.ftx.transform;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import com.google.common.base.Predicate;

import exm.ftx.common.Logging;
import exm.ftx.expr.ExprRetriever;
import exm.ftx.ir.Statement;
import exm.ftx.ir.expr.Expression;
import exm.ftx.ir.expr.VariableRef;
import exm.ftx.transform.IRWalk.IRWalker;

/**
 * Runs an expression query over every expression owned by a statement
 * tree.  Results follow statement order, then the order of each
 * statement's expressions.
 */
public class FindExpressions extends IRWalker {

  private static final Logger logger = Logging.getFTXLogger();

  private final ExprRetriever retriever;

  public FindExpressions(Predicate<? super Expression> query) {
    this.retriever = new ExprRetriever(query);
  }

  public static List<Expression> find(List<Statement> body,
                              Predicate<? super Expression> query) {
    FindExpressions finder = new FindExpressions(query);
    IRWalk.walk(logger, body, finder);
    return finder.getFound();
  }

  /**
   * All variable references in the tree
   */
  public static List<VariableRef> variables(List<Statement> body) {
    List<VariableRef> result = new ArrayList<VariableRef>();
    for (Expression e: find(body, ExprRetriever.VARIABLES)) {
      result.add((VariableRef)e);
    }
    return result;
  }

  @Override
  protected void visitOther(Statement stmt) {
    for (Expression e: stmt.expressions()) {
      retriever.map(e);
    }
  }

  public List<Expression> getFound() {
    return retriever.getFound();
  }
}
