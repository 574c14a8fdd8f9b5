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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import org.apache.log4j.Logger;

import exm.ftx.ir.Conditionals.Conditional;
import exm.ftx.ir.Conditionals.MaskedStatement;
import exm.ftx.ir.Conditionals.MultiConditional;
import exm.ftx.ir.Declarations.Declaration;
import exm.ftx.ir.Loops.Loop;
import exm.ftx.ir.Loops.WhileLoop;
import exm.ftx.ir.Statement;
import exm.ftx.ir.Statements.Assignment;
import exm.ftx.ir.Statements.Call;

public class IRWalk {

  /**
   * Walk pre-order
   * @param logger
   * @param body
   * @param walker
   * @param recursive if false, don't visit nested bodies
   */
  public static void walk(Logger logger, List<Statement> body,
                          IRWalker walker, boolean recursive) {
    for (Statement stmt: body) {
      walker.visit(logger, stmt);
      if (recursive) {
        for (List<Statement> b: stmt.getBodies()) {
          walk(logger, b, walker, recursive);
        }
      }
    }
  }

  public static void walk(Logger logger, List<Statement> body,
                          IRWalker walker) {
    walk(logger, body, walker, true);
  }

  /**
   * Visit the statements nested inside loops of the body, innermost loop
   * bodies last, without visiting the loops' siblings.
   */
  public static void walkLoopBodies(Logger logger, List<Statement> body,
                                    IRWalker walker) {
    Deque<Statement> stack = new ArrayDeque<Statement>();
    for (Statement s: body) {
      if (isLoop(s)) {
        stack.push(s);
      }
    }
    while (!stack.isEmpty()) {
      Statement loop = stack.pop();
      for (Statement s: loop.childStatements()) {
        walker.visit(logger, s);
        if (isLoop(s)) {
          stack.push(s);
        }
      }
    }
  }

  private static boolean isLoop(Statement s) {
    return s.kind() == Statement.StatementKind.LOOP ||
           s.kind() == Statement.StatementKind.WHILE_LOOP;
  }

  public static abstract class IRWalker {
    public void visit(Logger logger, Statement stmt) {
      switch (stmt.kind()) {
        case LOOP:
          visit((Loop)stmt);
          break;
        case WHILE_LOOP:
          visit((WhileLoop)stmt);
          break;
        case CONDITIONAL:
          visit((Conditional)stmt);
          break;
        case MULTI_CONDITIONAL:
          visit((MultiConditional)stmt);
          break;
        case MASKED_STATEMENT:
          visit((MaskedStatement)stmt);
          break;
        case ASSIGNMENT:
          visit((Assignment)stmt);
          break;
        case CALL:
          visit((Call)stmt);
          break;
        case DECLARATION:
          visit((Declaration)stmt);
          break;
        default:
          visitOther(stmt);
          break;
      }
    }

    protected void visit(Loop loop) {
      visitOther(loop);
    }

    protected void visit(WhileLoop loop) {
      visitOther(loop);
    }

    protected void visit(Conditional cond) {
      visitOther(cond);
    }

    protected void visit(MultiConditional cond) {
      visitOther(cond);
    }

    protected void visit(MaskedStatement masked) {
      visitOther(masked);
    }

    protected void visit(Assignment assign) {
      visitOther(assign);
    }

    protected void visit(Call call) {
      visitOther(call);
    }

    protected void visit(Declaration decl) {
      visitOther(decl);
    }

    /**
     * Statements without a more specific hook
     */
    protected void visitOther(Statement stmt) {
      // Nothing
    }
  }
}
