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
package exm.ftx.ir;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.ftx.ast.SourceSpan;
import exm.ftx.ir.expr.Expression;
import exm.ftx.ir.expr.RangeIndex;
import exm.ftx.ir.expr.ScalarRef;

public class Loops {

  /**
   * Counted loop <code>DO var = lower, upper[, step]</code>
   */
  public static class Loop extends Statement {
    private final ScalarRef variable;
    private final RangeIndex bounds;
    private final ImmutableList<Statement> body;

    public Loop(ScalarRef variable, RangeIndex bounds, List<Statement> body,
                SourceSpan source) {
      super(source);
      assert(variable != null && bounds != null);
      this.variable = variable;
      this.bounds = bounds;
      this.body = ImmutableList.copyOf(body);
    }

    public ScalarRef getVariable() {
      return variable;
    }

    public RangeIndex getBounds() {
      return bounds;
    }

    public List<Statement> getBody() {
      return body;
    }

    @Override
    public StatementKind kind() {
      return StatementKind.LOOP;
    }

    @Override
    public List<Expression> expressions() {
      return Arrays.<Expression>asList(variable, bounds);
    }

    @Override
    public List<List<Statement>> getBodies() {
      return Collections.<List<Statement>>singletonList(body);
    }

    @Override
    public void appendTo(StringBuilder sb, int indent) {
      List<Expression> parts = new ArrayList<Expression>();
      parts.add(bounds.getLower());
      parts.add(bounds.getUpper());
      if (bounds.getStep() != null) {
        parts.add(bounds.getStep());
      }
      StringBuilder header = new StringBuilder("DO ");
      header.append(variable.getName()).append('=');
      for (int i = 0; i < parts.size(); i++) {
        if (i > 0) {
          header.append(", ");
        }
        header.append(parts.get(i).stringify());
      }
      line(sb, indent, header.toString());
      appendBody(sb, body, indent + indentWidth());
      line(sb, indent, "END DO");
    }
  }

  /**
   * <code>DO WHILE (condition)</code>, or an unbounded <code>DO</code>
   * if there is no condition
   */
  public static class WhileLoop extends Statement {
    private final Expression condition;
    private final ImmutableList<Statement> body;

    public WhileLoop(Expression condition, List<Statement> body,
                     SourceSpan source) {
      super(source);
      this.condition = condition;
      this.body = ImmutableList.copyOf(body);
    }

    /**
     * @return loop condition, or null for an unbounded loop
     */
    public Expression getCondition() {
      return condition;
    }

    public List<Statement> getBody() {
      return body;
    }

    @Override
    public StatementKind kind() {
      return StatementKind.WHILE_LOOP;
    }

    @Override
    public List<Expression> expressions() {
      if (condition == null) {
        return Collections.emptyList();
      }
      return Collections.singletonList(condition);
    }

    @Override
    public List<List<Statement>> getBodies() {
      return Collections.<List<Statement>>singletonList(body);
    }

    @Override
    public void appendTo(StringBuilder sb, int indent) {
      if (condition == null) {
        line(sb, indent, "DO");
      } else {
        line(sb, indent, "DO WHILE (" + condition.stringify() + ")");
      }
      appendBody(sb, body, indent + indentWidth());
      line(sb, indent, "END DO");
    }
  }
}
