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
import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.ftx.ast.SourceSpan;
import exm.ftx.common.exceptions.FTXRuntimeError;
import exm.ftx.common.util.StringUtil;
import exm.ftx.expr.ExprStringifier;
import exm.ftx.ir.expr.Expression;

public class Conditionals {

  private static List<List<Statement>> copyBodies(
                                List<? extends List<Statement>> bodies) {
    List<List<Statement>> result = new ArrayList<List<Statement>>();
    for (List<Statement> body: bodies) {
      result.add(ImmutableList.copyOf(body));
    }
    return Collections.unmodifiableList(result);
  }

  /**
   * IF / ELSE IF / ELSE.  Conditions and bodies correspond positionally.
   * The inline form is the single-line <code>IF (c) stmt</code>.
   */
  public static class Conditional extends Statement {
    private final ImmutableList<Expression> conditions;
    private final List<List<Statement>> bodies;
    private final ImmutableList<Statement> elseBody;
    private final boolean inline;

    public Conditional(List<Expression> conditions,
                       List<? extends List<Statement>> bodies,
                       List<Statement> elseBody, boolean inline,
                       SourceSpan source) {
      super(source);
      if (conditions.size() != bodies.size()) {
        throw new FTXRuntimeError("Conditional with " + conditions.size()
            + " conditions and " + bodies.size() + " bodies");
      }
      this.conditions = ImmutableList.copyOf(conditions);
      this.bodies = copyBodies(bodies);
      this.elseBody = ImmutableList.copyOf(elseBody);
      this.inline = inline;
    }

    public List<Expression> getConditions() {
      return conditions;
    }

    public List<List<Statement>> getConditionBodies() {
      return bodies;
    }

    /**
     * @return else branch, empty if none
     */
    public List<Statement> getElseBody() {
      return elseBody;
    }

    public boolean isInline() {
      return inline;
    }

    @Override
    public StatementKind kind() {
      return StatementKind.CONDITIONAL;
    }

    @Override
    public List<Expression> expressions() {
      return conditions;
    }

    @Override
    public List<List<Statement>> getBodies() {
      List<List<Statement>> result = new ArrayList<List<Statement>>(bodies);
      result.add(elseBody);
      return result;
    }

    @Override
    public void appendTo(StringBuilder sb, int indent) {
      if (inline && conditions.size() == 1 && bodies.get(0).size() == 1 &&
          elseBody.isEmpty()) {
        String stmt = bodies.get(0).get(0).stringify().trim();
        line(sb, indent, "IF (" + conditions.get(0).stringify() + ") " +
                         stmt);
        return;
      }
      int inner = indent + indentWidth();
      for (int i = 0; i < conditions.size(); i++) {
        String cond = conditions.get(i).stringify();
        line(sb, indent, (i == 0 ? "IF (" : "ELSE IF (") + cond + ") THEN");
        appendBody(sb, bodies.get(i), inner);
      }
      if (!elseBody.isEmpty()) {
        line(sb, indent, "ELSE");
        appendBody(sb, elseBody, inner);
      }
      line(sb, indent, "END IF");
    }
  }

  /**
   * SELECT CASE.  Each case has a list of values, which may be ranges;
   * CASE DEFAULT is held separately.
   */
  public static class MultiConditional extends Statement {
    private final Expression selector;
    private final List<List<Expression>> values;
    private final List<List<Statement>> bodies;
    private final ImmutableList<Statement> elseBody;

    public MultiConditional(Expression selector,
                            List<? extends List<Expression>> values,
                            List<? extends List<Statement>> bodies,
                            List<Statement> elseBody, SourceSpan source) {
      super(source);
      if (values.size() != bodies.size()) {
        throw new FTXRuntimeError("SELECT CASE with " + values.size()
            + " case values and " + bodies.size() + " bodies");
      }
      this.selector = selector;
      List<List<Expression>> vals = new ArrayList<List<Expression>>();
      for (List<Expression> v: values) {
        vals.add(ImmutableList.copyOf(v));
      }
      this.values = Collections.unmodifiableList(vals);
      this.bodies = copyBodies(bodies);
      this.elseBody = ImmutableList.copyOf(elseBody);
    }

    public Expression getSelector() {
      return selector;
    }

    public List<List<Expression>> getValues() {
      return values;
    }

    public List<List<Statement>> getCaseBodies() {
      return bodies;
    }

    public List<Statement> getElseBody() {
      return elseBody;
    }

    @Override
    public StatementKind kind() {
      return StatementKind.MULTI_CONDITIONAL;
    }

    @Override
    public List<Expression> expressions() {
      List<Expression> result = new ArrayList<Expression>();
      result.add(selector);
      for (List<Expression> v: values) {
        result.addAll(v);
      }
      return result;
    }

    @Override
    public List<List<Statement>> getBodies() {
      List<List<Statement>> result = new ArrayList<List<Statement>>(bodies);
      result.add(elseBody);
      return result;
    }

    @Override
    public void appendTo(StringBuilder sb, int indent) {
      int caseIndent = indent + indentWidth();
      int bodyIndent = caseIndent + indentWidth();
      line(sb, indent, "SELECT CASE (" + selector.stringify() + ")");
      for (int i = 0; i < values.size(); i++) {
        String vals = StringUtil.concat(", ",
                              ExprStringifier.stringifyAll(values.get(i)));
        line(sb, caseIndent, "CASE (" + vals + ")");
        appendBody(sb, bodies.get(i), bodyIndent);
      }
      if (!elseBody.isEmpty()) {
        line(sb, caseIndent, "CASE DEFAULT");
        appendBody(sb, elseBody, bodyIndent);
      }
      line(sb, indent, "END SELECT");
    }
  }

  /**
   * WHERE construct: masked assignments, with the ELSEWHERE branch as
   * the default body (empty if there is none).
   */
  public static class MaskedStatement extends Statement {
    private final Expression condition;
    private final ImmutableList<Statement> body;
    private final ImmutableList<Statement> defaultBody;

    public MaskedStatement(Expression condition, List<Statement> body,
                           List<Statement> defaultBody, SourceSpan source) {
      super(source);
      this.condition = condition;
      this.body = ImmutableList.copyOf(body);
      this.defaultBody = ImmutableList.copyOf(defaultBody);
    }

    public Expression getCondition() {
      return condition;
    }

    public List<Statement> getBody() {
      return body;
    }

    public List<Statement> getDefault() {
      return defaultBody;
    }

    @Override
    public StatementKind kind() {
      return StatementKind.MASKED_STATEMENT;
    }

    @Override
    public List<Expression> expressions() {
      return Collections.singletonList(condition);
    }

    @Override
    public List<List<Statement>> getBodies() {
      List<List<Statement>> result = new ArrayList<List<Statement>>(2);
      result.add(body);
      result.add(defaultBody);
      return result;
    }

    @Override
    public void appendTo(StringBuilder sb, int indent) {
      int inner = indent + indentWidth();
      line(sb, indent, "WHERE (" + condition.stringify() + ")");
      appendBody(sb, body, inner);
      if (!defaultBody.isEmpty()) {
        line(sb, indent, "ELSEWHERE");
        appendBody(sb, defaultBody, inner);
      }
      line(sb, indent, "END WHERE");
    }
  }
}
