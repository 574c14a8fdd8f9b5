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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import com.google.common.collect.ImmutableList;

import exm.ftx.ast.SourceSpan;
import exm.ftx.common.util.StringUtil;
import exm.ftx.expr.ExprStringifier;
import exm.ftx.ir.expr.Expression;

/**
 * Simple statements, and the blocks that only group other statements
 */
public class Statements {

  public static class Assignment extends Statement {
    private final Expression target;
    private final Expression expr;
    private final boolean pointer;

    public Assignment(Expression target, Expression expr, boolean pointer,
                      SourceSpan source) {
      super(source);
      this.target = target;
      this.expr = expr;
      this.pointer = pointer;
    }

    public Expression getTarget() {
      return target;
    }

    public Expression getExpr() {
      return expr;
    }

    public boolean isPointer() {
      return pointer;
    }

    @Override
    public StatementKind kind() {
      return StatementKind.ASSIGNMENT;
    }

    @Override
    public List<Expression> expressions() {
      List<Expression> result = new ArrayList<Expression>(2);
      result.add(target);
      result.add(expr);
      return result;
    }

    @Override
    public void appendTo(StringBuilder sb, int indent) {
      line(sb, indent, target.stringify() + (pointer ? " => " : " = ") +
                       expr.stringify());
    }
  }

  public static class Call extends Statement {
    private final String name;
    private final ImmutableList<Expression> args;
    private final Map<String, Expression> kwargs;

    public Call(String name, List<Expression> args,
                Map<String, Expression> kwargs, SourceSpan source) {
      super(source);
      this.name = name;
      this.args = ImmutableList.copyOf(args);
      this.kwargs = Collections.unmodifiableMap(
                        new LinkedHashMap<String, Expression>(kwargs));
    }

    public String getName() {
      return name;
    }

    public List<Expression> getArgs() {
      return args;
    }

    public Map<String, Expression> getKwargs() {
      return kwargs;
    }

    @Override
    public StatementKind kind() {
      return StatementKind.CALL;
    }

    @Override
    public List<Expression> expressions() {
      List<Expression> result = new ArrayList<Expression>(args);
      result.addAll(kwargs.values());
      return result;
    }

    @Override
    public void appendTo(StringBuilder sb, int indent) {
      List<String> parts = ExprStringifier.stringifyAll(args);
      for (Entry<String, Expression> kw: kwargs.entrySet()) {
        parts.add(kw.getKey() + "=" + kw.getValue().stringify());
      }
      line(sb, indent, "CALL " + name + "(" +
                       StringUtil.concat(", ", parts) + ")");
    }
  }

  /**
   * ALLOCATE, DEALLOCATE or NULLIFY of a list of variables
   */
  public static class MemoryStatement extends Statement {
    private final StatementKind kind;
    private final ImmutableList<Expression> variables;

    public MemoryStatement(StatementKind kind, List<Expression> variables,
                           SourceSpan source) {
      super(source);
      assert(kind == StatementKind.ALLOCATION ||
             kind == StatementKind.DEALLOCATION ||
             kind == StatementKind.NULLIFY) : kind;
      this.kind = kind;
      this.variables = ImmutableList.copyOf(variables);
    }

    public static MemoryStatement allocation(List<Expression> variables,
                                             SourceSpan source) {
      return new MemoryStatement(StatementKind.ALLOCATION, variables, source);
    }

    public static MemoryStatement deallocation(List<Expression> variables,
                                               SourceSpan source) {
      return new MemoryStatement(StatementKind.DEALLOCATION, variables,
                                 source);
    }

    public static MemoryStatement nullify(List<Expression> variables,
                                          SourceSpan source) {
      return new MemoryStatement(StatementKind.NULLIFY, variables, source);
    }

    public List<Expression> getVariables() {
      return variables;
    }

    @Override
    public StatementKind kind() {
      return kind;
    }

    @Override
    public List<Expression> expressions() {
      return variables;
    }

    @Override
    public void appendTo(StringBuilder sb, int indent) {
      String keyword;
      switch (kind) {
        case ALLOCATION:
          keyword = "ALLOCATE";
          break;
        case DEALLOCATION:
          keyword = "DEALLOCATE";
          break;
        default:
          keyword = "NULLIFY";
          break;
      }
      line(sb, indent, keyword + "(" + StringUtil.concat(", ",
                ExprStringifier.stringifyAll(variables)) + ")");
    }
  }

  /**
   * Compiler directive in a comment, <code>!$keyword content</code>
   */
  public static class Pragma extends Statement {
    private final String keyword;
    private final String content;

    public Pragma(String keyword, String content, SourceSpan source) {
      super(source);
      this.keyword = keyword;
      this.content = content;
    }

    public String getKeyword() {
      return keyword;
    }

    public String getContent() {
      return content;
    }

    @Override
    public StatementKind kind() {
      return StatementKind.PRAGMA;
    }

    @Override
    public List<Expression> expressions() {
      return Collections.emptyList();
    }

    @Override
    public void appendTo(StringBuilder sb, int indent) {
      line(sb, indent, "!$" + keyword + (content.length() > 0 ?
                                         " " + content : ""));
    }
  }

  /**
   * Source text kept verbatim: comments, and statements that are not
   * modelled (I/O, SAVE, IMPLICIT, ...)
   */
  public static class Verbatim extends Statement {
    private final StatementKind kind;
    private final String text;

    public Verbatim(StatementKind kind, String text, SourceSpan source) {
      super(source);
      assert(kind == StatementKind.COMMENT ||
             kind == StatementKind.INTRINSIC) : kind;
      this.kind = kind;
      this.text = text;
    }

    public static Verbatim comment(String text, SourceSpan source) {
      return new Verbatim(StatementKind.COMMENT, text, source);
    }

    public static Verbatim intrinsic(String text, SourceSpan source) {
      return new Verbatim(StatementKind.INTRINSIC, text, source);
    }

    public String getText() {
      return text;
    }

    @Override
    public StatementKind kind() {
      return kind;
    }

    @Override
    public List<Expression> expressions() {
      return Collections.emptyList();
    }

    @Override
    public void appendTo(StringBuilder sb, int indent) {
      for (String l: StringUtil.trimNewlines(text).split("\n")) {
        line(sb, indent, l.trim());
      }
    }
  }

  /**
   * Sequence of statements, e.g. a specification part, or an ASSOCIATE
   * block when it binds names.  A section without associations prints
   * as just its body.
   */
  public static class Scope extends Statement {
    private final ImmutableList<Statement> body;
    /** Associate name to expression, in source order */
    private final Map<String, Expression> associations;

    public Scope(List<Statement> body, Map<String, Expression> associations,
                 SourceSpan source) {
      super(source);
      this.body = ImmutableList.copyOf(body);
      this.associations = associations == null ? null :
          Collections.unmodifiableMap(
                  new LinkedHashMap<String, Expression>(associations));
    }

    public static Scope section(List<Statement> body, SourceSpan source) {
      return new Scope(body, null, source);
    }

    public List<Statement> getBody() {
      return body;
    }

    /**
     * @return name bindings, or null for a plain section
     */
    public Map<String, Expression> getAssociations() {
      return associations;
    }

    @Override
    public StatementKind kind() {
      return associations == null ? StatementKind.SECTION :
                                    StatementKind.SCOPE;
    }

    @Override
    public List<Expression> expressions() {
      if (associations == null) {
        return Collections.emptyList();
      }
      return new ArrayList<Expression>(associations.values());
    }

    @Override
    public List<List<Statement>> getBodies() {
      return Collections.<List<Statement>>singletonList(body);
    }

    @Override
    public void appendTo(StringBuilder sb, int indent) {
      if (associations == null) {
        appendBody(sb, body, indent);
        return;
      }
      List<String> binds = new ArrayList<String>();
      for (Entry<String, Expression> a: associations.entrySet()) {
        binds.add(a.getKey() + "=>" + a.getValue().stringify());
      }
      line(sb, indent, "ASSOCIATE(" + StringUtil.concat(", ", binds) + ")");
      appendBody(sb, body, indent + indentWidth());
      line(sb, indent, "END ASSOCIATE");
    }
  }
}
