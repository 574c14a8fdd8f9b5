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

import exm.ftx.ast.SourceSpan;
import exm.ftx.ir.expr.Expression;

/**
 * Base of statement and control-flow nodes.  Statements own the
 * expressions returned by {@link #expressions()} and the nested bodies
 * returned by {@link #getBodies()}.
 */
public abstract class Statement extends IRNode {

  public static enum StatementKind {
    LOOP,
    WHILE_LOOP,
    CONDITIONAL,
    MULTI_CONDITIONAL,
    ASSIGNMENT,
    CALL,
    DECLARATION,
    TYPE_DEF,
    IMPORT,
    ALLOCATION,
    DEALLOCATION,
    NULLIFY,
    MASKED_STATEMENT,
    DATA_DECLARATION,
    PRAGMA,
    COMMENT,
    INTRINSIC,
    SECTION,
    SCOPE,
  }

  protected Statement(SourceSpan source) {
    super(source);
  }

  public abstract StatementKind kind();

  /**
   * @return expressions directly owned by this statement, in the order
   *         they appear in the source
   */
  public abstract List<Expression> expressions();

  /**
   * @return nested statement bodies, in source order
   */
  public List<List<Statement>> getBodies() {
    return Collections.emptyList();
  }

  /**
   * @return all statements in nested bodies, in source order
   */
  public List<Statement> childStatements() {
    List<Statement> result = new ArrayList<Statement>();
    for (List<Statement> body: getBodies()) {
      result.addAll(body);
    }
    return result;
  }

  @Override
  public List<IRNode> children() {
    List<IRNode> result = new ArrayList<IRNode>();
    result.addAll(expressions());
    result.addAll(childStatements());
    return result;
  }

  protected static void appendBody(StringBuilder sb, List<Statement> body,
                                   int indent) {
    for (Statement stmt: body) {
      stmt.appendTo(sb, indent);
    }
  }

  /**
   * Append one line of output at the given indentation
   */
  protected static void line(StringBuilder sb, int indent, String text) {
    indent(sb, indent);
    sb.append(text);
    sb.append('\n');
  }
}
