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
import exm.ftx.common.util.StringUtil;
import exm.ftx.expr.ExprStringifier;
import exm.ftx.ir.expr.Expression;
import exm.ftx.ir.expr.VariableRef;

public class Declarations {

  /**
   * Type declaration of one or more variables sharing a type descriptor
   */
  public static class Declaration extends Statement {
    private final DataType type;
    private final ImmutableList<VariableRef> variables;
    /** Shared DIMENSION attribute, or null */
    private final ImmutableList<Expression> dimensions;

    public Declaration(DataType type, List<? extends VariableRef> variables,
                       List<Expression> dimensions, SourceSpan source) {
      super(source);
      assert(type != null);
      this.type = type;
      this.variables = ImmutableList.copyOf(variables);
      this.dimensions = dimensions == null ? null :
                                ImmutableList.copyOf(dimensions);
    }

    public DataType getType() {
      return type;
    }

    public List<VariableRef> getVariables() {
      return variables;
    }

    public List<Expression> getDimensions() {
      return dimensions;
    }

    @Override
    public StatementKind kind() {
      return StatementKind.DECLARATION;
    }

    @Override
    public List<Expression> expressions() {
      List<Expression> result = new ArrayList<Expression>();
      if (dimensions != null) {
        result.addAll(dimensions);
      }
      result.addAll(variables);
      return result;
    }

    @Override
    public void appendTo(StringBuilder sb, int indent) {
      StringBuilder decl = new StringBuilder();
      type.appendTo(decl);
      if (dimensions != null) {
        decl.append(", DIMENSION(");
        decl.append(StringUtil.concat(",",
                          ExprStringifier.stringifyAll(dimensions)));
        decl.append(')');
      }
      decl.append(" :: ");
      decl.append(StringUtil.concat(", ",
                          ExprStringifier.stringifyAll(variables)));
      line(sb, indent, decl.toString());
    }
  }

  /**
   * Derived type definition.  The body holds component declarations
   * together with any comments and pragmas between them.
   */
  public static class TypeDef extends Statement {
    private final String name;
    private final ImmutableList<Statement> body;

    public TypeDef(String name, List<Statement> body, SourceSpan source) {
      super(source);
      this.name = name;
      this.body = ImmutableList.copyOf(body);
    }

    public String getName() {
      return name;
    }

    public List<Statement> getBody() {
      return body;
    }

    public List<Declaration> getDeclarations() {
      List<Declaration> result = new ArrayList<Declaration>();
      for (Statement s: body) {
        if (s.kind() == StatementKind.DECLARATION) {
          result.add((Declaration)s);
        }
      }
      return result;
    }

    @Override
    public StatementKind kind() {
      return StatementKind.TYPE_DEF;
    }

    @Override
    public List<Expression> expressions() {
      return Collections.emptyList();
    }

    @Override
    public List<List<Statement>> getBodies() {
      return Collections.<List<Statement>>singletonList(body);
    }

    @Override
    public void appendTo(StringBuilder sb, int indent) {
      line(sb, indent, "TYPE " + name);
      appendBody(sb, body, indent + indentWidth());
      line(sb, indent, "END TYPE " + name);
    }
  }

  /**
   * <code>DATA var / v1, v2, ... /</code>
   */
  public static class DataDeclaration extends Statement {
    private final Expression variable;
    private final ImmutableList<Expression> values;

    public DataDeclaration(Expression variable, List<Expression> values,
                           SourceSpan source) {
      super(source);
      this.variable = variable;
      this.values = ImmutableList.copyOf(values);
    }

    public Expression getVariable() {
      return variable;
    }

    public List<Expression> getValues() {
      return values;
    }

    @Override
    public StatementKind kind() {
      return StatementKind.DATA_DECLARATION;
    }

    @Override
    public List<Expression> expressions() {
      List<Expression> result = new ArrayList<Expression>();
      result.add(variable);
      result.addAll(values);
      return result;
    }

    @Override
    public void appendTo(StringBuilder sb, int indent) {
      line(sb, indent, "DATA " + variable.stringify() + "/" +
           StringUtil.concat(", ", ExprStringifier.stringifyAll(values)) +
           "/");
    }
  }

  /**
   * Module import (<code>USE</code>), or a C preprocessor include
   */
  public static class Import extends Statement {
    private final String module;
    private final ImmutableList<String> symbols;
    private final boolean cImport;

    public Import(String module, List<String> symbols, boolean cImport,
                  SourceSpan source) {
      super(source);
      this.module = module;
      this.symbols = ImmutableList.copyOf(symbols);
      this.cImport = cImport;
    }

    public String getModule() {
      return module;
    }

    /**
     * @return names in the ONLY list, empty if everything is imported
     */
    public List<String> getSymbols() {
      return symbols;
    }

    public boolean isCImport() {
      return cImport;
    }

    @Override
    public StatementKind kind() {
      return StatementKind.IMPORT;
    }

    @Override
    public List<Expression> expressions() {
      return Collections.emptyList();
    }

    @Override
    public void appendTo(StringBuilder sb, int indent) {
      if (cImport) {
        // Preprocessor directives start in the first column
        sb.append("#include \"").append(module).append("\"\n");
      } else if (symbols.isEmpty()) {
        line(sb, indent, "USE " + module);
      } else {
        line(sb, indent, "USE " + module + ", ONLY: " +
                         StringUtil.concat(", ", symbols));
      }
    }
  }
}
