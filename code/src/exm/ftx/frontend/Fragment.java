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
package exm.ftx.frontend;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;

import exm.ftx.ast.SourceSpan;
import exm.ftx.common.exceptions.FTXRuntimeError;
import exm.ftx.ir.IRNode;
import exm.ftx.ir.Statement;
import exm.ftx.ir.expr.Expression;

/**
 * Intermediate result of lowering one parse node.  Besides finished IR
 * nodes, lowering passes up pieces that only make sense to the parent:
 * name tokens and subscript tuples of a compound name, operator symbols,
 * keyword arguments, and the WHERE construct markers.
 */
public class Fragment {

  public static enum FragmentKind {
    NODE,
    NAME,
    OPERATOR,
    INDICES,
    KEYWORD,
    MARKER,
  }

  public static enum Marker {
    ELSEWHERE,
    ENDWHERE,
  }

  public final FragmentKind kind;

  private final IRNode node;
  /** Name, operator or keyword text */
  private final String text;
  private final List<Expression> args;
  private final Map<String, Expression> kwargs;
  private final Expression value;
  private final Marker marker;
  private final SourceSpan source;

  private Fragment(FragmentKind kind, IRNode node, String text,
                   List<Expression> args, Map<String, Expression> kwargs,
                   Expression value, Marker marker, SourceSpan source) {
    this.kind = kind;
    this.node = node;
    this.text = text;
    this.args = args;
    this.kwargs = kwargs;
    this.value = value;
    this.marker = marker;
    this.source = source;
  }

  public static Fragment node(IRNode node) {
    assert(node != null);
    return new Fragment(FragmentKind.NODE, node, null, null, null, null,
                        null, node.getSource());
  }

  public static Fragment name(String name, SourceSpan source) {
    assert(name != null);
    return new Fragment(FragmentKind.NAME, null, name, null, null, null,
                        null, source);
  }

  public static Fragment operator(String op) {
    return new Fragment(FragmentKind.OPERATOR, null, op, null, null, null,
                        null, null);
  }

  /**
   * Parenthesised subscript or argument tuple following a name.  An empty
   * tuple means the source had empty parentheses.
   */
  public static Fragment indices(List<Expression> args,
                     Map<String, Expression> kwargs, SourceSpan source) {
    return new Fragment(FragmentKind.INDICES, null, null,
        ImmutableList.copyOf(args), Collections.unmodifiableMap(
            new LinkedHashMap<String, Expression>(kwargs)), null, null,
        source);
  }

  public static Fragment indices(List<Expression> args, SourceSpan source) {
    return indices(args, Collections.<String, Expression>emptyMap(), source);
  }

  public static Fragment keyword(String key, Expression value) {
    return new Fragment(FragmentKind.KEYWORD, null, key, null, null, value,
                        null, value.getSource());
  }

  public static Fragment marker(Marker marker) {
    return new Fragment(FragmentKind.MARKER, null, null, null, null, null,
                        marker, null);
  }

  public FragmentKind getKind() {
    return kind;
  }

  public SourceSpan getSource() {
    return source;
  }

  public IRNode getNode() {
    if (kind == FragmentKind.NODE) {
      return node;
    } else {
      throw new FTXRuntimeError("getNode for " + kind + " fragment");
    }
  }

  public boolean isExpression() {
    return kind == FragmentKind.NODE && node instanceof Expression;
  }

  public boolean isStatement() {
    return kind == FragmentKind.NODE && node instanceof Statement;
  }

  public Expression getExpression() {
    if (isExpression()) {
      return (Expression)node;
    } else {
      throw new FTXRuntimeError("getExpression for " + this);
    }
  }

  public Statement getStatement() {
    if (isStatement()) {
      return (Statement)node;
    } else {
      throw new FTXRuntimeError("getStatement for " + this);
    }
  }

  public String getName() {
    if (kind == FragmentKind.NAME) {
      return text;
    } else {
      throw new FTXRuntimeError("getName for " + kind + " fragment");
    }
  }

  public String getOperator() {
    if (kind == FragmentKind.OPERATOR) {
      return text;
    } else {
      throw new FTXRuntimeError("getOperator for " + kind + " fragment");
    }
  }

  public List<Expression> getArgs() {
    if (kind == FragmentKind.INDICES) {
      return args;
    } else {
      throw new FTXRuntimeError("getArgs for " + kind + " fragment");
    }
  }

  public Map<String, Expression> getKwargs() {
    if (kind == FragmentKind.INDICES) {
      return kwargs;
    } else {
      throw new FTXRuntimeError("getKwargs for " + kind + " fragment");
    }
  }

  public String getKeyword() {
    if (kind == FragmentKind.KEYWORD) {
      return text;
    } else {
      throw new FTXRuntimeError("getKeyword for " + kind + " fragment");
    }
  }

  public Expression getKeywordValue() {
    if (kind == FragmentKind.KEYWORD) {
      return value;
    } else {
      throw new FTXRuntimeError("getKeywordValue for " + kind + " fragment");
    }
  }

  public Marker getMarker() {
    if (kind == FragmentKind.MARKER) {
      return marker;
    } else {
      throw new FTXRuntimeError("getMarker for " + kind + " fragment");
    }
  }

  public boolean isMarker(Marker m) {
    return kind == FragmentKind.MARKER && marker == m;
  }

  @Override
  public String toString() {
    switch (kind) {
      case NODE:
        return node.getClass().getSimpleName() + " " +
               node.stringify().trim();
      case NAME:
      case OPERATOR:
        return kind + " " + text;
      case INDICES:
        return kind + " " + args + " " + kwargs;
      case KEYWORD:
        return kind + " " + text + "=" + value;
      case MARKER:
        return kind + " " + marker;
      default:
        throw new FTXRuntimeError("Unknown fragment kind " + kind);
    }
  }
}
