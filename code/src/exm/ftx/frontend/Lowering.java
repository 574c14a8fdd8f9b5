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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import exm.ftx.ast.ParseNode;
import exm.ftx.ast.SourcePosition;
import exm.ftx.ast.SourceRangeExtractor;
import exm.ftx.ast.SourceSpan;
import exm.ftx.common.Logging;
import exm.ftx.common.exceptions.UnsupportedConstructException;
import exm.ftx.common.exceptions.UserException;
import exm.ftx.frontend.Fragment.FragmentKind;
import exm.ftx.frontend.Fragment.Marker;
import exm.ftx.ir.Conditionals.MaskedStatement;
import exm.ftx.ir.Statement;
import exm.ftx.ir.expr.Expression;

/**
 * Lowers the parse tree of one front end to IR.
 *
 * Subclasses switch on the tag of each node.  Tags without a dedicated
 * rule go to one of two shared rules: {@link #lowerChildren} for tags
 * known to be purely structural, and {@link #lowerUnknown} for anything
 * else, which only flattens a node with at most one meaningful child.
 *
 * Each instance lowers one source file and is not thread-safe.
 *
 * @param <N> parse tree node type of the front end
 */
public abstract class Lowering<N extends ParseNode> {

  protected final Logger logger = Logging.getFTXLogger();

  protected final String file;
  protected final String rawSource;
  private final SourceRangeExtractor extractor;

  /** Current tree depth, for log indentation */
  private int depth = 0;

  protected Lowering(String file, String rawSource) {
    this.file = file;
    this.rawSource = rawSource;
    this.extractor = new SourceRangeExtractor(file, rawSource);
  }

  /**
   * Lower a whole parse tree
   * @return top-level statements
   */
  public List<Statement> lowerProgram(N root) throws UserException {
    logger.debug("Lowering " + (file == null ? "<unknown>" : file));
    List<Fragment> result = lower(root);
    return statements(result, root, span(root, false));
  }

  /**
   * Lower a node and its subtree
   * @return IR for the node: empty if insignificant, several fragments if
   *          the node expands to more than one
   */
  public List<Fragment> lower(N node) throws UserException {
    SourceSpan source = span(node, false);
    if (LogHelper.isTraceEnabled()) {
      LogHelper.trace(depth, "<" + node.getTag() + "> " + node.getAttributes());
    }
    depth += 2;
    try {
      return dispatch(node, source);
    } finally {
      depth -= 2;
    }
  }

  /**
   * Front-end specific rule selection
   * @param source span of the node, or null if it has no position
   */
  protected abstract List<Fragment> dispatch(N node, SourceSpan source)
                                              throws UserException;

  protected abstract List<N> childrenOf(N node);

  /**
   * @return span of the node, or null if the front end recorded no
   *         position for it
   */
  protected SourceSpan span(N node, boolean fullLines) {
    SourcePosition pos = node.getPosition();
    if (pos == null) {
      return null;
    }
    return extractor.extract(pos, fullLines);
  }

  protected SourceSpan span(SourcePosition pos, boolean fullLines) {
    return pos == null ? null : extractor.extract(pos, fullLines);
  }

  /**
   * Rule for structural nodes: the results of all children, in order
   */
  protected List<Fragment> lowerChildren(N node) throws UserException {
    List<Fragment> result = new ArrayList<Fragment>();
    for (N child: childrenOf(node)) {
      result.addAll(lower(child));
    }
    return result;
  }

  /**
   * Rule for nodes without a lowering rule: the node is dropped from the
   * hierarchy if at most one child yields IR.
   */
  protected List<Fragment> lowerUnknown(N node, SourceSpan source)
                                        throws UserException {
    List<Fragment> result = new ArrayList<Fragment>();
    int meaningful = 0;
    for (N child: childrenOf(node)) {
      List<Fragment> childResult = lower(child);
      if (!childResult.isEmpty()) {
        meaningful++;
        result.addAll(childResult);
      }
    }
    if (meaningful > 1) {
      throw new UnsupportedConstructException(source, node.getTag(),
          "no lowering rule for node with " + meaningful +
          " meaningful children");
    }
    if (meaningful == 1) {
      LogHelper.trace(depth, "flattened <" + node.getTag() + ">");
    }
    return result;
  }

  protected UnsupportedConstructException unsupported(N node,
                                       SourceSpan source, String message) {
    return new UnsupportedConstructException(source, node.getTag(),
                                             message);
  }

  protected static List<Fragment> single(Fragment f) {
    return Collections.singletonList(f);
  }

  protected static List<Fragment> none() {
    return Collections.emptyList();
  }

  /**
   * Lower a node that must produce exactly one expression
   */
  protected Expression expression(N node) throws UserException {
    List<Fragment> result = lower(node);
    if (result.size() != 1 || !result.get(0).isExpression()) {
      throw unsupported(node, span(node, false),
          "expected one expression, found " + result);
    }
    return result.get(0).getExpression();
  }

  /**
   * @return expression of node, or null if node is null
   */
  protected Expression optionalExpression(N node) throws UserException {
    return node == null ? null : expression(node);
  }

  protected List<Expression> expressions(List<Fragment> frags, N context,
                             SourceSpan source) throws UserException {
    List<Expression> result = new ArrayList<Expression>(frags.size());
    for (Fragment f: frags) {
      if (!f.isExpression()) {
        throw unsupported(context, source, "expected expression, found " + f);
      }
      result.add(f.getExpression());
    }
    return result;
  }

  protected List<Statement> statements(List<Fragment> frags, N context,
                           SourceSpan source) throws UserException {
    List<Statement> result = new ArrayList<Statement>(frags.size());
    for (Fragment f: frags) {
      if (!f.isStatement()) {
        throw unsupported(context, source, "expected statement, found " + f);
      }
      result.add(f.getStatement());
    }
    return result;
  }

  /**
   * Lower a node to a statement body
   */
  protected List<Statement> body(N node) throws UserException {
    if (node == null) {
      return Collections.emptyList();
    }
    return statements(lower(node), node, span(node, false));
  }

  /**
   * Build masked statements from the lowered children of a WHERE
   * construct.  Each block runs up to an ENDWHERE marker and starts with
   * its mask; an ELSEWHERE marker splits the body from the default.
   */
  protected List<Fragment> maskedStatements(List<Fragment> frags, N context,
                               SourceSpan source) throws UserException {
    List<Fragment> result = new ArrayList<Fragment>();
    int pos = 0;
    while (pos < frags.size()) {
      int end = indexOf(frags, Marker.ENDWHERE, pos, frags.size());
      if (end < 0) {
        throw unsupported(context, source, "WHERE construct without END WHERE");
      }
      if (end == pos) {
        throw unsupported(context, source, "WHERE construct without mask");
      }
      Fragment mask = frags.get(pos);
      if (!mask.isExpression()) {
        throw unsupported(context, source, "expected WHERE mask, found " +
                          mask);
      }
      int elsewhere = indexOf(frags, Marker.ELSEWHERE, pos + 1, end);
      List<Statement> body;
      List<Statement> defaultBody;
      if (elsewhere >= 0) {
        body = statements(frags.subList(pos + 1, elsewhere), context, source);
        defaultBody = statements(frags.subList(elsewhere + 1, end), context,
                                 source);
      } else {
        body = statements(frags.subList(pos + 1, end), context, source);
        defaultBody = Collections.emptyList();
      }
      result.add(Fragment.node(new MaskedStatement(mask.getExpression(),
                                           body, defaultBody, source)));
      pos = end + 1;
    }
    return result;
  }

  private static int indexOf(List<Fragment> frags, Marker marker,
                             int from, int to) {
    for (int i = from; i < to; i++) {
      if (frags.get(i).isMarker(marker)) {
        return i;
      }
    }
    return -1;
  }

  /**
   * Assemble the lowered children of a name node into a reference
   */
  protected Expression nameChain(List<Fragment> parts, N node,
                                 SourceSpan source) throws UserException {
    return NameChain.build(parts, source, node.getTag());
  }

  /**
   * Split lowered call arguments into positional and keyword arguments
   */
  protected static void splitArguments(List<Fragment> frags,
      List<Expression> args, Map<String, Expression> kwargs) {
    for (Fragment f: frags) {
      if (f.getKind() == FragmentKind.KEYWORD) {
        kwargs.put(f.getKeyword(), f.getKeywordValue());
      } else {
        args.add(f.getExpression());
      }
    }
  }

  protected int getDepth() {
    return depth;
  }
}
