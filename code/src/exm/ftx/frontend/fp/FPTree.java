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
package exm.ftx.frontend.fp;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.antlr.runtime.CommonToken;
import org.antlr.runtime.Token;
import org.antlr.runtime.tree.CommonTree;

import exm.ftx.ast.ParseNode;
import exm.ftx.ast.SourcePosition;
import exm.ftx.common.exceptions.FTXRuntimeError;

/**
 * Node of the fparser-style rule tree.  The token type is an
 * {@link FPRule}, the token text the node's leaf string, and the token's
 * start and stop indexes the character offsets of the node in the raw
 * source, or -1 if unknown.
 */
public class FPTree extends CommonTree implements ParseNode {

  public FPTree(Token t) {
    super(t);
  }

  public FPTree(FPRule rule, String text) {
    this(noOffsets(new CommonToken(rule.tokenType(), text)));
  }

  private static Token noOffsets(CommonToken t) {
    t.setStartIndex(-1);
    t.setStopIndex(-1);
    return t;
  }

  /**
   * Build a node with the given children
   */
  public static FPTree node(FPRule rule, String text, FPTree... children) {
    FPTree t = new FPTree(rule, text);
    for (FPTree c: children) {
      t.addChild(c);
    }
    return t;
  }

  public static FPTree node(FPRule rule, FPTree... children) {
    return node(rule, null, children);
  }

  /**
   * Record the character offsets of this node, stop inclusive
   * @return this node
   */
  public FPTree at(int start, int stop) {
    if (!(token instanceof CommonToken)) {
      throw new FTXRuntimeError("Cannot set offsets on token " + token);
    }
    ((CommonToken)token).setStartIndex(start);
    ((CommonToken)token).setStopIndex(stop);
    return this;
  }

  public FPRule getRule() {
    return FPRule.fromTokenType(getType());
  }

  /**
   * @return offset of the first character, or -1
   */
  public int getStartOffset() {
    return token instanceof CommonToken ?
                        ((CommonToken)token).getStartIndex() : -1;
  }

  /**
   * @return offset of the last character, or -1
   */
  public int getStopOffset() {
    return token instanceof CommonToken ?
                        ((CommonToken)token).getStopIndex() : -1;
  }

  public boolean hasOffsets() {
    return getStartOffset() >= 0 && getStopOffset() >= getStartOffset();
  }

  /**
   * Shorter alternative to getChildCount()
   */
  public int childCount() {
    return getChildCount();
  }

  /**
   * alternative to getChild so we can avoid having the cast to
   * FPTree everywhere
   */
  public FPTree child(int i) {
    return (FPTree)super.getChild(i);
  }

  @SuppressWarnings({ "unchecked", "rawtypes" })
  @Override
  public List<FPTree> children() {
    if (children == null) {
      return Collections.emptyList();
    }
    return (List)(this.children);
  }

  public List<FPTree> children(int start) {
    // Return empty list if nothing in range
    if (childCount() <= start) {
      return Collections.emptyList();
    }
    return children().subList(start, children.size());
  }

  @Override
  public String getTag() {
    return getRule().tag();
  }

  /**
   * The only attribute is <code>text</code>, the leaf string
   */
  @Override
  public String getAttribute(String key) {
    return key.equals("text") ? getText() : null;
  }

  @Override
  public Map<String, String> getAttributes() {
    Map<String, String> result = new HashMap<String, String>();
    if (getText() != null) {
      result.put("text", getText());
    }
    return result;
  }

  /**
   * Offsets can only be converted with the raw source at hand, so the
   * position is computed by {@link FPLowering}
   * @return null
   */
  @Override
  public SourcePosition getPosition() {
    return null;
  }

  public String printTree() {
    StringWriter sw = new StringWriter();
    PrintWriter writer = new PrintWriter(sw);
    printTree(writer, 0);
    writer.flush();
    return sw.toString();
  }

  private void printTree(PrintWriter writer, int indent) {
    for (int i = 0; i < indent; i++) {
      writer.print(' ');
    }
    writer.print(getTag());
    if (getText() != null) {
      writer.print(" " + getText());
    }
    writer.println();
    for (FPTree c: children()) {
      c.printTree(writer, indent + 2);
    }
  }
}
