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

import java.util.List;

import exm.ftx.ast.SourceSpan;
import exm.ftx.common.Settings;
import exm.ftx.common.util.StringUtil;

/**
 * Common base of statements and expressions in the IR.
 *
 * Nodes are built once by lowering and not modified afterwards, with the
 * exception of the type annotation of declared variables.
 */
public abstract class IRNode {

  private final SourceSpan source;

  protected IRNode(SourceSpan source) {
    this.source = source;
  }

  /**
   * @return provenance of the node, or null if it was not built from source
   */
  public SourceSpan getSource() {
    return source;
  }

  /**
   * @return structural children in source order, for generic traversal
   */
  public abstract List<? extends IRNode> children();

  /**
   * Append Fortran text for this node
   * @param sb
   * @param indent current indentation in spaces
   */
  public abstract void appendTo(StringBuilder sb, int indent);

  /**
   * @return syntactically valid Fortran for this node
   */
  public String stringify() {
    StringBuilder sb = new StringBuilder(256);
    appendTo(sb, 0);
    return sb.toString();
  }

  protected static void indent(StringBuilder sb, int indent) {
    StringUtil.spaces(sb, indent);
  }

  protected static int indentWidth() {
    return Settings.CODEGEN_INDENT_WIDTH;
  }

  @Override
  public String toString() {
    return stringify();
  }
}
