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
package exm.ftx.ir.expr;

import java.util.List;

import com.google.common.base.Objects;

import exm.ftx.ast.SourceSpan;
import exm.ftx.ir.DataType;

/**
 * Reference to a named variable, possibly a component of a derived type
 * variable.  The <code>parent</code> link is the qualifier of the name, so
 * that <code>a%b%c</code> is the node <code>c</code> with parent
 * <code>b</code>, whose parent is <code>a</code>.  Parent links are not
 * children: the statement owning the outermost expression owns the chain.
 */
public abstract class VariableRef extends Expression {

  private final String name;
  private final VariableRef parent;
  private final Expression initial;

  /** Declared type; patched in once by declaration lowering */
  private DataType type;

  protected VariableRef(String name, VariableRef parent, Expression initial,
                        DataType type, SourceSpan source) {
    super(source);
    assert(name != null);
    this.name = name;
    this.parent = parent;
    this.initial = initial;
    this.type = type;
  }

  /**
   * Build a scalar reference if dims is null, otherwise an array reference
   */
  public static VariableRef create(String name, List<Expression> dims,
                 VariableRef parent, SourceSpan source) {
    if (dims == null) {
      return new ScalarRef(name, parent, null, null, source);
    } else {
      return new ArrayRef(name, dims, null, parent, null, null, source);
    }
  }

  public String getName() {
    return name;
  }

  public VariableRef getParent() {
    return parent;
  }

  /**
   * @return initial value in a declaration, or null
   */
  public Expression getInitial() {
    return initial;
  }

  public DataType getType() {
    return type;
  }

  public void setType(DataType type) {
    this.type = type;
  }

  /**
   * @return name including derived type qualifiers, e.g. a%b%c
   */
  public String getQualifiedName() {
    if (parent == null) {
      return name;
    }
    return parent.getQualifiedName() + "%" + name;
  }

  /**
   * @return outermost qualifier of the chain, or this if unqualified
   */
  public VariableRef getRoot() {
    VariableRef curr = this;
    while (curr.parent != null) {
      curr = curr.parent;
    }
    return curr;
  }

  protected boolean sameReference(VariableRef other) {
    return name.equalsIgnoreCase(other.name) &&
           Objects.equal(parent, other.parent) &&
           Objects.equal(initial, other.initial);
  }

  protected int referenceHash() {
    return Objects.hashCode(name.toLowerCase(), parent, initial);
  }
}
