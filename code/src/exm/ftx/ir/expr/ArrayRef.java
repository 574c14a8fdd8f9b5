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

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;

import exm.ftx.ast.SourceSpan;
import exm.ftx.ir.DataType;

/**
 * Reference to an array, either indexed (<code>a(i, 1:n)</code>) or as a
 * whole (<code>a</code>, no dimensions).  Declared arrays carry their
 * declared shape so that dimension inference can resolve <code>:</code>.
 */
public class ArrayRef extends VariableRef {

  /** null for a whole-array reference */
  private final ImmutableList<Expression> dimensions;
  /** null if the shape is not known */
  private final ImmutableList<Expression> shape;

  public ArrayRef(String name, List<Expression> dimensions,
                  List<Expression> shape, VariableRef parent,
                  Expression initial, DataType type, SourceSpan source) {
    super(name, parent, initial, type, source);
    this.dimensions = dimensions == null ? null :
                              ImmutableList.copyOf(dimensions);
    this.shape = shape == null ? null : ImmutableList.copyOf(shape);
  }

  public ArrayRef(String name, List<Expression> dimensions) {
    this(name, dimensions, null, null, null, null, null);
  }

  /**
   * @return the index expressions, or null if the whole array is referenced
   */
  public List<Expression> getDimensions() {
    return dimensions;
  }

  public boolean hasDimensions() {
    return dimensions != null;
  }

  /**
   * @return declared extents, or null if unknown
   */
  public List<Expression> getShape() {
    return shape;
  }

  /**
   * @return copy of this reference with the given declared shape
   */
  public ArrayRef withShape(List<Expression> newShape) {
    return new ArrayRef(getName(), dimensions, newShape, getParent(),
                        getInitial(), getType(), getSource());
  }

  @Override
  public ExprKind kind() {
    return ExprKind.ARRAY;
  }

  @Override
  public List<Expression> children() {
    List<Expression> result = new ArrayList<Expression>();
    if (dimensions != null) {
      result.addAll(dimensions);
    }
    if (getInitial() != null) {
      result.add(getInitial());
    }
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof ArrayRef)) {
      return false;
    }
    ArrayRef other = (ArrayRef)obj;
    return sameReference(other) &&
           Objects.equal(dimensions, other.dimensions);
  }

  @Override
  public int hashCode() {
    return 31 * referenceHash() + Objects.hashCode(dimensions);
  }
}
