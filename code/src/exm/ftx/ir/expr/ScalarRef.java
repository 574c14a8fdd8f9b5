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

import java.util.Collections;
import java.util.List;

import exm.ftx.ast.SourceSpan;
import exm.ftx.ir.DataType;

public class ScalarRef extends VariableRef {

  public ScalarRef(String name, VariableRef parent, Expression initial,
                   DataType type, SourceSpan source) {
    super(name, parent, initial, type, source);
  }

  public ScalarRef(String name) {
    this(name, null, null, null, null);
  }

  @Override
  public ExprKind kind() {
    return ExprKind.SCALAR;
  }

  @Override
  public List<Expression> children() {
    if (getInitial() == null) {
      return Collections.emptyList();
    }
    return Collections.singletonList(getInitial());
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof ScalarRef)) {
      return false;
    }
    return sameReference((ScalarRef)obj);
  }

  @Override
  public int hashCode() {
    return referenceHash();
  }
}
