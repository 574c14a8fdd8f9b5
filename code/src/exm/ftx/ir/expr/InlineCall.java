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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import com.google.common.collect.ImmutableList;

import exm.ftx.ast.SourceSpan;

/**
 * Function reference inside an expression: an intrinsic, or a routine
 * recognised only because it was written with an empty argument list.
 * The latter is marked provisional until a symbol table confirms it.
 */
public class InlineCall extends Expression {

  private final String name;
  private final ImmutableList<Expression> args;
  private final Map<String, Expression> kwargs;
  private final boolean provisional;

  public InlineCall(String name, List<Expression> args,
                    Map<String, Expression> kwargs, boolean provisional,
                    SourceSpan source) {
    super(source);
    assert(name != null);
    this.name = name;
    this.args = ImmutableList.copyOf(args);
    this.kwargs = new LinkedHashMap<String, Expression>(kwargs);
    this.provisional = provisional;
  }

  public InlineCall(String name, List<Expression> args) {
    this(name, args, new LinkedHashMap<String, Expression>(), false, null);
  }

  public String getName() {
    return name;
  }

  public List<Expression> getArgs() {
    return args;
  }

  /**
   * @return keyword arguments in source order
   */
  public Map<String, Expression> getKwargs() {
    return kwargs;
  }

  public boolean isProvisional() {
    return provisional;
  }

  @Override
  public ExprKind kind() {
    return ExprKind.INLINE_CALL;
  }

  @Override
  public List<Expression> children() {
    List<Expression> result = new ArrayList<Expression>(args);
    result.addAll(kwargs.values());
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof InlineCall)) {
      return false;
    }
    InlineCall other = (InlineCall)obj;
    if (!name.equalsIgnoreCase(other.name) || !args.equals(other.args) ||
        kwargs.size() != other.kwargs.size()) {
      return false;
    }
    for (Entry<String, Expression> e: kwargs.entrySet()) {
      if (!e.getValue().equals(lookupKeyword(other.kwargs, e.getKey()))) {
        return false;
      }
    }
    return true;
  }

  private static Expression lookupKeyword(Map<String, Expression> kwargs,
                                          String key) {
    for (Entry<String, Expression> e: kwargs.entrySet()) {
      if (e.getKey().equalsIgnoreCase(key)) {
        return e.getValue();
      }
    }
    return null;
  }

  @Override
  public int hashCode() {
    return name.toLowerCase().hashCode() * 31 + args.hashCode();
  }
}
