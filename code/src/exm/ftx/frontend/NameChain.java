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
import java.util.List;

import exm.ftx.ast.SourceSpan;
import exm.ftx.common.Logging;
import exm.ftx.common.Settings;
import exm.ftx.common.exceptions.AmbiguousReferenceException;
import exm.ftx.common.exceptions.UnsupportedConstructException;
import exm.ftx.common.exceptions.UserException;
import exm.ftx.common.lang.Intrinsics;
import exm.ftx.frontend.Fragment.FragmentKind;
import exm.ftx.ir.expr.Expression;
import exm.ftx.ir.expr.InlineCall;
import exm.ftx.ir.expr.VariableRef;

/**
 * Builds references from the lowered parts of a compound name such as
 * <code>a%b(i)%c</code>.
 *
 * The parts are name fragments, each optionally preceded by the
 * subscript tuple that applies to it, outermost qualifier first.  They
 * are read from the tail: each step takes one name and, if the part
 * before it is a tuple, that tuple as its subscripts.  The references
 * are then created outermost first, so each one can be given its
 * qualifier as parent, and the innermost reference is returned.
 */
public class NameChain {

  /**
   * @param parts lowered children of the name node
   * @param source span of the whole name
   * @param tag tag of the name node, for error reporting
   * @return innermost reference of the chain, or a call
   */
  public static Expression build(List<Fragment> parts, SourceSpan source,
                                 String tag) throws UserException {
    List<Fragment> names = new ArrayList<Fragment>();
    List<Fragment> tuples = new ArrayList<Fragment>();
    int cursor = parts.size() - 1;
    while (cursor >= 0) {
      Fragment leaf = parts.get(cursor--);
      if (leaf.getKind() != FragmentKind.NAME) {
        throw new UnsupportedConstructException(source, tag,
                          "expected name component, found " + leaf);
      }
      Fragment indices = null;
      if (cursor >= 0 && parts.get(cursor).getKind() == FragmentKind.INDICES) {
        indices = parts.get(cursor--);
      }
      names.add(leaf);
      tuples.add(indices);
    }
    if (names.isEmpty()) {
      throw new UnsupportedConstructException(source, tag,
                                              "name without components");
    }

    boolean qualified = names.size() > 1;
    VariableRef parent = null;
    Expression result = null;
    for (int i = names.size() - 1; i >= 0; i--) {
      Fragment name = names.get(i);
      SourceSpan span = name.getSource() != null ? name.getSource() : source;
      result = component(name.getName(), tuples.get(i), parent, qualified,
                         span, tag);
      parent = result.isVariable() ? (VariableRef)result : null;
    }
    return result;
  }

  private static Expression component(String name, Fragment indices,
        VariableRef parent, boolean qualified, SourceSpan source, String tag)
            throws UserException {
    if (indices == null) {
      return VariableRef.create(name, null, parent, source);
    }
    List<Expression> args = indices.getArgs();
    if (qualified) {
      // Components are never intrinsic calls: a%max(2), obj%f()
      if (!indices.getKwargs().isEmpty()) {
        throw new UnsupportedConstructException(source, tag,
            "keyword arguments to component " + name);
      }
      return VariableRef.create(name, args, parent, source);
    }

    boolean call = false;
    boolean provisional = false;
    if (Intrinsics.isElemental(name)) {
      call = true;
    } else if (args.isEmpty() && indices.getKwargs().isEmpty()) {
      if (Settings.getBoolean(Settings.STRICT_CALLS)) {
        throw new AmbiguousReferenceException(source, name);
      }
      call = true;
      provisional = true;
    } else if (!indices.getKwargs().isEmpty()) {
      // Keyword arguments cannot index an array
      call = true;
    }

    if (!call) {
      return VariableRef.create(name, args, parent, source);
    }
    if (provisional) {
      Logging.uniqueWarn("Treating " + name + "() as a call to an external"
                         + " routine");
    }
    return new InlineCall(name, args, indices.getKwargs(), provisional,
                          source);
  }
}
