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
package exm.ftx.transform;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.ftx.common.Logging;
import exm.ftx.ir.Statement;
import exm.ftx.ir.Statement.StatementKind;
import exm.ftx.transform.IRWalk.IRWalker;

/**
 * Collects the statements of given kinds from a statement tree, in
 * pre-order.
 */
public class FindNodes extends IRWalker {

  private static final Logger logger = Logging.getFTXLogger();

  private final Set<StatementKind> kinds;
  private final List<Statement> found = new ArrayList<Statement>();

  public FindNodes(Set<StatementKind> kinds) {
    this.kinds = kinds;
  }

  public static List<Statement> find(List<Statement> body,
                         StatementKind first, StatementKind... rest) {
    FindNodes finder = new FindNodes(EnumSet.of(first, rest));
    IRWalk.walk(logger, body, finder);
    return finder.getFound();
  }

  @Override
  protected void visitOther(Statement stmt) {
    if (kinds.contains(stmt.kind())) {
      found.add(stmt);
    }
  }

  public List<Statement> getFound() {
    return found;
  }
}
