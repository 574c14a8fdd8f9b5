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
package exm.ftx.ast;

import java.util.List;
import java.util.Map;

/**
 * What lowering needs from a node of a front end's parse tree.
 * Implementations are read-only views; lowering never modifies them.
 */
public interface ParseNode {

  /**
   * @return front-end specific identifier of the node's kind
   */
  public String getTag();

  /**
   * @return ordered children, empty if none
   */
  public List<? extends ParseNode> children();

  /**
   * @return attribute value, or null if the node has no such attribute
   */
  public String getAttribute(String key);

  public Map<String, String> getAttributes();

  /**
   * @return position in the raw source, or null if the front end did not
   *         record one for this node
   */
  public SourcePosition getPosition();
}
