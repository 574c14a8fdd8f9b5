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
package exm.ftx.common.exceptions;

import exm.ftx.ast.SourceSpan;

/**
 * A name with an empty argument list could be either a call to an external
 * routine or an array reference, and no symbol table is available to decide.
 */
public class AmbiguousReferenceException extends UserException {

  private static final long serialVersionUID = 2870941184937516102L;

  public AmbiguousReferenceException(SourceSpan span, String name) {
    super(span, "Cannot decide whether " + name + "() is a call to an"
        + " external routine or a variable reference");
  }
}
