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
package exm.ftx.common.lang;

import exm.ftx.common.Settings;

/**
 * Functions recognised by name when lowering references.
 */
public class Intrinsics {

  /**
   * Elementary functions: a reference to one of these is always a call,
   * never an array element.
   */
  public static enum ElementalIntrinsic {
    ABS,
    MIN,
    MAX,
    EXP,
    SQRT,
    LOG,
  }

  /**
   * Intrinsics converting their argument to another numeric type
   */
  public static enum CastIntrinsic {
    REAL,
    INT,
    DBLE,
    CMPLX,
  }

  /**
   * @param name function name, any case
   * @return the elemental intrinsic, or null if it isn't one of the
   *          built-in ones
   */
  public static ElementalIntrinsic lookupElemental(String name) {
    String upper = name.toUpperCase();
    for (ElementalIntrinsic i: ElementalIntrinsic.values()) {
      if (i.name().equals(upper)) {
        return i;
      }
    }
    return null;
  }

  public static CastIntrinsic lookupCast(String name) {
    String upper = name.toUpperCase();
    for (CastIntrinsic c: CastIntrinsic.values()) {
      if (c.name().equals(upper)) {
        return c;
      }
    }
    return null;
  }

  /**
   * True if the name is an elemental intrinsic, either built in or
   * configured through {@link Settings#EXTRA_INTRINSICS}
   */
  public static boolean isElemental(String name) {
    if (lookupElemental(name) != null) {
      return true;
    }
    for (String extra: Settings.getList(Settings.EXTRA_INTRINSICS)) {
      if (extra.equalsIgnoreCase(name)) {
        return true;
      }
    }
    return false;
  }
}
