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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import exm.ftx.ast.SourceSpan;
import exm.ftx.common.exceptions.UnsupportedConstructException;
import exm.ftx.common.util.StringUtil;
import exm.ftx.ir.expr.Expression;
import exm.ftx.ir.expr.FloatLiteral;
import exm.ftx.ir.expr.IntLiteral;
import exm.ftx.ir.expr.LogicLiteral;
import exm.ftx.ir.expr.StringLiteral;

/**
 * Construction of literal nodes from the literal text front ends report.
 */
public class Literals {

  public static enum LiteralType {
    INT,
    REAL,
    LOGICAL,
    CHARACTER,
  }

  private static final Pattern INT_PATTERN =
          Pattern.compile("[+-]?\\d+");
  private static final Pattern REAL_PATTERN =
          Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eEdD][+-]?\\d+)?");
  /** Kind suffix appended to the literal itself, e.g. 1.0_JPRB */
  private static final Pattern KIND_SUFFIX =
          Pattern.compile("(.*[^_])_(\\w+)");

  /**
   * @param type type name as reported by the front end, or null to infer
   *          from the text
   */
  public static LiteralType typeOf(String type, String value) {
    if (type != null) {
      String t = type.toLowerCase();
      if (t.startsWith("int")) {
        return LiteralType.INT;
      } else if (t.startsWith("real") || t.startsWith("double") ||
                 t.startsWith("float")) {
        return LiteralType.REAL;
      } else if (t.startsWith("bool") || t.startsWith("logical")) {
        return LiteralType.LOGICAL;
      } else if (t.startsWith("char") || t.startsWith("string")) {
        return LiteralType.CHARACTER;
      }
    }
    if (isLogical(value)) {
      return LiteralType.LOGICAL;
    } else if (value.startsWith("'") || value.startsWith("\"")) {
      return LiteralType.CHARACTER;
    } else if (INT_PATTERN.matcher(value).matches()) {
      return LiteralType.INT;
    } else if (REAL_PATTERN.matcher(value).matches()) {
      return LiteralType.REAL;
    }
    return null;
  }

  private static boolean isLogical(String value) {
    String v = value.toLowerCase();
    return v.equals("true") || v.equals("false") ||
           v.equals(".true.") || v.equals(".false.");
  }

  /**
   * Build a literal node
   * @param value literal text
   * @param type front end type name, or null
   * @param kind kind parameter, or null if none or appended to value
   * @param tag tag of the literal node, for errors
   */
  public static Expression create(String value, String type, String kind,
        SourceSpan source, String tag) throws UnsupportedConstructException {
    if (value == null) {
      throw new UnsupportedConstructException(source, tag,
                                              "literal without value");
    }
    String text = value.trim();
    if (kind == null && !text.startsWith("'") && !text.startsWith("\"")) {
      Matcher m = KIND_SUFFIX.matcher(text);
      if (m.matches()) {
        text = m.group(1);
        kind = m.group(2);
      }
    }
    LiteralType lt = typeOf(type, text);
    if (lt == null) {
      throw new UnsupportedConstructException(source, tag,
                          "cannot determine type of literal " + value);
    }
    switch (lt) {
      case INT:
        try {
          return new IntLiteral(Long.parseLong(text), text, kind, source);
        } catch (NumberFormatException e) {
          throw new UnsupportedConstructException(source, tag,
                                "integer literal out of range: " + text);
        }
      case REAL:
        return new FloatLiteral(text, kind, source);
      case LOGICAL:
        return new LogicLiteral(text.toLowerCase().contains("true"), source);
      case CHARACTER:
        return new StringLiteral(StringUtil.fortranUnquote(text), source);
      default:
        throw new UnsupportedConstructException(source, tag,
                                      "unknown literal type " + lt);
    }
  }
}
