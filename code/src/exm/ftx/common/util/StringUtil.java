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
package exm.ftx.common.util;

import java.util.List;

public class StringUtil {

  /**
   * Append the given number of spaces into given StringBuilder
   */
  public static void spaces(StringBuilder sb, int c) {
    for (int i = 0; i < c; i++)
      sb.append(' ');
  }

  public static String concat(String separator, List<? extends Object> objs) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < objs.size(); i++) {
      sb.append(objs.get(i));
      if (i < objs.size() - 1)
        sb.append(separator);
    }
    return sb.toString();
  }

  /**
   * Quote a character value as a Fortran string literal, doubling any
   * embedded single quotes.
   */
  public static String fortranQuote(String value) {
    StringBuilder sb = new StringBuilder(value.length() + 2);
    sb.append('\'');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c == '\'') {
        sb.append('\'');
      }
      sb.append(c);
    }
    sb.append('\'');
    return sb.toString();
  }

  /**
   * Inverse of {@link #fortranQuote(String)}: strip one level of matching
   * single or double quotes and collapse doubled quote characters.
   * Strings that are not quoted are returned unchanged.
   */
  public static String fortranUnquote(String literal) {
    if (literal.length() < 2) {
      return literal;
    }
    char q = literal.charAt(0);
    if ((q != '\'' && q != '"') || literal.charAt(literal.length() - 1) != q) {
      return literal;
    }
    String body = literal.substring(1, literal.length() - 1);
    String quote = String.valueOf(q);
    return body.replace(quote + quote, quote);
  }

  /**
   * Like String.trim(), but only drops blank lines and trailing
   * newlines, keeping leading indentation of the first line.
   */
  public static String trimNewlines(String s) {
    int i = 0;
    while (i < s.length() && (s.charAt(i) == '\n' || s.charAt(i) == '\r'))
      i++;
    int j = s.length();
    while (j > i && (s.charAt(j - 1) == '\n' || s.charAt(j - 1) == '\r'))
      j--;
    return s.substring(i, j);
  }
}
