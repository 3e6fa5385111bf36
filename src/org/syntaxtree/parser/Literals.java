/*
 * Copyright 2026 The Syntax Tree Translation Authors.
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
 * limitations under the License.
 */
package org.syntaxtree.parser;

import com.google.common.base.CharMatcher;
import java.math.BigInteger;

/** Decodes the values of numeric and string literal tokens. */
public final class Literals {

  private Literals() {}

  /** The value of an integer literal such as {@code 1_000}, {@code 0x1f} or {@code 0b11}. */
  public static BigInteger integerValue(String text) {
    String digits = CharMatcher.is('_').removeFrom(text);
    int radix = 10;
    if (digits.length() > 1 && digits.charAt(0) == '0') {
      switch (Character.toLowerCase(digits.charAt(1))) {
        case 'x':
          radix = 16;
          digits = digits.substring(2);
          break;
        case 'b':
          radix = 2;
          digits = digits.substring(2);
          break;
        case 'o':
          radix = 8;
          digits = digits.substring(2);
          break;
        case 'd':
          digits = digits.substring(2);
          break;
        default:
          radix = 8;
          digits = digits.substring(1);
      }
    }
    return new BigInteger(digits, radix);
  }

  public static double floatValue(String text) {
    return Double.parseDouble(CharMatcher.is('_').removeFrom(text));
  }

  /**
   * Resolves the escapes in raw string content. Single-quoted content only knows {@code \\} and
   * {@code \'}; interpolating content knows the usual control escapes, {@code \x},
   * <code>&#92;u</code> and octal escapes, and otherwise drops the backslash.
   */
  public static String unescape(String raw, boolean interpolating) {
    if (raw.indexOf('\\') < 0) {
      return raw;
    }
    StringBuilder sb = new StringBuilder(raw.length());
    int i = 0;
    while (i < raw.length()) {
      char c = raw.charAt(i);
      if (c != '\\' || i + 1 >= raw.length()) {
        sb.append(c);
        i++;
        continue;
      }
      char next = raw.charAt(i + 1);
      i += 2;
      if (!interpolating) {
        if (next != '\\' && next != '\'') {
          sb.append('\\');
        }
        sb.append(next);
        continue;
      }
      switch (next) {
        case 'n':
          sb.append('\n');
          break;
        case 't':
          sb.append('\t');
          break;
        case 's':
          sb.append(' ');
          break;
        case 'r':
          sb.append('\r');
          break;
        case 'e':
          sb.append('\u001b');
          break;
        case 'a':
          sb.append('\u0007');
          break;
        case 'b':
          sb.append('\b');
          break;
        case 'f':
          sb.append('\f');
          break;
        case 'v':
          sb.append('\u000b');
          break;
        case 'x':
          {
            int end = i;
            while (end < raw.length() && end < i + 2 && Character.digit(raw.charAt(end), 16) >= 0) {
              end++;
            }
            if (end == i) {
              sb.append('x');
            } else {
              sb.append((char) Integer.parseInt(raw.substring(i, end), 16));
              i = end;
            }
            break;
          }
        case 'u':
          i = appendUnicodeEscape(raw, i, sb);
          break;
        case '\n':
          break;
        default:
          if (next >= '0' && next <= '7') {
            int end = i;
            while (end < raw.length() && end < i + 2 && raw.charAt(end) >= '0'
                && raw.charAt(end) <= '7') {
              end++;
            }
            sb.append((char) Integer.parseInt(raw.substring(i - 1, end), 8));
            i = end;
          } else {
            sb.append(next);
          }
      }
    }
    return sb.toString();
  }

  private static int appendUnicodeEscape(String raw, int start, StringBuilder sb) {
    if (start < raw.length() && raw.charAt(start) == '{') {
      int close = raw.indexOf('}', start);
      if (close < 0) {
        sb.append('u');
        return start;
      }
      for (String codePoint : raw.substring(start + 1, close).trim().split("\\s+")) {
        sb.appendCodePoint(Integer.parseInt(codePoint, 16));
      }
      return close + 1;
    }
    if (start + 4 <= raw.length()) {
      sb.append((char) Integer.parseInt(raw.substring(start, start + 4), 16));
      return start + 4;
    }
    sb.append('u');
    return start;
  }
}
