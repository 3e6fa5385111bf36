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
package org.syntaxtree.whitequark;

import java.math.BigInteger;
import org.syntaxtree.parser.Literals;

/** Values of numeric literals as the {@code int}, {@code float} and related nodes hold them. */
public final class NumericValues {

  private NumericValues() {}

  /** The value of an integer or float literal. */
  static Object parseReal(String text) {
    if (isDecimalFraction(text)) {
      return Literals.floatValue(text);
    }
    return Literals.integerValue(text);
  }

  /** Whether {@code text} is a decimal literal with a fraction or an exponent. */
  static boolean isDecimalFraction(String text) {
    if (text.length() > 1 && text.charAt(0) == '0' && "xXbBoOdD".indexOf(text.charAt(1)) >= 0) {
      return false;
    }
    return text.indexOf('.') >= 0 || text.indexOf('e') >= 0 || text.indexOf('E') >= 0;
  }

  /** Negates the value of a numeric literal, as a glued minus sign does. */
  public static Object negate(Object value) {
    if (value instanceof BigInteger) {
      return ((BigInteger) value).negate();
    } else if (value instanceof Double) {
      return -((Double) value);
    } else if (value instanceof RubyRational) {
      return ((RubyRational) value).negate();
    } else if (value instanceof RubyComplex) {
      return ((RubyComplex) value).negate();
    }
    throw new IllegalArgumentException("not a numeric value: " + value);
  }
}
