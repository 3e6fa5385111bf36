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

import static com.google.common.base.Preconditions.checkArgument;

import java.math.BigInteger;

/**
 * The value of a {@code complex} node. Literals are purely imaginary, so the real part is always
 * the integer zero; the imaginary part is a {@link BigInteger}, a {@link Double} or a {@link
 * RubyRational}.
 */
public record RubyComplex(Object imaginary) {
  public RubyComplex {
    checkArgument(
        imaginary instanceof BigInteger
            || imaginary instanceof Double
            || imaginary instanceof RubyRational,
        "not a real number: %s",
        imaginary);
  }

  /** Parses the text of an imaginary literal, such as {@code 2i}, {@code 1.5i} or {@code 1ri}. */
  public static RubyComplex parse(String text) {
    checkArgument(text.endsWith("i"), "not an imaginary literal: %s", text);
    String number = text.substring(0, text.length() - 1);
    if (number.endsWith("r")) {
      return new RubyComplex(RubyRational.parse(number.substring(0, number.length() - 1)));
    }
    return new RubyComplex(NumericValues.parseReal(number));
  }

  public RubyComplex negate() {
    return new RubyComplex(NumericValues.negate(imaginary));
  }

  /** Prints the value the way Ruby's {@code Complex#inspect} does, e.g. {@code (0+1i)}. */
  @Override
  public String toString() {
    boolean negative;
    String magnitude;
    if (imaginary instanceof BigInteger) {
      BigInteger value = (BigInteger) imaginary;
      negative = value.signum() < 0;
      magnitude = value.abs().toString();
    } else if (imaginary instanceof Double) {
      double value = (Double) imaginary;
      negative = Math.copySign(1.0, value) < 0;
      magnitude = Node.inspectFloat(Math.abs(value));
    } else {
      RubyRational value = (RubyRational) imaginary;
      negative = value.numerator().signum() < 0;
      magnitude = (negative ? value.negate() : value) + "*";
    }
    return "(0" + (negative ? "-" : "+") + magnitude + "i)";
  }
}
