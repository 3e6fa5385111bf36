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

import com.google.common.base.CharMatcher;
import com.google.errorprone.annotations.Immutable;
import java.math.BigDecimal;
import java.math.BigInteger;
import org.syntaxtree.parser.Literals;

/** The value of a {@code rational} node, in lowest terms with a positive denominator. */
@Immutable
public record RubyRational(BigInteger numerator, BigInteger denominator) {
  public RubyRational {
    checkArgument(denominator.signum() > 0, "denominator must be positive: %s", denominator);
  }

  public static RubyRational of(BigInteger numerator, BigInteger denominator) {
    BigInteger gcd = numerator.gcd(denominator);
    if (gcd.signum() == 0) {
      gcd = BigInteger.ONE;
    }
    if (denominator.signum() < 0) {
      gcd = gcd.negate();
    }
    return new RubyRational(numerator.divide(gcd), denominator.divide(gcd));
  }

  /**
   * Parses the text of a rational literal without its {@code r} suffix, such as {@code 3},
   * {@code 0x1f} or {@code 1.5}. A decimal literal is exact: {@code 1.5} is {@code 3/2}.
   */
  public static RubyRational parse(String text) {
    if (NumericValues.isDecimalFraction(text)) {
      BigDecimal decimal = new BigDecimal(CharMatcher.is('_').removeFrom(text));
      return of(decimal.unscaledValue(), BigInteger.TEN.pow(decimal.scale()));
    }
    return of(Literals.integerValue(text), BigInteger.ONE);
  }

  public RubyRational negate() {
    return new RubyRational(numerator.negate(), denominator);
  }

  /** Prints the value the way Ruby's {@code Rational#inspect} does, e.g. {@code (3/2)}. */
  @Override
  public String toString() {
    return "(" + numerator + "/" + denominator + ")";
  }
}
