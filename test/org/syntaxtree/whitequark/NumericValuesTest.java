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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.math.BigInteger;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class NumericValuesTest {

  @Test
  public void testRationalIsInLowestTerms() {
    assertThat(RubyRational.parse("1").toString()).isEqualTo("(1/1)");
    assertThat(RubyRational.parse("1.5").toString()).isEqualTo("(3/2)");
    assertThat(RubyRational.parse("0.10").toString()).isEqualTo("(1/10)");
    assertThat(RubyRational.parse("0x1f").toString()).isEqualTo("(31/1)");
    assertThat(RubyRational.parse("1_000").toString()).isEqualTo("(1000/1)");
    assertThat(RubyRational.of(BigInteger.valueOf(4), BigInteger.valueOf(-6)).toString())
        .isEqualTo("(-2/3)");
  }

  @Test
  public void testRationalRejectsNonPositiveDenominator() {
    assertThrows(IllegalArgumentException.class,
        () -> new RubyRational(BigInteger.ONE, BigInteger.ZERO));
  }

  @Test
  public void testComplexInspect() {
    assertThat(RubyComplex.parse("1i").toString()).isEqualTo("(0+1i)");
    assertThat(RubyComplex.parse("2.5i").toString()).isEqualTo("(0+2.5i)");
    assertThat(RubyComplex.parse("1.5ri").toString()).isEqualTo("(0+(3/2)*i)");
    assertThat(RubyComplex.parse("0x10i").toString()).isEqualTo("(0+16i)");
  }

  @Test
  public void testNegate() {
    assertThat(NumericValues.negate(BigInteger.TEN)).isEqualTo(BigInteger.valueOf(-10));
    assertThat(NumericValues.negate(2.5)).isEqualTo(-2.5);
    assertThat(NumericValues.negate(RubyRational.parse("1.5")).toString()).isEqualTo("(-3/2)");
    assertThat(NumericValues.negate(RubyComplex.parse("1i")).toString()).isEqualTo("(0-1i)");
    assertThat(NumericValues.negate(RubyComplex.parse("0.0i")).toString())
        .isEqualTo("(0-0.0i)");
    assertThrows(IllegalArgumentException.class, () -> NumericValues.negate("1"));
  }

  @Test
  public void testDecimalFraction() {
    assertThat(NumericValues.isDecimalFraction("1.5")).isTrue();
    assertThat(NumericValues.isDecimalFraction("1e3")).isTrue();
    assertThat(NumericValues.isDecimalFraction("0e1")).isTrue();
    assertThat(NumericValues.isDecimalFraction("0xe1")).isFalse();
    assertThat(NumericValues.isDecimalFraction("12")).isFalse();
  }
}
