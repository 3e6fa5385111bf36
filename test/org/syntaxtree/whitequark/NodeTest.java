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

import java.math.BigInteger;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.syntaxtree.source.SourceBuffer;

@RunWith(JUnit4.class)
public final class NodeTest {
  private final SourceBuffer buffer = new SourceBuffer("foo 1\n");

  private Node send(int intStart) {
    Node argument = Node.of(NodeType.INT,
        SourceMap.operator(null, buffer.range(intStart, intStart + 1)), BigInteger.ONE);
    return Node.of(NodeType.SEND,
        SourceMap.send(null, buffer.range(0, 3), null, null, buffer.range(0, 5)),
        null, RubySymbol.of("foo"), argument);
  }

  @Test
  public void testSexp() {
    assertThat(send(4).toSexp()).isEqualTo("(send nil :foo\n  (int 1))");
  }

  @Test
  public void testEqualityIgnoresLocations() {
    assertThat(send(4)).isEqualTo(send(3));
    assertThat(send(4).hashCode()).isEqualTo(send(3).hashCode());
    assertThat(send(4).isEquivalentTo(send(3), false)).isTrue();
    assertThat(send(4).isEquivalentTo(send(3), true)).isFalse();
    assertThat(send(4).isEquivalentTo(send(4), true)).isTrue();
  }

  @Test
  public void testUpdated() {
    Node node = send(4);
    Node csend = node.updated(NodeType.CSEND, null, null);
    assertThat(csend.getType()).isEqualTo(NodeType.CSEND);
    assertThat(csend.getChildren()).isEqualTo(node.getChildren());
    assertThat(csend.getLocation()).isEqualTo(node.getLocation());
  }

  @Test
  public void testNodeChildrenSkipValues() {
    assertThat(send(4).getNodeChildren()).hasSize(1);
    assertThat(send(4).getChildCount()).isEqualTo(3);
  }

  @Test
  public void testInspectString() {
    assertThat(Node.inspectString("a\"b\\c\n")).isEqualTo("\"a\\\"b\\\\c\\n\"");
    assertThat(Node.inspectString("#{x} #y")).isEqualTo("\"\\#{x} #y\"");
    assertThat(Node.inspectString("\u0001")).isEqualTo("\"\\x01\"");
  }

  @Test
  public void testInspectFloat() {
    assertThat(Node.inspect(1.5)).isEqualTo("1.5");
    assertThat(Node.inspect(1.0e20)).isEqualTo("1.0e+20");
    assertThat(Node.inspect(Double.POSITIVE_INFINITY)).isEqualTo("Infinity");
  }

  @Test
  public void testInspectSymbols() {
    assertThat(Node.inspect(RubySymbol.of("foo"))).isEqualTo(":foo");
    assertThat(Node.inspect(RubySymbol.of("foo="))).isEqualTo(":foo=");
    assertThat(Node.inspect(RubySymbol.of("<=>"))).isEqualTo(":<=>");
    assertThat(Node.inspect(RubySymbol.of("foo bar"))).isEqualTo(":\"foo bar\"");
    assertThat(Node.inspect(RubySymbol.of("$&"))).isEqualTo(":$&");
    assertThat(Node.inspect(RubySymbol.of("$`"))).isEqualTo(":$`");
    assertThat(Node.inspect(RubySymbol.of("$-w"))).isEqualTo(":$-w");
    assertThat(Node.inspect(RubySymbol.of("$%"))).isEqualTo(":\"$%\"");
    assertThat(Node.inspect(null)).isEqualTo("nil");
  }
}
