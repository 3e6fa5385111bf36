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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.syntaxtree.ast.SyntaxNode;
import org.syntaxtree.ast.SyntaxNode.Alias;
import org.syntaxtree.ast.SyntaxNode.ArgStar;
import org.syntaxtree.ast.SyntaxNode.Assign;
import org.syntaxtree.ast.SyntaxNode.Assoc;
import org.syntaxtree.ast.SyntaxNode.Backref;
import org.syntaxtree.ast.SyntaxNode.Binary;
import org.syntaxtree.ast.SyntaxNode.CallNode;
import org.syntaxtree.ast.SyntaxNode.ConstPathRef;
import org.syntaxtree.ast.SyntaxNode.DefNode;
import org.syntaxtree.ast.SyntaxNode.DynaSymbol;
import org.syntaxtree.ast.SyntaxNode.HashLiteral;
import org.syntaxtree.ast.SyntaxNode.Ident;
import org.syntaxtree.ast.SyntaxNode.Imaginary;
import org.syntaxtree.ast.SyntaxNode.MAssign;
import org.syntaxtree.ast.SyntaxNode.MRHS;
import org.syntaxtree.ast.SyntaxNode.Program;
import org.syntaxtree.ast.SyntaxNode.RationalLiteral;
import org.syntaxtree.ast.SyntaxNode.RescueMod;
import org.syntaxtree.ast.SyntaxNode.SymbolLiteral;
import org.syntaxtree.ast.SyntaxNode.VCall;
import org.syntaxtree.ast.SyntaxNode.VarAlias;
import org.syntaxtree.ast.SyntaxNode.VarField;
import org.syntaxtree.ast.SyntaxNode.VarRef;

@RunWith(JUnit4.class)
public final class SyntaxTreeParserTest {
  private final PrimaryParser parser = SyntaxTreeParser.create();

  private List<SyntaxNode> statements(String source) {
    Program program = parser.parse(source);
    return program.statements().body();
  }

  private SyntaxNode statement(String source) {
    List<SyntaxNode> body = statements(source);
    assertThat(body).hasSize(1);
    return body.get(0);
  }

  @Test
  public void testProgramCoversTheWholeSource() {
    Program program = parser.parse("foo\n");
    assertThat(program.location().beginPos()).isEqualTo(0);
    assertThat(program.location().endPos()).isEqualTo(4);
  }

  @Test
  public void testEmptyProgram() {
    assertThat(statements("\n")).isEmpty();
  }

  @Test
  public void testUnassignedIdentifierIsAVCall() {
    assertThat(statement("foo")).isInstanceOf(VCall.class);
  }

  @Test
  public void testAssignedIdentifierIsAVarRef() {
    List<SyntaxNode> body = statements("foo = 1; foo");
    assertThat(body).hasSize(2);
    Assign assign = (Assign) body.get(0);
    assertThat(assign.target()).isInstanceOf(VarField.class);
    assertThat(body.get(1)).isInstanceOf(VarRef.class);
  }

  @Test
  public void testLocalsDoNotLeakOutOfDef() {
    List<SyntaxNode> body = statements("def f(a); a; end; a");
    assertThat(body.get(1)).isInstanceOf(VCall.class);
  }

  @Test
  public void testBinaryPrecedence() {
    Binary sum = (Binary) statement("1 + 2 * 3");
    assertThat(sum.operator()).isEqualTo("+");
    assertThat(sum.right()).isInstanceOf(Binary.class);
    assertThat(((Binary) sum.right()).operator()).isEqualTo("*");
  }

  @Test
  public void testPowerIsRightAssociative() {
    Binary power = (Binary) statement("a ** b ** c");
    assertThat(power.right()).isInstanceOf(Binary.class);
  }

  @Test
  public void testAliasOfBareNames() {
    Alias alias = (Alias) statement("alias foo bar");
    SymbolLiteral left = (SymbolLiteral) alias.left();
    assertThat(left.value()).isInstanceOf(Ident.class);
    assertThat(((Ident) left.value()).value()).isEqualTo("foo");
    assertThat(alias.location().endPos()).isEqualTo(13);
  }

  @Test
  public void testAliasOfSymbolsExcludesTheColonFromTheName() {
    Alias alias = (Alias) statement("alias :foo :bar");
    SymbolLiteral left = (SymbolLiteral) alias.left();
    assertThat(left.location().beginPos()).isEqualTo(6);
    assertThat(left.value().location().beginPos()).isEqualTo(7);
  }

  @Test
  public void testGlobalAliasIsAVarAlias() {
    VarAlias alias = (VarAlias) statement("alias $foo $bar");
    assertThat(alias.left().value()).isEqualTo("$foo");
    assertThat(alias.right().value()).isEqualTo("$bar");
  }

  @Test
  public void testSetterDefinitionNameIncludesEquals() {
    DefNode def = (DefNode) statement("def foo=(value); end");
    assertThat(((Ident) def.name()).value()).isEqualTo("foo=");
  }

  @Test
  public void testEndlessDefinition() {
    DefNode def = (DefNode) statement("def foo = 42");
    assertThat(def.endless()).isTrue();
    assertThat(def.bodystmt()).isInstanceOf(SyntaxNode.Int.class);
  }

  @Test
  public void testErrorCarriesThePosition() {
    ParseException e = assertThrows(ParseException.class, () -> parser.parse("foo(\n  )]"));
    assertThat(e.getLine()).isEqualTo(2);
    assertThat(e.getDetails()).isEqualTo("unexpected ']'");
  }

  @Test
  public void testAssignmentToKeywordIsAnError() {
    ParseException e = assertThrows(ParseException.class, () -> parser.parse("self = 1"));
    assertThat(e.getDetails()).isEqualTo("Can't assign to self");
  }

  @Test
  public void testRescueModifierOnAssignmentRescuesTheValue() {
    Assign assign = (Assign) statement("x = 1 rescue 2");
    assertThat(assign.value()).isInstanceOf(RescueMod.class);
    assertThat(assign.location().endPos()).isEqualTo(14);
    assertThat(statement("foo rescue bar")).isInstanceOf(RescueMod.class);
  }

  @Test
  public void testMultipleAssignment() {
    MAssign assign = (MAssign) statement("a, *b = 1, 2");
    assertThat(assign.target().parts()).hasSize(2);
    assertThat(assign.target().parts().get(0)).isInstanceOf(VarField.class);
    ArgStar splat = (ArgStar) assign.target().parts().get(1);
    assertThat(splat.value()).isInstanceOf(VarField.class);
    assertThat(assign.value()).isInstanceOf(MRHS.class);
    assertThat(((MRHS) assign.value()).parts()).hasSize(2);

    List<SyntaxNode> body = statements("a, b = c; b");
    assertThat(((MAssign) body.get(0)).value()).isInstanceOf(VCall.class);
    assertThat(body.get(1)).isInstanceOf(VarRef.class);
  }

  @Test
  public void testSplatValueIsAnMrhs() {
    Assign assign = (Assign) statement("a = *b");
    MRHS value = (MRHS) assign.value();
    assertThat(value.parts()).hasSize(1);
    assertThat(value.parts().get(0)).isInstanceOf(ArgStar.class);
    assertThat(((Assign) statement("a = 1, 2")).value()).isInstanceOf(MRHS.class);
  }

  @Test
  public void testRegexpReferences() {
    VarRef nth = (VarRef) statement("$1");
    assertThat(nth.value()).isInstanceOf(Backref.class);
    assertThat(((Backref) nth.value()).value()).isEqualTo("$1");
  }

  @Test
  public void testNumericLiterals() {
    assertThat(statement("1.5r")).isInstanceOf(RationalLiteral.class);
    assertThat(statement("2i")).isInstanceOf(Imaginary.class);
    assertThat(((Imaginary) statement("1ri")).value()).isEqualTo("1ri");
  }

  @Test
  public void testDoubleColonCallIsACallNode() {
    CallNode call = (CallNode) statement("foo::bar");
    assertThat(call.operator().value()).isEqualTo("::");
    assertThat(statement("Foo::Bar")).isInstanceOf(ConstPathRef.class);
  }

  @Test
  public void testQuotedLabelKeyIsADynaSymbol() {
    HashLiteral hash = (HashLiteral) statement("{'b': 2}");
    Assoc assoc = (Assoc) hash.assocs().get(0);
    DynaSymbol key = (DynaSymbol) assoc.key();
    assertThat(key.quote()).isEqualTo("'");
    assertThat(key.location().beginPos()).isEqualTo(1);
    assertThat(key.location().endPos()).isEqualTo(5);
  }
}
