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
package org.syntaxtree.ast;

/**
 * One method per {@link SyntaxNode} kind. A class implementing this interface covers every kind,
 * which the compiler checks.
 *
 * @param <R> the result of visiting a node
 */
public interface Visitor<R> {
  R visitIdent(SyntaxNode.Ident node);

  R visitConst(SyntaxNode.Const node);

  R visitIVar(SyntaxNode.IVar node);

  R visitGVar(SyntaxNode.GVar node);

  R visitBackref(SyntaxNode.Backref node);

  R visitCVar(SyntaxNode.CVar node);

  R visitKw(SyntaxNode.Kw node);

  R visitOp(SyntaxNode.Op node);

  R visitLabel(SyntaxNode.Label node);

  R visitTStringContent(SyntaxNode.TStringContent node);

  R visitInt(SyntaxNode.Int node);

  R visitFloat(SyntaxNode.FloatLiteral node);

  R visitRational(SyntaxNode.RationalLiteral node);

  R visitImaginary(SyntaxNode.Imaginary node);

  R visitStringLiteral(SyntaxNode.StringLiteral node);

  R visitStringEmbExpr(SyntaxNode.StringEmbExpr node);

  R visitStringConcat(SyntaxNode.StringConcat node);

  R visitSymbolLiteral(SyntaxNode.SymbolLiteral node);

  R visitDynaSymbol(SyntaxNode.DynaSymbol node);

  R visitArrayLiteral(SyntaxNode.ArrayLiteral node);

  R visitHashLiteral(SyntaxNode.HashLiteral node);

  R visitBareAssocHash(SyntaxNode.BareAssocHash node);

  R visitAssoc(SyntaxNode.Assoc node);

  R visitAssocSplat(SyntaxNode.AssocSplat node);

  R visitRange(SyntaxNode.RangeNode node);

  R visitRegexpLiteral(SyntaxNode.RegexpLiteral node);

  R visitVarRef(SyntaxNode.VarRef node);

  R visitVCall(SyntaxNode.VCall node);

  R visitVarField(SyntaxNode.VarField node);

  R visitConstRef(SyntaxNode.ConstRef node);

  R visitConstPathRef(SyntaxNode.ConstPathRef node);

  R visitConstPathField(SyntaxNode.ConstPathField node);

  R visitTopConstRef(SyntaxNode.TopConstRef node);

  R visitTopConstField(SyntaxNode.TopConstField node);

  R visitCall(SyntaxNode.CallNode node);

  R visitFCall(SyntaxNode.FCall node);

  R visitCommand(SyntaxNode.Command node);

  R visitCommandCall(SyntaxNode.CommandCall node);

  R visitArgParen(SyntaxNode.ArgParen node);

  R visitArgs(SyntaxNode.Args node);

  R visitArgStar(SyntaxNode.ArgStar node);

  R visitArgBlock(SyntaxNode.ArgBlock node);

  R visitArgsForward(SyntaxNode.ArgsForward node);

  R visitARef(SyntaxNode.ARef node);

  R visitARefField(SyntaxNode.ARefField node);

  R visitField(SyntaxNode.Field node);

  R visitMethodAddBlock(SyntaxNode.MethodAddBlock node);

  R visitBlock(SyntaxNode.BlockNode node);

  R visitBlockVar(SyntaxNode.BlockVar node);

  R visitLambda(SyntaxNode.Lambda node);

  R visitLambdaVar(SyntaxNode.LambdaVar node);

  R visitBinary(SyntaxNode.Binary node);

  R visitUnary(SyntaxNode.Unary node);

  R visitNot(SyntaxNode.Not node);

  R visitAssign(SyntaxNode.Assign node);

  R visitOpAssign(SyntaxNode.OpAssign node);

  R visitMAssign(SyntaxNode.MAssign node);

  R visitMLHS(SyntaxNode.MLHS node);

  R visitMRHS(SyntaxNode.MRHS node);

  R visitDefined(SyntaxNode.Defined node);

  R visitIf(SyntaxNode.IfNode node);

  R visitUnless(SyntaxNode.UnlessNode node);

  R visitElsif(SyntaxNode.Elsif node);

  R visitElse(SyntaxNode.Else node);

  R visitIfOp(SyntaxNode.IfOp node);

  R visitWhile(SyntaxNode.WhileNode node);

  R visitUntil(SyntaxNode.UntilNode node);

  R visitFor(SyntaxNode.For node);

  R visitCase(SyntaxNode.Case node);

  R visitWhen(SyntaxNode.When node);

  R visitParen(SyntaxNode.Paren node);

  R visitDef(SyntaxNode.DefNode node);

  R visitParams(SyntaxNode.Params node);

  R visitRestParam(SyntaxNode.RestParam node);

  R visitKwRestParam(SyntaxNode.KwRestParam node);

  R visitBlockArg(SyntaxNode.BlockArg node);

  R visitClass(SyntaxNode.ClassDeclaration node);

  R visitSClass(SyntaxNode.SClass node);

  R visitModule(SyntaxNode.ModuleDeclaration node);

  R visitProgram(SyntaxNode.Program node);

  R visitStatements(SyntaxNode.Statements node);

  R visitBodyStmt(SyntaxNode.BodyStmt node);

  R visitBegin(SyntaxNode.Begin node);

  R visitRescue(SyntaxNode.Rescue node);

  R visitRescueEx(SyntaxNode.RescueEx node);

  R visitEnsure(SyntaxNode.Ensure node);

  R visitRescueMod(SyntaxNode.RescueMod node);

  R visitReturn(SyntaxNode.ReturnNode node);

  R visitBreak(SyntaxNode.Break node);

  R visitNext(SyntaxNode.Next node);

  R visitRedo(SyntaxNode.Redo node);

  R visitRetry(SyntaxNode.Retry node);

  R visitYield(SyntaxNode.YieldNode node);

  R visitSuper(SyntaxNode.Super node);

  R visitZSuper(SyntaxNode.ZSuper node);

  R visitAlias(SyntaxNode.Alias node);

  R visitVarAlias(SyntaxNode.VarAlias node);

  R visitUndef(SyntaxNode.Undef node);
}
