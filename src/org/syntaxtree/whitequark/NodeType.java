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

/** The node types of the parser gem's AST, named as the gem prints them. */
public enum NodeType {
  // Literals
  INT("int"),
  FLOAT("float"),
  RATIONAL("rational"),
  COMPLEX("complex"),
  STR("str"),
  DSTR("dstr"),
  SYM("sym"),
  DSYM("dsym"),
  REGEXP("regexp"),
  REGOPT("regopt"),
  ARRAY("array"),
  HASH("hash"),
  KWARGS("kwargs"),
  PAIR("pair"),
  KWSPLAT("kwsplat"),
  IRANGE("irange"),
  ERANGE("erange"),
  NIL("nil"),
  TRUE("true"),
  FALSE("false"),
  SELF("self"),

  // Variables and constants
  LVAR("lvar"),
  IVAR("ivar"),
  GVAR("gvar"),
  CVAR("cvar"),
  NTH_REF("nth_ref"),
  BACK_REF("back_ref"),
  CONST("const"),
  CBASE("cbase"),
  LVASGN("lvasgn"),
  IVASGN("ivasgn"),
  GVASGN("gvasgn"),
  CVASGN("cvasgn"),
  CASGN("casgn"),
  OP_ASGN("op_asgn"),
  OR_ASGN("or_asgn"),
  AND_ASGN("and_asgn"),
  MASGN("masgn"),
  MLHS("mlhs"),

  // Calls
  SEND("send"),
  CSEND("csend"),
  INDEX("index"),
  INDEXASGN("indexasgn"),
  SPLAT("splat"),
  BLOCK_PASS("block_pass"),
  FORWARDED_ARGS("forwarded_args"),
  BLOCK("block"),
  LAMBDA("lambda"),
  MATCH_WITH_LVASGN("match_with_lvasgn"),

  // Operators
  AND("and"),
  OR("or"),
  DEFINED("defined?"),

  // Grouping and bodies
  BEGIN("begin"),
  KWBEGIN("kwbegin"),
  RESCUE("rescue"),
  RESBODY("resbody"),
  ENSURE("ensure"),

  // Control flow
  IF("if"),
  WHILE("while"),
  UNTIL("until"),
  WHILE_POST("while_post"),
  UNTIL_POST("until_post"),
  FOR("for"),
  CASE("case"),
  WHEN("when"),
  RETURN("return"),
  BREAK("break"),
  NEXT("next"),
  REDO("redo"),
  RETRY("retry"),
  YIELD("yield"),
  SUPER("super"),
  ZSUPER("zsuper"),

  // Definitions
  DEF("def"),
  DEFS("defs"),
  CLASS("class"),
  SCLASS("sclass"),
  MODULE("module"),
  ARGS("args"),
  ARG("arg"),
  OPTARG("optarg"),
  RESTARG("restarg"),
  KWARG("kwarg"),
  KWOPTARG("kwoptarg"),
  KWRESTARG("kwrestarg"),
  BLOCKARG("blockarg"),
  SHADOWARG("shadowarg"),
  PROCARG0("procarg0"),
  FORWARD_ARG("forward_arg"),
  /** The pre-3.1 form of a parameter list that is only {@code (...)}. */
  FORWARD_ARGS("forward_args"),

  // Aliases
  ALIAS("alias"),
  UNDEF("undef");

  private final String name;

  NodeType(String name) {
    this.name = name;
  }

  /** The name the parser gem uses, e.g. {@code op_asgn} or {@code defined?}. */
  public String getName() {
    return name;
  }

  /** Whether nodes of this type assign to a variable or constant. */
  public boolean isAssignment() {
    switch (this) {
      case LVASGN:
      case IVASGN:
      case GVASGN:
      case CVASGN:
      case CASGN:
        return true;
      default:
        return false;
    }
  }

  @Override
  public String toString() {
    return name;
  }
}
