/*
 * Copyright 2026 The Closure Compiler Authors.
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

package com.google.template.expr.rhino;

/**
 * The node types of the expression AST.
 *
 * <p>Every {@link Node} carries exactly one of these. Consumers switch over the token instead of
 * dispatching on node classes.
 */
public enum Token {
  // Operators
  BITOR,
  BITXOR,
  BITAND,
  EQ,
  NE,
  LT,
  LE,
  GT,
  GE,
  LSH,
  RSH,
  URSH,
  ADD,
  SUB,
  MUL,
  DIV,
  MOD,
  EXPONENT,
  NOT,
  BITNOT,
  POS,
  NEG,
  NEW,
  DELPROP,
  TYPEOF,
  VOID,
  SHEQ, // ===
  SHNE, // !==
  IN,
  INSTANCEOF,
  OR, // ||
  AND, // &&
  COALESCE, // ??
  INC, // ++
  DEC, // --
  HOOK, // conditional (?:)
  COMMA, // comma operator

  ASSIGN, // simple assignment  (=)
  ASSIGN_BITOR, // |=
  ASSIGN_BITXOR, // ^=
  ASSIGN_BITAND, // &=
  ASSIGN_LSH, // <<=
  ASSIGN_RSH, // >>=
  ASSIGN_URSH, // >>>=
  ASSIGN_ADD, // +=
  ASSIGN_SUB, // -=
  ASSIGN_MUL, // *=
  ASSIGN_DIV, // /=
  ASSIGN_MOD, // %=
  ASSIGN_EXPONENT, // **=
  ASSIGN_OR, // ||=
  ASSIGN_AND, // &&=
  ASSIGN_COALESCE, // ??=

  // Member access and calls
  GETPROP,
  GETELEM,
  CALL,
  OPTCHAIN_GETPROP,
  OPTCHAIN_GETELEM,
  OPTCHAIN_CALL,
  PROPERTY_NAME, // the non-computed name in a GETPROP

  // Primaries
  NAME,
  NUMBER,
  BIGINT,
  STRINGLIT,
  TEMPLATELIT,
  TEMPLATELIT_STRING,
  TEMPLATELIT_SUB,
  REGEXP,
  NULL,
  THIS,
  SUPER,
  FALSE,
  TRUE,

  // Literals
  ARRAYLIT,
  OBJECTLIT,
  STRING_KEY, // object literal or pattern key
  COMPUTED_PROP, // [key]: value
  MEMBER_FUNCTION_DEF, // method shorthand
  ITER_SPREAD, // ...x in an array literal or call
  OBJECT_SPREAD, // ...x in an object literal
  EMPTY, // array holes and anonymous function names

  // Functions and patterns
  FUNCTION,
  PARAM_LIST,
  DEFAULT_VALUE,
  ARRAY_PATTERN,
  OBJECT_PATTERN,
  ITER_REST,
  OBJECT_REST,

  // Statements, only inside function bodies
  BLOCK,
  RETURN,
  EXPR_RESULT,
  VAR,
  LET,
  CONST,
  DESTRUCTURING_LHS,
  IF,

  // Top level container produced by the parser
  ROOT,

  // Lexer-only tokens, never found in a finished tree
  EOF,
  ERROR,
  LP, // (
  RP, // )
  LB, // [
  RB, // ]
  LC, // {
  RC, // }
  DOT,
  OPTCHAIN, // ?.
  COLON,
  SEMI,
  ARROW, // =>
  ELLIPSIS, // ...
  HOOK_TOKEN, // ?
  TEMPLATE_START, // `
  KEYWORD;

  /** Whether this token is an assignment operator. */
  public boolean isAssign() {
    switch (this) {
      case ASSIGN:
      case ASSIGN_BITOR:
      case ASSIGN_BITXOR:
      case ASSIGN_BITAND:
      case ASSIGN_LSH:
      case ASSIGN_RSH:
      case ASSIGN_URSH:
      case ASSIGN_ADD:
      case ASSIGN_SUB:
      case ASSIGN_MUL:
      case ASSIGN_DIV:
      case ASSIGN_MOD:
      case ASSIGN_EXPONENT:
      case ASSIGN_OR:
      case ASSIGN_AND:
      case ASSIGN_COALESCE:
        return true;
      default:
        return false;
    }
  }
}
