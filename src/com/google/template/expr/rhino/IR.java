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

import static com.google.common.base.Preconditions.checkState;

/** An AST construction helper class */
public class IR {

  private IR() {}

  public static Node empty() {
    return new Node(Token.EMPTY);
  }

  public static Node name(String name) {
    return Node.newString(Token.NAME, name);
  }

  public static Node propertyName(String name) {
    return Node.newString(Token.PROPERTY_NAME, name);
  }

  public static Node string(String value) {
    return Node.newString(Token.STRINGLIT, value);
  }

  public static Node number(double d) {
    return Node.newNumber(d);
  }

  public static Node root(Node child) {
    return new Node(Token.ROOT, child);
  }

  public static Node function(Node name, Node params, Node body) {
    checkState(name.isName() || name.isEmpty(), name);
    checkState(params.isParamList(), params);
    checkState(body.isBlock(), body);
    return new Node(Token.FUNCTION, name, params, body);
  }

  public static Node arrowFunction(Node params, Node body) {
    checkState(params.isParamList(), params);
    checkState(body.isBlock() || mayBeExpression(body), body);
    Node func = new Node(Token.FUNCTION, empty(), params, body);
    func.setIsArrowFunction(true);
    return func;
  }

  public static Node paramList() {
    return new Node(Token.PARAM_LIST);
  }

  public static Node block() {
    return new Node(Token.BLOCK);
  }

  public static Node returnNode() {
    return new Node(Token.RETURN);
  }

  public static Node returnNode(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.RETURN, expr);
  }

  public static Node exprResult(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.EXPR_RESULT, expr);
  }

  public static Node getprop(Node target, Node prop) {
    checkState(mayBeExpression(target), target);
    checkState(prop.getToken() == Token.PROPERTY_NAME, prop);
    return new Node(Token.GETPROP, target, prop);
  }

  public static Node getelem(Node target, Node elem) {
    checkState(mayBeExpression(target), target);
    checkState(mayBeExpression(elem), elem);
    return new Node(Token.GETELEM, target, elem);
  }

  public static Node objectlit(Node... propdefs) {
    Node objectlit = new Node(Token.OBJECTLIT);
    for (Node propdef : propdefs) {
      checkState(mayBeObjectLitKey(propdef), propdef);
      objectlit.addChildToBack(propdef);
    }
    return objectlit;
  }

  public static Node arraylit(Node... exprs) {
    Node arraylit = new Node(Token.ARRAYLIT);
    for (Node expr : exprs) {
      arraylit.addChildToBack(expr);
    }
    return arraylit;
  }

  public static Node stringKey(String key, Node value) {
    Node stringKey = Node.newString(Token.STRING_KEY, key);
    stringKey.addChildToBack(value);
    return stringKey;
  }

  public static Node computedProp(Node key, Node value) {
    return new Node(Token.COMPUTED_PROP, key, value);
  }

  public static Node defaultValue(Node target, Node value) {
    checkState(target.isName() || target.isDestructuringPattern(), target);
    checkState(mayBeExpression(value), value);
    return new Node(Token.DEFAULT_VALUE, target, value);
  }

  public static Node hook(Node cond, Node trueval, Node falseval) {
    return new Node(Token.HOOK, cond, trueval, falseval);
  }

  static boolean mayBeObjectLitKey(Node n) {
    switch (n.getToken()) {
      case STRING_KEY:
      case COMPUTED_PROP:
      case MEMBER_FUNCTION_DEF:
      case OBJECT_SPREAD:
        return true;
      default:
        return false;
    }
  }

  /** It isn't possible to always determine if a detached node is a expression, so just reject known statements. */
  static boolean mayBeExpression(Node n) {
    switch (n.getToken()) {
      case BLOCK:
      case RETURN:
      case EXPR_RESULT:
      case VAR:
      case LET:
      case CONST:
      case IF:
      case ROOT:
      case PARAM_LIST:
      case STRING_KEY:
      case COMPUTED_PROP:
      case MEMBER_FUNCTION_DEF:
      case PROPERTY_NAME:
      case DEFAULT_VALUE:
      case ARRAY_PATTERN:
      case OBJECT_PATTERN:
      case ITER_REST:
      case OBJECT_REST:
      case EMPTY:
        return false;
      default:
        return true;
    }
  }
}
