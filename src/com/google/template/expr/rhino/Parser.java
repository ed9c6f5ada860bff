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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * This class implements the expression parser.
 *
 * <p>The parser accepts a single expression (or a function declaration, which is handled like a
 * named function expression), or a single binding pattern. Statements are only accepted inside
 * function bodies. The first syntax error is reported to the {@link ErrorReporter} and aborts the
 * parse; the parse methods then return null.
 *
 * @see TokenStream
 */
public class Parser {

  // Exception to unwind
  private static class ParserException extends RuntimeException {
    private static final long serialVersionUID = 5882582646773765630L;
  }

  // Bounds the recursion of the parser and of the tree walks over its output.
  static final int MAX_NESTING_DEPTH = 256;

  private final TokenStream ts;
  private final ErrorReporter errorReporter;

  private @Nullable Token currentToken;
  private int lastTokenEnd;
  private int syntaxErrorCount;
  private int nestingDepth;

  public Parser(String sourceString, ErrorReporter errorReporter) {
    this.ts = new TokenStream(sourceString);
    this.errorReporter = checkNotNull(errorReporter);
  }

  public int getSyntaxErrorCount() {
    return syntaxErrorCount;
  }

  /**
   * Parses the whole source as one expression.
   *
   * @return a ROOT node whose only child is the expression, or null after a syntax error
   */
  public @Nullable Node parseExpression() {
    try {
      Node pn = expr();
      mustBeAtEnd();
      return IR.root(pn).srcref(pn);
    } catch (ParserException e) {
      return null;
    }
  }

  /**
   * Parses the whole source as one binding target, optionally with a default value: a name, an
   * array pattern or an object pattern.
   *
   * @return a ROOT node whose only child is the target, or null after a syntax error
   */
  public @Nullable Node parseBindingPattern() {
    try {
      Node pn = bindingElement();
      mustBeAtEnd();
      return IR.root(pn).srcref(pn);
    } catch (ParserException e) {
      return null;
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Token handling

  private Token peekToken() {
    if (currentToken == null) {
      Token tt = ts.getToken();
      if (tt == Token.ERROR) {
        reportError(checkNotNull(ts.getErrorMessage()), ts.getTokenBeg());
      }
      currentToken = tt;
    }
    return currentToken;
  }

  private void consumeToken() {
    checkState(currentToken != null, "no token to consume");
    currentToken = null;
    lastTokenEnd = ts.getTokenEnd();
  }

  private Token nextToken() {
    Token tt = peekToken();
    consumeToken();
    return tt;
  }

  private boolean matchToken(Token toMatch) {
    if (peekToken() != toMatch) {
      return false;
    }
    consumeToken();
    return true;
  }

  private void mustMatchToken(Token toMatch, String message) {
    if (!matchToken(toMatch)) {
      reportError(message, ts.getTokenBeg());
    }
  }

  /** Offset of the first character of the token returned by the last {@link #peekToken()}. */
  private int peekedTokenBeg() {
    peekToken();
    return ts.getTokenBeg();
  }

  private void mustBeAtEnd() {
    if (peekToken() != Token.EOF) {
      reportUnexpected();
    }
  }

  private void reportUnexpected() {
    Token tt = peekToken();
    int beg = ts.getTokenBeg();
    if (tt == Token.EOF) {
      reportError("Unexpected end of input", beg);
    }
    String text = ts.getSourceString().substring(beg, ts.getTokenEnd());
    if (tt == Token.KEYWORD) {
      reportError("Unexpected keyword '" + text + "'", beg);
    }
    reportError("Unexpected token '" + text + "'", beg);
  }

  private void reportError(String message, int offset) {
    ++syntaxErrorCount;
    errorReporter.error(message, offset);
    throw new ParserException();
  }

  private void enterNesting() {
    if (++nestingDepth > MAX_NESTING_DEPTH) {
      reportError("Expression nested too deeply", peekedTokenBeg());
    }
  }

  private void exitNesting() {
    nestingDepth--;
  }

  private Node finish(Node n, int start) {
    return n.setSourceRange(start, lastTokenEnd);
  }

  /** Whether the token can be used where an identifier name (a property name) is expected. */
  private boolean isIdentifierName(Token tt) {
    switch (tt) {
      case NAME:
      case KEYWORD:
      case TYPEOF:
      case VOID:
      case DELPROP:
      case NEW:
      case IN:
      case INSTANCEOF:
      case THIS:
      case SUPER:
      case NULL:
      case TRUE:
      case FALSE:
      case FUNCTION:
      case RETURN:
      case VAR:
      case CONST:
      case IF:
        return ts.getString() != null;
      default:
        return false;
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Expressions

  private Node expr() {
    Node pn = assignExpr();
    while (matchToken(Token.COMMA)) {
      int start = pn.getSourceOffset();
      pn = finish(new Node(Token.COMMA, pn, assignExpr()), start);
    }
    return pn;
  }

  private Node assignExpr() {
    enterNesting();
    Node pn = condExpr();
    Token tt = peekToken();
    if (tt.isAssign()) {
      consumeToken();
      int start = pn.getSourceOffset();
      pn = finish(new Node(tt, pn, assignExpr()), start);
    }
    exitNesting();
    return pn;
  }

  private Node condExpr() {
    Node pn = orExpr();
    if (matchToken(Token.HOOK_TOKEN)) {
      int start = pn.getSourceOffset();
      Node ifTrue = assignExpr();
      mustMatchToken(Token.COLON, "Expected ':'");
      Node ifFalse = assignExpr();
      pn = finish(IR.hook(pn, ifTrue, ifFalse), start);
    }
    return pn;
  }

  private Node orExpr() {
    Node pn = andExpr();
    while (true) {
      Token tt = peekToken();
      if (tt != Token.OR && tt != Token.COALESCE) {
        return pn;
      }
      consumeToken();
      pn = binary(tt, pn, andExpr());
    }
  }

  private Node andExpr() {
    Node pn = bitOrExpr();
    while (matchToken(Token.AND)) {
      pn = binary(Token.AND, pn, bitOrExpr());
    }
    return pn;
  }

  private Node bitOrExpr() {
    Node pn = bitXorExpr();
    while (matchToken(Token.BITOR)) {
      pn = binary(Token.BITOR, pn, bitXorExpr());
    }
    return pn;
  }

  private Node bitXorExpr() {
    Node pn = bitAndExpr();
    while (matchToken(Token.BITXOR)) {
      pn = binary(Token.BITXOR, pn, bitAndExpr());
    }
    return pn;
  }

  private Node bitAndExpr() {
    Node pn = eqExpr();
    while (matchToken(Token.BITAND)) {
      pn = binary(Token.BITAND, pn, eqExpr());
    }
    return pn;
  }

  private Node eqExpr() {
    Node pn = relExpr();
    while (true) {
      Token tt = peekToken();
      switch (tt) {
        case EQ:
        case NE:
        case SHEQ:
        case SHNE:
          consumeToken();
          pn = binary(tt, pn, relExpr());
          continue;
        default:
          return pn;
      }
    }
  }

  private Node relExpr() {
    Node pn = shiftExpr();
    while (true) {
      Token tt = peekToken();
      switch (tt) {
        case IN:
        case INSTANCEOF:
        case LE:
        case LT:
        case GE:
        case GT:
          consumeToken();
          pn = binary(tt, pn, shiftExpr());
          continue;
        default:
          return pn;
      }
    }
  }

  private Node shiftExpr() {
    Node pn = addExpr();
    while (true) {
      Token tt = peekToken();
      switch (tt) {
        case LSH:
        case URSH:
        case RSH:
          consumeToken();
          pn = binary(tt, pn, addExpr());
          continue;
        default:
          return pn;
      }
    }
  }

  private Node addExpr() {
    Node pn = mulExpr();
    while (true) {
      Token tt = peekToken();
      if (tt != Token.ADD && tt != Token.SUB) {
        return pn;
      }
      consumeToken();
      pn = binary(tt, pn, mulExpr());
    }
  }

  private Node mulExpr() {
    Node pn = expExpr();
    while (true) {
      Token tt = peekToken();
      switch (tt) {
        case MUL:
        case DIV:
        case MOD:
          consumeToken();
          pn = binary(tt, pn, expExpr());
          continue;
        default:
          return pn;
      }
    }
  }

  // ** is right associative
  private Node expExpr() {
    Node pn = unaryExpr();
    if (matchToken(Token.EXPONENT)) {
      enterNesting();
      pn = binary(Token.EXPONENT, pn, expExpr());
      exitNesting();
    }
    return pn;
  }

  private Node binary(Token type, Node left, Node right) {
    return finish(new Node(type, left, right), left.getSourceOffset());
  }

  private Node unaryExpr() {
    Token tt = peekToken();
    int start = ts.getTokenBeg();
    switch (tt) {
      case NOT:
      case BITNOT:
      case TYPEOF:
      case VOID:
      case DELPROP:
        consumeToken();
        return finish(new Node(tt, nestedUnaryExpr()), start);
      case ADD:
        consumeToken();
        return finish(new Node(Token.POS, nestedUnaryExpr()), start);
      case SUB:
        consumeToken();
        return finish(new Node(Token.NEG, nestedUnaryExpr()), start);
      case INC:
      case DEC:
        {
          consumeToken();
          Node n = finish(new Node(tt, memberExpr(true)), start);
          n.setIsPostfix(false);
          return n;
        }
      default:
        {
          Node pn = memberExpr(true);
          tt = peekToken();
          if ((tt == Token.INC || tt == Token.DEC) && !ts.sawLineTerminator()) {
            consumeToken();
            pn = finish(new Node(tt, pn), pn.getSourceOffset());
            pn.setIsPostfix(true);
          }
          return pn;
        }
    }
  }

  private Node nestedUnaryExpr() {
    enterNesting();
    Node operand = unaryExpr();
    exitNesting();
    return operand;
  }

  private void argumentList(Node listNode) {
    while (!matchToken(Token.RP)) {
      Token tt = peekToken();
      if (tt == Token.EOF) {
        reportError("Expected ')'", ts.getTokenBeg());
      }
      if (tt == Token.ELLIPSIS) {
        int start = ts.getTokenBeg();
        consumeToken();
        listNode.addChildToBack(finish(new Node(Token.ITER_SPREAD, assignExpr()), start));
      } else {
        listNode.addChildToBack(assignExpr());
      }
      if (!matchToken(Token.COMMA)) {
        mustMatchToken(Token.RP, "Expected ')'");
        break;
      }
    }
  }

  private Node memberExpr(boolean allowCallSyntax) {
    Node pn;
    int start = peekedTokenBeg();
    if (matchToken(Token.NEW)) {
      enterNesting();
      Node target = memberExpr(false);
      exitNesting();
      pn = new Node(Token.NEW, target);
      if (matchToken(Token.LP)) {
        argumentList(pn);
      } else {
        pn.setHasNoArguments(true);
      }
      finish(pn, start);
    } else {
      pn = primaryExpr();
    }
    return memberExprTail(allowCallSyntax, pn);
  }

  private Node memberExprTail(boolean allowCallSyntax, Node pn) {
    int start = pn.getSourceOffset();
    while (true) {
      Token tt = peekToken();
      switch (tt) {
        case DOT:
          consumeToken();
          pn = finish(IR.getprop(pn, propertyName()), start);
          break;
        case OPTCHAIN:
          consumeToken();
          if (matchToken(Token.LP)) {
            Node call = new Node(Token.OPTCHAIN_CALL, pn);
            argumentList(call);
            pn = finish(call, start);
          } else if (matchToken(Token.LB)) {
            Node elem = expr();
            mustMatchToken(Token.RB, "Expected ']'");
            pn = finish(new Node(Token.OPTCHAIN_GETELEM, pn, elem), start);
          } else {
            pn = finish(new Node(Token.OPTCHAIN_GETPROP, pn, propertyName()), start);
          }
          break;
        case LB:
          {
            consumeToken();
            Node elem = expr();
            mustMatchToken(Token.RB, "Expected ']'");
            pn = finish(IR.getelem(pn, elem), start);
            break;
          }
        case LP:
          if (!allowCallSyntax) {
            return pn;
          }
          consumeToken();
          Node call = new Node(Token.CALL, pn);
          argumentList(call);
          pn = finish(call, start);
          break;
        default:
          return pn;
      }
    }
  }

  private Node propertyName() {
    Token tt = peekToken();
    if (!isIdentifierName(tt)) {
      reportUnexpected();
    }
    int start = ts.getTokenBeg();
    String name = checkNotNull(ts.getString());
    consumeToken();
    return finish(IR.propertyName(name), start);
  }

  private Node primaryExpr() {
    Token tt = peekToken();
    int start = ts.getTokenBeg();
    switch (tt) {
      case NAME:
        {
          String name = checkNotNull(ts.getString());
          consumeToken();
          Node pn = finish(IR.name(name), start);
          if (peekToken() == Token.ARROW && !ts.sawLineTerminator()) {
            Node params = IR.paramList();
            params.addChildToBack(pn);
            finish(params, start);
            return arrowFunction(params, start);
          }
          return pn;
        }
      case NUMBER:
        {
          double d = ts.getNumber();
          consumeToken();
          return finish(IR.number(d), start);
        }
      case BIGINT:
        {
          String value = checkNotNull(ts.getString());
          consumeToken();
          return finish(Node.newString(Token.BIGINT, value), start);
        }
      case STRINGLIT:
        {
          String value = checkNotNull(ts.getString());
          consumeToken();
          return finish(IR.string(value), start);
        }
      case NULL:
      case THIS:
      case SUPER:
      case FALSE:
      case TRUE:
        consumeToken();
        return finish(new Node(tt), start);
      case DIV:
      case ASSIGN_DIV:
        {
          // Rescan as a regular expression; the buffered operator token is dropped.
          currentToken = null;
          if (ts.readRegExp() == Token.ERROR) {
            reportError(checkNotNull(ts.getErrorMessage()), start);
          }
          lastTokenEnd = ts.getTokenEnd();
          return finish(Node.newString(Token.REGEXP, checkNotNull(ts.getString())), start);
        }
      case LP:
        consumeToken();
        return parenExpr(start);
      case LB:
        consumeToken();
        return arrayLiteral(start);
      case LC:
        consumeToken();
        return objectLiteral(start);
      case FUNCTION:
        consumeToken();
        return function(start);
      case TEMPLATE_START:
        consumeToken();
        return templateLiteral(start);
      default:
        reportUnexpected();
        throw new IllegalStateException("unreachable");
    }
  }

  /** Parses what follows an opening parenthesis: a parenthesized expression or arrow parameters. */
  private Node parenExpr(int start) {
    if (matchToken(Token.RP)) {
      if (peekToken() != Token.ARROW) {
        reportUnexpected();
      }
      return arrowFunction(finish(IR.paramList(), start), start);
    }
    List<Node> items = new ArrayList<>();
    boolean sawSpread = false;
    boolean trailingComma = false;
    while (true) {
      if (peekToken() == Token.ELLIPSIS) {
        int spreadStart = ts.getTokenBeg();
        consumeToken();
        items.add(finish(new Node(Token.ITER_SPREAD, assignExpr()), spreadStart));
        sawSpread = true;
      } else {
        items.add(assignExpr());
      }
      if (!matchToken(Token.COMMA)) {
        break;
      }
      if (peekToken() == Token.RP) {
        trailingComma = true;
        break;
      }
    }
    mustMatchToken(Token.RP, "Expected ')'");

    if (peekToken() == Token.ARROW) {
      Node params = IR.paramList();
      for (Node item : items) {
        params.addChildToBack(toParameter(item, item == items.get(items.size() - 1)));
      }
      return arrowFunction(finish(params, start), start);
    }
    if (sawSpread || trailingComma) {
      reportUnexpected();
    }
    Node pn = items.get(0);
    for (int i = 1; i < items.size(); i++) {
      pn = binary(Token.COMMA, pn, items.get(i));
      pn.setSourceRange(items.get(0).getSourceOffset(), items.get(i).getSourceEnd());
    }
    pn.setIsParenthesized(true);
    return pn;
  }

  private Node arrowFunction(Node params, int start) {
    mustMatchToken(Token.ARROW, "Expected '=>'");
    Node body;
    if (peekToken() == Token.LC) {
      int bodyStart = ts.getTokenBeg();
      consumeToken();
      body = functionBody(bodyStart);
    } else {
      body = assignExpr();
    }
    return finish(IR.arrowFunction(params, body), start);
  }

  private Node arrayLiteral(int start) {
    Node pn = IR.arraylit();
    while (true) {
      Token tt = peekToken();
      if (tt == Token.RB) {
        consumeToken();
        break;
      }
      if (tt == Token.EOF) {
        reportError("Expected ']'", ts.getTokenBeg());
      }
      if (tt == Token.COMMA) {
        int holeStart = ts.getTokenBeg();
        consumeToken();
        pn.addChildToBack(IR.empty().setSourceRange(holeStart, holeStart));
        continue;
      }
      if (tt == Token.ELLIPSIS) {
        int spreadStart = ts.getTokenBeg();
        consumeToken();
        pn.addChildToBack(finish(new Node(Token.ITER_SPREAD, assignExpr()), spreadStart));
      } else {
        pn.addChildToBack(assignExpr());
      }
      if (!matchToken(Token.COMMA)) {
        mustMatchToken(Token.RB, "Expected ']'");
        break;
      }
    }
    return finish(pn, start);
  }

  private Node objectLiteral(int start) {
    Node pn = IR.objectlit();
    while (!matchToken(Token.RC)) {
      Token tt = peekToken();
      int propStart = ts.getTokenBeg();
      if (tt == Token.EOF) {
        reportError("Expected '}'", propStart);
      }
      if (tt == Token.ELLIPSIS) {
        consumeToken();
        pn.addChildToBack(finish(new Node(Token.OBJECT_SPREAD, assignExpr()), propStart));
      } else if (tt == Token.LB) {
        consumeToken();
        Node key = assignExpr();
        mustMatchToken(Token.RB, "Expected ']'");
        Node value;
        if (peekToken() == Token.LP) {
          value = method(ts.getTokenBeg());
        } else {
          mustMatchToken(Token.COLON, "Expected ':'");
          value = assignExpr();
        }
        pn.addChildToBack(finish(IR.computedProp(key, value), propStart));
      } else {
        pn.addChildToBack(objectProperty(propStart));
      }
      if (!matchToken(Token.COMMA)) {
        mustMatchToken(Token.RC, "Expected '}'");
        break;
      }
    }
    return finish(pn, start);
  }

  private Node objectProperty(int start) {
    Token tt = peekToken();
    boolean identifier = isIdentifierName(tt);
    if (!identifier && tt != Token.STRINGLIT && tt != Token.NUMBER) {
      reportUnexpected();
    }
    String key = checkNotNull(ts.getString());
    consumeToken();
    int keyEnd = lastTokenEnd;

    Token next = peekToken();
    if (identifier
        && (key.equals("get") || key.equals("set"))
        && next != Token.COLON
        && next != Token.LP
        && next != Token.COMMA
        && next != Token.RC) {
      // Accessors are kept as plain methods keyed by the accessor name.
      Node accessorKey = objectProperty(ts.getTokenBeg());
      return finish(accessorKey, start);
    }

    Node property;
    if (matchToken(Token.COLON)) {
      property = IR.stringKey(key, assignExpr());
    } else if (next == Token.LP) {
      property = Node.newString(Token.MEMBER_FUNCTION_DEF, key);
      property.addChildToBack(method(ts.getTokenBeg()));
    } else if (tt == Token.NAME) {
      Node value = IR.name(key).setSourceRange(start, keyEnd);
      if (peekToken() == Token.ASSIGN) {
        // `{ a = 1 }` is only meaningful once the literal turns into a pattern.
        consumeToken();
        value = finish(new Node(Token.ASSIGN, value, assignExpr()), start);
      }
      property = IR.stringKey(key, value);
      property.setShorthandProperty(true);
    } else {
      reportUnexpected();
      throw new IllegalStateException("unreachable");
    }
    if (tt == Token.STRINGLIT) {
      property.setQuotedString();
    }
    return finish(property, start);
  }

  private Node method(int start) {
    mustMatchToken(Token.LP, "Expected '('");
    Node params = formalParameters(start);
    int bodyStart = peekedTokenBeg();
    mustMatchToken(Token.LC, "Expected '{'");
    Node body = functionBody(bodyStart);
    return finish(IR.function(IR.empty().setSourceRange(start, start), params, body), start);
  }

  private Node templateLiteral(int start) {
    checkState(currentToken == null);
    Node pn = new Node(Token.TEMPLATELIT);
    while (true) {
      if (ts.readTemplateLiteralPart() == Token.ERROR) {
        reportError(checkNotNull(ts.getErrorMessage()), start);
      }
      lastTokenEnd = ts.getTokenEnd();
      String raw = checkNotNull(ts.getString());
      int partStart = ts.getTokenBeg();
      pn.addChildToBack(
          Node.newString(Token.TEMPLATELIT_STRING, raw)
              .setSourceRange(partStart, partStart + raw.length()));
      if (ts.isTemplateTail()) {
        break;
      }
      int subStart = lastTokenEnd;
      Node sub = expr();
      if (peekToken() != Token.RC) {
        reportError("Expected '}'", ts.getTokenBeg());
      }
      consumeToken();
      pn.addChildToBack(finish(new Node(Token.TEMPLATELIT_SUB, sub), subStart));
    }
    return finish(pn, start);
  }

  // ---------------------------------------------------------------------------------------------
  // Functions and patterns

  private Node function(int start) {
    Node name;
    if (peekToken() == Token.NAME) {
      int nameStart = ts.getTokenBeg();
      String fnName = checkNotNull(ts.getString());
      consumeToken();
      name = finish(IR.name(fnName), nameStart);
    } else {
      name = IR.empty().setSourceRange(lastTokenEnd, lastTokenEnd);
    }
    int paramsStart = peekedTokenBeg();
    mustMatchToken(Token.LP, "Expected '('");
    Node params = formalParameters(paramsStart);
    int bodyStart = peekedTokenBeg();
    mustMatchToken(Token.LC, "Expected '{'");
    Node body = functionBody(bodyStart);
    return finish(IR.function(name, params, body), start);
  }

  /** Parses parameters after the opening parenthesis, up to and including the closing one. */
  private Node formalParameters(int start) {
    Node params = IR.paramList();
    while (!matchToken(Token.RP)) {
      Token tt = peekToken();
      if (tt == Token.EOF) {
        reportError("Expected ')'", ts.getTokenBeg());
      }
      if (tt == Token.ELLIPSIS) {
        int restStart = ts.getTokenBeg();
        consumeToken();
        params.addChildToBack(finish(new Node(Token.ITER_REST, bindingTarget()), restStart));
        mustMatchToken(Token.RP, "Expected ')'");
        break;
      }
      params.addChildToBack(bindingElement());
      if (!matchToken(Token.COMMA)) {
        mustMatchToken(Token.RP, "Expected ')'");
        break;
      }
    }
    return finish(params, start);
  }

  private Node bindingElement() {
    enterNesting();
    Node target = bindingTarget();
    if (matchToken(Token.ASSIGN)) {
      int start = target.getSourceOffset();
      target = finish(IR.defaultValue(target, assignExpr()), start);
    }
    exitNesting();
    return target;
  }

  private Node bindingTarget() {
    Token tt = peekToken();
    int start = ts.getTokenBeg();
    switch (tt) {
      case NAME:
        {
          String name = checkNotNull(ts.getString());
          consumeToken();
          return finish(IR.name(name), start);
        }
      case LB:
        consumeToken();
        return arrayPattern(start);
      case LC:
        consumeToken();
        return objectPattern(start);
      default:
        reportUnexpected();
        throw new IllegalStateException("unreachable");
    }
  }

  private Node arrayPattern(int start) {
    Node pn = new Node(Token.ARRAY_PATTERN);
    while (!matchToken(Token.RB)) {
      Token tt = peekToken();
      int elemStart = ts.getTokenBeg();
      if (tt == Token.EOF) {
        reportError("Expected ']'", elemStart);
      }
      if (tt == Token.COMMA) {
        consumeToken();
        pn.addChildToBack(IR.empty().setSourceRange(elemStart, elemStart));
        continue;
      }
      if (tt == Token.ELLIPSIS) {
        consumeToken();
        pn.addChildToBack(finish(new Node(Token.ITER_REST, bindingTarget()), elemStart));
        mustMatchToken(Token.RB, "Expected ']'");
        break;
      }
      pn.addChildToBack(bindingElement());
      if (!matchToken(Token.COMMA)) {
        mustMatchToken(Token.RB, "Expected ']'");
        break;
      }
    }
    return finish(pn, start);
  }

  private Node objectPattern(int start) {
    Node pn = new Node(Token.OBJECT_PATTERN);
    while (!matchToken(Token.RC)) {
      Token tt = peekToken();
      int propStart = ts.getTokenBeg();
      if (tt == Token.EOF) {
        reportError("Expected '}'", propStart);
      }
      if (tt == Token.ELLIPSIS) {
        consumeToken();
        Node target = bindingTarget();
        if (!target.isName()) {
          reportError("Invalid rest element", target.getSourceOffset());
        }
        pn.addChildToBack(finish(new Node(Token.OBJECT_REST, target), propStart));
        mustMatchToken(Token.RC, "Expected '}'");
        break;
      }
      if (tt == Token.LB) {
        consumeToken();
        Node key = assignExpr();
        mustMatchToken(Token.RB, "Expected ']'");
        mustMatchToken(Token.COLON, "Expected ':'");
        pn.addChildToBack(finish(IR.computedProp(key, bindingElement()), propStart));
      } else {
        boolean identifier = isIdentifierName(tt);
        if (!identifier && tt != Token.STRINGLIT && tt != Token.NUMBER) {
          reportUnexpected();
        }
        String key = checkNotNull(ts.getString());
        consumeToken();
        Node property;
        if (matchToken(Token.COLON)) {
          property = IR.stringKey(key, bindingElement());
        } else if (tt == Token.NAME) {
          Node value = finish(IR.name(key), propStart);
          if (matchToken(Token.ASSIGN)) {
            value = finish(IR.defaultValue(value, assignExpr()), propStart);
          }
          property = IR.stringKey(key, value);
          property.setShorthandProperty(true);
        } else {
          reportUnexpected();
          throw new IllegalStateException("unreachable");
        }
        if (tt == Token.STRINGLIT) {
          property.setQuotedString();
        }
        pn.addChildToBack(finish(property, propStart));
      }
      if (!matchToken(Token.COMMA)) {
        mustMatchToken(Token.RC, "Expected '}'");
        break;
      }
    }
    return finish(pn, start);
  }

  /**
   * Reinterprets an expression parsed inside parentheses as an arrow function parameter. Nodes are
   * retagged in place: array and object literals become patterns, assignments become default
   * values and spreads become rests.
   */
  private Node toParameter(Node n, boolean last) {
    if (n.getToken() == Token.ITER_SPREAD) {
      if (!last) {
        reportError("Rest parameter must be last formal parameter", n.getSourceOffset());
      }
      n.setToken(Token.ITER_REST);
      toBindingTarget(n.getOnlyChild());
      return n;
    }
    return toBindingElement(n);
  }

  private Node toBindingElement(Node n) {
    if (n.getToken() == Token.ASSIGN) {
      n.setToken(Token.DEFAULT_VALUE);
      toBindingTarget(checkNotNull(n.getFirstChild()));
      return n;
    }
    return toBindingTarget(n);
  }

  private Node toBindingTarget(Node n) {
    if (n.getIsParenthesized()) {
      reportError("Invalid destructuring assignment target", n.getSourceOffset());
    }
    switch (n.getToken()) {
      case NAME:
        return n;
      case ARRAYLIT:
        n.setToken(Token.ARRAY_PATTERN);
        for (Node child : n.children()) {
          if (child.getToken() == Token.ITER_SPREAD) {
            child.setToken(Token.ITER_REST);
            toBindingTarget(child.getOnlyChild());
          } else if (!child.isEmpty()) {
            toBindingElement(child);
          }
        }
        return n;
      case OBJECTLIT:
        n.setToken(Token.OBJECT_PATTERN);
        for (Node child : n.children()) {
          switch (child.getToken()) {
            case STRING_KEY:
            case COMPUTED_PROP:
              toBindingElement(checkNotNull(child.getLastChild()));
              break;
            case OBJECT_SPREAD:
              child.setToken(Token.OBJECT_REST);
              if (!child.getOnlyChild().isName()) {
                reportError("Invalid rest element", child.getSourceOffset());
              }
              break;
            default:
              reportError("Invalid destructuring assignment target", child.getSourceOffset());
          }
        }
        return n;
      default:
        reportError("Invalid destructuring assignment target", n.getSourceOffset());
        throw new IllegalStateException("unreachable");
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Statements

  /** Parses statements after the opening brace of a function body, up to the closing one. */
  private Node functionBody(int start) {
    enterNesting();
    Node block = IR.block();
    while (!matchToken(Token.RC)) {
      if (peekToken() == Token.EOF) {
        reportError("Expected '}'", ts.getTokenBeg());
      }
      Node stmt = statement();
      if (stmt != null) {
        block.addChildToBack(stmt);
      }
    }
    exitNesting();
    return finish(block, start);
  }

  private @Nullable Node statement() {
    Token tt = peekToken();
    int start = ts.getTokenBeg();
    switch (tt) {
      case SEMI:
        consumeToken();
        return null;
      case LC:
        consumeToken();
        return functionBody(start);
      case RETURN:
        {
          consumeToken();
          Token next = peekToken();
          Node ret;
          if (next == Token.SEMI
              || next == Token.RC
              || next == Token.EOF
              || ts.sawLineTerminator()) {
            ret = IR.returnNode();
          } else {
            ret = IR.returnNode(expr());
          }
          autoInsertSemicolon();
          return finish(ret, start);
        }
      case VAR:
      case CONST:
        consumeToken();
        return variables(tt, start);
      case IF:
        {
          consumeToken();
          mustMatchToken(Token.LP, "Expected '('");
          Node cond = expr();
          mustMatchToken(Token.RP, "Expected ')'");
          Node ifTrue = statementOrEmptyBlock();
          Node ifNode = new Node(Token.IF, cond, ifTrue);
          if (peekToken() == Token.KEYWORD && "else".equals(ts.getString())) {
            consumeToken();
            ifNode.addChildToBack(statementOrEmptyBlock());
          }
          return finish(ifNode, start);
        }
      case FUNCTION:
        {
          consumeToken();
          Node fn = function(start);
          if (fn.getFirstChild().isEmpty()) {
            reportError("Function statements require a function name", start);
          }
          return fn;
        }
      case NAME:
        if ("let".equals(ts.getString())) {
          consumeToken();
          Token next = peekToken();
          if (next == Token.NAME || next == Token.LB || next == Token.LC) {
            return variables(Token.LET, start);
          }
          // `let` used as a plain identifier.
          Node name = IR.name("let").setSourceRange(start, lastTokenEnd);
          return expressionStatement(memberExprTail(true, name), start);
        }
        return expressionStatement(null, start);
      default:
        return expressionStatement(null, start);
    }
  }

  private Node statementOrEmptyBlock() {
    enterNesting();
    int start = peekedTokenBeg();
    Node stmt = statement();
    exitNesting();
    return stmt != null ? stmt : IR.block().setSourceRange(start, lastTokenEnd);
  }

  private Node expressionStatement(@Nullable Node head, int start) {
    Node e;
    if (head == null) {
      e = expr();
    } else {
      // Resume the expression grammar after an already parsed primary.
      e = head;
      Token tt = peekToken();
      if (tt.isAssign()) {
        consumeToken();
        e = finish(new Node(tt, e, assignExpr()), start);
      }
    }
    autoInsertSemicolon();
    return finish(IR.exprResult(e), start);
  }

  private Node variables(Token declType, int start) {
    Node result = new Node(declType);
    do {
      Node target = bindingTarget();
      Node decl;
      if (target.isName()) {
        decl = target;
        if (matchToken(Token.ASSIGN)) {
          // The name keeps its own range; the initializer is its child.
          decl.addChildToBack(assignExpr());
        }
      } else {
        decl = new Node(Token.DESTRUCTURING_LHS, target);
        if (matchToken(Token.ASSIGN)) {
          decl.addChildToBack(assignExpr());
        }
        finish(decl, target.getSourceOffset());
      }
      result.addChildToBack(decl);
    } while (matchToken(Token.COMMA));
    autoInsertSemicolon();
    return finish(result, start);
  }

  private void autoInsertSemicolon() {
    Token tt = peekToken();
    if (tt == Token.SEMI) {
      consumeToken();
    } else if (tt != Token.RC && tt != Token.EOF && !ts.sawLineTerminator()) {
      reportError("Expected ';'", ts.getTokenBeg());
    }
  }
}
