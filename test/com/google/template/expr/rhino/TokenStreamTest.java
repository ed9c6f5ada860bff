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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class TokenStreamTest {

  private static ImmutableList<Token> tokens(String source) {
    TokenStream ts = new TokenStream(source);
    ImmutableList.Builder<Token> result = ImmutableList.builder();
    Token tt;
    do {
      tt = ts.getToken();
      result.add(tt);
    } while (tt != Token.EOF && tt != Token.ERROR);
    return result.build();
  }

  @Test
  public void testOptionalChainingAndCoalescing() {
    assertThat(tokens("a?.b ?? c"))
        .containsExactly(
            Token.NAME, Token.OPTCHAIN, Token.NAME, Token.COALESCE, Token.NAME, Token.EOF)
        .inOrder();
  }

  @Test
  public void testQuestionDotBeforeDigitIsConditional() {
    assertThat(tokens("a?.5:1"))
        .containsExactly(
            Token.NAME, Token.HOOK_TOKEN, Token.NUMBER, Token.COLON, Token.NUMBER, Token.EOF)
        .inOrder();
  }

  @Test
  public void testArrowAndEllipsis() {
    assertThat(tokens("(...a) => a"))
        .containsExactly(
            Token.LP, Token.ELLIPSIS, Token.NAME, Token.RP, Token.ARROW, Token.NAME, Token.EOF)
        .inOrder();
  }

  @Test
  public void testAssignmentOperators() {
    assertThat(tokens("a >>>= b **= c ??= d"))
        .containsExactly(
            Token.NAME,
            Token.ASSIGN_URSH,
            Token.NAME,
            Token.ASSIGN_EXPONENT,
            Token.NAME,
            Token.ASSIGN_COALESCE,
            Token.NAME,
            Token.EOF)
        .inOrder();
  }

  @Test
  public void testKeywords() {
    assertThat(tokens("typeof x instanceof y"))
        .containsExactly(Token.TYPEOF, Token.NAME, Token.INSTANCEOF, Token.NAME, Token.EOF)
        .inOrder();
    assertThat(tokens("class")).containsExactly(Token.KEYWORD, Token.EOF).inOrder();
    assertThat(tokens("let")).containsExactly(Token.NAME, Token.EOF).inOrder();
  }

  @Test
  public void testIsKeyword() {
    assertThat(TokenStream.isKeyword("this")).isTrue();
    assertThat(TokenStream.isKeyword("else")).isTrue();
    assertThat(TokenStream.isKeyword("let")).isFalse();
    assertThat(TokenStream.isKeyword("foo")).isFalse();
  }

  @Test
  public void testNumbers() {
    assertNumber("0x1F", 31);
    assertNumber("0b101", 5);
    assertNumber("0o17", 15);
    assertNumber("1_000", 1000);
    assertNumber("1e3", 1000);
    assertNumber(".5", 0.5);
  }

  private static void assertNumber(String source, double expected) {
    TokenStream ts = new TokenStream(source);
    assertThat(ts.getToken()).isEqualTo(Token.NUMBER);
    assertThat(ts.getNumber()).isEqualTo(expected);
    assertThat(ts.getString()).isEqualTo(source);
  }

  @Test
  public void testBigInt() {
    TokenStream ts = new TokenStream("10n");
    assertThat(ts.getToken()).isEqualTo(Token.BIGINT);
    assertThat(ts.getString()).isEqualTo("10");
  }

  @Test
  public void testIdentifierRightAfterNumberIsAnError() {
    TokenStream ts = new TokenStream("3in x");
    assertThat(ts.getToken()).isEqualTo(Token.ERROR);
    assertThat(ts.getErrorMessage()).isEqualTo("Invalid or unexpected token");
  }

  @Test
  public void testStringEscapes() {
    TokenStream ts = new TokenStream("'a\\nb\\x41\\u0042\\u{43}'");
    assertThat(ts.getToken()).isEqualTo(Token.STRINGLIT);
    assertThat(ts.getString()).isEqualTo("a\nbABC");
  }

  @Test
  public void testUnterminatedString() {
    TokenStream ts = new TokenStream("'abc");
    assertThat(ts.getToken()).isEqualTo(Token.ERROR);
    assertThat(ts.getErrorMessage()).isEqualTo("Unterminated string literal");
  }

  @Test
  public void testTokenPositions() {
    TokenStream ts = new TokenStream("  foo + bar");
    assertThat(ts.getToken()).isEqualTo(Token.NAME);
    assertThat(ts.getTokenBeg()).isEqualTo(2);
    assertThat(ts.getTokenEnd()).isEqualTo(5);
    assertThat(ts.getToken()).isEqualTo(Token.ADD);
    assertThat(ts.getTokenBeg()).isEqualTo(6);
  }

  @Test
  public void testLineTerminatorsAndComments() {
    TokenStream ts = new TokenStream("a /* x\n */ b // c");
    assertThat(ts.getToken()).isEqualTo(Token.NAME);
    assertThat(ts.sawLineTerminator()).isFalse();
    assertThat(ts.getToken()).isEqualTo(Token.NAME);
    assertThat(ts.getString()).isEqualTo("b");
    assertThat(ts.sawLineTerminator()).isTrue();
    assertThat(ts.getToken()).isEqualTo(Token.EOF);
  }

  @Test
  public void testUnterminatedComment() {
    TokenStream ts = new TokenStream("a /* b");
    assertThat(ts.getToken()).isEqualTo(Token.NAME);
    assertThat(ts.getToken()).isEqualTo(Token.ERROR);
    assertThat(ts.getErrorMessage()).isEqualTo("Unterminated comment");
  }

  @Test
  public void testTemplateLiteralParts() {
    TokenStream ts = new TokenStream("`a${b}c`");
    assertThat(ts.getToken()).isEqualTo(Token.TEMPLATE_START);
    assertThat(ts.readTemplateLiteralPart()).isEqualTo(Token.TEMPLATELIT_STRING);
    assertThat(ts.getString()).isEqualTo("a");
    assertThat(ts.isTemplateTail()).isFalse();
    assertThat(ts.getToken()).isEqualTo(Token.NAME);
    assertThat(ts.getToken()).isEqualTo(Token.RC);
    assertThat(ts.readTemplateLiteralPart()).isEqualTo(Token.TEMPLATELIT_STRING);
    assertThat(ts.getString()).isEqualTo("c");
    assertThat(ts.isTemplateTail()).isTrue();
    assertThat(ts.getToken()).isEqualTo(Token.EOF);
  }

  @Test
  public void testRegExp() {
    TokenStream ts = new TokenStream("/a[/]b/g.test(x)");
    assertThat(ts.getToken()).isEqualTo(Token.DIV);
    assertThat(ts.readRegExp()).isEqualTo(Token.REGEXP);
    assertThat(ts.getString()).isEqualTo("/a[/]b/g");
    assertThat(ts.getToken()).isEqualTo(Token.DOT);
  }

  @Test
  public void testInvalidCharacter() {
    TokenStream ts = new TokenStream("a # b");
    assertThat(ts.getToken()).isEqualTo(Token.NAME);
    assertThat(ts.getToken()).isEqualTo(Token.ERROR);
    assertThat(ts.getTokenBeg()).isEqualTo(2);
  }
}
