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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.math.BigInteger;
import org.jspecify.annotations.Nullable;

/**
 * This class implements the expression scanner.
 *
 * <p>The scanner is driven one token at a time by the {@link Parser}. After {@link #getToken()}
 * returns, {@link #getString()}, {@link #getNumber()}, {@link #getTokenBeg()} and {@link
 * #getTokenEnd()} describe that token until the next call. Malformed input produces {@link
 * Token#ERROR} and a message available from {@link #getErrorMessage()}.
 */
public class TokenStream {

  private static final ImmutableMap<String, Token> KEYWORDS =
      ImmutableMap.<String, Token>builder()
          .put("typeof", Token.TYPEOF)
          .put("void", Token.VOID)
          .put("delete", Token.DELPROP)
          .put("new", Token.NEW)
          .put("in", Token.IN)
          .put("instanceof", Token.INSTANCEOF)
          .put("this", Token.THIS)
          .put("super", Token.SUPER)
          .put("null", Token.NULL)
          .put("true", Token.TRUE)
          .put("false", Token.FALSE)
          .put("function", Token.FUNCTION)
          .put("return", Token.RETURN)
          .put("var", Token.VAR)
          .put("const", Token.CONST)
          .put("if", Token.IF)
          .buildOrThrow();

  // Reserved words the grammar has no use for. They scan as KEYWORD so the parser can reject them
  // with a precise message.
  private static final ImmutableSet<String> RESERVED =
      ImmutableSet.of(
          "break", "case", "catch", "class", "continue", "debugger", "default", "do", "else",
          "enum", "export", "extends", "finally", "for", "import", "switch", "throw", "try",
          "while", "with");

  /** Returns whether {@code name} can never be used as an identifier. */
  public static boolean isKeyword(String name) {
    return KEYWORDS.containsKey(name) || RESERVED.contains(name);
  }

  public static boolean isJSIdentifierStart(char c) {
    return (c >= 'a' && c <= 'z')
        || (c >= 'A' && c <= 'Z')
        || c == '_'
        || c == '$'
        || (c > 0x7f && Character.isUnicodeIdentifierStart(c));
  }

  public static boolean isJSIdentifierPart(char c) {
    return isJSIdentifierStart(c)
        || (c >= '0' && c <= '9')
        || (c > 0x7f && Character.isUnicodeIdentifierPart(c));
  }

  private final String sourceString;
  private int cursor;

  private int tokenBeg;
  private int tokenEnd;
  private @Nullable String string;
  private double number;
  private @Nullable String errorMessage;
  private boolean sawLineTerminator;
  private boolean templateTail;

  public TokenStream(String sourceString) {
    this.sourceString = sourceString;
  }

  public final String getSourceString() {
    return sourceString;
  }

  public final int getTokenBeg() {
    return tokenBeg;
  }

  public final int getTokenEnd() {
    return tokenEnd;
  }

  /** The identifier, keyword, string value, regular expression or numeric text of the token. */
  public final @Nullable String getString() {
    return string;
  }

  public final double getNumber() {
    return number;
  }

  public final @Nullable String getErrorMessage() {
    return errorMessage;
  }

  /** Whether a line terminator separates the last token from the one before it. */
  public final boolean sawLineTerminator() {
    return sawLineTerminator;
  }

  /** Whether the last template part ended the literal (as opposed to opening a substitution). */
  public final boolean isTemplateTail() {
    return templateTail;
  }

  public final Token getToken() {
    string = null;
    errorMessage = null;
    sawLineTerminator = false;
    skipWhitespaceAndComments();
    tokenBeg = cursor;
    if (errorMessage != null) {
      tokenEnd = cursor;
      return Token.ERROR;
    }
    if (cursor >= sourceString.length()) {
      tokenEnd = cursor;
      return Token.EOF;
    }
    Token token = scan();
    tokenEnd = cursor;
    return token;
  }

  private void skipWhitespaceAndComments() {
    while (cursor < sourceString.length()) {
      char c = sourceString.charAt(cursor);
      if (c == '\n' || c == '\r' || c == '\u2028' || c == '\u2029') {
        sawLineTerminator = true;
        cursor++;
      } else if (Character.isWhitespace(c) || c == '\u00a0' || c == '\ufeff') {
        cursor++;
      } else if (c == '/' && peekChar(1) == '/') {
        while (cursor < sourceString.length() && sourceString.charAt(cursor) != '\n') {
          cursor++;
        }
      } else if (c == '/' && peekChar(1) == '*') {
        int close = sourceString.indexOf("*/", cursor + 2);
        if (close < 0) {
          errorMessage = "Unterminated comment";
          cursor = sourceString.length();
          return;
        }
        if (sourceString.substring(cursor, close).indexOf('\n') >= 0) {
          sawLineTerminator = true;
        }
        cursor = close + 2;
      } else {
        return;
      }
    }
  }

  private char peekChar(int ahead) {
    int i = cursor + ahead;
    return i < sourceString.length() ? sourceString.charAt(i) : '\0';
  }

  private boolean matchChar(char c) {
    if (peekChar(0) == c && cursor < sourceString.length()) {
      cursor++;
      return true;
    }
    return false;
  }

  private Token scan() {
    char c = sourceString.charAt(cursor);
    if (isJSIdentifierStart(c)) {
      return scanIdentifier();
    }
    if (isDigit(c) || (c == '.' && isDigit(peekChar(1)))) {
      return scanNumber();
    }
    if (c == '"' || c == '\'') {
      return scanString(c);
    }
    cursor++;
    switch (c) {
      case '(':
        return Token.LP;
      case ')':
        return Token.RP;
      case '[':
        return Token.LB;
      case ']':
        return Token.RB;
      case '{':
        return Token.LC;
      case '}':
        return Token.RC;
      case ';':
        return Token.SEMI;
      case ',':
        return Token.COMMA;
      case ':':
        return Token.COLON;
      case '~':
        return Token.BITNOT;
      case '`':
        return Token.TEMPLATE_START;
      case '.':
        if (peekChar(0) == '.' && peekChar(1) == '.') {
          cursor += 2;
          return Token.ELLIPSIS;
        }
        return Token.DOT;
      case '?':
        if (peekChar(0) == '.' && !isDigit(peekChar(1))) {
          cursor++;
          return Token.OPTCHAIN;
        }
        if (matchChar('?')) {
          return matchChar('=') ? Token.ASSIGN_COALESCE : Token.COALESCE;
        }
        return Token.HOOK_TOKEN;
      case '=':
        if (matchChar('>')) {
          return Token.ARROW;
        }
        if (matchChar('=')) {
          return matchChar('=') ? Token.SHEQ : Token.EQ;
        }
        return Token.ASSIGN;
      case '!':
        if (matchChar('=')) {
          return matchChar('=') ? Token.SHNE : Token.NE;
        }
        return Token.NOT;
      case '<':
        if (matchChar('<')) {
          return matchChar('=') ? Token.ASSIGN_LSH : Token.LSH;
        }
        return matchChar('=') ? Token.LE : Token.LT;
      case '>':
        if (matchChar('>')) {
          if (matchChar('>')) {
            return matchChar('=') ? Token.ASSIGN_URSH : Token.URSH;
          }
          return matchChar('=') ? Token.ASSIGN_RSH : Token.RSH;
        }
        return matchChar('=') ? Token.GE : Token.GT;
      case '+':
        if (matchChar('+')) {
          return Token.INC;
        }
        return matchChar('=') ? Token.ASSIGN_ADD : Token.ADD;
      case '-':
        if (matchChar('-')) {
          return Token.DEC;
        }
        return matchChar('=') ? Token.ASSIGN_SUB : Token.SUB;
      case '*':
        if (matchChar('*')) {
          return matchChar('=') ? Token.ASSIGN_EXPONENT : Token.EXPONENT;
        }
        return matchChar('=') ? Token.ASSIGN_MUL : Token.MUL;
      case '/':
        return matchChar('=') ? Token.ASSIGN_DIV : Token.DIV;
      case '%':
        return matchChar('=') ? Token.ASSIGN_MOD : Token.MOD;
      case '&':
        if (matchChar('&')) {
          return matchChar('=') ? Token.ASSIGN_AND : Token.AND;
        }
        return matchChar('=') ? Token.ASSIGN_BITAND : Token.BITAND;
      case '|':
        if (matchChar('|')) {
          return matchChar('=') ? Token.ASSIGN_OR : Token.OR;
        }
        return matchChar('=') ? Token.ASSIGN_BITOR : Token.BITOR;
      case '^':
        return matchChar('=') ? Token.ASSIGN_BITXOR : Token.BITXOR;
      default:
        errorMessage = "Invalid or unexpected token";
        return Token.ERROR;
    }
  }

  private Token scanIdentifier() {
    int start = cursor;
    while (cursor < sourceString.length() && isJSIdentifierPart(sourceString.charAt(cursor))) {
      cursor++;
    }
    string = sourceString.substring(start, cursor);
    Token keyword = KEYWORDS.get(string);
    if (keyword != null) {
      return keyword;
    }
    return RESERVED.contains(string) ? Token.KEYWORD : Token.NAME;
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isHexDigit(char c) {
    return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
  }

  private Token scanNumber() {
    int start = cursor;
    int radix = 10;
    if (peekChar(0) == '0') {
      char x = Character.toLowerCase(peekChar(1));
      if (x == 'x') {
        radix = 16;
      } else if (x == 'o') {
        radix = 8;
      } else if (x == 'b') {
        radix = 2;
      }
    }
    if (radix != 10) {
      cursor += 2;
      int digitsStart = cursor;
      while (cursor < sourceString.length()
          && (isHexDigit(sourceString.charAt(cursor)) || sourceString.charAt(cursor) == '_')) {
        cursor++;
      }
      String digits = sourceString.substring(digitsStart, cursor).replace("_", "");
      if (digits.isEmpty()) {
        errorMessage = "Invalid or unexpected token";
        return Token.ERROR;
      }
      BigInteger value;
      try {
        value = new BigInteger(digits, radix);
      } catch (NumberFormatException e) {
        errorMessage = "Invalid or unexpected token";
        return Token.ERROR;
      }
      if (matchChar('n')) {
        string = value.toString();
        return Token.BIGINT;
      }
      number = value.doubleValue();
      string = sourceString.substring(start, cursor);
      return checkNumberEnd();
    }

    scanDigits();
    boolean integral = true;
    if (peekChar(0) == '.') {
      integral = false;
      cursor++;
      scanDigits();
    }
    char e = peekChar(0);
    if (e == 'e' || e == 'E') {
      integral = false;
      cursor++;
      if (peekChar(0) == '+' || peekChar(0) == '-') {
        cursor++;
      }
      if (!isDigit(peekChar(0))) {
        errorMessage = "Invalid or unexpected token";
        return Token.ERROR;
      }
      scanDigits();
    }
    String text = sourceString.substring(start, cursor).replace("_", "");
    if (integral && matchChar('n')) {
      string = text;
      return Token.BIGINT;
    }
    number = Double.parseDouble(text);
    string = sourceString.substring(start, cursor);
    return checkNumberEnd();
  }

  private void scanDigits() {
    while (cursor < sourceString.length()
        && (isDigit(sourceString.charAt(cursor)) || sourceString.charAt(cursor) == '_')) {
      cursor++;
    }
  }

  // An identifier must not start right after a numeric literal.
  private Token checkNumberEnd() {
    if (cursor < sourceString.length() && isJSIdentifierStart(sourceString.charAt(cursor))) {
      errorMessage = "Invalid or unexpected token";
      return Token.ERROR;
    }
    return Token.NUMBER;
  }

  private Token scanString(char quote) {
    cursor++;
    StringBuilder sb = new StringBuilder();
    while (true) {
      if (cursor >= sourceString.length()) {
        errorMessage = "Unterminated string literal";
        return Token.ERROR;
      }
      char c = sourceString.charAt(cursor++);
      if (c == quote) {
        break;
      }
      if (c == '\n' || c == '\r') {
        errorMessage = "Unterminated string literal";
        return Token.ERROR;
      }
      if (c == '\\') {
        if (!readEscape(sb)) {
          return Token.ERROR;
        }
      } else {
        sb.append(c);
      }
    }
    string = sb.toString();
    return Token.STRINGLIT;
  }

  /** Reads the escape sequence after a backslash into {@code sb}. */
  private boolean readEscape(StringBuilder sb) {
    if (cursor >= sourceString.length()) {
      errorMessage = "Unterminated string literal";
      return false;
    }
    char c = sourceString.charAt(cursor++);
    switch (c) {
      case 'n':
        sb.append('\n');
        return true;
      case 't':
        sb.append('\t');
        return true;
      case 'r':
        sb.append('\r');
        return true;
      case 'b':
        sb.append('\b');
        return true;
      case 'f':
        sb.append('\f');
        return true;
      case 'v':
        sb.append('\u000b');
        return true;
      case '0':
        sb.append('\0');
        return true;
      case '\r':
        matchChar('\n');
        return true;
      case '\n':
        return true;
      case 'x':
        return readHexEscape(sb, 2);
      case 'u':
        if (matchChar('{')) {
          int close = sourceString.indexOf('}', cursor);
          if (close < 0) {
            errorMessage = "Invalid Unicode escape sequence";
            return false;
          }
          try {
            sb.appendCodePoint(Integer.parseInt(sourceString.substring(cursor, close), 16));
          } catch (IllegalArgumentException e) {
            errorMessage = "Invalid Unicode escape sequence";
            return false;
          }
          cursor = close + 1;
          return true;
        }
        return readHexEscape(sb, 4);
      default:
        sb.append(c);
        return true;
    }
  }

  private boolean readHexEscape(StringBuilder sb, int digits) {
    if (cursor + digits > sourceString.length()) {
      errorMessage = "Invalid hexadecimal escape sequence";
      return false;
    }
    int value = 0;
    for (int i = 0; i < digits; i++) {
      char h = sourceString.charAt(cursor + i);
      if (!isHexDigit(h)) {
        errorMessage = "Invalid hexadecimal escape sequence";
        return false;
      }
      value = value * 16 + Character.digit(h, 16);
    }
    cursor += digits;
    sb.append((char) value);
    return true;
  }

  /**
   * Scans one raw chunk of a template literal, starting right after the opening backtick or after
   * the closing brace of a substitution. Returns {@link Token#TEMPLATELIT_STRING}; {@link
   * #isTemplateTail()} tells whether the chunk ended the literal or opened a {@code ${}}.
   */
  public final Token readTemplateLiteralPart() {
    string = null;
    errorMessage = null;
    tokenBeg = cursor;
    while (true) {
      if (cursor >= sourceString.length()) {
        tokenEnd = cursor;
        errorMessage = "Unterminated template literal";
        return Token.ERROR;
      }
      char c = sourceString.charAt(cursor);
      if (c == '`') {
        string = sourceString.substring(tokenBeg, cursor);
        cursor++;
        templateTail = true;
        break;
      }
      if (c == '$' && peekChar(1) == '{') {
        string = sourceString.substring(tokenBeg, cursor);
        cursor += 2;
        templateTail = false;
        break;
      }
      cursor += c == '\\' ? 2 : 1;
    }
    tokenEnd = cursor;
    return Token.TEMPLATELIT_STRING;
  }

  /**
   * Rescans the last DIV or ASSIGN_DIV token as the start of a regular expression literal. The
   * pattern and flags, slashes included, are available from {@link #getString()}.
   */
  public final Token readRegExp() {
    cursor = tokenBeg + 1;
    boolean inClass = false;
    while (true) {
      if (cursor >= sourceString.length()) {
        errorMessage = "Invalid regular expression: missing /";
        tokenEnd = cursor;
        return Token.ERROR;
      }
      char c = sourceString.charAt(cursor++);
      if (c == '\n') {
        errorMessage = "Invalid regular expression: missing /";
        tokenEnd = cursor;
        return Token.ERROR;
      } else if (c == '\\') {
        cursor++;
      } else if (c == '[') {
        inClass = true;
      } else if (c == ']') {
        inClass = false;
      } else if (c == '/' && !inClass) {
        break;
      }
    }
    while (cursor < sourceString.length() && isJSIdentifierPart(sourceString.charAt(cursor))) {
      cursor++;
    }
    tokenEnd = cursor;
    string = sourceString.substring(tokenBeg, cursor);
    return Token.REGEXP;
  }
}
