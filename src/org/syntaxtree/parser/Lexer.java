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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.syntaxtree.source.SourceBuffer;

/**
 * Splits Ruby source into {@link Token}s. Both parsers consume the same token stream.
 *
 * <p>The lexer keeps a stack of modes: code, string content and regexp content. An interpolation
 * {@code #{} inside a string pushes a code mode that ends at the matching {@code }}. String content
 * is emitted one token per line, each including its trailing newline.
 *
 * <p>Newlines become {@link TokenType#NEWLINE} tokens only where they can end a statement: not
 * after an operator or a comma, and not before a line that starts with {@code .} or {@code &.}.
 */
public final class Lexer {

  static final ImmutableSet<String> KEYWORDS =
      ImmutableSet.of(
          "alias", "and", "begin", "break", "case", "class", "def", "defined?", "do", "else",
          "elsif", "end", "ensure", "false", "for", "if", "in", "module", "next", "nil", "not",
          "or", "redo", "rescue", "retry", "return", "self", "super", "then", "true", "undef",
          "unless", "until", "when", "while", "yield", "__FILE__", "__LINE__");

  // Longest first, so the first match wins.
  private static final ImmutableList<String> OPERATORS =
      ImmutableList.of(
          "**=", "<=>", "===", "...", "<<=", ">>=", "&&=", "||=", "==", "!=", ">=", "<=", "&&",
          "||", "<<", ">>", "**", "=~", "!~", "=>", "->", "..", "::", "&.", "+=", "-=", "*=",
          "/=", "%=", "|=", "&=", "^=", "+", "-", "*", "/", "%", "=", "<", ">", "!", "&", "|",
          "^", "~", "?", ":", ",", ".", "(", ")", "[", "]", "{", "}");

  private static final ImmutableList<String> SYMBOL_OPERATORS =
      ImmutableList.of(
          "[]=", "[]", "<=>", "===", "==", "=~", "!=", "!~", "**", "+@", "-@", "<<", ">>", "<=",
          ">=", "+", "-", "*", "/", "%", "<", ">", "!", "&", "|", "^", "~");

  private static final String BACK_REFERENCES = "&`'+";

  private static final String SPECIAL_GLOBALS = "~*$?!@/\\;,.=:<>\"0";

  private static final ImmutableSet<String> VALUE_KEYWORDS =
      ImmutableSet.of("end", "self", "nil", "true", "false", "__FILE__", "__LINE__", "redo",
          "retry");

  private enum ModeKind {
    CODE,
    STRING,
    REGEXP
  }

  private static final class Mode {
    final ModeKind kind;
    final char terminator;
    final boolean interpolates;
    int braceDepth;
    boolean endsLabel;

    Mode(ModeKind kind, char terminator, boolean interpolates) {
      this.kind = kind;
      this.terminator = terminator;
      this.interpolates = interpolates;
    }
  }

  private final SourceBuffer buffer;
  private final String source;
  private final List<Token> tokens = new ArrayList<>();
  private final Deque<Mode> modes = new ArrayDeque<>();
  private int pos;
  private boolean spaceBefore;

  public Lexer(SourceBuffer buffer) {
    this.buffer = buffer;
    this.source = buffer.getSource();
  }

  /** Lexes the whole buffer. The last token is always {@link TokenType#EOF}. */
  public ImmutableList<Token> tokenize() {
    tokens.clear();
    modes.clear();
    pos = 0;
    modes.push(new Mode(ModeKind.CODE, '\0', false));
    while (true) {
      Mode mode = modes.peek();
      if (mode.kind == ModeKind.CODE) {
        if (!lexCode(mode)) {
          break;
        }
      } else {
        lexContent(mode);
      }
    }
    if (modes.size() > 1) {
      throw new ParseException("unterminated interpolation", buffer, source.length());
    }
    if (last() != null && last().is(TokenType.NEWLINE)) {
      tokens.remove(tokens.size() - 1);
    }
    tokens.add(new Token(TokenType.EOF, "", source.length(), source.length(), true));
    return ImmutableList.copyOf(tokens);
  }

  /** Lexes one token in code mode. Returns false at the end of input. */
  private boolean lexCode(Mode mode) {
    spaceBefore = pos == 0 || tokens.isEmpty();
    while (pos < source.length()) {
      char c = source.charAt(pos);
      if (c == ' ' || c == '\t' || c == '\r') {
        pos++;
        spaceBefore = true;
      } else if (c == '\\' && peekChar(1) == '\n') {
        pos += 2;
        spaceBefore = true;
      } else if (c == '#') {
        while (pos < source.length() && source.charAt(pos) != '\n') {
          pos++;
        }
      } else if (c == '\n') {
        if (endsStatement() && !continuesOnNextLine(pos + 1)) {
          add(TokenType.NEWLINE, pos, pos + 1);
        }
        pos++;
        spaceBefore = true;
      } else {
        break;
      }
    }
    if (pos >= source.length()) {
      return false;
    }

    int start = pos;
    char c = source.charAt(pos);
    if (c == ';') {
      pos++;
      add(TokenType.SEMICOLON, start, pos);
    } else if (c == '}' && modes.size() > 1 && mode.braceDepth == 0) {
      pos++;
      add(TokenType.EMBEXPR_END, start, pos);
      modes.pop();
    } else if (isDigit(c)) {
      lexNumber();
    } else if (c == '@') {
      lexInstanceVariable();
    } else if (c == '$') {
      lexGlobalVariable();
    } else if (isIdentifierStart(c)) {
      lexIdentifier();
    } else if (c == '"' || c == '\'') {
      boolean labelAllowed = labelAllowed();
      pos++;
      add(TokenType.STRING_BEGIN, start, pos);
      Mode string = new Mode(ModeKind.STRING, c, c == '"');
      string.endsLabel = labelAllowed;
      modes.push(string);
    } else if (c == ':' && (peekChar(1) == '"' || peekChar(1) == '\'')) {
      pos += 2;
      add(TokenType.DSYMBOL_BEGIN, start, pos);
      char quote = source.charAt(start + 1);
      modes.push(new Mode(ModeKind.STRING, quote, quote == '"'));
    } else if (c == ':' && peekChar(1) != ':' && startsSymbol()) {
      lexSymbol();
    } else if (c == '/' && startsRegexp()) {
      pos++;
      add(TokenType.REGEXP_BEGIN, start, pos);
      modes.push(new Mode(ModeKind.REGEXP, '/', true));
    } else {
      lexOperator(mode);
    }
    return true;
  }

  private void lexNumber() {
    int start = pos;
    TokenType type = TokenType.INTEGER;
    if (source.charAt(pos) == '0' && "xXbBoOdD".indexOf(peekChar(1)) >= 0) {
      pos += 2;
      while (pos < source.length()
          && (Character.digit(source.charAt(pos), 16) >= 0 || source.charAt(pos) == '_')) {
        pos++;
      }
      addNumber(type, start, true);
      return;
    }
    skipDigits();
    if (peekChar(0) == '.' && isDigit(peekChar(1))) {
      type = TokenType.FLOAT;
      pos++;
      skipDigits();
    }
    if ((peekChar(0) == 'e' || peekChar(0) == 'E')
        && (isDigit(peekChar(1))
            || ((peekChar(1) == '+' || peekChar(1) == '-') && isDigit(peekChar(2))))) {
      type = TokenType.FLOAT;
      pos += 2;
      skipDigits();
      addNumber(type, start, false);
      return;
    }
    addNumber(type, start, true);
  }

  /** Adds a number token, taking an {@code r}, {@code i} or {@code ri} suffix into account. */
  private void addNumber(TokenType type, int start, boolean rationalAllowed) {
    int end = pos;
    TokenType suffixed = type;
    if (rationalAllowed && peekChar(0) == 'r') {
      pos++;
      suffixed = TokenType.RATIONAL;
    }
    if (peekChar(0) == 'i') {
      pos++;
      suffixed = TokenType.IMAGINARY;
    }
    if (isIdentifierPart(peekChar(0))) {
      pos = end;
      suffixed = type;
    }
    add(suffixed, start, pos);
  }

  private void skipDigits() {
    while (pos < source.length() && (isDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
      pos++;
    }
  }

  private void lexInstanceVariable() {
    int start = pos;
    TokenType type = TokenType.IVAR;
    pos++;
    if (peekChar(0) == '@') {
      type = TokenType.CVAR;
      pos++;
    }
    if (!isIdentifierStart(peekChar(0))) {
      throw new ParseException("'@' without identifiers is not allowed", buffer, start);
    }
    skipIdentifierChars();
    add(type, start, pos);
  }

  private void lexGlobalVariable() {
    int start = pos;
    pos++;
    char c = peekChar(0);
    if (c >= '1' && c <= '9') {
      while (isDigit(peekChar(0))) {
        pos++;
      }
      add(TokenType.BACKREF, start, pos);
    } else if (c != '\0' && BACK_REFERENCES.indexOf(c) >= 0) {
      pos++;
      add(TokenType.BACKREF, start, pos);
    } else if (c != '\0' && SPECIAL_GLOBALS.indexOf(c) >= 0) {
      pos++;
      add(TokenType.GVAR, start, pos);
    } else if (isIdentifierStart(c)) {
      skipIdentifierChars();
      add(TokenType.GVAR, start, pos);
    } else {
      throw new ParseException("unsupported global variable", buffer, start);
    }
  }

  private void lexIdentifier() {
    int start = pos;
    skipIdentifierChars();
    char suffix = peekChar(0);
    if ((suffix == '?' || suffix == '!') && peekChar(1) != '=') {
      pos++;
    }
    String word = source.substring(start, pos);
    Token previous = last();
    boolean afterDot =
        previous != null && (previous.isOperator(".") || previous.isOperator("&."));
    boolean afterDef = previous != null && previous.isKeyword("def");

    if (!afterDot
        && peekChar(0) == ':'
        && peekChar(1) != ':'
        && !(previous != null && previous.isOperator("?"))) {
      pos++;
      add(TokenType.LABEL, start, pos);
    } else if (afterDot || (afterDef && !word.equals("self"))) {
      add(Character.isUpperCase(word.charAt(0)) ? TokenType.CONSTANT : TokenType.IDENTIFIER,
          start, pos);
    } else if (KEYWORDS.contains(word)) {
      add(TokenType.KEYWORD, start, pos);
    } else if (Character.isUpperCase(word.charAt(0))) {
      add(TokenType.CONSTANT, start, pos);
    } else {
      add(TokenType.IDENTIFIER, start, pos);
    }
  }

  /** Whether a string starting here may be a quoted label, as in {@code {"a": 1}}. */
  private boolean labelAllowed() {
    Token previous = last();
    if (previous == null) {
      return false;
    }
    if (previous.is(TokenType.IDENTIFIER)) {
      return spaceBefore;
    }
    return previous.isOperator("{") || previous.isOperator(",") || previous.isOperator("(")
        || previous.isOperator("[") || previous.isOperator("|");
  }

  private boolean startsSymbol() {
    char next = peekChar(1);
    if (!isIdentifierStart(next)
        && next != '@'
        && next != '$'
        && symbolOperatorAt(pos + 1) == null) {
      return false;
    }
    return spaceBefore || !valueEnded();
  }

  private void lexSymbol() {
    int start = pos;
    pos++;
    String operator = symbolOperatorAt(pos);
    if (operator != null && !isIdentifierStart(peekChar(0))) {
      pos += operator.length();
    } else {
      while (peekChar(0) == '@' || peekChar(0) == '$') {
        pos++;
      }
      skipIdentifierChars();
      char suffix = peekChar(0);
      if (suffix == '?' || suffix == '!' || (suffix == '=' && "=~>".indexOf(peekChar(1)) < 0)) {
        pos++;
      }
    }
    tokens.add(new Token(TokenType.SYMBOL, source.substring(start + 1, pos), start, pos,
        spaceBefore));
  }

  private @Nullable String symbolOperatorAt(int offset) {
    for (String operator : SYMBOL_OPERATORS) {
      if (source.startsWith(operator, offset)) {
        return operator;
      }
    }
    return null;
  }

  private boolean startsRegexp() {
    if (!valueEnded()) {
      return true;
    }
    Token previous = last();
    char next = peekChar(1);
    return previous.is(TokenType.IDENTIFIER)
        && spaceBefore
        && next != ' '
        && next != '=';
  }

  private void lexOperator(Mode mode) {
    int start = pos;
    for (String operator : OPERATORS) {
      if (source.startsWith(operator, pos)) {
        pos += operator.length();
        if (operator.equals("{")) {
          mode.braceDepth++;
        } else if (operator.equals("}")) {
          mode.braceDepth--;
        }
        add(TokenType.OPERATOR, start, pos);
        return;
      }
    }
    throw new ParseException(
        "unexpected character '" + source.charAt(pos) + "'", buffer, pos);
  }

  /** Lexes string or regexp content up to the terminator or an interpolation. */
  private void lexContent(Mode mode) {
    int start = pos;
    while (true) {
      if (pos >= source.length()) {
        throw new ParseException(
            mode.kind == ModeKind.REGEXP ? "unterminated regexp meets end of file"
                : "unterminated string meets end of file",
            buffer,
            source.length());
      }
      char c = source.charAt(pos);
      if (c == '\\') {
        pos = Math.min(pos + 2, source.length());
      } else if (c == mode.terminator) {
        addContent(start, pos);
        int end = pos + 1;
        if (mode.endsLabel && peekChar(1) == ':' && peekChar(2) != ':') {
          end = pos + 2;
          tokens.add(new Token(TokenType.LABEL_END, source.substring(pos, end), pos, end, false));
        } else if (mode.kind == ModeKind.REGEXP) {
          while (end < source.length() && Character.isLowerCase(source.charAt(end))) {
            end++;
          }
          tokens.add(new Token(TokenType.REGEXP_END, source.substring(pos, end), pos, end, false));
        } else {
          tokens.add(new Token(TokenType.STRING_END, source.substring(pos, end), pos, end, false));
        }
        pos = end;
        modes.pop();
        return;
      } else if (mode.interpolates && c == '#' && peekChar(1) == '{') {
        addContent(start, pos);
        tokens.add(new Token(TokenType.EMBEXPR_BEGIN, "#{", pos, pos + 2, false));
        pos += 2;
        modes.push(new Mode(ModeKind.CODE, '\0', false));
        return;
      } else if (c == '\n') {
        pos++;
        addContent(start, pos);
        start = pos;
      } else {
        pos++;
      }
    }
  }

  private void addContent(int start, int end) {
    if (end > start) {
      tokens.add(
          new Token(TokenType.STRING_CONTENT, source.substring(start, end), start, end, false));
    }
  }

  /** Whether a newline after the last token may end a statement. */
  private boolean endsStatement() {
    Token previous = last();
    if (previous == null) {
      return false;
    }
    switch (previous.type()) {
      case NEWLINE:
      case SEMICOLON:
      case EMBEXPR_BEGIN:
      case STRING_BEGIN:
      case DSYMBOL_BEGIN:
      case REGEXP_BEGIN:
        return false;
      case OPERATOR:
        String value = previous.value();
        return value.equals(")") || value.equals("]") || value.equals("}");
      case KEYWORD:
        return !previous.isKeyword("and") && !previous.isKeyword("or")
            && !previous.isKeyword("not");
      default:
        return true;
    }
  }

  /** Whether the next non-blank line starts with a method call dot. */
  private boolean continuesOnNextLine(int offset) {
    int i = offset;
    while (i < source.length()) {
      char c = source.charAt(i);
      if (c == ' ' || c == '\t' || c == '\r' || c == '\n') {
        i++;
      } else if (c == '#') {
        while (i < source.length() && source.charAt(i) != '\n') {
          i++;
        }
      } else {
        break;
      }
    }
    return (source.startsWith(".", i) && !source.startsWith("..", i))
        || source.startsWith("&.", i);
  }

  /** Whether the last token ends a value, so that an operator after it is binary. */
  private boolean valueEnded() {
    Token previous = last();
    if (previous == null) {
      return false;
    }
    switch (previous.type()) {
      case IDENTIFIER:
      case CONSTANT:
      case IVAR:
      case GVAR:
      case CVAR:
      case BACKREF:
      case INTEGER:
      case FLOAT:
      case RATIONAL:
      case IMAGINARY:
      case SYMBOL:
      case STRING_END:
      case REGEXP_END:
        return true;
      case OPERATOR:
        String value = previous.value();
        return value.equals(")") || value.equals("]") || value.equals("}");
      case KEYWORD:
        return VALUE_KEYWORDS.contains(previous.value());
      default:
        return false;
    }
  }

  private void add(TokenType type, int start, int end) {
    tokens.add(new Token(type, source.substring(start, end), start, end, spaceBefore));
  }

  private @Nullable Token last() {
    return tokens.isEmpty() ? null : tokens.get(tokens.size() - 1);
  }

  private char peekChar(int ahead) {
    int offset = pos + ahead;
    return offset >= 0 && offset < source.length() ? source.charAt(offset) : '\0';
  }

  private void skipIdentifierChars() {
    while (pos < source.length() && isIdentifierPart(source.charAt(pos))) {
      pos++;
    }
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  static boolean isIdentifierStart(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || c > 0x7f;
  }

  static boolean isIdentifierPart(char c) {
    return isIdentifierStart(c) || isDigit(c);
  }
}
