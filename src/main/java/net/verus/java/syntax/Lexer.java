// Copyright 2026 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package net.verus.java.syntax;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * A scanner for Rust, optionally with the Verus overlay.
 *
 * <p>Most tokens are recognized from the next few characters. A few are not, and those have
 * dedicated recognizers here: string contents with escapes, raw strings whose closing fence must
 * repeat the opening fence, floats that must not swallow a following field access or range,
 * nested block comments and their doc markers. When no recognizer can make progress the lexer
 * emits an {@link TokenKind#ILLEGAL} token, the error sentinel, and reports a lexical error; it
 * never throws.
 */
final class Lexer {

  // --- These fields are accessed directly by the parser and tests: ---

  // Mapping from file offsets to Locations.
  final FileLocations locs;

  // Information about current token. Updated by nextToken.
  TokenKind kind;
  int start; // start offset
  int end; // end offset
  Object value; // see Token.value

  // --- end of parser-visible fields ---

  private final List<SyntaxError> errors;

  // Input buffer and position
  private final char[] buffer;
  private int pos;

  private final FileOptions options;

  private final ImmutableList.Builder<Comment> comments = ImmutableList.builder();

  // Kind of the token before the current one; a number directly after '.' is a tuple index.
  @Nullable private TokenKind previousKind;

  private static final ImmutableSet<String> NUMERIC_SUFFIXES =
      ImmutableSet.of(
          "u8", "i8", "u16", "i16", "u32", "i32", "u64", "i64", "u128", "i128", "isize", "usize",
          "f32", "f64");

  // Integer suffixes that exist only in the verification overlay.
  private static final ImmutableSet<String> OVERLAY_NUMERIC_SUFFIXES =
      ImmutableSet.of("int", "nat");

  /**
   * A segment of a string literal's content: either a run of plain characters or a single escape
   * sequence. Offsets are absolute.
   */
  static final class StringSegment {
    final boolean escape;
    final int start;
    final int end;

    StringSegment(boolean escape, int start, int end) {
      this.escape = escape;
      this.start = start;
      this.end = end;
    }
  }

  /**
   * The fence of a raw string literal: the number of {@code #} characters between the {@code r}
   * prefix and the opening quote. The closing quote must be followed by exactly as many.
   */
  static final class RawStringFence {
    final int hashes;
    final int literalStart;

    RawStringFence(int hashes, int literalStart) {
      Preconditions.checkArgument(hashes >= 0);
      this.hashes = hashes;
      this.literalStart = literalStart;
    }
  }

  // Constructs a lexer which tokenizes the parser input.
  // Errors are appended to errors.
  Lexer(ParserInput input, FileOptions options, List<SyntaxError> errors) {
    this.locs = FileLocations.create(input.getContent(), input.getFile());
    this.options = options;
    this.buffer = input.getContent();
    this.pos = 0;
    this.errors = errors;
  }

  ImmutableList<Comment> getComments() {
    return comments.build();
  }

  /**
   * Scans the whole input and returns its tokens, ending with a single EOF token. The joint flag
   * of each token records whether the next token follows it immediately.
   */
  ImmutableList<Token> tokenize() {
    List<Token> raw = new ArrayList<>();
    do {
      nextToken();
      raw.add(new Token(kind, start, end, value, false));
    } while (kind != TokenKind.EOF);

    ImmutableList.Builder<Token> result = ImmutableList.builderWithExpectedSize(raw.size());
    for (int i = 0; i < raw.size(); i++) {
      Token tok = raw.get(i);
      boolean joint = i + 1 < raw.size() && raw.get(i + 1).start == tok.end;
      result.add(joint ? new Token(tok.kind, tok.start, tok.end, tok.value, true) : tok);
    }
    return result.build();
  }

  /**
   * Reads the next token, updating the Lexer's token fields. It is an error to call nextToken after
   * an EOF token.
   */
  void nextToken() {
    Preconditions.checkState(kind != TokenKind.EOF, "nextToken called after EOF");
    previousKind = kind;
    tokenize1();
    Preconditions.checkState(kind != null);
  }

  private void error(String message, int pos) {
    errors.add(new SyntaxError(locs.getLocation(pos), message, SyntaxError.Kind.LEXICAL));
  }

  private void setToken(TokenKind kind, int start, int end) {
    this.kind = kind;
    this.start = start;
    this.end = end;
    this.value = null;
  }

  // Returns the ith unconsumed char, or -1 for EOF.
  private int peek(int i) {
    return pos + i < buffer.length ? buffer[pos + i] : -1;
  }

  // Consumes a char and returns the next unconsumed char, or -1 for EOF.
  private int next() {
    pos++;
    return peek(0);
  }

  private static boolean isShebangBlank(int c) {
    return c == ' ' || c == '\t' || c == '\r' || c == '\f' || c == '\u000B';
  }

  /**
   * Recognizes a shebang line. Only called at offset zero. A line beginning with {@code #!} is a
   * shebang unless its next non-blank character is {@code [}, which starts an inner attribute.
   */
  private boolean scanShebang() {
    if (peek(0) != '#' || peek(1) != '!') {
      return false;
    }
    int i = 2;
    while (isShebangBlank(peek(i))) {
      i++;
    }
    if (peek(i) == '[') {
      return false;
    }
    int oldPos = pos;
    while (pos < buffer.length && buffer[pos] != '\n') {
      pos++;
    }
    setToken(TokenKind.SHEBANG, oldPos, pos);
    return true;
  }

  /**
   * Scans the content of a string literal delimited by double quotes, honoring escapes.
   *
   * <p>ON ENTRY: 'pos' is 1 + the index of the opening quote. ON EXIT: 'pos' is 1 + the index of
   * the closing quote, or the end of the buffer if the literal is unclosed.
   */
  private void stringLiteral(int literalStart) {
    ImmutableList.Builder<StringSegment> segments = ImmutableList.builder();
    int runStart = pos;
    while (pos < buffer.length) {
      char c = buffer[pos];
      if (c == '"') {
        if (runStart < pos) {
          segments.add(new StringSegment(false, runStart, pos));
        }
        pos++;
        setToken(TokenKind.STRING, literalStart, pos);
        value = segments.build();
        return;
      }
      if (c == '\\') {
        if (runStart < pos) {
          segments.add(new StringSegment(false, runStart, pos));
        }
        int escapeStart = pos;
        scanEscape();
        segments.add(new StringSegment(true, escapeStart, pos));
        runStart = pos;
        continue;
      }
      pos++;
    }
    if (runStart < pos) {
      segments.add(new StringSegment(false, runStart, pos));
    }
    error("unclosed string literal", literalStart);
    setToken(TokenKind.STRING, literalStart, pos);
    value = segments.build();
  }

  /**
   * Scans one escape sequence. Accepts {@code \x} followed by two hex digits, a unicode escape of
   * one to six hex digits in braces, and a backslash followed by any other single character,
   * including a newline.
   *
   * <p>ON ENTRY: 'pos' is the index of the backslash. ON EXIT: 'pos' is just past the escape.
   */
  private void scanEscape() {
    int escapeStart = pos;
    int c = next(); // consume '\'
    if (c == -1) {
      error("unclosed escape sequence", escapeStart);
      return;
    }
    if (c == 'x') {
      pos++;
      for (int i = 0; i < 2; i++) {
        if (!isxdigit(peek(0))) {
          error("invalid escape sequence: expected two hex digits after \\x", escapeStart);
          return;
        }
        pos++;
      }
      return;
    }
    if (c == 'u') {
      c = next();
      if (c == '{') {
        c = next();
        int digits = 0;
        while (isxdigit(c) || c == '_') {
          digits++;
          c = next();
        }
        if (c != '}' || digits == 0) {
          error("invalid unicode escape sequence", escapeStart);
          return;
        }
        pos++;
        return;
      }
      for (int i = 0; i < 4; i++) {
        if (!isxdigit(peek(0))) {
          error("invalid unicode escape sequence", escapeStart);
          return;
        }
        pos++;
      }
      return;
    }
    pos++; // any other character, including a newline
  }

  /**
   * Recognizes the start of a raw string literal and returns its fence, or null if the input does
   * not start a raw string (for example {@code r#ident}, a raw identifier).
   *
   * <p>ON ENTRY: 'pos' is the index just past the {@code r} of the prefix. ON EXIT, if a fence was
   * returned: 'pos' is just past the opening quote; otherwise 'pos' is unchanged.
   */
  @Nullable
  RawStringFence scanRawStringStart(int literalStart) {
    int i = 0;
    while (peek(i) == '#') {
      i++;
    }
    if (peek(i) != '"') {
      return null;
    }
    pos += i + 1;
    return new RawStringFence(i, literalStart);
  }

  /**
   * Recognizes the end of a raw string literal. Succeeds only if 'pos' is at a double quote that
   * is followed by exactly {@code fence.hashes} {@code #} characters; a run of fewer or more does
   * not terminate the literal.
   *
   * <p>ON EXIT, if successful: 'pos' is just past the closing fence; otherwise it is unchanged.
   */
  boolean scanRawStringEnd(RawStringFence fence) {
    if (peek(0) != '"') {
      return false;
    }
    int hashes = 0;
    while (peek(1 + hashes) == '#') {
      hashes++;
    }
    if (hashes != fence.hashes) {
      return false;
    }
    pos += 1 + hashes;
    return true;
  }

  /** Scans the content and end of a raw string literal whose start fence has been consumed. */
  private void rawStringLiteral(RawStringFence fence) {
    int contentStart = pos;
    while (pos < buffer.length) {
      int contentEnd = pos;
      if (scanRawStringEnd(fence)) {
        setToken(TokenKind.RAW_STRING, fence.literalStart, pos);
        value = new StringSegment(false, contentStart, contentEnd);
        return;
      }
      pos++;
    }
    error("unclosed raw string literal", fence.literalStart);
    setToken(TokenKind.RAW_STRING, fence.literalStart, pos);
    value = new StringSegment(false, contentStart, pos);
  }

  /**
   * Scans a char literal, or emits a single quote that begins a lifetime or label.
   *
   * <p>ON ENTRY: 'pos' is 1 + the index of the opening quote.
   */
  private void charLiteralOrQuote(int literalStart) {
    int c = peek(0);
    if (c == '\\') {
      scanEscape();
      if (peek(0) == '\'') {
        pos++;
      } else {
        error("unclosed char literal", literalStart);
      }
      setToken(TokenKind.CHAR, literalStart, pos);
      return;
    }
    int width = c != -1 && Character.isHighSurrogate((char) c) ? 2 : 1;
    if (c != -1 && c != '\'' && c != '\n' && peek(width) == '\'') {
      pos += width + 1;
      setToken(TokenKind.CHAR, literalStart, pos);
      return;
    }
    // 'a: a lifetime or label; the identifier is the next token.
    setToken(TokenKind.QUOTE, literalStart, pos);
  }

  private static final Map<String, TokenKind> keywordMap = new HashMap<>();

  static {
    keywordMap.put("_", TokenKind.UNDERSCORE);
    keywordMap.put("as", TokenKind.AS);
    keywordMap.put("async", TokenKind.ASYNC);
    keywordMap.put("await", TokenKind.AWAIT);
    keywordMap.put("break", TokenKind.BREAK);
    keywordMap.put("const", TokenKind.CONST);
    keywordMap.put("continue", TokenKind.CONTINUE);
    keywordMap.put("crate", TokenKind.CRATE);
    keywordMap.put("dyn", TokenKind.DYN);
    keywordMap.put("else", TokenKind.ELSE);
    keywordMap.put("enum", TokenKind.ENUM);
    keywordMap.put("extern", TokenKind.EXTERN);
    keywordMap.put("false", TokenKind.FALSE);
    keywordMap.put("fn", TokenKind.FN);
    keywordMap.put("for", TokenKind.FOR);
    keywordMap.put("if", TokenKind.IF);
    keywordMap.put("impl", TokenKind.IMPL);
    keywordMap.put("in", TokenKind.IN);
    keywordMap.put("let", TokenKind.LET);
    keywordMap.put("loop", TokenKind.LOOP);
    keywordMap.put("match", TokenKind.MATCH);
    keywordMap.put("mod", TokenKind.MOD);
    keywordMap.put("move", TokenKind.MOVE);
    keywordMap.put("mut", TokenKind.MUT);
    keywordMap.put("pub", TokenKind.PUB);
    keywordMap.put("ref", TokenKind.REF);
    keywordMap.put("return", TokenKind.RETURN);
    keywordMap.put("self", TokenKind.SELF);
    keywordMap.put("static", TokenKind.STATIC);
    keywordMap.put("struct", TokenKind.STRUCT);
    keywordMap.put("super", TokenKind.SUPER);
    keywordMap.put("trait", TokenKind.TRAIT);
    keywordMap.put("true", TokenKind.TRUE);
    keywordMap.put("type", TokenKind.TYPE);
    keywordMap.put("unsafe", TokenKind.UNSAFE);
    keywordMap.put("use", TokenKind.USE);
    keywordMap.put("where", TokenKind.WHERE);
    keywordMap.put("while", TokenKind.WHILE);
    keywordMap.put("yield", TokenKind.YIELD);
  }

  /**
   * Scans an identifier or keyword.
   *
   * <p>ON ENTRY: 'pos' is the index of the first char of the identifier, or of the {@code r} of a
   * raw identifier {@code r#name}. ON EXIT: 'pos' is 1 + the index of the last char.
   */
  private void identifierOrKeyword() {
    int oldPos = pos;
    boolean raw = false;
    if (peek(0) == 'r' && peek(1) == '#' && isIdentifierStart(peek(2))) {
      raw = true;
      pos += 2;
    }
    scanIdentifier();
    String id = bufferSlice(oldPos, pos);
    TokenKind kind = raw ? null : keywordMap.get(id);
    if (kind == null) {
      setToken(TokenKind.IDENTIFIER, oldPos, pos);
      value = id;
    } else {
      setToken(kind, oldPos, pos);
    }
  }

  // Consumes identifier characters starting at pos (the first one must be an identifier start).
  private void scanIdentifier() {
    // Keep consistent with isIdentifierStart and isIdentifierPart.
    pos += Character.charCount(Character.codePointAt(buffer, pos));
    while (pos < buffer.length) {
      int cp = Character.codePointAt(buffer, pos);
      if (!isIdentifierPart(cp)) {
        return;
      }
      pos += Character.charCount(cp);
    }
  }

  /** Reports whether {@code c} (a char or code point, or -1) may start an identifier. */
  static boolean isIdentifierStart(int c) {
    return c == '_' || (c >= 0 && Character.isUnicodeIdentifierStart(c));
  }

  private static boolean isIdentifierPart(int c) {
    return c >= 0 && Character.isUnicodeIdentifierPart(c) && !Character.isIdentifierIgnorable(c);
  }

  /**
   * Scans a line comment or a (possibly nested) block comment and records it.
   *
   * <p>ON ENTRY: 'pos' is the index of the leading {@code /}, which is followed by {@code /} or
   * {@code *}.
   */
  private void comment() {
    int oldPos = pos;
    if (peek(1) == '/') {
      while (pos < buffer.length && buffer[pos] != '\n') {
        pos++;
      }
      addComment(oldPos, pos, /* block= */ false);
      return;
    }
    pos += 2; // "/*"
    int depth = 1;
    while (pos < buffer.length) {
      if (peek(0) == '/' && peek(1) == '*') {
        depth++;
        pos += 2;
      } else if (peek(0) == '*' && peek(1) == '/') {
        depth--;
        pos += 2;
        if (depth == 0) {
          addComment(oldPos, pos, /* block= */ true);
          return;
        }
      } else {
        pos++;
      }
    }
    error("unclosed block comment", oldPos);
    addComment(oldPos, pos, /* block= */ true);
  }

  /**
   * Tokenizes an operator or punctuation token. Operators of the verification overlay are
   * recognized only if the overlay is enabled; otherwise they scan as a sequence of base tokens.
   *
   * @return true if it tokenized one
   */
  private boolean punctuation(char c) {
    boolean verus = options.allowVerusSyntax();
    int p = pos;
    switch (c) {
      case '(':
        return single(TokenKind.LPAREN);
      case ')':
        return single(TokenKind.RPAREN);
      case '[':
        return single(TokenKind.LBRACKET);
      case ']':
        return single(TokenKind.RBRACKET);
      case '{':
        return single(TokenKind.LBRACE);
      case '}':
        return single(TokenKind.RBRACE);
      case ',':
        return single(TokenKind.COMMA);
      case ';':
        return single(TokenKind.SEMI);
      case '@':
        return single(TokenKind.AT);
      case '#':
        return single(TokenKind.POUND);
      case '$':
        return single(TokenKind.DOLLAR);
      case '?':
        return single(TokenKind.QUESTION);
      case '>':
        // Always a single '>'; the parser glues '>>', '>=' and '>>=' using the joint flag,
        // so that nested generic argument lists close one bracket at a time.
        return single(TokenKind.GREATER);
      case ':':
        return peek(1) == ':' ? multi(TokenKind.COLON_COLON, 2) : single(TokenKind.COLON);
      case '=':
        if (verus && peek(1) == '=' && peek(2) == '>') {
          return multi(TokenKind.IMPLIES, 3);
        } else if (verus && peek(1) == '=' && peek(2) == '=') {
          return multi(TokenKind.EQUALS_EQUALS_EQUALS, 3);
        } else if (verus && peek(1) == '~' && peek(2) == '~' && peek(3) == '=') {
          return multi(TokenKind.EQUALS_TILDE_TILDE_EQUALS, 4);
        } else if (verus && peek(1) == '~' && peek(2) == '=') {
          return multi(TokenKind.EQUALS_TILDE_EQUALS, 3);
        } else if (peek(1) == '=') {
          return multi(TokenKind.EQUALS_EQUALS, 2);
        } else if (peek(1) == '>') {
          return multi(TokenKind.FAT_ARROW, 2);
        }
        return single(TokenKind.EQUALS);
      case '<':
        if (verus && peek(1) == '=' && peek(2) == '=' && peek(3) == '>') {
          return multi(TokenKind.EQUIV, 4);
        } else if (verus && peek(1) == '=' && peek(2) == '=') {
          return multi(TokenKind.EXPLIES, 3);
        } else if (peek(1) == '<' && peek(2) == '=') {
          return multi(TokenKind.LESS_LESS_EQUALS, 3);
        } else if (peek(1) == '<') {
          return multi(TokenKind.LESS_LESS, 2);
        } else if (peek(1) == '=') {
          return multi(TokenKind.LESS_EQUALS, 2);
        }
        return single(TokenKind.LESS);
      case '!':
        if (verus && peek(1) == '=' && peek(2) == '=') {
          return multi(TokenKind.NOT_EQUALS_EQUALS, 3);
        } else if (peek(1) == '=') {
          return multi(TokenKind.NOT_EQUALS, 2);
        }
        return single(TokenKind.BANG);
      case '&':
        // '&&&' and '|||' are scanned as two tokens; the parser glues them where they are big
        // connectives.
        if (peek(1) == '&') {
          return multi(TokenKind.AMPERSAND_AMPERSAND, 2);
        } else if (peek(1) == '=') {
          return multi(TokenKind.AMPERSAND_EQUALS, 2);
        }
        return single(TokenKind.AMPERSAND);
      case '|':
        if (peek(1) == '|') {
          return multi(TokenKind.PIPE_PIPE, 2);
        } else if (peek(1) == '=') {
          return multi(TokenKind.PIPE_EQUALS, 2);
        }
        return single(TokenKind.PIPE);
      case '+':
        return peek(1) == '=' ? multi(TokenKind.PLUS_EQUALS, 2) : single(TokenKind.PLUS);
      case '-':
        if (peek(1) == '>') {
          return multi(TokenKind.RARROW, 2);
        } else if (peek(1) == '=') {
          return multi(TokenKind.MINUS_EQUALS, 2);
        }
        return single(TokenKind.MINUS);
      case '*':
        return peek(1) == '=' ? multi(TokenKind.STAR_EQUALS, 2) : single(TokenKind.STAR);
      case '/':
        return peek(1) == '=' ? multi(TokenKind.SLASH_EQUALS, 2) : single(TokenKind.SLASH);
      case '%':
        return peek(1) == '=' ? multi(TokenKind.PERCENT_EQUALS, 2) : single(TokenKind.PERCENT);
      case '^':
        return peek(1) == '=' ? multi(TokenKind.CARET_EQUALS, 2) : single(TokenKind.CARET);
      case '.':
        if (peek(1) == '.' && peek(2) == '.') {
          return multi(TokenKind.DOT_DOT_DOT, 3);
        } else if (peek(1) == '.' && peek(2) == '=') {
          return multi(TokenKind.DOT_DOT_EQUALS, 3);
        } else if (peek(1) == '.') {
          return multi(TokenKind.DOT_DOT, 2);
        }
        return single(TokenKind.DOT);
      default:
        Preconditions.checkState(pos == p);
        return false;
    }
  }

  private boolean single(TokenKind kind) {
    return multi(kind, 1);
  }

  private boolean multi(TokenKind kind, int length) {
    setToken(kind, pos, pos + length);
    pos += length;
    return true;
  }

  /** Performs tokenization of the next token. Skips whitespace and comments. */
  private void tokenize1() {
    if (pos == 0 && scanShebang()) {
      return;
    }
    kind = null;
    while (pos < buffer.length) {
      char c = buffer[pos];
      switch (c) {
        case ' ':
        case '\t':
        case '\r':
        case '\n':
        case '\f':
        case '\u000B':
          pos++;
          continue;
        case '/':
          if (peek(1) == '/' || peek(1) == '*') {
            comment();
            continue;
          }
          break;
        case '"':
          pos++;
          stringLiteral(pos - 1);
          return;
        case '\'':
          pos++;
          charLiteralOrQuote(pos - 1);
          return;
        default:
          break;
      }

      if (isdigit(c)) {
        scanNumber();
        return;
      }

      // Prefixed literals: b"..", b'.', c"..", r"..", r#".."#, br"..", cr"..".
      if (c == 'b' || c == 'c' || c == 'r') {
        if (prefixedLiteral(c)) {
          return;
        }
      }

      if (isIdentifierStart(Character.codePointAt(buffer, pos))) {
        identifierOrKeyword();
        return;
      }

      if (punctuation(c)) {
        return;
      }

      // The error sentinel: nothing else can make progress here.
      int cp = Character.codePointAt(buffer, pos);
      int width = Character.charCount(cp);
      error("invalid character: '" + new String(Character.toChars(cp)) + "'", pos);
      setToken(TokenKind.ILLEGAL, pos, pos + width);
      value = new String(Character.toChars(cp));
      pos += width;
      return;
    }
    setToken(TokenKind.EOF, pos, pos);
  }

  /**
   * Recognizes a string, raw string or char literal that starts with a one- or two-letter prefix.
   * Returns false, consuming nothing, if the prefix letter actually starts an identifier.
   */
  private boolean prefixedLiteral(char c) {
    int literalStart = pos;
    if ((c == 'b' || c == 'c') && peek(1) == '"') {
      pos += 2;
      stringLiteral(literalStart);
      return true;
    }
    if (c == 'b' && peek(1) == '\'') {
      pos += 2;
      charLiteralOrQuote(literalStart);
      if (kind == TokenKind.QUOTE) {
        error("invalid byte literal", literalStart);
        setToken(TokenKind.CHAR, literalStart, pos);
      }
      return true;
    }
    int prefixLength = c == 'r' ? 1 : (peek(1) == 'r' ? 2 : 0);
    if (prefixLength == 0) {
      return false;
    }
    pos += prefixLength;
    RawStringFence fence = scanRawStringStart(literalStart);
    if (fence == null) {
      pos = literalStart;
      return false;
    }
    rawStringLiteral(fence);
    return true;
  }

  /**
   * Scans an integer or float literal, including any type suffix.
   *
   * <p>A '.' after the integer part belongs to the literal only if it is not followed by another
   * '.' (a range) or by an identifier start (a field access or method call). A number directly
   * after a '.' token is a tuple index, and is always scanned as an integer.
   */
  private void scanNumber() {
    int start = pos;
    int c = peek(0);
    boolean isFloat = false;

    if (c == '0' && (peek(1) == 'x' || peek(1) == 'o' || peek(1) == 'b')) {
      int radix = peek(1) == 'x' ? 16 : peek(1) == 'o' ? 8 : 2;
      pos += 2;
      c = peek(0);
      int digits = 0;
      boolean badDigit = false;
      while (c == '_' || digitValue(c) >= 0) {
        if (c != '_') {
          if (digitValue(c) >= radix) {
            if (!isdigit(c)) {
              // Letters after 0b/0o are left for the suffix check, which reports them.
              break;
            }
            if (!badDigit) {
              error("invalid digit '" + (char) c + "' for a base " + radix + " literal", pos);
              badDigit = true;
            }
          }
          digits++;
        }
        c = next();
      }
      if (digits == 0) {
        error("invalid integer literal: no digits after base prefix", start);
      }
    } else {
      while (isdigit(c) || c == '_') {
        c = next();
      }
      if (previousKind != TokenKind.DOT) {
        if (c == '.' && peek(1) != '.' && !isIdentifierStart(peek(1))) {
          isFloat = true;
          c = next(); // consume '.'
          while (isdigit(c) || c == '_') {
            c = next();
          }
        }
        if ((c == 'e' || c == 'E')
            && (isdigit(peek(1))
                || ((peek(1) == '+' || peek(1) == '-') && isdigit(peek(2)))
                || (peek(1) == '_' && isFloat))) {
          isFloat = true;
          c = next(); // consume [eE]
          if (c == '+' || c == '-') {
            c = next();
          }
          while (isdigit(c) || c == '_') {
            c = next();
          }
        }
      }
    }

    // Optional suffix, e.g. 1u8, 2.5f32.
    if (isIdentifierStart(c)) {
      int suffixStart = pos;
      scanIdentifier();
      String suffix = bufferSlice(suffixStart, pos);
      boolean valid =
          isFloat
              ? suffix.equals("f32") || suffix.equals("f64")
              : NUMERIC_SUFFIXES.contains(suffix)
                  || (options.allowVerusSyntax() && OVERLAY_NUMERIC_SUFFIXES.contains(suffix));
      if (!valid) {
        error("invalid suffix '" + suffix + "' for number literal", suffixStart);
      }
    }

    setToken(isFloat ? TokenKind.FLOAT : TokenKind.INT, start, pos);
  }

  private static boolean isdigit(int c) {
    return '0' <= c && c <= '9';
  }

  private static boolean isxdigit(int c) {
    return isdigit(c) || ('A' <= c && c <= 'F') || ('a' <= c && c <= 'f');
  }

  // Returns the value of a hex digit, or -1.
  private static int digitValue(int c) {
    if (isdigit(c)) {
      return c - '0';
    } else if ('a' <= c && c <= 'f') {
      return c - 'a' + 10;
    } else if ('A' <= c && c <= 'F') {
      return c - 'A' + 10;
    }
    return -1;
  }

  /**
   * Returns parts of the source buffer based on offsets
   *
   * @param start the beginning offset for the slice
   * @param end the offset immediately following the slice
   * @return the text at offset start with length end - start
   */
  String bufferSlice(int start, int end) {
    return new String(this.buffer, start, end - start);
  }

  private void addComment(int start, int end, boolean block) {
    comments.add(new Comment(locs, start, bufferSlice(start, end), block));
  }
}
