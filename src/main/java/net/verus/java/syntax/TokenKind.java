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

/** A TokenKind represents the kind of a lexical token. */
public enum TokenKind {
  AMPERSAND("&"),
  AMPERSAND_AMPERSAND("&&"),
  AMPERSAND_EQUALS("&="),
  AS("as"),
  ASYNC("async"),
  AT("@"),
  AWAIT("await"),
  BANG("!"),
  BREAK("break"),
  CARET("^"),
  CARET_EQUALS("^="),
  CHAR("char literal"),
  COLON(":"),
  COLON_COLON("::"),
  COMMA(","),
  CONST("const"),
  CONTINUE("continue"),
  CRATE("crate"),
  DOLLAR("$"),
  DOT("."),
  DOT_DOT(".."),
  DOT_DOT_DOT("..."),
  DOT_DOT_EQUALS("..="),
  DYN("dyn"),
  ELSE("else"),
  ENUM("enum"),
  EOF("EOF"),
  EQUALS("="),
  EQUALS_EQUALS("=="),
  EXTERN("extern"),
  FALSE("false"),
  FAT_ARROW("=>"),
  FLOAT("float literal"),
  FN("fn"),
  FOR("for"),
  GREATER(">"),
  IDENTIFIER("identifier"),
  IF("if"),
  ILLEGAL("illegal character"),
  IMPL("impl"),
  IN("in"),
  INT("integer literal"),
  LBRACE("{"),
  LBRACKET("["),
  LESS("<"),
  LESS_EQUALS("<="),
  LESS_LESS("<<"),
  LESS_LESS_EQUALS("<<="),
  LET("let"),
  LOOP("loop"),
  LPAREN("("),
  MATCH("match"),
  MINUS("-"),
  MINUS_EQUALS("-="),
  MOD("mod"),
  MOVE("move"),
  MUT("mut"),
  NOT_EQUALS("!="),
  PERCENT("%"),
  PERCENT_EQUALS("%="),
  PIPE("|"),
  PIPE_EQUALS("|="),
  PIPE_PIPE("||"),
  PLUS("+"),
  PLUS_EQUALS("+="),
  POUND("#"),
  PUB("pub"),
  QUESTION("?"),
  QUOTE("'"),
  RARROW("->"),
  RAW_STRING("raw string literal"),
  RBRACE("}"),
  RBRACKET("]"),
  REF("ref"),
  RETURN("return"),
  RPAREN(")"),
  SELF("self"),
  SEMI(";"),
  SHEBANG("shebang"),
  SLASH("/"),
  SLASH_EQUALS("/="),
  STAR("*"),
  STAR_EQUALS("*="),
  STATIC("static"),
  STRING("string literal"),
  STRUCT("struct"),
  SUPER("super"),
  TRAIT("trait"),
  TRUE("true"),
  TYPE("type"),
  UNDERSCORE("_"),
  UNSAFE("unsafe"),
  USE("use"),
  WHERE("where"),
  WHILE("while"),
  YIELD("yield"),

  // Verification overlay operators. The lexer produces these only when the overlay is enabled.
  EQUALS_EQUALS_EQUALS("==="),
  EQUALS_TILDE_EQUALS("=~="),
  EQUALS_TILDE_TILDE_EQUALS("=~~="),
  IMPLIES("==>"),
  EXPLIES("<=="),
  EQUIV("<==>"),
  NOT_EQUALS_EQUALS("!==");

  private final String name;

  TokenKind(String name) {
    this.name = name;
  }

  /** Reports whether this token is an opening delimiter of a token tree. */
  boolean isOpenDelimiter() {
    return this == LPAREN || this == LBRACKET || this == LBRACE;
  }

  /** Reports whether this token is a closing delimiter of a token tree. */
  boolean isCloseDelimiter() {
    return this == RPAREN || this == RBRACKET || this == RBRACE;
  }

  /** Returns the closing delimiter matching this opening delimiter. */
  TokenKind closer() {
    switch (this) {
      case LPAREN:
        return RPAREN;
      case LBRACKET:
        return RBRACKET;
      case LBRACE:
        return RBRACE;
      default:
        throw new IllegalStateException("not an opening delimiter: " + this);
    }
  }

  @Override
  public String toString() {
    return name;
  }
}
