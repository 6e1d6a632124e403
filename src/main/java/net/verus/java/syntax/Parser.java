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
import com.google.common.flogger.GoogleLogger;
import com.google.common.primitives.ImmutableIntArray;
import com.google.errorprone.annotations.FormatMethod;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.function.Supplier;
import javax.annotation.Nullable;

/**
 * Recursive descent parser that creates the concrete syntax tree of a source file.
 *
 * <p>The parser never aborts: it reports syntax errors, skips to the end of the offending
 * statement, and carries on, so that the tree covers the whole input.
 */
final class Parser {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  /** Combines the parser result into a single value object. */
  static final class ParseResult {
    // Maps char offsets in the file to Locations.
    final FileLocations locs;

    // The source_file node.
    final SyntaxNode root;

    final ImmutableList<Comment> comments;

    // Errors encountered during scanning or parsing.
    // These lists are ultimately owned by SourceFile.
    final List<SyntaxError> errors;

    private ParseResult(
        FileLocations locs,
        SyntaxNode root,
        ImmutableList<Comment> comments,
        List<SyntaxError> errors) {
      this.locs = locs;
      this.root = root;
      this.comments = comments;
      this.errors = errors;
    }
  }

  private static final EnumSet<TokenKind> LITERAL_TOKENS =
      EnumSet.of(
          TokenKind.INT,
          TokenKind.FLOAT,
          TokenKind.STRING,
          TokenKind.RAW_STRING,
          TokenKind.CHAR,
          TokenKind.TRUE,
          TokenKind.FALSE);

  // Tokens that may begin an expression, used for optional operands such as return values.
  private static final EnumSet<TokenKind> EXPRESSION_START =
      EnumSet.of(
          TokenKind.IDENTIFIER,
          TokenKind.SELF,
          TokenKind.SUPER,
          TokenKind.CRATE,
          TokenKind.COLON_COLON,
          TokenKind.LESS,
          TokenKind.LPAREN,
          TokenKind.LBRACKET,
          TokenKind.LBRACE,
          TokenKind.MINUS,
          TokenKind.STAR,
          TokenKind.BANG,
          TokenKind.AMPERSAND,
          TokenKind.AMPERSAND_AMPERSAND,
          TokenKind.PIPE,
          TokenKind.PIPE_PIPE,
          TokenKind.MOVE,
          TokenKind.IF,
          TokenKind.MATCH,
          TokenKind.WHILE,
          TokenKind.LOOP,
          TokenKind.FOR,
          TokenKind.UNSAFE,
          TokenKind.ASYNC,
          TokenKind.CONST,
          TokenKind.STATIC,
          TokenKind.RETURN,
          TokenKind.BREAK,
          TokenKind.CONTINUE,
          TokenKind.YIELD,
          TokenKind.QUOTE,
          TokenKind.DOT_DOT,
          TokenKind.DOT_DOT_EQUALS,
          TokenKind.POUND,
          TokenKind.DOLLAR,
          TokenKind.INT,
          TokenKind.FLOAT,
          TokenKind.STRING,
          TokenKind.RAW_STRING,
          TokenKind.CHAR,
          TokenKind.TRUE,
          TokenKind.FALSE);

  private static final ImmutableSet<String> PRIMITIVE_TYPES =
      ImmutableSet.of(
          "bool", "str", "char", "u8", "i8", "u16", "i16", "u32", "i32", "u64", "i64", "u128",
          "i128", "isize", "usize", "f32", "f64");

  private static final ImmutableSet<String> OVERLAY_PRIMITIVE_TYPES = ImmutableSet.of("int", "nat");

  // Overlay words that open a clause of a function or loop specification.
  private static final ImmutableSet<String> FUNCTION_CLAUSE_WORDS =
      ImmutableSet.of(
          "requires", "recommends", "ensures", "returns", "decreases", "opens_invariants",
          "no_unwind");

  private static final ImmutableSet<String> LOOP_CLAUSE_WORDS =
      ImmutableSet.of(
          "invariant", "invariant_ensures", "invariant_except_break", "ensures", "decreases");

  private static final int MAX_REPORTED_ERRORS = 5;

  private final FileLocations locs;
  private final char[] buffer;
  private final Grammar grammar;
  private final boolean verus;
  private final List<SyntaxError> errors;
  private final ImmutableList<Token> tokens;

  private int pos; // index of the current token
  private Token token; // current lookahead token
  private int lastEnd; // end offset of the last consumed token
  @Nullable private TokenKind lastKind; // kind of the last consumed token

  private int errorsCount;
  private int failures; // syntax errors seen, including those suppressed in recovery mode
  private boolean recoveryMode; // stop reporting errors until next statement

  // True while parsing a condition or iterable, where '{' opens a block, not a struct literal.
  private boolean noStructLiteral;

  // Index of the '}' that follows the most recent trailing expression of a block.
  private int tailPos = -1;

  // Index of the first token of the big connective being parsed, or -1 outside one.
  private int bigConnectiveStart = -1;

  private Parser(ParserInput input, FileOptions options, List<SyntaxError> errors, Lexer lexer) {
    this.locs = lexer.locs;
    this.buffer = input.getContent();
    this.grammar = Grammar.of(options);
    this.verus = options.allowVerusSyntax();
    this.errors = errors;
    this.tokens = lexer.tokenize();
    this.token = tokens.get(0);
  }

  /** Main entry point for parsing a file. */
  static ParseResult parseFile(ParserInput input, FileOptions options) {
    List<SyntaxError> errors = new ArrayList<>();
    Lexer lexer = new Lexer(input, options, errors);
    Parser parser = new Parser(input, options, errors, lexer);
    SyntaxNode root;
    try {
      root = parser.parseSourceFile();
    } catch (StackOverflowError ex) {
      // JVM threads have very limited stack, and deeply nested inputs can exhaust it. A parse
      // error is the most robust outcome.
      parser.reportError(0, "input is too deeply nested");
      root =
          SyntaxNode.builder(parser.locs, NodeKind.SOURCE_FILE, 0)
              .build(input.getContent().length);
    }
    return new ParseResult(lexer.locs, root, lexer.getComments(), errors);
  }

  /** Parses a single expression that must span the whole input. */
  static SyntaxNode parseExpression(ParserInput input, FileOptions options)
      throws SyntaxError.Exception {
    List<SyntaxError> errors = new ArrayList<>();
    Lexer lexer = new Lexer(input, options, errors);
    Parser parser = new Parser(input, options, errors, lexer);
    SyntaxNode result;
    try {
      result = parser.parseExpression();
      if (parser.token.kind != TokenKind.EOF) {
        parser.syntaxError("expected end of input");
      }
    } catch (StackOverflowError ex) {
      throw new SyntaxError.Exception(
          ImmutableList.of(
              new SyntaxError(lexer.locs.getLocation(0), "input is too deeply nested")));
    }
    if (!errors.isEmpty()) {
      throw new SyntaxError.Exception(errors);
    }
    return result;
  }

  // ==== Tokens ====

  private Token peek(int n) {
    return tokens.get(Math.min(pos + n, tokens.size() - 1));
  }

  private TokenKind peekKind(int n) {
    return peek(n).kind;
  }

  private boolean at(TokenKind kind) {
    return token.kind == kind;
  }

  private void nextToken() {
    if (token.kind != TokenKind.EOF) {
      lastEnd = token.end;
      lastKind = token.kind;
      pos++;
      token = tokens.get(pos);
    }
  }

  // Moves to the token at the given index, as if all tokens before it had been consumed.
  private void advanceTo(int index) {
    while (pos < index && token.kind != TokenKind.EOF) {
      nextToken();
    }
  }

  private String text(Token t) {
    return new String(buffer, t.start, t.end - t.start);
  }

  // Returns an anonymous leaf for the current token and consumes it.
  private SyntaxNode take() {
    return takeAs(NodeKind.TOKEN);
  }

  // Returns a named leaf of the given kind for the current token and consumes it.
  private SyntaxNode takeAs(NodeKind kind) {
    SyntaxNode leaf = SyntaxNode.leaf(locs, kind, token.start, token.end, text(token));
    nextToken();
    return leaf;
  }

  // Consumes the current token if it has the expected kind; reports an error otherwise.
  @Nullable
  private SyntaxNode expect(TokenKind kind) {
    if (token.kind == kind) {
      return take();
    }
    syntaxError("expected '" + kind + "'");
    return null;
  }

  // Reports whether the current token is the given overlay contextual keyword.
  private boolean isWord(String word) {
    return isWordAt(0, word);
  }

  private boolean isWordAt(int n, String word) {
    Token t = peek(n);
    return verus
        && t.kind == TokenKind.IDENTIFIER
        && word.equals(t.value)
        && grammar.isContextualKeyword(word);
  }

  // Reports whether the token n ahead is an identifier with the given text. Used for the
  // contextual keywords of the base language (union, default, auto, macro_rules).
  private boolean isNameAt(int n, String name) {
    Token t = peek(n);
    return t.kind == TokenKind.IDENTIFIER && name.equals(t.value);
  }

  @Nullable
  private SyntaxNode expectWord(String word) {
    if (isWord(word)) {
      return take();
    }
    syntaxError("expected '" + word + "'");
    return null;
  }

  private SyntaxNode.Builder node(NodeKind kind) {
    return SyntaxNode.builder(locs, kind, token.start);
  }

  private SyntaxNode.Builder nodeAt(NodeKind kind, int start) {
    return SyntaxNode.builder(locs, kind, start);
  }

  private SyntaxNode finish(SyntaxNode.Builder b) {
    return b.build(lastEnd);
  }

  // An empty error node standing in for a missing required part.
  private SyntaxNode missing() {
    return SyntaxNode.builder(locs, NodeKind.ERROR, token.start).build(token.start);
  }

  // ==== Errors ====

  @FormatMethod
  private void reportError(int offset, String format, Object... args) {
    errorsCount++;
    // Limit the number of reported errors to avoid spamming output.
    if (errorsCount <= MAX_REPORTED_ERRORS) {
      Location location = locs.getLocation(offset);
      errors.add(new SyntaxError(location, String.format(format, args)));
    }
  }

  private void syntaxError(String message) {
    failures++;
    if (!recoveryMode) {
      // The lexer has already reported illegal characters.
      if (token.kind != TokenKind.ILLEGAL) {
        reportError(token.start, "syntax error at '%s': %s", tokenString(token), message);
      }
      recoveryMode = true;
    }
  }

  private String tokenString(Token t) {
    return t.kind == TokenKind.EOF ? "EOF" : text(t);
  }

  /**
   * Skips the rest of a statement after a syntax error: everything up to and including the next
   * ';' at the same nesting depth, or up to the '}' that closes the enclosing block. Returns an
   * error node holding the skipped tokens, or null if nothing was skipped.
   */
  @Nullable
  private SyntaxNode syncStatement(boolean topLevel) {
    if (lastKind == TokenKind.SEMI || lastKind == TokenKind.RBRACE) {
      return null; // the statement ended cleanly despite the error
    }
    SyntaxNode.Builder b = node(NodeKind.ERROR);
    int depth = 0;
    int skipped = 0;
    while (token.kind != TokenKind.EOF) {
      if (depth == 0 && token.kind == TokenKind.SEMI) {
        b.add(take());
        skipped++;
        break;
      }
      if (depth == 0 && token.kind == TokenKind.RBRACE && !topLevel) {
        break;
      }
      if (token.kind.isOpenDelimiter()) {
        depth++;
      } else if (token.kind.isCloseDelimiter()) {
        depth = Math.max(0, depth - 1);
        if (depth == 0 && token.kind == TokenKind.RBRACE) {
          b.add(take());
          skipped++;
          if (topLevel) {
            break;
          }
          continue;
        }
      }
      b.add(take());
      skipped++;
    }
    if (skipped == 0) {
      return null;
    }
    logger.atFine().log(
        "skipped %d tokens after syntax error before %s", skipped, locs.getLocation(lastEnd));
    return finish(b);
  }

  // ==== Conflicts ====

  private void checkDeclared(Conflict conflict) {
    Preconditions.checkState(
        grammar.hasConflict(conflict), "conflict %s is not declared", conflict.name());
  }

  /**
   * Decides a declared conflict deterministically: reports whether the current token is one of
   * the tokens that select the first of the conflicting readings.
   */
  private boolean decide(Conflict conflict) {
    return decide(conflict, 0);
  }

  // As decide(conflict), for the token n ahead of the current one.
  private boolean decide(Conflict conflict, int n) {
    checkDeclared(conflict);
    return conflict.resolvingTokens().contains(peekKind(n));
  }

  /**
   * Resolves a declared conflict by trying each reading in turn. A reading is accepted if it
   * parses without error and ends next to one of the conflict's resolving tokens; otherwise the
   * parser backtracks. The last reading is kept unconditionally, with its errors.
   */
  private SyntaxNode resolve(Conflict conflict, List<Supplier<SyntaxNode>> readings) {
    checkDeclared(conflict);
    int savedPos = pos;
    int savedLastEnd = lastEnd;
    TokenKind savedLastKind = lastKind;
    int savedErrors = errors.size();
    int savedCount = errorsCount;
    int savedFailures = failures;
    boolean savedRecovery = recoveryMode;
    for (int i = 0; ; i++) {
      recoveryMode = false;
      SyntaxNode result = readings.get(i).get();
      boolean clean =
          failures == savedFailures
              && (conflict.resolvingTokens().contains(token.kind)
                  || conflict.resolvingTokens().contains(lastKind));
      if (clean || i == readings.size() - 1) {
        if (savedRecovery) {
          // Errors are not reported while recovering.
          errors.subList(savedErrors, errors.size()).clear();
          errorsCount = savedCount;
          recoveryMode = true;
        }
        return result;
      }
      pos = savedPos;
      token = tokens.get(pos);
      lastEnd = savedLastEnd;
      lastKind = savedLastKind;
      errors.subList(savedErrors, errors.size()).clear();
      errorsCount = savedCount;
      failures = savedFailures;
    }
  }

  // ==== Statements ====

  // source_file = shebang? statement*
  private SyntaxNode parseSourceFile() {
    SyntaxNode.Builder b = nodeAt(NodeKind.SOURCE_FILE, 0);
    if (at(TokenKind.SHEBANG)) {
      b.add(takeAs(NodeKind.SHEBANG));
    }
    parseStatements(b, /*topLevel=*/ true, /*allowExpressions=*/ true);
    return b.build(buffer.length);
  }

  /**
   * Parses statements into b until the closing brace of the enclosing block (or EOF at the top
   * level). A trailing expression without semicolon ends the sequence.
   */
  private void parseStatements(SyntaxNode.Builder b, boolean topLevel, boolean allowExpressions) {
    while (token.kind != TokenKind.EOF && (topLevel || token.kind != TokenKind.RBRACE)) {
      int before = pos;
      boolean tail = false;
      if (!topLevel && allowExpressions && peekBigConnective() != null) {
        b.add(parseBigConnective());
        tail = true;
      } else if (topLevel && at(TokenKind.RBRACE)) {
        syntaxError("unexpected '}'");
      } else {
        b.add(parseStatement(!topLevel && allowExpressions, allowExpressions));
        tail = tailPos == pos;
      }
      if (recoveryMode) {
        b.add(syncStatement(topLevel));
        recoveryMode = false;
        tail = false;
      }
      if (pos == before) {
        // No progress: drop the offending token.
        SyntaxNode.Builder err = node(NodeKind.ERROR);
        err.add(take());
        b.add(finish(err));
      }
      if (tail) {
        break;
      }
    }
  }

  /**
   * Parses one statement. An expression that is not followed by ';' is returned bare when it is
   * the last thing in a block (allowTail); block-like expressions become expression statements.
   */
  private SyntaxNode parseStatement(boolean allowTail, boolean allowExpressions) {
    switch (token.kind) {
      case SEMI:
        {
          SyntaxNode.Builder b = node(NodeKind.EMPTY_STATEMENT);
          b.add(take());
          return finish(b);
        }
      case POUND:
        return parseAttributeItem();
      case LET:
        if (allowExpressions) {
          return parseLetDeclaration();
        }
        break;
      case PUB:
      case FN:
      case STRUCT:
      case ENUM:
      case TYPE:
      case MOD:
      case TRAIT:
      case IMPL:
      case USE:
      case EXTERN:
        return parseItem();
      case STATIC:
        if (peekKind(1) != TokenKind.PIPE
            && peekKind(1) != TokenKind.PIPE_PIPE
            && peekKind(1) != TokenKind.MOVE
            && peekKind(1) != TokenKind.ASYNC) {
          return parseItem();
        }
        break;
      case CONST:
        if (peekKind(1) != TokenKind.LBRACE) {
          return parseItem();
        }
        break;
      case UNSAFE:
        if (peekKind(1) != TokenKind.LBRACE) {
          return parseItem();
        }
        break;
      case ASYNC:
        if (peekKind(1) != TokenKind.LBRACE
            && peekKind(1) != TokenKind.MOVE
            && peekKind(1) != TokenKind.PIPE
            && peekKind(1) != TokenKind.PIPE_PIPE) {
          return parseItem();
        }
        break;
      case CRATE:
        if (!decide(Conflict.VISIBILITY_VS_SCOPED_PATH, 1)) {
          return parseItem();
        }
        break;
      case IDENTIFIER:
        if (isItemWord()) {
          return isNameAt(0, "macro_rules") ? parseMacroDefinition() : parseItem();
        }
        if (isWord("verus") && peekKind(1) == TokenKind.BANG && peekKind(2) == TokenKind.LBRACE) {
          return parseVerusBlock();
        }
        break;
      default:
        break;
    }
    if (!allowExpressions) {
      if (isPathStart() && isMacroInvocationAhead()) {
        return parseExpressionPathOrMacro();
      }
      syntaxError("expected item");
      return missing();
    }
    return parseExpressionStatement(allowTail);
  }

  // Reports whether the identifier at the current token starts an item.
  private boolean isItemWord() {
    if (isNameAt(0, "macro_rules")) {
      return peekKind(1) == TokenKind.BANG && peekKind(2) == TokenKind.IDENTIFIER;
    }
    if (isNameAt(0, "union")) {
      return peekKind(1) == TokenKind.IDENTIFIER;
    }
    if (isNameAt(0, "default")) {
      return EnumSet.of(
              TokenKind.FN, TokenKind.UNSAFE, TokenKind.ASYNC, TokenKind.CONST, TokenKind.TYPE,
              TokenKind.IMPL, TokenKind.EXTERN, TokenKind.PUB)
          .contains(peekKind(1));
    }
    if (isNameAt(0, "auto")) {
      return peekKind(1) == TokenKind.TRAIT;
    }
    if (!verus) {
      return false;
    }
    if (isWord("open") || isWord("closed")) {
      return peekKind(1) == TokenKind.FN
          || peekKind(1) == TokenKind.CONST
          || isModeWordAt(1)
          || isWordAt(1, "broadcast");
    }
    if (isModeWordAt(0)) {
      return isModeFollower(1);
    }
    if (isWord("broadcast")) {
      return isWordAt(1, "group")
          || peekKind(1) == TokenKind.USE
          || peekKind(1) == TokenKind.FN
          || isModeWordAt(1)
          || isWordAt(1, "open")
          || isWordAt(1, "closed");
    }
    if (isWord("global")) {
      return isWordAt(1, "size_of") || isWordAt(1, "layout");
    }
    if (isWord("assume_specification")) {
      return peekKind(1) == TokenKind.LBRACKET || peekKind(1) == TokenKind.LESS;
    }
    if (isWord("ghost") || isWord("tracked")) {
      return peekKind(1) == TokenKind.STRUCT
          || peekKind(1) == TokenKind.ENUM
          || isNameAt(1, "union");
    }
    return false;
  }

  private boolean isModeWordAt(int n) {
    return isWordAt(n, "spec") || isWordAt(n, "proof") || isWordAt(n, "exec");
  }

  // Reports whether the token n ahead can follow a function mode word in an item.
  private boolean isModeFollower(int n) {
    TokenKind kind = peekKind(n);
    return kind == TokenKind.FN
        || kind == TokenKind.CONST
        || kind == TokenKind.STATIC
        || kind == TokenKind.UNSAFE
        || kind == TokenKind.ASYNC
        || isWordAt(n, "broadcast")
        || (kind == TokenKind.LPAREN && isWordAt(n + 1, "checked"));
  }

  // verus_block = 'verus' '!' '{' statement* '}'
  private SyntaxNode parseVerusBlock() {
    SyntaxNode.Builder b = node(NodeKind.VERUS_BLOCK);
    b.add(take());
    b.add(take());
    b.add(take());
    parseStatements(b, /*topLevel=*/ false, /*allowExpressions=*/ true);
    b.add(expect(TokenKind.RBRACE));
    return finish(b);
  }

  // let_declaration = 'let' 'ghost'? 'tracked'? 'mut'? pattern (':' type)? ('=' expr ('else'
  // block)?)? ';'
  private SyntaxNode parseLetDeclaration() {
    SyntaxNode.Builder b = node(NodeKind.LET_DECLARATION);
    b.add(take());
    if (isWord("ghost") || isWord("tracked")) {
      b.add(take());
    }
    if (at(TokenKind.MUT)) {
      b.add(takeAs(NodeKind.MUTABLE_SPECIFIER));
    }
    b.add("pattern", parsePattern());
    if (at(TokenKind.COLON)) {
      b.add(take());
      b.add("type", parseType());
    }
    if (at(TokenKind.EQUALS)) {
      b.add(take());
      b.add("value", parseExpression());
      if (at(TokenKind.ELSE)) {
        b.add(take());
        b.add("alternative", parseBlock());
      }
    }
    b.add(expect(TokenKind.SEMI));
    return finish(b);
  }

  // attribute_item = '#' '!'? '[' attribute ']'
  private SyntaxNode parseAttributeItem() {
    boolean inner = peekKind(1) == TokenKind.BANG;
    SyntaxNode.Builder b = node(inner ? NodeKind.INNER_ATTRIBUTE_ITEM : NodeKind.ATTRIBUTE_ITEM);
    b.add(take());
    if (inner) {
      b.add(take());
    }
    b.add(expect(TokenKind.LBRACKET));
    b.add(parseAttribute());
    b.add(expect(TokenKind.RBRACKET));
    return finish(b);
  }

  // attribute = 'trigger' (expr (',' expr)*)?
  //           | path ('=' expr | token_tree)?
  private SyntaxNode parseAttribute() {
    SyntaxNode.Builder b = node(NodeKind.ATTRIBUTE);
    if (isWord("trigger")) {
      b.add(take());
      while (!at(TokenKind.RBRACKET) && !at(TokenKind.EOF)) {
        b.add(parseExpression());
        if (!at(TokenKind.COMMA)) {
          break;
        }
        b.add(take());
      }
      return finish(b);
    }
    if (at(TokenKind.UNSAFE)) {
      // #[unsafe(no_mangle)]
      b.add(takeAs(NodeKind.IDENTIFIER));
    } else {
      b.add(parseSimplePath());
    }
    if (at(TokenKind.EQUALS)) {
      b.add(take());
      b.add("value", parseExpression());
    } else if (at(TokenKind.LPAREN) || at(TokenKind.LBRACKET) || at(TokenKind.LBRACE)) {
      b.add("arguments", parseDelimitedTokenTree(TokenTreeMode.INVOCATION));
    }
    return finish(b);
  }

  // An expression statement, or the trailing expression of a block.
  private SyntaxNode parseExpressionStatement(boolean allowTail) {
    int start = token.start;
    SyntaxNode e;
    if (isBlockLikeStart()) {
      e = parseBlockLikeExpression();
      if (at(TokenKind.DOT) || at(TokenKind.QUESTION)) {
        e = parseBinaryTail(parsePostfix(e), ASSIGN_LEVEL);
      } else {
        SyntaxNode.Builder b = nodeAt(NodeKind.EXPRESSION_STATEMENT, start);
        b.add(e);
        return finish(b);
      }
    } else {
      e = parseExpression();
      if (e.kind() == NodeKind.MACRO_INVOCATION
          && isBraceDelimited(e)
          && !at(TokenKind.SEMI)) {
        return e;
      }
      if (e.kind() == NodeKind.ASSERT_BY_BLOCK_EXPRESSION
          && lastKind == TokenKind.RBRACE
          && !at(TokenKind.SEMI)) {
        // assert(..) by { .. } ends with a block, so like one it needs no ';'.
        SyntaxNode.Builder b = nodeAt(NodeKind.EXPRESSION_STATEMENT, start);
        b.add(e);
        return finish(b);
      }
    }
    if (at(TokenKind.SEMI)) {
      SyntaxNode.Builder b = nodeAt(NodeKind.EXPRESSION_STATEMENT, start);
      b.add(e);
      b.add(take());
      return finish(b);
    }
    if (allowTail && at(TokenKind.RBRACE)) {
      tailPos = pos;
      return e;
    }
    syntaxError("expected ';'");
    SyntaxNode.Builder b = nodeAt(NodeKind.EXPRESSION_STATEMENT, start);
    b.add(e);
    return finish(b);
  }

  private static boolean isBraceDelimited(SyntaxNode macro) {
    SyntaxNode tree = macro.getChild(NodeKind.TOKEN_TREE);
    return tree != null && "{".equals(tree.getChildren().get(0).getText());
  }

  /**
   * Returns "&&&" or "|||" if the current token is a '&&' (or '||') directly followed by a '&' (or
   * '|') and the overlay is on, and null otherwise. The lexer scans both as two tokens, so that
   * base-language code such as {@code a &&&b} lexes the same with and without the overlay; only the
   * parser decides where the pair reads as one big connective.
   */
  @Nullable
  private String peekBigConnective() {
    if (!verus || !token.joint) {
      return null;
    }
    if (at(TokenKind.AMPERSAND_AMPERSAND) && peekKind(1) == TokenKind.AMPERSAND) {
      return "&&&";
    } else if (at(TokenKind.PIPE_PIPE) && peekKind(1) == TokenKind.PIPE) {
      return "|||";
    }
    return null;
  }

  /**
   * Reports whether the current position continues the enclosing big connective: a glued '&&&' or
   * '|||' outside any delimiter opened since the connective began. Such a pair ends the operand
   * instead of being read as '&&' or '||' applied to a reference or closure.
   */
  private boolean atBigConnectiveContinuation() {
    if (bigConnectiveStart < 0 || peekBigConnective() == null) {
      return false;
    }
    int depth = 0;
    for (int i = bigConnectiveStart; i < pos; i++) {
      TokenKind kind = tokens.get(i).kind;
      if (kind.isOpenDelimiter()) {
        depth++;
      } else if (kind.isCloseDelimiter()) {
        depth--;
      }
    }
    return depth == 0;
  }

  // big_and = ('&&&' expr)+   big_or = ('|||' expr)+
  private SyntaxNode parseBigConnective() {
    String op = peekBigConnective();
    SyntaxNode.Builder b =
        node(op.equals("&&&") ? NodeKind.BIG_AND_EXPRESSION : NodeKind.BIG_OR_EXPRESSION);
    int outer = bigConnectiveStart;
    bigConnectiveStart = pos;
    while (op.equals(peekBigConnective())) {
      b.add(takeJoined(2));
      b.add(parseExpression());
    }
    bigConnectiveStart = outer;
    if (peekBigConnective() != null) {
      syntaxError("'&&&' and '|||' cannot be mixed without braces");
    }
    return finish(b);
  }

  // ==== Items ====

  /**
   * Parses an item: the optional visibility and modifiers shared by all items, then the keyword
   * that decides which item it is.
   */
  private SyntaxNode parseItem() {
    int start = token.start;
    List<SyntaxNode> prefix = new ArrayList<>();
    addIfPresent(prefix, parseVisibilityModifier());
    if ((isWord("open") || isWord("closed"))
        && (peekKind(1) == TokenKind.FN
            || peekKind(1) == TokenKind.CONST
            || isModeWordAt(1)
            || isWordAt(1, "broadcast"))) {
      SyntaxNode.Builder b = node(NodeKind.PUBLISH);
      b.add(take());
      prefix.add(finish(b));
    }
    addIfPresent(prefix, parseFunctionModifiers());
    parseFunctionMode(prefix);
    if (isWord("broadcast") && (peekKind(1) == TokenKind.FN || isModeWordAt(1))) {
      prefix.add(take());
      parseFunctionMode(prefix);
    }
    if ((isWord("ghost") || isWord("tracked"))
        && (peekKind(1) == TokenKind.STRUCT
            || peekKind(1) == TokenKind.ENUM
            || isNameAt(1, "union"))) {
      prefix.add(parseDataMode());
    }

    switch (token.kind) {
      case FN:
        return parseFunction(start, prefix);
      case CONST:
        return parseConstItem(start, prefix);
      case STATIC:
        return parseStaticItem(start, prefix);
      case STRUCT:
        return parseStructItem(start, prefix);
      case ENUM:
        return parseEnumItem(start, prefix);
      case TYPE:
        return parseTypeItem(start, prefix);
      case MOD:
        return parseModItem(start, prefix);
      case TRAIT:
        return parseTraitItem(start, prefix);
      case UNSAFE:
        if (peekKind(1) == TokenKind.IMPL) {
          return parseImplItem(start, prefix);
        }
        return parseTraitItem(start, prefix);
      case IMPL:
        return parseImplItem(start, prefix);
      case USE:
        return parseUseDeclaration(start, prefix);
      case EXTERN:
        return peekKind(1) == TokenKind.CRATE
            ? parseExternCrateDeclaration(start, prefix)
            : parseForeignModItem(start, prefix);
      case IDENTIFIER:
        if (isNameAt(0, "union") && peekKind(1) == TokenKind.IDENTIFIER) {
          return parseUnionItem(start, prefix);
        }
        if (isNameAt(0, "auto") && peekKind(1) == TokenKind.TRAIT) {
          return parseTraitItem(start, prefix);
        }
        if (isWord("broadcast") && isWordAt(1, "group")) {
          return parseBroadcastGroup(start, prefix);
        }
        if (isWord("broadcast") && peekKind(1) == TokenKind.USE) {
          return parseBroadcastUse(start, prefix);
        }
        if (isWord("global")) {
          return parseGlobalItem(start, prefix);
        }
        if (isWord("assume_specification")) {
          return parseAssumeSpecification(start, prefix);
        }
        break;
      default:
        break;
    }
    syntaxError("expected item");
    SyntaxNode.Builder b = nodeAt(NodeKind.ERROR, start);
    prefix.forEach(b::add);
    return finish(b);
  }

  private static void addIfPresent(List<SyntaxNode> list, @Nullable SyntaxNode node) {
    if (node != null) {
      list.add(node);
    }
  }

  // Reports each part of an item's prefix that this kind of item does not accept.
  private void checkPrefix(List<SyntaxNode> prefix, String item, NodeKind... allowed) {
    ImmutableSet<NodeKind> ok = ImmutableSet.copyOf(allowed);
    for (SyntaxNode part : prefix) {
      if (!ok.contains(part.kind())) {
        failures++;
        reportError(
            part.getStartOffset(), "%s is not allowed on %s", describe(part), item);
      }
    }
  }

  private static String describe(SyntaxNode node) {
    return node.isLeaf()
        ? "'" + node.getText() + "'"
        : node.kind().getName().replace('_', ' ');
  }

  // SyntaxNode.Builder for an item whose prefix has already been parsed.
  private SyntaxNode.Builder itemNode(NodeKind kind, int start, List<SyntaxNode> prefix) {
    SyntaxNode.Builder b = nodeAt(kind, start);
    prefix.forEach(b::add);
    return b;
  }

  // visibility_modifier = 'crate' | 'pub' ('(' ('crate' | 'self' | 'super' | 'in' path) ')')?
  @Nullable
  private SyntaxNode parseVisibilityModifier() {
    if (at(TokenKind.CRATE) && !decide(Conflict.VISIBILITY_VS_SCOPED_PATH, 1)) {
      SyntaxNode.Builder b = node(NodeKind.VISIBILITY_MODIFIER);
      b.add(takeAs(NodeKind.CRATE));
      return finish(b);
    }
    if (!at(TokenKind.PUB)) {
      return null;
    }
    if (peekKind(1) != TokenKind.LPAREN) {
      return parseVisibility(false);
    }
    return resolve(
        Conflict.VISIBILITY_MODIFIER,
        ImmutableList.of(() -> parseVisibility(true), () -> parseVisibility(false)));
  }

  private SyntaxNode parseVisibility(boolean restricted) {
    SyntaxNode.Builder b = node(NodeKind.VISIBILITY_MODIFIER);
    b.add(take());
    if (restricted) {
      b.add(take());
      switch (token.kind) {
        case CRATE:
          b.add(takeAs(NodeKind.CRATE));
          break;
        case SELF:
          b.add(takeAs(NodeKind.SELF));
          break;
        case SUPER:
          b.add(takeAs(NodeKind.SUPER));
          break;
        case IN:
          b.add(take());
          b.add(parseSimplePath());
          break;
        default:
          syntaxError("expected 'crate', 'self', 'super' or 'in'");
          break;
      }
      b.add(expect(TokenKind.RPAREN));
    }
    return finish(b);
  }

  // function_modifiers = ('async' | 'default' | 'const' | 'unsafe' | extern_modifier)+
  @Nullable
  private SyntaxNode parseFunctionModifiers() {
    SyntaxNode.Builder b = node(NodeKind.FUNCTION_MODIFIERS);
    while (true) {
      TokenKind next = peekKind(1);
      if (at(TokenKind.ASYNC) && next != TokenKind.LBRACE && next != TokenKind.MOVE) {
        b.add(take());
      } else if (isNameAt(0, "default")
          && EnumSet.of(
                  TokenKind.FN, TokenKind.UNSAFE, TokenKind.ASYNC, TokenKind.CONST,
                  TokenKind.EXTERN)
              .contains(next)) {
        b.add(take());
      } else if (at(TokenKind.CONST)
          && (next == TokenKind.FN
              || next == TokenKind.UNSAFE
              || next == TokenKind.ASYNC
              || next == TokenKind.EXTERN)) {
        b.add(take());
      } else if (at(TokenKind.UNSAFE)
          && next != TokenKind.IMPL
          && next != TokenKind.TRAIT
          && next != TokenKind.LBRACE
          && !isNameAt(1, "auto")) {
        b.add(take());
      } else if (at(TokenKind.EXTERN)
          && (next == TokenKind.FN
              || (next == TokenKind.STRING
                  && (peekKind(2) == TokenKind.FN || peekKind(2) == TokenKind.UNSAFE)))) {
        b.add(parseExternModifier());
      } else {
        break;
      }
    }
    return b.isEmpty() ? null : finish(b);
  }

  // extern_modifier = 'extern' string_literal?
  private SyntaxNode parseExternModifier() {
    SyntaxNode.Builder b = node(NodeKind.EXTERN_MODIFIER);
    b.add(take());
    if (at(TokenKind.STRING) || at(TokenKind.RAW_STRING)) {
      b.add(parseLiteral());
    }
    return finish(b);
  }

  // function_mode = 'spec' ('(' 'checked' ')')? | 'proof' | 'exec'
  private void parseFunctionMode(List<SyntaxNode> prefix) {
    if (!isModeWordAt(0) || !isModeFollower(1)) {
      return;
    }
    SyntaxNode.Builder b = node(NodeKind.FUNCTION_MODE);
    boolean spec = isWord("spec");
    b.add(take());
    if (spec && at(TokenKind.LPAREN)) {
      b.add(take());
      b.add(expectWord("checked"));
      b.add(expect(TokenKind.RPAREN));
    }
    prefix.add(finish(b));
  }

  // data_mode = 'ghost' | 'tracked'
  private SyntaxNode parseDataMode() {
    SyntaxNode.Builder b = node(NodeKind.DATA_MODE);
    b.add(take());
    return finish(b);
  }

  private SyntaxNode expectIdentifier() {
    if (at(TokenKind.IDENTIFIER)) {
      return takeAs(NodeKind.IDENTIFIER);
    }
    syntaxError("expected identifier");
    return missing();
  }

  private SyntaxNode expectTypeIdentifier() {
    if (at(TokenKind.IDENTIFIER)) {
      return takeAs(NodeKind.TYPE_IDENTIFIER);
    }
    syntaxError("expected type name");
    return missing();
  }

  // function_item = prefix 'fn' name type_parameters? parameters ('->' return_type)?
  //                 where_clause? prover? fn_qualifier? (block | ';')
  private SyntaxNode parseFunction(int start, List<SyntaxNode> prefix) {
    checkPrefix(
        prefix,
        "functions",
        NodeKind.VISIBILITY_MODIFIER,
        NodeKind.PUBLISH,
        NodeKind.FUNCTION_MODIFIERS,
        NodeKind.FUNCTION_MODE,
        NodeKind.TOKEN);
    SyntaxNode.Builder b = itemNode(NodeKind.FUNCTION_ITEM, start, prefix);
    b.add(take());
    b.add("name", isMetavariableStart() ? parseMetavariable() : expectIdentifier());
    if (at(TokenKind.LESS)) {
      b.add("type_parameters", parseTypeParameters());
    }
    b.add("parameters", parseParameters());
    if (at(TokenKind.RARROW)) {
      b.add(take());
      b.add("return_type", parseReturnType());
    }
    if (at(TokenKind.WHERE)) {
      b.add(parseWhereClause());
    }
    if (isWord("by")) {
      b.add(parseProver());
    }
    if (isFunctionClauseStart()) {
      b.add(parseFnQualifier());
    }
    if (at(TokenKind.LBRACE)) {
      b.add("body", parseBlock());
    } else {
      b.setKind(NodeKind.FUNCTION_SIGNATURE_ITEM);
      b.add(expect(TokenKind.SEMI));
    }
    return finish(b);
  }

  // return_type = type | '(' 'tracked'? identifier ':' type ')'
  private SyntaxNode parseReturnType() {
    SyntaxNode.Builder b = node(NodeKind.RETURN_TYPE);
    int name = isWordAt(1, "tracked") ? 2 : 1;
    if (verus
        && at(TokenKind.LPAREN)
        && peekKind(name) == TokenKind.IDENTIFIER
        && peekKind(name + 1) == TokenKind.COLON) {
      b.add(take());
      if (name == 2) {
        b.add(take());
      }
      b.add(takeAs(NodeKind.IDENTIFIER));
      b.add(take());
      b.add(parseType());
      b.add(expect(TokenKind.RPAREN));
    } else {
      b.add(parseType());
    }
    return finish(b);
  }

  // prover = 'by' ('(' identifier ')')?
  private SyntaxNode parseProver() {
    SyntaxNode.Builder b = node(NodeKind.PROVER);
    b.add(take());
    if (at(TokenKind.LPAREN)) {
      b.add(take());
      b.add(expectIdentifier());
      b.add(expect(TokenKind.RPAREN));
    }
    return finish(b);
  }

  private boolean isFunctionClauseStart() {
    return verus
        && at(TokenKind.IDENTIFIER)
        && FUNCTION_CLAUSE_WORDS.contains(token.value)
        && isWord((String) token.value);
  }

  private boolean isLoopClauseStart() {
    return verus
        && at(TokenKind.IDENTIFIER)
        && LOOP_CLAUSE_WORDS.contains(token.value)
        && isWord((String) token.value);
  }

  // fn_qualifier = (requires | recommends | ensures | returns | decreases | opens_invariants
  //                 | no_unwind)+
  private SyntaxNode parseFnQualifier() {
    SyntaxNode.Builder b = node(NodeKind.FN_QUALIFIER);
    while (isFunctionClauseStart()) {
      b.add(parseClause());
    }
    return finish(b);
  }

  // Parses the loop specification clauses that precede a loop body.
  private void parseLoopClauses(SyntaxNode.Builder b) {
    while (isLoopClauseStart()) {
      b.add(parseClause());
    }
  }

  private SyntaxNode parseClause() {
    String word = (String) token.value;
    switch (word) {
      case "requires":
        return parseExpressionListClause(NodeKind.REQUIRES_CLAUSE, Conflict.REQUIRES_CLAUSE);
      case "ensures":
        return parseExpressionListClause(NodeKind.ENSURES_CLAUSE, Conflict.ENSURES_CLAUSE);
      case "recommends":
        return parseExpressionListClause(NodeKind.RECOMMENDS_CLAUSE, Conflict.RECOMMENDS_CLAUSE);
      case "decreases":
        return parseExpressionListClause(NodeKind.DECREASES_CLAUSE, Conflict.DECREASES_CLAUSE);
      case "invariant":
        return parseExpressionListClause(NodeKind.INVARIANT_CLAUSE, Conflict.INVARIANT_CLAUSE);
      case "invariant_ensures":
        return parseExpressionListClause(
            NodeKind.INVARIANT_ENSURES_CLAUSE, Conflict.INVARIANT_ENSURES_CLAUSE);
      case "invariant_except_break":
        return parseExpressionListClause(
            NodeKind.INVARIANT_EXCEPT_BREAK_CLAUSE, Conflict.INVARIANT_EXCEPT_BREAK_CLAUSE);
      case "returns":
        {
          SyntaxNode.Builder b = node(NodeKind.RETURNS_CLAUSE);
          b.add(take());
          b.add(parseClauseExpression());
          if (at(TokenKind.COMMA)) {
            b.add(take());
          }
          return finish(b);
        }
      case "opens_invariants":
        {
          SyntaxNode.Builder b = node(NodeKind.OPENS_INVARIANTS_CLAUSE);
          b.add(take());
          if (isWord("any") || isWord("none")) {
            b.add(take());
          } else {
            b.add(expect(TokenKind.LBRACKET));
            while (!at(TokenKind.RBRACKET) && !at(TokenKind.EOF)) {
              b.add(parseExpression());
              if (!at(TokenKind.COMMA)) {
                break;
              }
              b.add(take());
            }
            b.add(expect(TokenKind.RBRACKET));
          }
          return finish(b);
        }
      case "no_unwind":
        {
          SyntaxNode.Builder b = node(NodeKind.NO_UNWIND_CLAUSE);
          b.add(take());
          if (isWord("when")) {
            b.add(take());
            b.add(parseClauseExpression());
          }
          return finish(b);
        }
      default:
        throw new IllegalStateException("not a clause: " + word);
    }
  }

  /**
   * Parses a clause made of a keyword and a comma-separated expression list. A trailing comma is
   * allowed; the list ends at the body, at ';', or at the next clause keyword.
   */
  private SyntaxNode parseExpressionListClause(NodeKind kind, Conflict conflict) {
    SyntaxNode.Builder b = node(kind);
    b.add(take());
    b.add(parseClauseExpression());
    while (at(TokenKind.COMMA)) {
      b.add(take());
      if (decide(conflict) || at(TokenKind.EOF) || isClauseBoundary()) {
        break;
      }
      b.add(parseClauseExpression());
    }
    if (kind == NodeKind.DECREASES_CLAUSE && isWord("when")) {
      b.add(take());
      b.add(parseClauseExpression());
    }
    if ((kind == NodeKind.DECREASES_CLAUSE || kind == NodeKind.RECOMMENDS_CLAUSE)
        && isWord("via")) {
      b.add(take());
      b.add(parseClauseExpression());
    }
    if (at(TokenKind.COMMA)) {
      b.add(take());
    }
    return finish(b);
  }

  // Reports whether the current token ends a clause's expression list.
  private boolean isClauseBoundary() {
    return isFunctionClauseStart()
        || isLoopClauseStart()
        || isWord("when")
        || isWord("via")
        || at(TokenKind.RBRACE)
        || at(TokenKind.EQUALS);
  }

  // Clause expressions precede a block, so '{' may not open a struct literal.
  private SyntaxNode parseClauseExpression() {
    boolean saved = noStructLiteral;
    noStructLiteral = true;
    try {
      return parseExpression();
    } finally {
      noStructLiteral = saved;
    }
  }

  // const_item = prefix 'const' (identifier | '_') ':' type ('=' expr)? fn_qualifier? ';'
  private SyntaxNode parseConstItem(int start, List<SyntaxNode> prefix) {
    checkPrefix(
        prefix,
        "constants",
        NodeKind.VISIBILITY_MODIFIER,
        NodeKind.PUBLISH,
        NodeKind.FUNCTION_MODE);
    SyntaxNode.Builder b = itemNode(NodeKind.CONST_ITEM, start, prefix);
    b.add(take());
    b.add("name", at(TokenKind.UNDERSCORE) ? takeAs(NodeKind.IDENTIFIER) : expectIdentifier());
    b.add(expect(TokenKind.COLON));
    b.add("type", parseType());
    if (at(TokenKind.EQUALS)) {
      b.add(take());
      b.add("value", parseExpression());
    }
    if (isFunctionClauseStart()) {
      b.add(parseFnQualifier());
    }
    b.add(expect(TokenKind.SEMI));
    return finish(b);
  }

  // static_item = prefix 'static' 'ref'? 'mut'? identifier ':' type ('=' expr)? fn_qualifier? ';'
  private SyntaxNode parseStaticItem(int start, List<SyntaxNode> prefix) {
    checkPrefix(prefix, "statics", NodeKind.VISIBILITY_MODIFIER, NodeKind.FUNCTION_MODE);
    SyntaxNode.Builder b = itemNode(NodeKind.STATIC_ITEM, start, prefix);
    b.add(take());
    if (at(TokenKind.REF)) {
      b.add(take());
    }
    if (at(TokenKind.MUT)) {
      b.add(takeAs(NodeKind.MUTABLE_SPECIFIER));
    }
    b.add("name", expectIdentifier());
    b.add(expect(TokenKind.COLON));
    b.add("type", parseType());
    if (at(TokenKind.EQUALS)) {
      b.add(take());
      b.add("value", parseExpression());
    }
    if (isFunctionClauseStart()) {
      b.add(parseFnQualifier());
    }
    b.add(expect(TokenKind.SEMI));
    return finish(b);
  }

  // struct_item = prefix 'struct' name type_parameters?
  //     (where_clause? field_declaration_list | ordered_field_declaration_list where_clause? ';'
  //      | ';')
  private SyntaxNode parseStructItem(int start, List<SyntaxNode> prefix) {
    checkPrefix(prefix, "structs", NodeKind.VISIBILITY_MODIFIER, NodeKind.DATA_MODE);
    SyntaxNode.Builder b = itemNode(NodeKind.STRUCT_ITEM, start, prefix);
    b.add(take());
    b.add("name", expectTypeIdentifier());
    if (at(TokenKind.LESS)) {
      b.add("type_parameters", parseTypeParameters());
    }
    if (at(TokenKind.LPAREN)) {
      b.add("body", parseOrderedFieldDeclarationList());
      if (at(TokenKind.WHERE)) {
        b.add(parseWhereClause());
      }
      b.add(expect(TokenKind.SEMI));
    } else if (at(TokenKind.SEMI)) {
      b.add(take());
    } else {
      if (at(TokenKind.WHERE)) {
        b.add(parseWhereClause());
      }
      b.add("body", parseFieldDeclarationList());
    }
    return finish(b);
  }

  // union_item = prefix 'union' name type_parameters? where_clause? field_declaration_list
  private SyntaxNode parseUnionItem(int start, List<SyntaxNode> prefix) {
    checkPrefix(prefix, "unions", NodeKind.VISIBILITY_MODIFIER, NodeKind.DATA_MODE);
    SyntaxNode.Builder b = itemNode(NodeKind.UNION_ITEM, start, prefix);
    b.add(take());
    b.add("name", expectTypeIdentifier());
    if (at(TokenKind.LESS)) {
      b.add("type_parameters", parseTypeParameters());
    }
    if (at(TokenKind.WHERE)) {
      b.add(parseWhereClause());
    }
    b.add("body", parseFieldDeclarationList());
    return finish(b);
  }

  // enum_item = prefix 'enum' name type_parameters? where_clause? enum_variant_list
  private SyntaxNode parseEnumItem(int start, List<SyntaxNode> prefix) {
    checkPrefix(prefix, "enums", NodeKind.VISIBILITY_MODIFIER, NodeKind.DATA_MODE);
    SyntaxNode.Builder b = itemNode(NodeKind.ENUM_ITEM, start, prefix);
    b.add(take());
    b.add("name", expectTypeIdentifier());
    if (at(TokenKind.LESS)) {
      b.add("type_parameters", parseTypeParameters());
    }
    if (at(TokenKind.WHERE)) {
      b.add(parseWhereClause());
    }
    SyntaxNode.Builder list = node(NodeKind.ENUM_VARIANT_LIST);
    list.add(expect(TokenKind.LBRACE));
    while (!at(TokenKind.RBRACE) && !at(TokenKind.EOF)) {
      parseOuterAttributes(list);
      list.add(parseEnumVariant());
      if (!at(TokenKind.COMMA)) {
        break;
      }
      list.add(take());
    }
    list.add(expect(TokenKind.RBRACE));
    b.add("body", finish(list));
    return finish(b);
  }

  // enum_variant = visibility? identifier (field_declaration_list
  //     | ordered_field_declaration_list)? ('=' expr)?
  private SyntaxNode parseEnumVariant() {
    SyntaxNode.Builder b = node(NodeKind.ENUM_VARIANT);
    b.add(parseVisibilityModifier());
    b.add("name", expectIdentifier());
    if (at(TokenKind.LBRACE)) {
      b.add("body", parseFieldDeclarationList());
    } else if (at(TokenKind.LPAREN)) {
      b.add("body", parseOrderedFieldDeclarationList());
    }
    if (at(TokenKind.EQUALS)) {
      b.add(take());
      b.add("value", parseExpression());
    }
    return finish(b);
  }

  // Parses any outer attributes (#[...]) into b.
  private void parseOuterAttributes(SyntaxNode.Builder b) {
    while (at(TokenKind.POUND) && peekKind(1) == TokenKind.LBRACKET) {
      b.add(parseAttributeItem());
    }
  }

  // field_declaration_list = '{' (attribute_item* field_declaration),* ','? '}'
  private SyntaxNode parseFieldDeclarationList() {
    SyntaxNode.Builder b = node(NodeKind.FIELD_DECLARATION_LIST);
    b.add(expect(TokenKind.LBRACE));
    while (!at(TokenKind.RBRACE) && !at(TokenKind.EOF)) {
      parseOuterAttributes(b);
      SyntaxNode.Builder field = node(NodeKind.FIELD_DECLARATION);
      field.add(parseVisibilityModifier());
      if (isWord("ghost") || isWord("tracked")) {
        field.add(parseDataMode());
      }
      field.add("name", parseFieldIdentifier());
      field.add(expect(TokenKind.COLON));
      field.add("type", parseType());
      b.add(finish(field));
      if (!at(TokenKind.COMMA)) {
        break;
      }
      b.add(take());
    }
    b.add(expect(TokenKind.RBRACE));
    return finish(b);
  }

  // ordered_field_declaration_list = '(' (attribute_item* visibility? data_mode? type),* ','? ')'
  private SyntaxNode parseOrderedFieldDeclarationList() {
    SyntaxNode.Builder b = node(NodeKind.ORDERED_FIELD_DECLARATION_LIST);
    b.add(expect(TokenKind.LPAREN));
    while (!at(TokenKind.RPAREN) && !at(TokenKind.EOF)) {
      parseOuterAttributes(b);
      b.add(parseVisibilityModifier());
      if ((isWord("ghost") || isWord("tracked")) && peekKind(1) != TokenKind.COMMA) {
        b.add(parseDataMode());
      }
      b.add("type", parseType());
      if (!at(TokenKind.COMMA)) {
        break;
      }
      b.add(take());
    }
    b.add(expect(TokenKind.RPAREN));
    return finish(b);
  }

  private SyntaxNode parseFieldIdentifier() {
    if (at(TokenKind.IDENTIFIER)) {
      return takeAs(NodeKind.FIELD_IDENTIFIER);
    }
    syntaxError("expected field name");
    return missing();
  }

  // type_item = prefix 'type' name type_parameters? where_clause? '=' type where_clause? ';'
  // associated_type = 'type' name type_parameters? trait_bounds? where_clause? ';'
  private SyntaxNode parseTypeItem(int start, List<SyntaxNode> prefix) {
    checkPrefix(prefix, "type aliases", NodeKind.VISIBILITY_MODIFIER);
    SyntaxNode.Builder b = itemNode(NodeKind.TYPE_ITEM, start, prefix);
    b.add(take());
    b.add("name", expectTypeIdentifier());
    if (at(TokenKind.LESS)) {
      b.add("type_parameters", parseTypeParameters());
    }
    boolean associated = false;
    if (at(TokenKind.COLON)) {
      b.add("bounds", parseTraitBounds());
      associated = true;
    }
    if (at(TokenKind.WHERE)) {
      b.add(parseWhereClause());
    }
    if (associated || at(TokenKind.SEMI)) {
      b.setKind(NodeKind.ASSOCIATED_TYPE);
      checkPrefix(prefix, "associated types");
    } else {
      b.add(expect(TokenKind.EQUALS));
      b.add("type", parseType());
      if (at(TokenKind.WHERE)) {
        b.add(parseWhereClause());
      }
    }
    b.add(expect(TokenKind.SEMI));
    return finish(b);
  }

  // mod_item = visibility? 'mod' identifier (';' | declaration_list)
  private SyntaxNode parseModItem(int start, List<SyntaxNode> prefix) {
    checkPrefix(prefix, "modules", NodeKind.VISIBILITY_MODIFIER);
    SyntaxNode.Builder b = itemNode(NodeKind.MOD_ITEM, start, prefix);
    b.add(take());
    b.add("name", expectIdentifier());
    if (at(TokenKind.SEMI)) {
      b.add(take());
    } else {
      b.add("body", parseDeclarationList());
    }
    return finish(b);
  }

  // declaration_list = '{' declaration_statement* '}'
  private SyntaxNode parseDeclarationList() {
    SyntaxNode.Builder b = node(NodeKind.DECLARATION_LIST);
    b.add(expect(TokenKind.LBRACE));
    parseStatements(b, /*topLevel=*/ false, /*allowExpressions=*/ false);
    b.add(expect(TokenKind.RBRACE));
    return finish(b);
  }

  // trait_item = visibility? 'unsafe'? 'auto'? 'trait' name type_parameters? trait_bounds?
  //              where_clause? declaration_list
  private SyntaxNode parseTraitItem(int start, List<SyntaxNode> prefix) {
    checkPrefix(prefix, "traits", NodeKind.VISIBILITY_MODIFIER);
    SyntaxNode.Builder b = itemNode(NodeKind.TRAIT_ITEM, start, prefix);
    if (at(TokenKind.UNSAFE)) {
      b.add(take());
    }
    if (isNameAt(0, "auto")) {
      b.add(take());
    }
    b.add(expect(TokenKind.TRAIT));
    b.add("name", expectTypeIdentifier());
    if (at(TokenKind.LESS)) {
      b.add("type_parameters", parseTypeParameters());
    }
    if (at(TokenKind.COLON)) {
      b.add("bounds", parseTraitBounds());
    }
    if (at(TokenKind.WHERE)) {
      b.add(parseWhereClause());
    }
    b.add("body", parseDeclarationList());
    return finish(b);
  }

  // impl_item = 'unsafe'? 'impl' type_parameters? ('!'? trait 'for')? type where_clause?
  //             (declaration_list | ';')
  private SyntaxNode parseImplItem(int start, List<SyntaxNode> prefix) {
    checkPrefix(prefix, "impl blocks");
    SyntaxNode.Builder b = itemNode(NodeKind.IMPL_ITEM, start, prefix);
    if (at(TokenKind.UNSAFE)) {
      b.add(take());
    }
    b.add(take());
    if (at(TokenKind.LESS)) {
      b.add("type_parameters", parseTypeParameters());
    }
    SyntaxNode bang = at(TokenKind.BANG) ? take() : null;
    SyntaxNode first = parseTypeNoBounds();
    if (at(TokenKind.FOR)) {
      b.add(bang);
      b.add("trait", first);
      b.add(take());
      b.add("type", parseTypeNoBounds());
    } else {
      if (bang != null) {
        failures++;
        reportError(bang.getStartOffset(), "negative impls require a trait");
        b.add(bang);
      }
      b.add("type", first);
    }
    if (at(TokenKind.WHERE)) {
      b.add(parseWhereClause());
    }
    if (at(TokenKind.SEMI)) {
      b.add(take());
    } else {
      b.add("body", parseDeclarationList());
    }
    return finish(b);
  }

  // extern_crate_declaration = visibility? 'extern' 'crate' identifier ('as' identifier)? ';'
  private SyntaxNode parseExternCrateDeclaration(int start, List<SyntaxNode> prefix) {
    checkPrefix(prefix, "extern crates", NodeKind.VISIBILITY_MODIFIER);
    SyntaxNode.Builder b = itemNode(NodeKind.EXTERN_CRATE_DECLARATION, start, prefix);
    b.add(take());
    b.add(takeAs(NodeKind.CRATE));
    b.add("name", at(TokenKind.SELF) ? takeAs(NodeKind.SELF) : expectIdentifier());
    if (at(TokenKind.AS)) {
      b.add(take());
      b.add("alias", expectIdentifier());
    }
    b.add(expect(TokenKind.SEMI));
    return finish(b);
  }

  // foreign_mod_item = visibility? extern_modifier (';' | declaration_list)
  private SyntaxNode parseForeignModItem(int start, List<SyntaxNode> prefix) {
    checkPrefix(prefix, "extern blocks", NodeKind.VISIBILITY_MODIFIER);
    SyntaxNode.Builder b = itemNode(NodeKind.FOREIGN_MOD_ITEM, start, prefix);
    b.add(parseExternModifier());
    if (at(TokenKind.SEMI)) {
      b.add(take());
    } else {
      b.add("body", parseDeclarationList());
    }
    return finish(b);
  }

  // broadcast_group = visibility? 'broadcast' 'group' identifier broadcast_group_list
  private SyntaxNode parseBroadcastGroup(int start, List<SyntaxNode> prefix) {
    checkPrefix(prefix, "broadcast groups", NodeKind.VISIBILITY_MODIFIER);
    SyntaxNode.Builder b = itemNode(NodeKind.BROADCAST_GROUP, start, prefix);
    b.add(take());
    b.add(take());
    b.add("name", expectIdentifier());
    SyntaxNode.Builder list = node(NodeKind.BROADCAST_GROUP_LIST);
    list.add(expect(TokenKind.LBRACE));
    while (!at(TokenKind.RBRACE) && !at(TokenKind.EOF)) {
      parseOuterAttributes(list);
      list.add(parseSimplePath());
      if (!at(TokenKind.COMMA)) {
        break;
      }
      list.add(take());
    }
    list.add(expect(TokenKind.RBRACE));
    b.add("members", finish(list));
    return finish(b);
  }

  // broadcast_use = 'broadcast' 'use' path (',' path)* ','? ';'
  private SyntaxNode parseBroadcastUse(int start, List<SyntaxNode> prefix) {
    checkPrefix(prefix, "broadcast use");
    SyntaxNode.Builder b = itemNode(NodeKind.BROADCAST_USE, start, prefix);
    b.add(take());
    b.add(take());
    b.add(parseSimplePath());
    while (at(TokenKind.COMMA)) {
      b.add(take());
      if (at(TokenKind.SEMI)) {
        break;
      }
      b.add(parseSimplePath());
    }
    b.add(expect(TokenKind.SEMI));
    return finish(b);
  }

  // global_item = 'global' (global_sizeof | global_layout) ';'
  private SyntaxNode parseGlobalItem(int start, List<SyntaxNode> prefix) {
    checkPrefix(prefix, "global items");
    SyntaxNode.Builder b = itemNode(NodeKind.GLOBAL_ITEM, start, prefix);
    b.add(take());
    if (isWord("size_of")) {
      // global_sizeof = 'size_of' type '==' expr
      SyntaxNode.Builder size = node(NodeKind.GLOBAL_SIZEOF);
      size.add(take());
      size.add(parseTypeNoBounds());
      size.add(expect(TokenKind.EQUALS_EQUALS));
      size.add(parseExpression());
      b.add(finish(size));
    } else {
      // global_layout = 'layout' type 'is' identifier '==' literal (',' identifier '==' literal)?
      SyntaxNode.Builder layout = node(NodeKind.GLOBAL_LAYOUT);
      layout.add(expectWord("layout"));
      layout.add(parseTypeNoBounds());
      layout.add(expectWord("is"));
      layout.add(expectIdentifier());
      layout.add(expect(TokenKind.EQUALS_EQUALS));
      layout.add(parseLiteral());
      if (at(TokenKind.COMMA)) {
        layout.add(take());
        layout.add(expectIdentifier());
        layout.add(expect(TokenKind.EQUALS_EQUALS));
        layout.add(parseLiteral());
      }
      b.add(finish(layout));
    }
    b.add(expect(TokenKind.SEMI));
    return finish(b);
  }

  // assume_specification_item = visibility? 'assume_specification' type_parameters?
  //     '[' path ']' parameters ('->' return_type)? where_clause? fn_qualifier? ';'
  private SyntaxNode parseAssumeSpecification(int start, List<SyntaxNode> prefix) {
    checkPrefix(prefix, "assumed specifications", NodeKind.VISIBILITY_MODIFIER);
    SyntaxNode.Builder b = itemNode(NodeKind.ASSUME_SPECIFICATION_ITEM, start, prefix);
    b.add(take());
    if (at(TokenKind.LESS)) {
      b.add(parseTypeParameters());
    }
    b.add(expect(TokenKind.LBRACKET));
    b.add("target", parseExpressionPath());
    b.add(expect(TokenKind.RBRACKET));
    b.add("parameters", parseParameters());
    if (at(TokenKind.RARROW)) {
      b.add(take());
      b.add("return_type", parseReturnType());
    }
    if (at(TokenKind.WHERE)) {
      b.add(parseWhereClause());
    }
    if (isFunctionClauseStart()) {
      b.add(parseFnQualifier());
    }
    b.add(expect(TokenKind.SEMI));
    return finish(b);
  }

  // use_declaration = visibility? 'use' use_clause ';'
  private SyntaxNode parseUseDeclaration(int start, List<SyntaxNode> prefix) {
    checkPrefix(prefix, "use declarations", NodeKind.VISIBILITY_MODIFIER);
    SyntaxNode.Builder b = itemNode(NodeKind.USE_DECLARATION, start, prefix);
    b.add(take());
    b.add("argument", parseUseClause());
    b.add(expect(TokenKind.SEMI));
    return finish(b);
  }

  // use_clause = path | path 'as' (identifier | '_') | use_list | path? '::' use_list
  //            | (path? '::')? '*'
  private SyntaxNode parseUseClause() {
    int start = token.start;
    if (at(TokenKind.LBRACE)) {
      return parseUseList();
    }
    if (at(TokenKind.STAR)) {
      SyntaxNode.Builder b = node(NodeKind.USE_WILDCARD);
      b.add(take());
      return finish(b);
    }
    SyntaxNode path = null;
    if (!at(TokenKind.COLON_COLON)
        || (peekKind(1) != TokenKind.LBRACE && peekKind(1) != TokenKind.STAR)) {
      path = parseSimplePath();
    }
    if (at(TokenKind.COLON_COLON) && peekKind(1) == TokenKind.LBRACE) {
      SyntaxNode.Builder b = nodeAt(NodeKind.SCOPED_USE_LIST, start);
      b.add("path", path);
      b.add(take());
      b.add("list", parseUseList());
      return finish(b);
    }
    if (at(TokenKind.COLON_COLON) && peekKind(1) == TokenKind.STAR) {
      SyntaxNode.Builder b = nodeAt(NodeKind.USE_WILDCARD, start);
      b.add(path);
      b.add(take());
      b.add(take());
      return finish(b);
    }
    if (at(TokenKind.AS)) {
      SyntaxNode.Builder b = nodeAt(NodeKind.USE_AS_CLAUSE, start);
      b.add("path", path);
      b.add(take());
      b.add("alias", at(TokenKind.UNDERSCORE) ? take() : expectIdentifier());
      return finish(b);
    }
    return path;
  }

  // use_list = '{' use_clause,* ','? '}'
  private SyntaxNode parseUseList() {
    SyntaxNode.Builder b = node(NodeKind.USE_LIST);
    b.add(take());
    while (!at(TokenKind.RBRACE) && !at(TokenKind.EOF)) {
      b.add(parseUseClause());
      if (!at(TokenKind.COMMA)) {
        break;
      }
      b.add(take());
    }
    b.add(expect(TokenKind.RBRACE));
    return finish(b);
  }

  // A path without generic arguments, as in use declarations, attributes and visibility
  // restrictions. Segments may be self, super or crate as well as identifiers.
  private SyntaxNode parseSimplePath() {
    int start = token.start;
    SyntaxNode path = at(TokenKind.COLON_COLON) ? null : parsePathSegment();
    while (at(TokenKind.COLON_COLON)
        && (peekKind(1) == TokenKind.IDENTIFIER
            || peekKind(1) == TokenKind.SELF
            || peekKind(1) == TokenKind.SUPER
            || peekKind(1) == TokenKind.CRATE)) {
      SyntaxNode.Builder b = nodeAt(NodeKind.SCOPED_IDENTIFIER, start);
      b.add("path", path);
      b.add(take());
      b.add("name", parsePathSegment());
      path = finish(b);
    }
    if (path == null) {
      syntaxError("expected path");
      return missing();
    }
    return path;
  }

  // One segment of a simple path: an identifier or one of the path keywords.
  private SyntaxNode parsePathSegment() {
    switch (token.kind) {
      case IDENTIFIER:
        return takeAs(NodeKind.IDENTIFIER);
      case SELF:
        return takeAs(NodeKind.SELF);
      case SUPER:
        return takeAs(NodeKind.SUPER);
      case CRATE:
        return takeAs(NodeKind.CRATE);
      default:
        if (isMetavariableStart()) {
          return parseMetavariable();
        }
        syntaxError("expected identifier");
        return missing();
    }
  }

  // ==== Generics and bounds ====

  // type_parameters = '<' (attribute_item* (metavariable | type_parameter | lifetime_parameter
  //     | const_parameter)),+ ','? '>'
  private SyntaxNode parseTypeParameters() {
    SyntaxNode.Builder b = node(NodeKind.TYPE_PARAMETERS);
    b.add(take());
    while (!at(TokenKind.GREATER) && !at(TokenKind.EOF)) {
      parseOuterAttributes(b);
      if (isMetavariableStart()) {
        b.add(parseMetavariable());
      } else if (at(TokenKind.QUOTE)) {
        SyntaxNode.Builder param = node(NodeKind.LIFETIME_PARAMETER);
        param.add("name", parseLifetime());
        if (at(TokenKind.COLON)) {
          param.add("bounds", parseTraitBounds());
        }
        b.add(finish(param));
      } else if (at(TokenKind.CONST)) {
        b.add(parseConstParameter());
      } else {
        SyntaxNode.Builder param = node(NodeKind.TYPE_PARAMETER);
        param.add("name", expectTypeIdentifier());
        if (at(TokenKind.COLON)) {
          param.add("bounds", parseTraitBounds());
        }
        if (at(TokenKind.EQUALS)) {
          param.add(take());
          param.add("default_type", parseType());
        }
        b.add(finish(param));
      }
      if (!at(TokenKind.COMMA)) {
        break;
      }
      b.add(take());
    }
    b.add(expect(TokenKind.GREATER));
    return finish(b);
  }

  // const_parameter = 'const' identifier ':' type ('=' (block | identifier | literal
  //     | negative_literal))?
  private SyntaxNode parseConstParameter() {
    SyntaxNode.Builder b = node(NodeKind.CONST_PARAMETER);
    b.add(take());
    b.add("name", expectIdentifier());
    b.add(expect(TokenKind.COLON));
    b.add("type", parseType());
    if (at(TokenKind.EQUALS)) {
      b.add(take());
      if (at(TokenKind.LBRACE)) {
        b.add("value", parseBlock());
      } else if (at(TokenKind.IDENTIFIER)) {
        b.add("value", takeAs(NodeKind.IDENTIFIER));
      } else if (at(TokenKind.MINUS)) {
        b.add("value", parseNegativeLiteral());
      } else {
        b.add("value", parseLiteral());
      }
    }
    return finish(b);
  }

  // lifetime = '\'' identifier
  private SyntaxNode parseLifetime() {
    return parseQuoted(NodeKind.LIFETIME);
  }

  // A lifetime or label: a quote followed by a name, which may be a keyword ('static) or '_'.
  private SyntaxNode parseQuoted(NodeKind kind) {
    SyntaxNode.Builder b = node(kind);
    b.add(expect(TokenKind.QUOTE));
    if (at(TokenKind.IDENTIFIER)
        || at(TokenKind.UNDERSCORE)
        || (token.end > token.start
            && Lexer.isIdentifierStart(buffer[token.start])
            && !LITERAL_TOKENS.contains(token.kind))) {
      b.add(takeAs(NodeKind.IDENTIFIER));
    } else {
      syntaxError("expected lifetime name");
    }
    return finish(b);
  }

  // trait_bounds = ':' (type | lifetime | higher_ranked_trait_bound) ('+' ...)*
  private SyntaxNode parseTraitBounds() {
    SyntaxNode.Builder b = node(NodeKind.TRAIT_BOUNDS);
    b.add(take());
    b.add(parseBound());
    while (at(TokenKind.PLUS)) {
      b.add(take());
      b.add(parseBound());
    }
    return finish(b);
  }

  private SyntaxNode parseBound() {
    if (at(TokenKind.QUOTE)) {
      return parseLifetime();
    }
    if (at(TokenKind.FOR) && peekKind(1) == TokenKind.LESS) {
      // higher_ranked_trait_bound = 'for' type_parameters type
      SyntaxNode.Builder b = node(NodeKind.HIGHER_RANKED_TRAIT_BOUND);
      b.add(take());
      b.add("type_parameters", parseTypeParameters());
      b.add("type", parseTypeNoBounds());
      return finish(b);
    }
    return parseTypeNoBounds();
  }

  // where_clause = 'where' (where_predicate,+ ','?)?
  private SyntaxNode parseWhereClause() {
    SyntaxNode.Builder b = node(NodeKind.WHERE_CLAUSE);
    b.add(take());
    while (isWherePredicateStart()) {
      // where_predicate = (lifetime | higher_ranked_trait_bound | type) trait_bounds
      SyntaxNode.Builder pred = node(NodeKind.WHERE_PREDICATE);
      pred.add("left", parseBound());
      if (at(TokenKind.COLON)) {
        pred.add("bounds", parseTraitBounds());
      } else {
        syntaxError("expected ':'");
      }
      b.add(finish(pred));
      if (!at(TokenKind.COMMA)) {
        break;
      }
      b.add(take());
    }
    return finish(b);
  }

  private boolean isWherePredicateStart() {
    switch (token.kind) {
      case QUOTE:
      case FOR:
      case IDENTIFIER:
      case SELF:
      case AMPERSAND:
      case STAR:
      case LPAREN:
      case LBRACKET:
      case COLON_COLON:
      case LESS:
        return !isFunctionClauseStart();
      default:
        return false;
    }
  }

  // ==== Parameters ====

  // parameters = '(' (attribute_item* 'tracked'? (self_parameter | variadic_parameter | '_'
  //     | parameter | type)),* ','? ')'
  private SyntaxNode parseParameters() {
    SyntaxNode.Builder b = node(NodeKind.PARAMETERS);
    b.add(expect(TokenKind.LPAREN));
    while (!at(TokenKind.RPAREN) && !at(TokenKind.EOF)) {
      parseOuterAttributes(b);
      if (isWord("tracked")
          && peekKind(1) != TokenKind.COLON
          && peekKind(1) != TokenKind.COMMA
          && peekKind(1) != TokenKind.RPAREN) {
        b.add(take());
      }
      b.add(parseParameterEntry());
      if (!at(TokenKind.COMMA)) {
        break;
      }
      b.add(take());
    }
    b.add(expect(TokenKind.RPAREN));
    return finish(b);
  }

  private SyntaxNode parseParameterEntry() {
    if (isSelfParameter()) {
      return parseSelfParameter();
    }
    if (at(TokenKind.DOT_DOT_DOT)) {
      SyntaxNode.Builder b = node(NodeKind.VARIADIC_PARAMETER);
      b.add(take());
      return finish(b);
    }
    if (at(TokenKind.UNDERSCORE)
        && (peekKind(1) == TokenKind.COMMA || peekKind(1) == TokenKind.RPAREN)) {
      return take();
    }
    Conflict conflict;
    if (at(TokenKind.LPAREN)) {
      conflict = Conflict.UNIT_TYPE_VS_TUPLE_PATTERN;
    } else if (at(TokenKind.IDENTIFIER) || at(TokenKind.COLON_COLON)) {
      conflict = Conflict.PARAMETERS_VS_TUPLE_STRUCT_PATTERN;
    } else {
      conflict = Conflict.ANONYMOUS_PARAMETER;
    }
    return resolve(conflict, ImmutableList.of(this::parseParameter, this::parseType));
  }

  // parameter = 'mut'? pattern ':' type
  // variadic_parameter = 'mut'? (pattern ':')? '...'
  private SyntaxNode parseParameter() {
    SyntaxNode.Builder b = node(NodeKind.PARAMETER);
    if (at(TokenKind.MUT)) {
      b.add(takeAs(NodeKind.MUTABLE_SPECIFIER));
    }
    b.add("pattern", at(TokenKind.SELF) ? takeAs(NodeKind.SELF) : parsePatternNoOr());
    b.add(expect(TokenKind.COLON));
    if (at(TokenKind.DOT_DOT_DOT)) {
      b.setKind(NodeKind.VARIADIC_PARAMETER);
      b.add(take());
    } else {
      b.add("type", parseType());
    }
    return finish(b);
  }

  // Reports whether a self parameter starts here: '&' lifetime? 'mut'? 'self', or 'mut'? 'self',
  // not followed by a type annotation.
  private boolean isSelfParameter() {
    int n = 0;
    if (peekKind(n) == TokenKind.AMPERSAND) {
      n++;
      if (peekKind(n) == TokenKind.QUOTE) {
        n += 2;
      }
    }
    if (peekKind(n) == TokenKind.MUT) {
      n++;
    }
    return peekKind(n) == TokenKind.SELF
        && peekKind(n + 1) != TokenKind.COLON
        && peekKind(n + 1) != TokenKind.COLON_COLON;
  }

  // self_parameter = '&'? lifetime? 'mut'? 'self'
  private SyntaxNode parseSelfParameter() {
    SyntaxNode.Builder b = node(NodeKind.SELF_PARAMETER);
    if (at(TokenKind.AMPERSAND)) {
      b.add(take());
      if (at(TokenKind.QUOTE)) {
        b.add(parseLifetime());
      }
    }
    if (at(TokenKind.MUT)) {
      b.add(takeAs(NodeKind.MUTABLE_SPECIFIER));
    }
    b.add(takeAs(NodeKind.SELF));
    return finish(b);
  }

  // ==== Types ====

  // A type, possibly a bounded type 'T + 'a + Trait'.
  private SyntaxNode parseType() {
    SyntaxNode t = parseTypeNoBounds();
    while (at(TokenKind.PLUS)) {
      SyntaxNode.Builder b = nodeAt(NodeKind.BOUNDED_TYPE, t.getStartOffset());
      b.add(t);
      b.add(take());
      if (at(TokenKind.QUOTE)) {
        b.add(parseLifetime());
      } else if (at(TokenKind.USE) && peekKind(1) == TokenKind.LESS) {
        b.add(parseUseBounds());
      } else {
        b.add(parseTypeNoBounds());
      }
      t = finish(b);
    }
    return t;
  }

  // A type that does not extend over a '+': the operand of casts, references and bounds.
  private SyntaxNode parseTypeNoBounds() {
    switch (token.kind) {
      case AMPERSAND:
        return parseReferenceType(token.start, token.start + 1, /*nested=*/ false);
      case AMPERSAND_AMPERSAND:
        return parseReferenceType(token.start, token.start + 1, /*nested=*/ true);
      case STAR:
        {
          // pointer_type = '*' ('const' | mutable_specifier) type
          SyntaxNode.Builder b = node(NodeKind.POINTER_TYPE);
          b.add(take());
          if (at(TokenKind.CONST)) {
            b.add(take());
          } else if (at(TokenKind.MUT)) {
            b.add(takeAs(NodeKind.MUTABLE_SPECIFIER));
          } else {
            syntaxError("expected 'const' or 'mut'");
          }
          b.add("type", parseTypeNoBounds());
          return finish(b);
        }
      case LPAREN:
        {
          if (peekKind(1) == TokenKind.RPAREN) {
            SyntaxNode.Builder b = node(NodeKind.UNIT_TYPE);
            b.add(take());
            b.add(take());
            return finish(b);
          }
          // tuple_type = '(' type,+ ','? ')'
          SyntaxNode.Builder b = node(NodeKind.TUPLE_TYPE);
          b.add(take());
          while (!at(TokenKind.RPAREN) && !at(TokenKind.EOF)) {
            b.add(parseType());
            if (!at(TokenKind.COMMA)) {
              break;
            }
            b.add(take());
          }
          b.add(expect(TokenKind.RPAREN));
          return finish(b);
        }
      case LBRACKET:
        {
          // array_type = '[' type (';' expr)? ']'
          SyntaxNode.Builder b = node(NodeKind.ARRAY_TYPE);
          b.add(take());
          b.add("element", parseType());
          if (at(TokenKind.SEMI)) {
            b.add(take());
            b.add("length", parseExpression());
          }
          b.add(expect(TokenKind.RBRACKET));
          return finish(b);
        }
      case BANG:
        {
          SyntaxNode.Builder b = node(NodeKind.NEVER_TYPE);
          b.add(take());
          return finish(b);
        }
      case QUESTION:
        {
          SyntaxNode.Builder b = node(NodeKind.REMOVED_TRAIT_BOUND);
          b.add(take());
          b.add(parseTypeNoBounds());
          return finish(b);
        }
      case IMPL:
        {
          // abstract_type = 'impl' ('for' type_parameters)? type
          SyntaxNode.Builder b = node(NodeKind.ABSTRACT_TYPE);
          b.add(take());
          if (at(TokenKind.FOR) && peekKind(1) == TokenKind.LESS) {
            b.add(take());
            b.add(parseTypeParameters());
          }
          b.add("trait", parseType());
          return finish(b);
        }
      case DYN:
        {
          // dynamic_type = 'dyn' (higher_ranked_trait_bound | type)
          SyntaxNode.Builder b = node(NodeKind.DYNAMIC_TYPE);
          b.add(take());
          b.add("trait", parseBound());
          return finish(b);
        }
      case FOR:
        {
          int start = token.start;
          SyntaxNode lifetimes = parseForLifetimes();
          if (isPathStart() && !at(TokenKind.LESS)) {
            SyntaxNode.Builder b = nodeAt(NodeKind.FUNCTION_TYPE, start);
            b.add(lifetimes);
            b.add("trait", parseTypePath());
            parseFunctionTypeTail(b);
            return finish(b);
          }
          return parseFunctionType(start, lifetimes);
        }
      case FN:
      case UNSAFE:
      case EXTERN:
      case ASYNC:
      case CONST:
        return parseFunctionType(token.start, null);
      case DOLLAR:
        if (isMetavariableStart()) {
          return parseMetavariable();
        }
        break;
      case IDENTIFIER:
        if (peekKind(1) == TokenKind.BANG
            && peek(1).joint
            && peek(2).kind.isOpenDelimiter()) {
          return parseMacroInvocation(takeAs(NodeKind.IDENTIFIER));
        }
        // fall through
      case SELF:
      case SUPER:
      case CRATE:
      case COLON_COLON:
      case LESS:
        {
          int start = token.start;
          SyntaxNode path = parseTypePath();
          if (at(TokenKind.LPAREN)
              && (path.kind() == NodeKind.TYPE_IDENTIFIER
                  || path.kind() == NodeKind.SCOPED_TYPE_IDENTIFIER)) {
            // function_type = trait parameters ('->' type)?, as in Fn(u8) -> u8
            SyntaxNode.Builder b = nodeAt(NodeKind.FUNCTION_TYPE, start);
            b.add("trait", path);
            parseFunctionTypeTail(b);
            return finish(b);
          }
          return path;
        }
      default:
        break;
    }
    syntaxError("expected type");
    return missing();
  }

  // reference_type = '&' lifetime? mutable_specifier? type. A '&&' token is two references.
  private SyntaxNode parseReferenceType(int start, int innerStart, boolean nested) {
    SyntaxNode.Builder outer = nodeAt(NodeKind.REFERENCE_TYPE, start);
    SyntaxNode.Builder b = outer;
    if (nested) {
      outer.add(SyntaxNode.leaf(locs, NodeKind.TOKEN, start, innerStart, "&"));
      b = nodeAt(NodeKind.REFERENCE_TYPE, innerStart);
      b.add(SyntaxNode.leaf(locs, NodeKind.TOKEN, innerStart, token.end, "&"));
      nextToken();
    } else {
      b.add(take());
    }
    if (at(TokenKind.QUOTE)) {
      b.add(parseLifetime());
    }
    if (at(TokenKind.MUT)) {
      b.add(takeAs(NodeKind.MUTABLE_SPECIFIER));
    }
    b.add("type", parseTypeNoBounds());
    if (nested) {
      outer.add("type", finish(b));
    }
    return finish(outer);
  }

  // for_lifetimes = 'for' '<' lifetime,+ ','? '>'
  private SyntaxNode parseForLifetimes() {
    SyntaxNode.Builder b = node(NodeKind.FOR_LIFETIMES);
    b.add(take());
    b.add(expect(TokenKind.LESS));
    while (at(TokenKind.QUOTE)) {
      b.add(parseLifetime());
      if (!at(TokenKind.COMMA)) {
        break;
      }
      b.add(take());
    }
    b.add(expect(TokenKind.GREATER));
    return finish(b);
  }

  // function_type = for_lifetimes? function_modifiers? 'fn' parameters ('->' type)?
  private SyntaxNode parseFunctionType(int start, @Nullable SyntaxNode lifetimes) {
    SyntaxNode.Builder b = nodeAt(NodeKind.FUNCTION_TYPE, start);
    b.add(lifetimes);
    b.add(parseFunctionModifiers());
    b.add(expect(TokenKind.FN));
    parseFunctionTypeTail(b);
    return finish(b);
  }

  private void parseFunctionTypeTail(SyntaxNode.Builder b) {
    b.add("parameters", parseParameters());
    if (at(TokenKind.RARROW)) {
      b.add(take());
      b.add("return_type", parseTypeNoBounds());
    }
  }

  // use_bounds = 'use' '<' (lifetime | type_identifier),* ','? '>'
  private SyntaxNode parseUseBounds() {
    SyntaxNode.Builder b = node(NodeKind.USE_BOUNDS);
    b.add(take());
    b.add(take());
    while (!at(TokenKind.GREATER) && !at(TokenKind.EOF)) {
      b.add(at(TokenKind.QUOTE) ? parseLifetime() : expectTypeIdentifier());
      if (!at(TokenKind.COMMA)) {
        break;
      }
      b.add(take());
    }
    b.add(expect(TokenKind.GREATER));
    return finish(b);
  }

  /**
   * Parses a path in type position. All segments but the last are plain path segments; the last
   * becomes a type identifier, and generic arguments may follow any segment.
   */
  private SyntaxNode parseTypePath() {
    int start = token.start;
    SyntaxNode path = null;
    if (at(TokenKind.LESS)) {
      path = parseBracketedType();
    } else if (!at(TokenKind.COLON_COLON)) {
      path = parsePathSegment();
    }
    while (true) {
      if (at(TokenKind.COLON_COLON) && peekKind(1) == TokenKind.LESS && path != null) {
        SyntaxNode.Builder b = nodeAt(NodeKind.GENERIC_TYPE, start);
        b.add("type", asTypePath(path));
        b.add(take());
        b.add("type_arguments", parseTypeArguments());
        path = finish(b);
      } else if (at(TokenKind.COLON_COLON) && isPathSegmentAt(1)) {
        SyntaxNode.Builder b = nodeAt(NodeKind.SCOPED_IDENTIFIER, start);
        b.add("path", path);
        b.add(take());
        b.add("name", parsePathSegment());
        path = finish(b);
      } else if (at(TokenKind.LESS)
          && path != null
          && (path.kind() == NodeKind.IDENTIFIER || path.kind() == NodeKind.SCOPED_IDENTIFIER)) {
        SyntaxNode.Builder b = nodeAt(NodeKind.GENERIC_TYPE, start);
        b.add("type", asTypePath(path));
        b.add("type_arguments", parseTypeArguments());
        path = finish(b);
      } else {
        break;
      }
    }
    if (path == null) {
      syntaxError("expected type");
      return missing();
    }
    return asTypePath(path);
  }

  private boolean isPathSegmentAt(int n) {
    TokenKind kind = peekKind(n);
    return kind == TokenKind.IDENTIFIER
        || kind == TokenKind.SELF
        || kind == TokenKind.SUPER
        || kind == TokenKind.CRATE
        || (kind == TokenKind.DOLLAR && peek(n).joint && peekKind(n + 1) == TokenKind.IDENTIFIER);
  }

  /**
   * Converts a path parsed in value form to type form: an identifier becomes a type identifier
   * (or a primitive type), and the name of a scoped identifier becomes a type identifier.
   */
  private SyntaxNode asTypePath(SyntaxNode path) {
    switch (path.kind()) {
      case IDENTIFIER:
        {
          boolean primitive =
              PRIMITIVE_TYPES.contains(path.getText())
                  || (verus && OVERLAY_PRIMITIVE_TYPES.contains(path.getText()));
          return SyntaxNode.leaf(
              locs,
              primitive && !at(TokenKind.COLON_COLON)
                  ? NodeKind.PRIMITIVE_TYPE
                  : NodeKind.TYPE_IDENTIFIER,
              path.getStartOffset(),
              path.getEndOffset(),
              path.getText());
        }
      case SCOPED_IDENTIFIER:
        {
          SyntaxNode.Builder b =
              nodeAt(NodeKind.SCOPED_TYPE_IDENTIFIER, path.getStartOffset());
          List<SyntaxNode> children = path.getChildren();
          for (int i = 0; i < children.size(); i++) {
            SyntaxNode child = children.get(i);
            String field = path.getFieldName(i);
            if ("name".equals(field) && child.kind() == NodeKind.IDENTIFIER) {
              child =
                  SyntaxNode.leaf(
                      locs,
                      NodeKind.TYPE_IDENTIFIER,
                      child.getStartOffset(),
                      child.getEndOffset(),
                      child.getText());
            }
            b.add(field == null ? "" : field, child);
          }
          return b.build(path.getEndOffset());
        }
      default:
        return path;
    }
  }

  // bracketed_type = '<' (type | qualified_type) '>'
  // qualified_type = type 'as' type
  private SyntaxNode parseBracketedType() {
    SyntaxNode.Builder b = node(NodeKind.BRACKETED_TYPE);
    b.add(take());
    SyntaxNode type = parseType();
    if (at(TokenKind.AS)) {
      SyntaxNode.Builder q = nodeAt(NodeKind.QUALIFIED_TYPE, type.getStartOffset());
      q.add("type", type);
      q.add(take());
      q.add("alias", parseType());
      b.add(finish(q));
    } else {
      b.add(type);
    }
    b.add(expect(TokenKind.GREATER));
    return finish(b);
  }

  // type_arguments = '<' ((type | type_binding | lifetime | literal | block) trait_bounds?),+
  //     ','? '>'
  private SyntaxNode parseTypeArguments() {
    SyntaxNode.Builder b = node(NodeKind.TYPE_ARGUMENTS);
    b.add(expect(TokenKind.LESS));
    while (!at(TokenKind.GREATER) && !at(TokenKind.EOF)) {
      b.add(parseTypeArgument());
      if (at(TokenKind.COLON)) {
        b.add(parseTraitBounds());
      }
      if (!at(TokenKind.COMMA)) {
        break;
      }
      b.add(take());
    }
    b.add(expect(TokenKind.GREATER));
    return finish(b);
  }

  private SyntaxNode parseTypeArgument() {
    if (at(TokenKind.QUOTE)) {
      return parseLifetime();
    }
    if (at(TokenKind.LBRACE)) {
      return parseBlock();
    }
    if (LITERAL_TOKENS.contains(token.kind)) {
      return parseLiteral();
    }
    if (at(TokenKind.MINUS)) {
      return parseNegativeLiteral();
    }
    if (at(TokenKind.IDENTIFIER) && peekKind(1) == TokenKind.EQUALS) {
      // type_binding = type_identifier '=' type
      SyntaxNode.Builder b = node(NodeKind.TYPE_BINDING);
      b.add("name", takeAs(NodeKind.TYPE_IDENTIFIER));
      b.add(take());
      b.add("type", parseType());
      return finish(b);
    }
    return parseType();
  }

  // ==== Expressions ====

  // An operator at the current position, possibly glued from several joint '>' and '=' tokens.
  private static final class Operator {
    final PrecedenceTable.Entry entry;
    final int tokens;

    Operator(PrecedenceTable.Entry entry, int tokens) {
      this.entry = entry;
      this.tokens = tokens;
    }
  }

  private static final int RANGE_LEVEL = PrecedenceTable.Tier.RANGE.level();
  private static final int IMPLICATION_LEVEL = PrecedenceTable.Tier.IMPLICATION.level();
  private static final int AND_LEVEL = PrecedenceTable.Tier.AND.level();
  private static final int ASSIGN_LEVEL = PrecedenceTable.Tier.ASSIGN.level();

  private SyntaxNode parseExpression() {
    return parseExpression(ASSIGN_LEVEL);
  }

  // Parses an expression whose binary operators all bind at least as tightly as minLevel.
  private SyntaxNode parseExpression(int minLevel) {
    if (isRangeOperator() && minLevel <= RANGE_LEVEL) {
      // Prefix range: '..' expr?
      SyntaxNode.Builder b = node(NodeKind.RANGE_EXPRESSION);
      b.add(take());
      if (canStartExpression()) {
        b.add(parseExpression(RANGE_LEVEL + 1));
      }
      return parseBinaryTail(finish(b), minLevel);
    }
    return parseBinaryTail(parseUnary(), minLevel);
  }

  private boolean isRangeOperator() {
    return at(TokenKind.DOT_DOT) || at(TokenKind.DOT_DOT_EQUALS) || at(TokenKind.DOT_DOT_DOT);
  }

  private boolean canStartExpression() {
    return EXPRESSION_START.contains(token.kind) && !(noStructLiteral && at(TokenKind.LBRACE));
  }

  /**
   * Extends x with binary, cast and range operators of level minLevel or above. Operators of one
   * tier group to the left, except on the right-associative assignment and implication tiers.
   */
  private SyntaxNode parseBinaryTail(SyntaxNode x, int minLevel) {
    while (true) {
      if (atBigConnectiveContinuation()) {
        return x;
      }
      Operator op = peekOperator();
      if (op == null || op.entry.tier().level() < minLevel) {
        return x;
      }
      PrecedenceTable.Entry e = op.entry;
      int start = x.getStartOffset();
      int level = e.tier().level();
      switch (e.tier()) {
        case RANGE:
          {
            SyntaxNode.Builder b = nodeAt(NodeKind.RANGE_EXPRESSION, start);
            b.add(x);
            b.add(takeOperator(op));
            if (canStartExpression()) {
              b.add(parseExpression(RANGE_LEVEL + 1));
            }
            x = finish(b);
            break;
          }
        case CAST:
          x = parseCastTail(x, op, minLevel);
          break;
        case ASSIGN:
          {
            boolean plain = e.operator().equals("=");
            SyntaxNode.Builder b =
                nodeAt(
                    plain ? NodeKind.ASSIGNMENT_EXPRESSION : NodeKind.COMPOUND_ASSIGNMENT_EXPR,
                    start);
            b.add("left", x);
            b.add(plain ? "" : "operator", takeOperator(op));
            b.add("right", parseExpression(level));
            x = finish(b);
            break;
          }
        default:
          {
            SyntaxNode.Builder b = nodeAt(NodeKind.BINARY_EXPRESSION, start);
            b.add("left", x);
            b.add("operator", takeOperator(op));
            boolean right = e.associativity() == PrecedenceTable.Associativity.RIGHT;
            b.add("right", parseExpression(right ? level : level + 1));
            x = finish(b);
            break;
          }
      }
    }
  }

  // Parses the right side of an 'as', 'is', 'matches' or '@' operator applied to x.
  private SyntaxNode parseCastTail(SyntaxNode x, Operator op, int minLevel) {
    int start = x.getStartOffset();
    switch (op.entry.operator()) {
      case "as":
        {
          SyntaxNode.Builder b = nodeAt(NodeKind.TYPE_CAST_EXPRESSION, start);
          b.add("value", x);
          b.add(take());
          b.add("type", parseTypeNoBounds());
          return finish(b);
        }
      case "is":
        {
          SyntaxNode.Builder b = nodeAt(NodeKind.IS_EXPRESSION, start);
          b.add("value", x);
          b.add(take());
          b.add("variant", expectIdentifier());
          return finish(b);
        }
      case "matches":
        {
          SyntaxNode.Builder b = nodeAt(NodeKind.MATCHES_EXPRESSION_WITHOUT_BODY, start);
          b.add("value", x);
          b.add(take());
          b.add("pattern", parsePattern());
          SyntaxNode matches = finish(b);
          // 'x matches P ==> body' and 'x matches P && body' bind the body to the match.
          boolean implies = at(TokenKind.IMPLIES) && minLevel <= IMPLICATION_LEVEL;
          boolean and =
              at(TokenKind.AMPERSAND_AMPERSAND)
                  && minLevel <= AND_LEVEL
                  && !atBigConnectiveContinuation();
          if (!implies && !and) {
            return matches;
          }
          SyntaxNode.Builder m = nodeAt(NodeKind.MATCHES_EXPRESSION, start);
          m.add("matches", matches);
          m.add(take());
          m.add("body", parseExpression(implies ? IMPLICATION_LEVEL : AND_LEVEL + 1));
          return finish(m);
        }
      case "@":
        {
          SyntaxNode.Builder b = nodeAt(NodeKind.VIEW_EXPRESSION, start);
          b.add("value", x);
          b.add(take());
          return parsePostfix(finish(b));
        }
      default:
        throw new IllegalStateException("unexpected cast operator " + op.entry.operator());
    }
  }

  // Returns the binary, cast or range operator at the current position, if any.
  @Nullable
  private Operator peekOperator() {
    String spelling;
    int count = 1;
    PrecedenceTable.Fixity fixity = PrecedenceTable.Fixity.INFIX;
    switch (token.kind) {
      case GREATER:
        // The lexer never merges '>' so that generic argument lists can close one at a time.
        if (token.joint && peekKind(1) == TokenKind.GREATER) {
          if (peek(1).joint && peekKind(2) == TokenKind.EQUALS) {
            spelling = ">>=";
            count = 3;
          } else {
            spelling = ">>";
            count = 2;
          }
        } else if (token.joint && peekKind(1) == TokenKind.EQUALS) {
          spelling = ">=";
          count = 2;
        } else {
          spelling = ">";
        }
        break;
      case AT:
        spelling = "@";
        fixity = PrecedenceTable.Fixity.POSTFIX;
        break;
      case IDENTIFIER:
        if (isWord("is") || isWord("matches")) {
          spelling = (String) token.value;
          break;
        }
        return null;
      default:
        spelling = token.kind.toString();
        break;
    }
    PrecedenceTable.Entry entry = grammar.precedence().lookup(spelling, fixity);
    return entry == null ? null : new Operator(entry, count);
  }

  // Consumes the tokens of op, returning a single leaf spanning them.
  private SyntaxNode takeOperator(Operator op) {
    return takeJoined(op.tokens);
  }

  // Consumes count joint tokens, returning a single leaf spanning them.
  private SyntaxNode takeJoined(int count) {
    if (count == 1) {
      return take();
    }
    int start = token.start;
    int end = peek(count - 1).end;
    SyntaxNode leaf =
        SyntaxNode.leaf(locs, NodeKind.TOKEN, start, end, new String(buffer, start, end - start));
    for (int i = 0; i < count; i++) {
      nextToken();
    }
    return leaf;
  }

  private SyntaxNode parseUnary() {
    switch (token.kind) {
      case MINUS:
      case STAR:
      case BANG:
        {
          SyntaxNode.Builder b = node(NodeKind.UNARY_EXPRESSION);
          b.add(take());
          b.add(parseUnary());
          return finish(b);
        }
      case AMPERSAND:
        return parseReferenceExpression(false);
      case AMPERSAND_AMPERSAND:
        return parseReferenceExpression(true);
      case POUND:
        if (peekKind(1) == TokenKind.LBRACKET && decide(Conflict.STATEMENT_VS_CALL_EXPRESSION)) {
          return parseAttributedExpression();
        }
        break;
      default:
        break;
    }
    return parsePostfix(parsePrimary());
  }

  // reference_expression = '&' ('raw' ('const' | 'mut') | 'mut')? expr. '&&' is two references.
  private SyntaxNode parseReferenceExpression(boolean nested) {
    int start = token.start;
    SyntaxNode.Builder outer = node(NodeKind.REFERENCE_EXPRESSION);
    SyntaxNode.Builder b = outer;
    if (nested) {
      outer.add(SyntaxNode.leaf(locs, NodeKind.TOKEN, start, start + 1, "&"));
      b = nodeAt(NodeKind.REFERENCE_EXPRESSION, start + 1);
      b.add(SyntaxNode.leaf(locs, NodeKind.TOKEN, start + 1, token.end, "&"));
      nextToken();
    } else {
      b.add(take());
    }
    if (isNameAt(0, "raw") && (peekKind(1) == TokenKind.CONST || peekKind(1) == TokenKind.MUT)) {
      b.add(take());
      b.add(take());
    } else if (at(TokenKind.MUT)) {
      b.add(takeAs(NodeKind.MUTABLE_SPECIFIER));
    }
    b.add("value", parseUnary());
    if (nested) {
      outer.add("value", finish(b));
    }
    return finish(outer);
  }

  // Outer attributes on an expression, as in '#[trigger] f(x)'. They attach to the call, index,
  // field access or macro invocation they precede.
  private SyntaxNode parseAttributedExpression() {
    int start = token.start;
    List<SyntaxNode> attributes = new ArrayList<>();
    while (at(TokenKind.POUND) && peekKind(1) == TokenKind.LBRACKET) {
      attributes.add(parseAttributeItem());
    }
    SyntaxNode e = parseUnary();
    NodeKind kind = e.kind();
    boolean attachable =
        kind == NodeKind.CALL_EXPRESSION
            || kind == NodeKind.INDEX_EXPRESSION
            || kind == NodeKind.FIELD_EXPRESSION
            || kind == NodeKind.MACRO_INVOCATION;
    SyntaxNode.Builder b = nodeAt(attachable ? kind : NodeKind.ERROR, start);
    attributes.forEach(b::add);
    if (attachable) {
      for (int i = 0; i < e.getChildren().size(); i++) {
        String field = e.getFieldName(i);
        b.add(field == null ? "" : field, e.getChildren().get(i));
      }
    } else {
      failures++;
      reportError(start, "attributes are not allowed on %s", describe(e));
      b.add(e);
    }
    return b.build(e.getEndOffset());
  }

  // Applies postfix operators: '?', field access, '.await', calls and indexing.
  private SyntaxNode parsePostfix(SyntaxNode x) {
    while (true) {
      int start = x.getStartOffset();
      switch (token.kind) {
        case QUESTION:
          {
            SyntaxNode.Builder b = nodeAt(NodeKind.TRY_EXPRESSION, start);
            b.add(x);
            b.add(take());
            x = finish(b);
            break;
          }
        case DOT:
          {
            TokenKind next = peekKind(1);
            if (next == TokenKind.AWAIT) {
              SyntaxNode.Builder b = nodeAt(NodeKind.AWAIT_EXPRESSION, start);
              b.add(x);
              b.add(take());
              b.add(take());
              x = finish(b);
            } else if (next == TokenKind.IDENTIFIER || next == TokenKind.INT) {
              SyntaxNode.Builder b = nodeAt(NodeKind.FIELD_EXPRESSION, start);
              b.add("value", x);
              b.add(take());
              b.add(
                  "field",
                  next == TokenKind.INT
                      ? takeAs(NodeKind.INTEGER_LITERAL)
                      : takeAs(NodeKind.FIELD_IDENTIFIER));
              x = finish(b);
              if (at(TokenKind.COLON_COLON) && peekKind(1) == TokenKind.LESS) {
                // Method turbofish: x.f::<T>()
                SyntaxNode.Builder g = nodeAt(NodeKind.GENERIC_FUNCTION, start);
                g.add("function", x);
                g.add(take());
                g.add("type_arguments", parseTypeArguments());
                x = finish(g);
              }
            } else {
              syntaxError("expected field name");
              return x;
            }
            break;
          }
        case LPAREN:
          {
            SyntaxNode.Builder b = nodeAt(NodeKind.CALL_EXPRESSION, start);
            b.add("function", x);
            b.add("arguments", parseArguments());
            x = finish(b);
            break;
          }
        case LBRACKET:
          {
            SyntaxNode.Builder b = nodeAt(NodeKind.INDEX_EXPRESSION, start);
            b.add(x);
            b.add(take());
            b.add(withStructLiterals(this::parseExpression));
            b.add(expect(TokenKind.RBRACKET));
            x = finish(b);
            break;
          }
        default:
          return x;
      }
    }
  }

  // Parses with struct literals allowed again, as inside parentheses, brackets and braces.
  private SyntaxNode withStructLiterals(Supplier<SyntaxNode> parser) {
    boolean saved = noStructLiteral;
    noStructLiteral = false;
    try {
      return parser.get();
    } finally {
      noStructLiteral = saved;
    }
  }

  // Parses with struct literals disallowed, as in conditions and iterables.
  private SyntaxNode withoutStructLiterals(Supplier<SyntaxNode> parser) {
    boolean saved = noStructLiteral;
    noStructLiteral = true;
    try {
      return parser.get();
    } finally {
      noStructLiteral = saved;
    }
  }

  // arguments = '(' expr,* ','? ')'
  private SyntaxNode parseArguments() {
    SyntaxNode.Builder b = node(NodeKind.ARGUMENTS);
    b.add(take());
    boolean saved = noStructLiteral;
    noStructLiteral = false;
    while (!at(TokenKind.RPAREN) && !at(TokenKind.EOF)) {
      b.add(parseExpression());
      if (!at(TokenKind.COMMA)) {
        break;
      }
      b.add(take());
    }
    noStructLiteral = saved;
    b.add(expect(TokenKind.RPAREN));
    return finish(b);
  }

  private SyntaxNode parsePrimary() {
    switch (token.kind) {
      case INT:
      case FLOAT:
      case STRING:
      case RAW_STRING:
      case CHAR:
      case TRUE:
      case FALSE:
        return parseLiteral();
      case LPAREN:
        return withStructLiterals(this::parseParenthesizedExpression);
      case LBRACKET:
        return withStructLiterals(this::parseArrayExpression);
      case LBRACE:
      case IF:
      case MATCH:
      case WHILE:
      case LOOP:
      case QUOTE:
        return parseBlockLikeExpression();
      case FOR:
        if (verus && peekKind(1) == TokenKind.LESS) {
          return parseClosure();
        }
        return parseBlockLikeExpression();
      case UNSAFE:
      case CONST:
        if (peekKind(1) == TokenKind.LBRACE) {
          return parseBlockLikeExpression();
        }
        break;
      case ASYNC:
        if (isBlockLikeStart()) {
          return parseBlockLikeExpression();
        }
        return parseClosure();
      case STATIC:
      case MOVE:
      case PIPE:
      case PIPE_PIPE:
        return parseClosure();
      case RETURN:
      case YIELD:
        {
          SyntaxNode.Builder b =
              node(at(TokenKind.RETURN) ? NodeKind.RETURN_EXPRESSION : NodeKind.YIELD_EXPRESSION);
          b.add(take());
          if (canStartExpression()) {
            b.add(parseExpression());
          }
          return finish(b);
        }
      case BREAK:
        {
          SyntaxNode.Builder b = node(NodeKind.BREAK_EXPRESSION);
          b.add(take());
          if (at(TokenKind.QUOTE)) {
            b.add(parseQuoted(NodeKind.LABEL));
          }
          if (canStartExpression()) {
            b.add(parseExpression());
          }
          return finish(b);
        }
      case CONTINUE:
        {
          SyntaxNode.Builder b = node(NodeKind.CONTINUE_EXPRESSION);
          b.add(take());
          if (at(TokenKind.QUOTE)) {
            b.add(parseQuoted(NodeKind.LABEL));
          }
          return finish(b);
        }
      case DOLLAR:
        if (isMetavariableStart()) {
          return parseMetavariable();
        }
        break;
      case IDENTIFIER:
        if (isWord("assert") && (peekKind(1) == TokenKind.LPAREN || isWordAt(1, "forall"))) {
          return parseAssert();
        }
        if (isWord("assume") && peekKind(1) == TokenKind.LPAREN) {
          return parseAssume();
        }
        if ((isWord("forall") || isWord("exists") || isWord("choose"))
            && (peekKind(1) == TokenKind.PIPE || peekKind(1) == TokenKind.PIPE_PIPE)) {
          return parseQuantifier();
        }
        if (isBlockLikeStart()) {
          return parseBlockLikeExpression();
        }
        return parsePathExpression();
      case SELF:
      case SUPER:
      case CRATE:
      case COLON_COLON:
      case LESS:
        return parsePathExpression();
      default:
        break;
    }
    syntaxError("expected expression");
    return missing();
  }

  // '()' is the unit value, '(e)' a parenthesized expression, '(e,)' and '(e, f)' tuples.
  private SyntaxNode parseParenthesizedExpression() {
    SyntaxNode.Builder b = node(NodeKind.PARENTHESIZED_EXPRESSION);
    b.add(take());
    if (at(TokenKind.RPAREN)) {
      b.setKind(NodeKind.UNIT_EXPRESSION);
      b.add(take());
      return finish(b);
    }
    b.add(parseExpression());
    if (at(TokenKind.COMMA)) {
      b.setKind(NodeKind.TUPLE_EXPRESSION);
      while (at(TokenKind.COMMA)) {
        b.add(take());
        if (at(TokenKind.RPAREN)) {
          break;
        }
        b.add(parseExpression());
      }
    }
    b.add(expect(TokenKind.RPAREN));
    return finish(b);
  }

  // array_expression = '[' (expr ';' expr | expr,* ','?) ']'
  private SyntaxNode parseArrayExpression() {
    SyntaxNode.Builder b = node(NodeKind.ARRAY_EXPRESSION);
    b.add(take());
    if (!at(TokenKind.RBRACKET)) {
      b.add(parseExpression());
      if (decide(Conflict.ARRAY_EXPRESSION)) {
        b.add(take());
        b.add("length", parseExpression());
      } else {
        while (at(TokenKind.COMMA)) {
          b.add(take());
          if (at(TokenKind.RBRACKET)) {
            break;
          }
          b.add(parseExpression());
        }
      }
    }
    b.add(expect(TokenKind.RBRACKET));
    return finish(b);
  }

  // A path, a macro invocation, or a struct literal.
  private SyntaxNode parsePathExpression() {
    SyntaxNode path = parseExpressionPath();
    if (at(TokenKind.BANG)
        && peek(1).kind.isOpenDelimiter()
        && (path.kind() == NodeKind.IDENTIFIER || path.kind() == NodeKind.SCOPED_IDENTIFIER)) {
      return parseMacroInvocation(path);
    }
    if (at(TokenKind.LBRACE)
        && !noStructLiteral
        && (path.kind() == NodeKind.IDENTIFIER
            || path.kind() == NodeKind.SCOPED_IDENTIFIER
            || path.kind() == NodeKind.GENERIC_TYPE)
        && decide(Conflict.SCOPED_IDENTIFIER_VS_SCOPED_TYPE_IDENTIFIER)) {
      SyntaxNode.Builder b = nodeAt(NodeKind.STRUCT_EXPRESSION, path.getStartOffset());
      b.add("name", asTypePath(path));
      b.add("body", parseFieldInitializerList());
      return finish(b);
    }
    return path;
  }

  /**
   * Parses a path in expression position: identifiers joined by '::', with optional turbofish
   * arguments ('f::<T>', 'Vec::<T>::new') and an optional qualified prefix ('<T as Trait>::f').
   */
  private SyntaxNode parseExpressionPath() {
    int start = token.start;
    SyntaxNode path = null;
    if (at(TokenKind.LESS)) {
      path = parseBracketedType();
    } else if (!at(TokenKind.COLON_COLON)) {
      path = parsePathSegment();
    }
    while (at(TokenKind.COLON_COLON)) {
      if (peekKind(1) == TokenKind.LESS && path != null) {
        SyntaxNode colons = take();
        SyntaxNode arguments = parseTypeArguments();
        boolean continues = at(TokenKind.COLON_COLON) && isPathSegmentAt(1);
        SyntaxNode.Builder b =
            nodeAt(continues ? NodeKind.GENERIC_TYPE : NodeKind.GENERIC_FUNCTION, start);
        b.add(continues ? "type" : "function", continues ? asTypePath(path) : path);
        b.add(colons);
        b.add("type_arguments", arguments);
        path = finish(b);
        if (!continues) {
          break;
        }
      } else if (isPathSegmentAt(1)) {
        SyntaxNode.Builder b = nodeAt(NodeKind.SCOPED_IDENTIFIER, start);
        b.add("path", path);
        b.add(take());
        b.add("name", parsePathSegment());
        path = finish(b);
      } else {
        break;
      }
    }
    if (path == null) {
      syntaxError("expected path");
      return missing();
    }
    return path;
  }

  private boolean isPathStart() {
    switch (token.kind) {
      case IDENTIFIER:
      case SELF:
      case SUPER:
      case CRATE:
      case COLON_COLON:
      case LESS:
        return true;
      default:
        return isMetavariableStart();
    }
  }

  // Reports whether a simple path followed by '!' and a delimiter starts here.
  private boolean isMacroInvocationAhead() {
    int i = at(TokenKind.COLON_COLON) ? 1 : 0;
    while (isPathSegmentAt(i) && peekKind(i) != TokenKind.DOLLAR) {
      i++;
      if (peekKind(i) != TokenKind.COLON_COLON) {
        break;
      }
      i++;
    }
    return peekKind(i) == TokenKind.BANG && peekKind(i + 1).isOpenDelimiter();
  }

  // A macro invocation in a declaration list, where no other expression may appear.
  private SyntaxNode parseExpressionPathOrMacro() {
    SyntaxNode path = parseExpressionPath();
    return parseMacroInvocation(path);
  }

  // field_initializer_list = '{' (shorthand_field_initializer | field_initializer
  //     | base_field_initializer),* ','? '}'
  private SyntaxNode parseFieldInitializerList() {
    SyntaxNode.Builder b = node(NodeKind.FIELD_INITIALIZER_LIST);
    b.add(take());
    boolean saved = noStructLiteral;
    noStructLiteral = false;
    while (!at(TokenKind.RBRACE) && !at(TokenKind.EOF)) {
      parseOuterAttributes(b);
      if (at(TokenKind.DOT_DOT)) {
        SyntaxNode.Builder base = node(NodeKind.BASE_FIELD_INITIALIZER);
        base.add(take());
        base.add(parseExpression());
        b.add(finish(base));
      } else if ((at(TokenKind.IDENTIFIER) || at(TokenKind.INT))
          && peekKind(1) == TokenKind.COLON) {
        SyntaxNode.Builder field = node(NodeKind.FIELD_INITIALIZER);
        field.add(
            "field",
            at(TokenKind.INT)
                ? takeAs(NodeKind.INTEGER_LITERAL)
                : takeAs(NodeKind.FIELD_IDENTIFIER));
        field.add(take());
        field.add("value", parseExpression());
        b.add(finish(field));
      } else if (at(TokenKind.IDENTIFIER)) {
        SyntaxNode.Builder shorthand = node(NodeKind.SHORTHAND_FIELD_INITIALIZER);
        shorthand.add(takeAs(NodeKind.IDENTIFIER));
        b.add(finish(shorthand));
      } else {
        syntaxError("expected field initializer");
        break;
      }
      if (!at(TokenKind.COMMA)) {
        break;
      }
      b.add(take());
    }
    noStructLiteral = saved;
    b.add(expect(TokenKind.RBRACE));
    return finish(b);
  }

  // ==== Blocks and control flow ====

  // Reports whether an expression that ends with a block starts here.
  private boolean isBlockLikeStart() {
    switch (token.kind) {
      case LBRACE:
      case IF:
      case MATCH:
      case WHILE:
      case LOOP:
        return true;
      case FOR:
        return peekKind(1) != TokenKind.LESS;
      case QUOTE:
        return peekKind(2) == TokenKind.COLON;
      case UNSAFE:
      case CONST:
        return peekKind(1) == TokenKind.LBRACE;
      case ASYNC:
        return peekKind(1) == TokenKind.LBRACE
            || (peekKind(1) == TokenKind.MOVE && peekKind(2) == TokenKind.LBRACE);
      case IDENTIFIER:
        if (isNameAt(0, "gen")) {
          return peekKind(1) == TokenKind.LBRACE
              || (peekKind(1) == TokenKind.MOVE && peekKind(2) == TokenKind.LBRACE);
        }
        return (isNameAt(0, "try") || isWord("proof")) && peekKind(1) == TokenKind.LBRACE;
      default:
        return false;
    }
  }

  // Parses an expression that ends with a block, with its optional label.
  private SyntaxNode parseBlockLikeExpression() {
    int start = token.start;
    List<SyntaxNode> label = new ArrayList<>();
    if (at(TokenKind.QUOTE)) {
      label.add(parseQuoted(NodeKind.LABEL));
      addIfPresent(label, expect(TokenKind.COLON));
      if (!at(TokenKind.LBRACE)
          && !at(TokenKind.LOOP)
          && !at(TokenKind.WHILE)
          && !at(TokenKind.FOR)
          && !isWord("proof")) {
        syntaxError("expected loop or block after label");
        SyntaxNode.Builder b = nodeAt(NodeKind.ERROR, start);
        label.forEach(b::add);
        return finish(b);
      }
    }
    switch (token.kind) {
      case LBRACE:
        return parseBlock(start, label);
      case IF:
        return parseIf();
      case MATCH:
        return parseMatch();
      case WHILE:
        return parseWhile(start, label);
      case LOOP:
        return parseLoop(start, label);
      case FOR:
        return parseFor(start, label);
      case UNSAFE:
        return parseKeywordBlock(NodeKind.UNSAFE_BLOCK, /*allowMove=*/ false);
      case ASYNC:
        return parseKeywordBlock(NodeKind.ASYNC_BLOCK, /*allowMove=*/ true);
      case CONST:
        {
          SyntaxNode.Builder b = node(NodeKind.CONST_BLOCK);
          b.add(take());
          b.add("body", parseBlock());
          return finish(b);
        }
      default:
        if (isNameAt(0, "gen")) {
          return parseKeywordBlock(NodeKind.GEN_BLOCK, /*allowMove=*/ true);
        }
        if (isNameAt(0, "try")) {
          return parseKeywordBlock(NodeKind.TRY_BLOCK, /*allowMove=*/ false);
        }
        // proof_block = (label ':')? 'proof' block
        SyntaxNode.Builder b = nodeAt(NodeKind.PROOF_BLOCK, start);
        label.forEach(b::add);
        b.add(take());
        b.add(parseBlock());
        return finish(b);
    }
  }

  // unsafe_block, async_block, gen_block, try_block = keyword 'move'? block
  private SyntaxNode parseKeywordBlock(NodeKind kind, boolean allowMove) {
    SyntaxNode.Builder b = node(kind);
    b.add(take());
    if (allowMove && at(TokenKind.MOVE)) {
      b.add(take());
    }
    b.add(parseBlock());
    return finish(b);
  }

  private SyntaxNode parseBlock() {
    return parseBlock(token.start, ImmutableList.of());
  }

  // block = (label ':')? '{' statement* expr? '}'
  private SyntaxNode parseBlock(int start, List<SyntaxNode> label) {
    SyntaxNode.Builder b = nodeAt(NodeKind.BLOCK, start);
    label.forEach(b::add);
    SyntaxNode open = expect(TokenKind.LBRACE);
    if (open == null) {
      return finish(b);
    }
    b.add(open);
    boolean saved = noStructLiteral;
    noStructLiteral = false;
    parseStatements(b, /*topLevel=*/ false, /*allowExpressions=*/ true);
    noStructLiteral = saved;
    b.add(expect(TokenKind.RBRACE));
    return finish(b);
  }

  // if_expression = 'if' condition block else_clause?
  // else_clause = 'else' (block | if_expression)
  private SyntaxNode parseIf() {
    SyntaxNode.Builder b = node(NodeKind.IF_EXPRESSION);
    b.add(take());
    b.add("condition", parseCondition());
    b.add("consequence", parseBlock());
    if (at(TokenKind.ELSE)) {
      SyntaxNode.Builder e = node(NodeKind.ELSE_CLAUSE);
      e.add(take());
      e.add(at(TokenKind.IF) ? parseIf() : parseBlock());
      b.add("alternative", finish(e));
    }
    return finish(b);
  }

  /**
   * Parses the condition of an if or while: an expression, a let condition, or a chain of them
   * joined by '&&'. A '{' ends the condition.
   */
  private SyntaxNode parseCondition() {
    boolean saved = noStructLiteral;
    noStructLiteral = true;
    try {
      if (!conditionHasLet()) {
        return parseExpression();
      }
      int start = token.start;
      List<SyntaxNode> parts = new ArrayList<>();
      while (true) {
        parts.add(at(TokenKind.LET) ? parseLetCondition() : parseExpression(AND_LEVEL + 1));
        if (!at(TokenKind.AMPERSAND_AMPERSAND)) {
          break;
        }
        parts.add(take());
      }
      if (parts.size() == 1) {
        return parts.get(0);
      }
      SyntaxNode.Builder b = nodeAt(NodeKind.LET_CHAIN, start);
      parts.forEach(b::add);
      return finish(b);
    } finally {
      noStructLiteral = saved;
    }
  }

  // Reports whether a 'let' occurs in the condition that starts here, outside any brackets.
  private boolean conditionHasLet() {
    int depth = 0;
    for (int i = pos; i < tokens.size(); i++) {
      TokenKind kind = tokens.get(i).kind;
      if (kind == TokenKind.EOF
          || (depth == 0 && (kind == TokenKind.LBRACE || kind == TokenKind.SEMI))) {
        return false;
      }
      if (depth == 0 && kind == TokenKind.LET) {
        return true;
      }
      if (kind.isOpenDelimiter()) {
        depth++;
      } else if (kind.isCloseDelimiter()) {
        if (depth == 0) {
          return false;
        }
        depth--;
      }
    }
    return false;
  }

  // let_condition = 'let' pattern '=' expr
  private SyntaxNode parseLetCondition() {
    SyntaxNode.Builder b = node(NodeKind.LET_CONDITION);
    b.add(take());
    b.add("pattern", parsePattern());
    b.add(expect(TokenKind.EQUALS));
    b.add("value", parseExpression(AND_LEVEL + 1));
    return finish(b);
  }

  // match_expression = 'match' expr match_block
  private SyntaxNode parseMatch() {
    SyntaxNode.Builder b = node(NodeKind.MATCH_EXPRESSION);
    b.add(take());
    b.add("value", withoutStructLiterals(this::parseExpression));
    b.add("body", withStructLiterals(this::parseMatchBlock));
    return finish(b);
  }

  // match_block = '{' match_arm* '}'
  private SyntaxNode parseMatchBlock() {
    SyntaxNode.Builder b = node(NodeKind.MATCH_BLOCK);
    SyntaxNode open = expect(TokenKind.LBRACE);
    if (open == null) {
      return finish(b);
    }
    b.add(open);
    while (!at(TokenKind.RBRACE) && !at(TokenKind.EOF)) {
      int before = pos;
      b.add(parseMatchArm());
      if (recoveryMode) {
        b.add(syncStatement(/*topLevel=*/ false));
        recoveryMode = false;
      }
      if (pos == before) {
        SyntaxNode.Builder err = node(NodeKind.ERROR);
        err.add(take());
        b.add(finish(err));
      }
    }
    b.add(expect(TokenKind.RBRACE));
    return finish(b);
  }

  // match_arm = attribute_item* match_pattern '=>' (expr ',' | block_like ','? | expr)
  // match_pattern = pattern ('if' condition)?
  private SyntaxNode parseMatchArm() {
    SyntaxNode.Builder b = node(NodeKind.MATCH_ARM);
    while (at(TokenKind.POUND)) {
      b.add(parseAttributeItem());
    }
    SyntaxNode.Builder pattern = node(NodeKind.MATCH_PATTERN);
    pattern.add(parsePattern());
    if (at(TokenKind.IF)) {
      pattern.add(take());
      pattern.add("condition", parseCondition());
    }
    b.add("pattern", finish(pattern));
    b.add(expect(TokenKind.FAT_ARROW));
    if (isBlockLikeStart()) {
      SyntaxNode value = parseBlockLikeExpression();
      if (at(TokenKind.DOT) || at(TokenKind.QUESTION)) {
        value = parseBinaryTail(parsePostfix(value), ASSIGN_LEVEL);
      }
      b.add("value", value);
      if (at(TokenKind.COMMA)) {
        b.add(take());
      }
    } else {
      b.add("value", parseExpression());
      if (at(TokenKind.COMMA)) {
        b.add(take());
      } else if (!at(TokenKind.RBRACE)) {
        syntaxError("expected ',' or '}'");
      }
    }
    return finish(b);
  }

  // while_expression = (label ':')? 'while' condition loop_clause* block
  private SyntaxNode parseWhile(int start, List<SyntaxNode> label) {
    SyntaxNode.Builder b = nodeAt(NodeKind.WHILE_EXPRESSION, start);
    label.forEach(b::add);
    b.add(take());
    b.add("condition", parseCondition());
    parseLoopClauses(b);
    b.add("body", parseBlock());
    return finish(b);
  }

  // loop_expression = (label ':')? 'loop' loop_clause* block
  private SyntaxNode parseLoop(int start, List<SyntaxNode> label) {
    SyntaxNode.Builder b = nodeAt(NodeKind.LOOP_EXPRESSION, start);
    label.forEach(b::add);
    b.add(take());
    parseLoopClauses(b);
    b.add("body", parseBlock());
    return finish(b);
  }

  // for_expression = (label ':')? 'for' pattern 'in' expr (':' expr)? loop_clause* block
  private SyntaxNode parseFor(int start, List<SyntaxNode> label) {
    SyntaxNode.Builder b = nodeAt(NodeKind.FOR_EXPRESSION, start);
    label.forEach(b::add);
    b.add(take());
    b.add("pattern", parsePattern());
    b.add(expect(TokenKind.IN));
    b.add("value", withoutStructLiterals(this::parseExpression));
    if (verus && at(TokenKind.COLON)) {
      b.add(take());
      b.add(withoutStructLiterals(this::parseExpression));
    }
    parseLoopClauses(b);
    b.add("body", parseBlock());
    return finish(b);
  }

  // closure_expression = ('for' type_parameters)? 'static'? 'async'? 'move'? closure_parameters
  //     (('->' return_type)? fn_qualifier? block | expr | '_')
  private SyntaxNode parseClosure() {
    SyntaxNode.Builder b = node(NodeKind.CLOSURE_EXPRESSION);
    if (at(TokenKind.FOR)) {
      b.add(take());
      b.add(parseTypeParameters());
    }
    if (at(TokenKind.STATIC)) {
      b.add(take());
    }
    if (at(TokenKind.ASYNC)) {
      b.add(take());
    }
    if (at(TokenKind.MOVE)) {
      b.add(take());
    }
    b.add("parameters", parseClosureParameters());
    if (at(TokenKind.RARROW) || isFunctionClauseStart()) {
      if (at(TokenKind.RARROW)) {
        b.add(take());
        b.add("return_type", parseReturnType());
      }
      if (isFunctionClauseStart()) {
        b.add(parseFnQualifier());
      }
      b.add("body", parseBlock());
    } else if (at(TokenKind.UNDERSCORE)) {
      b.add("body", take());
    } else {
      b.add("body", parseExpression());
    }
    return finish(b);
  }

  // closure_parameters = '|' (pattern | parameter),* '|' | '||'
  private SyntaxNode parseClosureParameters() {
    SyntaxNode.Builder b = node(NodeKind.CLOSURE_PARAMETERS);
    if (at(TokenKind.PIPE_PIPE)) {
      b.add(take());
      return finish(b);
    }
    b.add(expect(TokenKind.PIPE));
    while (!at(TokenKind.PIPE) && !at(TokenKind.EOF)) {
      parseOuterAttributes(b);
      b.add(
          resolve(
              Conflict.PARAMETERS_VS_PATTERN,
              ImmutableList.of(this::parseClosureParameter, this::parsePatternNoOr)));
      if (!at(TokenKind.COMMA)) {
        break;
      }
      b.add(take());
    }
    b.add(expect(TokenKind.PIPE));
    return finish(b);
  }

  private SyntaxNode parseClosureParameter() {
    SyntaxNode.Builder b = node(NodeKind.PARAMETER);
    if (at(TokenKind.MUT)) {
      b.add(takeAs(NodeKind.MUTABLE_SPECIFIER));
    }
    b.add("pattern", parsePatternNoOr());
    b.add(expect(TokenKind.COLON));
    b.add("type", parseType());
    return finish(b);
  }

  // ==== Verification overlay expressions ====

  // quantifier_expression = ('forall' | 'exists' | 'choose') closure_parameters
  //     inner_attribute_item* (('->' type)? block | expr | '_')
  private SyntaxNode parseQuantifier() {
    SyntaxNode.Builder b = node(NodeKind.QUANTIFIER_EXPRESSION);
    b.add(take());
    b.add(parseClosureParameters());
    while (at(TokenKind.POUND) && peekKind(1) == TokenKind.BANG) {
      b.add(parseAttributeItem());
    }
    if (at(TokenKind.RARROW)) {
      b.add(take());
      b.add("return_type", parseType());
      b.add("body", parseBlock());
    } else if (at(TokenKind.UNDERSCORE)) {
      b.add("body", take());
    } else {
      b.add("body", parseExpression());
    }
    return finish(b);
  }

  // assert_expression = 'assert' '(' expr ')'
  // assert_by_block_expression = 'assert' '(' expr ')' prover requires_clause? block?
  // assert_forall_expression = 'assert' 'forall' closure ('implies' expr)? 'by' block
  private SyntaxNode parseAssert() {
    if (isWordAt(1, "forall")) {
      SyntaxNode.Builder b = node(NodeKind.ASSERT_FORALL_EXPRESSION);
      b.add(take());
      b.add(take());
      b.add(parseClosure());
      if (isWord("implies")) {
        b.add(take());
        b.add(parseExpression());
      }
      b.add(expectWord("by"));
      b.add(parseBlock());
      return finish(b);
    }
    SyntaxNode.Builder b = node(NodeKind.ASSERT_EXPRESSION);
    b.add(take());
    b.add(take());
    b.add(withStructLiterals(this::parseExpression));
    b.add(expect(TokenKind.RPAREN));
    if (decide(Conflict.ASSERT_VS_ASSERT_BY) && isWord("by")) {
      b.setKind(NodeKind.ASSERT_BY_BLOCK_EXPRESSION);
      b.add(parseProver());
      if (isWord("requires")) {
        b.add(parseExpressionListClause(NodeKind.REQUIRES_CLAUSE, Conflict.REQUIRES_CLAUSE));
      }
      if (at(TokenKind.LBRACE)) {
        b.add(parseBlock());
      }
    }
    return finish(b);
  }

  // assume_expression = 'assume' '(' expr ')'
  private SyntaxNode parseAssume() {
    SyntaxNode.Builder b = node(NodeKind.ASSUME_EXPRESSION);
    b.add(take());
    b.add(take());
    b.add(withStructLiterals(this::parseExpression));
    b.add(expect(TokenKind.RPAREN));
    return finish(b);
  }

  // ==== Literals ====

  private SyntaxNode parseLiteral() {
    switch (token.kind) {
      case INT:
        return takeAs(NodeKind.INTEGER_LITERAL);
      case FLOAT:
        return takeAs(NodeKind.FLOAT_LITERAL);
      case CHAR:
        return takeAs(NodeKind.CHAR_LITERAL);
      case TRUE:
      case FALSE:
        return takeAs(NodeKind.BOOLEAN_LITERAL);
      case STRING:
        return parseStringLiteral();
      case RAW_STRING:
        return parseRawStringLiteral();
      default:
        syntaxError("expected literal");
        return missing();
    }
  }

  // string_literal = '"' (string_content | escape_sequence)* '"'. The opening leaf includes any
  // b or c prefix.
  private SyntaxNode parseStringLiteral() {
    SyntaxNode.Builder b = node(NodeKind.STRING_LITERAL);
    int quote = token.start;
    while (buffer[quote] != '"') {
      quote++;
    }
    b.add(leaf(NodeKind.TOKEN, token.start, quote + 1));
    int contentEnd = quote + 1;
    for (Object o : (ImmutableList<?>) token.value) {
      Lexer.StringSegment segment = (Lexer.StringSegment) o;
      b.add(
          leaf(
              segment.escape ? NodeKind.ESCAPE_SEQUENCE : NodeKind.STRING_CONTENT,
              segment.start,
              segment.end));
      contentEnd = segment.end;
    }
    // An unclosed literal has no closing quote.
    if (contentEnd < token.end) {
      b.add(leaf(NodeKind.TOKEN, token.end - 1, token.end));
    }
    nextToken();
    return finish(b);
  }

  // raw_string_literal = open_fence string_content close_fence
  private SyntaxNode parseRawStringLiteral() {
    SyntaxNode.Builder b = node(NodeKind.RAW_STRING_LITERAL);
    Lexer.StringSegment content = (Lexer.StringSegment) token.value;
    b.add(leaf(NodeKind.TOKEN, token.start, content.start));
    if (content.end > content.start) {
      b.add(leaf(NodeKind.STRING_CONTENT, content.start, content.end));
    }
    if (token.end > content.end) {
      b.add(leaf(NodeKind.TOKEN, content.end, token.end));
    }
    nextToken();
    return finish(b);
  }

  private SyntaxNode leaf(NodeKind kind, int start, int end) {
    return SyntaxNode.leaf(locs, kind, start, end, new String(buffer, start, end - start));
  }

  // negative_literal = '-' (integer_literal | float_literal)
  private SyntaxNode parseNegativeLiteral() {
    SyntaxNode.Builder b = node(NodeKind.NEGATIVE_LITERAL);
    b.add(take());
    if (at(TokenKind.INT) || at(TokenKind.FLOAT)) {
      b.add(parseLiteral());
    } else {
      syntaxError("expected number after '-'");
    }
    return finish(b);
  }

  // ==== Patterns ====

  // pattern = '|'? pattern_no_or ('|' pattern_no_or)*
  private SyntaxNode parsePattern() {
    int start = token.start;
    SyntaxNode p;
    if (at(TokenKind.PIPE)) {
      SyntaxNode.Builder b = node(NodeKind.OR_PATTERN);
      b.add(take());
      b.add(parsePatternNoOr());
      p = finish(b);
    } else {
      p = parsePatternNoOr();
    }
    while (at(TokenKind.PIPE)) {
      SyntaxNode.Builder b = nodeAt(NodeKind.OR_PATTERN, start);
      b.add(p);
      b.add(take());
      b.add(parsePatternNoOr());
      p = finish(b);
    }
    return p;
  }

  private SyntaxNode parsePatternNoOr() {
    int start = token.start;
    switch (token.kind) {
      case UNDERSCORE:
        return takeAs(NodeKind.WILDCARD_PATTERN);
      case INT:
      case FLOAT:
      case STRING:
      case RAW_STRING:
      case CHAR:
      case TRUE:
      case FALSE:
        return parseRangePatternTail(parseLiteral());
      case MINUS:
        return parseRangePatternTail(parseNegativeLiteral());
      case DOT_DOT:
      case DOT_DOT_EQUALS:
        {
          if (token.kind == TokenKind.DOT_DOT && !isRangePatternBoundStart(1)) {
            return takeAs(NodeKind.REMAINING_FIELD_PATTERN);
          }
          SyntaxNode.Builder b = node(NodeKind.RANGE_PATTERN);
          b.add(take());
          b.add("right", parseRangePatternBound());
          return finish(b);
        }
      case AMPERSAND:
      case AMPERSAND_AMPERSAND:
        return parseReferencePattern();
      case REF:
        {
          SyntaxNode.Builder b = node(NodeKind.REF_PATTERN);
          b.add(take());
          b.add(parsePatternNoOr());
          return finish(b);
        }
      case MUT:
        {
          SyntaxNode.Builder b = node(NodeKind.MUT_PATTERN);
          b.add(takeAs(NodeKind.MUTABLE_SPECIFIER));
          b.add(parsePatternNoOr());
          return finish(b);
        }
      case LPAREN:
        {
          SyntaxNode.Builder b = node(NodeKind.TUPLE_PATTERN);
          parsePatternList(b, TokenKind.RPAREN);
          return finish(b);
        }
      case LBRACKET:
        {
          SyntaxNode.Builder b = node(NodeKind.SLICE_PATTERN);
          parsePatternList(b, TokenKind.RBRACKET);
          return finish(b);
        }
      case CONST:
        if (peekKind(1) == TokenKind.LBRACE) {
          SyntaxNode.Builder b = node(NodeKind.CONST_BLOCK);
          b.add(take());
          b.add("body", parseBlock());
          return finish(b);
        }
        break;
      case SELF:
        if (peekKind(1) != TokenKind.COLON_COLON) {
          return takeAs(NodeKind.SELF);
        }
        return parsePathPattern();
      case IDENTIFIER:
        if (peekKind(1) == TokenKind.AT) {
          SyntaxNode.Builder b = node(NodeKind.CAPTURED_PATTERN);
          b.add(takeAs(NodeKind.IDENTIFIER));
          b.add(take());
          b.add(parsePatternNoOr());
          return finish(b);
        }
        return parsePathPattern();
      case SUPER:
      case CRATE:
      case COLON_COLON:
      case LESS:
        return parsePathPattern();
      case DOLLAR:
        if (isMetavariableStart()) {
          return parseMetavariable();
        }
        break;
      default:
        break;
    }
    syntaxError("expected pattern");
    return nodeAt(NodeKind.ERROR, start).build(start);
  }

  // reference_pattern = '&' mutable_specifier? pattern. '&&' is two references.
  private SyntaxNode parseReferencePattern() {
    int start = token.start;
    boolean nested = at(TokenKind.AMPERSAND_AMPERSAND);
    SyntaxNode.Builder outer = node(NodeKind.REFERENCE_PATTERN);
    SyntaxNode.Builder b = outer;
    if (nested) {
      outer.add(leaf(NodeKind.TOKEN, start, start + 1));
      b = nodeAt(NodeKind.REFERENCE_PATTERN, start + 1);
      b.add(leaf(NodeKind.TOKEN, start + 1, token.end));
      nextToken();
    } else {
      b.add(take());
    }
    if (at(TokenKind.MUT)) {
      b.add(takeAs(NodeKind.MUTABLE_SPECIFIER));
    }
    b.add(parsePatternNoOr());
    if (nested) {
      outer.add(finish(b));
    }
    return finish(outer);
  }

  // Parses '(' pattern,* ','? ')' or the bracketed equivalent, the opening token included.
  private void parsePatternList(SyntaxNode.Builder b, TokenKind close) {
    b.add(take());
    while (!at(close) && !at(TokenKind.EOF)) {
      b.add(parsePattern());
      if (!at(TokenKind.COMMA)) {
        break;
      }
      b.add(take());
    }
    b.add(expect(close));
  }

  /**
   * Parses a pattern that starts with a path: a binding or constant, a tuple struct or struct
   * pattern, a generic pattern, a macro invocation, or the left bound of a range.
   */
  private SyntaxNode parsePathPattern() {
    int start = token.start;
    if (at(TokenKind.IDENTIFIER)
        && peekKind(1) == TokenKind.BANG
        && peek(2).kind.isOpenDelimiter()) {
      return parseMacroInvocation(takeAs(NodeKind.IDENTIFIER));
    }
    SyntaxNode path = parseExpressionPath();
    if (path.kind() == NodeKind.GENERIC_FUNCTION) {
      // Turbofish in a pattern: Foo::<T> or Foo::<T>(..)
      SyntaxNode.Builder g =
          nodeAt(at(TokenKind.LPAREN) ? NodeKind.GENERIC_TYPE : NodeKind.GENERIC_PATTERN, start);
      for (int i = 0; i < path.getChildren().size(); i++) {
        String field = path.getFieldName(i);
        g.add("function".equals(field) ? "" : field, path.getChildren().get(i));
      }
      path = finish(g);
    }
    switch (token.kind) {
      case LPAREN:
        {
          SyntaxNode.Builder b = nodeAt(NodeKind.TUPLE_STRUCT_PATTERN, start);
          b.add("type", path);
          parsePatternList(b, TokenKind.RPAREN);
          return finish(b);
        }
      case LBRACE:
        return parseStructPattern(start, path);
      case BANG:
        if (peek(1).kind.isOpenDelimiter()) {
          return parseMacroInvocation(path);
        }
        return path;
      case DOT_DOT:
      case DOT_DOT_EQUALS:
      case DOT_DOT_DOT:
        return parseRangePatternTail(path);
      default:
        return path;
    }
  }

  // struct_pattern = type '{' (field_pattern | remaining_field_pattern),* ','? '}'
  // field_pattern = 'ref'? mutable_specifier? (identifier | field_identifier ':' pattern)
  private SyntaxNode parseStructPattern(int start, SyntaxNode path) {
    SyntaxNode.Builder b = nodeAt(NodeKind.STRUCT_PATTERN, start);
    b.add("type", asTypePath(path));
    b.add(take());
    while (!at(TokenKind.RBRACE) && !at(TokenKind.EOF)) {
      parseOuterAttributes(b);
      if (at(TokenKind.DOT_DOT)) {
        b.add(takeAs(NodeKind.REMAINING_FIELD_PATTERN));
      } else {
        SyntaxNode.Builder f = node(NodeKind.FIELD_PATTERN);
        if (at(TokenKind.REF)) {
          f.add(take());
        }
        if (at(TokenKind.MUT)) {
          f.add(takeAs(NodeKind.MUTABLE_SPECIFIER));
        }
        if ((at(TokenKind.IDENTIFIER) || at(TokenKind.INT)) && peekKind(1) == TokenKind.COLON) {
          f.add("name", parseFieldIdentifier());
          f.add(take());
          f.add("pattern", parsePattern());
        } else if (at(TokenKind.IDENTIFIER)) {
          f.add("name", takeAs(NodeKind.SHORTHAND_FIELD_IDENTIFIER));
        } else {
          syntaxError("expected field pattern");
          b.add(finish(f));
          break;
        }
        b.add(finish(f));
      }
      if (!at(TokenKind.COMMA)) {
        break;
      }
      b.add(take());
    }
    b.add(expect(TokenKind.RBRACE));
    return finish(b);
  }

  // Extends a literal or path into a range pattern if a range operator follows.
  private SyntaxNode parseRangePatternTail(SyntaxNode left) {
    if (!at(TokenKind.DOT_DOT) && !at(TokenKind.DOT_DOT_EQUALS) && !at(TokenKind.DOT_DOT_DOT)) {
      return left;
    }
    SyntaxNode.Builder b = nodeAt(NodeKind.RANGE_PATTERN, left.getStartOffset());
    b.add("left", left);
    boolean open = at(TokenKind.DOT_DOT);
    b.add(take());
    if (!open || isRangePatternBoundStart(0)) {
      b.add("right", parseRangePatternBound());
    }
    return finish(b);
  }

  private boolean isRangePatternBoundStart(int n) {
    switch (peekKind(n)) {
      case INT:
      case FLOAT:
      case CHAR:
      case STRING:
      case RAW_STRING:
      case TRUE:
      case FALSE:
      case MINUS:
      case IDENTIFIER:
      case SELF:
      case SUPER:
      case CRATE:
      case COLON_COLON:
      case LESS:
        return true;
      default:
        return false;
    }
  }

  private SyntaxNode parseRangePatternBound() {
    if (at(TokenKind.MINUS)) {
      return parseNegativeLiteral();
    }
    if (LITERAL_TOKENS.contains(token.kind)) {
      return parseLiteral();
    }
    return parseExpressionPath();
  }

  // ==== Macros ====

  /** How a token tree treats '$'. */
  private enum TokenTreeMode {
    /** The arguments of a macro invocation, where '$' is an ordinary token. */
    INVOCATION,
    /** The left side of a macro rule, which binds metavariables to fragments. */
    PATTERN,
    /** The right side of a macro rule, which refers to bound metavariables. */
    TEMPLATE,
  }

  private boolean isMetavariableStart() {
    return at(TokenKind.DOLLAR)
        && token.joint
        && (peekKind(1) == TokenKind.IDENTIFIER || peekKind(1) == TokenKind.CRATE);
  }

  // metavariable = '$' identifier, as a single leaf.
  private SyntaxNode parseMetavariable() {
    int start = token.start;
    nextToken();
    int end = token.end;
    nextToken();
    return leaf(NodeKind.METAVARIABLE, start, end);
  }

  // macro_invocation = path '!' token_tree
  private SyntaxNode parseMacroInvocation(SyntaxNode path) {
    SyntaxNode.Builder b = nodeAt(NodeKind.MACRO_INVOCATION, path.getStartOffset());
    b.add("macro", path);
    b.add(expect(TokenKind.BANG));
    if (token.kind.isOpenDelimiter()) {
      b.add(parseDelimitedTokenTree(TokenTreeMode.INVOCATION));
    } else {
      syntaxError("expected '(', '[' or '{' after '!'");
    }
    return finish(b);
  }

  /**
   * Parses the delimited token tree that starts at the current token. A tree whose delimiters do
   * not match is reported and returned as an error node spanning the tokens the matcher consumed.
   */
  private SyntaxNode parseDelimitedTokenTree(TokenTreeMode mode) {
    TokenTreeMatcher.Result r = TokenTreeMatcher.match(tokens, pos, locs);
    if (r.tree() == null) {
      delimiterError(r.error());
      SyntaxNode.Builder b = node(NodeKind.ERROR);
      while (pos < r.endIndex() && !at(TokenKind.EOF)) {
        b.add(take());
      }
      return finish(b);
    }
    SyntaxNode tree = convertTokenTree(r.tree(), TokenTree.ROOT, mode);
    advanceTo(r.endIndex());
    return tree;
  }

  private void delimiterError(SyntaxError error) {
    failures++;
    if (!recoveryMode) {
      errorsCount++;
      if (errorsCount <= MAX_REPORTED_ERRORS) {
        errors.add(error);
      }
      recoveryMode = true;
    }
  }

  // Converts one group of a matched token tree, and its descendants, into syntax nodes.
  private SyntaxNode convertTokenTree(TokenTree tree, int group, TokenTreeMode mode) {
    Token open = tokens.get(tree.token(group));
    Token close = tokens.get(tree.closeToken(group));
    SyntaxNode.Builder b =
        nodeAt(
            mode == TokenTreeMode.PATTERN ? NodeKind.TOKEN_TREE_PATTERN : NodeKind.TOKEN_TREE,
            open.start);
    b.add(tokenLeaf(open));
    convertTokenTreeChildren(tree, tree.children(group), mode, b);
    b.add(tokenLeaf(close));
    return b.build(close.end);
  }

  private void convertTokenTreeChildren(
      TokenTree tree, ImmutableIntArray children, TokenTreeMode mode, SyntaxNode.Builder b) {
    int i = 0;
    while (i < children.length()) {
      int child = children.get(i);
      if (tree.isGroup(child)) {
        b.add(convertTokenTree(tree, child, mode));
        i++;
        continue;
      }
      Token t = tokens.get(tree.token(child));
      if (t.kind != TokenKind.DOLLAR || mode == TokenTreeMode.INVOCATION
          || i + 1 == children.length()) {
        b.add(tokenTreeLeaf(t));
        i++;
        continue;
      }
      int next = children.get(i + 1);
      if (tree.isGroup(next) && tree.delimiter(next) == TokenKind.LPAREN) {
        i = convertRepetition(tree, children, i, mode, b);
        continue;
      }
      Token name = tokens.get(tree.token(next));
      if (!tree.isGroup(next)
          && t.joint
          && (name.kind == TokenKind.IDENTIFIER || name.kind == TokenKind.CRATE)) {
        SyntaxNode metavariable = leaf(NodeKind.METAVARIABLE, t.start, name.end);
        i += 2;
        if (mode == TokenTreeMode.PATTERN
            && i + 1 < children.length()
            && !tree.isGroup(children.get(i))
            && !tree.isGroup(children.get(i + 1))
            && tokens.get(tree.token(children.get(i))).kind == TokenKind.COLON
            && tokens.get(tree.token(children.get(i + 1))).kind == TokenKind.IDENTIFIER) {
          Token colon = tokens.get(tree.token(children.get(i)));
          Token fragment = tokens.get(tree.token(children.get(i + 1)));
          SyntaxNode.Builder binding = nodeAt(NodeKind.TOKEN_BINDING_PATTERN, t.start);
          binding.add("name", metavariable);
          binding.add(tokenLeaf(colon));
          binding.add("type", leaf(NodeKind.FRAGMENT_SPECIFIER, fragment.start, fragment.end));
          if (FragmentKind.fromName(fragment.name()) == null) {
            tokenError(fragment, "unknown macro fragment specifier '" + fragment.name() + "'");
          }
          b.add(binding.build(fragment.end));
          i += 2;
        } else {
          b.add(metavariable);
        }
        continue;
      }
      b.add(tokenTreeLeaf(t));
      i++;
    }
  }

  /**
   * Converts a repetition '$' '(' ... ')' separator? operator whose '$' is at children[i], and
   * returns the index of the first child after it.
   */
  private int convertRepetition(
      TokenTree tree, ImmutableIntArray children, int i, TokenTreeMode mode, SyntaxNode.Builder b) {
    Token dollar = tokens.get(tree.token(children.get(i)));
    int group = children.get(i + 1);
    SyntaxNode.Builder r =
        nodeAt(
            mode == TokenTreeMode.PATTERN
                ? NodeKind.TOKEN_REPETITION_PATTERN
                : NodeKind.TOKEN_REPETITION,
            dollar.start);
    r.add(tokenLeaf(dollar));
    Token close = tokens.get(tree.closeToken(group));
    r.add(tokenLeaf(tokens.get(tree.token(group))));
    convertTokenTreeChildren(tree, tree.children(group), mode, r);
    r.add(tokenLeaf(close));
    int end = close.end;
    i += 2;
    if (i < children.length() && !tree.isGroup(children.get(i))) {
      Token t = tokens.get(tree.token(children.get(i)));
      boolean operator = isRepetitionOperator(t);
      boolean followedByOperator =
          i + 1 < children.length()
              && !tree.isGroup(children.get(i + 1))
              && isRepetitionOperator(tokens.get(tree.token(children.get(i + 1))));
      if (!operator || followedByOperator) {
        // separator
        r.add(tokenTreeLeaf(t));
        end = t.end;
        i++;
      }
    }
    if (i < children.length()
        && !tree.isGroup(children.get(i))
        && isRepetitionOperator(tokens.get(tree.token(children.get(i))))) {
      Token op = tokens.get(tree.token(children.get(i)));
      r.add(tokenLeaf(op));
      end = op.end;
      i++;
    } else {
      tokenError(close, "expected repetition operator '*', '+' or '?'");
    }
    b.add(r.build(end));
    return i;
  }

  private static boolean isRepetitionOperator(Token t) {
    return t.kind == TokenKind.STAR || t.kind == TokenKind.PLUS || t.kind == TokenKind.QUESTION;
  }

  private SyntaxNode tokenLeaf(Token t) {
    return leaf(NodeKind.TOKEN, t.start, t.end);
  }

  // Returns the leaf for a token inside a token tree. Literals and names are named leaves.
  private SyntaxNode tokenTreeLeaf(Token t) {
    switch (t.kind) {
      case INT:
        return leaf(NodeKind.INTEGER_LITERAL, t.start, t.end);
      case FLOAT:
        return leaf(NodeKind.FLOAT_LITERAL, t.start, t.end);
      case CHAR:
        return leaf(NodeKind.CHAR_LITERAL, t.start, t.end);
      case TRUE:
      case FALSE:
        return leaf(NodeKind.BOOLEAN_LITERAL, t.start, t.end);
      case STRING:
        return leaf(NodeKind.STRING_LITERAL, t.start, t.end);
      case RAW_STRING:
        return leaf(NodeKind.RAW_STRING_LITERAL, t.start, t.end);
      case IDENTIFIER:
        return leaf(
            PRIMITIVE_TYPES.contains(t.name())
                    || (verus && OVERLAY_PRIMITIVE_TYPES.contains(t.name()))
                ? NodeKind.PRIMITIVE_TYPE
                : NodeKind.IDENTIFIER,
            t.start,
            t.end);
      case MUT:
        return leaf(NodeKind.MUTABLE_SPECIFIER, t.start, t.end);
      case SELF:
        return leaf(NodeKind.SELF, t.start, t.end);
      case SUPER:
        return leaf(NodeKind.SUPER, t.start, t.end);
      case CRATE:
        return leaf(NodeKind.CRATE, t.start, t.end);
      default:
        return tokenLeaf(t);
    }
  }

  // Reports an error at the given token, outside the usual one-error-per-statement flow.
  private void tokenError(Token t, String message) {
    failures++;
    reportError(t.start, "syntax error at '%s': %s", tokenString(t), message);
  }

  /**
   * Parses a macro definition.
   *
   * <pre>
   * macro_definition = 'macro_rules' '!' name
   *     ( '(' rules ')' ';' | '[' rules ']' ';' | '{' rules '}' )
   * rules = (macro_rule ';')* macro_rule?
   * macro_rule = token_tree_pattern '=>' token_tree
   * </pre>
   */
  private SyntaxNode parseMacroDefinition() {
    SyntaxNode.Builder b = node(NodeKind.MACRO_DEFINITION);
    b.add(take()); // macro_rules
    b.add(expect(TokenKind.BANG));
    b.add("name", expectIdentifier());
    if (!token.kind.isOpenDelimiter()) {
      syntaxError("expected macro rules");
      return finish(b);
    }
    TokenTreeMatcher.Result r = TokenTreeMatcher.match(tokens, pos, locs);
    if (r.tree() == null) {
      delimiterError(r.error());
      SyntaxNode.Builder err = node(NodeKind.ERROR);
      while (pos < r.endIndex() && !at(TokenKind.EOF)) {
        err.add(take());
      }
      b.add(finish(err));
      return finish(b);
    }
    TokenTree tree = r.tree();
    TokenKind delimiter = tree.delimiter(TokenTree.ROOT);
    Token open = tokens.get(tree.token(TokenTree.ROOT));
    Token close = tokens.get(tree.closeToken(TokenTree.ROOT));
    b.add(tokenLeaf(open));
    ImmutableIntArray children = tree.children(TokenTree.ROOT);
    int i = 0;
    while (i < children.length()) {
      int left = children.get(i);
      if (!tree.isGroup(left)) {
        tokenError(tokens.get(tree.token(left)), "expected macro rule pattern");
        break;
      }
      SyntaxNode.Builder rule =
          nodeAt(NodeKind.MACRO_RULE, tokens.get(tree.token(left)).start);
      rule.add("left", convertTokenTree(tree, left, TokenTreeMode.PATTERN));
      i++;
      if (i >= children.length()
          || tree.isGroup(children.get(i))
          || tokens.get(tree.token(children.get(i))).kind != TokenKind.FAT_ARROW) {
        Token at = tokens.get(tree.closeToken(left));
        tokenError(at, "expected '=>' after macro rule pattern");
        b.add(rule.build(at.end));
        break;
      }
      rule.add(tokenLeaf(tokens.get(tree.token(children.get(i)))));
      i++;
      if (i >= children.length() || !tree.isGroup(children.get(i))) {
        Token at = tokens.get(tree.token(children.get(i - 1)));
        tokenError(at, "expected macro rule template");
        b.add(rule.build(at.end));
        break;
      }
      int right = children.get(i);
      rule.add("right", convertTokenTree(tree, right, TokenTreeMode.TEMPLATE));
      b.add(rule.build(tokens.get(tree.closeToken(right)).end));
      i++;
      if (i < children.length()) {
        Token t = tokens.get(tree.token(children.get(i)));
        if (tree.isGroup(children.get(i)) || t.kind != TokenKind.SEMI) {
          tokenError(t, "expected ';' between macro rules");
          break;
        }
        b.add(tokenLeaf(t));
        i++;
      }
    }
    b.add(tokenLeaf(close));
    advanceTo(r.endIndex());
    if (delimiter != TokenKind.LBRACE) {
      b.add(expect(TokenKind.SEMI));
    }
    return finish(b);
  }
}
