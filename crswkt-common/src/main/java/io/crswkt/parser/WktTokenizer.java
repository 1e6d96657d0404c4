package io.crswkt.parser;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.LexerNoViableAltException;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.Interval;

import com.google.common.base.CharMatcher;

/**
 * The lexer used for a single parse. Lax mode and the maximum nesting
 * depth are fixed at construction. Lexical errors are raised immediately
 * as {@link WktSyntaxException}s.
 */
class WktTokenizer extends WktLexer {
  private static final CharMatcher LINE_BREAK = CharMatcher.anyOf("\r\n");

  private final int maxDepth;
  private int depth;

  /**
   * Create a tokenizer
   * @param input the characters to tokenize
   * @param lax true if '#' comments should be accepted
   * @param maxDepth the maximum number of nested brackets
   */
  WktTokenizer(CharStream input, boolean lax, int maxDepth) {
    super(input);
    this.lax = lax;
    this.maxDepth = maxDepth;
    removeErrorListeners();
  }

  @Override
  public Token nextToken() {
    Token t = super.nextToken();
    if (t.getType() == LBRACKET) {
      ++depth;
      if (depth > maxDepth) {
        int column = t.getCharPositionInLine() + 1;
        throw new WktSyntaxException("Syntax error at line " + t.getLine() +
            ", column " + column + ": brackets nested deeper than " +
            maxDepth + " levels", t.getLine(), column, t.getStartIndex(),
            t.getText(), false);
      }
    } else if (t.getType() == RBRACKET && depth > 0) {
      --depth;
    }
    return t;
  }

  @Override
  public void notifyListeners(LexerNoViableAltException e) {
    // the lexer stops at the character it could not match, which is the
    // line break if a comment has been rejected
    String text = LINE_BREAK.trimTrailingFrom(_input.getText(
        Interval.of(_tokenStartCharIndex, _input.index())));
    throw WktSyntaxException.illegalCharacters(text, _tokenStartLine,
        _tokenStartCharPositionInLine + 1, _tokenStartCharIndex);
  }
}
