package io.crswkt.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;

/**
 * Converts the first error the parser reports into a
 * {@link WktSyntaxException}. Since the exception aborts the parse, the
 * parser never attempts to recover.
 */
class WktErrorListener extends BaseErrorListener {
  static final WktErrorListener INSTANCE = new WktErrorListener();

  @Override
  public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
      int line, int charPositionInLine, String msg, RecognitionException e) {
    if (!(offendingSymbol instanceof Token)) {
      throw new WktSyntaxException("Syntax error at line " + line +
          ", column " + (charPositionInLine + 1) + ": " + msg, line,
          charPositionInLine + 1, -1, null, false);
    }

    Token t = (Token)offendingSymbol;
    if (t.getType() == Token.EOF) {
      throw WktSyntaxException.prematureEnd(line, charPositionInLine + 1,
          t.getStartIndex());
    }

    String tokenType = recognizer.getVocabulary().getSymbolicName(t.getType());
    throw WktSyntaxException.unexpectedToken(tokenType, t.getText(), line,
        charPositionInLine + 1, t.getStartIndex());
  }
}
