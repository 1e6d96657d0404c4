package io.crswkt.parser;

import java.math.BigInteger;

import org.antlr.v4.runtime.Token;

/**
 * Explicit conversions of NUMBER tokens to the numeric types stored in the
 * tree. Every conversion either succeeds or raises a
 * {@link WktSyntaxException} pointing at the token.
 */
public final class WktNumbers {
  private WktNumbers() {
    // hidden constructor
  }

  /**
   * Convert a token to an integer
   * @param token the token
   * @return the integer
   * @throws WktSyntaxException if the token is not an integral literal or
   * does not fit into an int
   */
  public static int parseInt(Token token) {
    try {
      return Integer.parseInt(token.getText());
    } catch (NumberFormatException e) {
      throw malformed(token, "integer");
    }
  }

  /**
   * Convert a token to a floating point number
   * @param token the token
   * @return the number
   * @throws WktSyntaxException if the token is not a numeric literal
   */
  public static double parseFloat(Token token) {
    try {
      return Double.parseDouble(token.getText());
    } catch (NumberFormatException e) {
      throw malformed(token, "number");
    }
  }

  /**
   * Convert a token to an integral number if its literal is integral,
   * otherwise to a floating point number. Integral literals become a
   * {@link Long} or, if they are too large, a {@link BigInteger}.
   * @param token the token
   * @return the number
   * @throws WktSyntaxException if the token is not a numeric literal
   */
  public static Number parseIntElseFloat(Token token) {
    String text = token.getText();
    if (text.indexOf('.') < 0) {
      try {
        return Long.parseLong(text);
      } catch (NumberFormatException e) {
        try {
          return new BigInteger(text);
        } catch (NumberFormatException e2) {
          throw malformed(token, "number");
        }
      }
    }
    return parseFloat(token);
  }

  private static WktSyntaxException malformed(Token token, String expected) {
    int line = token.getLine();
    int column = token.getCharPositionInLine() + 1;
    return new WktSyntaxException("Syntax error at line " + line +
        ", column " + column + ": " + expected + " expected, found '" +
        token.getText() + "'", line, column, token.getStartIndex(),
        token.getText(), false);
  }
}
