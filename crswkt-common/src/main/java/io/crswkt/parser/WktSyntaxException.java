package io.crswkt.parser;

/**
 * Raised if a CRS WKT string violates the token or grammar rules: an
 * illegal character, an unexpected token, a malformed numeral, too deeply
 * nested brackets or a premature end of input
 */
public class WktSyntaxException extends WktException {
  private static final long serialVersionUID = 6620318957720443513L;

  private final int line;
  private final int column;
  private final int offset;
  private final String offendingText;
  private final boolean prematureEnd;

  /**
   * Constructs a new exception
   * @param message the detail message
   * @param line the line where the error occurred (1-based)
   * @param column the column where the error occurred (1-based)
   * @param offset the absolute character offset of the error (0-based)
   * @param offendingText the text that caused the error (may be null)
   * @param prematureEnd true if the input ended in the middle of a construct
   */
  public WktSyntaxException(String message, int line, int column, int offset,
      String offendingText, boolean prematureEnd) {
    super(message);
    this.line = line;
    this.column = column;
    this.offset = offset;
    this.offendingText = offendingText;
    this.prematureEnd = prematureEnd;
  }

  /**
   * Create an exception for characters no token rule matches
   * @param text the offending text
   * @param line the line (1-based)
   * @param column the column (1-based)
   * @param offset the absolute offset (0-based)
   * @return the exception
   */
  public static WktSyntaxException illegalCharacters(String text, int line,
      int column, int offset) {
    return new WktSyntaxException("Illegal character(s) encountered at line " +
        line + ", column " + column + ": '" + text + "'", line, column,
        offset, text, false);
  }

  /**
   * Create an exception for a token that does not fit the grammar
   * @param tokenType the symbolic name of the token's type
   * @param text the token's text
   * @param line the line (1-based)
   * @param column the column (1-based)
   * @param offset the absolute offset (0-based)
   * @return the exception
   */
  public static WktSyntaxException unexpectedToken(String tokenType,
      String text, int line, int column, int offset) {
    return new WktSyntaxException("Syntax error at line " + line +
        ", column " + column + ": unexpected token " + tokenType +
        " '" + text + "'", line, column, offset, text, false);
  }

  /**
   * Create an exception for input that ended in the middle of a construct
   * @param line the line of the end of input (1-based)
   * @param column the column of the end of input (1-based)
   * @param offset the length of the input
   * @return the exception
   */
  public static WktSyntaxException prematureEnd(int line, int column,
      int offset) {
    return new WktSyntaxException("Syntax error: premature end of input " +
        "at line " + line + ", column " + column, line, column, offset,
        null, true);
  }

  /**
   * @return the line where the error occurred (1-based)
   */
  public int getLine() {
    return line;
  }

  /**
   * @return the column where the error occurred (1-based)
   */
  public int getColumn() {
    return column;
  }

  /**
   * @return the absolute character offset of the error (0-based)
   */
  public int getOffset() {
    return offset;
  }

  /**
   * @return the text that caused the error or null if the input ended
   * prematurely
   */
  public String getOffendingText() {
    return offendingText;
  }

  /**
   * @return true if the input ended in the middle of a construct
   */
  public boolean isPrematureEnd() {
    return prematureEnd;
  }
}
