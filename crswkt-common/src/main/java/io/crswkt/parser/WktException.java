package io.crswkt.parser;

/**
 * Base class for all errors raised while parsing a CRS WKT string
 */
public class WktException extends RuntimeException {
  private static final long serialVersionUID = -2287385215873470373L;

  /**
   * Constructs a new exception
   * @param message the detail message
   */
  public WktException(String message) {
    super(message);
  }
}
