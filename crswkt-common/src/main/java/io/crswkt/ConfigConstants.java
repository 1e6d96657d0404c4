package io.crswkt;

/**
 * Configuration constants
 */
@SuppressWarnings("javadoc")
public final class ConfigConstants {
  public static final String STRICT = "crswkt.strict";
  public static final String MAX_DEPTH = "crswkt.maxDepth";
  public static final String PRETTY = "crswkt.pretty";

  public static final boolean DEFAULT_STRICT = true;
  public static final int DEFAULT_MAX_DEPTH = 16;
  public static final boolean DEFAULT_PRETTY = false;

  private ConfigConstants() {
    // hidden constructor
  }
}
