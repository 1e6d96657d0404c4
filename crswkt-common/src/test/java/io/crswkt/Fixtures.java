package io.crswkt;

import java.io.IOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.IOUtils;

/**
 * Loads test fixtures from the classpath
 */
public final class Fixtures {
  private Fixtures() {
    // hidden constructor
  }

  /**
   * Load a fixture
   * @param name the fixture's file name (without path)
   * @return the fixture's contents
   */
  public static String load(String name) {
    URL u = Fixtures.class.getResource("fixtures/" + name);
    if (u == null) {
      throw new IllegalArgumentException("Unknown fixture: " + name);
    }
    try {
      return IOUtils.toString(u, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
  }
}
