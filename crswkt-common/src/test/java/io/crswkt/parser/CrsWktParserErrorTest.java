package io.crswkt.parser;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import io.crswkt.ConfigConstants;
import io.crswkt.model.NodeKind;
import io.vertx.core.json.JsonObject;

/**
 * Test how {@link CrsWktParser} handles invalid input
 */
public class CrsWktParserErrorTest {
  private static WktSyntaxException expectSyntaxError(String wkt) {
    return expectSyntaxError(new CrsWktParser(), wkt);
  }

  private static WktSyntaxException expectSyntaxError(CrsWktParser parser,
      String wkt) {
    try {
      parser.parse(wkt);
    } catch (WktSyntaxException e) {
      return e;
    }
    fail("Expected a syntax error for " + wkt);
    return null;
  }

  private static WktContentException expectContentError(String wkt) {
    try {
      new CrsWktParser().parse(wkt);
    } catch (WktContentException e) {
      return e;
    }
    fail("Expected a content error for " + wkt);
    return null;
  }

  /**
   * A geographic coordinate system with a single axis
   */
  @Test
  public void geographicCsWithOneAxis() {
    WktContentException e = expectContentError(
        "GEOGCS[\"G\", AXIS[\"lat\",NORTH]]");
    assertTrue(e.getMessage(), e.getMessage().contains(
        "0 or 2 axes expected, 1 defined"));
    assertEquals(NodeKind.GEOGCS, e.getParentKind());
    assertEquals(NodeKind.AXIS, e.getOffendingKind());
  }

  /**
   * A projected coordinate system with three axes
   */
  @Test
  public void projectedCsWithThreeAxes() {
    WktContentException e = expectContentError("PROJCS[\"P\", GEOGCS[\"G\"], " +
        "AXIS[\"E\",EAST], AXIS[\"N\",NORTH], AXIS[\"H\",UP]]");
    assertTrue(e.getMessage(), e.getMessage().contains(
        "0 or 2 axes expected, 3 defined"));
    assertEquals(NodeKind.PROJCS, e.getParentKind());
  }

  /**
   * A geocentric coordinate system with two axes
   */
  @Test
  public void geocentricCsWithTwoAxes() {
    WktContentException e = expectContentError("GEOCCS[\"C\", " +
        "AXIS[\"X\",OTHER], AXIS[\"Y\",EAST]]");
    assertTrue(e.getMessage(), e.getMessage().contains(
        "0 or 3 axes expected, 2 defined"));
  }

  /**
   * A vertical coordinate system with two axes
   */
  @Test
  public void verticalCsWithTwoAxes() {
    WktContentException e = expectContentError("VERT_CS[\"V\", " +
        "AXIS[\"H\",UP], AXIS[\"D\",DOWN]]");
    assertTrue(e.getMessage(), e.getMessage().contains(
        "0 or 1 axes expected, 2 defined"));
  }

  /**
   * A local coordinate system without axes
   */
  @Test
  public void localCsWithoutAxes() {
    WktContentException e = expectContentError("LOCAL_CS[\"L\", " +
        "LOCAL_DATUM[\"LD\",10000]]");
    assertTrue(e.getMessage(), e.getMessage().contains(
        "1 or 2 axes expected, 0 defined"));
    assertEquals(NodeKind.LOCAL_CS, e.getParentKind());
  }

  /**
   * A child node that is not valid in its parent
   */
  @Test
  public void invalidChild() {
    WktContentException e = expectContentError(
        "GEOGCS[\"G\", PARAMETER[\"False easting\",0]]");
    assertEquals("PARAMETER node is not valid in a GEOGCS definition",
        e.getMessage());
    assertEquals(NodeKind.PARAMETER, e.getOffendingKind());
    assertEquals(NodeKind.GEOGCS, e.getParentKind());
  }

  /**
   * A datum shift outside a datum
   */
  @Test
  public void towgs84OutsideDatum() {
    WktContentException e = expectContentError(
        "GEOGCS[\"G\", TOWGS84[0,0,0,0,0,0,0]]");
    assertEquals(NodeKind.TOWGS84, e.getOffendingKind());
  }

  /**
   * TOWGS84 with six values
   */
  @Test
  public void towgs84WithSixValues() {
    WktSyntaxException e = expectSyntaxError("GEOGCS[\"G\", DATUM[\"D\", " +
        "TOWGS84[1,2,3,4,5,6]]]");
    assertEquals("]", e.getOffendingText());
    assertFalse(e.isPrematureEnd());
  }

  /**
   * TOWGS84 with eight values
   */
  @Test
  public void towgs84WithEightValues() {
    WktSyntaxException e = expectSyntaxError("GEOGCS[\"G\", DATUM[\"D\", " +
        "TOWGS84[1,2,3,4,5,6,7,8]]]");
    assertEquals(",", e.getOffendingText());
  }

  /**
   * Characters no token matches
   */
  @Test
  public void illegalCharacter() {
    WktSyntaxException e = expectSyntaxError("GEOGCS[\"G\"] $");
    assertEquals("$", e.getOffendingText());
    assertEquals(1, e.getLine());
    assertEquals(13, e.getColumn());
    assertEquals(12, e.getOffset());
    assertTrue(e.getMessage(), e.getMessage().startsWith("Illegal character(s)"));
  }

  /**
   * Lower-case keywords are not keywords
   */
  @Test
  public void lowerCaseKeyword() {
    WktSyntaxException e = expectSyntaxError("geogcs[\"G\"]");
    assertEquals("g", e.getOffendingText());
  }

  /**
   * Upper-case words that are not WKT keywords
   */
  @Test
  public void unknownKeyword() {
    WktSyntaxException e = expectSyntaxError("GEOGCS[\"G\",\n  AXIS[\"a\", NORTHWARD]]");
    assertEquals("NORTHWARD", e.getOffendingText());
    assertTrue(e.getMessage(), e.getMessage().contains("KEYWORD"));
    assertEquals(2, e.getLine());
    assertEquals(13, e.getColumn());
  }

  /**
   * Names must be quoted
   */
  @Test
  public void unquotedName() {
    expectSyntaxError("GEOGCS[G]");
  }

  /**
   * Input ending in the middle of a node
   */
  @Test
  public void prematureEnd() {
    WktSyntaxException e = expectSyntaxError("GEOGCS[\"G\", DATUM[\"D\"");
    assertTrue(e.isPrematureEnd());
    assertNull(e.getOffendingText());
  }

  /**
   * Empty input
   */
  @Test
  public void emptyInput() {
    assertTrue(expectSyntaxError("").isPrematureEnd());
    assertTrue(expectSyntaxError("  \n\t ").isPrematureEnd());
  }

  /**
   * Anything after the coordinate system
   */
  @Test
  public void trailingTokens() {
    WktSyntaxException e = expectSyntaxError("GEOGCS[\"G\"] GEOGCS[\"H\"]");
    assertEquals("GEOGCS", e.getOffendingText());
    assertEquals(13, e.getColumn());
  }

  /**
   * A trailing comma in a node list
   */
  @Test
  public void trailingComma() {
    expectSyntaxError("GEOGCS[\"G\",]");
  }

  /**
   * A coordinate system nested in a node list
   */
  @Test
  public void nestedCoordinateSystem() {
    expectSyntaxError("GEOGCS[\"G\", GEOGCS[\"H\"]]");
  }

  /**
   * A compound coordinate system with only one child
   */
  @Test
  public void compoundCsWithOneChild() {
    expectSyntaxError("COMPD_CS[\"C\", GEOGCS[\"G\"]]");
  }

  /**
   * Compound coordinate systems cannot be nested
   */
  @Test
  public void nestedCompoundCs() {
    expectSyntaxError("COMPD_CS[\"C\", COMPD_CS[\"D\", GEOGCS[\"G\"], " +
        "GEOGCS[\"H\"]], GEOGCS[\"I\"]]");
  }

  /**
   * Authority codes must consist of digits
   */
  @Test
  public void nonNumericAuthorityCode() {
    WktSyntaxException e = expectSyntaxError(
        "GEOGCS[\"G\", AUTHORITY[\"EPSG\",\"ABC\"]]");
    assertEquals("\"ABC\"", e.getOffendingText());
  }

  /**
   * A datum type that is not an integer
   */
  @Test
  public void decimalDatumType() {
    WktSyntaxException e = expectSyntaxError(
        "VERT_CS[\"V\", VERT_DATUM[\"VD\", 2005.5]]");
    assertEquals("2005.5", e.getOffendingText());
    assertTrue(e.getMessage(), e.getMessage().contains("integer expected"));
  }

  /**
   * Brackets nested deeper than configured
   */
  @Test
  public void nestingTooDeep() {
    CrsWktParser parser = new CrsWktParser(new JsonObject()
        .put(ConfigConstants.MAX_DEPTH, 2), null);
    WktSyntaxException e = expectSyntaxError(parser,
        "GEOGCS[\"G\", DATUM[\"D\", SPHEROID[\"S\", 1, 2]]]");
    assertTrue(e.getMessage(), e.getMessage().contains("nested deeper than 2"));
    assertEquals("[", e.getOffendingText());

    // the same string is fine with the default depth
    new CrsWktParser().parse("GEOGCS[\"G\", DATUM[\"D\", SPHEROID[\"S\", 1, 2]]]");
  }

  /**
   * The depth must be positive
   */
  @Test(expected = IllegalArgumentException.class)
  public void invalidMaxDepth() {
    new CrsWktParser(new JsonObject().put(ConfigConstants.MAX_DEPTH, 0), null);
  }
}
