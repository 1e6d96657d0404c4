package io.crswkt.parser;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import io.crswkt.model.Authority;
import io.crswkt.model.Axis;
import io.crswkt.model.AxisDirection;
import io.crswkt.model.CrsNode;
import io.crswkt.model.Datum;
import io.crswkt.model.GeographicCs;
import io.crswkt.model.LocalCs;
import io.crswkt.model.LocalDatum;
import io.crswkt.model.NodeKind;
import io.crswkt.model.Parameter;
import io.crswkt.model.PrimeMeridian;
import io.crswkt.model.ProjectedCs;
import io.crswkt.model.Projection;
import io.crswkt.model.Spheroid;
import io.crswkt.model.ToWgs84;
import io.crswkt.model.Unit;
import io.crswkt.model.VerticalCs;
import io.crswkt.model.VerticalDatum;

/**
 * Test {@link NodeClassifier}
 */
public class NodeClassifierTest {
  private final NodeClassifier classifier = new NodeClassifier();

  private static List<CrsNode> nodes(CrsNode... nodes) {
    return Arrays.asList(nodes);
  }

  /**
   * Children are assigned to their slots regardless of their order
   */
  @Test
  public void geographicCs() {
    Authority auth = new Authority("EPSG", "4277");
    Unit unit = new Unit("degree", 0.0174532925199433, null);
    Datum datum = new Datum("D", null, null, null);
    PrimeMeridian primem = new PrimeMeridian("Greenwich", 0, null);
    Axis lat = new Axis("lat", AxisDirection.NORTH);
    Axis lon = new Axis("lon", AxisDirection.EAST);

    GeographicCs cs = classifier.classifyGeographicCs("G",
        nodes(auth, lat, unit, datum, lon, primem));
    assertEquals("G", cs.getName());
    assertSame(datum, cs.getDatum());
    assertSame(primem, cs.getPrimeMeridian());
    assertSame(unit, cs.getAngularUnit());
    assertSame(auth, cs.getAuthority());
    assertEquals(Arrays.asList(lat, lon), cs.getAxisList());
  }

  /**
   * Missing children stay unset
   */
  @Test
  public void emptyGeographicCs() {
    GeographicCs cs = classifier.classifyGeographicCs("G",
        Collections.<CrsNode>emptyList());
    assertNull(cs.getDatum());
    assertNull(cs.getAuthority());
    assertTrue(cs.getAxisList().isEmpty());
  }

  /**
   * Parameters are kept in document order
   */
  @Test
  public void projectedCs() {
    GeographicCs geogcs = classifier.classifyGeographicCs("G",
        Collections.<CrsNode>emptyList());
    Parameter p1 = new Parameter("a", 1L);
    Parameter p2 = new Parameter("b", 2.5);
    Projection proj = new Projection("Transverse Mercator", null);
    ProjectedCs cs = classifier.classifyProjectedCs("P", geogcs,
        nodes(p1, proj, p2));
    assertSame(geogcs, cs.getGeographicCs());
    assertSame(proj, cs.getProjection());
    assertEquals(Arrays.asList(p1, p2), cs.getParamList());
  }

  /**
   * Spheroid and datum shift of a datum
   */
  @Test
  public void datum() {
    Spheroid spheroid = new Spheroid("Airy 1830", 6377563.396, 299.3249646, null);
    ToWgs84 towgs84 = new ToWgs84(375, -111, 431, 0, 0, 0, 0);
    Datum datum = classifier.classifyDatum("D", nodes(towgs84, spheroid));
    assertSame(spheroid, datum.getSpheroid());
    assertSame(towgs84, datum.getTowgs84());
  }

  /**
   * A datum does not accept axes
   */
  @Test
  public void datumWithAxis() {
    try {
      classifier.classifyDatum("D", nodes(new Axis("x", AxisDirection.OTHER)));
      fail("Expected a content error");
    } catch (WktContentException e) {
      assertEquals(NodeKind.DATUM, e.getParentKind());
      assertEquals(NodeKind.AXIS, e.getOffendingKind());
    }
  }

  /**
   * A vertical coordinate system does not accept a horizontal datum
   */
  @Test(expected = WktContentException.class)
  public void verticalCsWithDatum() {
    classifier.classifyVerticalCs("V", nodes(new Datum("D", null, null, null)));
  }

  /**
   * Vertical and local coordinate systems
   */
  @Test
  public void verticalAndLocalCs() {
    VerticalDatum vd = new VerticalDatum("VD", 2005, null);
    Axis up = new Axis("Up", AxisDirection.UP);
    VerticalCs vcs = classifier.classifyVerticalCs("V", nodes(up, vd));
    assertSame(vd, vcs.getVertDatum());
    assertEquals(1, vcs.getAxisList().size());

    LocalDatum ld = new LocalDatum("LD", 10000, null);
    LocalCs lcs = classifier.classifyLocalCs("L", nodes(ld, up));
    assertSame(ld, lcs.getLocalDatum());
    assertEquals(1, lcs.getAxisList().size());
  }

  /**
   * If a singular child is given more than once, the last one wins
   */
  @Test
  public void duplicateAuthority() {
    Authority second = new Authority("EPSG", "2");
    GeographicCs cs = classifier.classifyGeographicCs("G",
        nodes(new Authority("EPSG", "1"), second));
    assertSame(second, cs.getAuthority());
  }

  /**
   * The last datum shift of a datum wins
   */
  @Test
  public void duplicateTowgs84() {
    ToWgs84 second = new ToWgs84(1, 2, 3, 4, 5, 6, 7);
    Datum datum = classifier.classifyDatum("D",
        nodes(new ToWgs84(0, 0, 0, 0, 0, 0, 0), second));
    assertSame(second, datum.getTowgs84());
  }
}
