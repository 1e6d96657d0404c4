package io.crswkt.model;

/**
 * A horizontal DATUM node
 */
public class Datum extends IdentifiableNode {
  private final Spheroid spheroid;
  private final ToWgs84 towgs84;

  /**
   * Constructs the node
   * @param name the datum's name
   * @param spheroid the reference ellipsoid (may be null)
   * @param towgs84 the shift to WGS84 (may be null)
   * @param authority the authority (may be null)
   */
  public Datum(String name, Spheroid spheroid, ToWgs84 towgs84,
      Authority authority) {
    super(NodeKind.DATUM, name, authority);
    this.spheroid = spheroid;
    this.towgs84 = towgs84;
  }

  public Spheroid getSpheroid() {
    return spheroid;
  }

  /**
   * @return the shift to WGS84 or null if the datum does not define one
   */
  public ToWgs84 getTowgs84() {
    return towgs84;
  }

  @Override
  public <T> T accept(CrsNodeVisitor<T> visitor) {
    return visitor.visitDatum(this);
  }
}
