package io.crswkt.model;

/**
 * A PRIMEM node
 */
public class PrimeMeridian extends IdentifiableNode {
  private final double longitude;

  public PrimeMeridian(String name, double longitude, Authority authority) {
    super(NodeKind.PRIMEM, name, authority);
    this.longitude = longitude;
  }

  /**
   * @return the longitude of the prime meridian relative to Greenwich
   */
  public double getLongitude() {
    return longitude;
  }

  @Override
  public <T> T accept(CrsNodeVisitor<T> visitor) {
    return visitor.visitPrimeMeridian(this);
  }
}
