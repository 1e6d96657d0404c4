package io.crswkt.model;

/**
 * A SPHEROID node describing the reference ellipsoid of a {@link Datum}
 */
public class Spheroid extends IdentifiableNode {
  private final double semiMajorAxis;
  private final double inverseFlattening;

  public Spheroid(String name, double semiMajorAxis, double inverseFlattening,
      Authority authority) {
    super(NodeKind.SPHEROID, name, authority);
    this.semiMajorAxis = semiMajorAxis;
    this.inverseFlattening = inverseFlattening;
  }

  /**
   * @return the semi-major axis in metres
   */
  public double getSemiMajorAxis() {
    return semiMajorAxis;
  }

  /**
   * @return the inverse flattening (0 for a sphere)
   */
  public double getInverseFlattening() {
    return inverseFlattening;
  }

  @Override
  public <T> T accept(CrsNodeVisitor<T> visitor) {
    return visitor.visitSpheroid(this);
  }
}
