package io.crswkt.model;

/**
 * A TOWGS84 node holding the 7-parameter datum shift to WGS84: three
 * translations, three rotations and a scale factor in parts per million
 */
public class ToWgs84 extends IdentifiableNode {
  /**
   * The number of parameters of a TOWGS84 node
   */
  public static final int PARAMETER_COUNT = 7;

  private final double dx;
  private final double dy;
  private final double dz;
  private final double ex;
  private final double ey;
  private final double ez;
  private final double ppm;

  /**
   * Constructs the node
   * @param params the seven parameters dx, dy, dz, ex, ey, ez and ppm
   * @throws IllegalArgumentException if there are not exactly seven
   * parameters
   */
  public ToWgs84(double... params) {
    super(NodeKind.TOWGS84, null, null);
    if (params.length != PARAMETER_COUNT) {
      throw new IllegalArgumentException("TOWGS84 requires " + PARAMETER_COUNT +
          " parameters, " + params.length + " given");
    }
    this.dx = params[0];
    this.dy = params[1];
    this.dz = params[2];
    this.ex = params[3];
    this.ey = params[4];
    this.ez = params[5];
    this.ppm = params[6];
  }

  public double getDx() {
    return dx;
  }

  public double getDy() {
    return dy;
  }

  public double getDz() {
    return dz;
  }

  public double getEx() {
    return ex;
  }

  public double getEy() {
    return ey;
  }

  public double getEz() {
    return ez;
  }

  public double getPpm() {
    return ppm;
  }

  /**
   * @return a new array holding all seven parameters in WKT order
   */
  public double[] toArray() {
    return new double[] { dx, dy, dz, ex, ey, ez, ppm };
  }

  @Override
  public <T> T accept(CrsNodeVisitor<T> visitor) {
    return visitor.visitToWgs84(this);
  }
}
