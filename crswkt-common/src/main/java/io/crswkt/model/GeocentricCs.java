package io.crswkt.model;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * A geocentric coordinate system (GEOCCS)
 */
public class GeocentricCs extends CoordinateSystem {
  private final Datum datum;
  private final PrimeMeridian primeMeridian;
  private final Unit linearUnit;
  private final List<Axis> axisList;

  public GeocentricCs(String name, Datum datum, PrimeMeridian primeMeridian,
      Unit linearUnit, List<Axis> axisList, Authority authority) {
    super(NodeKind.GEOCCS, name, authority);
    this.datum = datum;
    this.primeMeridian = primeMeridian;
    this.linearUnit = linearUnit;
    this.axisList = axisList == null ? ImmutableList.of() : ImmutableList.copyOf(axisList);
  }

  public Datum getDatum() {
    return datum;
  }

  public PrimeMeridian getPrimeMeridian() {
    return primeMeridian;
  }

  public Unit getLinearUnit() {
    return linearUnit;
  }

  /**
   * @return an unmodifiable list of the axes, 0 or 3 (never null)
   */
  public List<Axis> getAxisList() {
    return axisList;
  }

  @Override
  public <T> T accept(CrsNodeVisitor<T> visitor) {
    return visitor.visitGeocentricCs(this);
  }
}
