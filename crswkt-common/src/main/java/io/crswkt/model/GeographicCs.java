package io.crswkt.model;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * A geographic coordinate system (GEOGCS)
 */
public class GeographicCs extends CoordinateSystem {
  private final Datum datum;
  private final PrimeMeridian primeMeridian;
  private final Unit angularUnit;
  private final List<Axis> axisList;

  /**
   * Constructs the node
   * @param name the coordinate system's name
   * @param datum the datum (may be null)
   * @param primeMeridian the prime meridian (may be null)
   * @param angularUnit the angular unit (may be null)
   * @param axisList the axes (0 or 2, may be null if there are none)
   * @param authority the authority (may be null)
   */
  public GeographicCs(String name, Datum datum, PrimeMeridian primeMeridian,
      Unit angularUnit, List<Axis> axisList, Authority authority) {
    super(NodeKind.GEOGCS, name, authority);
    this.datum = datum;
    this.primeMeridian = primeMeridian;
    this.angularUnit = angularUnit;
    this.axisList = axisList == null ? ImmutableList.of() : ImmutableList.copyOf(axisList);
  }

  public Datum getDatum() {
    return datum;
  }

  public PrimeMeridian getPrimeMeridian() {
    return primeMeridian;
  }

  public Unit getAngularUnit() {
    return angularUnit;
  }

  /**
   * @return an unmodifiable list of the axes (never null)
   */
  public List<Axis> getAxisList() {
    return axisList;
  }

  @Override
  public <T> T accept(CrsNodeVisitor<T> visitor) {
    return visitor.visitGeographicCs(this);
  }
}
