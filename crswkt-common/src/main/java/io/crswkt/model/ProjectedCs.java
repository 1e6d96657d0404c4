package io.crswkt.model;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * A projected coordinate system (PROJCS) based on a {@link GeographicCs}
 */
public class ProjectedCs extends CoordinateSystem {
  private final GeographicCs geographicCs;
  private final Projection projection;
  private final List<Parameter> paramList;
  private final Unit linearUnit;
  private final List<Axis> axisList;

  /**
   * Constructs the node
   * @param name the coordinate system's name
   * @param geographicCs the underlying geographic coordinate system
   * @param projection the map projection (may be null)
   * @param paramList the projection parameters (may be null if there are none)
   * @param linearUnit the linear unit (may be null)
   * @param axisList the axes (0 or 2, may be null if there are none)
   * @param authority the authority (may be null)
   */
  public ProjectedCs(String name, GeographicCs geographicCs,
      Projection projection, List<Parameter> paramList, Unit linearUnit,
      List<Axis> axisList, Authority authority) {
    super(NodeKind.PROJCS, name, authority);
    this.geographicCs = geographicCs;
    this.projection = projection;
    this.paramList = paramList == null ? ImmutableList.of() : ImmutableList.copyOf(paramList);
    this.linearUnit = linearUnit;
    this.axisList = axisList == null ? ImmutableList.of() : ImmutableList.copyOf(axisList);
  }

  public GeographicCs getGeographicCs() {
    return geographicCs;
  }

  public Projection getProjection() {
    return projection;
  }

  /**
   * @return an unmodifiable list of the projection parameters in the
   * order they were defined (never null)
   */
  public List<Parameter> getParamList() {
    return paramList;
  }

  public Unit getLinearUnit() {
    return linearUnit;
  }

  /**
   * @return an unmodifiable list of the axes (never null)
   */
  public List<Axis> getAxisList() {
    return axisList;
  }

  @Override
  public <T> T accept(CrsNodeVisitor<T> visitor) {
    return visitor.visitProjectedCs(this);
  }
}
