package io.crswkt.model;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * A vertical coordinate system (VERT_CS)
 */
public class VerticalCs extends CoordinateSystem {
  private final VerticalDatum vertDatum;
  private final Unit linearUnit;
  private final List<Axis> axisList;

  public VerticalCs(String name, VerticalDatum vertDatum, Unit linearUnit,
      List<Axis> axisList, Authority authority) {
    super(NodeKind.VERT_CS, name, authority);
    this.vertDatum = vertDatum;
    this.linearUnit = linearUnit;
    this.axisList = axisList == null ? ImmutableList.of() : ImmutableList.copyOf(axisList);
  }

  public VerticalDatum getVertDatum() {
    return vertDatum;
  }

  public Unit getLinearUnit() {
    return linearUnit;
  }

  /**
   * @return an unmodifiable list of the axes, 0 or 1 (never null)
   */
  public List<Axis> getAxisList() {
    return axisList;
  }

  @Override
  public <T> T accept(CrsNodeVisitor<T> visitor) {
    return visitor.visitVerticalCs(this);
  }
}
