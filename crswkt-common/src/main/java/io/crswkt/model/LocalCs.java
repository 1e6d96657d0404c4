package io.crswkt.model;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * A local (engineering) coordinate system (LOCAL_CS)
 */
public class LocalCs extends CoordinateSystem {
  private final LocalDatum localDatum;
  private final Unit unit;
  private final List<Axis> axisList;

  public LocalCs(String name, LocalDatum localDatum, Unit unit,
      List<Axis> axisList, Authority authority) {
    super(NodeKind.LOCAL_CS, name, authority);
    this.localDatum = localDatum;
    this.unit = unit;
    this.axisList = axisList == null ? ImmutableList.of() : ImmutableList.copyOf(axisList);
  }

  public LocalDatum getLocalDatum() {
    return localDatum;
  }

  public Unit getUnit() {
    return unit;
  }

  /**
   * @return an unmodifiable list of the axes, 1 or 2 (never null)
   */
  public List<Axis> getAxisList() {
    return axisList;
  }

  @Override
  public <T> T accept(CrsNodeVisitor<T> visitor) {
    return visitor.visitLocalCs(this);
  }
}
