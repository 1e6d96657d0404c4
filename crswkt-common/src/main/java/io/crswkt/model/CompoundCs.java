package io.crswkt.model;

/**
 * A compound coordinate system (COMPD_CS) combining two single coordinate
 * systems, typically a horizontal and a vertical one
 */
public class CompoundCs extends CoordinateSystem {
  private final CoordinateSystem headCs;
  private final CoordinateSystem tailCs;

  /**
   * Constructs the node
   * @param name the coordinate system's name
   * @param headCs the first coordinate system
   * @param tailCs the second coordinate system
   * @param authority the authority (may be null)
   */
  public CompoundCs(String name, CoordinateSystem headCs,
      CoordinateSystem tailCs, Authority authority) {
    super(NodeKind.COMPD_CS, name, authority);
    this.headCs = headCs;
    this.tailCs = tailCs;
  }

  public CoordinateSystem getHeadCs() {
    return headCs;
  }

  public CoordinateSystem getTailCs() {
    return tailCs;
  }

  @Override
  public <T> T accept(CrsNodeVisitor<T> visitor) {
    return visitor.visitCompoundCs(this);
  }
}
