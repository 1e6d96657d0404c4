package io.crswkt.model;

/**
 * A UNIT node. Depending on where it appears it is an angular unit
 * (conversion factor to radians) or a linear unit (conversion factor
 * to metres).
 */
public class Unit extends IdentifiableNode {
  private final double conversionFactor;

  public Unit(String name, double conversionFactor, Authority authority) {
    super(NodeKind.UNIT, name, authority);
    this.conversionFactor = conversionFactor;
  }

  /**
   * @return the factor converting values in this unit to the base unit
   */
  public double getConversionFactor() {
    return conversionFactor;
  }

  @Override
  public <T> T accept(CrsNodeVisitor<T> visitor) {
    return visitor.visitUnit(this);
  }
}
