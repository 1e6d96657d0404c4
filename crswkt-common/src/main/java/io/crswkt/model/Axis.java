package io.crswkt.model;

/**
 * An AXIS node
 */
public class Axis extends IdentifiableNode {
  private final AxisDirection direction;

  public Axis(String name, AxisDirection direction) {
    super(NodeKind.AXIS, name, null);
    this.direction = direction;
  }

  public AxisDirection getDirection() {
    return direction;
  }

  @Override
  public <T> T accept(CrsNodeVisitor<T> visitor) {
    return visitor.visitAxis(this);
  }
}
