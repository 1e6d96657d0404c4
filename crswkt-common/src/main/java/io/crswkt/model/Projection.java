package io.crswkt.model;

/**
 * A PROJECTION node naming the map projection of a {@link ProjectedCs}
 */
public class Projection extends IdentifiableNode {
  public Projection(String name, Authority authority) {
    super(NodeKind.PROJECTION, name, authority);
  }

  @Override
  public <T> T accept(CrsNodeVisitor<T> visitor) {
    return visitor.visitProjection(this);
  }
}
