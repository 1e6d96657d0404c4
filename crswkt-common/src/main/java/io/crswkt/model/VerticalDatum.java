package io.crswkt.model;

/**
 * A VERT_DATUM node
 */
public class VerticalDatum extends IdentifiableNode {
  private final int datumType;

  public VerticalDatum(String name, int datumType, Authority authority) {
    super(NodeKind.VERT_DATUM, name, authority);
    this.datumType = datumType;
  }

  public int getDatumType() {
    return datumType;
  }

  @Override
  public <T> T accept(CrsNodeVisitor<T> visitor) {
    return visitor.visitVerticalDatum(this);
  }
}
