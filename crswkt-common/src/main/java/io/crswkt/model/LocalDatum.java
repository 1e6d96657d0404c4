package io.crswkt.model;

/**
 * A LOCAL_DATUM node
 */
public class LocalDatum extends IdentifiableNode {
  private final int datumType;

  public LocalDatum(String name, int datumType, Authority authority) {
    super(NodeKind.LOCAL_DATUM, name, authority);
    this.datumType = datumType;
  }

  public int getDatumType() {
    return datumType;
  }

  @Override
  public <T> T accept(CrsNodeVisitor<T> visitor) {
    return visitor.visitLocalDatum(this);
  }
}
