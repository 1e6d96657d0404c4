package io.crswkt.model;

/**
 * An AUTHORITY node referring to a definition in an external registry
 * such as EPSG
 */
public class Authority extends CrsNode {
  private final String code;

  /**
   * Constructs the node
   * @param name the name of the organization (e.g. "EPSG")
   * @param code the code of the definition in the organization's registry
   */
  public Authority(String name, String code) {
    super(NodeKind.AUTHORITY, name);
    this.code = code;
  }

  /**
   * @return the code of the definition (digits only)
   */
  public String getCode() {
    return code;
  }

  @Override
  public <T> T accept(CrsNodeVisitor<T> visitor) {
    return visitor.visitAuthority(this);
  }

  @Override
  public String toString() {
    return getName() + ":" + code;
  }
}
