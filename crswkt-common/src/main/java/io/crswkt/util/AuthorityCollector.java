package io.crswkt.util;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.crswkt.model.Authority;
import io.crswkt.model.Axis;
import io.crswkt.model.CompoundCs;
import io.crswkt.model.CrsNode;
import io.crswkt.model.CrsNodeVisitor;
import io.crswkt.model.Datum;
import io.crswkt.model.GeocentricCs;
import io.crswkt.model.GeographicCs;
import io.crswkt.model.IdentifiableNode;
import io.crswkt.model.LocalCs;
import io.crswkt.model.LocalDatum;
import io.crswkt.model.Parameter;
import io.crswkt.model.PrimeMeridian;
import io.crswkt.model.ProjectedCs;
import io.crswkt.model.Projection;
import io.crswkt.model.Spheroid;
import io.crswkt.model.ToWgs84;
import io.crswkt.model.Unit;
import io.crswkt.model.VerticalCs;
import io.crswkt.model.VerticalDatum;

/**
 * Collects all authorities in a tree so they can be cross-referenced with
 * a CRS registry such as EPSG. Each authority is keyed by the path of the
 * node it identifies, e.g. <code>PROJCS/geographic_cs/datum</code>. List
 * entries are addressed by index, e.g. <code>PROJCS/axis_list[1]</code>.
 */
public class AuthorityCollector implements CrsNodeVisitor<Void> {
  private final Map<String, Authority> result = new LinkedHashMap<>();
  private final Deque<String> path = new ArrayDeque<>();

  private AuthorityCollector() {
    // use #collect(CrsNode)
  }

  /**
   * Collect all authorities in the given tree
   * @param root the root of the tree
   * @return an ordered map of node paths and authorities (depth-first,
   * children before their parents)
   */
  public static Map<String, Authority> collect(CrsNode root) {
    AuthorityCollector collector = new AuthorityCollector();
    collector.path.addLast(root.getKind().name());
    root.accept(collector);
    return collector.result;
  }

  private String currentPath() {
    return String.join("/", path);
  }

  /**
   * Record the node's own authority
   */
  private void self(IdentifiableNode node) {
    if (node.getAuthority() != null) {
      result.put(currentPath(), node.getAuthority());
    }
  }

  private void child(String field, CrsNode node) {
    if (node == null) {
      return;
    }
    path.addLast(field);
    node.accept(this);
    path.removeLast();
  }

  private void children(String field, List<? extends CrsNode> nodes) {
    for (int i = 0; i < nodes.size(); ++i) {
      child(field + "[" + i + "]", nodes.get(i));
    }
  }

  @Override
  public Void visitGeographicCs(GeographicCs node) {
    child("datum", node.getDatum());
    child("prime_meridian", node.getPrimeMeridian());
    child("angular_unit", node.getAngularUnit());
    children("axis_list", node.getAxisList());
    self(node);
    return null;
  }

  @Override
  public Void visitProjectedCs(ProjectedCs node) {
    child("geographic_cs", node.getGeographicCs());
    child("projection", node.getProjection());
    children("param_list", node.getParamList());
    child("linear_unit", node.getLinearUnit());
    children("axis_list", node.getAxisList());
    self(node);
    return null;
  }

  @Override
  public Void visitGeocentricCs(GeocentricCs node) {
    child("datum", node.getDatum());
    child("prime_meridian", node.getPrimeMeridian());
    child("linear_unit", node.getLinearUnit());
    children("axis_list", node.getAxisList());
    self(node);
    return null;
  }

  @Override
  public Void visitVerticalCs(VerticalCs node) {
    child("vert_datum", node.getVertDatum());
    child("linear_unit", node.getLinearUnit());
    children("axis_list", node.getAxisList());
    self(node);
    return null;
  }

  @Override
  public Void visitLocalCs(LocalCs node) {
    child("local_datum", node.getLocalDatum());
    child("unit", node.getUnit());
    children("axis_list", node.getAxisList());
    self(node);
    return null;
  }

  @Override
  public Void visitCompoundCs(CompoundCs node) {
    child("head_cs", node.getHeadCs());
    child("tail_cs", node.getTailCs());
    self(node);
    return null;
  }

  @Override
  public Void visitDatum(Datum node) {
    child("spheroid", node.getSpheroid());
    child("towgs84", node.getTowgs84());
    self(node);
    return null;
  }

  @Override
  public Void visitVerticalDatum(VerticalDatum node) {
    self(node);
    return null;
  }

  @Override
  public Void visitLocalDatum(LocalDatum node) {
    self(node);
    return null;
  }

  @Override
  public Void visitSpheroid(Spheroid node) {
    self(node);
    return null;
  }

  @Override
  public Void visitPrimeMeridian(PrimeMeridian node) {
    self(node);
    return null;
  }

  @Override
  public Void visitUnit(Unit node) {
    self(node);
    return null;
  }

  @Override
  public Void visitAxis(Axis node) {
    self(node);
    return null;
  }

  @Override
  public Void visitParameter(Parameter node) {
    self(node);
    return null;
  }

  @Override
  public Void visitProjection(Projection node) {
    self(node);
    return null;
  }

  @Override
  public Void visitToWgs84(ToWgs84 node) {
    self(node);
    return null;
  }

  @Override
  public Void visitAuthority(Authority node) {
    // authorities are recorded by the nodes they identify
    return null;
  }
}
