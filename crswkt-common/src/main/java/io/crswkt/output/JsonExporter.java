package io.crswkt.output;

import java.util.List;

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
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

/**
 * Converts a tree of {@link CrsNode}s to nested JSON objects. Every node
 * becomes an object with a single key (the node's kind) mapping to an
 * object of the node's fields. Fields holding other nodes contain the
 * nested node's object, list fields contain an array of such objects.
 * Fields that are not set are omitted.
 */
public class JsonExporter implements CrsNodeVisitor<JsonObject> {
  private static final JsonExporter INSTANCE = new JsonExporter();

  /**
   * Convert a node and all its descendants to JSON
   * @param node the node
   * @return the JSON object
   */
  public static JsonObject export(CrsNode node) {
    return node.accept(INSTANCE);
  }

  /**
   * Convert a node and all its descendants to a compact JSON string
   * @param node the node
   * @return the JSON string
   */
  public static String exportText(CrsNode node) {
    return exportText(node, false);
  }

  /**
   * Convert a node and all its descendants to a JSON string
   * @param node the node
   * @param pretty true if the string should be indented
   * @return the JSON string
   */
  public static String exportText(CrsNode node, boolean pretty) {
    JsonObject obj = export(node);
    return pretty ? obj.encodePrettily() : obj.encode();
  }

  /**
   * Create the fields object of a node and put its name into it
   */
  private static JsonObject fields(CrsNode node) {
    return new JsonObject().put("name", node.getName());
  }

  /**
   * Put a nested node into a fields object unless it is null
   */
  private void putNode(JsonObject fields, String key, CrsNode node) {
    if (node != null) {
      fields.put(key, node.accept(this));
    }
  }

  private void putList(JsonObject fields, String key,
      List<? extends CrsNode> nodes) {
    JsonArray arr = new JsonArray();
    for (CrsNode n : nodes) {
      arr.add(n.accept(this));
    }
    fields.put(key, arr);
  }

  /**
   * Add the node's authority (if any) and wrap the fields into an object
   * keyed by the node's kind
   */
  private JsonObject wrap(IdentifiableNode node, JsonObject fields) {
    putNode(fields, "authority", node.getAuthority());
    return new JsonObject().put(node.getKind().name(), fields);
  }

  @Override
  public JsonObject visitGeographicCs(GeographicCs node) {
    JsonObject fields = fields(node);
    putNode(fields, "datum", node.getDatum());
    putNode(fields, "prime_meridian", node.getPrimeMeridian());
    putNode(fields, "angular_unit", node.getAngularUnit());
    putList(fields, "axis_list", node.getAxisList());
    return wrap(node, fields);
  }

  @Override
  public JsonObject visitProjectedCs(ProjectedCs node) {
    JsonObject fields = fields(node);
    putNode(fields, "geographic_cs", node.getGeographicCs());
    putNode(fields, "projection", node.getProjection());
    putList(fields, "param_list", node.getParamList());
    putNode(fields, "linear_unit", node.getLinearUnit());
    putList(fields, "axis_list", node.getAxisList());
    return wrap(node, fields);
  }

  @Override
  public JsonObject visitGeocentricCs(GeocentricCs node) {
    JsonObject fields = fields(node);
    putNode(fields, "datum", node.getDatum());
    putNode(fields, "prime_meridian", node.getPrimeMeridian());
    putNode(fields, "linear_unit", node.getLinearUnit());
    putList(fields, "axis_list", node.getAxisList());
    return wrap(node, fields);
  }

  @Override
  public JsonObject visitVerticalCs(VerticalCs node) {
    JsonObject fields = fields(node);
    putNode(fields, "vert_datum", node.getVertDatum());
    putNode(fields, "linear_unit", node.getLinearUnit());
    putList(fields, "axis_list", node.getAxisList());
    return wrap(node, fields);
  }

  @Override
  public JsonObject visitLocalCs(LocalCs node) {
    JsonObject fields = fields(node);
    putNode(fields, "local_datum", node.getLocalDatum());
    putNode(fields, "unit", node.getUnit());
    putList(fields, "axis_list", node.getAxisList());
    return wrap(node, fields);
  }

  @Override
  public JsonObject visitCompoundCs(CompoundCs node) {
    JsonObject fields = fields(node);
    putNode(fields, "head_cs", node.getHeadCs());
    putNode(fields, "tail_cs", node.getTailCs());
    return wrap(node, fields);
  }

  @Override
  public JsonObject visitDatum(Datum node) {
    JsonObject fields = fields(node);
    putNode(fields, "spheroid", node.getSpheroid());
    putNode(fields, "towgs84", node.getTowgs84());
    return wrap(node, fields);
  }

  @Override
  public JsonObject visitVerticalDatum(VerticalDatum node) {
    return wrap(node, fields(node).put("datum_type", node.getDatumType()));
  }

  @Override
  public JsonObject visitLocalDatum(LocalDatum node) {
    return wrap(node, fields(node).put("datum_type", node.getDatumType()));
  }

  @Override
  public JsonObject visitSpheroid(Spheroid node) {
    return wrap(node, fields(node)
        .put("semi_major_axis", node.getSemiMajorAxis())
        .put("inverse_flattening", node.getInverseFlattening()));
  }

  @Override
  public JsonObject visitPrimeMeridian(PrimeMeridian node) {
    return wrap(node, fields(node).put("longitude", node.getLongitude()));
  }

  @Override
  public JsonObject visitUnit(Unit node) {
    return wrap(node, fields(node)
        .put("conversion_factor", node.getConversionFactor()));
  }

  @Override
  public JsonObject visitAxis(Axis node) {
    return wrap(node, fields(node).put("direction", node.getDirection().name()));
  }

  @Override
  public JsonObject visitParameter(Parameter node) {
    return wrap(node, fields(node).put("value", node.getValue()));
  }

  @Override
  public JsonObject visitProjection(Projection node) {
    return wrap(node, fields(node));
  }

  @Override
  public JsonObject visitToWgs84(ToWgs84 node) {
    return wrap(node, fields(node)
        .put("dx", node.getDx())
        .put("dy", node.getDy())
        .put("dz", node.getDz())
        .put("ex", node.getEx())
        .put("ey", node.getEy())
        .put("ez", node.getEz())
        .put("ppm", node.getPpm()));
  }

  @Override
  public JsonObject visitAuthority(Authority node) {
    JsonObject fields = fields(node).put("code", node.getCode());
    return new JsonObject().put(node.getKind().name(), fields);
  }
}
