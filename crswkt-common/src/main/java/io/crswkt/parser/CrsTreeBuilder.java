package io.crswkt.parser;

import java.util.ArrayList;
import java.util.List;

import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.TerminalNode;

import io.crswkt.model.Authority;
import io.crswkt.model.Axis;
import io.crswkt.model.AxisDirection;
import io.crswkt.model.CompoundCs;
import io.crswkt.model.CoordinateSystem;
import io.crswkt.model.CrsNode;
import io.crswkt.model.GeographicCs;
import io.crswkt.model.LocalDatum;
import io.crswkt.model.Parameter;
import io.crswkt.model.PrimeMeridian;
import io.crswkt.model.Projection;
import io.crswkt.model.Spheroid;
import io.crswkt.model.ToWgs84;
import io.crswkt.model.Unit;
import io.crswkt.model.VerticalDatum;
import io.crswkt.parser.WktParser.AuthorityContext;
import io.crswkt.parser.WktParser.AxisContext;
import io.crswkt.parser.WktParser.CompdCsContext;
import io.crswkt.parser.WktParser.CoordSysContext;
import io.crswkt.parser.WktParser.DatumContext;
import io.crswkt.parser.WktParser.GeocentricCsContext;
import io.crswkt.parser.WktParser.GeographicCsContext;
import io.crswkt.parser.WktParser.HorizCsContext;
import io.crswkt.parser.WktParser.LocalCsContext;
import io.crswkt.parser.WktParser.LocalDatumContext;
import io.crswkt.parser.WktParser.NameContext;
import io.crswkt.parser.WktParser.NodeContext;
import io.crswkt.parser.WktParser.ParameterContext;
import io.crswkt.parser.WktParser.PrimemContext;
import io.crswkt.parser.WktParser.ProjectedCsContext;
import io.crswkt.parser.WktParser.ProjectionContext;
import io.crswkt.parser.WktParser.SingleCsContext;
import io.crswkt.parser.WktParser.SpheroidContext;
import io.crswkt.parser.WktParser.Towgs84Context;
import io.crswkt.parser.WktParser.UnitContext;
import io.crswkt.parser.WktParser.VertCsContext;
import io.crswkt.parser.WktParser.VertDatumContext;
import io.vertx.core.Handler;

/**
 * Reduces a parse tree bottom-up into a tree of {@link CrsNode}s. Children
 * are built before their parents; node lists are handed to the
 * {@link NodeClassifier}. Every node read is reported to the diagnostics
 * handler.
 */
class CrsTreeBuilder extends WktBaseVisitor<CrsNode> {
  private final NodeClassifier classifier;
  private final Handler<String> diagnostics;

  /**
   * Create a builder
   * @param classifier the classifier for generic node lists
   * @param diagnostics a handler receiving a message for every node read
   */
  CrsTreeBuilder(NodeClassifier classifier, Handler<String> diagnostics) {
    this.classifier = classifier;
    this.diagnostics = diagnostics;
  }

  /**
   * Report a node that has been read successfully
   * @param node the node
   * @return the node
   */
  private <T extends CrsNode> T read(T node) {
    diagnostics.handle("Read " + node.getKind() + " node '" +
        node.getName() + "'");
    return node;
  }

  /**
   * Get the unquoted text of a name
   */
  private static String name(NameContext ctx) {
    String text = ctx.getStart().getText();
    return text.substring(1, text.length() - 1);
  }

  private Authority authority(AuthorityContext ctx) {
    if (ctx == null) {
      return null;
    }
    return (Authority)visit(ctx);
  }

  private List<CrsNode> nodes(List<NodeContext> ctxs) {
    List<CrsNode> result = new ArrayList<>(ctxs.size());
    for (NodeContext ctx : ctxs) {
      result.add(visit(ctx));
    }
    return result;
  }

  @Override
  public CrsNode visitCoordSys(CoordSysContext ctx) {
    if (ctx.compdCs() != null) {
      return visit(ctx.compdCs());
    }
    return visit(ctx.singleCs());
  }

  @Override
  public CrsNode visitSingleCs(SingleCsContext ctx) {
    return visit(ctx.getChild(0));
  }

  @Override
  public CrsNode visitHorizCs(HorizCsContext ctx) {
    return visit(ctx.getChild(0));
  }

  @Override
  public CrsNode visitNode(NodeContext ctx) {
    return visit(ctx.getChild(0));
  }

  @Override
  public CrsNode visitCompdCs(CompdCsContext ctx) {
    CoordinateSystem head = (CoordinateSystem)visit(ctx.head);
    CoordinateSystem tail = (CoordinateSystem)visit(ctx.tail);
    return read(new CompoundCs(name(ctx.name()), head, tail,
        authority(ctx.authority())));
  }

  @Override
  public CrsNode visitProjectedCs(ProjectedCsContext ctx) {
    GeographicCs geographicCs = (GeographicCs)visit(ctx.geographicCs());
    return read(classifier.classifyProjectedCs(name(ctx.name()),
        geographicCs, nodes(ctx.node())));
  }

  @Override
  public CrsNode visitGeographicCs(GeographicCsContext ctx) {
    return read(classifier.classifyGeographicCs(name(ctx.name()),
        nodes(ctx.node())));
  }

  @Override
  public CrsNode visitGeocentricCs(GeocentricCsContext ctx) {
    return read(classifier.classifyGeocentricCs(name(ctx.name()),
        nodes(ctx.node())));
  }

  @Override
  public CrsNode visitVertCs(VertCsContext ctx) {
    return read(classifier.classifyVerticalCs(name(ctx.name()),
        nodes(ctx.node())));
  }

  @Override
  public CrsNode visitLocalCs(LocalCsContext ctx) {
    return read(classifier.classifyLocalCs(name(ctx.name()),
        nodes(ctx.node())));
  }

  @Override
  public CrsNode visitDatum(DatumContext ctx) {
    return read(classifier.classifyDatum(name(ctx.name()), nodes(ctx.node())));
  }

  @Override
  public CrsNode visitVertDatum(VertDatumContext ctx) {
    return read(new VerticalDatum(name(ctx.name()),
        WktNumbers.parseInt(ctx.datumType), authority(ctx.authority())));
  }

  @Override
  public CrsNode visitLocalDatum(LocalDatumContext ctx) {
    return read(new LocalDatum(name(ctx.name()),
        WktNumbers.parseInt(ctx.datumType), authority(ctx.authority())));
  }

  @Override
  public CrsNode visitSpheroid(SpheroidContext ctx) {
    return read(new Spheroid(name(ctx.name()),
        WktNumbers.parseFloat(ctx.semiMajorAxis),
        WktNumbers.parseFloat(ctx.inverseFlattening),
        authority(ctx.authority())));
  }

  @Override
  public CrsNode visitPrimem(PrimemContext ctx) {
    return read(new PrimeMeridian(name(ctx.name()),
        WktNumbers.parseFloat(ctx.longitude), authority(ctx.authority())));
  }

  @Override
  public CrsNode visitUnit(UnitContext ctx) {
    return read(new Unit(name(ctx.name()),
        WktNumbers.parseFloat(ctx.conversionFactor),
        authority(ctx.authority())));
  }

  @Override
  public CrsNode visitAxis(AxisContext ctx) {
    AxisDirection direction = AxisDirection.valueOf(
        ctx.AXIS_DIRECTION().getText());
    return read(new Axis(name(ctx.name()), direction));
  }

  @Override
  public CrsNode visitParameter(ParameterContext ctx) {
    return read(new Parameter(name(ctx.name()),
        WktNumbers.parseIntElseFloat(ctx.value)));
  }

  @Override
  public CrsNode visitProjection(ProjectionContext ctx) {
    return read(new Projection(name(ctx.name()), authority(ctx.authority())));
  }

  @Override
  public CrsNode visitTowgs84(Towgs84Context ctx) {
    List<TerminalNode> numbers = ctx.NUMBER();
    double[] params = new double[numbers.size()];
    for (int i = 0; i < params.length; ++i) {
      params[i] = WktNumbers.parseFloat(numbers.get(i).getSymbol());
    }
    return read(new ToWgs84(params));
  }

  @Override
  public CrsNode visitAuthority(AuthorityContext ctx) {
    Token code = ctx.CODE().getSymbol();
    String codeText = code.getText().substring(1, code.getText().length() - 1);
    Authority authority = new Authority(name(ctx.name()), codeText);
    diagnostics.handle("Read AUTHORITY node '" + authority.getName() +
        "', code '" + codeText + "'");
    return authority;
  }
}
