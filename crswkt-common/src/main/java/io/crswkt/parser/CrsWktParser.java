package io.crswkt.parser;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;

import com.google.common.base.Preconditions;

import io.crswkt.ConfigConstants;
import io.crswkt.model.CoordinateSystem;
import io.crswkt.parser.WktParser.CoordSysContext;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import io.vertx.core.logging.Logger;
import io.vertx.core.logging.LoggerFactory;

/**
 * Parses coordinate reference system definitions in OGC Well-Known Text
 * (version 1) into a tree of immutable nodes.
 *
 * <p>In strict mode (the default) the input must not contain anything but
 * WKT. In lax mode, stand-alone and inline comments starting with
 * <code>#</code> are skipped.</p>
 *
 * <p>Instances only hold immutable options and may be shared. Every call
 * to {@link #parse(String)} uses its own lexer and parser.</p>
 */
public class CrsWktParser {
  private static final Logger log = LoggerFactory.getLogger(CrsWktParser.class);

  private final boolean strict;
  private final int maxDepth;
  private final Handler<String> diagnostics;

  /**
   * Create a strict parser reporting diagnostics to the log
   */
  public CrsWktParser() {
    this(ConfigConstants.DEFAULT_STRICT);
  }

  /**
   * Create a parser reporting diagnostics to the log
   * @param strict false if comments should be accepted
   */
  public CrsWktParser(boolean strict) {
    this(strict, null);
  }

  /**
   * Create a parser
   * @param strict false if comments should be accepted
   * @param diagnostics a handler receiving a trace message for every node
   * read (may be null if messages should be logged at debug level)
   */
  public CrsWktParser(boolean strict, Handler<String> diagnostics) {
    this(new JsonObject().put(ConfigConstants.STRICT, strict), diagnostics);
  }

  /**
   * Create a parser from a configuration object
   * @param config the configuration (see {@link ConfigConstants#STRICT}
   * and {@link ConfigConstants#MAX_DEPTH})
   * @param diagnostics a handler receiving a trace message for every node
   * read (may be null if messages should be logged at debug level)
   */
  public CrsWktParser(JsonObject config, Handler<String> diagnostics) {
    this.strict = config.getBoolean(ConfigConstants.STRICT,
        ConfigConstants.DEFAULT_STRICT);
    this.maxDepth = config.getInteger(ConfigConstants.MAX_DEPTH,
        ConfigConstants.DEFAULT_MAX_DEPTH);
    Preconditions.checkArgument(maxDepth > 0,
        "Maximum nesting depth must be positive: %s", maxDepth);
    if (diagnostics == null) {
      this.diagnostics = msg -> {
        if (log.isDebugEnabled()) {
          log.debug(msg);
        }
      };
    } else {
      this.diagnostics = diagnostics;
    }
  }

  /**
   * @return true if the parser rejects comments
   */
  public boolean isStrict() {
    return strict;
  }

  /**
   * @return the maximum number of nested brackets the parser accepts
   */
  public int getMaxDepth() {
    return maxDepth;
  }

  /**
   * Parse a CRS WKT string
   * @param wkt the string to parse
   * @return the coordinate system defined by the string
   * @throws WktSyntaxException if the string contains illegal characters,
   * does not match the grammar or ends prematurely
   * @throws WktContentException if the string is syntactically valid but
   * contains invalid child nodes or a wrong number of axes
   */
  public CoordinateSystem parse(String wkt) {
    Preconditions.checkNotNull(wkt, "WKT string must not be null");

    WktTokenizer lexer = new WktTokenizer(CharStreams.fromString(wkt),
        !strict, maxDepth);
    CommonTokenStream tokens = new CommonTokenStream(lexer);
    WktParser parser = new WktParser(tokens);
    parser.removeErrorListeners();
    parser.addErrorListener(WktErrorListener.INSTANCE);
    CoordSysContext ctx = parser.coordSys();

    CrsTreeBuilder builder = new CrsTreeBuilder(new NodeClassifier(),
        diagnostics);
    return (CoordinateSystem)builder.visit(ctx);
  }
}
