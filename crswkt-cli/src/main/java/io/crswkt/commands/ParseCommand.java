package io.crswkt.commands;

import java.io.IOException;
import java.io.PrintWriter;

import de.undercouch.underline.InputReader;
import de.undercouch.underline.OptionDesc;
import de.undercouch.underline.OptionParserException;
import io.crswkt.ConfigConstants;
import io.crswkt.model.CoordinateSystem;
import io.crswkt.output.JsonExporter;
import io.vertx.core.Handler;

/**
 * Parse WKT files and print their JSON representation, one document
 * per file
 */
public class ParseCommand extends AbstractWktFileCommand {
  private boolean pretty;

  /**
   * Specify if the JSON output should be indented
   * @param pretty true if the output should be indented
   */
  @OptionDesc(longName = "pretty", shortName = "p",
      description = "pretty-print the JSON output")
  public void setPretty(boolean pretty) {
    this.pretty = pretty;
  }

  @Override
  public String getUsageName() {
    return "parse";
  }

  @Override
  public String getUsageDescription() {
    return "Parse CRS WKT files and print them as JSON";
  }

  @Override
  public void doRun(String[] remainingArgs, InputReader in, PrintWriter out,
      Handler<Integer> handler) throws OptionParserException, IOException {
    if (!pretty) {
      pretty = config().getBoolean(ConfigConstants.PRETTY,
          ConfigConstants.DEFAULT_PRETTY);
    }
    super.doRun(remainingArgs, in, out, handler);
  }

  @Override
  protected void process(String path, CoordinateSystem cs, PrintWriter out) {
    out.println(JsonExporter.exportText(cs, pretty));
  }
}
