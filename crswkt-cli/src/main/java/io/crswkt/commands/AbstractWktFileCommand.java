package io.crswkt.commands;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.apache.commons.io.FileUtils;

import de.undercouch.underline.InputReader;
import de.undercouch.underline.OptionDesc;
import de.undercouch.underline.OptionParserException;
import de.undercouch.underline.UnknownAttributes;
import io.crswkt.model.CoordinateSystem;
import io.crswkt.parser.CrsWktParser;
import io.crswkt.parser.WktException;
import io.vertx.core.Handler;
import io.vertx.core.logging.Logger;
import io.vertx.core.logging.LoggerFactory;

/**
 * Abstract base class for commands that parse one or more WKT files.
 * Files that cannot be read or parsed are reported and skipped. The exit
 * code is 1 if at least one file failed.
 */
public abstract class AbstractWktFileCommand extends AbstractCrsWktCommand {
  private static Logger log = LoggerFactory.getLogger(AbstractWktFileCommand.class);

  protected List<String> files;
  protected boolean lax;

  /**
   * Set the files to parse
   * @param files the files
   */
  @UnknownAttributes("FILE")
  public void setFiles(List<String> files) {
    this.files = files;
  }

  /**
   * Specify if comments starting with '#' should be accepted
   * @param lax true if comments should be accepted
   */
  @OptionDesc(longName = "lax", shortName = "l",
      description = "accept comments starting with '#'")
  public void setLax(boolean lax) {
    this.lax = lax;
  }

  @Override
  public boolean checkArguments() {
    if (files == null || files.isEmpty()) {
      error("no file given. provide at least one file to parse.");
      return false;
    }
    return super.checkArguments();
  }

  /**
   * Process a file that has been parsed successfully
   * @param path the file's path as given on the command line
   * @param cs the coordinate system defined in the file
   * @param out the writer to write the results to
   */
  protected abstract void process(String path, CoordinateSystem cs,
      PrintWriter out);

  @Override
  public void doRun(String[] remainingArgs, InputReader in, PrintWriter out,
      Handler<Integer> handler) throws OptionParserException, IOException {
    CrsWktParser parser = createParser(lax);
    int exitCode = 0;
    for (String path : files) {
      String wkt;
      try {
        wkt = FileUtils.readFileToString(new File(path), StandardCharsets.UTF_8);
      } catch (IOException e) {
        error("could not read file " + path + ": " + e.getMessage());
        exitCode = 1;
        continue;
      }

      CoordinateSystem cs;
      try {
        cs = parser.parse(wkt);
      } catch (WktException e) {
        error(path + ": " + e.getMessage());
        exitCode = 1;
        continue;
      } catch (RuntimeException e) {
        error(path + ": " + e.getMessage());
        log.error("Could not parse file " + path, e);
        exitCode = 1;
        continue;
      }

      process(path, cs, out);
    }
    out.flush();
    handler.handle(exitCode);
  }
}
