package io.crswkt.commands;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.junit.Before;
import org.junit.Rule;
import org.junit.rules.TemporaryFolder;

import de.undercouch.underline.InputReader;
import de.undercouch.underline.StandardInputReader;
import io.vertx.core.json.JsonObject;

/**
 * Base class for unit tests that test commands
 * @param <T> the type of the command under test
 */
public abstract class CommandTestBase<T extends AbstractCrsWktCommand> {
  protected static final String GEOGCS = "GEOGCS[\"OSGB 1936\", " +
      "DATUM[\"OSGB 1936\", SPHEROID[\"Airy 1830\",6377563.396,299.3249646, " +
      "AUTHORITY[\"EPSG\",\"7001\"]], AUTHORITY[\"EPSG\",\"6277\"]], " +
      "PRIMEM[\"Greenwich\",0], UNIT[\"degree\",0.0174532925199433], " +
      "AUTHORITY[\"EPSG\",\"4277\"]]";

  /**
   * A folder for the files to parse
   */
  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  /**
   * The command under test
   */
  protected T cmd;

  protected InputReader in = new StandardInputReader();
  protected StringWriter writer;
  protected PrintWriter out;

  /**
   * The exit code passed to the end handler or null if it has not
   * been called yet
   */
  protected Integer exitCode;

  /**
   * Create a new instance of the command under test
   * @return the command under test
   */
  protected abstract T createCommand();

  /**
   * Set up test
   * @throws Exception if something goes wrong
   */
  @Before
  public void setUp() throws Exception {
    cmd = createCommand();
    cmd.setConfig(new JsonObject());
    cmd.setEndHandler(code -> exitCode = code);

    writer = new StringWriter();
    out = new PrintWriter(writer);
  }

  /**
   * Write a file into the temporary folder
   * @param name the file's name
   * @param contents the file's contents
   * @return the file's absolute path
   * @throws IOException if the file could not be written
   */
  protected String writeFile(String name, String contents) throws IOException {
    File f = folder.newFile(name);
    FileUtils.writeStringToFile(f, contents, StandardCharsets.UTF_8);
    return f.getAbsolutePath();
  }
}
