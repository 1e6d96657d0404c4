package io.crswkt;

import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.net.URL;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;

import de.undercouch.underline.CommandDesc;
import de.undercouch.underline.CommandDescList;
import de.undercouch.underline.InputReader;
import de.undercouch.underline.Option.ArgumentType;
import de.undercouch.underline.OptionDesc;
import de.undercouch.underline.OptionParserException;
import de.undercouch.underline.StandardInputReader;
import io.crswkt.commands.AbstractCrsWktCommand;
import io.crswkt.commands.AuthorityCommand;
import io.crswkt.commands.HelpCommand;
import io.crswkt.commands.ParseCommand;
import io.vertx.core.Handler;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;

/**
 * Command-line interface for the CRS WKT parser
 */
public class CrsWktCli extends AbstractCrsWktCommand {
  /**
   * The CLI's home directory (may be null)
   */
  protected File crsWktHome;

  private boolean displayVersion;
  private String confFilePath;
  private AbstractCrsWktCommand command;

  /**
   * Load the configuration file given on the command line or, if there
   * is none, the default configuration file in the home directory if it
   * exists
   * @return the configuration (empty if there is no configuration file)
   * @throws IOException if the configuration file could not be read
   * @throws DecodeException if the configuration file is not valid JSON
   */
  private JsonObject loadConfig() throws IOException {
    File confFile = null;
    if (confFilePath != null) {
      confFile = new File(confFilePath);
    } else if (crsWktHome != null) {
      File confDir = new File(crsWktHome, "conf");
      File defaultConfFile = new File(confDir, "crswkt.json");
      if (defaultConfFile.exists()) {
        confFile = defaultConfFile;
      }
    }

    if (confFile == null) {
      return new JsonObject();
    }

    String confFileStr = FileUtils.readFileToString(confFile, StandardCharsets.UTF_8);
    return new JsonObject(confFileStr);
  }

  /**
   * Set the path to the application's configuration file
   * @param path the path
   */
  @OptionDesc(longName = "conf", shortName = "c",
      description = "path to the application's configuration file",
      argumentName = "PATH", argumentType = ArgumentType.STRING)
  public void setConfFilePath(String path) {
    this.confFilePath = path;
  }

  /**
   * Specify if version information should be displayed
   * @param display true if the version should be displayed
   */
  @OptionDesc(longName = "version", shortName = "V",
      description = "output version information and exit",
      priority = 9999)
  public void setDisplayVersion(boolean display) {
    this.displayVersion = display;
  }

  /**
   * Set the command to execute
   * @param command the command
   */
  @CommandDescList({
    @CommandDesc(longName = "parse",
        description = "parse CRS WKT files and print them as JSON",
        command = ParseCommand.class),
    @CommandDesc(longName = "authority",
        description = "list the authority references in CRS WKT files",
        command = AuthorityCommand.class),
    @CommandDesc(longName = "help",
        description = "display help for a given command",
        command = HelpCommand.class)
  })
  public void setCommand(AbstractCrsWktCommand command) {
    this.command = command;
  }

  /**
   * Run the command-line interface
   * @param args the command line arguments
   * @throws IOException if a stream could not be read
   */
  public static void main(String[] args) throws IOException {
    CrsWktCli cli = new CrsWktCli();
    cli.setup();
    try {
      PrintWriter out = new PrintWriter(new OutputStreamWriter(
          System.out, StandardCharsets.UTF_8));
      cli.setEndHandler(exitCode -> {
        out.flush();
        System.exit(exitCode);
      });
      cli.run(args, new StandardInputReader(), out);
    } catch (OptionParserException e) {
      cli.error(e.getMessage());
      System.exit(1);
    }
  }

  /**
   * Setup the CLI's home directory from the environment variable
   * <code>CRSWKT_HOME</code>
   */
  public void setup() {
    String crsWktHomeStr = System.getenv("CRSWKT_HOME");
    if (crsWktHomeStr == null) {
      return;
    }

    try {
      crsWktHome = new File(crsWktHomeStr).getCanonicalFile();
    } catch (IOException e) {
      error("invalid CRSWKT_HOME: " + crsWktHomeStr);
      System.exit(1);
    }
  }

  @Override
  public String getUsageName() {
    return ""; // the tool's name will be prepended
  }

  @Override
  public String getUsageDescription() {
    return "Command-line interface for the CRS WKT parser";
  }

  @Override
  public void doRun(String[] remainingArgs, InputReader in, PrintWriter out,
      Handler<Integer> handler) throws OptionParserException, IOException {
    if (displayVersion) {
      version(out);
      handler.handle(0);
      return;
    }

    // if there are no commands print usage and exit
    if (command == null) {
      usage(out);
      handler.handle(0);
      return;
    }

    JsonObject config;
    try {
      config = loadConfig();
    } catch (IOException e) {
      error("could not read config file: " + e.getMessage());
      handler.handle(1);
      return;
    } catch (DecodeException e) {
      error("invalid config file: " + e.getMessage());
      handler.handle(1);
      return;
    }

    command.setConfig(config);
    command.setEndHandler(handler);
    command.run(remainingArgs, in, out);
  }

  /**
   * Prints out version information
   * @param out the writer to print to
   */
  private void version(PrintWriter out) {
    out.println("crswkt " + getVersion());
    out.flush();
  }

  /**
   * @return the tool's version string
   */
  public static String getVersion() {
    URL u = CrsWktCli.class.getResource("version.dat");
    String version;
    try {
      version = IOUtils.toString(u, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new RuntimeException("Could not read version information", e);
    }
    return version.trim();
  }
}
