package io.crswkt.commands;

import java.beans.IntrospectionException;
import java.io.IOException;
import java.io.PrintWriter;
import java.lang.reflect.InvocationTargetException;

import de.undercouch.underline.Command;
import de.undercouch.underline.InputReader;
import de.undercouch.underline.OptionDesc;
import de.undercouch.underline.OptionGroup;
import de.undercouch.underline.OptionIntrospector;
import de.undercouch.underline.OptionIntrospector.ID;
import de.undercouch.underline.OptionParser;
import de.undercouch.underline.OptionParserException;
import io.crswkt.ConfigConstants;
import io.crswkt.parser.CrsWktParser;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;

/**
 * Abstract base class for all crswkt commands
 */
public abstract class AbstractCrsWktCommand implements CrsWktCommand {
  /**
   * The name of the command-line tool
   */
  protected static final String TOOL_NAME = "crswkt";

  private OptionGroup<ID> options;
  private boolean displayHelp;
  private JsonObject config;
  private Handler<Integer> endHandler;

  /**
   * @return the configuration object (never null)
   */
  protected JsonObject config() {
    if (config == null) {
      config = new JsonObject();
    }
    return config;
  }

  /**
   * Set the configuration object
   * @param config the configuration object
   */
  public void setConfig(JsonObject config) {
    this.config = config;
  }

  /**
   * Set the end handler that will be called with the exit code when the
   * command has finished its work
   * @param endHandler the end handler
   */
  public void setEndHandler(Handler<Integer> endHandler) {
    this.endHandler = endHandler;
  }

  /**
   * Specifies if the command's help should be displayed
   * @param display true if the help should be displayed
   */
  @OptionDesc(longName = "help", shortName = "h",
      description = "display this help and exit", priority = 9000)
  public void setDisplayHelp(boolean display) {
    this.displayHelp = display;
  }

  /**
   * Outputs an error message
   * @param msg the message
   */
  protected void error(String msg) {
    System.err.println(TOOL_NAME + ": " + msg);
  }

  /**
   * @return the classes to inspect for CLI options
   */
  protected Class<?>[] getClassesToIntrospect() {
    return new Class<?>[] { getClass() };
  }

  /**
   * @return the commands the parsed CLI values should be injected into
   */
  protected Command[] getObjectsToEvaluate() {
    return new Command[] { this };
  }

  /**
   * Parse the command line and inject the values into this command
   * @param args the command line arguments
   * @return the arguments that have not been consumed (e.g. the arguments
   * of a sub-command)
   * @throws OptionParserException if the arguments are invalid
   */
  private String[] evaluateOptions(String[] args) throws OptionParserException {
    Class<?>[] classes = getClassesToIntrospect();
    if (options == null) {
      try {
        options = OptionIntrospector.introspect(classes);
      } catch (IntrospectionException e) {
        throw new RuntimeException("Could not inspect command " +
            getClass().getName(), e);
      }
    }

    ID unknownArgsId = OptionIntrospector.hasUnknownArguments(classes) ?
        OptionIntrospector.DEFAULT_ID : null;
    OptionParser.Result<ID> parsed = OptionParser.parse(args, options,
        unknownArgsId);
    try {
      OptionIntrospector.evaluate(parsed.getValues(),
          (Object[])getObjectsToEvaluate());
    } catch (IllegalAccessException | InvocationTargetException | InstantiationException e) {
      throw new RuntimeException("Could not evaluate options", e);
    }
    return parsed.getRemainingArgs();
  }

  @Override
  public int run(String[] args, InputReader in, PrintWriter out)
      throws OptionParserException, IOException {
    String[] remainingArgs = evaluateOptions(args);

    int exitCode;
    if (displayHelp) {
      usage(out);
      exitCode = 0;
    } else if (!checkArguments()) {
      exitCode = 1;
    } else {
      doRun(remainingArgs, in, out, endHandler);
      return 0;
    }
    endHandler.handle(exitCode);
    return exitCode;
  }

  /**
   * Prints out usage information
   * @param out the writer to print to
   */
  protected void usage(PrintWriter out) {
    String usageName = getUsageName();
    String name = usageName == null || usageName.isEmpty() ?
        TOOL_NAME : TOOL_NAME + " " + usageName;

    // commands with sub-commands point to the help command
    String footnotes = null;
    if (!options.getCommands().isEmpty()) {
      footnotes = "Use `" + TOOL_NAME + " help <command>' to read about " +
          "a specific command.";
    }

    OptionParser.usage(name, getUsageDescription(), options,
        OptionIntrospector.getUnknownArgumentName(getClassesToIntrospect()),
        footnotes, out);
    out.flush();
  }

  @Override
  public boolean checkArguments() {
    // nothing to check by default. subclasses may override
    return true;
  }

  /**
   * Create a new parser from the configuration
   * @param lax true if comments should be accepted regardless of the
   * configuration
   * @return the parser
   */
  protected CrsWktParser createParser(boolean lax) {
    JsonObject parserConfig = config().copy();
    if (lax) {
      parserConfig.put(ConfigConstants.STRICT, false);
    }
    return new CrsWktParser(parserConfig, null);
  }
}
