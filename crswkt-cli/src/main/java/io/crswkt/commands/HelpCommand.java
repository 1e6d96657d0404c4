package io.crswkt.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;

import de.undercouch.underline.InputReader;
import de.undercouch.underline.OptionParserException;
import de.undercouch.underline.UnknownAttributes;
import io.crswkt.CrsWktCli;
import io.vertx.core.Handler;

/**
 * Displays the help of a command or, if no command is given, the general
 * usage information of the tool
 */
public class HelpCommand extends AbstractCrsWktCommand {
  private List<String> commandPath = new ArrayList<>();

  /**
   * Set the command whose help should be displayed
   * @param commandPath the command's name and the names of its
   * sub-commands (if any)
   */
  @UnknownAttributes("COMMAND")
  public void setCommandPath(List<String> commandPath) {
    this.commandPath = commandPath;
  }

  @Override
  public String getUsageName() {
    return "help";
  }

  @Override
  public String getUsageDescription() {
    return "Display a command's help";
  }

  @Override
  public void doRun(String[] remainingArgs, InputReader in, PrintWriter out,
      Handler<Integer> handler) throws OptionParserException, IOException {
    // let a fresh CLI resolve the command and ask it for its help
    List<String> args = new ArrayList<>(commandPath);
    args.add("--help");

    CrsWktCli cli = new CrsWktCli();
    cli.setConfig(config());
    cli.setEndHandler(handler);
    cli.run(args.toArray(new String[args.size()]), in, out);
  }
}
