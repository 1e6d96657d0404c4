package io.crswkt.commands;

import java.io.PrintWriter;
import java.util.Map;

import io.crswkt.model.Authority;
import io.crswkt.model.CoordinateSystem;
import io.crswkt.util.AuthorityCollector;

/**
 * Print the authority references of WKT files. Each line holds the path
 * of the node in the tree and the authority separated by a tab. If more
 * than one file is given, lines are prefixed with the file's path.
 */
public class AuthorityCommand extends AbstractWktFileCommand {
  @Override
  public String getUsageName() {
    return "authority";
  }

  @Override
  public String getUsageDescription() {
    return "List the authority references in CRS WKT files";
  }

  @Override
  protected void process(String path, CoordinateSystem cs, PrintWriter out) {
    String prefix = files.size() > 1 ? path + "\t" : "";
    for (Map.Entry<String, Authority> e : AuthorityCollector.collect(cs).entrySet()) {
      out.println(prefix + e.getKey() + "\t" + e.getValue());
    }
  }
}
