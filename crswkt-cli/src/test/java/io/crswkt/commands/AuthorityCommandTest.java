package io.crswkt.commands;

import static org.junit.Assert.assertEquals;

import org.junit.Test;

/**
 * Test for {@link AuthorityCommand}
 */
public class AuthorityCommandTest extends CommandTestBase<AuthorityCommand> {
  @Override
  protected AuthorityCommand createCommand() {
    return new AuthorityCommand();
  }

  /**
   * List the authorities of a single file
   * @throws Exception if something goes wrong
   */
  @Test
  public void single() throws Exception {
    String path = writeFile("geogcs.wkt", GEOGCS);
    cmd.run(new String[] { path }, in, out);
    assertEquals(Integer.valueOf(0), exitCode);

    String[] lines = writer.toString().split("\\r?\\n");
    assertEquals(3, lines.length);
    assertEquals("GEOGCS/datum/spheroid\tEPSG:7001", lines[0]);
    assertEquals("GEOGCS/datum\tEPSG:6277", lines[1]);
    assertEquals("GEOGCS\tEPSG:4277", lines[2]);
  }

  /**
   * Lines are prefixed with the file's path if there is more than one file
   * @throws Exception if something goes wrong
   */
  @Test
  public void multiple() throws Exception {
    String p1 = writeFile("a.wkt", GEOGCS);
    String p2 = writeFile("b.wkt", "LOCAL_CS[\"L\", AXIS[\"x\",OTHER], " +
        "AUTHORITY[\"LOCAL\",\"1\"]]");
    cmd.run(new String[] { p1, p2 }, in, out);
    assertEquals(Integer.valueOf(0), exitCode);

    String[] lines = writer.toString().split("\\r?\\n");
    assertEquals(4, lines.length);
    assertEquals(p1 + "\tGEOGCS\tEPSG:4277", lines[2]);
    assertEquals(p2 + "\tLOCAL_CS\tLOCAL:1", lines[3]);
  }

  /**
   * Content errors lead to exit code 1
   * @throws Exception if something goes wrong
   */
  @Test
  public void contentError() throws Exception {
    String path = writeFile("bad.wkt", "GEOGCS[\"G\", AXIS[\"lat\",NORTH]]");
    cmd.run(new String[] { path }, in, out);
    assertEquals(Integer.valueOf(1), exitCode);
    assertEquals("", writer.toString());
  }
}
