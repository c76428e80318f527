package io.geotext.commands;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.WKTReader;

import de.undercouch.underline.InputReader;
import de.undercouch.underline.StandardInputReader;
import io.geotext.ConfigConstants;
import io.vertx.core.json.JsonObject;

/**
 * Test {@link ParseCommand}
 */
public class ParseCommandTest {
  private ParseCommand cmd;
  private InputReader in = new StandardInputReader();
  private StringWriter writer;
  private PrintWriter out;
  private int exitCode;

  /**
   * A temporary folder for configuration files
   */
  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  /**
   * Set up test
   */
  @Before
  public void setUp() {
    cmd = new ParseCommand();
    cmd.setConfig(new JsonObject());
    writer = new StringWriter();
    out = new PrintWriter(writer);
  }

  private String[] outputLines() {
    return writer.toString().trim().split("\\r?\\n");
  }

  /**
   * Parse a geometry given on the command line
   * @throws Exception if something goes wrong
   */
  @Test
  public void simple() throws Exception {
    exitCode = cmd.run(new String[] { "POINT (1 2)" }, in, out);
    assertEquals(0, exitCode);
    assertEquals("POINT (1 2)", writer.toString().trim());
  }

  /**
   * The SRID is printed as an EWKT prefix
   * @throws Exception if something goes wrong
   */
  @Test
  public void ewkt() throws Exception {
    exitCode = cmd.run(new String[] { "--ewkt", "SRID=4326;POINT(1 2)" }, in, out);
    assertEquals(0, exitCode);
    assertEquals("SRID=4326;POINT (1 2)", writer.toString().trim());
  }

  /**
   * Z coordinates are kept
   * @throws Exception if something goes wrong
   */
  @Test
  public void wkt12() throws Exception {
    exitCode = cmd.run(new String[] { "--wkt12", "POINT Z (1 2 3)" }, in, out);
    assertEquals(0, exitCode);
    Geometry g = new WKTReader().read(writer.toString().trim());
    assertEquals(3.0, g.getCoordinate().getZ(), 0.0);
  }

  /**
   * Parser options can be set in the configuration
   * @throws Exception if something goes wrong
   */
  @Test
  public void config() throws Exception {
    cmd.setConfig(new JsonObject()
        .put(ConfigConstants.WKT_IGNORE_EXTRA_TOKENS, true));
    exitCode = cmd.run(new String[] { "POINT (1 2) trailing" }, in, out);
    assertEquals(0, exitCode);
    assertEquals("POINT (1 2)", writer.toString().trim());
  }

  /**
   * Geometries are read from the input stream if none are given
   * @throws Exception if something goes wrong
   */
  @Test
  public void readInput() throws Exception {
    cmd.setInput(new ByteArrayInputStream(
        "POINT (1 2)\n\nLINESTRING (0 0, 1 1)\n".getBytes(StandardCharsets.UTF_8)));
    exitCode = cmd.run(new String[0], in, out);
    assertEquals(0, exitCode);
    String[] lines = outputLines();
    assertEquals(2, lines.length);
    assertEquals("POINT (1 2)", lines[0]);
    assertEquals("LINESTRING (0 0, 1 1)", lines[1]);
  }

  /**
   * Parse errors lead to exit code 1
   * @throws Exception if something goes wrong
   */
  @Test
  public void parseError() throws Exception {
    exitCode = cmd.run(new String[] { "POINT (1 2)", "FOO (1 2)" }, in, out);
    assertEquals(1, exitCode);
    String[] lines = outputLines();
    assertEquals(1, lines.length);
    assertTrue(lines[0].startsWith("POINT"));
  }

  /**
   * The configuration file given with --conf is read
   * @throws Exception if something goes wrong
   */
  @Test
  public void confFile() throws Exception {
    File conf = folder.newFile("geotext.json");
    FileUtils.writeStringToFile(conf, new JsonObject()
        .put(ConfigConstants.WKT_SUPPORT_EWKT, true).encode(),
        StandardCharsets.UTF_8);
    cmd = new ParseCommand();
    exitCode = cmd.run(new String[] { "--conf", conf.getPath(),
        "SRID=31467;POINT (1 2)" }, in, out);
    assertEquals(0, exitCode);
    assertEquals("SRID=31467;POINT (1 2)", writer.toString().trim());
  }

  /**
   * A missing default configuration file means defaults are used
   * @throws Exception if something goes wrong
   */
  @Test
  public void missingDefaultConfFile() throws Exception {
    cmd = new ParseCommand();
    cmd.setDefaultConfFile(new File(folder.getRoot(), "missing.json"));
    exitCode = cmd.run(new String[] { "POINT (1 2)" }, in, out);
    assertEquals(0, exitCode);
    assertEquals("POINT (1 2)", writer.toString().trim());
  }

  /**
   * An invalid configuration file leads to exit code 1
   * @throws Exception if something goes wrong
   */
  @Test
  public void invalidConfFile() throws Exception {
    File conf = folder.newFile("broken.json");
    FileUtils.writeStringToFile(conf, "{ not json", StandardCharsets.UTF_8);
    cmd = new ParseCommand();
    exitCode = cmd.run(new String[] { "-c", conf.getPath(), "POINT (1 2)" },
        in, out);
    assertEquals(1, exitCode);
    assertEquals("", writer.toString().trim());
  }

  /**
   * Print the version
   * @throws Exception if something goes wrong
   */
  @Test
  public void version() throws Exception {
    exitCode = cmd.run(new String[] { "--version" }, in, out);
    assertEquals(0, exitCode);
    assertEquals("geotext 1.0.0", writer.toString().trim());
  }

  /**
   * Print usage information
   * @throws Exception if something goes wrong
   */
  @Test
  public void help() throws Exception {
    exitCode = cmd.run(new String[] { "-h" }, in, out);
    assertEquals(0, exitCode);
    String usage = writer.toString();
    assertTrue(usage.contains("geotext"));
    assertTrue(usage.contains("--wkt12"));
  }
}
