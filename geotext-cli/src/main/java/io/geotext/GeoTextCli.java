package io.geotext;

import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.net.URL;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.IOUtils;

import de.undercouch.underline.OptionParserException;
import de.undercouch.underline.StandardInputReader;
import io.geotext.commands.ParseCommand;
import io.vertx.core.logging.Logger;
import io.vertx.core.logging.LoggerFactory;

/**
 * GeoText command-line interface. Reads its configuration from
 * <code>$GEOTEXT_CLI_HOME/conf/geotext.json</code> unless
 * <code>--conf</code> is given.
 */
public class GeoTextCli {
  private static Logger log = LoggerFactory.getLogger(GeoTextCli.class);

  private GeoTextCli() {
    // hidden constructor
  }

  /**
   * Run the GeoText command-line interface
   * @param args the command line arguments
   * @throws IOException if a stream could not be read
   */
  public static void main(String[] args) throws IOException {
    String home = System.getenv("GEOTEXT_CLI_HOME");
    if (home == null) {
      log.debug("Environment variable GEOTEXT_CLI_HOME not set. "
          + "Using current working directory.");
      home = ".";
    }

    ParseCommand cmd = new ParseCommand();
    cmd.setDefaultConfFile(new File(new File(home, "conf"), "geotext.json"));

    PrintWriter out = new PrintWriter(new OutputStreamWriter(
        System.out, StandardCharsets.UTF_8));
    int exitCode;
    try {
      exitCode = cmd.run(args, new StandardInputReader(), out);
    } catch (OptionParserException e) {
      System.err.println("geotext: " + e.getMessage());
      exitCode = 1;
    }
    out.flush();
    System.exit(exitCode);
  }

  /**
   * @return the tool's version string
   */
  public static String getVersion() {
    URL u = GeoTextCli.class.getResource("version.dat");
    String version;
    try {
      version = IOUtils.toString(u, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new RuntimeException("Could not read version information", e);
    }
    return version.trim();
  }
}
