package io.geotext.commands;

import java.beans.IntrospectionException;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.lang.reflect.InvocationTargetException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateXY;
import org.locationtech.jts.geom.CoordinateXYM;
import org.locationtech.jts.geom.CoordinateXYZM;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.Ordinate;
import org.locationtech.jts.io.WKTWriter;

import de.undercouch.underline.Command;
import de.undercouch.underline.InputReader;
import de.undercouch.underline.Option.ArgumentType;
import de.undercouch.underline.OptionDesc;
import de.undercouch.underline.OptionGroup;
import de.undercouch.underline.OptionIntrospector;
import de.undercouch.underline.OptionIntrospector.ID;
import de.undercouch.underline.OptionParser;
import de.undercouch.underline.OptionParserException;
import de.undercouch.underline.UnknownAttributes;
import io.geotext.GeoTextCli;
import io.geotext.jts.JtsFactoryGenerator;
import io.geotext.jts.JtsGeometryFactory;
import io.geotext.wkt.WKTParseException;
import io.geotext.wkt.WKTParser;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.core.logging.Logger;
import io.vertx.core.logging.LoggerFactory;

/**
 * Parses geometries given as arguments or read line by line from an input
 * stream and prints them in normalized form. Returns exit code 1 on the
 * first geometry that cannot be parsed.
 */
public class ParseCommand implements Command {
  private static Logger log = LoggerFactory.getLogger(ParseCommand.class);

  private OptionGroup<ID> options;
  private JsonObject config;
  private File defaultConfFile;
  private String confFilePath;
  private boolean displayHelp;
  private boolean displayVersion;
  private List<String> geometries = new ArrayList<>();
  private boolean supportEwkt;
  private boolean supportWkt12;
  private boolean strictWkt11;
  private boolean ignoreExtraTokens;
  private InputStream input = System.in;

  /**
   * Set the configuration object. If set, no configuration file is read.
   * @param config the configuration object
   */
  public void setConfig(JsonObject config) {
    this.config = config;
  }

  /**
   * Set the configuration file to read if <code>--conf</code> is not given.
   * The file is optional.
   * @param file the file
   */
  public void setDefaultConfFile(File file) {
    this.defaultConfFile = file;
  }

  /**
   * Set the path to the configuration file
   * @param path the path
   */
  @OptionDesc(longName = "conf", shortName = "c",
      description = "path to the application's configuration file",
      argumentName = "PATH", argumentType = ArgumentType.STRING)
  public void setConfFilePath(String path) {
    this.confFilePath = path;
  }

  /**
   * Specifies if the help should be displayed
   * @param display true if the help should be displayed
   */
  @OptionDesc(longName = "help", shortName = "h",
      description = "display this help and exit", priority = 9000)
  public void setDisplayHelp(boolean display) {
    this.displayHelp = display;
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
   * Set the geometries to parse
   * @param geometries the WKT strings
   */
  @UnknownAttributes("WKT")
  public void setGeometries(List<String> geometries) {
    this.geometries = geometries;
  }

  /**
   * Enable PostGIS EWKT extensions
   * @param supportEwkt true if the extensions should be recognized
   */
  @OptionDesc(longName = "ewkt",
      description = "recognize PostGIS EWKT extensions (SRID prefix, POINTM)")
  public void setSupportEwkt(boolean supportEwkt) {
    this.supportEwkt = supportEwkt;
  }

  /**
   * Enable SFS 1.2 dimension markers
   * @param supportWkt12 true if the markers should be recognized
   */
  @OptionDesc(longName = "wkt12",
      description = "recognize SFS 1.2 dimension markers (Z, M, ZM)")
  public void setSupportWkt12(boolean supportWkt12) {
    this.supportWkt12 = supportWkt12;
  }

  /**
   * Enable strict SFS 1.1 mode
   * @param strictWkt11 true if only X and Y should be allowed
   */
  @OptionDesc(longName = "strict",
      description = "only allow X and Y coordinates (ignored with --ewkt or --wkt12)")
  public void setStrictWkt11(boolean strictWkt11) {
    this.strictWkt11 = strictWkt11;
  }

  /**
   * Ignore tokens after the geometry
   * @param ignoreExtraTokens true if they should be ignored
   */
  @OptionDesc(longName = "ignore-extra",
      description = "ignore tokens after the end of the geometry")
  public void setIgnoreExtraTokens(boolean ignoreExtraTokens) {
    this.ignoreExtraTokens = ignoreExtraTokens;
  }

  /**
   * Set the stream to read geometries from if none are given on the
   * command line
   * @param input the stream
   */
  public void setInput(InputStream input) {
    this.input = input;
  }

  @Override
  public int run(String[] args, InputReader in, PrintWriter out)
      throws OptionParserException, IOException {
    if (options == null) {
      try {
        options = OptionIntrospector.introspect(ParseCommand.class);
      } catch (IntrospectionException e) {
        throw new RuntimeException("Could not inspect command", e);
      }
    }

    OptionParser.Result<ID> parsedOptions = OptionParser.parse(args,
        options, OptionIntrospector.DEFAULT_ID);
    try {
      OptionIntrospector.evaluate(parsedOptions.getValues(), this);
    } catch (IllegalAccessException | InvocationTargetException | InstantiationException e) {
      throw new RuntimeException("Could not evaluate options", e);
    }

    if (displayHelp) {
      OptionParser.usage("geotext", "Parse WKT geometries given as "
          + "arguments or read line by line from standard input", options,
          "WKT", null, out);
      out.flush();
      return 0;
    }

    if (displayVersion) {
      out.println("geotext " + GeoTextCli.getVersion());
      out.flush();
      return 0;
    }

    WKTParser<Geometry> parser;
    try {
      parser = createParser(loadConfig());
    } catch (IOException e) {
      error("Could not read config file: " + e.getMessage());
      return 1;
    } catch (DecodeException e) {
      error("Invalid config file: " + e.getMessage());
      return 1;
    }

    List<String> wkts = geometries;
    if (wkts == null || wkts.isEmpty()) {
      wkts = new ArrayList<>();
      for (String line : IOUtils.readLines(input, StandardCharsets.UTF_8)) {
        if (!line.trim().isEmpty()) {
          wkts.add(line);
        }
      }
    }

    try {
      for (String wkt : wkts) {
        Geometry g;
        try {
          g = parser.parse(wkt);
        } catch (WKTParseException e) {
          error(e.getMessage());
          return 1;
        }
        out.println(format(g));
      }
    } finally {
      out.flush();
    }
    return 0;
  }

  /**
   * Get the configuration object or read it from the configuration file
   * @return the configuration
   * @throws IOException if the configuration file could not be read
   */
  private JsonObject loadConfig() throws IOException {
    if (config != null) {
      return config;
    }

    File confFile = confFilePath != null ? new File(confFilePath) : defaultConfFile;
    if (confFile == null || (confFilePath == null && !confFile.exists())) {
      log.debug("No configuration file found at " + confFile + ". Using defaults.");
      return new JsonObject();
    }
    return new JsonObject(FileUtils.readFileToString(confFile,
        StandardCharsets.UTF_8));
  }

  /**
   * Create the parser according to the configuration and the command
   * line flags. Flags can only enable options.
   * @param config the configuration
   * @return the parser
   */
  private WKTParser<Geometry> createParser(JsonObject config) {
    WKTParser<Geometry> parser = WKTParser.fromConfig(
        JtsGeometryFactory.cartesian(), config);
    parser.setFactoryGenerator(JtsFactoryGenerator.fromConfig(config));
    if (supportEwkt) {
      parser.setSupportEwkt(true);
    }
    if (supportWkt12) {
      parser.setSupportWkt12(true);
    }
    if (strictWkt11) {
      parser.setStrictWkt11(true);
    }
    if (ignoreExtraTokens) {
      parser.setIgnoreExtraTokens(true);
    }
    return parser;
  }

  /**
   * Outputs an error message
   * @param msg the message
   */
  private void error(String msg) {
    System.err.println("geotext: " + msg);
  }

  /**
   * Convert a geometry to WKT. Prepends an EWKT SRID prefix if the
   * geometry has an SRID.
   * @param g the geometry
   * @return the WKT string
   */
  static String format(Geometry g) {
    EnumSet<Ordinate> ordinates = EnumSet.of(Ordinate.X, Ordinate.Y);
    Coordinate c = g.getCoordinate();
    if (c instanceof CoordinateXYZM) {
      ordinates.add(Ordinate.Z);
      ordinates.add(Ordinate.M);
    } else if (c instanceof CoordinateXYM) {
      ordinates.add(Ordinate.M);
    } else if (c != null && !(c instanceof CoordinateXY)) {
      ordinates.add(Ordinate.Z);
    }

    WKTWriter writer = new WKTWriter(ordinates.size());
    writer.setOutputOrdinates(ordinates);
    String result = writer.write(g);
    if (g.getSRID() != 0) {
      result = "SRID=" + g.getSRID() + ";" + result;
    }
    return result;
  }
}
