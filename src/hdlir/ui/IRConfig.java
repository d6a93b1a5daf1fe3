package hdlir.ui;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/**
 * Data-Class to hold IR construction options.
 */
public class IRConfig {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Capture a source location on each created or modified node. */
  public boolean debug = false;

  public boolean print_diagnostics = true;
  public int diagnostic_context_lines = 2;
  public int diagnostic_line_width = 80;
  public boolean ansi_colors = true;
  /** Directories searched for the file names recorded in debug locations. */
  public List<String> source_paths = new ArrayList<>(List.of(".", "src", "test"));

  /**
   * Reads a configuration from a YAML document. Missing keys keep their defaults.
   * @param in the YAML input, not closed by this method
   * @return the parsed configuration, the default configuration for an empty document
   */
  public static IRConfig load(InputStream in) {
    Yaml yaml = new Yaml(new Constructor(IRConfig.class, new LoaderOptions()));
    IRConfig config = yaml.load(in);
    if (config == null) {
      logger.warn("Empty IR configuration, using defaults");
      return new IRConfig();
    }
    return config;
  }

  public static IRConfig load(String fileName) throws IOException {
    try (InputStream in = new FileInputStream(fileName)) {
      IRConfig config = load(in);
      logger.debug("Loaded IR configuration from {}", fileName);
      return config;
    }
  }
}
