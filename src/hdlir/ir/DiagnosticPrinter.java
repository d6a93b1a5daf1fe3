package hdlir.ir;

import hdlir.IRContext;
import hdlir.ui.IRConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Logs the source context of the debug locations recorded on IR nodes. */
public final class DiagnosticPrinter {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private static final String RED = "\033[91m";
  private static final String GREEN = "\033[92m";
  private static final String BLUE = "\033[94m";
  private static final String ENDC = "\033[0m";

  private DiagnosticPrinter() {}

  public static void printNodes(Collection<? extends IRNode> nodes) {
    for (IRNode node : nodes)
      printNode(node);
  }

  public static void printNode(IRNode node) {
    if (node.getDebugLocations().isEmpty())
      return;
    IRConfig config = node.context().map(IRContext::getConfig).orElseGet(IRConfig::new);
    if (!config.print_diagnostics)
      return;
    for (DebugLocation location : node.getDebugLocations()) {
      Optional<Path> file = resolve(location.filename(), config.source_paths);
      if (file.isEmpty()) {
        logger.error("{}", location);
        continue;
      }
      List<String> lines;
      try {
        lines = Files.readAllLines(file.get());
      } catch (IOException e) {
        logger.error("{} (unable to read source: {})", location, e.getMessage());
        continue;
      }
      logger.error("{}:{}", file.get(), location.lineNumber());
      for (String line : formatContext(lines, location.lineNumber(), config))
        logger.error(line);
    }
  }

  /**
   * Formats the lines around {@code lineNumber} (1-based), marking the target line.
   * @return the formatted block including the surrounding rulers
   */
  public static List<String> formatContext(List<String> lines, int lineNumber, IRConfig config) {
    List<String> result = new ArrayList<>();
    String ruler = color(BLUE, "-".repeat(config.diagnostic_line_width), config.ansi_colors);
    result.add(ruler);
    int first = Math.max(1, lineNumber - config.diagnostic_context_lines);
    int last = Math.min(lines.size(), lineNumber + config.diagnostic_context_lines);
    for (int i = first; i <= last; ++i) {
      String text = lines.get(i - 1);
      if (i == lineNumber)
        result.add(color(RED, ">" + text, config.ansi_colors));
      else
        result.add(color(GREEN, " " + text, config.ansi_colors));
    }
    result.add(ruler);
    return result;
  }

  private static String color(String code, String text, boolean enabled) { return enabled ? code + text + ENDC : text; }

  private static Optional<Path> resolve(String filename, List<String> sourcePaths) {
    Path direct = Path.of(filename);
    if (Files.isRegularFile(direct))
      return Optional.of(direct);
    for (String root : sourcePaths) {
      Path rootPath = Path.of(root);
      if (!Files.isDirectory(rootPath))
        continue;
      try (var stream = Files.walk(rootPath)) {
        Optional<Path> found = stream.filter(p -> p.getFileName() != null && p.getFileName().toString().equals(filename))
                                   .filter(Files::isRegularFile)
                                   .findFirst();
        if (found.isPresent())
          return found;
      } catch (IOException e) {
        logger.debug("Unable to search {} for {}: {}", root, filename, e.getMessage());
      }
    }
    return Optional.empty();
  }
}
