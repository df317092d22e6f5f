package nfadfa;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;
import nfadfa.graph.DotGraph;

/**
 * Writes automata as Graphviz files.
 *
 * <p>Rendering only reads the automaton. Callers treat any failure here as
 * cosmetic: the JSON outputs are already complete by the time it runs.
 */
final class DotRenderer {

  private static final long DOT_TIMEOUT_SECONDS = 60;

  private final Path directory;
  private final boolean renderPng;

  DotRenderer(Path directory, boolean renderPng) {
    this.directory = directory;
    this.renderPng = renderPng;
  }

  /**
   * Write {@code <name>.dot} and, if enabled, {@code <name>.png}.
   *
   * @param graph automaton to draw
   * @param name file name (without extension) and graph title
   * @return path of the last file written
   */
  Path render(DotGraph<?, ?> graph, String name) throws IOException, InterruptedException {
    Files.createDirectories(directory);
    final Path dotFile = directory.resolve(name + ".dot");
    Files.writeString(dotFile, graph.dotGraph(name), StandardCharsets.UTF_8);
    if (!renderPng) {
      return dotFile;
    }

    final Path pngFile = directory.resolve(name + ".png");
    final Process process = new ProcessBuilder("dot", "-Tpng", dotFile.toString(), "-o", pngFile.toString())
      .redirectErrorStream(true)
      .redirectOutput(ProcessBuilder.Redirect.DISCARD)
      .start();
    if (!process.waitFor(DOT_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
      process.destroyForcibly();
      throw new IOException("dot did not finish within " + DOT_TIMEOUT_SECONDS + "s");
    }
    if (process.exitValue() != 0) {
      throw new IOException("dot exited with status " + process.exitValue());
    }
    return pngFile;
  }
}
