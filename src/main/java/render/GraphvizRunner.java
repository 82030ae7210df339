package render;

import utilities.SuffixTreeLogger;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Pipes DOT text through an external Graphviz binary and writes the rendered image.
 */
public final class GraphvizRunner {

    public static final String DEFAULT_BINARY = "dot";

    private final String binary;
    private final List<String> options;

    public GraphvizRunner() {
        this(DEFAULT_BINARY, List.of("-Tsvg"));
    }

    public GraphvizRunner(String binary, List<String> options) {
        this.binary = Objects.requireNonNull(binary, "binary");
        this.options = List.copyOf(options);
    }

    public List<String> command() {
        List<String> command = new ArrayList<>(options.size() + 1);
        command.add(binary);
        command.addAll(options);
        return command;
    }

    /**
     * Render {@code dot} into {@code output}.
     *
     * @throws IOException if the binary cannot be started, fails, or the output cannot be written
     */
    public void render(String dot, Path output) throws IOException {
        Objects.requireNonNull(dot, "dot");
        Objects.requireNonNull(output, "output");
        // stderr is collected in a file, never through a pipe.
        Path errors = Files.createTempFile("graphviz", ".err");
        try {
            ProcessBuilder pb = new ProcessBuilder(command());
            pb.redirectOutput(output.toFile());
            pb.redirectError(errors.toFile());
            Process process = pb.start();
            int exit;
            try {
                try (OutputStream stdin = process.getOutputStream()) {
                    stdin.write(dot.getBytes(StandardCharsets.UTF_8));
                }
                exit = process.waitFor();
            } catch (IOException e) {
                process.destroy();
                throw e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroy();
                throw new IOException("interrupted while waiting for " + binary, e);
            }
            String stderr = Files.readString(errors, StandardCharsets.UTF_8).trim();
            if (exit != 0) {
                throw new IOException(binary + " exited with status " + exit + ": " + stderr);
            }
            if (!stderr.isEmpty()) {
                SuffixTreeLogger.warning(binary + ": " + stderr);
            }
            SuffixTreeLogger.info("Rendered " + output);
        } finally {
            Files.deleteIfExists(errors);
        }
    }
}
