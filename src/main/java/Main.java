import datagenerators.WordGenerator;
import graph.EdgeDescriptor;
import render.DotExporter;
import render.GraphvizRunner;
import tree.LeafEndMode;
import tree.SuffixTree;
import tree.SuffixTreeBuilder;
import tree.SuffixTreeConfiguration;
import utilities.MemUtil;
import utilities.SuffixTreeLogger;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Level;

/**
 * Command line driver: builds the suffix tree of a word given inline, read from a file or
 * generated at random, prints its transitions and suffix links, and optionally exports it to
 * Graphviz.
 */
public final class Main {

    private static final String DEFAULT_WORD = "abcabxabcd";
    private static final int DEFAULT_ALPHABET = 3;
    private static final long DEFAULT_SEED = 42L;
    // Above this many vertices the per-vertex listing is skipped.
    private static final int MAX_LISTED_VERTICES = 200;

    public static void main(String[] args) throws IOException {
        run(args, System.out);
    }

    static SuffixTree<Character> run(String[] args, PrintStream out) throws IOException {
        CliOptions options = CliOptions.parse(args);
        String word = options.word();
        if (options.trace && SuffixTreeLogger.consoleLevel().intValue() > Level.FINEST.intValue()) {
            // Phase traces are logged at FINEST.
            SuffixTreeLogger.setConsoleLevel(Level.FINEST);
        }

        SuffixTreeConfiguration configuration = SuffixTreeConfiguration.defaults().toBuilder()
                .leafEndMode(options.leafEndMode)
                .initialCapacity(Math.max(1, word.length()))
                .traceLogging(options.trace)
                .verifyInvariants(options.verify)
                .build();

        long t0 = System.nanoTime();
        SuffixTree<Character> tree = SuffixTreeBuilder.build(word, configuration);
        double ms = (System.nanoTime() - t0) / 1_000_000.0;
        SuffixTreeLogger.info(String.format(Locale.ROOT, "Built suffix tree of %d symbols in %.3f ms",
                word.length(), ms));

        out.printf(Locale.ROOT, "Word length: %d%nLeaf ends: %s%nVertices: %d  Edges: %d  Leaves: %d%n",
                tree.length(), tree.leafEndMode(), tree.vertexCount(), tree.edgeCount(), tree.view().leafCount());
        out.println("Active point: " + tree.activePoint());

        if (tree.vertexCount() <= MAX_LISTED_VERTICES) {
            for (int v = 0; v < tree.vertexCount(); v++) {
                out.print(v + ":");
                for (Map.Entry<Character, EdgeDescriptor> edge : tree.edges(v).entrySet()) {
                    out.print(" " + edge.getKey() + "->" + edge.getValue().target()
                            + "[" + join(tree.label(edge.getValue())) + "]");
                }
                tree.suffixLink(v).ifPresent(link -> out.print("  suffix=" + link));
                out.println();
            }
        }

        if (options.dotFile != null || options.renderFile != null) {
            String dot = new DotExporter().export(tree.view());
            if (options.dotFile != null) {
                Files.writeString(options.dotFile, dot, StandardCharsets.UTF_8);
                out.println("DOT written to " + options.dotFile);
            }
            if (options.renderFile != null) {
                new GraphvizRunner(options.dotBinary, List.of("-Tsvg")).render(dot, options.renderFile);
                out.println("Image written to " + options.renderFile);
            }
        }

        if (options.memory) {
            out.println(MemUtil.jolMemoryReport(tree, false).report());
        }
        return tree;
    }

    private static String join(List<Character> symbols) {
        StringBuilder sb = new StringBuilder(symbols.size());
        for (Character c : symbols) {
            sb.append(c.charValue());
        }
        return sb.toString();
    }

    static final class CliOptions {
        final String word;
        final Path file;
        final int random;
        final int alphabet;
        final double zipf;
        final long seed;
        final LeafEndMode leafEndMode;
        final Path dotFile;
        final Path renderFile;
        final String dotBinary;
        final boolean memory;
        final boolean trace;
        final boolean verify;

        private CliOptions(String word,
                           Path file,
                           int random,
                           int alphabet,
                           double zipf,
                           long seed,
                           LeafEndMode leafEndMode,
                           Path dotFile,
                           Path renderFile,
                           String dotBinary,
                           boolean memory,
                           boolean trace,
                           boolean verify) {
            this.word = word;
            this.file = file;
            this.random = random;
            this.alphabet = alphabet;
            this.zipf = zipf;
            this.seed = seed;
            this.leafEndMode = leafEndMode;
            this.dotFile = dotFile;
            this.renderFile = renderFile;
            this.dotBinary = dotBinary;
            this.memory = memory;
            this.trace = trace;
            this.verify = verify;
        }

        static CliOptions parse(String[] args) {
            String word = null;
            Path file = null;
            int random = -1;
            int alphabet = DEFAULT_ALPHABET;
            double zipf = 0.0;
            long seed = DEFAULT_SEED;
            LeafEndMode leafEnd = LeafEndMode.OPEN;
            Path dot = null;
            Path render = null;
            String dotBinary = GraphvizRunner.DEFAULT_BINARY;
            boolean memory = false;
            boolean trace = false;
            boolean verify = false;

            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if (!arg.startsWith("--")) {
                    throw new IllegalArgumentException("Unexpected argument " + arg);
                }
                String key;
                String value = null;
                int eq = arg.indexOf('=');
                if (eq >= 0) {
                    key = arg.substring(2, eq);
                    value = arg.substring(eq + 1);
                } else {
                    key = arg.substring(2);
                }

                // Flags take no value.
                switch (key) {
                    case "memory" -> {
                        memory = true;
                        continue;
                    }
                    case "trace" -> {
                        trace = true;
                        continue;
                    }
                    case "verify" -> {
                        verify = true;
                        continue;
                    }
                    default -> {
                    }
                }

                if (value == null) {
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Missing value for option --" + key);
                    }
                    value = args[++i];
                }
                switch (key) {
                    case "word" -> word = value;
                    case "file" -> file = Path.of(value);
                    case "random" -> random = Integer.parseInt(value);
                    case "alphabet" -> alphabet = Integer.parseInt(value);
                    case "zipf" -> zipf = Double.parseDouble(value);
                    case "seed" -> seed = Long.parseLong(value);
                    case "leaf-end" -> leafEnd = LeafEndMode.valueOf(value.toUpperCase(Locale.ROOT));
                    case "dot" -> dot = Path.of(value);
                    case "render" -> render = Path.of(value);
                    case "dot-binary" -> dotBinary = value;
                    default -> throw new IllegalArgumentException("Unknown option --" + key);
                }
            }

            int sources = (word != null ? 1 : 0) + (file != null ? 1 : 0) + (random >= 0 ? 1 : 0);
            if (sources > 1) {
                throw new IllegalArgumentException("Use only one of --word, --file and --random");
            }
            return new CliOptions(word, file, random, alphabet, zipf, seed, leafEnd,
                    dot, render, dotBinary, memory, trace, verify);
        }

        // Resolve the input word; trailing line breaks of a file are dropped, other whitespace is kept.
        String word() throws IOException {
            if (word != null) {
                return word;
            }
            if (file != null) {
                return stripLineBreaks(Files.readString(file, StandardCharsets.UTF_8));
            }
            if (random >= 0) {
                WordGenerator generator = new WordGenerator(seed);
                return zipf > 0.0
                        ? generator.zipf(random, alphabet, zipf)
                        : generator.uniform(random, alphabet);
            }
            return DEFAULT_WORD;
        }

        static String stripLineBreaks(String text) {
            int end = text.length();
            while (end > 0 && (text.charAt(end - 1) == '\n' || text.charAt(end - 1) == '\r')) {
                end--;
            }
            return text.substring(0, end);
        }
    }
}
