package PMIndex;

import org.openjdk.jol.info.GraphLayout;
import tree.ActivePointState;
import tree.BuildStats;
import tree.SuffixTree;
import tree.SuffixTreeBuilder;
import tree.SuffixTreeConfiguration;
import utilities.MemUtil;
import utilities.MemoryUsageReport;
import utilities.SuffixTreeLogger;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Streaming index over string tokens. Every inserted token is one symbol of the word and is
 * appended to an online suffix tree right away, so the index is queryable after each insert.
 *
 * Queries run against a snapshot that is rebuilt lazily after the stream has grown.
 */
public class SuffixTreeIndex implements IPMIndexing {

    private final SuffixTreeConfiguration configuration;
    private SuffixTreeBuilder<String> builder;

    // Snapshot for queries; null when tokens arrived since it was taken.
    private SuffixTree<String> snapshot;

    public SuffixTreeIndex() {
        this(SuffixTreeConfiguration.defaults());
    }

    public SuffixTreeIndex(SuffixTreeConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.builder = new SuffixTreeBuilder<>(configuration);
    }

    @Override
    public void insert(String key) {
        if (key == null || key.isEmpty()) {
            return;
        }
        builder.append(key);
        snapshot = null;
    }

    @Override
    public boolean exists(List<String> pattern) {
        return current().contains(pattern);
    }

    /**
     * Token offsets at which the pattern starts, ascending. Aligns with regex semantics for
     * empty patterns: every boundary 0..size() matches.
     */
    @Override
    public ArrayList<Integer> report(List<String> pattern) {
        return new ArrayList<>(current().findOccurrences(pattern));
    }

    @Override
    public void expire() {
        SuffixTreeLogger.debug("expiring suffix tree index of " + builder.length() + " tokens");
        builder = new SuffixTreeBuilder<>(configuration);
        snapshot = null;
    }

    @Override
    public int size() {
        return builder.length();
    }

    public ActivePointState activePoint() {
        return builder.activePoint();
    }

    public BuildStats stats() {
        return builder.stats();
    }

    public SuffixTree<String> tree() {
        return current();
    }

    private SuffixTree<String> current() {
        if (snapshot == null) {
            snapshot = builder.snapshot();
        }
        return snapshot;
    }

    // =========================
    // === JOL memory reports ==
    // =========================

    /**
     * Memory footprint of the live builder.
     *
     * @param includeFootprintTable when true, append the full class histogram
     */
    public MemoryUsageReport jolMemoryReport(boolean includeFootprintTable) {
        return MemUtil.jolMemoryReport("SuffixTreeIndex", builder, Map.of(), includeFootprintTable);
    }

    // One line for quick comparisons between runs.
    public String jolMemorySummary() {
        long bytes = GraphLayout.parseInstance(builder).totalSize();
        return String.format(Locale.ROOT, "Tokens: %d  Total: %d B (%.3f MiB)",
                builder.length(), bytes, bytes / (1024.0 * 1024.0));
    }
}
