package utilities;

import org.openjdk.jol.info.GraphLayout;
import org.openjdk.jol.vm.VM;
import tree.SuffixTree;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

public class MemUtil {

    private MemUtil() {
    }

    // Detailed JOL report for a suffix tree, optionally including the class footprint table.
    public static MemoryUsageReport jolMemoryReport(SuffixTree<?> tree, boolean includeFootprintTable) {
        Map<String, Object> parts = new LinkedHashMap<>();
        parts.put("Word", tree.word());
        return jolMemoryReport("SuffixTree", tree, parts, includeFootprintTable);
    }

    /**
     * Report the retained size of {@code root} plus the share of each named part. Parts are
     * measured as independent roots, so they may overlap; the remainder is clamped at zero.
     */
    public static MemoryUsageReport jolMemoryReport(String label, Object root, Map<String, ?> parts,
                                                    boolean includeFootprintTable) {
        StringBuilder sb = new StringBuilder(4_096);

        // VM details (useful to interpret alignment, header sizes, and compressed oops status)
        sb.append("=== JOL / VM details ===\n");
        sb.append(VM.current().details()).append('\n');

        GraphLayout total = GraphLayout.parseInstance(root);
        sb.append("\n=== ").append(label).append(" total (as root) ===\n");
        appendLayout(sb, "Total", total.totalSize());

        long remainder = total.totalSize();
        for (Map.Entry<String, ?> part : parts.entrySet()) {
            long bytes = GraphLayout.parseInstance(part.getValue()).totalSize();
            appendLayout(sb, part.getKey(), bytes);
            remainder -= bytes;
        }
        if (!parts.isEmpty()) {
            appendLayout(sb, "Other", Math.max(0, remainder));
        }

        if (includeFootprintTable) {
            sb.append("\n--- Class footprint (").append(label).append(" root) ---\n");
            sb.append(total.toFootprint()).append('\n');
        }
        return new MemoryUsageReport(sb.toString(), total.totalSize());
    }

    private static void appendLayout(StringBuilder sb, String label, long bytes) {
        sb.append(String.format(Locale.ROOT, "%s: %d B (%.3f MiB)%n", label, bytes, bytes / (1024.0 * 1024.0)));
    }
}
