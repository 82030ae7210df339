package utilities;

/** Human-readable JOL report together with the retained size of the measured graph. */
public record MemoryUsageReport(String report, long totalBytes) {

    public double totalMiB() {
        return totalBytes / (1024.0 * 1024.0);
    }
}
