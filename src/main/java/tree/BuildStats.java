package tree;

/**
 * Work counters of a construction. {@code suffixMoves} counts active point moves to a suffix,
 * {@code canonicalHops} counts edges crossed while canonicalizing; both stay linear in the
 * number of symbols.
 */
public record BuildStats(int symbols, int vertices, int leaves, long suffixMoves, long canonicalHops) {
}
