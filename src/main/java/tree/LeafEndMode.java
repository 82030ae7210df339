package tree;

/**
 * How leaf edges record their end.
 */
public enum LeafEndMode {
    /** Leaf ends follow the last processed position; supports incremental construction. */
    OPEN,
    /** Leaf ends are pinned to |word| - 1 at creation; only valid when the whole word is known up front. */
    FIXED
}
