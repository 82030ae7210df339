package graph;

import java.util.Objects;

/**
 * Content of an edge: the label is word[start..end] (inclusive), or word[start..current end]
 * when the end is {@link #OPEN}. Only leaf edges may be open.
 */
public record EdgeDescriptor(int start, int end, EdgeTarget target) {

    // Marker for an end that follows the last processed position.
    public static final int OPEN = Integer.MIN_VALUE;

    public EdgeDescriptor {
        Objects.requireNonNull(target, "target");
        if (start < 0) {
            throw new IllegalArgumentException("start must be non-negative: " + start);
        }
        if (end == OPEN) {
            if (!target.isLeaf()) {
                throw new IllegalArgumentException("only leaf edges may have an open end");
            }
        } else if (end < start) {
            throw new IllegalArgumentException("end " + end + " precedes start " + start);
        }
    }

    public static EdgeDescriptor internal(int start, int end, int vertex) {
        return new EdgeDescriptor(start, end, EdgeTarget.internal(vertex));
    }

    public static EdgeDescriptor openLeaf(int start) {
        return new EdgeDescriptor(start, OPEN, EdgeTarget.LEAF);
    }

    public static EdgeDescriptor closedLeaf(int start, int end) {
        return new EdgeDescriptor(start, end, EdgeTarget.LEAF);
    }

    public boolean isOpen() {
        return end == OPEN;
    }

    public boolean isLeaf() {
        return target.isLeaf();
    }

    // Inclusive end, resolving an open end against the last processed index.
    public int effectiveEnd(int lastIndex) {
        return isOpen() ? lastIndex : end;
    }

    public int length(int lastIndex) {
        return effectiveEnd(lastIndex) - start + 1;
    }

    // Same edge with its end pinned, used when resolving leaves against a final length.
    public EdgeDescriptor resolve(int lastIndex) {
        return isOpen() ? new EdgeDescriptor(start, lastIndex, target) : this;
    }

    @Override
    public String toString() {
        return "(" + start + ", " + (isOpen() ? "open" : Integer.toString(end)) + ", " + target + ")";
    }
}
