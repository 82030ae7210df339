package tree;

/** Immutable snapshot of an active point: {@code len} symbols from {@code pos}, read from {@code vertex}. */
public record ActivePointState(int vertex, int pos, int len) {

    public boolean isExplicit() {
        return len == 0;
    }

    @Override
    public String toString() {
        return "(vertex=" + vertex + ", pos=" + pos + ", len=" + len + ")";
    }
}
