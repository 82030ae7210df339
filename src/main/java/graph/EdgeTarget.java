package graph;

/**
 * Where an edge leads: either an internal vertex of the graph or a leaf.
 * Leaves are not materialized as vertices, so a leaf target carries no id.
 */
public final class EdgeTarget {

    private static final int NO_VERTEX = -1;

    public static final EdgeTarget LEAF = new EdgeTarget(NO_VERTEX);

    private final int vertex;

    private EdgeTarget(int vertex) {
        this.vertex = vertex;
    }

    public static EdgeTarget internal(int vertex) {
        if (vertex < 0) {
            throw new IllegalArgumentException("vertex id must be non-negative: " + vertex);
        }
        return new EdgeTarget(vertex);
    }

    public boolean isLeaf() {
        return vertex == NO_VERTEX;
    }

    /**
     * Return the target vertex id.
     *
     * @throws InvariantViolationException if this target is a leaf
     */
    public int vertex() {
        if (isLeaf()) {
            throw new InvariantViolationException("leaf target has no vertex");
        }
        return vertex;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EdgeTarget)) return false;
        return vertex == ((EdgeTarget) o).vertex;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(vertex);
    }

    @Override
    public String toString() {
        return isLeaf() ? "leaf" : Integer.toString(vertex);
    }
}
