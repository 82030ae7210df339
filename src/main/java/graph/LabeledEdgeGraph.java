package graph;

import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMaps;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.ArrayList;
import java.util.OptionalInt;

/**
 * Growable arena of vertices. Each vertex owns a map from the integer code of a leading
 * symbol to the descriptor of the edge starting with that symbol, and may carry a suffix
 * link to another vertex. Vertices are never removed.
 *
 * The graph holds no algorithmic logic: the active point and the builder decide what is
 * stored here.
 */
public final class LabeledEdgeGraph {

    public static final int ROOT = 0;

    private static final int NO_LINK = -1;

    // Outgoing edges per vertex, indexed by vertex id.
    private final ArrayList<Int2ObjectOpenHashMap<EdgeDescriptor>> adjacencies;

    // Suffix link per vertex, NO_LINK when not (yet) known.
    private final IntArrayList suffixLinks;

    private int edgeCount;

    public LabeledEdgeGraph() {
        this(16);
    }

    public LabeledEdgeGraph(int expectedVertices) {
        int capacity = Math.max(1, expectedVertices);
        this.adjacencies = new ArrayList<>(capacity);
        this.suffixLinks = new IntArrayList(capacity);
        addVertex();
        suffixLinks.set(ROOT, ROOT);
    }

    // Append a vertex without edges and return its id.
    public int addVertex() {
        adjacencies.add(new Int2ObjectOpenHashMap<>(4));
        suffixLinks.add(NO_LINK);
        return adjacencies.size() - 1;
    }

    public int vertexCount() {
        return adjacencies.size();
    }

    public int edgeCount() {
        return edgeCount;
    }

    public boolean hasEdge(int vertex, int symbol) {
        return adjacency(vertex).containsKey(symbol);
    }

    /**
     * Return the edge of {@code vertex} keyed by {@code symbol}.
     *
     * @throws MissingEdgeException if there is no such edge
     */
    public EdgeDescriptor edge(int vertex, int symbol) {
        EdgeDescriptor edge = adjacency(vertex).get(symbol);
        if (edge == null) {
            throw new MissingEdgeException(vertex, symbol);
        }
        return edge;
    }

    // Insert or overwrite the edge keyed by symbol.
    public void setEdge(int vertex, int symbol, EdgeDescriptor descriptor) {
        if (descriptor == null) {
            throw new IllegalArgumentException("descriptor cannot be null");
        }
        if (!descriptor.isLeaf()) {
            checkVertex(descriptor.target().vertex());
        }
        if (adjacency(vertex).put(symbol, descriptor) == null) {
            edgeCount++;
        }
    }

    // Read-only view of the outgoing edges of a vertex, keyed by symbol code.
    public Int2ObjectMap<EdgeDescriptor> edges(int vertex) {
        return Int2ObjectMaps.unmodifiable(adjacency(vertex));
    }

    public OptionalInt suffixLink(int vertex) {
        checkVertex(vertex);
        int link = suffixLinks.getInt(vertex);
        return link == NO_LINK ? OptionalInt.empty() : OptionalInt.of(link);
    }

    public void setSuffixLink(int vertex, int target) {
        checkVertex(vertex);
        checkVertex(target);
        suffixLinks.set(vertex, target);
    }

    // Deep copy; descriptors are immutable and shared.
    public LabeledEdgeGraph copy() {
        LabeledEdgeGraph copy = new LabeledEdgeGraph(vertexCount());
        copy.adjacencies.clear();
        copy.suffixLinks.clear();
        for (int v = 0; v < vertexCount(); v++) {
            copy.adjacencies.add(new Int2ObjectOpenHashMap<>(adjacencies.get(v)));
            copy.suffixLinks.add(suffixLinks.getInt(v));
        }
        copy.edgeCount = edgeCount;
        return copy;
    }

    private Int2ObjectOpenHashMap<EdgeDescriptor> adjacency(int vertex) {
        checkVertex(vertex);
        return adjacencies.get(vertex);
    }

    private void checkVertex(int vertex) {
        if (vertex < 0 || vertex >= adjacencies.size()) {
            throw new InvariantViolationException(
                    "unknown vertex " + vertex + " (vertex count " + adjacencies.size() + ")");
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int v = 0; v < vertexCount(); v++) {
            sb.append(v).append(": ").append(adjacencies.get(v));
            int link = suffixLinks.getInt(v);
            if (link != NO_LINK) {
                sb.append(" suffix=").append(link);
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
