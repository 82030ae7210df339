package tree;

import graph.EdgeDescriptor;
import graph.InvariantViolationException;
import graph.LabeledEdgeGraph;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.Objects;

/**
 * Canonical cursor into a suffix tree under construction.
 *
 * The point denotes the factor spelled by {@code vertex} followed by word[pos, pos + len).
 * With {@code len == 0} the point is explicit (it sits on {@code vertex}, and {@code pos} is
 * kept at 0). Otherwise it lies strictly inside the edge of {@code vertex} keyed by
 * word[pos], and {@code len} is smaller than that edge's length.
 *
 * Open leaf edges are measured against the last symbol of {@code word}, so callers must
 * append the symbol of a phase to the word before running the phase.
 */
public final class ActivePoint {

    private final LabeledEdgeGraph graph;
    private final IntList word;

    private int vertex = LabeledEdgeGraph.ROOT;
    private int pos;
    private int len;

    private long suffixMoves;
    private long canonicalHops;

    public ActivePoint(LabeledEdgeGraph graph, IntList word) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.word = Objects.requireNonNull(word, "word");
    }

    public int vertex() {
        return vertex;
    }

    public int pos() {
        return pos;
    }

    public int length() {
        return len;
    }

    public long suffixMoves() {
        return suffixMoves;
    }

    public long canonicalHops() {
        return canonicalHops;
    }

    public ActivePointState state() {
        return new ActivePointState(vertex, pos, len);
    }

    public boolean isExplicit() {
        return len == 0;
    }

    public boolean isRoot() {
        return vertex == LabeledEdgeGraph.ROOT && pos == 0 && len == 0;
    }

    /**
     * Whether the point can be extended by word[position]. This is the show-stopper test:
     * true means the current suffix followed by that symbol already occurs in the tree.
     */
    public boolean hasOutgoing(int position) {
        int symbol = word.getInt(position);
        if (isExplicit()) {
            return graph.hasEdge(vertex, symbol);
        }
        EdgeDescriptor edge = currentEdge();
        return word.getInt(edge.start() + len) == symbol;
    }

    /**
     * Push the point down while it covers a whole edge. Only internal edges can be crossed;
     * reaching the end of a leaf edge means the point was built from a broken tree.
     */
    public void canonicalize() {
        int lastIndex = word.size() - 1;
        while (len > 0) {
            EdgeDescriptor edge = currentEdge();
            int edgeLength = edge.length(lastIndex);
            if (len < edgeLength) {
                return;
            }
            if (edge.isLeaf()) {
                throw new InvariantViolationException(
                        "active point " + this + " runs past leaf edge " + edge);
            }
            vertex = edge.target().vertex();
            pos += edgeLength;
            len -= edgeLength;
            canonicalHops++;
        }
        pos = 0;
    }

    /**
     * Move to the point spelling the current factor without its first symbol.
     * From the root this drops one symbol of the pending walk; elsewhere it follows the
     * vertex's suffix link. The result is canonical.
     */
    public void moveToSuffix() {
        if (isRoot()) {
            throw new InvariantViolationException("cannot move to the suffix of the root");
        }
        suffixMoves++;
        if (vertex == LabeledEdgeGraph.ROOT) {
            len--;
            if (len == 0) {
                pos = 0;
            } else {
                pos++;
            }
        } else {
            int from = vertex;
            vertex = graph.suffixLink(from).orElseThrow(() ->
                    new InvariantViolationException("vertex " + from + " has no suffix link yet"));
        }
        canonicalize();
    }

    /**
     * Make the point explicit and return its vertex. An implicit point splits its edge: a new
     * vertex is inserted after {@code len} symbols and the remainder of the edge hangs below it.
     * The point itself keeps its coordinates relative to the old vertex.
     */
    public int splitEdge() {
        if (isExplicit()) {
            return vertex;
        }
        int symbol = word.getInt(pos);
        EdgeDescriptor edge = graph.edge(vertex, symbol);
        int splitAt = edge.start() + len;

        int middle = graph.addVertex();
        graph.setEdge(vertex, symbol, EdgeDescriptor.internal(edge.start(), splitAt - 1, middle));
        graph.setEdge(middle, word.getInt(splitAt), new EdgeDescriptor(splitAt, edge.end(), edge.target()));
        return middle;
    }

    // Read word[position] past the point, then canonicalize.
    public void elongate(int position) {
        if (isExplicit()) {
            pos = position;
            len = 1;
        } else {
            len++;
        }
        canonicalize();
    }

    private EdgeDescriptor currentEdge() {
        return graph.edge(vertex, word.getInt(pos));
    }

    @Override
    public String toString() {
        return state().toString();
    }
}
