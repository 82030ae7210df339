package graph;

// Thrown by LabeledEdgeGraph.edge when the requested transition does not exist.
public final class MissingEdgeException extends InvariantViolationException {

    private final int vertex;
    private final int symbol;

    public MissingEdgeException(int vertex, int symbol) {
        super("vertex " + vertex + " has no edge keyed by symbol code " + symbol);
        this.vertex = vertex;
        this.symbol = symbol;
    }

    public int getVertex() {
        return vertex;
    }

    public int getSymbol() {
        return symbol;
    }
}
