package render;

import graph.EdgeTarget;

import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Read-only projection of a suffix tree for presentation code: the vertices (root marked)
 * and every edge as (source, target or leaf, resolved label).
 */
public final class TreeView<S> {

    public record VertexView(int id, boolean root, OptionalInt suffixLink) {
        public VertexView {
            Objects.requireNonNull(suffixLink, "suffixLink");
        }
    }

    public record EdgeView<S>(int source, EdgeTarget target, int start, List<S> label) {
        public EdgeView {
            Objects.requireNonNull(target, "target");
            label = List.copyOf(label);
        }
    }

    private final List<VertexView> vertices;
    private final List<EdgeView<S>> edges;

    public TreeView(List<VertexView> vertices, List<EdgeView<S>> edges) {
        this.vertices = List.copyOf(vertices);
        this.edges = List.copyOf(edges);
    }

    public List<VertexView> vertices() {
        return vertices;
    }

    public List<EdgeView<S>> edges() {
        return edges;
    }

    public long leafCount() {
        return edges.stream().filter(e -> e.target().isLeaf()).count();
    }
}
