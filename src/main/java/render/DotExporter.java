package render;

import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.function.Function;

/**
 * Writes a {@link TreeView} in the Graphviz DOT language. Internal vertices are circles named
 * by their id, leaves are anonymous points, suffix links are dashed edges.
 */
public final class DotExporter {

    private static final String FG_COLOR = "black";
    private static final String BG_COLOR = "transparent";

    private final String style;
    private final boolean showSuffixLinks;
    private final Function<Object, String> symbolFormatter;
    private final String separator;

    public DotExporter() {
        this(defaultStyle(), true, String::valueOf, "");
    }

    public DotExporter(String style, boolean showSuffixLinks, Function<Object, String> symbolFormatter, String separator) {
        this.style = Objects.requireNonNull(style, "style");
        this.showSuffixLinks = showSuffixLinks;
        this.symbolFormatter = Objects.requireNonNull(symbolFormatter, "symbolFormatter");
        this.separator = Objects.requireNonNull(separator, "separator");
    }

    // Left-to-right layout, circles, transparent background.
    public static String defaultStyle() {
        return "graph[bgcolor = " + BG_COLOR + " fontcolor = " + FG_COLOR + " rankdir = LR]; "
                + "node[color = " + FG_COLOR + " fontcolor = " + FG_COLOR + " shape = circle]; "
                + "edge[color = " + FG_COLOR + " fontcolor = " + FG_COLOR + "]; ";
    }

    public DotExporter withSuffixLinks(boolean show) {
        return new DotExporter(style, show, symbolFormatter, separator);
    }

    // Join symbols with a separator, e.g. " " for word tokens.
    public DotExporter withSeparator(String separator) {
        return new DotExporter(style, showSuffixLinks, symbolFormatter, separator);
    }

    public String export(TreeView<?> view) {
        StringBuilder sb = new StringBuilder(256);
        sb.append("digraph suffix_tree {\n");
        sb.append("  ").append(style).append('\n');

        for (TreeView.VertexView vertex : view.vertices()) {
            sb.append("  ").append(vertex.id());
            if (vertex.root()) {
                sb.append(" [shape = doublecircle]");
            }
            sb.append(";\n");
        }

        int leafId = 0;
        for (TreeView.EdgeView<?> edge : view.edges()) {
            String target;
            if (edge.target().isLeaf()) {
                target = "leaf" + leafId++;
                sb.append("  ").append(target).append(" [shape = point label = \"\"];\n");
            } else {
                target = Integer.toString(edge.target().vertex());
            }
            sb.append("  ").append(edge.source()).append(" -> ").append(target)
                    .append(" [label = \"").append(escape(label(edge.label()))).append("\"];\n");
        }

        if (showSuffixLinks) {
            for (TreeView.VertexView vertex : view.vertices()) {
                OptionalInt link = vertex.suffixLink();
                if (vertex.root() || link.isEmpty()) {
                    continue;
                }
                sb.append("  ").append(vertex.id()).append(" -> ").append(link.getAsInt())
                        .append(" [style = dashed constraint = false];\n");
            }
        }

        sb.append("}\n");
        return sb.toString();
    }

    private String label(List<?> symbols) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < symbols.size(); i++) {
            if (i > 0) {
                sb.append(separator);
            }
            sb.append(symbolFormatter.apply(symbols.get(i)));
        }
        return sb.toString();
    }

    static String escape(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
