package tree;

import graph.EdgeDescriptor;
import graph.InvariantViolationException;
import graph.LabeledEdgeGraph;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntLists;
import utilities.AlphabetMapper;
import utilities.SuffixTreeLogger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Online suffix tree construction (Ukkonen, "On-line construction of suffix trees").
 *
 * Every appended symbol runs one phase. The active point persists across phases in canonical
 * form and always denotes the longest suffix of the processed prefix that occurs at least
 * twice. A phase either absorbs the new symbol into that suffix (show-stopper) or attaches
 * leaves while walking down the chain of shorter suffixes through suffix links.
 *
 * Leaf edges are created open ended, so they grow with the word at no cost. No terminal
 * sentinel is appended: suffixes that also occur elsewhere end inside the tree instead of at
 * a leaf.
 *
 * Builders are single threaded. Snapshots are independent copies and stay valid while the
 * builder keeps growing.
 */
public final class SuffixTreeBuilder<S> {

    private static final int UNBOUNDED = -1;

    private final SuffixTreeConfiguration configuration;
    private final AlphabetMapper<S> mapper;
    private final ArrayList<S> symbols;
    private final IntArrayList codes;
    private final LabeledEdgeGraph graph;
    private final ActivePoint activePoint;

    // Word length that FIXED leaf ends were pinned to, UNBOUNDED in OPEN mode.
    private final int fixedLength;

    private int leaves;
    private boolean broken;

    /**
     * Incremental builder with open leaf ends.
     *
     * @throws IllegalArgumentException if the configuration asks for fixed leaf ends, which
     *                                  need the whole word up front (use {@link #build(List, SuffixTreeConfiguration)})
     */
    public SuffixTreeBuilder(SuffixTreeConfiguration configuration) {
        this(configuration, UNBOUNDED);
        if (configuration.leafEndMode() == LeafEndMode.FIXED) {
            throw new IllegalArgumentException("fixed leaf ends require the whole word; use SuffixTreeBuilder.build");
        }
    }

    public SuffixTreeBuilder() {
        this(SuffixTreeConfiguration.defaults());
    }

    private SuffixTreeBuilder(SuffixTreeConfiguration configuration, int fixedLength) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.fixedLength = fixedLength;
        int capacity = fixedLength > 0 ? fixedLength : configuration.initialCapacity();
        this.mapper = new AlphabetMapper<>();
        this.symbols = new ArrayList<>(capacity);
        this.codes = new IntArrayList(capacity);
        this.graph = new LabeledEdgeGraph(capacity);
        this.activePoint = new ActivePoint(graph, IntLists.unmodifiable(codes));
    }

    public static <S> SuffixTree<S> build(List<S> word) {
        return build(word, SuffixTreeConfiguration.defaults());
    }

    // One-shot construction; the only entry point that supports FIXED leaf ends.
    public static <S> SuffixTree<S> build(List<S> word, SuffixTreeConfiguration configuration) {
        Objects.requireNonNull(word, "word");
        Objects.requireNonNull(configuration, "configuration");
        int fixed = configuration.leafEndMode() == LeafEndMode.FIXED ? word.size() : UNBOUNDED;
        SuffixTreeBuilder<S> builder = new SuffixTreeBuilder<>(configuration, fixed);
        builder.appendAll(word);
        return builder.snapshot();
    }

    public static SuffixTree<Character> build(CharSequence text) {
        return build(text, SuffixTreeConfiguration.defaults());
    }

    public static SuffixTree<Character> build(CharSequence text, SuffixTreeConfiguration configuration) {
        Objects.requireNonNull(text, "text");
        List<Character> word = new ArrayList<>(text.length());
        for (int i = 0; i < text.length(); i++) {
            word.add(text.charAt(i));
        }
        return build(word, configuration);
    }

    /**
     * Append one symbol and run its phase.
     *
     * @throws InvariantViolationException if the construction breaks an invariant; the builder
     *                                     is unusable afterwards
     */
    public void append(S symbol) {
        Objects.requireNonNull(symbol, "symbol");
        if (broken) {
            throw new IllegalStateException("builder aborted after an invariant violation");
        }
        if (fixedLength != UNBOUNDED && codes.size() == fixedLength) {
            throw new IllegalStateException("fixed leaf ends were pinned to " + fixedLength + " symbols");
        }
        int position = codes.size();
        codes.add(mapper.getId(symbol));
        symbols.add(symbol);
        try {
            extend(position);
        } catch (InvariantViolationException e) {
            broken = true;
            String message = "invariant violated in phase " + position + " (symbol " + symbol
                    + ", active point " + activePoint + "): " + e.getMessage();
            SuffixTreeLogger.error(message, e);
            throw new InvariantViolationException(message, e);
        }
    }

    public void appendAll(Iterable<? extends S> word) {
        for (S symbol : word) {
            append(symbol);
        }
    }

    private void extend(int position) {
        if (configuration.traceLogging()) {
            SuffixTreeLogger.trace("phase " + position + " symbol=" + symbols.get(position)
                    + " activePoint=" + activePoint);
        }

        if (activePoint.hasOutgoing(position)) {
            activePoint.elongate(position);
            return;
        }
        if (activePoint.isRoot()) {
            attachLeaf(position);
            return;
        }

        int previous = attachLeaf(position);
        activePoint.moveToSuffix();
        while (!activePoint.hasOutgoing(position) && !activePoint.isRoot()) {
            int explicit = attachLeaf(position);
            graph.setSuffixLink(previous, explicit);
            previous = explicit;
            activePoint.moveToSuffix();
        }

        // Close the suffix link chain of this phase.
        if (activePoint.hasOutgoing(position)) {
            graph.setSuffixLink(previous, activePoint.vertex());
            activePoint.elongate(position);
        } else {
            graph.setSuffixLink(previous, LabeledEdgeGraph.ROOT);
            attachLeaf(position);
        }
    }

    // Make the active point explicit and hang a leaf for word[position] below it.
    private int attachLeaf(int position) {
        int explicit = activePoint.splitEdge();
        EdgeDescriptor leaf = fixedLength == UNBOUNDED
                ? EdgeDescriptor.openLeaf(position)
                : EdgeDescriptor.closedLeaf(position, fixedLength - 1);
        graph.setEdge(explicit, codes.getInt(position), leaf);
        leaves++;
        if (configuration.traceLogging()) {
            SuffixTreeLogger.trace("  leaf " + leaf + " under vertex " + explicit);
        }
        return explicit;
    }

    /**
     * Copy of the tree for the processed prefix.
     *
     * @throws InvariantViolationException when {@code verifyInvariants} is configured and the
     *                                     tree fails validation
     */
    public SuffixTree<S> snapshot() {
        SuffixTree<S> tree = new SuffixTree<>(graph.copy(), new ArrayList<>(symbols), mapper.copy(),
                new IntArrayList(codes), activePoint.state(), configuration.leafEndMode());
        if (configuration.verifyInvariants()) {
            TreeValidator.validate(tree);
        }
        SuffixTreeLogger.debug("snapshot after " + codes.size() + " symbols: " + stats());
        return tree;
    }

    public int length() {
        return codes.size();
    }

    // Live active point; read it, do not move it.
    public ActivePointState activePoint() {
        return activePoint.state();
    }

    public BuildStats stats() {
        return new BuildStats(codes.size(), graph.vertexCount(), leaves,
                activePoint.suffixMoves(), activePoint.canonicalHops());
    }

    // Live graph, for tests that need to corrupt a tree under construction.
    LabeledEdgeGraph graph() {
        return graph;
    }
}
