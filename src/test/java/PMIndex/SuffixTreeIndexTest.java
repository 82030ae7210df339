package PMIndex;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tree.ActivePointState;
import tree.LeafEndMode;
import tree.SuffixTreeConfiguration;
import tree.TreeValidator;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SuffixTreeIndexTest {

    private SuffixTreeIndex index;

    @BeforeEach
    void setUp() {
        index = new SuffixTreeIndex();
        for (String token : "to be or not to be".split(" ")) {
            index.insert(token);
        }
    }

    @Test
    void reportsTokenOffsets() {
        assertEquals(6, index.size());
        assertEquals(List.of(0, 4), index.report(List.of("to", "be")));
        assertEquals(List.of(2), index.report(List.of("or", "not")));
        assertEquals(List.of(), index.report(List.of("be", "to")));
        assertEquals(List.of(0, 1, 2, 3, 4, 5, 6), index.report(List.of()));
    }

    @Test
    void existsFollowsReport() {
        assertTrue(index.exists(List.of("not", "to", "be")));
        assertFalse(index.exists(List.of("question")));
    }

    @Test
    void queriesSeeTokensInsertedAfterAnEarlierQuery() {
        assertFalse(index.exists(List.of("be", "that")));
        index.insert("that");
        assertTrue(index.exists(List.of("be", "that")));
        assertEquals(List.of(4), index.report(List.of("to", "be", "that")));
    }

    @Test
    void emptyTokensAreIgnored() {
        index.insert("");
        index.insert(null);
        assertEquals(6, index.size());
    }

    @Test
    void activePointTracksTheRepeatedSuffix() {
        assertEquals(new ActivePointState(0, 4, 2), index.activePoint());
        assertEquals(6, index.stats().symbols());
        TreeValidator.validate(index.tree());
    }

    @Test
    void expireStartsOver() {
        index.expire();
        assertEquals(0, index.size());
        assertFalse(index.exists(List.of("to")));
        index.insert("to");
        assertEquals(List.of(0), index.report(List.of("to")));
    }

    @Test
    void memoryReportsCoverTheBuilder() {
        assertTrue(index.jolMemoryReport(false).totalBytes() > 0);
        assertTrue(index.jolMemorySummary().startsWith("Tokens: 6  Total: "));
    }

    @Test
    void fixedLeafEndsAreRejected() {
        SuffixTreeConfiguration fixed = SuffixTreeConfiguration.builder().leafEndMode(LeafEndMode.FIXED).build();
        assertThrows(IllegalArgumentException.class, () -> new SuffixTreeIndex(fixed));
    }
}
