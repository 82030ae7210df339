package utilities;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

import java.util.Objects;

/**
 * Dense integer coding of an arbitrary alphabet. Symbols receive codes 0, 1, 2, ... in the
 * order they are first seen, so the suffix tree can key its edges by primitive ints.
 */
public class AlphabetMapper<T> {

    public static final int UNKNOWN = -1;

    private static final float LOAD_FACTOR = 0.75f;

    // Primitive map to avoid boxing on every edge lookup.
    private final Object2IntOpenHashMap<T> symbolToId;

    // Reverse direction, indexed by code.
    private final ObjectArrayList<T> idToSymbol;

    public AlphabetMapper() {
        this(16);
    }

    public AlphabetMapper(int capacity) {
        int expected = Math.max(1, capacity);
        this.symbolToId = new Object2IntOpenHashMap<>(expected, LOAD_FACTOR);
        this.symbolToId.defaultReturnValue(UNKNOWN);
        this.idToSymbol = new ObjectArrayList<>(expected);
    }

    public int getSize() {
        return idToSymbol.size();
    }

    // Insert-on-miss mapping.
    public int getId(T symbol) {
        Objects.requireNonNull(symbol, "symbol");
        int id = symbolToId.getInt(symbol);
        if (id == UNKNOWN) {
            id = idToSymbol.size();
            symbolToId.put(symbol, id);
            idToSymbol.add(symbol);
        }
        return id;
    }

    // Lookup without inserting; UNKNOWN for symbols never seen.
    public int lookup(T symbol) {
        if (symbol == null) {
            return UNKNOWN;
        }
        return symbolToId.getInt(symbol);
    }

    public T symbol(int id) {
        if (id < 0 || id >= idToSymbol.size()) {
            throw new IllegalArgumentException("unknown symbol code " + id);
        }
        return idToSymbol.get(id);
    }

    public AlphabetMapper<T> copy() {
        AlphabetMapper<T> copy = new AlphabetMapper<>(getSize());
        for (T symbol : idToSymbol) {
            copy.getId(symbol);
        }
        return copy;
    }
}
