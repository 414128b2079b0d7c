package org.Aayush.wayfinder.core.id;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Name-to-index mapper backed by a fastutil open hash map.
 * <p>
 * Used for named nodes such as transit stations. Immutable and safe for concurrent reads.
 */
public class FastUtilIDMapper implements IDMapper {

    private static final int MISSING = -1;

    // name -> index
    private final Object2IntOpenHashMap<String> forward;
    // index -> name
    private final String[] reverse;

    /**
     * Constructs the mapper from a standard Java Map.
     * Validates that the indices are dense and 0-indexed.
     */
    public FastUtilIDMapper(Map<String, Integer> mappings) {
        if (mappings == null) {
            throw new IllegalArgumentException("Mappings cannot be null");
        }
        int size = mappings.size();
        this.forward = new Object2IntOpenHashMap<>(size);
        this.forward.defaultReturnValue(MISSING);
        this.reverse = new String[size];

        for (Map.Entry<String, Integer> entry : mappings.entrySet()) {
            String key = requireName(entry.getKey());
            int value = checkedIndex(entry.getValue(), size, reverse);
            forward.put(key, value);
            reverse[value] = key;
        }
        forward.trim();
    }

    /**
     * Builds a mapper from names given in index order.
     *
     * @throws IllegalArgumentException when a name is blank or repeated.
     */
    static FastUtilIDMapper ofNames(List<String> names) {
        if (names == null) {
            throw new IllegalArgumentException("Names cannot be null");
        }
        Map<String, Integer> mappings = new LinkedHashMap<>(names.size() * 2);
        for (int i = 0; i < names.size(); i++) {
            String name = requireName(names.get(i));
            if (mappings.putIfAbsent(name, i) != null) {
                throw new IllegalArgumentException("Duplicate external ID: " + name);
            }
        }
        return new FastUtilIDMapper(mappings);
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("External IDs must be non-blank");
        }
        return name;
    }

    private static int checkedIndex(Integer boxed, int size, String[] reverse) {
        if (boxed == null) {
            throw new IllegalArgumentException("Internal index cannot be null");
        }
        int value = boxed;
        if (value < 0 || value >= size) {
            throw new IllegalArgumentException(
                    "Input indices must be dense and 0-indexed. Found out of bounds: " + value
            );
        }
        if (reverse[value] != null) {
            throw new IllegalArgumentException(
                    "Duplicate internal index detected in input map: " + value
            );
        }
        return value;
    }

    @Override
    public int toInternal(String externalId) throws UnknownIDException {
        int id = forward.getInt(externalId);
        if (id == MISSING) {
            throw new UnknownIDException("External ID not found: " + externalId);
        }
        return id;
    }

    @Override
    public String toExternal(int internalId) {
        if (!containsInternal(internalId)) {
            throw new IndexOutOfBoundsException("Internal ID out of bounds: " + internalId);
        }
        return reverse[internalId];
    }

    @Override
    public boolean containsExternal(String externalId) {
        return forward.containsKey(externalId);
    }

    @Override
    public boolean containsInternal(int internalId) {
        return internalId >= 0 && internalId < reverse.length;
    }

    @Override
    public int size() {
        return reverse.length;
    }
}
