package com.example.demo.xlsxgen.util;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assigns sequential indices to distinct values in first-seen order.
 * Equal values, by {@code equals}, always get the same index.
 */
public class IndexedTable<T> {
    private final Map<T, Integer> indices = new LinkedHashMap<>();
    private final int base;

    public IndexedTable() {
        this(0);
    }

    public IndexedTable(int base) {
        this.base = base;
    }

    public int indexOf(T value) {
        Integer index = indices.get(value);
        if (index == null) {
            index = base + indices.size();
            indices.put(value, index);
        }
        return index;
    }

    public boolean contains(T value) {
        return indices.containsKey(value);
    }

    public int size() {
        return indices.size();
    }

    public List<T> values() {
        return new ArrayList<>(indices.keySet());
    }

    public void clear() {
        indices.clear();
    }
}
