package com.xpt.exploration;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds equal-length exploration sequences from independent value lists. The first key varies
 * slowest, the last fastest; the result length is the product of the input lengths.
 */
public final class CartesianProduct {

    private CartesianProduct() {
    }

    public static LinkedHashMap<String, List<Object>> of(LinkedHashMap<String, ? extends List<?>> dimensions) {
        LinkedHashMap<String, List<Object>> out = new LinkedHashMap<>();
        if (dimensions.isEmpty()) return out;
        int total = 1;
        for (Map.Entry<String, ? extends List<?>> e : dimensions.entrySet()) {
            if (e.getValue() == null || e.getValue().isEmpty()) {
                throw new IllegalArgumentException("Dimension `" + e.getKey() + "` has no values");
            }
            total = Math.multiplyExact(total, e.getValue().size());
        }
        int repeat = total;
        for (Map.Entry<String, ? extends List<?>> e : dimensions.entrySet()) {
            List<?> values = e.getValue();
            repeat /= values.size();
            List<Object> column = new ArrayList<>(total);
            while (column.size() < total) {
                for (Object v : values) {
                    for (int r = 0; r < repeat; r++) column.add(v);
                }
            }
            out.put(e.getKey(), column);
        }
        return out;
    }
}
