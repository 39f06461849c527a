package com.example.rittdoc.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Counts of the rewrites the compliance transformer applied, keyed by rule.
 */
@Data
@NoArgsConstructor
public class TransformReport {
    private Map<String, Integer> fixes = new LinkedHashMap<>();

    public void record(String rule) {
        fixes.merge(rule, 1, Integer::sum);
    }

    public int getTotal() {
        return fixes.values().stream().mapToInt(Integer::intValue).sum();
    }

    public boolean isEmpty() {
        return fixes.isEmpty();
    }
}
