package org.tanzu.fleetinventory.model;

import java.util.List;

/**
 * Field-level merge helpers for the record groups. The stronger value wins; the weaker one only fills gaps.
 */
final class MergeSupport {

    private MergeSupport() {
    }

    static <V> V first(V stronger, V weaker) {
        return stronger != null ? stronger : weaker;
    }

    static <V> List<V> firstNonEmpty(List<V> stronger, List<V> weaker) {
        return stronger != null && !stronger.isEmpty() ? stronger : weaker;
    }

    static <V> List<V> copyOf(List<V> values) {
        return values == null ? null : List.copyOf(values);
    }
}
