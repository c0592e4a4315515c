package org.pragmatica.structmerge.merge;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a three-way merge: a clean merged tree, or a merged tree containing conflict
 * regions, which are also available keyed by their anchor.
 */
public sealed interface MergeResult {

    MergedTree tree();

    default boolean isClean() {
        return this instanceof Clean;
    }

    default List<ConflictRegion> regions() {
        return tree().conflicts();
    }

    static MergeResult of(MergedTree tree) {
        var regions = tree.conflicts();
        if (regions.isEmpty()) {
            return new Clean(tree);
        }
        var conflicts = new LinkedHashMap<ConflictAnchor, ConflictRegion>();
        for (var region : regions) {
            conflicts.putIfAbsent(region.anchor(), region);
        }
        return new Conflicted(conflicts, tree);
    }

    record Clean(MergedTree tree) implements MergeResult {}

    record Conflicted(Map<ConflictAnchor, ConflictRegion> conflicts, MergedTree tree) implements MergeResult {
        public Conflicted {
            conflicts = Collections.unmodifiableMap(new LinkedHashMap<>(conflicts));
        }
    }
}
