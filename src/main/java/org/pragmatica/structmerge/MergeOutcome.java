package org.pragmatica.structmerge;

import org.pragmatica.structmerge.error.MergeError;
import org.pragmatica.structmerge.merge.MergeResult;

import java.util.Optional;

/**
 * Result of {@link StructuralMerge#merge}: merged text, possibly with conflicts, or the reason
 * why the structural merge could not be performed.
 */
public sealed interface MergeOutcome {

    default Optional<String> text() {
        return this instanceof Merged merged ? Optional.of(merged.mergedText()) : Optional.empty();
    }

    record Merged(MergeResult result, String mergedText, MergeStatistics statistics) implements MergeOutcome {
        public boolean isClean() {
            return result.isClean();
        }
    }

    record StructuralMergeUnavailable(MergeError error) implements MergeOutcome {}
}
