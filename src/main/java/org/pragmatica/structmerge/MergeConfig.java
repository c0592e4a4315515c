package org.pragmatica.structmerge;

import org.pragmatica.structmerge.matching.TreeMatcher;
import org.pragmatica.structmerge.render.MarkerStyle;

/**
 * Settings of a structural merge.
 *
 * @param similarityThreshold minimal similarity for matching two nodes that are not identical
 * @param conflictMarkerSize  number of characters of each conflict marker
 * @param diff3               whether conflict blocks show the base content
 * @param leftName            label of the left revision in conflict markers
 * @param baseName            label of the base revision in conflict markers
 * @param rightName           label of the right revision in conflict markers
 * @param verifyRoundTrip     reject inputs whose parsed tree does not render back to their text
 * @param checkMergedSyntax   re-parse clean merge output and report syntax errors as an issue
 * @param parallelism         number of files merged concurrently by {@link BatchMerger}
 */
public record MergeConfig(double similarityThreshold,
                          int conflictMarkerSize,
                          boolean diff3,
                          String leftName,
                          String baseName,
                          String rightName,
                          boolean verifyRoundTrip,
                          boolean checkMergedSyntax,
                          int parallelism) {

    public static final MergeConfig DEFAULT = builder().build();

    public MergeConfig {
        if (similarityThreshold < 0.0 || similarityThreshold > 1.0) {
            throw new IllegalArgumentException("Similarity threshold must be within [0, 1], got " + similarityThreshold);
        }
        if (conflictMarkerSize < 1) {
            throw new IllegalArgumentException("Conflict marker size must be positive, got " + conflictMarkerSize);
        }
        if (parallelism < 1) {
            throw new IllegalArgumentException("Parallelism must be positive, got " + parallelism);
        }
    }

    public MarkerStyle markerStyle() {
        return new MarkerStyle(conflictMarkerSize, diff3, leftName, baseName, rightName);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder().similarityThreshold(similarityThreshold)
                            .conflictMarkerSize(conflictMarkerSize)
                            .diff3(diff3)
                            .revisionNames(leftName, baseName, rightName)
                            .verifyRoundTrip(verifyRoundTrip)
                            .checkMergedSyntax(checkMergedSyntax)
                            .parallelism(parallelism);
    }

    public static final class Builder {
        private double similarityThreshold = TreeMatcher.DEFAULT_THRESHOLD;
        private int conflictMarkerSize = MarkerStyle.DEFAULT.size();
        private boolean diff3 = MarkerStyle.DEFAULT.diff3();
        private String leftName = MarkerStyle.DEFAULT.leftName();
        private String baseName = MarkerStyle.DEFAULT.baseName();
        private String rightName = MarkerStyle.DEFAULT.rightName();
        private boolean verifyRoundTrip = true;
        private boolean checkMergedSyntax = true;
        private int parallelism = Runtime.getRuntime().availableProcessors();

        private Builder() {}

        public Builder similarityThreshold(double threshold) {
            this.similarityThreshold = threshold;
            return this;
        }

        public Builder conflictMarkerSize(int size) {
            this.conflictMarkerSize = size;
            return this;
        }

        public Builder diff3(boolean enabled) {
            this.diff3 = enabled;
            return this;
        }

        public Builder revisionNames(String left, String base, String right) {
            this.leftName = left;
            this.baseName = base;
            this.rightName = right;
            return this;
        }

        public Builder verifyRoundTrip(boolean enabled) {
            this.verifyRoundTrip = enabled;
            return this;
        }

        public Builder checkMergedSyntax(boolean enabled) {
            this.checkMergedSyntax = enabled;
            return this;
        }

        public Builder parallelism(int threads) {
            this.parallelism = threads;
            return this;
        }

        public MergeConfig build() {
            return new MergeConfig(similarityThreshold,
                                   conflictMarkerSize,
                                   diff3,
                                   leftName,
                                   baseName,
                                   rightName,
                                   verifyRoundTrip,
                                   checkMergedSyntax,
                                   parallelism);
        }
    }
}
