package org.pragmatica.structmerge;

/**
 * Figures describing a merge, used to compare it with other merge methods.
 *
 * @param conflictCount       number of conflict regions
 * @param conflictMass        total number of characters inside the sides of all conflicts
 * @param hasAdditionalIssues the output has problems conflict markers do not show
 * @param method              name of the merge method
 */
public record MergeStatistics(int conflictCount, int conflictMass, boolean hasAdditionalIssues, String method) {
    public static final String STRUCTURED = "structured";
    public static final String FROM_PARSED_ORIGINAL = "from_parsed_original";

    public boolean isClean() {
        return conflictCount == 0;
    }
}
