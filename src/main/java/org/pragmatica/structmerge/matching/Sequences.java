package org.pragmatica.structmerge.matching;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.BiPredicate;

/**
 * Subsequence algorithms shared by the matcher, the differ and the merger.
 */
public final class Sequences {
    private static final long MAX_TABLE_CELLS = 4_000_000L;

    private Sequences() {}

    /**
     * Positions of a longest strictly increasing subsequence of {@code values}. Negative values
     * stand for absent entries and never take part. Among several longest subsequences the one
     * ending with the smallest values is chosen, which makes the result deterministic.
     */
    public static int[] longestIncreasing(int[] values) {
        var tails = new int[values.length];
        var predecessors = new int[values.length];
        int length = 0;

        for (int i = 0; i < values.length; i++) {
            if (values[i] < 0) {
                continue;
            }
            int low = 0;
            int high = length;
            while (low < high) {
                int middle = (low + high) >>> 1;
                if (values[tails[middle]] < values[i]) {
                    low = middle + 1;
                } else {
                    high = middle;
                }
            }
            predecessors[i] = low > 0 ? tails[low - 1] : -1;
            tails[low] = i;
            if (low == length) {
                length++;
            }
        }

        var result = new int[length];
        int position = length > 0 ? tails[length - 1] : -1;
        for (int k = length - 1; k >= 0; k--) {
            result[k] = position;
            position = predecessors[position];
        }
        return result;
    }

    /**
     * Pairs {@code (i, j)} of a longest common subsequence of two sequences of the given lengths
     * under the supplied equality. Falls back to greedy in-order pairing when the dynamic
     * programming table would be too large.
     */
    public static List<int[]> commonSubsequence(int leftLength, int rightLength, BiPredicate<Integer, Integer> equal) {
        if ((long) (leftLength + 1) * (rightLength + 1) > MAX_TABLE_CELLS) {
            return greedyPairs(leftLength, rightLength, equal);
        }
        var table = new int[leftLength + 1][rightLength + 1];
        for (int i = leftLength - 1; i >= 0; i--) {
            for (int j = rightLength - 1; j >= 0; j--) {
                table[i][j] = equal.test(i, j)
                              ? table[i + 1][j + 1] + 1
                              : Math.max(table[i + 1][j], table[i][j + 1]);
            }
        }
        var pairs = new ArrayList<int[]>();
        int i = 0;
        int j = 0;
        while (i < leftLength && j < rightLength) {
            if (equal.test(i, j) && table[i][j] == table[i + 1][j + 1] + 1) {
                pairs.add(new int[]{i, j});
                i++;
                j++;
            } else if (table[i + 1][j] >= table[i][j + 1]) {
                i++;
            } else {
                j++;
            }
        }
        return pairs;
    }

    private static List<int[]> greedyPairs(int leftLength, int rightLength, BiPredicate<Integer, Integer> equal) {
        var pairs = new ArrayList<int[]>();
        var used = new boolean[rightLength];
        int from = 0;
        for (int i = 0; i < leftLength; i++) {
            for (int j = from; j < rightLength; j++) {
                if (!used[j] && equal.test(i, j)) {
                    used[j] = true;
                    pairs.add(new int[]{i, j});
                    from = j + 1;
                    break;
                }
            }
        }
        return pairs;
    }

    static int[] filled(int length, int value) {
        var array = new int[length];
        Arrays.fill(array, value);
        return array;
    }
}
