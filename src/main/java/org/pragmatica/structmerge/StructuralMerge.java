package org.pragmatica.structmerge;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.pragmatica.structmerge.diff.StructuralDiffer;
import org.pragmatica.structmerge.error.InvariantViolationException;
import org.pragmatica.structmerge.error.MergeError;
import org.pragmatica.structmerge.error.ParseException;
import org.pragmatica.structmerge.lang.LanguageProfile;
import org.pragmatica.structmerge.lang.LanguageRegistry;
import org.pragmatica.structmerge.matching.Matching;
import org.pragmatica.structmerge.matching.TreeMatcher;
import org.pragmatica.structmerge.merge.ConflictMinimizer;
import org.pragmatica.structmerge.merge.MergeResult;
import org.pragmatica.structmerge.merge.MergedNode;
import org.pragmatica.structmerge.merge.ThreeWayMerger;
import org.pragmatica.structmerge.render.SourceRenderer;
import org.pragmatica.structmerge.tree.Revision;
import org.pragmatica.structmerge.tree.SourceLocation;
import org.pragmatica.structmerge.tree.SyntaxTree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Entry point of the structural merge.
 *
 * <p>Example usage:
 * <pre>{@code
 * var merge = StructuralMerge.withDefaults();
 * var outcome = merge.merge("json", ancestor, left, right);
 *
 * if (outcome instanceof MergeOutcome.Merged merged) {
 *     Files.writeString(target, merged.mergedText());
 * }
 * }</pre>
 *
 * <p>The three revisions are parsed and matched on the configured executor, by default in the
 * calling thread. Inputs the engine cannot handle produce
 * {@link MergeOutcome.StructuralMergeUnavailable}; the caller falls back to another merge method.
 */
public final class StructuralMerge {
    private static final Logger logger = LogManager.getLogger(StructuralMerge.class);

    private final LanguageRegistry registry;
    private final MergeConfig config;
    private final Executor executor;
    private final SourceRenderer renderer;

    private StructuralMerge(LanguageRegistry registry, MergeConfig config, Executor executor) {
        this.registry = registry;
        this.config = config;
        this.executor = executor;
        this.renderer = SourceRenderer.create(config.markerStyle());
    }

    public static StructuralMerge withDefaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public LanguageRegistry registry() {
        return registry;
    }

    public MergeConfig config() {
        return config;
    }

    /**
     * Merge three revisions of a file written in the named language.
     */
    public MergeOutcome merge(String languageName, String ancestor, String left, String right) {
        var language = registry.byName(languageName);
        if (language.isEmpty()) {
            return unavailable(new MergeError.UnsupportedLanguage(languageName));
        }
        return merge(language.get(), ancestor, left, right);
    }

    public MergeOutcome merge(LanguageProfile language, String ancestor, String left, String right) {
        try {
            return mergeTexts(language, Map.of(Revision.ANCESTOR, ancestor, Revision.LEFT, left, Revision.RIGHT, right));
        } catch (InvariantViolationException e) {
            logger.error("Structural merge of {} revisions failed: {}", language.name(), e.getMessage(), e);
            return unavailable(new MergeError.InvariantViolation(e.getMessage()));
        }
    }

    /**
     * Merge again the revisions recorded in a text with conflict markers, for instance the
     * output of a line-based merge. The structural result is returned when it has less conflict
     * mass than the given text, preferring results without additional issues.
     */
    public MergeOutcome solve(String languageName, String conflictedText) {
        var language = registry.byName(languageName);
        if (language.isEmpty()) {
            return unavailable(new MergeError.UnsupportedLanguage(languageName));
        }
        return solve(language.get(), conflictedText);
    }

    public MergeOutcome solve(LanguageProfile language, String conflictedText) {
        ParsedMerge parsed;
        try {
            parsed = ParsedMerge.parse(conflictedText, config.markerStyle());
        } catch (ParseException e) {
            return unavailable(new MergeError.UnreadableConflicts(e.error()));
        }
        var original = new MergeStatistics(parsed.conflictCount(),
                                           parsed.conflictMass(),
                                           false,
                                           MergeStatistics.FROM_PARSED_ORIGINAL);
        var outcome = merge(language,
                            parsed.reconstruct(Revision.ANCESTOR),
                            parsed.reconstruct(Revision.LEFT),
                            parsed.reconstruct(Revision.RIGHT));
        if (!(outcome instanceof MergeOutcome.Merged merged)) {
            return outcome;
        }
        var best = selectBest(List.of(merged.statistics(), original));
        if (best == original) {
            return unavailable(new MergeError.NoBetterSolution(original.conflictCount()));
        }
        logger.info("Solved {} of {} conflict(s)", original.conflictCount() - best.conflictCount(), original.conflictCount());
        return merged;
    }

    /**
     * The candidate with the least conflict mass among those without additional issues, or the
     * one with the least conflict mass if all have issues.
     */
    static MergeStatistics selectBest(List<MergeStatistics> candidates) {
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("No merge candidates to select from");
        }
        var sorted = new ArrayList<>(candidates);
        sorted.sort(Comparator.comparingInt(MergeStatistics::conflictMass));
        for (var candidate : sorted) {
            logger.debug("{}: {} conflict(s), {} mass, has additional issues: {}", candidate.method(),
                         candidate.conflictCount(), candidate.conflictMass(), candidate.hasAdditionalIssues());
        }
        return sorted.stream()
                     .filter(candidate -> !candidate.hasAdditionalIssues())
                     .findFirst()
                     .orElse(sorted.get(0));
    }

    private MergeOutcome mergeTexts(LanguageProfile language, Map<Revision, String> texts) {
        long started = System.nanoTime();
        var parsing = new EnumMap<Revision, CompletableFuture<SyntaxTree>>(Revision.class);
        for (var revision : Revision.values()) {
            parsing.put(revision, async(() -> parse(language, texts.get(revision), revision)));
        }
        var trees = new EnumMap<Revision, SyntaxTree>(Revision.class);
        for (var revision : Revision.values()) {
            try {
                trees.put(revision, await(parsing.get(revision)));
            } catch (ParseException e) {
                return unavailable(new MergeError.ParseFailure(revision, e.error()));
            }
        }
        logger.debug("Parsed {} revisions in {} ms", language.name(), elapsed(started));

        if (config.verifyRoundTrip()) {
            for (var tree : trees.values()) {
                var mismatch = roundTripMismatch(tree);
                if (mismatch.isPresent()) {
                    return unavailable(mismatch.get());
                }
            }
        }

        started = System.nanoTime();
        var matcher = TreeMatcher.create(config.similarityThreshold());
        var ancestor = trees.get(Revision.ANCESTOR);
        var leftMatching = async(() -> matcher.match(ancestor, trees.get(Revision.LEFT)).verify());
        var rightMatching = async(() -> matcher.match(ancestor, trees.get(Revision.RIGHT)).verify());
        var left = joinMatching(leftMatching);
        var right = joinMatching(rightMatching);
        logger.debug("Matched revisions in {} ms", elapsed(started));

        started = System.nanoTime();
        var differ = StructuralDiffer.create();
        var leftScript = differ.diff(ancestor, left.derived(), left);
        var rightScript = differ.diff(ancestor, right.derived(), right);
        var merged = ThreeWayMerger.create().merge(ancestor, leftScript, rightScript);
        var result = ConflictMinimizer.create(merged.tree().classes()).minimize(merged);
        result.tree().verify();
        var text = renderer.render(result);
        logger.debug("Merged and rendered in {} ms", elapsed(started));

        var statistics = statistics(language, result, text);
        if (statistics.hasAdditionalIssues()) {
            logger.warn("Structural merge of {} revisions has issues not shown by conflict markers", language.name());
        }
        return new MergeOutcome.Merged(result, text, statistics);
    }

    private static SyntaxTree parse(LanguageProfile language, String text, Revision revision) {
        try {
            return language.parse(text, revision);
        } catch (ParseException e) {
            throw new CompletionException(e);
        }
    }

    private <T> CompletableFuture<T> async(Supplier<T> task) {
        return CompletableFuture.supplyAsync(task, executor);
    }

    private static SyntaxTree await(CompletableFuture<SyntaxTree> future) throws ParseException {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof ParseException parseException) {
                throw parseException;
            }
            throw rethrow(e);
        }
    }

    private static Matching joinMatching(CompletableFuture<Matching> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            throw rethrow(e);
        }
    }

    private static RuntimeException rethrow(CompletionException e) {
        if (e.getCause() instanceof RuntimeException runtime) {
            return runtime;
        }
        return e;
    }

    private Optional<MergeError> roundTripMismatch(SyntaxTree tree) {
        return roundTripMismatch(tree, renderer.renderExploded(tree));
    }

    /**
     * Compares the text rendered from a parsed tree with the tree's source and locates the first
     * difference.
     */
    static Optional<MergeError> roundTripMismatch(SyntaxTree tree, String rendered) {
        var source = tree.source();
        if (rendered.equals(source)) {
            return Optional.empty();
        }
        int offset = 0;
        int limit = Math.min(rendered.length(), source.length());
        while (offset < limit && rendered.charAt(offset) == source.charAt(offset)) {
            offset++;
        }
        return Optional.of(new MergeError.RoundTripMismatch(tree.revision(), SourceLocation.of(source, offset)));
    }

    // === Statistics ===

    private MergeStatistics statistics(LanguageProfile language, MergeResult result, String text) {
        var classes = result.tree().classes();
        int mass = 0;
        for (var region : result.regions()) {
            mass += renderer.renderSide(region.base(), classes).length()
                    + renderer.renderSide(region.left(), classes).length()
                    + renderer.renderSide(region.right(), classes).length();
        }
        boolean issues = hasDuplicateKeys(result);
        if (!issues && config.checkMergedSyntax()) {
            issues = result.isClean() ? !reparses(language, text) : !revisionsReparse(language, text);
        }
        return new MergeStatistics(result.regions().size(), mass, issues, MergeStatistics.STRUCTURED);
    }

    private static boolean reparses(LanguageProfile language, String text) {
        try {
            language.parse(text, Revision.ANCESTOR);
            return true;
        } catch (ParseException e) {
            logger.warn("Merged {} text does not parse: {}", language.name(), e.getMessage());
            return false;
        }
    }

    /**
     * Whether each revision obtained by picking one side of every conflict parses, without
     * duplicate keys. Two-way markers cannot be read back and are not checked.
     */
    boolean revisionsReparse(LanguageProfile language, String text) {
        if (!config.diff3()) {
            return true;
        }
        ParsedMerge parsed;
        try {
            parsed = ParsedMerge.parse(text, config.markerStyle());
        } catch (ParseException e) {
            logger.warn("Conflict markers of merged {} text cannot be read back: {}", language.name(), e.getMessage());
            return false;
        }
        for (var revision : Revision.values()) {
            try {
                var tree = language.parse(parsed.reconstruct(revision), revision);
                if (hasDuplicateKeys(tree)) {
                    logger.warn("Merged {} text has duplicate keys when taking the {} side", language.name(), revision);
                    return false;
                }
            } catch (ParseException e) {
                logger.warn("Merged {} text does not parse when taking the {} side: {}",
                            language.name(), revision, e.getMessage());
                return false;
            }
        }
        return true;
    }

    private static boolean hasDuplicateKeys(SyntaxTree tree) {
        for (int node = 0; node < tree.size(); node++) {
            if (!tree.traits(node).isUnordered()) {
                continue;
            }
            var keys = new HashSet<String>();
            for (int child : tree.children(node)) {
                var key = tree.identityKey(child);
                if (key.isPresent() && !keys.add(key.get())) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Whether two elements of one unordered node carry the same identity key, like two members
     * of a JSON object with the same name.
     */
    private static boolean hasDuplicateKeys(MergeResult result) {
        var classes = result.tree().classes();
        var pending = new ArrayDeque<MergedNode>();
        pending.push(result.tree().root());
        while (!pending.isEmpty()) {
            var node = pending.pop();
            if (node instanceof MergedNode.Mixed mixed) {
                mixed.children().forEach(pending::push);
            } else if (node instanceof MergedNode.Commutative commutative) {
                var keys = new HashSet<String>();
                for (var element : commutative.elements()) {
                    pending.push(element);
                    if (element instanceof MergedNode.Conflict) {
                        continue;
                    }
                    var id = element.first().orElseThrow();
                    var key = classes.tree(id.revision()).identityKey(id.index());
                    if (key.isPresent() && !keys.add(key.get())) {
                        logger.debug("Duplicate key {} in merged {}", key.get(), classes.kind(commutative.layout()));
                        return true;
                    }
                }
            }
        }
        return false;
    }

    private static long elapsed(long started) {
        return (System.nanoTime() - started) / 1_000_000;
    }

    private static MergeOutcome unavailable(MergeError error) {
        logger.warn("Structural merge unavailable: {}", error.message());
        return new MergeOutcome.StructuralMergeUnavailable(error);
    }

    public static final class Builder {
        private LanguageRegistry registry = LanguageRegistry.builtin();
        private MergeConfig config = MergeConfig.DEFAULT;
        private Executor executor = Runnable::run;

        private Builder() {}

        public Builder registry(LanguageRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder config(MergeConfig config) {
            this.config = config;
            return this;
        }

        public Builder executor(Executor executor) {
            this.executor = executor;
            return this;
        }

        public StructuralMerge build() {
            return new StructuralMerge(registry, config, executor);
        }
    }
}
