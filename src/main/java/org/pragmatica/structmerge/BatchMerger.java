package org.pragmatica.structmerge;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.pragmatica.structmerge.error.MergeError;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Merges many files concurrently, choosing the language of each file from its path.
 */
public final class BatchMerger implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(BatchMerger.class);

    private final StructuralMerge merge;
    private final ExecutorService executor;

    private BatchMerger(StructuralMerge merge, ExecutorService executor) {
        this.merge = merge;
        this.executor = executor;
    }

    /**
     * Batch merger running on a fixed pool sized by {@link MergeConfig#parallelism()}.
     */
    public static BatchMerger create(StructuralMerge merge) {
        return new BatchMerger(merge, Executors.newFixedThreadPool(merge.config().parallelism()));
    }

    /**
     * Three revisions of one file.
     */
    public record FileRevisions(Path path, String ancestor, String left, String right) {}

    public record FileOutcome(Path path, MergeOutcome outcome) {}

    /**
     * Merges all files, returning their outcomes in input order.
     */
    public List<FileOutcome> mergeAll(List<FileRevisions> files) {
        var futures = new ArrayList<CompletableFuture<FileOutcome>>(files.size());
        for (var file : files) {
            futures.add(CompletableFuture.supplyAsync(() -> new FileOutcome(file.path(), mergeFile(file)), executor));
        }
        var outcomes = new ArrayList<FileOutcome>(futures.size());
        for (var future : futures) {
            outcomes.add(future.join());
        }
        long clean = outcomes.stream()
                             .filter(outcome -> outcome.outcome() instanceof MergeOutcome.Merged merged && merged.isClean())
                             .count();
        logger.info("Merged {} files, {} without conflicts", outcomes.size(), clean);
        return outcomes;
    }

    public MergeOutcome mergeFile(FileRevisions file) {
        var language = merge.registry().forPath(file.path());
        if (language.isEmpty()) {
            var name = file.path().getFileName() == null ? file.path().toString() : file.path().getFileName().toString();
            logger.warn("No language registered for {}", file.path());
            return new MergeOutcome.StructuralMergeUnavailable(new MergeError.UnsupportedLanguage(name));
        }
        logger.debug("Merging {} as {}", file.path(), language.get().name());
        return merge.merge(language.get(), file.ancestor(), file.left(), file.right());
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
                logger.warn("Batch merge workers did not stop in time, interrupting");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
