package com.autonomous.orchestrator.knowledge;

import com.autonomous.orchestrator.model.KnowledgeItem;
import com.autonomous.orchestrator.model.SourceRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Retrieves and synthesizes knowledge for batches of queries.
 * <p>
 * Queries run concurrently and fail independently: a query that errors or times out is logged
 * and left out of the result, the rest of the batch is unaffected. Within one query the sources
 * are consulted in order and then synthesized.
 */
@Slf4j
@Service
public class KnowledgeSeeker {

    private final List<KnowledgeSource> sources;
    private final KnowledgeSynthesizer synthesizer;
    private final Executor executor;
    private final long queryTimeoutMs;
    private final int maxExpansionDepth;
    private final int maxTopicsPerItem;

    public KnowledgeSeeker(List<KnowledgeSource> sources,
                           KnowledgeSynthesizer synthesizer,
                           @Qualifier("knowledgeExecutor") Executor executor,
                           @Value("${orchestrator.knowledge.query-timeout-ms:60000}") long queryTimeoutMs,
                           @Value("${orchestrator.knowledge.expansion.max-depth:1}") int maxExpansionDepth,
                           @Value("${orchestrator.knowledge.expansion.max-topics-per-item:3}") int maxTopicsPerItem) {
        this.sources = List.copyOf(sources);
        this.synthesizer = synthesizer;
        this.executor = executor;
        this.queryTimeoutMs = queryTimeoutMs;
        this.maxExpansionDepth = maxExpansionDepth;
        this.maxTopicsPerItem = maxTopicsPerItem;
    }

    /**
     * One item per query that succeeded, in query order.
     */
    public List<KnowledgeItem> seekKnowledge(List<String> queries) {
        if (queries.isEmpty()) {
            return List.of();
        }
        List<CompletableFuture<Optional<KnowledgeItem>>> futures = queries.stream()
            .map(query -> submit(query)
                .exceptionally(error -> {
                    log.error("Error seeking knowledge for query \"{}\": {}", query, rootMessage(error));
                    return Optional.empty();
                }))
            .toList();

        List<KnowledgeItem> items = futures.stream()
            .map(CompletableFuture::join)
            .flatMap(Optional::stream)
            .toList();
        log.debug("Knowledge batch: {} queries, {} items", queries.size(), items.size());
        return items;
    }

    /**
     * Follows the related topics of each item with "how does X relate to Y" queries, up to the
     * configured depth and number of topics per item.
     */
    public List<KnowledgeItem> expandKnowledge(List<KnowledgeItem> baseKnowledge) {
        return expand(baseKnowledge, maxExpansionDepth);
    }

    private List<KnowledgeItem> expand(List<KnowledgeItem> items, int remainingDepth) {
        if (remainingDepth <= 0 || items.isEmpty()) {
            return List.of();
        }
        List<String> followUps = items.stream()
            .flatMap(item -> item.getRelatedTopics().stream()
                .limit(maxTopicsPerItem)
                .map(related -> String.format("How does %s relate to %s?", related, item.key())))
            .toList();

        List<KnowledgeItem> found = seekKnowledge(followUps);
        List<KnowledgeItem> expanded = new ArrayList<>(found);
        expanded.addAll(expand(found, remainingDepth - 1));
        return expanded;
    }

    /**
     * Hands one query to the executor. The deadline is armed when the query starts running, so
     * time spent waiting for a free worker does not count against it.
     */
    private CompletableFuture<Optional<KnowledgeItem>> submit(String query) {
        CompletableFuture<Optional<KnowledgeItem>> outcome = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                if (outcome.isDone()) {
                    return;
                }
                outcome.orTimeout(queryTimeoutMs, TimeUnit.MILLISECONDS);
                try {
                    outcome.complete(Optional.of(seekOne(query)));
                } catch (RuntimeException e) {
                    outcome.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            outcome.completeExceptionally(e);
        }
        return outcome;
    }

    private KnowledgeItem seekOne(String query) {
        List<SourceRecord> records = new ArrayList<>();
        for (KnowledgeSource source : sources) {
            records.addAll(retrieveQuietly(source, query));
        }
        return synthesizer.synthesize(query, records);
    }

    private List<SourceRecord> retrieveQuietly(KnowledgeSource source, String query) {
        try {
            return source.retrieve(query);
        } catch (RuntimeException e) {
            log.warn("{} lookup failed for \"{}\": {}", source.name(), query, e.getMessage());
            return List.of();
        }
    }

    private static String rootMessage(Throwable error) {
        Throwable root = error;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getClass().getSimpleName() + ": " + root.getMessage();
    }
}
