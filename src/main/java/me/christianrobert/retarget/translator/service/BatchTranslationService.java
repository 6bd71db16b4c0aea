package me.christianrobert.retarget.translator.service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.retarget.config.service.ConfigService;
import me.christianrobert.retarget.translator.context.TranslationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs many translations in parallel on a shared, bounded thread pool.
 *
 * <p>Each translation builds its own emission state, so requests are independent; the
 * pool only bounds how many run at once. Results come back in request order.</p>
 */
@ApplicationScoped
public class BatchTranslationService {

    private static final Logger log = LoggerFactory.getLogger(BatchTranslationService.class);

    @Inject
    TranslationService translationService;

    @Inject
    ConfigService configService;

    private ExecutorService executorService;

    /**
     * Creates the worker pool, sized by {@link ConfigService#BATCH_PARALLELISM}.
     */
    @PostConstruct
    public void init() {
        int parallelism = Math.max(1, configService.getConfigValueAsInt(ConfigService.BATCH_PARALLELISM, 4));
        log.info("Initializing batch translation pool with {} worker(s)", parallelism);
        executorService = Executors.newFixedThreadPool(parallelism);
    }

    /**
     * Shuts down the worker pool, waiting up to 30 seconds for running translations.
     */
    @PreDestroy
    public void shutdown() {
        if (executorService == null || executorService.isShutdown()) {
            return;
        }
        log.info("Shutting down batch translation pool");
        try {
            executorService.shutdown();
            if (!executorService.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Batch pool did not terminate in 30s, forcing shutdown");
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            log.error("Interrupted while shutting down batch pool", e);
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Translates every request; the i-th result belongs to the i-th request.
     */
    public List<TranslationResult> translateAll(List<TranslationRequest> requests) {
        log.info("Translating batch of {} request(s)", requests.size());

        List<CompletableFuture<TranslationResult>> futures = new ArrayList<>();
        for (TranslationRequest request : requests) {
            CompletableFuture<TranslationResult> future = CompletableFuture
                    .supplyAsync(() -> translationService.translate(request), executorService)
                    .exceptionally(e -> {
                        log.error("Batch translation failed for " + request, e);
                        return TranslationResult.failure(request.getTarget(), "Unexpected error: " + e.getMessage());
                    });
            futures.add(future);
        }

        List<TranslationResult> results = new ArrayList<>();
        for (CompletableFuture<TranslationResult> future : futures) {
            results.add(future.join());
        }

        long failures = results.stream().filter(TranslationResult::isFailure).count();
        log.info("Batch finished: {} succeeded, {} failed", results.size() - failures, failures);
        return results;
    }

    /**
     * Translates the same program into several targets.
     */
    public List<TranslationResult> translateToTargets(TranslationRequest request, List<String> targets) {
        List<TranslationRequest> requests = new ArrayList<>();
        for (String target : targets) {
            requests.add(request.withTarget(target));
        }
        return translateAll(requests);
    }

    /**
     * Translates one JSON document into several targets.
     *
     * @see TranslationService#translateDocument(String, String, boolean)
     */
    public List<TranslationResult> translateDocument(String documentJson, List<String> targets, boolean includeAst) {
        log.info("Translating document into {} target(s)", targets.size());
        List<CompletableFuture<TranslationResult>> futures = new ArrayList<>();
        for (String target : targets) {
            futures.add(CompletableFuture
                    .supplyAsync(() -> translationService.translateDocument(target, documentJson, includeAst),
                            executorService)
                    .exceptionally(e -> {
                        log.error("Document translation failed for target " + target, e);
                        return TranslationResult.failure(target, "Unexpected error: " + e.getMessage());
                    }));
        }
        List<TranslationResult> results = new ArrayList<>();
        for (CompletableFuture<TranslationResult> future : futures) {
            results.add(future.join());
        }
        return results;
    }
}
