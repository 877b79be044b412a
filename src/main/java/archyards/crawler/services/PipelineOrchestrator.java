/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.services;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import archyards.crawler.config.PipelineConfig;
import archyards.crawler.data.models.Article;
import archyards.crawler.data.models.ArticleStatus;
import archyards.crawler.data.models.Candidate;
import archyards.crawler.data.models.CollectionName;
import archyards.crawler.data.models.RunState;
import archyards.crawler.data.models.RunSummary;
import archyards.crawler.data.models.RunTrigger;
import archyards.crawler.data.models.ScoredCandidate;
import archyards.crawler.exceptions.RunInProgressException;
import archyards.crawler.exceptions.StoreUnavailableException;
import archyards.crawler.feeds.FeedSource;
import archyards.crawler.feeds.FeedSourceRegistry;
import archyards.crawler.observability.LoggingConfig;
import archyards.crawler.store.CollectionStore;

/**
 * Drives one pipeline run end to end: fetch, rank, rewrite, publish.
 *
 * <p>
 * <b>Run Flow:</b>
 * <ol>
 * <li>Archive the current published collection under today's date</li>
 * <li>{@link RunState#FETCHING}: fetch every source in parallel, each time-boxed; a failing source counts as zero
 * candidates plus one failed source</li>
 * <li>{@link RunState#RANKING}: drop already-published ids, select with {@link RankingService}, merge the selection
 * into {@code raw}</li>
 * <li>{@link RunState#REWRITING}: reuse articles already rewritten by an earlier interrupted run, rewrite the rest in
 * parallel; successes go to {@code rewritten}, failures back to {@code raw} as {@code rewrite_failed}</li>
 * <li>{@link RunState#PUBLISHING}: promote every rewritten selection in one batch</li>
 * </ol>
 *
 * <p>
 * <b>Single-run guard:</b> at most one run is active. A trigger while a run is active fails with
 * {@link RunInProgressException} before touching any collection. Scheduled and on-demand triggers share the guard.
 *
 * <p>
 * <b>Failure policy:</b> source and rewrite failures are folded into the {@link RunSummary}. A
 * {@link StoreUnavailableException} aborts the run; the summary is marked aborted and nothing further is promoted.
 *
 * <p>
 * <b>Telemetry:</b> spans {@code pipeline.run} and {@code pipeline.fetch_source}; metrics
 * {@code archyards.feed.fetch.duration}, {@code archyards.feed.candidates.total}, {@code archyards.pipeline.runs.total},
 * {@code archyards.pipeline.run.duration} and {@code archyards.pipeline.articles.published.total}.
 */
@ApplicationScoped
public class PipelineOrchestrator {

    private static final Logger LOG = Logger.getLogger(PipelineOrchestrator.class);

    private final PipelineConfig config;
    private final FeedSourceRegistry sourceRegistry;
    private final RankingService rankingService;
    private final RewriteService rewriteService;
    private final CollectionStore store;
    private final MeterRegistry meterRegistry;
    private final Tracer tracer;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final ExecutorService runExecutor = Executors.newSingleThreadExecutor(namedThreads("archyards-run"));

    private volatile RunState state = RunState.IDLE;
    private volatile String activeRunId;
    private volatile RunSummary lastSummary;

    @Inject
    public PipelineOrchestrator(PipelineConfig config, FeedSourceRegistry sourceRegistry,
            RankingService rankingService, RewriteService rewriteService, CollectionStore store,
            MeterRegistry meterRegistry, Tracer tracer, Clock clock) {
        this.config = config;
        this.sourceRegistry = sourceRegistry;
        this.rankingService = rankingService;
        this.rewriteService = rewriteService;
        this.store = store;
        this.meterRegistry = meterRegistry;
        this.tracer = tracer;
        this.clock = clock;
    }

    /**
     * Runs the pipeline on the calling thread.
     *
     * @param trigger
     *            what started the run
     * @return the run summary
     * @throws RunInProgressException
     *             if another run is active
     */
    public RunSummary trigger(RunTrigger trigger) {
        String runId = claim();
        try {
            return execute(runId, trigger);
        } finally {
            release();
        }
    }

    /**
     * Claims the single-run guard on the calling thread and runs the pipeline in the background.
     *
     * @param trigger
     *            what started the run
     * @return run id and completion of the run
     * @throws RunInProgressException
     *             if another run is active
     */
    public StartedRun triggerAsync(RunTrigger trigger) {
        String runId = claim();
        try {
            CompletableFuture<RunSummary> completion = CompletableFuture.supplyAsync(() -> {
                try {
                    return execute(runId, trigger);
                } finally {
                    release();
                }
            }, runExecutor);
            return new StartedRun(runId, completion);
        } catch (RuntimeException e) {
            release();
            throw e;
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public RunState state() {
        return state;
    }

    public Optional<String> activeRunId() {
        return Optional.ofNullable(activeRunId);
    }

    public Optional<RunSummary> lastSummary() {
        return Optional.ofNullable(lastSummary);
    }

    @PreDestroy
    void shutdown() {
        runExecutor.shutdownNow();
    }

    private String claim() {
        if (!running.compareAndSet(false, true)) {
            String active = activeRunId;
            LOG.warnf("Rejecting pipeline trigger: run %s is in progress", active);
            throw new RunInProgressException(active);
        }
        String runId = UUID.randomUUID().toString();
        activeRunId = runId;
        return runId;
    }

    private void release() {
        activeRunId = null;
        running.set(false);
    }

    private RunSummary execute(String runId, RunTrigger trigger) {
        Instant startedAt = clock.instant();
        RunSummary.Builder summary = RunSummary.builder(runId, trigger, startedAt);

        Span span = tracer.spanBuilder("pipeline.run").setAttribute("run.id", runId)
                .setAttribute("run.trigger", trigger.value()).startSpan();
        Timer.Sample timerSample = Timer.start(meterRegistry);

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setRunId(runId);
            LoggingConfig.setRunTrigger(trigger.value());
            LoggingConfig.setRequestOrigin("PipelineOrchestrator");

            LOG.infof("=== Pipeline run %s started (%s) ===", runId, trigger.value());

            try {
                runStages(runId, summary, span);
            } catch (StoreUnavailableException e) {
                LOG.errorf(e, "Pipeline run %s aborted: collection store unavailable", runId);
                span.recordException(e);
                summary.aborted(e.getMessage());
            }

            RunSummary result = summary.build(clock.instant());
            lastSummary = result;

            String outcome = result.aborted() ? "aborted" : result.failed() > 0 ? "partial" : "success";
            span.setAttribute("run.outcome", outcome);
            span.setAttribute("articles.published", result.published());
            Counter.builder("archyards.pipeline.runs.total").tag("trigger", trigger.value()).tag("outcome", outcome)
                    .register(meterRegistry).increment();
            Counter.builder("archyards.pipeline.articles.published.total").register(meterRegistry)
                    .increment(result.published());
            timerSample.stop(Timer.builder("archyards.pipeline.run.duration").tag("outcome", outcome)
                    .register(meterRegistry));

            LOG.infof(
                    "=== Pipeline run %s done (%s) in %dms: fetched=%d, failed_sources=%s, selected=%d, "
                            + "rewritten=%d, reused=%d, rewrite_failed=%d, published=%d ===",
                    runId, outcome, result.duration().toMillis(), result.fetched(), result.failedSources(),
                    result.selected(), result.rewritten(), result.reused(), result.rewriteFailed(),
                    result.published());
            return result;
        } finally {
            state = RunState.DONE;
            span.end();
            LoggingConfig.clearMDC();
        }
    }

    private void runStages(String runId, RunSummary.Builder summary, Span span) {
        LocalDate today = LocalDate.ofInstant(clock.instant(), config.zone());
        store.archivePublished(today);

        state = RunState.FETCHING;
        List<Candidate> pool = fetchAll(runId, summary);
        span.addEvent("fetch.completed", Attributes.of(AttributeKey.longKey("candidates"), (long) pool.size()));

        state = RunState.RANKING;
        Set<String> publishedIds = new HashSet<>();
        for (Article article : store.read(CollectionName.PUBLISHED)) {
            publishedIds.add(article.id());
        }
        List<Candidate> eligible = new ArrayList<>();
        for (Candidate candidate : pool) {
            if (!publishedIds.contains(candidate.id())) {
                eligible.add(candidate);
            }
        }
        if (eligible.size() < pool.size()) {
            LOG.infof("Excluded %d already published candidates", pool.size() - eligible.size());
        }

        List<ScoredCandidate> selected = rankingService.select(eligible);
        summary.selected(selected.size());
        logSelection(selected);
        if (selected.size() < config.minArticles()) {
            LOG.warnf("Only %d articles selected, below the minimum of %d", selected.size(), config.minArticles());
        }
        if (selected.isEmpty()) {
            state = RunState.PUBLISHING;
            return;
        }

        List<Article> raw = new ArrayList<>();
        for (ScoredCandidate scored : selected) {
            raw.add(Article.fromScored(scored));
        }
        store.merge(CollectionName.RAW, raw);

        state = RunState.REWRITING;
        Map<String, Article> alreadyRewritten = new HashMap<>();
        for (Article article : store.read(CollectionName.REWRITTEN)) {
            if (article.status() == ArticleStatus.REWRITTEN) {
                alreadyRewritten.put(article.id(), article);
            }
        }

        List<Article> toRewrite = new ArrayList<>();
        int reused = 0;
        for (Article article : raw) {
            if (alreadyRewritten.containsKey(article.id())) {
                reused++;
                LOG.infof("Reusing earlier rewrite of %s", article.id());
            } else {
                toRewrite.add(article);
            }
        }

        Map<String, Article> outcomes = rewriteAll(runId, toRewrite);
        List<Article> successes = new ArrayList<>();
        List<Article> failures = new ArrayList<>();
        for (Article article : outcomes.values()) {
            if (article.status() == ArticleStatus.REWRITTEN) {
                successes.add(article);
            } else {
                failures.add(article);
            }
        }
        summary.rewritten(successes.size()).reused(reused).rewriteFailed(failures.size());
        store.merge(CollectionName.REWRITTEN, successes);
        store.merge(CollectionName.RAW, failures);

        state = RunState.PUBLISHING;
        List<String> promote = new ArrayList<>();
        for (Article article : raw) {
            Article outcome = outcomes.get(article.id());
            if (alreadyRewritten.containsKey(article.id())
                    || (outcome != null && outcome.status() == ArticleStatus.REWRITTEN)) {
                promote.add(article.id());
            }
        }
        List<Article> published = store.promoteAll(promote);

        List<String> publishedIdsThisRun = new ArrayList<>();
        for (Article article : published) {
            publishedIdsThisRun.add(article.id());
            LOG.infof("Published %s [%s] %s", article.id(), article.sourceName(), article.displayTitle());
        }
        summary.published(publishedIdsThisRun);
    }

    private List<Candidate> fetchAll(String runId, RunSummary.Builder summary) {
        List<FeedSource> sources = sourceRegistry.sources();
        if (sources.isEmpty()) {
            LOG.warn("No feed sources configured");
            return List.of();
        }

        Context parent = Context.current();
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(config.fetchParallelism(), sources.size()),
                namedThreads("archyards-fetch"));
        try {
            Map<FeedSource, Future<List<Candidate>>> futures = new LinkedHashMap<>();
            for (FeedSource source : sources) {
                futures.put(source, pool.submit(() -> fetchSource(runId, source, parent)));
            }

            List<Candidate> candidates = new ArrayList<>();
            for (Map.Entry<FeedSource, Future<List<Candidate>>> entry : futures.entrySet()) {
                String name = entry.getKey().name();
                try {
                    List<Candidate> fetched = entry.getValue().get(config.fetchTimeout().toMillis(),
                            TimeUnit.MILLISECONDS);
                    summary.fetched(name, fetched.size());
                    candidates.addAll(fetched);
                    LOG.infof("Fetched %d candidates from %s", fetched.size(), name);
                } catch (TimeoutException e) {
                    entry.getValue().cancel(true);
                    summary.sourceFailed(name);
                    LOG.warnf("Source %s timed out after %s", name, config.fetchTimeout());
                } catch (ExecutionException e) {
                    summary.sourceFailed(name);
                    LOG.warnf("Source %s unavailable: %s", name, e.getCause().getMessage());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    summary.sourceFailed(name);
                    LOG.warnf("Interrupted while waiting for source %s", name);
                }
            }
            return candidates;
        } finally {
            pool.shutdownNow();
        }
    }

    private List<Candidate> fetchSource(String runId, FeedSource source, Context parent) {
        Span span = tracer.spanBuilder("pipeline.fetch_source").setParent(parent)
                .setAttribute("source_name", source.name()).startSpan();
        Timer.Sample timerSample = Timer.start(meterRegistry);

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setRunId(runId);
            LoggingConfig.setSourceName(source.name());

            List<Candidate> candidates = source.fetch();
            span.setAttribute("candidates", candidates.size());
            Counter.builder("archyards.feed.candidates.total").tag("source", source.name()).register(meterRegistry)
                    .increment(candidates.size());
            timerSample.stop(Timer.builder("archyards.feed.fetch.duration").tag("source", source.name())
                    .tag("result", "success").register(meterRegistry));
            return candidates;
        } catch (RuntimeException e) {
            span.recordException(e);
            timerSample.stop(Timer.builder("archyards.feed.fetch.duration").tag("source", source.name())
                    .tag("result", "failure").register(meterRegistry));
            throw e;
        } finally {
            span.end();
            LoggingConfig.clearMDC();
        }
    }

    private Map<String, Article> rewriteAll(String runId, List<Article> articles) {
        Map<String, Article> outcomes = new LinkedHashMap<>();
        if (articles.isEmpty()) {
            return outcomes;
        }

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(config.rewriteParallelism(), articles.size()),
                namedThreads("archyards-rewrite"));
        try {
            Map<Article, Future<Article>> futures = new LinkedHashMap<>();
            for (Article article : articles) {
                futures.put(article, pool.submit(() -> {
                    LoggingConfig.setRunId(runId);
                    LoggingConfig.setArticleId(article.id());
                    try {
                        return rewriteService.rewrite(article);
                    } finally {
                        LoggingConfig.clearMDC();
                    }
                }));
            }

            for (Map.Entry<Article, Future<Article>> entry : futures.entrySet()) {
                Article article = entry.getKey();
                try {
                    outcomes.put(article.id(), entry.getValue().get());
                } catch (ExecutionException e) {
                    LOG.errorf(e.getCause(), "Rewrite of %s failed unexpectedly", article.id());
                    outcomes.put(article.id(), article.withStatus(ArticleStatus.REWRITE_FAILED));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    LOG.warnf("Interrupted while waiting for rewrite of %s", article.id());
                    outcomes.put(article.id(), article.withStatus(ArticleStatus.REWRITE_FAILED));
                }
            }
            return outcomes;
        } finally {
            pool.shutdownNow();
        }
    }

    private void logSelection(List<ScoredCandidate> selected) {
        int position = 1;
        for (ScoredCandidate scored : selected) {
            LOG.infof("  #%d [%s] %s (score=%.2f)", position++, scored.sourceName(), scored.candidate().originalTitle(),
                    scored.popularityScore());
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * A run accepted by {@link #triggerAsync(RunTrigger)}.
     *
     * @param runId
     *            id of the started run
     * @param completion
     *            completes with the run summary
     */
    public record StartedRun(String runId, CompletableFuture<RunSummary> completion) {
    }
}
