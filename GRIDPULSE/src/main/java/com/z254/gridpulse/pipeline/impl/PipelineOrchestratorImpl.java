package com.z254.gridpulse.pipeline.impl;

import com.z254.gridpulse.capability.Classification;
import com.z254.gridpulse.capability.Classifier;
import com.z254.gridpulse.capability.ContextFetcher;
import com.z254.gridpulse.capability.Forecaster;
import com.z254.gridpulse.capability.MetricFetcher;
import com.z254.gridpulse.capability.MetricSeries;
import com.z254.gridpulse.capability.NarrativeRequest;
import com.z254.gridpulse.capability.Narrator;
import com.z254.gridpulse.capability.RetrievalFetcher;
import com.z254.gridpulse.capability.impl.TemplateNarrator;
import com.z254.gridpulse.config.GridPulseProperties;
import com.z254.gridpulse.domain.model.AnalysisSession;
import com.z254.gridpulse.domain.model.AnalysisStep.StepStatus;
import com.z254.gridpulse.domain.model.ChangePoint;
import com.z254.gridpulse.domain.model.ContextRecord;
import com.z254.gridpulse.domain.model.ConversationTurn;
import com.z254.gridpulse.domain.model.RegionInfo;
import com.z254.gridpulse.domain.model.RetrievalRecord;
import com.z254.gridpulse.domain.model.StepTemplate;
import com.z254.gridpulse.domain.model.TimeSeriesPoint;
import com.z254.gridpulse.domain.model.Zone;
import com.z254.gridpulse.event.EventBus;
import com.z254.gridpulse.event.EventType.DataType;
import com.z254.gridpulse.event.EventType.NarrativeChannel;
import com.z254.gridpulse.event.PipelineEvent;
import com.z254.gridpulse.exception.ClassificationException;
import com.z254.gridpulse.exception.SessionNotFoundException;
import com.z254.gridpulse.exception.StructuralFetchException;
import com.z254.gridpulse.exception.TaskAlreadyRunningException;
import com.z254.gridpulse.health.GridPulseHealthIndicator;
import com.z254.gridpulse.influence.InfluenceAnalyzer;
import com.z254.gridpulse.influence.InfluenceConfig;
import com.z254.gridpulse.observability.StructuredLogger;
import com.z254.gridpulse.pipeline.BlockingStreamBridge;
import com.z254.gridpulse.pipeline.PipelineOrchestrator;
import com.z254.gridpulse.region.RegionMatcher;
import com.z254.gridpulse.session.SessionStore;
import com.z254.gridpulse.signal.ChangePointConfig;
import com.z254.gridpulse.signal.ChangePointDetector;
import com.z254.gridpulse.signal.ZoneClusterer;
import com.z254.gridpulse.signal.ZoneConfig;
import com.z254.gridpulse.signal.ZoneInput;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Default implementation of {@link PipelineOrchestrator}.
 *
 * <p>Each run classifies the query, applies the matching step template and executes
 * its steps in order. Every session write and every published event of a run is
 * chained on one reactive pipeline, so a task has a single writer and its events
 * keep their order. Blocking capability calls go through the {@link BlockingStreamBridge}.
 */
@Service
@Slf4j
public class PipelineOrchestratorImpl implements PipelineOrchestrator {

    static final String STATUS_COMPLETED = "completed";
    static final String STATUS_ERROR = "error";

    private static final int RELATED_DAYS = 3;
    private static final int MAX_RELATED_LINKS = 3;

    private final SessionStore sessionStore;
    private final EventBus eventBus;
    private final BlockingStreamBridge bridge;
    private final Classifier classifier;
    private final MetricFetcher metricFetcher;
    private final ContextFetcher contextFetcher;
    private final RetrievalFetcher retrievalFetcher;
    private final Forecaster forecaster;
    private final Narrator narrator;
    private final TemplateNarrator fallbackNarrator;
    private final ChangePointDetector changePointDetector;
    private final ZoneClusterer zoneClusterer;
    private final InfluenceAnalyzer influenceAnalyzer;
    private final RegionMatcher regionMatcher;
    private final StructuredLogger structuredLogger;
    private final GridPulseHealthIndicator healthIndicator;
    private final MeterRegistry meterRegistry;

    private final GridPulseProperties properties;
    private final GridPulseProperties.PipelineProperties pipeline;
    private final ChangePointConfig historyChangePoints;
    private final ChangePointConfig forecastChangePoints;
    private final ZoneConfig zoneConfig;
    private final InfluenceConfig influenceConfig;
    private final ZoneId zoneId;

    private final Map<String, RunHandle> activeRuns = new ConcurrentHashMap<>();

    public PipelineOrchestratorImpl(
            SessionStore sessionStore,
            EventBus eventBus,
            BlockingStreamBridge bridge,
            Classifier classifier,
            MetricFetcher metricFetcher,
            ContextFetcher contextFetcher,
            RetrievalFetcher retrievalFetcher,
            Forecaster forecaster,
            Narrator narrator,
            TemplateNarrator fallbackNarrator,
            ChangePointDetector changePointDetector,
            ZoneClusterer zoneClusterer,
            InfluenceAnalyzer influenceAnalyzer,
            RegionMatcher regionMatcher,
            StructuredLogger structuredLogger,
            GridPulseHealthIndicator healthIndicator,
            MeterRegistry meterRegistry,
            GridPulseProperties properties) {
        this.sessionStore = sessionStore;
        this.eventBus = eventBus;
        this.bridge = bridge;
        this.classifier = classifier;
        this.metricFetcher = metricFetcher;
        this.contextFetcher = contextFetcher;
        this.retrievalFetcher = retrievalFetcher;
        this.forecaster = forecaster;
        this.narrator = narrator;
        this.fallbackNarrator = fallbackNarrator;
        this.changePointDetector = changePointDetector;
        this.zoneClusterer = zoneClusterer;
        this.influenceAnalyzer = influenceAnalyzer;
        this.regionMatcher = regionMatcher;
        this.structuredLogger = structuredLogger;
        this.healthIndicator = healthIndicator;
        this.meterRegistry = meterRegistry;
        this.properties = properties;
        this.pipeline = properties.getPipeline();

        GridPulseProperties.SignalProperties.ChangePointProperties cp = properties.getSignal().getChangePoint();
        this.historyChangePoints = new ChangePointConfig(
                cp.getWindow(), cp.getHistoryThreshold(), cp.getTopN(), cp.getNeighborhood(), cp.isFallbackEnabled());
        this.forecastChangePoints = historyChangePoints.withThreshold(cp.getForecastThreshold());

        GridPulseProperties.SignalProperties.ZoneProperties zones = properties.getSignal().getZones();
        this.zoneConfig = new ZoneConfig(zones.getLookback(), zones.getMaxZoneLength(), zones.getVolumeWindow(),
                zones.getFallbackTopK(), zones.getMaxZones(), zones.isFallbackEnabled());

        GridPulseProperties.InfluenceProperties influence = properties.getInfluence();
        this.influenceConfig = new InfluenceConfig(influence.getMinPoints(), influence.getWindowSize(),
                influence.getWindowStep(), influence.getMinFactorChangePct());

        this.zoneId = ZoneId.of(properties.getWeather().getTimezone());
        log.info("Initialized pipeline orchestrator (classifier={}, narrator={}, forecaster={})",
                classifier.getClass().getSimpleName(), narrator.getClass().getSimpleName(), forecaster.modelName());
    }

    // --------------------------------------------------------------------------------------------
    // Task lifecycle
    // --------------------------------------------------------------------------------------------

    @Override
    public Mono<String> submit(String query) {
        return sessionStore.create(AnalysisSession.create(null, query))
                .doOnNext(taskId -> start(reserve(taskId), new RunContext(taskId, query, List.of(), false)));
    }

    @Override
    public Flux<PipelineEvent> submitAndStream(String query) {
        return sessionStore.create(AnalysisSession.create(null, query))
                .flatMapMany(taskId -> {
                    // Queue must exist before the first event is published
                    Flux<PipelineEvent> direct = eventBus.attach(taskId);
                    start(reserve(taskId), new RunContext(taskId, query, List.of(), false));
                    return direct;
                });
    }

    @Override
    public Mono<String> followUp(String taskId, String query) {
        return Mono.defer(() -> {
            RunHandle handle = reserve(taskId);
            return sessionStore.mutate(taskId, session -> session.resetForNewQuery(query))
                    .doOnError(e -> activeRuns.remove(taskId, handle))
                    .map(session -> {
                        start(handle, new RunContext(taskId, query, session.getConversationHistory(), true));
                        return taskId;
                    });
        });
    }

    @Override
    public Mono<AnalysisSession> getSession(String taskId) {
        return sessionStore.get(taskId);
    }

    @Override
    public Mono<Boolean> delete(String taskId) {
        return Mono.defer(() -> {
            RunHandle handle = activeRuns.remove(taskId);
            if (handle != null) {
                log.info("Cancelling active run of task {}", taskId);
                handle.dispose();
            }
            eventBus.close(taskId);
            return sessionStore.delete(taskId);
        });
    }

    @Override
    public Flux<PipelineEvent> liveEvents(String taskId) {
        return eventBus.subscribe(taskId);
    }

    @Override
    public Flux<PipelineEvent> resumeEvents(String taskId, long fromSeq) {
        return eventBus.resume(taskId, fromSeq);
    }

    @Override
    public Flux<PipelineEvent> eventLog(String taskId, long fromSeq) {
        return eventBus.replay(taskId, fromSeq);
    }

    @Override
    public boolean isRunning(String taskId) {
        return activeRuns.containsKey(taskId);
    }

    private RunHandle reserve(String taskId) {
        RunHandle handle = new RunHandle(Disposables.swap());
        if (activeRuns.putIfAbsent(taskId, handle) != null) {
            throw new TaskAlreadyRunningException(taskId);
        }
        return handle;
    }

    private void start(RunHandle handle, RunContext run) {
        meterRegistry.counter("gridpulse.tasks.started").increment();
        healthIndicator.runStarted();
        withTaskContext(run, () -> structuredLogger.logTaskStarted(run.getTaskId(), run.getQuery(), run.isFollowUp()));

        Disposable disposable = execute(run)
                .subscribeOn(Schedulers.parallel())
                .doFinally(signal -> {
                    activeRuns.remove(run.getTaskId(), handle);
                    if (signal == SignalType.CANCEL) {
                        healthIndicator.runFinished(false);
                    }
                })
                .subscribe(
                        unused -> { },
                        e -> log.error("Run of task {} ended with an unhandled error", run.getTaskId(), e));
        handle.swap().update(disposable);
    }

    private Mono<Void> execute(RunContext run) {
        return save(run, session -> session.setStatus(AnalysisSession.SessionStatus.PROCESSING))
                .then(classify(run))
                .then(Mono.defer(() -> runTemplate(run)))
                .then(Mono.defer(() -> complete(run)))
                .onErrorResume(e -> fail(run, e));
    }

    private Mono<Void> runTemplate(RunContext run) {
        return switch (run.getTemplate()) {
            case FORECAST -> runStep(run, 1, () -> fetchData(run))
                    .then(runStep(run, 2, () -> analyzeSentiment(run)))
                    .then(runStep(run, 3, () -> analyzeInfluence(run)))
                    .then(runStep(run, 4, () -> selectModel(run)))
                    .then(runStep(run, 5, () -> forecast(run)))
                    .then(runStep(run, 6, () -> visualize(run)))
                    .then(runStep(run, 7, () -> writeReport(run)));
            case RETRIEVAL -> runStep(run, 1, () -> retrieveReports(run))
                    .then(runStep(run, 2, () -> answerFromReports(run)));
            case NEWS -> runStep(run, 1, () -> searchNews(run))
                    .then(runStep(run, 2, () -> summarizeNews(run)));
            case CHAT -> runStep(run, 1, () -> answer(run));
        };
    }

    private Mono<Void> complete(RunContext run) {
        String reply = run.getReply() != null ? run.getReply() : "";
        int limit = properties.getSession().getHistoryLimit();
        return save(run, session -> {
                    session.markCompleted();
                    session.appendTurn(ConversationTurn.user(run.getQuery()), limit);
                    session.appendTurn(ConversationTurn.assistant(reply), limit);
                })
                .then(emit(run, PipelineEvent.done(STATUS_COMPLETED, null)))
                .doOnSuccess(unused -> {
                    long durationNanos = System.nanoTime() - run.getStartedAtNanos();
                    meterRegistry.counter("gridpulse.tasks.completed").increment();
                    meterRegistry.timer("gridpulse.task.duration").record(durationNanos, TimeUnit.NANOSECONDS);
                    healthIndicator.runFinished(true);
                    withTaskContext(run, () -> structuredLogger.logTaskCompleted(run.getTaskId(),
                            Duration.ofNanos(durationNanos).toMillis(), STATUS_COMPLETED));
                });
    }

    private Mono<Void> fail(RunContext run, Throwable error) {
        if (error instanceof SessionNotFoundException) {
            log.info("Task {} was removed while running", run.getTaskId());
            healthIndicator.runFinished(false);
            return Mono.empty();
        }
        String message = describe(error);
        if (isFatal(error)) {
            log.warn("Task {} failed: {}", run.getTaskId(), message);
        } else {
            log.error("Task {} failed unexpectedly", run.getTaskId(), error);
        }
        meterRegistry.counter("gridpulse.tasks.failed").increment();
        healthIndicator.runFinished(false);
        withTaskContext(run, () -> structuredLogger.logTaskFailed(run.getTaskId(),
                error.getClass().getSimpleName(), message));

        return save(run, session -> session.markError(message))
                .then(emit(run, PipelineEvent.error(message)))
                .then(emit(run, PipelineEvent.done(STATUS_ERROR, message)))
                .onErrorResume(e -> {
                    log.error("Could not record the failure of task {}", run.getTaskId(), e);
                    return Mono.empty();
                });
    }

    // --------------------------------------------------------------------------------------------
    // Classification
    // --------------------------------------------------------------------------------------------

    private Mono<Void> classify(RunContext run) {
        return bridge.<Classification>bridge("classifier",
                        onChunk -> classifier.classify(run.getQuery(), run.getHistory(), onChunk),
                        pipeline.getClassifierTimeout())
                .onErrorMap(e -> !(e instanceof ClassificationException),
                        e -> new ClassificationException("Could not classify the query: " + describe(e), e))
                .concatMap(increment -> increment.isChunk()
                        ? emit(run, PipelineEvent.thinking(increment.chunk())).then(Mono.<Classification>empty())
                        : Mono.justOrEmpty(increment.result()))
                .singleOrEmpty()
                .switchIfEmpty(Mono.error(() -> new ClassificationException("The classifier returned no result")))
                .flatMap(classification -> applyClassification(run, classification));
    }

    private Mono<Void> applyClassification(RunContext run, Classification classification) {
        StepTemplate template = classification.getTemplate() != null
                ? classification.getTemplate() : StepTemplate.CHAT;
        String mention = classification.getRegionMention();

        Mono<RegionInfo> region;
        if (template.requiresRegion()) {
            region = resolveRegion(mention);
        } else {
            region = Mono.justOrEmpty(mention == null ? null : regionMatcher.match(mention).orElse(null));
        }

        return region.map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(resolved -> {
                    RegionInfo info = resolved.orElse(null);
                    run.setClassification(classification);
                    run.setTemplate(template);
                    run.setRegion(info);
                    run.setHorizon(clamp(classification.getHorizon(), pipeline.getDefaultHorizon(),
                            1, pipeline.getMaxHorizon()));
                    return save(run, session -> {
                                session.applyTemplate(template);
                                if (info != null) {
                                    session.setRegionCode(info.getCode());
                                    session.setRegionName(info.getName());
                                }
                            })
                            .then(emit(run, PipelineEvent.intent(template.name().toLowerCase(Locale.ROOT),
                                    template.getStepNames(), info != null ? info.getName() : null,
                                    classification.getReason())))
                            .doOnSuccess(unused -> withTaskContext(run, () -> structuredLogger.logTaskClassified(
                                    run.getTaskId(), template.name(), info != null ? info.getCode() : null)));
                });
    }

    private Mono<RegionInfo> resolveRegion(String mention) {
        String supported = String.join(", ", regionMatcher.supportedNames());
        if (mention == null || mention.isBlank()) {
            return Mono.error(new ClassificationException(
                    "No region was found in the query. Supported regions: " + supported));
        }
        return regionMatcher.match(mention)
                .map(Mono::just)
                .orElseGet(() -> Mono.error(new ClassificationException(
                        "Region '" + mention + "' is not supported. Supported regions: " + supported)));
    }

    // --------------------------------------------------------------------------------------------
    // Step execution
    // --------------------------------------------------------------------------------------------

    /**
     * Run one step. The body returns the completion message. Fatal errors propagate
     * after the step is marked failed; other errors fail only the step.
     */
    private Mono<Void> runStep(RunContext run, int step, Supplier<Mono<String>> body) {
        return Mono.defer(() -> {
            String name = run.getTemplate().stepName(step);
            return save(run, session -> session.updateStep(step, StepStatus.RUNNING, null))
                    .then(emit(run, PipelineEvent.stepStart(step, name)))
                    .then(Mono.defer(body))
                    .defaultIfEmpty("")
                    .flatMap(message -> save(run, session -> session.updateStep(step, StepStatus.COMPLETED, message))
                            .then(emit(run, PipelineEvent.stepComplete(step, name, message.isEmpty() ? null : message)))
                            .doOnSuccess(unused -> logStep(run, step, name, "completed")))
                    .onErrorResume(e -> stepFailed(run, step, name, e));
        });
    }

    private Mono<Void> stepFailed(RunContext run, int step, String name, Throwable error) {
        if (error instanceof SessionNotFoundException) {
            return Mono.error(error);
        }
        String message = describe(error);
        Mono<Void> record = save(run, session -> session.updateStep(step, StepStatus.ERROR, message))
                .then(emit(run, PipelineEvent.stepError(step, name, message)))
                .doOnSuccess(unused -> logStep(run, step, name, "error"));
        if (isFatal(error)) {
            return record.then(Mono.error(error));
        }
        log.warn("Step {} ({}) of task {} failed, continuing: {}", step, name, run.getTaskId(), message);
        return record;
    }

    // --------------------------------------------------------------------------------------------
    // Forecast flow
    // --------------------------------------------------------------------------------------------

    private Mono<String> fetchData(RunContext run) {
        RegionInfo region = run.getRegion();
        int historyDays = clamp(run.getClassification().getHistoryDays(), pipeline.getDefaultHistoryDays(),
                pipeline.getMinHistoryDays(), pipeline.getMaxHistoryDays());
        LocalDate end = LocalDate.now(zoneId).minusDays(1);
        LocalDate start = end.minusDays(historyDays - 1L);

        Mono<MetricSeries> metric = Mono.defer(() -> metricFetcher.fetch(region, start, end))
                .timeout(pipeline.getFetchTimeout())
                .onErrorMap(e -> !(e instanceof StructuralFetchException),
                        e -> new StructuralFetchException(
                                "Could not load demand data for " + region.getName() + ": " + describe(e), e))
                .filter(series -> !series.points().isEmpty())
                .switchIfEmpty(Mono.error(() -> new StructuralFetchException(
                        "No demand data is available for " + region.getName())));
        Mono<List<ContextRecord>> context = optional(run, "context",
                () -> contextFetcher.fetch(run.getQuery(), region, pipeline.getContextDays()));
        Mono<List<RetrievalRecord>> retrieval = retrievalFetcher.isEnabled()
                ? optional(run, "retrieval", () -> retrievalFetcher.retrieve(run.getQuery()))
                : Mono.just(List.of());

        return Mono.zip(metric, context, retrieval)
                .flatMap(fetched -> {
                    MetricSeries series = fetched.getT1();
                    run.setOriginalSeries(series.points());
                    run.setWeather(series.weather());
                    run.setContextRecords(fetched.getT2());
                    run.setRetrievalRecords(fetched.getT3());
                    run.setZones(zoneClusterer.cluster(zoneInput(series.points(), fetched.getT2()), zoneConfig));

                    return save(run, session -> {
                                session.setOriginalSeries(run.getOriginalSeries());
                                session.setContextRecords(run.getContextRecords());
                                session.setRetrievalRecords(run.getRetrievalRecords());
                                session.setZones(run.getZones());
                            })
                            .then(emit(run, PipelineEvent.data(1, DataType.TIME_SERIES_ORIGINAL,
                                    run.getOriginalSeries())))
                            .then(emit(run, PipelineEvent.data(1, DataType.CONTEXT_RECORDS,
                                    run.getContextRecords())))
                            .then(emit(run, PipelineEvent.data(1, DataType.RETRIEVAL_RECORDS,
                                    run.getRetrievalRecords())))
                            .thenReturn(String.format(Locale.ROOT, "Loaded %d days of demand data and %d news items",
                                    run.getOriginalSeries().size(), run.getContextRecords().size()));
                });
    }

    private Mono<String> analyzeSentiment(RunContext run) {
        if (run.getContextRecords().isEmpty()) {
            return Mono.just("No news records found; sentiment analysis skipped");
        }
        NarrativeRequest request = request(run, NarrativeRequest.Kind.SENTIMENT, facts(
                NarrativeRequest.REGION, run.getRegion(),
                NarrativeRequest.CONTEXT_RECORDS, run.getContextRecords()));
        return narrate(run, 2, NarrativeChannel.SENTIMENT, request)
                .flatMap(text -> {
                    run.setSentimentSummary(text);
                    return save(run, session -> session.setSentimentSummary(text))
                            .thenReturn("Summarized " + run.getContextRecords().size() + " news items");
                });
    }

    private Mono<String> analyzeInfluence(RunContext run) {
        double structureRatio = properties.getInfluence().getStructureRatios()
                .getOrDefault(run.getRegion().getCode(), properties.getInfluence().getDefaultStructureRatio());
        return Mono.fromCallable(() -> influenceAnalyzer.analyze(
                        run.getOriginalSeries(), run.getWeather(), structureRatio, influenceConfig))
                .flatMap(result -> {
                    run.setInfluence(result);
                    return save(run, session -> session.setInfluence(result))
                            .then(emit(run, PipelineEvent.data(3, DataType.INFLUENCE, result)))
                            .thenReturn(result.getSummary());
                });
    }

    private Mono<String> selectModel(RunContext run) {
        String model = forecaster.modelName();
        run.setForecastModel(model);
        return save(run, session -> session.setForecastModel(model))
                .then(emit(run, PipelineEvent.modelSelection(4, model, run.getHorizon())))
                .thenReturn(String.format(Locale.ROOT, "Selected %s with a %d-day horizon", model, run.getHorizon()));
    }

    private Mono<String> forecast(RunContext run) {
        return Mono.defer(() -> forecaster.forecast(run.getOriginalSeries(), run.getHorizon()))
                .timeout(pipeline.getForecasterTimeout())
                .onErrorMap(e -> !(e instanceof StructuralFetchException),
                        e -> new StructuralFetchException("Forecast failed: " + describe(e), e))
                .switchIfEmpty(Mono.error(() -> new StructuralFetchException("The forecaster returned no result")))
                .flatMap(result -> {
                    run.setForecastSeries(result.points());
                    run.setForecastMetrics(result.metrics());
                    return save(run, session -> {
                                session.setForecastSeries(result.points());
                                session.setForecastMetrics(result.metrics());
                            })
                            .then(emit(run, PipelineEvent.data(5, DataType.FORECAST_METRICS, result.metrics())))
                            .then(emit(run, PipelineEvent.data(5, DataType.TIME_SERIES_FULL,
                                    TimeSeriesPoint.concat(run.getOriginalSeries(), result.points()))))
                            .thenReturn(String.format(Locale.ROOT, "Forecast %d days with %s",
                                    result.points().size(), result.model()));
                });
    }

    private Mono<String> visualize(RunContext run) {
        List<ChangePoint> detected = new ArrayList<>(
                changePointDetector.detect(run.getOriginalSeries(), historyChangePoints));
        detected.addAll(changePointDetector.detect(run.getForecastSeries(), forecastChangePoints));
        int concurrency = pipeline.getEnrichmentConcurrency();

        Mono<List<ChangePoint>> changePoints = Flux.fromIterable(detected)
                .flatMapSequential(point -> enrichChangePoint(run, point), concurrency)
                .collectList();
        Mono<List<Zone>> zones = Flux.fromIterable(run.getZones())
                .flatMapSequential(zone -> summarizeZone(run, zone), concurrency)
                .collectList();

        return Mono.zip(changePoints, zones)
                .flatMap(enriched -> {
                    run.setChangePoints(enriched.getT1());
                    run.setZones(enriched.getT2());
                    return save(run, session -> {
                                session.setChangePoints(run.getChangePoints());
                                session.setZones(run.getZones());
                            })
                            .then(emit(run, PipelineEvent.data(6, DataType.ANOMALY_ZONES, run.getZones())))
                            .then(emit(run, PipelineEvent.data(6, DataType.CHANGE_POINTS, run.getChangePoints())))
                            .thenReturn(String.format(Locale.ROOT, "Found %d change points and %d significant intervals",
                                    run.getChangePoints().size(), run.getZones().size()));
                });
    }

    private Mono<ChangePoint> enrichChangePoint(RunContext run, ChangePoint point) {
        List<ContextRecord> related = relatedRecords(run.getContextRecords(), point.getDate(), point.getDate());
        NarrativeRequest request = request(run, NarrativeRequest.Kind.CHANGE_POINT_NOTE, facts(
                NarrativeRequest.REGION, run.getRegion(),
                NarrativeRequest.CHANGE_POINT, point,
                NarrativeRequest.CONTEXT_RECORDS, related));
        List<String> links = related.stream()
                .map(ContextRecord::getUrl)
                .filter(Objects::nonNull)
                .limit(MAX_RELATED_LINKS)
                .toList();
        return note(run, request).map(note -> point.withEnrichment(note, links));
    }

    private Mono<Zone> summarizeZone(RunContext run, Zone zone) {
        NarrativeRequest request = request(run, NarrativeRequest.Kind.ZONE_SUMMARY, facts(
                NarrativeRequest.REGION, run.getRegion(),
                NarrativeRequest.ZONE, zone,
                NarrativeRequest.CONTEXT_RECORDS,
                relatedRecords(run.getContextRecords(), zone.getStartDate(), zone.getEndDate())));
        return note(run, request).map(zone::withSummary);
    }

    private Mono<String> writeReport(RunContext run) {
        NarrativeRequest request = request(run, NarrativeRequest.Kind.REPORT, facts(
                NarrativeRequest.REGION, run.getRegion(),
                NarrativeRequest.ORIGINAL_SERIES, run.getOriginalSeries(),
                NarrativeRequest.FORECAST_SERIES, run.getForecastSeries(),
                NarrativeRequest.FORECAST_METRICS, run.getForecastMetrics(),
                NarrativeRequest.FORECAST_MODEL, run.getForecastModel(),
                NarrativeRequest.INFLUENCE, run.getInfluence(),
                NarrativeRequest.ZONES, run.getZones(),
                NarrativeRequest.CHANGE_POINTS, run.getChangePoints(),
                NarrativeRequest.CONTEXT_RECORDS, run.getContextRecords(),
                NarrativeRequest.SENTIMENT_SUMMARY, run.getSentimentSummary()));
        return narrate(run, 7, NarrativeChannel.REPORT, request)
                .flatMap(text -> {
                    run.setReply(text);
                    return save(run, session -> session.setNarrative(text)).thenReturn("Report generated");
                });
    }

    // --------------------------------------------------------------------------------------------
    // Retrieval, news and chat flows
    // --------------------------------------------------------------------------------------------

    private Mono<String> retrieveReports(RunContext run) {
        if (!retrievalFetcher.isEnabled()) {
            return emit(run, PipelineEvent.data(1, DataType.RETRIEVAL_RECORDS, List.of()))
                    .thenReturn("Report retrieval is not configured");
        }
        return optional(run, "retrieval", () -> retrievalFetcher.retrieve(run.getQuery()))
                .flatMap(records -> {
                    run.setRetrievalRecords(records);
                    return save(run, session -> session.setRetrievalRecords(records))
                            .then(emit(run, PipelineEvent.data(1, DataType.RETRIEVAL_RECORDS, records)))
                            .thenReturn("Found " + records.size() + " report passages");
                });
    }

    private Mono<String> answerFromReports(RunContext run) {
        NarrativeRequest request = request(run, NarrativeRequest.Kind.RETRIEVAL_ANSWER, facts(
                NarrativeRequest.RETRIEVAL_RECORDS, run.getRetrievalRecords()));
        return answerWith(run, 2, request);
    }

    private Mono<String> searchNews(RunContext run) {
        return optional(run, "context",
                () -> contextFetcher.fetch(run.getQuery(), run.getRegion(), pipeline.getContextDays()))
                .flatMap(records -> {
                    run.setContextRecords(records);
                    return save(run, session -> session.setContextRecords(records))
                            .then(emit(run, PipelineEvent.data(1, DataType.CONTEXT_RECORDS, records)))
                            .thenReturn("Found " + records.size() + " news items");
                });
    }

    private Mono<String> summarizeNews(RunContext run) {
        NarrativeRequest request = request(run, NarrativeRequest.Kind.NEWS_SUMMARY, facts(
                NarrativeRequest.REGION, run.getRegion(),
                NarrativeRequest.CONTEXT_RECORDS, run.getContextRecords()));
        return answerWith(run, 2, request);
    }

    private Mono<String> answer(RunContext run) {
        NarrativeRequest request = request(run, NarrativeRequest.Kind.ANSWER, facts(
                NarrativeRequest.REPLY, run.getClassification().getReply()));
        return answerWith(run, 1, request);
    }

    private Mono<String> answerWith(RunContext run, int step, NarrativeRequest request) {
        return narrate(run, step, NarrativeChannel.ANSWER, request)
                .flatMap(text -> {
                    run.setReply(text);
                    return save(run, session -> session.setNarrative(text)).thenReturn("Answer generated");
                });
    }

    // --------------------------------------------------------------------------------------------
    // Capability helpers
    // --------------------------------------------------------------------------------------------

    /**
     * Optional fetch: failures and timeouts are logged and contribute an empty list.
     */
    private <T> Mono<List<T>> optional(RunContext run, String capability, Supplier<Mono<List<T>>> fetch) {
        return Mono.defer(fetch)
                .timeout(pipeline.getFetchTimeout())
                .onErrorResume(e -> {
                    log.warn("Optional {} fetch failed for task {}: {}", capability, run.getTaskId(), describe(e));
                    capabilityFailed(run, capability, e);
                    return Mono.just(List.of());
                })
                .defaultIfEmpty(List.of());
    }

    /**
     * Stream narrative text as chunks on a channel. A failing narrator is replaced
     * by the template narrator; chunks already emitted stay.
     */
    private Mono<String> narrate(RunContext run, int step, String channel, NarrativeRequest request) {
        return streamNarrative(run, step, channel, narrator, request)
                .onErrorResume(e -> {
                    if (e instanceof SessionNotFoundException || narrator == fallbackNarrator) {
                        return Mono.error(e);
                    }
                    log.warn("Narrator failed for task {} ({}), using template text: {}",
                            run.getTaskId(), request.kind(), describe(e));
                    capabilityFailed(run, "narrator", e);
                    return streamNarrative(run, step, channel, fallbackNarrator, request);
                });
    }

    private Mono<String> streamNarrative(RunContext run, int step, String channel,
                                         Narrator source, NarrativeRequest request) {
        return bridge.<String>bridge("narrator:" + request.kind(),
                        onChunk -> source.narrate(request, onChunk),
                        pipeline.getNarratorChunkTimeout())
                .concatMap(increment -> increment.isChunk()
                        ? emit(run, PipelineEvent.narrativeChunk(step, channel, increment.chunk()))
                        .then(Mono.<String>empty())
                        : Mono.justOrEmpty(increment.result()))
                .singleOrEmpty()
                .defaultIfEmpty("");
    }

    /**
     * Short narrative that is stored but not streamed.
     */
    private Mono<String> note(RunContext run, NarrativeRequest request) {
        return bridge.<String>call("narrator:" + request.kind(),
                        onChunk -> narrator.narrate(request, onChunk),
                        pipeline.getNarratorChunkTimeout())
                .onErrorResume(e -> {
                    log.warn("Narrator note failed for task {} ({}): {}", run.getTaskId(), request.kind(), describe(e));
                    capabilityFailed(run, "narrator", e);
                    return Mono.fromCallable(() -> fallbackNarrator.narrate(request, chunk -> { }));
                })
                .defaultIfEmpty("");
    }

    private void capabilityFailed(RunContext run, String capability, Throwable error) {
        meterRegistry.counter("gridpulse.capability.failures", "capability", capability).increment();
        withTaskContext(run, () -> structuredLogger.logCapabilityFailure(
                run.getTaskId(), capability, false, describe(error)));
    }

    private static NarrativeRequest request(RunContext run, NarrativeRequest.Kind kind, Map<String, Object> facts) {
        return new NarrativeRequest(kind, run.getQuery(), facts, run.getHistory());
    }

    /**
     * Facts from alternating keys and values; null values are left out.
     */
    private static Map<String, Object> facts(Object... keysAndValues) {
        Map<String, Object> facts = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keysAndValues.length; i += 2) {
            if (keysAndValues[i + 1] != null) {
                facts.put((String) keysAndValues[i], keysAndValues[i + 1]);
            }
        }
        return facts;
    }

    // --------------------------------------------------------------------------------------------
    // Internal helpers
    // --------------------------------------------------------------------------------------------

    private Mono<Void> save(RunContext run, Consumer<AnalysisSession> mutation) {
        return Mono.defer(() -> sessionStore.mutate(run.getTaskId(), mutation)).then();
    }

    private Mono<Void> emit(RunContext run, PipelineEvent event) {
        return Mono.defer(() -> eventBus.publish(run.getTaskId(), event)).then();
    }

    private void logStep(RunContext run, int step, String name, String status) {
        withTaskContext(run, () -> structuredLogger.logStepCompleted(run.getTaskId(), step, name, status));
    }

    private void withTaskContext(RunContext run, Runnable logCall) {
        structuredLogger.setTaskContext(run.getTaskId(), run.templateName());
        try {
            logCall.run();
        } finally {
            structuredLogger.clearContext();
        }
    }

    static ZoneInput zoneInput(List<TimeSeriesPoint> points, List<ContextRecord> records) {
        List<LocalDate> dates = points.stream().map(TimeSeriesPoint::getDate).toList();
        Map<LocalDate, Long> perDay = records.stream()
                .filter(record -> record.getPublishedDate() != null)
                .collect(Collectors.groupingBy(ContextRecord::getPublishedDate, Collectors.counting()));
        int[] counts = new int[dates.size()];
        for (int i = 0; i < counts.length; i++) {
            counts[i] = perDay.getOrDefault(dates.get(i), 0L).intValue();
        }
        return new ZoneInput(dates, TimeSeriesPoint.values(points), null, counts);
    }

    /**
     * Records published within a few days of a date range.
     */
    static List<ContextRecord> relatedRecords(List<ContextRecord> records, LocalDate from, LocalDate to) {
        if (from == null || to == null) {
            return List.of();
        }
        LocalDate lower = from.minusDays(RELATED_DAYS);
        LocalDate upper = to.plusDays(RELATED_DAYS);
        return records.stream()
                .filter(record -> record.getPublishedDate() != null
                        && !record.getPublishedDate().isBefore(lower)
                        && !record.getPublishedDate().isAfter(upper))
                .limit(MAX_RELATED_LINKS)
                .toList();
    }

    static int clamp(Integer requested, int fallback, int min, int max) {
        int value = requested != null ? requested : fallback;
        return Math.max(min, Math.min(max, value));
    }

    private static boolean isFatal(Throwable error) {
        return error instanceof ClassificationException || error instanceof StructuralFetchException;
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message != null && !message.isBlank() ? message : error.getClass().getSimpleName();
    }

    private record RunHandle(Disposable.Swap swap) {

        void dispose() {
            swap.dispose();
        }
    }
}
