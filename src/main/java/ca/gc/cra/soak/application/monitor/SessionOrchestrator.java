package ca.gc.cra.soak.application.monitor;

import ca.gc.cra.soak.application.port.ClockPort;
import ca.gc.cra.soak.application.port.ComponentSizeProbe;
import ca.gc.cra.soak.application.port.MetricsPort;
import ca.gc.cra.soak.application.port.MetricsProvider;
import ca.gc.cra.soak.application.port.RemediationHook;
import ca.gc.cra.soak.application.port.ReportExporter;
import ca.gc.cra.soak.application.port.TaskScheduler;
import ca.gc.cra.soak.application.port.TaskScheduler.ScheduledTask;
import ca.gc.cra.soak.config.SessionConfig;
import ca.gc.cra.soak.domain.analysis.Alert;
import ca.gc.cra.soak.domain.analysis.HealthCheck;
import ca.gc.cra.soak.domain.analysis.LeakCandidate;
import ca.gc.cra.soak.domain.metrics.Snapshot;
import ca.gc.cra.soak.domain.report.FinalReport;
import ca.gc.cra.soak.domain.session.NotificationKind;
import ca.gc.cra.soak.domain.session.OperationEvent;
import ca.gc.cra.soak.domain.session.ProgressReport;
import ca.gc.cra.soak.domain.session.SessionHandle;
import ca.gc.cra.soak.domain.session.SessionNotification;
import ca.gc.cra.soak.domain.session.SessionStatus;
import ca.gc.cra.soak.domain.session.SessionStatusView;
import ca.gc.cra.soak.infrastructure.exec.ExecutorFactories;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Owns the session state machine and drives every periodic task of a monitoring
 * session.
 * <p><strong>Why:</strong> Long sessions must survive transient measurement failures while still
 * guaranteeing a frozen, consistent data set for the final report.</p>
 * <p><strong>State machine:</strong> {@code IDLE -> INITIALIZING -> RUNNING -> STOPPING -> COMPLETED}, with
 * {@code ERROR} when the baseline or finalization fails. A new session may start from {@code IDLE},
 * {@code COMPLETED} or {@code ERROR}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Validate configuration, establish the baseline and schedule the snapshot, health-check,
 *   progress and deadline tasks.</li>
 *   <li>Hand each snapshot to the {@link LeakAnalysisEngine}, turn candidates into alerts and fan them out
 *   through the {@link AlertDispatcher}.</li>
 *   <li>Accept workload callbacks ({@link #track}, {@link #untrack}, {@link #recordOperation}).</li>
 *   <li>On {@link #stop()} or when the duration elapses: cancel every task, delta-check all tracked units,
 *   take final measurements, freeze the data and generate the {@link FinalReport}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> A single {@link ReentrantLock} serializes state transitions and every
 * mutation of the session data. Scheduled callbacks re-check the state under the lock and do nothing once
 * the session left {@code RUNNING}, so no append happens after finalization begins. Metrics reads run
 * outside the lock. External reads ({@link #getStatus()}, subscriber payloads) are immutable copies.</p>
 * <p><strong>Observability:</strong> MDC key {@code session}; counters {@code soak.session.started},
 * {@code soak.session.completed}, {@code soak.cycle.failed}; observation {@code soak.health.score}.</p>
 *
 * @since SOAK 0.1
 */
public final class SessionOrchestrator implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(SessionOrchestrator.class);
  private static final String MDC_SESSION = "session";
  private static final int DEFAULT_READ_THREADS = 2;

  private final ReentrantLock lock = new ReentrantLock();
  private final MetricsProvider metricsProvider;
  private final TaskScheduler scheduler;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final SessionRegistry registry;
  private final Executor probeExecutor;
  private final ExecutorService ownedReadPool;
  private final ComponentSizeProbe sizeProbe;
  private final List<ReportExporter> exporters;
  private final Supplier<String> idGenerator;
  private final AlertDispatcher dispatcher;
  private final ReportGenerator reportGenerator = new ReportGenerator();

  private volatile SessionStatus status = SessionStatus.IDLE;
  private volatile ActiveSession active;
  private FinalReport lastReport;

  private SessionOrchestrator(Builder builder) {
    this.metricsProvider = Objects.requireNonNull(builder.metricsProvider, "metricsProvider");
    this.scheduler = Objects.requireNonNull(builder.scheduler, "scheduler");
    this.clock = builder.clock == null ? ClockPort.SYSTEM : builder.clock;
    this.metrics = builder.metrics == null ? MetricsPort.NO_OP : builder.metrics;
    this.registry = builder.registry == null ? new SessionRegistry() : builder.registry;
    if (builder.probeExecutor == null) {
      this.ownedReadPool = ExecutorFactories.newProbePool(
          DEFAULT_READ_THREADS, "soak-read", (t, ex) -> log.error("Uncaught error on {}", t.getName(), ex));
      this.probeExecutor = ownedReadPool;
    } else {
      this.ownedReadPool = null;
      this.probeExecutor = builder.probeExecutor;
    }
    this.sizeProbe = builder.sizeProbe == null ? ComponentSizeProbe.UNMEASURED : builder.sizeProbe;
    this.exporters = List.copyOf(builder.exporters);
    this.idGenerator = builder.idGenerator == null
        ? () -> "soak-" + UUID.randomUUID().toString().substring(0, 8)
        : builder.idGenerator;
    this.dispatcher = new AlertDispatcher(clock, metrics);
    this.dispatcher.setRemediationHook(builder.remediationHook);
  }

  /**
   * Creates a builder.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts a session.
   *
   * @param config session configuration; validated before any state changes
   * @return handle identifying the new session
   * @throws AlreadyRunningException when a session is already active here or in the shared registry
   * @throws ca.gc.cra.soak.config.ConfigurationException when the configuration is invalid
   * @throws SnapshotCollectionException when the baseline cannot be established; the state becomes
   *     {@code ERROR}
   */
  public SessionHandle start(SessionConfig config) throws SnapshotCollectionException {
    Objects.requireNonNull(config, "config");
    lock.lock();
    try {
      if (!status.acceptsStart()) {
        String current = active == null ? "<unknown>" : active.handle.sessionId();
        throw new AlreadyRunningException("session " + current + " is " + status);
      }
      config.validate();
      String sessionId = idGenerator.get();
      registry.acquire(sessionId);
      status = SessionStatus.INITIALIZING;
      MDC.put(MDC_SESSION, sessionId);
      try {
        initialize(sessionId, config);
        status = SessionStatus.RUNNING;
        metrics.increment("soak.session.started");
        log.info("Session {} started for {} (snapshot every {}, health every {})",
            sessionId, config.sessionDuration(), config.snapshotInterval(), config.healthCheckInterval());
        return active.handle;
      } catch (SnapshotCollectionException | RuntimeException ex) {
        status = SessionStatus.ERROR;
        if (active != null && active.handle.sessionId().equals(sessionId)) {
          active.cancelTasks();
          active.tracker.closeAll();
          active.data.freeze(clock.nowMillis());
        }
        registry.release(sessionId);
        log.error("Session {} failed to start", sessionId, ex);
        throw ex;
      } finally {
        MDC.remove(MDC_SESSION);
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Stops the running session and returns its report. Idempotent: without a running session the call
   * returns {@link StopResult#noActiveSession()} and changes nothing.
   *
   * @return completed result with the final report, or the no-active-session marker
   * @throws AnalysisException when the report cannot be generated; the state becomes {@code ERROR}
   */
  public StopResult stop() {
    lock.lock();
    try {
      if (status != SessionStatus.RUNNING) {
        return StopResult.noActiveSession();
      }
      return finish("stop requested");
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns a read-only projection of the current or most recent session.
   *
   * @return status view
   */
  public SessionStatusView getStatus() {
    lock.lock();
    try {
      if (active == null) {
        return SessionStatusView.idle();
      }
      long now = clock.nowMillis();
      SessionData data = active.data;
      long end = status == SessionStatus.RUNNING ? now : data.view(now).endedAtMillis();
      long elapsed = Math.max(0L, end - active.handle.startedAtMillis());
      long duration = active.handle.duration().toMillis();
      return new SessionStatusView(
          active.handle.sessionId(),
          status,
          elapsed,
          Math.max(0L, duration - elapsed),
          Math.min(100d, elapsed * 100d / duration),
          data.snapshotCount(),
          data.healthCheckCount(),
          data.alertCount(),
          data.leakCandidateCount(),
          data.operationCount(),
          status == SessionStatus.RUNNING ? active.tracker.trackedCount() : 0);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Registers a tracked unit with the running session.
   *
   * @param unitId unit identifier
   * @param initialSizeBytes size estimate at creation
   * @throws NoActiveSessionException when no session is running
   */
  public void track(String unitId, long initialSizeBytes) {
    lock.lock();
    try {
      ActiveSession session = requireRunning("track");
      session.tracker.track(unitId, initialSizeBytes).ifPresent(c -> recordComponentCandidate(session, c));
    } finally {
      lock.unlock();
    }
  }

  /**
   * Reports the current size of a tracked unit measured by the workload itself.
   *
   * @param unitId unit identifier
   * @param sizeBytes current size
   * @return {@code false} when the unit is not tracked
   * @throws NoActiveSessionException when no session is running
   */
  public boolean reportUnitSize(String unitId, long sizeBytes) {
    lock.lock();
    try {
      return requireRunning("reportUnitSize").tracker.reportSize(unitId, sizeBytes);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes a tracked unit after its final delta check.
   *
   * @param unitId unit identifier
   * @return cleanup candidate raised by the final check, if any
   * @throws NoActiveSessionException when no session is running
   */
  public Optional<LeakCandidate> untrack(String unitId) {
    lock.lock();
    try {
      ActiveSession session = requireRunning("untrack");
      Optional<LeakCandidate> candidate = session.tracker.untrack(unitId);
      candidate.ifPresent(c -> recordComponentCandidate(session, c));
      return candidate;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Appends a workload operation event.
   *
   * @param type operation type
   * @param attributes event details
   * @throws NoActiveSessionException when no session is running
   */
  public void recordOperation(String type, Map<String, String> attributes) {
    lock.lock();
    try {
      ActiveSession session = requireRunning("recordOperation");
      session.data.appendOperation(new OperationEvent(clock.nowMillis(), type, attributes));
    } finally {
      lock.unlock();
    }
  }

  /**
   * Subscribes to one notification kind.
   *
   * @param kind notification kind
   * @param callback callback receiving read-only payloads
   * @return handle removing the callback
   */
  public Subscription subscribe(NotificationKind kind, Consumer<? super SessionNotification> callback) {
    return dispatcher.subscribe(kind, callback);
  }

  /**
   * Subscribes to progress reports.
   *
   * @param callback receives each progress report
   * @return handle removing the callback
   */
  public Subscription subscribeToProgress(Consumer<ProgressReport> callback) {
    Objects.requireNonNull(callback, "callback");
    return dispatcher.subscribe(NotificationKind.PROGRESS, n -> callback.accept((ProgressReport) n));
  }

  /**
   * Subscribes to alerts as they are raised.
   *
   * @param callback receives each alert
   * @return handle removing the callback
   */
  public Subscription subscribeToAlerts(Consumer<Alert> callback) {
    Objects.requireNonNull(callback, "callback");
    return dispatcher.subscribe(NotificationKind.ALERT, n -> callback.accept((Alert) n));
  }

  /**
   * Subscribes to periodic health checks.
   *
   * @param callback receives each health check
   * @return handle removing the callback
   */
  public Subscription subscribeToHealthChecks(Consumer<HealthCheck> callback) {
    Objects.requireNonNull(callback, "callback");
    return dispatcher.subscribe(NotificationKind.HEALTH_CHECK, n -> callback.accept((HealthCheck) n));
  }

  /**
   * Registers or clears the remediation hook used when automatic remediation is enabled.
   *
   * @param hook remediation hook, or {@code null}
   */
  public void setRemediationHook(RemediationHook hook) {
    dispatcher.setRemediationHook(hook);
  }

  /**
   * Returns the report of the most recently completed session.
   *
   * @return last report, or empty when no session completed
   */
  public Optional<FinalReport> lastReport() {
    lock.lock();
    try {
      return Optional.ofNullable(lastReport);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns a copy of the current session data.
   *
   * @return data copy, or empty before the first session
   */
  public Optional<SessionDataView> sessionData() {
    lock.lock();
    try {
      return active == null ? Optional.empty() : Optional.of(active.data.view(clock.nowMillis()));
    } finally {
      lock.unlock();
    }
  }

  /**
   * Stops a running session and releases the scheduler.
   */
  @Override
  public void close() {
    try {
      if (stop().isCompleted()) {
        log.info("Session stopped during close");
      }
    } finally {
      try {
        scheduler.close();
      } finally {
        if (ownedReadPool != null) {
          ownedReadPool.shutdownNow();
        }
      }
    }
  }

  private void initialize(String sessionId, SessionConfig config) throws SnapshotCollectionException {
    long startedAt = clock.nowMillis();
    SessionHandle handle = new SessionHandle(sessionId, startedAt, config.sessionDuration());
    SessionData data = new SessionData(sessionId, startedAt, config);
    LeakAnalysisEngine engine = new LeakAnalysisEngine(config.leak(), config.component());
    SnapshotCollector collector = new SnapshotCollector(
        metricsProvider, clock, probeExecutor, config.snapshotTimeout(), metrics);
    ActiveSession session = new ActiveSession(handle, config, data, engine, collector);
    session.tracker = new ComponentLifecycleTracker(
        engine,
        config.component(),
        scheduler,
        config.componentCheckInterval(),
        clock,
        sizeProbe,
        candidate -> onComponentCandidate(session, candidate),
        metrics);
    active = session;

    Snapshot baseline = collector.establishBaseline(0);
    data.appendSnapshot(baseline);

    session.tasks.add(scheduler.schedulePeriodic(
        "snapshot", config.snapshotInterval(), () -> guarded(session, "snapshot", () -> snapshotCycle(session))));
    session.tasks.add(scheduler.schedulePeriodic(
        "health-check", config.healthCheckInterval(), () -> guarded(session, "health", () -> healthCycle(session))));
    session.tasks.add(scheduler.schedulePeriodic(
        "progress", config.reportingInterval(), () -> guarded(session, "progress", () -> progressCycle(session))));
    session.tasks.add(scheduler.scheduleOnce(
        "deadline", config.sessionDuration(), () -> guarded(session, "deadline", () -> deadline(session))));
  }

  private void guarded(ActiveSession session, String cycle, Runnable body) {
    MDC.put(MDC_SESSION, session.handle.sessionId());
    try {
      body.run();
    } catch (RuntimeException ex) {
      metrics.increment("soak.cycle.failed");
      log.error("{} cycle failed; session continues", cycle, ex);
    } finally {
      MDC.remove(MDC_SESSION);
    }
  }

  private void snapshotCycle(ActiveSession session) {
    if (!isRunning(session)) {
      return;
    }
    Snapshot snapshot;
    try {
      snapshot = session.collector.takeSnapshot(session.tracker.trackedCount());
    } catch (SnapshotCollectionException ex) {
      log.warn("Snapshot skipped: {}", ex.getMessage());
      return;
    }
    lock.lock();
    try {
      if (!isRunning(session) || !session.data.appendSnapshot(snapshot)) {
        return;
      }
      if (session.config.enableLeakDetection()) {
        analyze(session, snapshot);
      }
    } finally {
      lock.unlock();
    }
  }

  private void analyze(ActiveSession session, Snapshot snapshot) {
    try {
      Snapshot baseline = session.collector.baseline()
          .orElseThrow(() -> new AnalysisException("baseline missing"));
      List<LeakCandidate> candidates = new ArrayList<>(session.engine.analyzeSnapshot(snapshot, baseline));
      session.engine
          .trendCandidate(session.engine.analyzeTrend(session.data.view(snapshot.timestampMillis()).snapshots()),
              snapshot.timestampMillis())
          .ifPresent(candidates::add);
      if (candidates.isEmpty()) {
        return;
      }
      metrics.observe("soak.leak.candidates", candidates.size());
      session.data.appendLeakCandidates(candidates);
      Alert alert = session.alerts.leakCycle(candidates, snapshot.timestampMillis());
      dispatcher.raiseAlert(session.data, alert, session.config.enableAutomaticRemediation());
    } catch (AnalysisException ex) {
      log.warn("Leak analysis skipped: {}", ex.getMessage());
    }
  }

  private void healthCycle(ActiveSession session) {
    lock.lock();
    try {
      if (!isRunning(session)) {
        return;
      }
      evaluateHealth(session, true);
    } finally {
      lock.unlock();
    }
  }

  private void evaluateHealth(ActiveSession session, boolean alertOnDegradation) {
    long now = clock.nowMillis();
    HealthCheck check = session.scorer.computeHealthScore(session.data.view(now), now);
    if (!session.data.appendHealthCheck(check)) {
      return;
    }
    metrics.observe("soak.health.score", Math.round(check.score()));
    log.info("Health check: score={} status={}", check.score(), check.status());
    dispatcher.publish(check);

    double minScore = session.config.health().minScore();
    boolean degraded = check.score() < minScore;
    if (alertOnDegradation && degraded && !session.degraded) {
      dispatcher.raiseAlert(session.data, session.alerts.healthDegraded(check, minScore),
          session.config.enableAutomaticRemediation());
    }
    session.degraded = degraded;
  }

  private void progressCycle(ActiveSession session) {
    ProgressReport report;
    lock.lock();
    try {
      if (!isRunning(session)) {
        return;
      }
      long now = clock.nowMillis();
      SessionDataView view = session.data.view(now);
      long elapsed = Math.max(0L, now - session.handle.startedAtMillis());
      long duration = session.handle.duration().toMillis();
      report = new ProgressReport(
          session.handle.sessionId(),
          now,
          elapsed,
          Math.max(0L, duration - elapsed),
          Math.min(100d, elapsed * 100d / duration),
          view.latestSnapshot().map(s -> OptionalDouble.of(s.usedMb())).orElse(OptionalDouble.empty()),
          view.latestHealthCheck().map(h -> OptionalDouble.of(h.score())).orElse(OptionalDouble.empty()),
          view.snapshots().size(),
          view.alerts().size(),
          view.leakCandidates().size(),
          session.tracker.trackedCount());
      log.info("Progress {}%: {} snapshots, {} alerts",
          Math.round(report.progressPercent()), report.snapshotCount(), report.alertCount());
      dispatcher.publish(report);
    } finally {
      lock.unlock();
    }
  }

  private void deadline(ActiveSession session) {
    lock.lock();
    try {
      if (!isRunning(session)) {
        return;
      }
      finish("configured duration elapsed");
    } finally {
      lock.unlock();
    }
  }

  private StopResult finish(String reason) {
    ActiveSession session = active;
    status = SessionStatus.STOPPING;
    MDC.put(MDC_SESSION, session.handle.sessionId());
    try {
      log.info("Stopping session: {}", reason);
      session.cancelTasks();
      for (LeakCandidate candidate : session.tracker.closeAll()) {
        recordComponentCandidate(session, candidate);
      }
      long endedAt = clock.nowMillis();
      try {
        Snapshot last = session.collector.takeSnapshot(0);
        session.data.appendSnapshot(last);
        endedAt = Math.max(endedAt, last.timestampMillis());
      } catch (SnapshotCollectionException ex) {
        log.warn("Final snapshot skipped: {}", ex.getMessage());
      }
      evaluateHealth(session, false);
      endedAt = Math.max(endedAt, clock.nowMillis());
      session.data.freeze(endedAt);

      FinalReport report;
      try {
        report = reportGenerator.generate(session.data.view(endedAt));
      } catch (RuntimeException ex) {
        throw new AnalysisException("report generation failed", ex);
      }
      lastReport = report;
      status = SessionStatus.COMPLETED;
      metrics.increment("soak.session.completed");
      log.info("Session completed: grade {} ({}), {} snapshots, {} alerts{}",
          report.grade().letter(), report.grade().score(), report.session().snapshotCount(),
          report.session().alertCount(), report.incompleteData() ? ", data incomplete" : "");
      export(report);
      return StopResult.completed(report);
    } catch (RuntimeException ex) {
      status = SessionStatus.ERROR;
      session.data.freeze(clock.nowMillis());
      log.error("Session finalization failed", ex);
      throw ex instanceof AnalysisException ? ex : new AnalysisException("session finalization failed", ex);
    } finally {
      registry.release(session.handle.sessionId());
      MDC.remove(MDC_SESSION);
    }
  }

  private void export(FinalReport report) {
    for (ReportExporter exporter : exporters) {
      try {
        exporter.export(report);
      } catch (Exception ex) {
        log.warn("Report exporter {} failed", exporter.getClass().getName(), ex);
      }
    }
  }

  private void onComponentCandidate(ActiveSession session, LeakCandidate candidate) {
    lock.lock();
    try {
      if (isRunning(session)) {
        recordComponentCandidate(session, candidate);
      }
    } finally {
      lock.unlock();
    }
  }

  private void recordComponentCandidate(ActiveSession session, LeakCandidate candidate) {
    if (!session.config.enableLeakDetection()) {
      log.debug("Leak detection disabled; ignoring {} candidate", candidate.type());
      return;
    }
    if (session.data.appendLeakCandidates(List.of(candidate))) {
      dispatcher.raiseAlert(session.data, session.alerts.component(candidate, candidate.detectedAtMillis()),
          session.config.enableAutomaticRemediation());
    }
  }

  private ActiveSession requireRunning(String operation) {
    if (status != SessionStatus.RUNNING || active == null) {
      throw new NoActiveSessionException(operation + " requires a running session (status " + status + ")");
    }
    return active;
  }

  private boolean isRunning(ActiveSession session) {
    return status == SessionStatus.RUNNING && active == session;
  }

  private static final class ActiveSession {
    private final SessionHandle handle;
    private final SessionConfig config;
    private final SessionData data;
    private final LeakAnalysisEngine engine;
    private final SnapshotCollector collector;
    private final HealthScorer scorer;
    private final AlertFactory alerts;
    private final List<ScheduledTask> tasks = new ArrayList<>();
    private ComponentLifecycleTracker tracker;
    private boolean degraded;

    private ActiveSession(
        SessionHandle handle,
        SessionConfig config,
        SessionData data,
        LeakAnalysisEngine engine,
        SnapshotCollector collector) {
      this.handle = handle;
      this.config = config;
      this.data = data;
      this.engine = engine;
      this.collector = collector;
      this.scorer = new HealthScorer(config);
      this.alerts = new AlertFactory(handle.sessionId());
    }

    private void cancelTasks() {
      for (ScheduledTask task : tasks) {
        task.cancel();
      }
      tasks.clear();
    }
  }

  /**
   * Builder for {@link SessionOrchestrator}. {@link #metricsProvider} and {@link #scheduler} are required.
   */
  public static final class Builder {
    private MetricsProvider metricsProvider;
    private TaskScheduler scheduler;
    private ClockPort clock;
    private MetricsPort metrics;
    private SessionRegistry registry;
    private Executor probeExecutor;
    private ComponentSizeProbe sizeProbe;
    private RemediationHook remediationHook;
    private final List<ReportExporter> exporters = new ArrayList<>();
    private Supplier<String> idGenerator;

    private Builder() {}

    /**
     * Sets the source of memory and runtime readings. Required.
     *
     * @param metricsProvider provider read for every snapshot
     * @return this builder
     */
    public Builder metricsProvider(MetricsProvider metricsProvider) {
      this.metricsProvider = metricsProvider;
      return this;
    }

    /**
     * Sets the scheduler driving the periodic tasks. Required; closed by {@link SessionOrchestrator#close()}.
     *
     * @param scheduler task scheduler
     * @return this builder
     */
    public Builder scheduler(TaskScheduler scheduler) {
      this.scheduler = scheduler;
      return this;
    }

    /**
     * Sets the time source; defaults to {@link ClockPort#SYSTEM}.
     *
     * @param clock time source
     * @return this builder
     */
    public Builder clock(ClockPort clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets the sink for the monitor's own counters; defaults to {@link MetricsPort#NO_OP}.
     *
     * @param metrics metrics sink
     * @return this builder
     */
    public Builder metrics(MetricsPort metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the registry shared by orchestrators that must not run concurrently; defaults to a private one.
     *
     * @param registry session registry
     * @return this builder
     */
    public Builder registry(SessionRegistry registry) {
      this.registry = registry;
      return this;
    }

    /**
     * Sets the executor running metrics reads. Without one the orchestrator owns a small daemon pool,
     * shut down by {@link SessionOrchestrator#close()}, so a hung read is bounded by the snapshot timeout.
     *
     * @param probeExecutor executor for provider reads
     * @return this builder
     */
    public Builder probeExecutor(Executor probeExecutor) {
      this.probeExecutor = probeExecutor;
      return this;
    }

    /**
     * Sets the per-unit size measurement; defaults to {@link ComponentSizeProbe#UNMEASURED}.
     *
     * @param sizeProbe unit size measurement
     * @return this builder
     */
    public Builder sizeProbe(ComponentSizeProbe sizeProbe) {
      this.sizeProbe = sizeProbe;
      return this;
    }

    /**
     * Sets the hook invoked for high-severity alerts when remediation is enabled.
     *
     * @param remediationHook hook, or {@code null} for none
     * @return this builder
     */
    public Builder remediationHook(RemediationHook remediationHook) {
      this.remediationHook = remediationHook;
      return this;
    }

    /**
     * Adds an exporter receiving the final report. May be called repeatedly.
     *
     * @param exporter report exporter
     * @return this builder
     */
    public Builder exporter(ReportExporter exporter) {
      this.exporters.add(Objects.requireNonNull(exporter, "exporter"));
      return this;
    }

    /**
     * Sets the session id source; defaults to {@code soak-} plus a random suffix.
     *
     * @param idGenerator session id supplier
     * @return this builder
     */
    public Builder idGenerator(Supplier<String> idGenerator) {
      this.idGenerator = idGenerator;
      return this;
    }

    /**
     * Builds the orchestrator.
     *
     * @return new orchestrator in {@code IDLE}
     * @throws NullPointerException when the metrics provider or scheduler is missing
     */
    public SessionOrchestrator build() {
      return new SessionOrchestrator(this);
    }
  }
}
