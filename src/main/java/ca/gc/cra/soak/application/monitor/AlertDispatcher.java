package ca.gc.cra.soak.application.monitor;

import ca.gc.cra.soak.application.port.ClockPort;
import ca.gc.cra.soak.application.port.MetricsPort;
import ca.gc.cra.soak.application.port.RemediationHook;
import ca.gc.cra.soak.domain.analysis.Alert;
import ca.gc.cra.soak.domain.analysis.RemediationOutcome;
import ca.gc.cra.soak.domain.analysis.RemediationRecord;
import ca.gc.cra.soak.domain.analysis.Severity;
import ca.gc.cra.soak.domain.session.NotificationKind;
import ca.gc.cra.soak.domain.session.SessionNotification;
import ca.gc.cra.soak.logging.Logs;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Appends alerts to the session log and fans notifications out to subscribers.
 * <p><strong>Isolation:</strong> subscribers are invoked in registration order; a subscriber that throws is
 * logged as a {@link SubscriberException} and never stops delivery to the others or fails the caller.
 * Remediation failures are recorded as unsuccessful outcomes.</p>
 * <p><strong>Remediation:</strong> when enabled, the registered hook runs for every appended alert of
 * severity HIGH or above, after subscribers were notified.</p>
 * <p><strong>Thread-safety:</strong> Subscription lists are copy-on-write; subscribe and unsubscribe may
 * be called from any thread, including from within a callback.</p>
 *
 * @since SOAK 0.1
 */
public final class AlertDispatcher {
  private static final Logger log = LoggerFactory.getLogger(AlertDispatcher.class);
  private static final int MAX_LOGGED_DETAIL_BYTES = 512;

  private final Map<NotificationKind, List<Consumer<? super SessionNotification>>> subscribers =
      new EnumMap<>(NotificationKind.class);
  private final ClockPort clock;
  private final MetricsPort metrics;
  private volatile RemediationHook remediationHook;

  /**
   * Creates a dispatcher.
   *
   * @param clock time source for remediation records
   * @param metrics metrics sink; {@code null} falls back to {@link MetricsPort#NO_OP}
   */
  public AlertDispatcher(ClockPort clock, MetricsPort metrics) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    for (NotificationKind kind : NotificationKind.values()) {
      subscribers.put(kind, new CopyOnWriteArrayList<>());
    }
  }

  /**
   * Registers a callback for one notification kind.
   *
   * @param kind notification kind
   * @param callback callback receiving read-only payloads
   * @return handle removing the callback
   */
  public Subscription subscribe(NotificationKind kind, Consumer<? super SessionNotification> callback) {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(callback, "callback");
    List<Consumer<? super SessionNotification>> list = subscribers.get(kind);
    Consumer<? super SessionNotification> entry = notification -> callback.accept(notification);
    list.add(entry);
    return () -> list.remove(entry);
  }

  /**
   * Registers or clears the remediation hook.
   *
   * @param hook hook invoked for HIGH and CRITICAL alerts; {@code null} clears it
   */
  public void setRemediationHook(RemediationHook hook) {
    this.remediationHook = hook;
  }

  public Optional<RemediationHook> remediationHook() {
    return Optional.ofNullable(remediationHook);
  }

  /**
   * Appends {@code alert} to the session alert log, notifies alert subscribers and optionally remediates.
   *
   * @param data session data receiving the alert
   * @param alert alert to raise
   * @param remediate whether automatic remediation is enabled for this session
   * @return {@code false} when the session data is frozen and the alert was dropped
   */
  public boolean raiseAlert(SessionData data, Alert alert, boolean remediate) {
    Objects.requireNonNull(data, "data");
    Objects.requireNonNull(alert, "alert");
    if (!data.appendAlert(alert)) {
      return false;
    }
    metrics.increment("soak.alert.raised");
    metrics.increment("soak.alert." + alert.severity().name().toLowerCase(Locale.ROOT));
    log.warn("Alert {} [{} {}]: {}", alert.id(), alert.severity(), alert.type(),
        Logs.truncate(alert.details(), MAX_LOGGED_DETAIL_BYTES));
    publish(alert);

    RemediationHook hook = remediationHook;
    if (remediate && hook != null && alert.severity().atLeast(Severity.HIGH)) {
      data.appendRemediation(new RemediationRecord(alert.id(), clock.nowMillis(), remediate(hook, alert)));
    }
    return true;
  }

  /**
   * Delivers a notification to every subscriber of its kind.
   *
   * @param notification payload
   * @return number of subscribers that failed
   */
  public int publish(SessionNotification notification) {
    Objects.requireNonNull(notification, "notification");
    int failures = 0;
    for (Consumer<? super SessionNotification> subscriber : subscribers.get(notification.kind())) {
      try {
        subscriber.accept(notification);
      } catch (RuntimeException ex) {
        failures++;
        metrics.increment("soak.subscriber.failed");
        SubscriberException wrapped = new SubscriberException(notification.kind(), ex);
        log.warn(wrapped.getMessage(), wrapped);
      }
    }
    return failures;
  }

  public int subscriberCount(NotificationKind kind) {
    return subscribers.get(kind).size();
  }

  private RemediationOutcome remediate(RemediationHook hook, Alert alert) {
    metrics.increment("soak.remediation.invoked");
    try {
      RemediationOutcome outcome = hook.remediate(alert);
      if (outcome == null) {
        return RemediationOutcome.failed("remediation hook returned no outcome");
      }
      log.info("Remediation for alert {} {} (reclaimed {})", alert.id(),
          outcome.success() ? "succeeded" : "did not succeed", Logs.megabytes(outcome.reclaimedBytes()));
      return outcome;
    } catch (Exception ex) {
      metrics.increment("soak.remediation.failed");
      log.warn("Remediation hook failed for alert {}", alert.id(), ex);
      return RemediationOutcome.failed(String.valueOf(ex.getMessage()));
    }
  }
}
