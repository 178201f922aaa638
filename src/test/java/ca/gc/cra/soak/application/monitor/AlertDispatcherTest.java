package ca.gc.cra.soak.application.monitor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.soak.config.SessionConfig;
import ca.gc.cra.soak.domain.analysis.Alert;
import ca.gc.cra.soak.domain.analysis.AlertType;
import ca.gc.cra.soak.domain.analysis.HealthCheck;
import ca.gc.cra.soak.domain.analysis.HealthStatus;
import ca.gc.cra.soak.domain.analysis.RemediationOutcome;
import ca.gc.cra.soak.domain.analysis.RemediationRecord;
import ca.gc.cra.soak.domain.analysis.Severity;
import ca.gc.cra.soak.domain.session.NotificationKind;
import ca.gc.cra.soak.domain.session.SessionNotification;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class AlertDispatcherTest {
  private MutableClock clock;
  private RecordingMetricsPort metrics;
  private AlertDispatcher dispatcher;
  private SessionData data;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(5_000L);
    metrics = new RecordingMetricsPort();
    dispatcher = new AlertDispatcher(clock, metrics);
    data = new SessionData("s-1", 0L, SessionConfig.defaults());
  }

  @Test
  void failingSubscriberDoesNotStopOthers() {
    List<String> calls = new ArrayList<>();
    dispatcher.subscribe(NotificationKind.ALERT, n -> calls.add("first"));
    dispatcher.subscribe(NotificationKind.ALERT, n -> {
      throw new IllegalStateException("boom");
    });
    dispatcher.subscribe(NotificationKind.ALERT, n -> calls.add("third"));

    Logger logger = (Logger) LoggerFactory.getLogger(AlertDispatcher.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    boolean originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender.start();
    logger.addAppender(appender);
    int failures;
    try {
      failures = dispatcher.publish(alert(Severity.LOW));
    } finally {
      logger.detachAppender(appender);
      logger.setAdditive(originalAdditive);
      appender.stop();
    }

    assertEquals(1, failures);
    assertEquals(List.of("first", "third"), calls);
    assertEquals(1, metrics.count("soak.subscriber.failed"));
    assertTrue(appender.list.stream().anyMatch(e -> e.getLevel() == Level.WARN
        && e.getThrowableProxy() != null
        && e.getThrowableProxy().getClassName().equals(SubscriberException.class.getName())));
  }

  @Test
  void notificationsReachOnlyTheirKind() {
    List<SessionNotification> alerts = new ArrayList<>();
    List<SessionNotification> checks = new ArrayList<>();
    dispatcher.subscribe(NotificationKind.ALERT, alerts::add);
    dispatcher.subscribe(NotificationKind.HEALTH_CHECK, checks::add);

    dispatcher.publish(new HealthCheck(1L, 95d, HealthStatus.EXCELLENT, List.of()));

    assertTrue(alerts.isEmpty());
    assertEquals(1, checks.size());
  }

  @Test
  void unsubscribeStopsDelivery() {
    List<SessionNotification> received = new ArrayList<>();
    Subscription subscription = dispatcher.subscribe(NotificationKind.ALERT, received::add);

    dispatcher.publish(alert(Severity.LOW));
    subscription.unsubscribe();
    dispatcher.publish(alert(Severity.LOW));

    assertEquals(1, received.size());
    assertEquals(0, dispatcher.subscriberCount(NotificationKind.ALERT));
  }

  @Test
  void raisedAlertIsRecordedBeforeSubscribersSeeIt() {
    List<Integer> alertCountsSeen = new ArrayList<>();
    dispatcher.subscribe(NotificationKind.ALERT, n -> alertCountsSeen.add(data.alertCount()));

    assertTrue(dispatcher.raiseAlert(data, alert(Severity.MEDIUM), false));

    assertEquals(List.of(1), alertCountsSeen);
    assertEquals(1, metrics.count("soak.alert.raised"));
    assertEquals(1, metrics.count("soak.alert.medium"));
  }

  @Test
  void highAlertInvokesRemediationWhenEnabled() {
    List<Alert> remediated = new ArrayList<>();
    dispatcher.setRemediationHook(alert -> {
      remediated.add(alert);
      return new RemediationOutcome(true, 3L * 1024 * 1024, "freed");
    });

    dispatcher.raiseAlert(data, alert(Severity.HIGH), true);
    dispatcher.raiseAlert(data, alert(Severity.MEDIUM), true);
    dispatcher.raiseAlert(data, alert(Severity.CRITICAL), false);

    assertEquals(1, remediated.size());
    List<RemediationRecord> records = data.view(clock.nowMillis()).remediations();
    assertEquals(1, records.size());
    assertTrue(records.get(0).outcome().success());
    assertEquals(5_000L, records.get(0).timestampMillis());
    assertEquals(1, metrics.count("soak.remediation.invoked"));
  }

  @Test
  void failingRemediationIsRecordedAsFailure() {
    dispatcher.setRemediationHook(alert -> {
      throw new IllegalStateException("cannot collect");
    });

    assertTrue(dispatcher.raiseAlert(data, alert(Severity.CRITICAL), true));

    RemediationRecord record = data.view(clock.nowMillis()).remediations().get(0);
    assertFalse(record.outcome().success());
    assertEquals("cannot collect", record.outcome().message());
    assertEquals(1, metrics.count("soak.remediation.failed"));
  }

  @Test
  void alertsAreDroppedOnceDataIsFrozen() {
    List<SessionNotification> received = new ArrayList<>();
    dispatcher.subscribe(NotificationKind.ALERT, received::add);
    data.freeze(10L);

    assertFalse(dispatcher.raiseAlert(data, alert(Severity.HIGH), true));

    assertTrue(received.isEmpty());
    assertEquals(0, data.alertCount());
  }

  private static Alert alert(Severity severity) {
    return new Alert("s-1-alert-" + severity, AlertType.MEMORY_LEAK, severity, 1_000L, "details",
        List.of(), Map.of());
  }
}
