/**
 * <strong>Purpose:</strong> Session use cases: orchestration, snapshot collection, component tracking, leak
 * analysis, health scoring, alert fan-out and report generation.
 * <p><strong>Role:</strong> Application layer between the ports in
 * {@link ca.gc.cra.soak.application.port} and the immutable records in {@code ca.gc.cra.soak.domain}.</p>
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.soak.application.monitor.SessionOrchestrator} serializes
 * every mutation of session data; the analysis classes are stateless.</p>
 *
 * @since SOAK 0.1
 */
package ca.gc.cra.soak.application.monitor;
