/**
 * <strong>Purpose:</strong> Capabilities the session monitor depends on: clock, metrics, host probes,
 * scheduling, remediation and report export.
 * <p><strong>Role:</strong> Application layer; infrastructure adapters implement these interfaces and tests
 * substitute deterministic fakes.</p>
 * <p><strong>Concurrency:</strong> Implementations must be thread-safe unless documented otherwise.</p>
 *
 * @since SOAK 0.1
 */
package ca.gc.cra.soak.application.port;
