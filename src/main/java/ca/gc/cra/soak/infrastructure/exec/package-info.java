/**
 * Executor factories for the session scheduler and metrics probes.
 * <p><strong>Role:</strong> Infrastructure utilities configuring named daemon threads.</p>
 * <p><strong>Concurrency:</strong> The session scheduler is single-threaded so periodic callbacks never
 * overlap; probe reads run on a separate pool bounded by the snapshot timeout.</p>
 */
package ca.gc.cra.soak.infrastructure.exec;
