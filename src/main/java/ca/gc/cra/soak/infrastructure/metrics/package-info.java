/**
 * OpenTelemetry bridge for the monitor's own {@code soak.*} metrics.
 * <p><strong>Concurrency:</strong> Instruments are cached per key and safe for concurrent updates.</p>
 * <p><strong>Security:</strong> Only metric keys are attached as attributes; alert details and unit ids
 * never leave the process through metrics.</p>
 */
package ca.gc.cra.soak.infrastructure.metrics;
