/**
 * Measurement records: memory samples, structural counts, performance samples and snapshots.
 */
package ca.gc.cra.soak.domain.metrics;
