/**
 * Leak candidates, trends, alerts, health checks and remediation outcomes.
 * <p>All types are immutable and safe to hand to subscribers.</p>
 */
package ca.gc.cra.soak.domain.analysis;
