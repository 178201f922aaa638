/**
 * Metrics providers reading the local JVM through {@code java.lang.management}.
 */
package ca.gc.cra.soak.infrastructure.runtime;
