/**
 * Scheduling adapters for the {@link ca.gc.cra.soak.application.port.TaskScheduler} port.
 */
package ca.gc.cra.soak.infrastructure.scheduling;
