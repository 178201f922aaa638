/**
 * Final report, grade and recommendation records.
 */
package ca.gc.cra.soak.domain.report;
