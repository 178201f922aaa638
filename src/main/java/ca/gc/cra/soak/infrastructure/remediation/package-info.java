/**
 * Remediation hooks invoked for HIGH and CRITICAL alerts when automatic remediation is enabled.
 */
package ca.gc.cra.soak.infrastructure.remediation;
