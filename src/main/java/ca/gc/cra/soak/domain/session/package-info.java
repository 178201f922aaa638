/**
 * Session lifecycle values and the notifications published to subscribers.
 */
package ca.gc.cra.soak.domain.session;
