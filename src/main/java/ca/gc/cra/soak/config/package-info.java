/**
 * <strong>Purpose:</strong> Session configuration: typed records, YAML loading, override merging and
 * composition of the runtime adapters.
 * <p><strong>Precedence:</strong> explicit overrides, then the YAML profile over its {@code common}
 * section, then {@link ca.gc.cra.soak.config.DefaultsForSession}.</p>
 *
 * @since SOAK 0.1
 */
package ca.gc.cra.soak.config;
