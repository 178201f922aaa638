package ca.gc.cra.soak.domain.session;

/**
 * Lifecycle states of a monitoring session.
 *
 * @since SOAK 0.1
 */
public enum SessionStatus {
  IDLE,
  INITIALIZING,
  RUNNING,
  STOPPING,
  COMPLETED,
  ERROR;

  /**
   * Reports whether a new session may start from this state.
   *
   * @return {@code true} for {@link #IDLE}, {@link #COMPLETED} and {@link #ERROR}
   */
  public boolean acceptsStart() {
    return this == IDLE || this == COMPLETED || this == ERROR;
  }
}
