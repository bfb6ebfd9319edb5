package ca.gc.cra.framescope.api;

/** Process exit codes returned by the command-line entry points. */
public enum ExitCode {
  /** Command completed. */
  SUCCESS(0),
  /** Arguments missing or malformed; usage was printed. */
  INVALID_ARGS(2),
  /** Input could not be read or was not a valid frame log. */
  IO_ERROR(3),
  /** Configuration values were rejected. */
  CONFIG_ERROR(4),
  /** Unexpected failure while replaying. */
  RUNTIME_FAILURE(5),
  /** Interrupted before completion. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }
}
