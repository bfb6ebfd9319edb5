package ca.gc.cra.framescope.domain.frame;

/**
 * Logical category of a frame, derived from its type tag.
 *
 * @since 0.1.0
 */
public enum FrameCategory {
  /** Plain or LLM-generated text. */
  TEXT,
  /** Final or interim speech-to-text output. */
  TRANSCRIPTION,
  /** Raw audio travelling in or out of the pipeline. */
  AUDIO,
  /** Lifecycle and turn-taking signals (start, end, speaking markers). */
  CONTROL,
  /** Anything the classifier does not recognize. */
  OTHER;

  /**
   * Indicates whether frames of this category carry text subject to text capture.
   *
   * @return {@code true} for {@link #TEXT} and {@link #TRANSCRIPTION}
   */
  public boolean isTextual() {
    return this == TEXT || this == TRANSCRIPTION;
  }
}
