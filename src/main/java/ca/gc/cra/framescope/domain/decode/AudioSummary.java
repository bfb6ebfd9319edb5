package ca.gc.cra.framescope.domain.decode;

import java.util.Locale;

/**
 * Size and format summary that stands in for raw audio in decode results and log lines.
 *
 * @param byteCount number of audio bytes
 * @param sampleRate sample rate in Hz; zero when unknown
 * @param channels channel count; zero when unknown
 * @since 0.1.0
 */
public record AudioSummary(int byteCount, int sampleRate, int channels) {

  /** Rejects negative values. */
  public AudioSummary {
    if (byteCount < 0 || sampleRate < 0 || channels < 0) {
      throw new IllegalArgumentException("audio summary values must be >= 0");
    }
  }

  @Override
  public String toString() {
    String base = String.format(Locale.ROOT, "[%.1fKB @ %dHz", byteCount / 1024d, sampleRate);
    return channels > 0 ? base + " x" + channels + "]" : base + "]";
  }
}
