package ca.gc.cra.framescope.application.observer;

import ca.gc.cra.framescope.config.ObservabilityConfig;
import ca.gc.cra.framescope.domain.frame.Frame;
import ca.gc.cra.framescope.domain.frame.FrameCategory;
import ca.gc.cra.framescope.domain.frame.FrameDirection;
import java.util.Map;
import java.util.Objects;

/**
 * Classifies frames by type tag and decides whether they qualify for capture.
 * <p>Classification never inspects payload contents. Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class FrameClassifier {
  private static final int FALLBACK_TAG_LENGTH = 10;

  private static final Map<String, Entry> ENTRIES = Map.ofEntries(
      Map.entry("UserStartedSpeakingFrame", new Entry(FrameCategory.CONTROL, "USR-START")),
      Map.entry("UserStoppedSpeakingFrame", new Entry(FrameCategory.CONTROL, "USR-STOP")),
      Map.entry("BotStartedSpeakingFrame", new Entry(FrameCategory.CONTROL, "BOT-START")),
      Map.entry("BotStoppedSpeakingFrame", new Entry(FrameCategory.CONTROL, "BOT-STOP")),
      Map.entry("TTSStartedFrame", new Entry(FrameCategory.CONTROL, "TTS-START")),
      Map.entry("TTSStoppedFrame", new Entry(FrameCategory.CONTROL, "TTS-STOP")),
      Map.entry("LLMFullResponseStartFrame", new Entry(FrameCategory.CONTROL, "LLM-START")),
      Map.entry("LLMFullResponseEndFrame", new Entry(FrameCategory.CONTROL, "LLM-END")),
      Map.entry("StartFrame", new Entry(FrameCategory.CONTROL, "START")),
      Map.entry("EndFrame", new Entry(FrameCategory.CONTROL, "END")),
      Map.entry("CancelFrame", new Entry(FrameCategory.CONTROL, "CANCEL")),
      Map.entry("TranscriptionFrame", new Entry(FrameCategory.TRANSCRIPTION, "STT")),
      Map.entry("InterimTranscriptionFrame", new Entry(FrameCategory.TRANSCRIPTION, "STT-PART")),
      Map.entry("LLMTextFrame", new Entry(FrameCategory.TEXT, "LLM")),
      Map.entry("TTSTextFrame", new Entry(FrameCategory.TEXT, "TTS-TEXT")),
      Map.entry("TextFrame", new Entry(FrameCategory.TEXT, "TEXT")),
      Map.entry("InputAudioRawFrame", new Entry(FrameCategory.AUDIO, "AUDIO-IN")),
      Map.entry("OutputAudioRawFrame", new Entry(FrameCategory.AUDIO, "AUDIO-OUT")),
      Map.entry("TTSAudioRawFrame", new Entry(FrameCategory.AUDIO, "TTS-AUDIO")),
      Map.entry("AudioRawFrame", new Entry(FrameCategory.AUDIO, "AUDIO")),
      Map.entry("OutputTransportMessageFrame", new Entry(FrameCategory.OTHER, "MSG")),
      Map.entry("TransportMessageFrame", new Entry(FrameCategory.OTHER, "MSG")),
      Map.entry("TransportMessageUrgentFrame", new Entry(FrameCategory.OTHER, "MSG")));

  /**
   * Returns the category of a frame.
   *
   * @param frame frame to classify
   * @return category registered for the frame's type tag, {@link FrameCategory#OTHER} when unknown
   */
  public FrameCategory classify(Frame frame) {
    Entry entry = ENTRIES.get(Objects.requireNonNull(frame, "frame").typeName());
    return entry != null ? entry.category() : FrameCategory.OTHER;
  }

  /**
   * Returns the short display tag of a frame, such as {@code STT} or {@code AUDIO-IN}.
   *
   * @param frame frame to tag
   * @return registered tag, or the first ten characters of the type name
   */
  public String tagFor(Frame frame) {
    String typeName = Objects.requireNonNull(frame, "frame").typeName();
    Entry entry = ENTRIES.get(typeName);
    if (entry != null) {
      return entry.tag();
    }
    return typeName.length() <= FALLBACK_TAG_LENGTH ? typeName : typeName.substring(0, FALLBACK_TAG_LENGTH);
  }

  /**
   * Decides whether a frame qualifies for background capture under {@code config}.
   * <p>Audio needs audio capture, text and transcription need text capture, control and other frames always
   * qualify. Nothing qualifies when the master switch is off.</p>
   *
   * @param frame frame to test
   * @param config active configuration
   * @return {@code true} when decode and log work should be scheduled
   */
  public boolean isCapturable(Frame frame, ObservabilityConfig config) {
    return isCapturable(classify(frame), config);
  }

  boolean isCapturable(FrameCategory category, ObservabilityConfig config) {
    if (!config.enabled()) {
      return false;
    }
    if (category == FrameCategory.AUDIO) {
      return config.enableAudioCapture();
    }
    if (category.isTextual()) {
      return config.enableTextCapture();
    }
    return true;
  }

  /**
   * Decides whether a captured frame is also serialized and decoded.
   *
   * @param config active configuration
   * @return {@code true} when binary logging is enabled
   */
  public boolean shouldDecode(ObservabilityConfig config) {
    return config.enabled() && config.enableBinaryLogging();
  }

  /**
   * Maps a direction to its display glyph.
   *
   * @param direction frame direction
   * @return {@code >>} downstream, {@code <<} upstream, {@code --} otherwise
   */
  public static String directionGlyph(FrameDirection direction) {
    if (direction == null) {
      return "--";
    }
    return switch (direction) {
      case DOWNSTREAM -> ">>";
      case UPSTREAM -> "<<";
      case CONTROL -> "--";
    };
  }

  private record Entry(FrameCategory category, String tag) {}
}
