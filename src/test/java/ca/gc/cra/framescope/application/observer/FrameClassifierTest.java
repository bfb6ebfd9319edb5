package ca.gc.cra.framescope.application.observer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.framescope.config.ObservabilityConfig;
import ca.gc.cra.framescope.domain.frame.Frame;
import ca.gc.cra.framescope.domain.frame.FrameCategory;
import ca.gc.cra.framescope.domain.frame.FrameDirection;
import org.junit.jupiter.api.Test;

class FrameClassifierTest {
  private final FrameClassifier classifier = new FrameClassifier();

  @Test
  void classifiesByTypeTag() {
    assertEquals(FrameCategory.TRANSCRIPTION, classifier.classify(frame("TranscriptionFrame")));
    assertEquals(FrameCategory.TRANSCRIPTION, classifier.classify(frame("InterimTranscriptionFrame")));
    assertEquals(FrameCategory.TEXT, classifier.classify(frame("LLMTextFrame")));
    assertEquals(FrameCategory.AUDIO, classifier.classify(frame("OutputAudioRawFrame")));
    assertEquals(FrameCategory.CONTROL, classifier.classify(frame("BotStartedSpeakingFrame")));
    assertEquals(FrameCategory.OTHER, classifier.classify(frame("MetricsFrame")));
  }

  @Test
  void classificationIgnoresPayload() {
    Frame textWithAudio = Frame.builder("TextFrame").audio(new byte[16], 16_000, 1).build();
    assertEquals(FrameCategory.TEXT, classifier.classify(textWithAudio));
  }

  @Test
  void tagsUseShortNamesWithTruncatedFallback() {
    assertEquals("STT", classifier.tagFor(frame("TranscriptionFrame")));
    assertEquals("STT-PART", classifier.tagFor(frame("InterimTranscriptionFrame")));
    assertEquals("AUDIO-IN", classifier.tagFor(frame("InputAudioRawFrame")));
    assertEquals("USR-START", classifier.tagFor(frame("UserStartedSpeakingFrame")));
    assertEquals("MSG", classifier.tagFor(frame("OutputTransportMessageFrame")));
    assertEquals("VisionImag", classifier.tagFor(frame("VisionImageRawFrame")));
    assertEquals("Short", classifier.tagFor(frame("Short")));
  }

  @Test
  void captureGatingFollowsConfiguration() {
    ObservabilityConfig defaults = ObservabilityConfig.defaults();
    assertFalse(classifier.isCapturable(frame("InputAudioRawFrame"), defaults));
    assertTrue(classifier.isCapturable(frame("InputAudioRawFrame"), defaults.withAudioCapture(true)));
    assertTrue(classifier.isCapturable(frame("TranscriptionFrame"), defaults));
    assertFalse(classifier.isCapturable(frame("TranscriptionFrame"), defaults.withTextCapture(false)));
    assertFalse(classifier.isCapturable(frame("LLMTextFrame"), defaults.withTextCapture(false)));
    assertTrue(classifier.isCapturable(frame("StartFrame"), defaults.withTextCapture(false)));
    assertTrue(classifier.isCapturable(frame("MetricsFrame"), defaults));
  }

  @Test
  void nothingIsCapturedWhenDisabled() {
    ObservabilityConfig disabled = ObservabilityConfig.disabled();
    assertFalse(classifier.isCapturable(frame("StartFrame"), disabled));
    assertFalse(classifier.isCapturable(frame("TranscriptionFrame"), disabled));
    assertFalse(classifier.shouldDecode(disabled));
  }

  @Test
  void decodeFollowsBinaryLoggingSwitch() {
    assertTrue(classifier.shouldDecode(ObservabilityConfig.defaults()));
    assertFalse(classifier.shouldDecode(ObservabilityConfig.defaults().withBinaryLogging(false)));
  }

  @Test
  void directionGlyphs() {
    assertEquals(">>", FrameClassifier.directionGlyph(FrameDirection.DOWNSTREAM));
    assertEquals("<<", FrameClassifier.directionGlyph(FrameDirection.UPSTREAM));
    assertEquals("--", FrameClassifier.directionGlyph(FrameDirection.CONTROL));
    assertEquals("--", FrameClassifier.directionGlyph(null));
  }

  private static Frame frame(String type) {
    return Frame.builder(type).build();
  }
}
