package ca.gc.cra.framescope.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DecodeSettingsTest {

  @Test
  void constructorClampsCountsAndDefaultsDurations() {
    DecodeSettings settings = new DecodeSettings(0, 0, Duration.ZERO, null, -4);

    assertEquals(1, settings.workers());
    assertEquals(1, settings.queueCapacity());
    assertEquals(DecodeSettings.defaults().taskTimeout(), settings.taskTimeout());
    assertEquals(DecodeSettings.defaults().drainTimeout(), settings.drainTimeout());
    assertEquals(0, settings.recentRecordLimit());
  }

  @Test
  void queueIsNeverSmallerThanThePool() {
    assertEquals(8, new DecodeSettings(8, 2, Duration.ofSeconds(1), Duration.ofSeconds(1), 0).queueCapacity());
  }

  @Test
  void fromMapReadsDecodeSection() {
    DecodeSettings settings = DecodeSettings.fromMap(Map.of(
        "decode.workers", "3",
        "queueCapacity", "50",
        "taskTimeoutMillis", "250",
        "decode.drainTimeoutMillis", "750",
        "recentRecordLimit", "5"));

    assertEquals(3, settings.workers());
    assertEquals(50, settings.queueCapacity());
    assertEquals(Duration.ofMillis(250), settings.taskTimeout());
    assertEquals(Duration.ofMillis(750), settings.drainTimeout());
    assertEquals(5, settings.recentRecordLimit());
  }

  @Test
  void fromMapRejectsOutOfRangeValues() {
    assertThrows(IllegalArgumentException.class, () -> DecodeSettings.fromMap(Map.of("workers", "65")));
    assertThrows(IllegalArgumentException.class, () -> DecodeSettings.fromMap(Map.of("taskTimeoutMillis", "0")));
    assertThrows(IllegalArgumentException.class, () -> DecodeSettings.fromMap(Map.of("queueCapacity", "x")));
  }

  @Test
  void defaultsHaveAtLeastOneWorker() {
    assertTrue(DecodeSettings.defaults().workers() >= 1);
  }
}
