package ca.gc.cra.framescope.domain.stats;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.framescope.domain.frame.FrameDirection;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PayloadTotalsTest {

  @Test
  void directionAccessorsDefaultToZero() {
    PayloadTotals totals = new PayloadTotals(
        40,
        Map.of(FrameDirection.DOWNSTREAM, 3L),
        Map.of(FrameDirection.DOWNSTREAM, 40L),
        Map.of(),
        0, 0, 0, 0);

    assertEquals(3L, totals.downstreamCount());
    assertEquals(40L, totals.downstreamBytes());
    assertEquals(0L, totals.upstreamCount());
    assertEquals(0L, totals.upstreamBytes());
    assertEquals(3L, totals.totalMessages());
  }

  @Test
  void emptyTotalsHaveNothingRecorded() {
    assertEquals(0L, PayloadTotals.EMPTY.totalMessages());
    assertEquals(0L, PayloadTotals.EMPTY.upstreamBytes());
  }
}
