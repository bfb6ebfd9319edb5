package ca.gc.cra.framescope.domain.stats;

import ca.gc.cra.framescope.domain.frame.FrameDirection;
import ca.gc.cra.framescope.domain.frame.FrameTypeKey;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Serialized-payload accounting collected by background decode tasks.
 *
 * @param totalBytes bytes of every payload handed to the decoder
 * @param messagesByDirection decoded payload count per direction
 * @param bytesByDirection payload bytes per direction
 * @param bytesByType payload bytes per frame type
 * @param undecodable payloads the decoder could not interpret
 * @param serializationFailures serializer invocations that threw
 * @param timeouts decode tasks cancelled by the per-task timeout
 * @param rejected decode tasks dropped because the worker queue was full
 * @since 0.1.0
 */
public record PayloadTotals(
    long totalBytes,
    Map<FrameDirection, Long> messagesByDirection,
    Map<FrameDirection, Long> bytesByDirection,
    Map<FrameTypeKey, Long> bytesByType,
    long undecodable,
    long serializationFailures,
    long timeouts,
    long rejected) {

  /** Totals with nothing recorded. */
  public static final PayloadTotals EMPTY =
      new PayloadTotals(0, Map.of(), Map.of(), Map.of(), 0, 0, 0, 0);

  /** Copies the maps so the record never aliases tracker state. */
  public PayloadTotals {
    messagesByDirection = copyDirections(messagesByDirection);
    bytesByDirection = copyDirections(bytesByDirection);
    bytesByType = bytesByType == null || bytesByType.isEmpty()
        ? Map.of()
        : Collections.unmodifiableMap(new TreeMap<>(bytesByType));
  }

  /**
   * Returns decoded downstream payloads.
   *
   * @return downstream payload count
   */
  public long downstreamCount() {
    return messagesByDirection.getOrDefault(FrameDirection.DOWNSTREAM, 0L);
  }

  /**
   * Returns decoded upstream payloads.
   *
   * @return upstream payload count
   */
  public long upstreamCount() {
    return messagesByDirection.getOrDefault(FrameDirection.UPSTREAM, 0L);
  }

  /**
   * Returns downstream payload bytes.
   *
   * @return downstream byte total
   */
  public long downstreamBytes() {
    return bytesByDirection.getOrDefault(FrameDirection.DOWNSTREAM, 0L);
  }

  /**
   * Returns upstream payload bytes.
   *
   * @return upstream byte total
   */
  public long upstreamBytes() {
    return bytesByDirection.getOrDefault(FrameDirection.UPSTREAM, 0L);
  }

  /**
   * Returns the number of payloads recorded across all directions.
   *
   * @return total decoded payload count
   */
  public long totalMessages() {
    long total = 0;
    for (long count : messagesByDirection.values()) {
      total += count;
    }
    return total;
  }

  private static Map<FrameDirection, Long> copyDirections(Map<FrameDirection, Long> source) {
    if (source == null || source.isEmpty()) {
      return Map.of();
    }
    return Collections.unmodifiableMap(new EnumMap<>(source));
  }
}
