package spmwis.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Records how long each named pipeline stage took, in the order the stages ran. */
public final class StageTimings {
  private final long startedAt;
  private final Map<String, Long> stageNanos = new LinkedHashMap<>();
  private long lastMark;

  private StageTimings(long startedAt) {
    this.startedAt = startedAt;
    this.lastMark = startedAt;
  }

  public static StageTimings start() {
    return new StageTimings(System.nanoTime());
  }

  /** Closes the current stage under {@code stage} and returns its duration in nanoseconds. */
  public long mark(String stage) {
    long now = System.nanoTime();
    long elapsed = now - lastMark;
    stageNanos.merge(stage, elapsed, Long::sum);
    lastMark = now;
    return elapsed;
  }

  public long elapsedMillis() {
    return (System.nanoTime() - startedAt) / 1_000_000L;
  }

  /** Stage durations in milliseconds, fractional, in execution order. */
  public Map<String, Double> stageMillis() {
    Map<String, Double> millis = new LinkedHashMap<>();
    stageNanos.forEach((stage, nanos) -> millis.put(stage, nanos / 1_000_000.0));
    return Collections.unmodifiableMap(millis);
  }
}
