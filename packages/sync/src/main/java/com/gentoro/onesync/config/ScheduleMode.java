package com.gentoro.onesync.config;

import com.gentoro.onesync.exception.ConfigException;
import java.util.Locale;

/**
 * How the periodic sync interval is measured.
 *
 * <p>{@link #FIXED_RATE} measures from each scheduled start, so a pass that overruns the interval
 * is followed immediately by the next tick (which the reentrancy guard skips if the pass is still
 * running). {@link #FIXED_DELAY} measures from the completion of the previous pass.
 */
public enum ScheduleMode {
  FIXED_RATE,
  FIXED_DELAY;

  public static ScheduleMode parse(String value) {
    if (value == null || value.isBlank()) return FIXED_RATE;
    return switch (value.trim().toLowerCase(Locale.ROOT).replace('_', '-')) {
      case "fixed-rate" -> FIXED_RATE;
      case "fixed-delay" -> FIXED_DELAY;
      default -> throw new ConfigException("Unsupported sync.schedule-mode: " + value);
    };
  }
}
