package ca.gc.cra.relay.config;

import ca.gc.cra.relay.validation.Numbers;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/** Typed readers over flattened string options. */
final class OptionValues {
  private OptionValues() {}

  static String string(Map<String, String> options, String key, String fallback) {
    String value = options.get(key);
    return value == null || value.isBlank() ? fallback : value.trim();
  }

  static Optional<String> optionalString(Map<String, String> options, String key) {
    String value = options.get(key);
    return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
  }

  static boolean bool(Map<String, String> options, String key, boolean fallback) {
    String value = options.get(key);
    if (value == null || value.isBlank()) {
      return fallback;
    }
    String normalized = value.trim();
    if (normalized.equalsIgnoreCase("true")) {
      return true;
    }
    if (normalized.equalsIgnoreCase("false")) {
      return false;
    }
    throw new IllegalArgumentException(key + " must be true or false (was " + value + ")");
  }

  static int integer(Map<String, String> options, String key, int fallback, int min, int max) {
    String value = options.get(key);
    if (value == null || value.isBlank()) {
      return fallback;
    }
    try {
      return (int) Numbers.requireRange(key, Long.parseLong(value.trim()), min, max);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was " + value + ")", ex);
    }
  }

  static double decimal(Map<String, String> options, String key, double fallback, double min) {
    String value = options.get(key);
    if (value == null || value.isBlank()) {
      return fallback;
    }
    try {
      return Numbers.requireAtLeast(key, Double.parseDouble(value.trim()), min);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be a number (was " + value + ")", ex);
    }
  }

  static Duration millis(Map<String, String> options, String key, Duration fallback, long minMillis) {
    String value = options.get(key);
    if (value == null || value.isBlank()) {
      return fallback;
    }
    try {
      long parsed = Long.parseLong(value.trim());
      return Duration.ofMillis(Numbers.requireRange(key, parsed, minMillis, Long.MAX_VALUE / 2));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be a number of milliseconds (was " + value + ")", ex);
    }
  }

  static Optional<Path> optionalPath(Map<String, String> options, String key) {
    Optional<String> value = optionalString(options, key);
    if (value.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Path.of(value.get()).toAbsolutePath().normalize());
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(key + " is not a valid path: " + value.get(), ex);
    }
  }
}
