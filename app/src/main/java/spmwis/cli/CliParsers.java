package spmwis.cli;

/** Shared helpers for CLI argument parsing. */
final class CliParsers {

  private CliParsers() {}

  static int parseNonNegativeInt(String raw, int defaultValue, String optionName) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    int value;
    try {
      value = Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid integer for " + optionName + ": " + raw);
    }
    if (value < 0) {
      throw new IllegalArgumentException(optionName + " must be non-negative: " + raw);
    }
    return value;
  }

  static boolean isOption(String raw) {
    return raw != null && raw.startsWith("--") && raw.length() > 2;
  }
}
