package wolfsim.security;

public record SanitizedText(String text, boolean injectionDetected) {
  public static SanitizedText clean(String text) {
    return new SanitizedText(text, false);
  }

  public static SanitizedText flagged(String text) {
    return new SanitizedText(text, true);
  }
}
