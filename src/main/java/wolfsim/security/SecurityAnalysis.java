package wolfsim.security;

import java.util.Locale;
import java.util.Set;

/**
 * Parsed reply of the security-analysis prompt. The reply is free text with three marker
 * lines; any marker that is missing leaves its field at the default.
 *
 * <pre>
 * HAS_INJECTION: true|false
 * REASON: ...
 * CLEANED_CONTENT: ...
 * </pre>
 *
 * The cleaned content may continue over several lines and ends at the next marker.
 */
public record SecurityAnalysis(boolean hasInjection, String reason, String cleanedContent) {
  static final String HAS_INJECTION = "HAS_INJECTION:";
  static final String REASON = "REASON:";
  static final String CLEANED_CONTENT = "CLEANED_CONTENT:";

  private static final Set<String> PLACEHOLDERS = Set.of(
      "", "n/a", "na", "none", "null", "same", "unchanged", "same as original",
      "[cleaned content]", "<cleaned content>", "[cleaned_content]", "<cleaned_content>");

  public static final SecurityAnalysis NONE = new SecurityAnalysis(false, null, null);

  /** Cleaned text worth substituting for the original, or null. */
  public String usableCleanedContent() {
    if (cleanedContent == null) return null;
    String trimmed = cleanedContent.trim();
    if (PLACEHOLDERS.contains(trimmed.toLowerCase(Locale.ROOT))) return null;
    return trimmed;
  }

  public static SecurityAnalysis parse(String response) {
    if (response == null || response.isBlank()) return NONE;

    boolean hasInjection = false;
    String reason = null;
    StringBuilder cleaned = null;
    boolean collecting = false;

    for (String rawLine : response.split("\\R")) {
      String line = stripDecoration(rawLine);
      String upper = line.toUpperCase(Locale.ROOT);
      if (upper.startsWith(HAS_INJECTION)) {
        String value = line.substring(HAS_INJECTION.length()).trim().toLowerCase(Locale.ROOT);
        hasInjection = value.startsWith("true") || value.startsWith("yes");
        collecting = false;
      } else if (upper.startsWith(REASON)) {
        reason = line.substring(REASON.length()).trim();
        collecting = false;
      } else if (upper.startsWith(CLEANED_CONTENT)) {
        cleaned = new StringBuilder(line.substring(CLEANED_CONTENT.length()).trim());
        collecting = true;
      } else if (collecting) {
        cleaned.append('\n').append(rawLine);
      }
    }

    return new SecurityAnalysis(hasInjection, reason, cleaned == null ? null : cleaned.toString().trim());
  }

  private static String stripDecoration(String line) {
    String out = line.trim().replace("**", "");
    while (out.startsWith("-") || out.startsWith("#") || out.startsWith("*")) {
      out = out.substring(1).trim();
    }
    return out;
  }
}
