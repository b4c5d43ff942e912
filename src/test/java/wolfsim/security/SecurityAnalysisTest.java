package wolfsim.security;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class SecurityAnalysisTest {

  @Test
  void parse_readsAllMarkers() {
    SecurityAnalysis analysis = SecurityAnalysis.parse("""
        HAS_INJECTION: true
        REASON: Tells the reader to ignore its rules
        CLEANED_CONTENT: I think player2 is the wolf""");

    assertTrue(analysis.hasInjection());
    assertEquals("Tells the reader to ignore its rules", analysis.reason());
    assertEquals("I think player2 is the wolf", analysis.usableCleanedContent());
  }

  @Test
  void parse_toleratesMarkdownAndCase() {
    SecurityAnalysis analysis = SecurityAnalysis.parse("""
        **HAS_INJECTION:** False
        - reason: ordinary accusation
        """);

    assertFalse(analysis.hasInjection());
    assertEquals("ordinary accusation", analysis.reason());
    assertNull(analysis.usableCleanedContent());
  }

  @Test
  void parse_keepsMultilineCleanedContentUntilNextMarker() {
    SecurityAnalysis analysis = SecurityAnalysis.parse("""
        CLEANED_CONTENT: first line
        second line
        HAS_INJECTION: yes""");

    assertTrue(analysis.hasInjection());
    assertEquals("first line\nsecond line", analysis.usableCleanedContent());
  }

  @Test
  void parse_missingMarkersFallBackToDefaults() {
    SecurityAnalysis analysis = SecurityAnalysis.parse("I cannot help with that.");

    assertFalse(analysis.hasInjection());
    assertNull(analysis.reason());
    assertNull(analysis.cleanedContent());
  }

  @Test
  void parse_handlesNullAndBlank() {
    assertSame(SecurityAnalysis.NONE, SecurityAnalysis.parse(null));
    assertSame(SecurityAnalysis.NONE, SecurityAnalysis.parse("   "));
  }

  @ParameterizedTest
  @ValueSource(strings = {"N/A", "none", "[cleaned content]", "<cleaned_content>", ""})
  void usableCleanedContent_rejectsPlaceholders(String placeholder) {
    SecurityAnalysis analysis = SecurityAnalysis.parse("HAS_INJECTION: false\nCLEANED_CONTENT: " + placeholder);
    assertNull(analysis.usableCleanedContent());
  }
}
