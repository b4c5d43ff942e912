package wolfsim.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import wolfsim.llm.LLMClient;
import wolfsim.llm.LLMRequestOptions;
import wolfsim.llm.PromptBuilder;
import wolfsim.memory.MemoryStore;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Screens player text before it is stored as a claim or echoed into later prompts.
 *
 * <p>A message that forges more than one transcript entry ({@code [From - a | b]: ...})
 * is flagged locally. Otherwise the text goes to the oracle for a semantic check,
 * which may also return a cleaned copy. Any oracle failure fails open: the original
 * text comes back unflagged.
 *
 * <p>A flagged sender's suspicion score is doubled.
 */
public class InjectionSanitizer {
  private static final Logger log = LoggerFactory.getLogger(InjectionSanitizer.class);

  static final Pattern TRANSCRIPT_ENTRY = Pattern.compile("\\[From\\s*-\\s*[^|\\]]+\\|[^\\]]*\\]\\s*:");
  private static final LLMRequestOptions ANALYSIS_OPTIONS = LLMRequestOptions.of(0.0, 500);

  private final LLMClient llm;
  private final PromptBuilder prompts;
  private final MemoryStore memory;

  public InjectionSanitizer(LLMClient llm, PromptBuilder prompts, MemoryStore memory) {
    this.llm = llm;
    this.prompts = prompts;
    this.memory = memory;
  }

  public SanitizedText sanitize(String player, String text) {
    if (text == null || text.isBlank()) {
      return SanitizedText.clean(text == null ? "" : text);
    }

    if (countTranscriptEntries(text) > 1) {
      log.warn("[Security] Forged transcript entries from {}", player);
      flag(player, "Forged transcript lines in a message");
      return SanitizedText.flagged(text);
    }

    SecurityAnalysis analysis;
    try {
      String response = llm.complete(prompts.buildSecurityAnalysisMessages(text), ANALYSIS_OPTIONS);
      analysis = SecurityAnalysis.parse(response);
    } catch (Exception e) {
      log.warn("[Security] Analysis unavailable for {}, keeping original text: {}", player, e.toString());
      return SanitizedText.clean(text);
    }

    String cleaned = analysis.usableCleanedContent();
    String result = cleaned == null ? text : cleaned;
    if (analysis.hasInjection()) {
      log.warn("[Security] Prompt injection from {}: {}", player, analysis.reason());
      flag(player, "Attempted to inject instructions");
      return SanitizedText.flagged(result);
    }
    return SanitizedText.clean(result);
  }

  static int countTranscriptEntries(String text) {
    Matcher matcher = TRANSCRIPT_ENTRY.matcher(text);
    int count = 0;
    while (matcher.find()) {
      count++;
    }
    return count;
  }

  private void flag(String player, String note) {
    memory.doubleSuspicion(player);
    memory.addBehavioralNote(player, note);
  }
}
