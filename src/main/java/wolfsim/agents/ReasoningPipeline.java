package wolfsim.agents;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import wolfsim.domain.PlayerRole;
import wolfsim.llm.ChatMessage;
import wolfsim.llm.LLMClient;
import wolfsim.llm.PromptBuilder;
import wolfsim.memory.MemoryStore;

import java.util.List;

/**
 * Reason, then extract: one oracle call for a free-text inner monologue over the
 * compiled situation, a second that reduces the monologue to the bare action.
 * Both outputs go to the reasoning log. An oracle failure yields {@link #FALLBACK}.
 */
public class ReasoningPipeline {
  private static final Logger log = LoggerFactory.getLogger(ReasoningPipeline.class);

  public static final String FALLBACK = "I need more time to think about this.";

  public record Decision(String innerMonologue, String action, boolean fallback) {}

  private final LLMClient llm;
  private final PromptBuilder prompts;
  private final MemoryStore memory;

  public ReasoningPipeline(LLMClient llm, PromptBuilder prompts, MemoryStore memory) {
    this.llm = llm;
    this.prompts = prompts;
    this.memory = memory;
  }

  public Decision decide(PlayerRole role, RoleFlow flow, String gameSituation) {
    String situation = prompts.buildSituationPrompt(
        memory, RolePersona.forRole(role), gameSituation, flow.guidingQuestions());

    String monologue;
    try {
      monologue = llm.complete(List.of(ChatMessage.user(situation)), null);
    } catch (Exception e) {
      log.error("[LLM] Inner monologue failed for {}", flow, e);
      memory.addThought(FALLBACK);
      return new Decision(FALLBACK, FALLBACK, true);
    }
    if (monologue == null) monologue = "";
    memory.addThought(monologue);

    String action;
    try {
      String actionPrompt = prompts.buildActionPrompt(monologue, situation, flow.actionType());
      String raw = llm.complete(List.of(ChatMessage.user(actionPrompt)), null);
      action = raw == null ? "" : raw.trim();
    } catch (Exception e) {
      log.error("[LLM] Action extraction failed for {}", flow, e);
      action = FALLBACK;
    }
    if (action.isEmpty()) {
      action = FALLBACK;
    }
    memory.addThought("Final " + flow.actionType() + ": " + action);
    return new Decision(monologue, action, FALLBACK.equals(action));
  }
}
