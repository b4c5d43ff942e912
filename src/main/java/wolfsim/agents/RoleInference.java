package wolfsim.agents;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import wolfsim.domain.PlayerRole;
import wolfsim.llm.LLMClient;
import wolfsim.llm.PromptBuilder;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/** Asks the oracle which role the moderator's message assigned. Villager on any doubt. */
public class RoleInference {
  private static final Logger log = LoggerFactory.getLogger(RoleInference.class);

  private final LLMClient llm;
  private final PromptBuilder prompts;

  public RoleInference(LLMClient llm, PromptBuilder prompts) {
    this.llm = llm;
    this.prompts = prompts;
  }

  public PlayerRole infer(String myName, String moderatorText) {
    try {
      String guess = llm.complete(prompts.buildRoleInferenceMessages(myName, moderatorText), null);
      log.info("[Role] Oracle guess: {}", guess);
      return classify(guess);
    } catch (Exception e) {
      log.error("[Role] Role inference failed, defaulting to villager", e);
      return PlayerRole.VILLAGER;
    }
  }

  /** Exactly one role named, or villager. */
  static PlayerRole classify(String guess) {
    if (guess == null) return PlayerRole.VILLAGER;
    String text = guess.toLowerCase(Locale.ROOT);
    Set<PlayerRole> named = EnumSet.noneOf(PlayerRole.class);
    if (text.contains("villager")) named.add(PlayerRole.VILLAGER);
    if (text.contains("seer")) named.add(PlayerRole.SEER);
    if (text.contains("doctor")) named.add(PlayerRole.DOCTOR);
    if (text.contains("wolf")) named.add(PlayerRole.WEREWOLF);
    if (named.size() != 1) {
      if (named.size() > 1) log.warn("[Role] Ambiguous guess names {}, defaulting to villager", named);
      return PlayerRole.VILLAGER;
    }
    return named.iterator().next();
  }
}
