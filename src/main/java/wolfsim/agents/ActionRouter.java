package wolfsim.agents;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import wolfsim.domain.InboundMessage;
import wolfsim.domain.PlayerRole;
import wolfsim.memory.MemoryStore;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Picks the reasoning flow for a response from the agent's role and the message's
 * channel, then records the chosen action in the matching part of self-state.
 */
public class ActionRouter {
  private static final Logger log = LoggerFactory.getLogger(ActionRouter.class);

  public static final String NOT_A_WEREWOLF = "I am not a werewolf";
  public static final String NO_ACTION = "Understood.";

  private final MemoryStore memory;
  private final ReasoningPipeline pipeline;
  private final GameHistory history;
  private final String moderatorName;
  private final String gameChannel;
  private final String packChannel;

  public ActionRouter(MemoryStore memory, ReasoningPipeline pipeline, GameHistory history,
                      String moderatorName, String gameChannel, String packChannel) {
    this.memory = memory;
    this.pipeline = pipeline;
    this.history = history;
    this.moderatorName = moderatorName;
    this.gameChannel = gameChannel;
    this.packChannel = packChannel;
  }

  public String route(InboundMessage message) {
    PlayerRole role = memory.myRole();
    if (message.isDirect()) {
      if (!moderatorName.equals(message.sender())) return NO_ACTION;
      return switch (role) {
        case SEER -> investigate();
        case DOCTOR -> protect();
        case VILLAGER, WEREWOLF, UNKNOWN -> NO_ACTION;
      };
    }
    if (gameChannel.equals(message.channel())) {
      return discussOrVote(role, message);
    }
    if (packChannel.equals(message.channel())) {
      if (role != PlayerRole.WEREWOLF) return NOT_A_WEREWOLF;
      return eliminate(message);
    }
    log.debug("[Respond] No flow for channel {}", message.channel());
    return NO_ACTION;
  }

  private String investigate() {
    Map<String, PlayerRole> checks = memory.myState().investigatedPlayers();
    String previous = checks.isEmpty()
        ? "None"
        : checks.entrySet().stream()
            .map(e -> "Checked " + e.getKey() + ": " + e.getValue().label())
            .collect(Collectors.joining("\n"));
    String situation = """
Previous Investigations:
%s

Current Game State:
%s""".formatted(previous, history.render(false));

    ReasoningPipeline.Decision decision = pipeline.decide(PlayerRole.SEER, RoleFlow.INVESTIGATE, situation);
    if (!decision.fallback()) {
      String target = memory.resolveName(decision.action());
      if (!checks.containsKey(target)) {
        memory.recordInvestigation(target, PlayerRole.UNKNOWN);
      }
    }
    return decision.action();
  }

  private String protect() {
    List<String> protectedPlayers = memory.myState().protectedPlayers();
    String situation = """
Previous Protections:
%s

Current Game State:
%s""".formatted(protectedPlayers.isEmpty() ? "None" : String.join(", ", protectedPlayers),
        history.render(false));

    ReasoningPipeline.Decision decision = pipeline.decide(PlayerRole.DOCTOR, RoleFlow.PROTECT, situation);
    if (!decision.fallback()) {
      memory.recordProtection(memory.resolveName(decision.action()));
    }
    return decision.action();
  }

  private String eliminate(InboundMessage message) {
    String sender = message.sender();
    if (!sender.equals(moderatorName) && !sender.equals(memory.myName())) {
      memory.addPackMember(sender);
    }
    List<String> pack = memory.myState().packMembers();
    String situation = """
Pack Information:
Known werewolves: %s

Current Game State:
%s""".formatted(pack.isEmpty() ? "None" : String.join(", ", pack), history.render(true));

    ReasoningPipeline.Decision decision = pipeline.decide(PlayerRole.WEREWOLF, RoleFlow.ELIMINATE, situation);
    if (!decision.fallback()) {
      memory.recordEliminationTarget(memory.resolveName(decision.action()));
    }
    return decision.action();
  }

  private String discussOrVote(PlayerRole role, InboundMessage message) {
    String situation = """
Recent Game History:
%s""".formatted(history.render(false));

    ReasoningPipeline.Decision decision = pipeline.decide(role, RoleFlow.DISCUSS, situation);
    if (!decision.fallback() && message.text().toLowerCase(Locale.ROOT).contains("vote")) {
      memory.recordVoteJustification(decision.action(), decision.innerMonologue());
    }
    return decision.action();
  }
}
