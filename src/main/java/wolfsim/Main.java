package wolfsim;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import wolfsim.agents.WerewolfAgent;
import wolfsim.config.AgentConfig;
import wolfsim.config.AgentFactory;
import wolfsim.domain.InboundMessage;
import wolfsim.domain.PlayerRole;
import wolfsim.metrics.GameMetrics;
import wolfsim.metrics.MetricsCollector;

import java.nio.file.Path;
import java.util.List;

/**
 * Scripted local game for one agent.
 *
 * <pre>
 *   Main [villager|werewolf|seer|doctor]
 *   Main metrics [resultsDir] [playerName]
 * </pre>
 */
public class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);

  public static void main(String[] args) throws Exception {
    AgentConfig config = AgentConfig.load();

    if (args.length > 0 && "metrics".equalsIgnoreCase(args[0])) {
      Path dir = Path.of(args.length > 1 ? args[1] : config.resultsDir());
      String player = args.length > 2 ? args[2] : config.agentName();
      GameMetrics metrics = new MetricsCollector().fromResultsDirectory(dir, player);
      System.out.println(metrics.summary());
      return;
    }

    PlayerRole role = args.length > 0 ? PlayerRole.fromText(args[0]) : PlayerRole.VILLAGER;
    if (role == PlayerRole.UNKNOWN) {
      throw new IllegalArgumentException("Unknown role: " + args[0]);
    }
    if (!config.hasApiKey()) {
      log.warn("[Config] No LLM API key configured; every oracle call will fall back");
    }

    WerewolfAgent agent = AgentFactory.buildAgent(config.withAgentName("test_" + role.label()));
    new Main(agent, config).play(role, 2);
  }

  private final WerewolfAgent agent;
  private final AgentConfig config;

  Main(WerewolfAgent agent, AgentConfig config) {
    this.agent = agent;
    this.config = config;
  }

  void play(PlayerRole role, int cycles) {
    String roleWord = role == PlayerRole.WEREWOLF ? "wolf" : role.label();
    agent.notify(InboundMessage.direct(config.moderatorName(), "You are a " + roleWord + " in this game."));
    log.info("[Sim] {} believes it is a {}", agent.name(), agent.role().label());

    for (int i = 1; i <= cycles; i++) {
      dayPhase(i);
      nightPhase(i);
    }
  }

  private void dayPhase(int day) {
    String arena = config.gameChannel();
    agent.notify(InboundMessage.group(config.moderatorName(), arena,
        "Day " + day + " has begun. The day phase is open, please discuss and vote."));

    List<String[]> discussion = List.of(
        new String[] {"player1", "I think player3 is acting suspicious"},
        new String[] {"player3", "No, I'm innocent! player2 is the one acting weird"},
        new String[] {"player2", "I'm just trying to help the village"}
    );
    for (String[] line : discussion) {
      InboundMessage msg = InboundMessage.group(line[0], arena, line[1]);
      agent.notify(msg);
      log.info("[Sim] Discussion reply: {}", agent.respond(msg));
    }

    InboundMessage vote = InboundMessage.group(config.moderatorName(), arena,
        "Please cast your votes now using 'vote [player_name]'");
    agent.notify(vote);
    log.info("[Sim] Vote: {}", agent.respond(vote));
  }

  private void nightPhase(int night) {
    agent.notify(InboundMessage.group(config.moderatorName(), config.gameChannel(),
        "Night " + night + " has fallen. The night phase begins, special roles perform your actions."));

    switch (agent.role()) {
      case WEREWOLF -> {
        InboundMessage msg = InboundMessage.group("other_wolf", config.packChannel(), "Who should we target tonight?");
        agent.notify(msg);
        log.info("[Sim] Pack reply: {}", agent.respond(msg));
      }
      case SEER -> {
        InboundMessage msg = InboundMessage.direct(config.moderatorName(), "Choose a player to investigate");
        agent.notify(msg);
        log.info("[Sim] Investigation: {}", agent.respond(msg));
      }
      case DOCTOR -> {
        InboundMessage msg = InboundMessage.direct(config.moderatorName(), "Choose a player to protect");
        agent.notify(msg);
        log.info("[Sim] Protection: {}", agent.respond(msg));
      }
      case VILLAGER, UNKNOWN -> log.info("[Sim] Villager sleeps through night {}", night);
    }
  }
}
