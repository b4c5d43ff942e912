package wolfsim.config;

import wolfsim.agents.ActionRouter;
import wolfsim.agents.GameHistory;
import wolfsim.agents.ReasoningPipeline;
import wolfsim.agents.RoleInference;
import wolfsim.agents.WerewolfAgent;
import wolfsim.analysis.BehaviorClassifier;
import wolfsim.analysis.PhaseEventTracker;
import wolfsim.llm.LLMClient;
import wolfsim.llm.OpenAiCompatibleClient;
import wolfsim.llm.PromptBuilder;
import wolfsim.memory.MemoryStore;
import wolfsim.security.InjectionSanitizer;

public class AgentFactory {
  public static LLMClient buildClient(AgentConfig config) {
    return new OpenAiCompatibleClient(
        config.apiKey(),
        config.baseUrl(),
        config.model(),
        config.temperature(),
        config.maxTokens()
    );
  }

  public static WerewolfAgent buildAgent(AgentConfig config) {
    return buildAgent(config, buildClient(config), new PromptBuilder());
  }

  public static WerewolfAgent buildAgent(AgentConfig config, LLMClient llm) {
    return buildAgent(config, llm, new PromptBuilder());
  }

  public static WerewolfAgent buildAgent(AgentConfig config, LLMClient llm, PromptBuilder prompts) {
    MemoryStore memory = new MemoryStore(config.agentName());
    GameHistory history = new GameHistory(config.packChannel());
    ReasoningPipeline pipeline = new ReasoningPipeline(llm, prompts, memory);
    ActionRouter router = new ActionRouter(
        memory,
        pipeline,
        history,
        config.moderatorName(),
        config.gameChannel(),
        config.packChannel()
    );
    return new WerewolfAgent(
        config.agentName(),
        config.moderatorName(),
        config.trustModerator(),
        memory,
        history,
        new InjectionSanitizer(llm, prompts, memory),
        new BehaviorClassifier(memory),
        new PhaseEventTracker(memory),
        new RoleInference(llm, prompts),
        router
    );
  }
}
