package wolfsim.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;

public class AgentConfig {
  public static final String DEFAULT_MODEL = "Llama31-70B-Instruct";
  public static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";

  private final String agentName;
  private final String apiKey;
  private final String baseUrl;
  private final String model;
  private final double temperature;
  private final int maxTokens;
  private final String moderatorName;
  private final String gameChannel;
  private final String packChannel;
  private final boolean trustModerator;
  private final String resultsDir;

  public AgentConfig(String agentName, String apiKey, String baseUrl, String model, double temperature,
                     int maxTokens, String moderatorName, String gameChannel, String packChannel,
                     boolean trustModerator, String resultsDir) {
    this.agentName = agentName;
    this.apiKey = apiKey;
    this.baseUrl = baseUrl;
    this.model = model;
    this.temperature = temperature;
    this.maxTokens = maxTokens;
    this.moderatorName = moderatorName;
    this.gameChannel = gameChannel;
    this.packChannel = packChannel;
    this.trustModerator = trustModerator;
    this.resultsDir = resultsDir;
  }

  public String agentName() { return agentName; }
  public String apiKey() { return apiKey; }
  public String baseUrl() { return baseUrl; }
  public String model() { return model; }
  public double temperature() { return temperature; }
  public int maxTokens() { return maxTokens; }
  public String moderatorName() { return moderatorName; }
  public String gameChannel() { return gameChannel; }
  public String packChannel() { return packChannel; }
  public boolean trustModerator() { return trustModerator; }
  public String resultsDir() { return resultsDir; }

  public boolean hasApiKey() {
    return apiKey != null && !apiKey.isBlank();
  }

  /** Opt-in: moderator messages skip the injection sanitizer. */
  public AgentConfig withTrustedModerator(boolean trusted) {
    return new AgentConfig(agentName, apiKey, baseUrl, model, temperature, maxTokens, moderatorName,
        gameChannel, packChannel, trusted, resultsDir);
  }

  public AgentConfig withAgentName(String name) {
    return new AgentConfig(name, apiKey, baseUrl, model, temperature, maxTokens, moderatorName,
        gameChannel, packChannel, trustModerator, resultsDir);
  }

  /** Defaults only, for tests and embedded use. */
  public static AgentConfig defaults(String agentName) {
    return new AgentConfig(agentName, "", DEFAULT_BASE_URL, DEFAULT_MODEL, 0.7, 500,
        "moderator", "play-arena", "wolf's-den", false, "game_results");
  }

  public static AgentConfig load() throws IOException {
    return load(Path.of("config.properties"), System.getenv());
  }

  public static AgentConfig load(Path propertiesPath, Map<String, String> env) throws IOException {
    Properties props = new Properties();
    if (Files.exists(propertiesPath)) {
      try (InputStream in = Files.newInputStream(propertiesPath)) {
        props.load(in);
      }
    }

    String agentName = getValue(props, env, "agent.name", "test_player", "WOLF_AGENT_NAME");
    String apiKey = getValue(props, env, "llm.api_key", "", "WOLF_LLM_API_KEY", "OPENAI_API_KEY");
    String baseUrl = getValue(props, env, "llm.base_url", DEFAULT_BASE_URL, "WOLF_LLM_BASE_URL", "OPENAI_BASE_URL");
    String model = getValue(props, env, "llm.model", DEFAULT_MODEL, "WOLF_LLM_MODEL", "OPENAI_MODEL_NAME");
    double temperature = getDoubleValue(props, env, "llm.temperature", "WOLF_LLM_TEMPERATURE", 0.7);
    int maxTokens = getIntValue(props, env, "llm.max_tokens", "WOLF_LLM_MAX_TOKENS", 500);
    String moderatorName = getValue(props, env, "game.moderator", "moderator", "WOLF_MODERATOR_NAME");
    String gameChannel = getValue(props, env, "game.channel", "play-arena", "WOLF_GAME_CHANNEL");
    String packChannel = getValue(props, env, "game.wolf_channel", "wolf's-den", "WOLF_PACK_CHANNEL");
    boolean trustModerator = getBoolValue(props, env, "security.trust_moderator", "WOLF_TRUST_MODERATOR", false);
    String resultsDir = getValue(props, env, "metrics.results_dir", "game_results", "WOLF_RESULTS_DIR");

    return new AgentConfig(agentName, apiKey, baseUrl, model, temperature, maxTokens,
        moderatorName, gameChannel, packChannel, trustModerator, resultsDir);
  }

  private static String getValue(Properties props, Map<String, String> env, String key,
                                 String defaultValue, String... envKeys) {
    for (String envKey : envKeys) {
      String value = env.get(envKey);
      if (value != null && !value.isBlank()) return value;
    }
    String value = props.getProperty(key);
    if (value != null && !value.isBlank()) return value.trim();
    return defaultValue;
  }

  private static int getIntValue(Properties props, Map<String, String> env, String key, String envKey,
                                 int defaultValue) {
    String raw = getValue(props, env, key, null, envKey);
    if (raw == null) return defaultValue;
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ignored) {
      return defaultValue;
    }
  }

  private static double getDoubleValue(Properties props, Map<String, String> env, String key, String envKey,
                                       double defaultValue) {
    String raw = getValue(props, env, key, null, envKey);
    if (raw == null) return defaultValue;
    try {
      return Double.parseDouble(raw.trim());
    } catch (NumberFormatException ignored) {
      return defaultValue;
    }
  }

  private static boolean getBoolValue(Properties props, Map<String, String> env, String key, String envKey,
                                      boolean defaultValue) {
    String raw = getValue(props, env, key, null, envKey);
    if (raw == null) return defaultValue;
    return Boolean.parseBoolean(raw.trim());
  }
}
