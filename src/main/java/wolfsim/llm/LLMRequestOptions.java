package wolfsim.llm;

public class LLMRequestOptions {
  private final Double temperature;
  private final Integer maxTokens;

  public LLMRequestOptions(Double temperature, Integer maxTokens) {
    this.temperature = temperature;
    this.maxTokens = maxTokens;
  }

  public Double temperature() {
    return temperature;
  }

  public Integer maxTokens() {
    return maxTokens;
  }

  public static LLMRequestOptions of(double temperature, int maxTokens) {
    return new LLMRequestOptions(temperature, maxTokens);
  }
}
