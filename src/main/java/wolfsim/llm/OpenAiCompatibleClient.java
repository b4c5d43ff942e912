package wolfsim.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;

/**
 * Chat-completions client for any OpenAI-compatible endpoint. No retries: a failed call
 * throws and the caller's fallback policy decides what happens next.
 */
public class OpenAiCompatibleClient implements LLMClient {
  private final HttpClient http;
  private final ObjectMapper mapper = new ObjectMapper();
  private final String apiKey;
  private final String baseUrl;
  private final String model;
  private final double temperature;
  private final int maxTokens;

  public OpenAiCompatibleClient(String apiKey, String baseUrl, String model, double temperature, int maxTokens) {
    this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(),
        apiKey, baseUrl, model, temperature, maxTokens);
  }

  OpenAiCompatibleClient(HttpClient http, String apiKey, String baseUrl, String model,
                         double temperature, int maxTokens) {
    if (baseUrl == null || baseUrl.isBlank()) {
      throw new IllegalArgumentException("Missing LLM base URL");
    }
    if (model == null || model.isBlank()) {
      throw new IllegalArgumentException("Missing LLM model");
    }
    this.http = http;
    this.apiKey = apiKey == null ? "" : apiKey.trim();
    this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    this.model = model;
    this.temperature = temperature;
    this.maxTokens = maxTokens;
  }

  @Override
  public String complete(List<ChatMessage> messages, LLMRequestOptions optionsOverride) throws Exception {
    if (apiKey.isBlank()) {
      throw new IllegalStateException("LLM API key is not configured");
    }
    HttpRequest request = HttpRequest.newBuilder()
        .uri(URI.create(baseUrl + "/chat/completions"))
        .header("Authorization", "Bearer " + apiKey)
        .header("Content-Type", "application/json")
        .timeout(Duration.ofSeconds(120))
        .POST(HttpRequest.BodyPublishers.ofString(requestBody(messages, optionsOverride)))
        .build();

    HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());
    if (response.statusCode() < 200 || response.statusCode() >= 300) {
      throw new IllegalStateException("LLM error " + response.statusCode() + ": " + response.body());
    }
    return extractContent(response.body());
  }

  String requestBody(List<ChatMessage> messages, LLMRequestOptions optionsOverride) throws Exception {
    double effectiveTemperature = temperature;
    int effectiveMaxTokens = maxTokens;
    if (optionsOverride != null) {
      if (optionsOverride.temperature() != null) effectiveTemperature = optionsOverride.temperature();
      if (optionsOverride.maxTokens() != null) effectiveMaxTokens = optionsOverride.maxTokens();
    }
    if (effectiveMaxTokens <= 0) {
      effectiveMaxTokens = 500;
    }

    ObjectNode body = mapper.createObjectNode();
    body.put("model", model);
    ArrayNode array = body.putArray("messages");
    for (ChatMessage message : messages) {
      array.addObject()
          .put("role", message.role())
          .put("content", message.content());
    }
    body.put("temperature", effectiveTemperature);
    body.put("max_tokens", effectiveMaxTokens);
    return mapper.writeValueAsString(body);
  }

  String extractContent(String responseBody) throws Exception {
    JsonNode root = mapper.readTree(responseBody);
    JsonNode contentNode = root.path("choices").path(0).path("message").path("content");
    if (contentNode.isMissingNode() || contentNode.isNull()) {
      throw new IllegalStateException("Missing choices[0].message.content from LLM response");
    }
    return contentNode.asText();
  }
}
