package wolfsim.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** Aggregates one player's outcomes across stored game-result files. */
public class MetricsCollector {
  private static final Logger log = LoggerFactory.getLogger(MetricsCollector.class);

  private final ObjectMapper mapper = new ObjectMapper();

  public GameMetrics fromResultsDirectory(Path resultsDir, String playerName) throws IOException {
    List<JsonNode> results = new ArrayList<>();
    if (!Files.isDirectory(resultsDir)) {
      log.warn("[Metrics] Results directory {} does not exist", resultsDir);
      return calculate(results, playerName);
    }
    try (DirectoryStream<Path> files = Files.newDirectoryStream(resultsDir, "*.json")) {
      for (Path file : files) {
        try {
          results.add(mapper.readTree(Files.readString(file)));
        } catch (JsonProcessingException e) {
          log.warn("[Metrics] Could not parse {}", file);
        }
      }
    }
    return calculate(results, playerName);
  }

  public GameMetrics calculate(List<JsonNode> results, String playerName) {
    int wins = 0;
    int survivals = 0;
    int failures = 0;
    for (JsonNode result : results) {
      JsonNode player = result.path("player_results").path(playerName);
      if (player.path("won").asBoolean(false)) wins++;
      if (player.path("survived").asBoolean(false)) survivals++;
      failures += player.path("response_failures").asInt(0);
    }
    return GameMetrics.of(results.size(), wins, survivals, failures);
  }
}
