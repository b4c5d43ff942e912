package wolfsim.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/** Writes {@code <gameId>.json} in the shape {@link MetricsCollector} reads back. */
public class GameResultWriter {
  private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

  public Path write(Path resultsDir, String gameId, Map<String, PlayerResult> playerResults) throws IOException {
    if (gameId == null || gameId.isBlank()) {
      throw new IllegalArgumentException("Missing game id");
    }
    Files.createDirectories(resultsDir);
    ObjectNode root = mapper.createObjectNode();
    root.set("player_results", mapper.valueToTree(playerResults));
    Path file = resultsDir.resolve(gameId + ".json");
    Files.writeString(file, mapper.writeValueAsString(root));
    return file;
  }
}
