package wolfsim.metrics;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** One player's entry under {@code player_results} in a game-result file. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlayerResult(
    @JsonProperty("won") boolean won,
    @JsonProperty("survived") boolean survived,
    @JsonProperty("response_failures") int responseFailures
) {}
