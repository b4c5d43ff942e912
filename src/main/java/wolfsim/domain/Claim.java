package wolfsim.domain;

import java.time.Instant;

public record Claim(Instant timestamp, String content, String channel) {}
