package wolfsim.agents;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Ordered transcript of everything the agent has seen and said, tagged by channel. */
public class GameHistory {
  public record Entry(String channel, String line) {}

  private final String packChannel;
  private final List<Entry> entries = new ArrayList<>();

  public GameHistory(String packChannel) {
    this.packChannel = packChannel;
  }

  public void add(String channel, String line) {
    if (line == null || line.isBlank()) return;
    entries.add(new Entry(channel, line));
  }

  public List<Entry> entries() {
    return Collections.unmodifiableList(entries);
  }

  /** Transcript text; pack-channel lines are left out unless asked for. */
  public String render(boolean includePackChannel) {
    List<String> lines = new ArrayList<>();
    for (Entry entry : entries) {
      if (!includePackChannel && packChannel.equals(entry.channel())) continue;
      lines.add(entry.line());
    }
    return String.join("\n", lines);
  }

  static String directLine(String from, String to, String text) {
    return "[From - " + from + "| To - " + to + "| Direct Message]: " + text;
  }

  static String groupLine(String from, String to, String channel, String text) {
    return "[From - " + from + "| To - " + to + "| Group Message in " + channel + "]: " + text;
  }
}
