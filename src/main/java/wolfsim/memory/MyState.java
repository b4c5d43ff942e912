package wolfsim.memory;

import wolfsim.domain.PlayerRole;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The agent's view of itself: what it said, whom it trusts, what its role has done,
 * and the running logs that feed the next prompt.
 */
public final class MyState {
  public record ThoughtEntry(Instant timestamp, String thought) {}

  public record KeyEvent(Instant timestamp, String type, String details, List<String> players) {
    public KeyEvent {
      players = List.copyOf(players);
    }
  }

  public record BehavioralNote(Instant timestamp, String observation) {}

  final List<String> claimsMade = new ArrayList<>();
  final Map<String, Double> alliances = new LinkedHashMap<>();
  final Map<String, String> enemies = new LinkedHashMap<>();
  String currentStrategy = "";
  boolean roleRevealed = false;
  final List<String> protectedPlayers = new ArrayList<>();
  final Map<String, PlayerRole> investigatedPlayers = new LinkedHashMap<>();
  final List<String> packMembers = new ArrayList<>();
  final List<String> eliminationTargets = new ArrayList<>();
  final List<ThoughtEntry> thoughtProcess = new ArrayList<>();
  final List<KeyEvent> keyEvents = new ArrayList<>();
  final Map<String, String> voteJustifications = new LinkedHashMap<>();
  final Map<String, List<BehavioralNote>> behavioralNotes = new LinkedHashMap<>();

  public List<String> claimsMade() { return Collections.unmodifiableList(claimsMade); }
  public Map<String, Double> alliances() { return Collections.unmodifiableMap(alliances); }
  public Map<String, String> enemies() { return Collections.unmodifiableMap(enemies); }
  public String currentStrategy() { return currentStrategy; }
  public boolean roleRevealed() { return roleRevealed; }
  public List<String> protectedPlayers() { return Collections.unmodifiableList(protectedPlayers); }
  public Map<String, PlayerRole> investigatedPlayers() { return Collections.unmodifiableMap(investigatedPlayers); }
  public List<String> packMembers() { return Collections.unmodifiableList(packMembers); }
  public List<String> eliminationTargets() { return Collections.unmodifiableList(eliminationTargets); }
  public List<ThoughtEntry> thoughtProcess() { return Collections.unmodifiableList(thoughtProcess); }
  public List<KeyEvent> keyEvents() { return Collections.unmodifiableList(keyEvents); }
  public Map<String, String> voteJustifications() { return Collections.unmodifiableMap(voteJustifications); }

  public List<BehavioralNote> behavioralNotesFor(String player) {
    return Collections.unmodifiableList(behavioralNotes.getOrDefault(player, List.of()));
  }

  public Map<String, List<BehavioralNote>> behavioralNotes() {
    return Collections.unmodifiableMap(behavioralNotes);
  }

  /** Last {@code count} key events, oldest first. */
  public List<KeyEvent> recentKeyEvents(int count) {
    int start = Math.max(0, keyEvents.size() - count);
    return Collections.unmodifiableList(keyEvents.subList(start, keyEvents.size()));
  }
}
