package wolfsim.analysis;

import wolfsim.memory.MemoryStore;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword rules over group-channel chat. Each rule runs on every message; one message
 * can trigger all three.
 */
public class BehaviorClassifier {
  static final Pattern VOTE = Pattern.compile("vote (?:for )?(\\w+)");
  static final double ACCUSATION_DELTA = 0.2;
  static final double DEFENSIVE_DELTA = 0.1;

  private final MemoryStore memory;

  public BehaviorClassifier(MemoryStore memory) {
    this.memory = memory;
  }

  public void analyze(String sender, String text) {
    if (text == null || text.isEmpty()) return;
    String content = text.toLowerCase(Locale.ROOT);
    trackVote(sender, content);
    trackAccusations(sender, content);
    trackDefense(sender, content);
  }

  // The captured token is not checked against known players.
  private void trackVote(String sender, String content) {
    if (!content.contains("vote")) return;
    Matcher m = VOTE.matcher(content);
    if (!m.find()) return;
    String target = m.group(1);
    memory.recordVote(sender, target);
    memory.addBehavioralNote(sender, "Voted for " + target);
  }

  // The accused gains suspicion; the note lands on the accuser.
  private void trackAccusations(String sender, String content) {
    if (!content.contains("suspicious") && !content.contains("wolf")) return;
    for (String player : memory.aliveOrdered()) {
      if (content.contains(player.toLowerCase(Locale.ROOT))) {
        memory.adjustSuspicion(player, ACCUSATION_DELTA);
        memory.addBehavioralNote(sender, "Accused " + player + " of suspicious behavior");
      }
    }
  }

  private void trackDefense(String sender, String content) {
    if (sender == null || sender.isEmpty()) return;
    if (!content.contains(sender.toLowerCase(Locale.ROOT))) return;
    if (!content.contains("not") && !content.contains("innocent")) return;
    memory.addBehavioralNote(sender, "Defensive behavior in response to accusations");
    memory.adjustSuspicion(sender, DEFENSIVE_DELTA);
  }
}
