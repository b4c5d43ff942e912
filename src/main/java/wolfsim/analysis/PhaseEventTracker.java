package wolfsim.analysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import wolfsim.domain.PlayerRole;
import wolfsim.memory.MemoryStore;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads moderator announcements. Elimination, night and day are independent substring
 * checks, so one announcement can fire several of them.
 */
public class PhaseEventTracker {
  private static final Logger log = LoggerFactory.getLogger(PhaseEventTracker.class);

  static final Pattern ELIMINATION = Pattern.compile("(\\w+) has been eliminated");
  static final Pattern INVESTIGATION_RESULT =
      Pattern.compile("(\\w+) is (?:a|an|the) (werewolf|wolf|villager|seer|doctor)\\b");

  private final MemoryStore memory;

  public PhaseEventTracker(MemoryStore memory) {
    this.memory = memory;
  }

  /** Group-channel announcement from the moderator. */
  public void onModeratorAnnouncement(String text) {
    if (text == null || text.isEmpty()) return;
    String content = text.toLowerCase(Locale.ROOT);

    Matcher death = ELIMINATION.matcher(content);
    if (death.find()) {
      String dead = memory.resolveName(death.group(1));
      memory.markDead(dead);
      memory.recordKeyEvent("elimination", dead + " was eliminated", List.of(dead));
      log.info("[Phase] {} eliminated", dead);
    }

    if (content.contains("night phase")) {
      memory.beginNight();
      memory.recordKeyEvent("phase_change", "Night phase began", List.of());
      log.info("[Phase] Night {} began", memory.nightCount());
    }
    if (content.contains("day phase")) {
      memory.beginDay();
      memory.recordKeyEvent("phase_change", "Day phase began", List.of());
      log.info("[Phase] Day {} began", memory.dayCount());
    }
  }

  /**
   * Direct moderator message to a seer, e.g. "player4 is a werewolf". Only players the
   * store already knows are updated. Returns true when a result was recorded.
   */
  public boolean onInvestigationResult(String text) {
    if (memory.myRole() != PlayerRole.SEER || text == null) return false;
    Matcher m = INVESTIGATION_RESULT.matcher(text.toLowerCase(Locale.ROOT));
    if (!m.find()) return false;
    String player = memory.resolveName(m.group(1));
    if (!memory.isKnown(player)) return false;
    PlayerRole role = PlayerRole.fromText(m.group(2));
    memory.recordInvestigation(player, role);
    memory.setSuspectedRole(player, role);
    memory.recordKeyEvent("investigation_result", player + " is a " + role.label(), List.of(player));
    log.info("[Phase] Investigation result: {} is {}", player, role.label());
    return true;
  }
}
