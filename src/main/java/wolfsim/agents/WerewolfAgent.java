package wolfsim.agents;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import wolfsim.analysis.BehaviorClassifier;
import wolfsim.analysis.PhaseEventTracker;
import wolfsim.domain.InboundMessage;
import wolfsim.domain.PlayerRole;
import wolfsim.memory.MemoryStore;
import wolfsim.security.InjectionSanitizer;
import wolfsim.security.SanitizedText;

/**
 * The two host entry points. {@link #notify} folds a message into memory and
 * {@link #respond} produces the reply for it. Neither throws: failures degrade to
 * no update or to the fallback reply.
 *
 * <p>One instance per seat, driven from one thread at a time.
 */
public class WerewolfAgent {
  private static final Logger log = LoggerFactory.getLogger(WerewolfAgent.class);

  private final String name;
  private final String moderatorName;
  private final boolean trustModerator;
  private final MemoryStore memory;
  private final GameHistory history;
  private final InjectionSanitizer sanitizer;
  private final BehaviorClassifier classifier;
  private final PhaseEventTracker tracker;
  private final RoleInference roleInference;
  private final ActionRouter router;

  // screened text of the last ingested message, reused when respond() follows notify()
  private InboundMessage lastIngested;
  private String lastScreenedText;

  public WerewolfAgent(String name, String moderatorName, boolean trustModerator, MemoryStore memory,
                       GameHistory history, InjectionSanitizer sanitizer, BehaviorClassifier classifier,
                       PhaseEventTracker tracker, RoleInference roleInference, ActionRouter router) {
    this.name = name;
    this.moderatorName = moderatorName;
    this.trustModerator = trustModerator;
    this.memory = memory;
    this.history = history;
    this.sanitizer = sanitizer;
    this.classifier = classifier;
    this.tracker = tracker;
    this.roleInference = roleInference;
    this.router = router;
  }

  public String name() { return name; }
  public MemoryStore memory() { return memory; }
  public GameHistory history() { return history; }
  public PlayerRole role() { return memory.myRole(); }

  public void notify(InboundMessage message) {
    if (message == null) {
      log.warn("[Notify] Ignoring null message");
      return;
    }
    try {
      ingest(message);
    } catch (RuntimeException e) {
      log.error("[Notify] Failed to process message from {}", message.sender(), e);
    }
  }

  public String respond(InboundMessage message) {
    if (message == null) {
      log.warn("[Respond] Null message, answering with fallback");
      return ReasoningPipeline.FALLBACK;
    }
    String heard = screenedTextOf(message);

    String reply;
    try {
      reply = router.route(message);
    } catch (RuntimeException e) {
      log.error("[Respond] Failed to respond to {} on {}", message.sender(), message.channel(), e);
      reply = ReasoningPipeline.FALLBACK;
    }
    if (reply == null || reply.isBlank()) {
      reply = ReasoningPipeline.FALLBACK;
    }

    String me = name + " (me)";
    if (message.isDirect()) {
      history.add(message.channel(), GameHistory.directLine(message.sender(), me, heard));
      history.add(message.channel(), GameHistory.directLine(me, message.sender(), reply));
    } else {
      history.add(message.channel(), GameHistory.groupLine(message.sender(), me, message.channel(), heard));
      history.add(message.channel(), GameHistory.groupLine(me, message.sender(), message.channel(), reply));
    }
    memory.addMyClaim(reply);
    log.info("[Respond] {} -> {}: {}", name, message.channel(), reply);
    return reply;
  }

  private void ingest(InboundMessage message) {
    String sender = message.sender();
    boolean fromModerator = moderatorName.equals(sender);
    log.debug("[Notify] {} on {} ({}): {}", sender, message.channel(), message.channelType(), message.text());

    memory.registerPlayer(sender);
    String text = screen(sender, fromModerator, message.text());
    lastIngested = message;
    lastScreenedText = text;
    memory.recordClaim(sender, text, message.channel());

    if (message.isDirect()) {
      if (!fromModerator) return;
      if (memory.myRole() == PlayerRole.UNKNOWN) {
        PlayerRole role = roleInference.infer(name, text);
        if (memory.assignMyRole(role)) {
          memory.addThought("Assigned role: " + role.label());
          log.info("[Role] Role assigned to {}: {}", name, role.label());
        }
      } else {
        tracker.onInvestigationResult(text);
      }
      return;
    }

    classifier.analyze(sender, text);
    if (fromModerator) {
      tracker.onModeratorAnnouncement(text);
    }
    history.add(message.channel(), sender + ": " + text);
  }

  /** Never the raw text: a message respond() sees without a prior notify() is screened here. */
  private String screenedTextOf(InboundMessage message) {
    if (message.equals(lastIngested)) {
      return lastScreenedText;
    }
    try {
      return screen(message.sender(), moderatorName.equals(message.sender()), message.text());
    } catch (RuntimeException e) {
      log.error("[Respond] Failed to screen message from {}", message.sender(), e);
      return "";
    }
  }

  private String screen(String sender, boolean fromModerator, String text) {
    if (name.equals(sender) || (fromModerator && trustModerator)) {
      return text;
    }
    SanitizedText result = sanitizer.sanitize(sender, text);
    return result.text();
  }
}
