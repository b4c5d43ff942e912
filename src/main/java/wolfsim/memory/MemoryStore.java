package wolfsim.memory;

import wolfsim.domain.Claim;
import wolfsim.domain.PlayerRole;
import wolfsim.domain.PlayerStatus;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-agent memory: other players, the game clock, and the agent's own state.
 *
 * <p>Operations naming a player that was never registered are ignored rather than
 * rejected, so late or partial state never breaks message handling. The store is owned
 * by a single agent instance and is not thread-safe; a concurrent host must serialize
 * calls per agent (one lock or mailbox per instance).
 */
public class MemoryStore {
  public static final int DEFAULT_SUSPICIOUS_COUNT = 3;

  private final String myName;
  private final Clock clock;
  private final Map<String, PlayerState> players = new LinkedHashMap<>();
  private final MyState myState = new MyState();

  private int dayCount = 0;
  private int nightCount = 0;
  private boolean isNight = false;
  private PlayerRole myRole = PlayerRole.UNKNOWN;
  private PlayerRole claimedRole = PlayerRole.UNKNOWN;

  public MemoryStore(String myName) {
    this(myName, Clock.systemUTC());
  }

  public MemoryStore(String myName, Clock clock) {
    this.myName = myName;
    this.clock = clock;
  }

  public String myName() { return myName; }
  public MyState myState() { return myState; }

  // ---- players ----

  public void registerPlayer(String name) {
    if (name == null || name.equals(myName) || players.containsKey(name)) return;
    players.put(name, new PlayerState(name));
  }

  public boolean isKnown(String name) {
    return name != null && players.containsKey(name);
  }

  public PlayerState player(String name) {
    return name == null ? null : players.get(name);
  }

  public Map<String, PlayerState> players() {
    return Collections.unmodifiableMap(players);
  }

  public void recordClaim(String player, String text, String channel) {
    PlayerState state = players.get(player);
    if (state == null) return;
    state.claimLog.add(new Claim(now(), text, channel));
  }

  public List<Claim> claimsOf(String player) {
    PlayerState state = players.get(player);
    return state == null ? List.of() : state.claims;
  }

  /** Cast and received halves are applied independently; a missing side is skipped. */
  public void recordVote(String voter, String target) {
    PlayerState voterState = players.get(voter);
    if (voterState != null) {
      voterState.voteLog.add(target);
    }
    PlayerState targetState = players.get(target);
    if (targetState != null) {
      targetState.voterLog.add(voter);
    }
  }

  public void markDead(String player) {
    PlayerState state = players.get(player);
    if (state != null) state.status = PlayerStatus.DEAD;
  }

  public void adjustSuspicion(String player, double delta) {
    PlayerState state = players.get(player);
    if (state != null) state.suspicionScore += delta;
  }

  /** Multiplies the score by two; a zero score stays zero. */
  public void doubleSuspicion(String player) {
    PlayerState state = players.get(player);
    if (state != null) state.suspicionScore *= 2;
  }

  public void setSuspectedRole(String player, PlayerRole role) {
    PlayerState state = players.get(player);
    if (state != null) state.suspectedRole = role;
  }

  public void markProtected(String player) {
    PlayerState state = players.get(player);
    if (state != null) state.protectedByDoctor = true;
  }

  public void markInvestigated(String player) {
    PlayerState state = players.get(player);
    if (state != null) state.investigatedBySeer = true;
  }

  /** Alive players in the order they were first seen. */
  public List<String> aliveOrdered() {
    List<String> alive = new ArrayList<>();
    for (PlayerState state : players.values()) {
      if (state.isAlive()) alive.add(state.name);
    }
    return alive;
  }

  public List<String> topSuspicious() {
    return topSuspicious(DEFAULT_SUSPICIOUS_COUNT);
  }

  /** Alive players by descending suspicion; ties keep first-seen order. */
  public List<String> topSuspicious(int count) {
    List<PlayerState> alive = new ArrayList<>();
    for (PlayerState state : players.values()) {
      if (state.isAlive()) alive.add(state);
    }
    alive.sort(Comparator.comparingDouble((PlayerState p) -> p.suspicionScore).reversed());
    return alive.stream()
        .limit(Math.max(0, count))
        .map(p -> p.name)
        .toList();
  }

  /** Resolves a lowercased mention back to the stored spelling, or returns it unchanged. */
  public String resolveName(String mention) {
    if (mention == null) return null;
    if (players.containsKey(mention)) return mention;
    for (String name : players.keySet()) {
      if (name.equalsIgnoreCase(mention)) return name;
    }
    return mention;
  }

  // ---- game clock ----

  public int dayCount() { return dayCount; }
  public int nightCount() { return nightCount; }
  public boolean isNight() { return isNight; }

  public void beginNight() {
    isNight = true;
    nightCount++;
  }

  public void beginDay() {
    isNight = false;
    dayCount++;
  }

  // ---- self ----

  public PlayerRole myRole() { return myRole; }
  public PlayerRole claimedRole() { return claimedRole; }

  /** Assigns the agent's role once; later calls leave it unchanged and return false. */
  public boolean assignMyRole(PlayerRole role) {
    if (myRole != PlayerRole.UNKNOWN || role == null || role == PlayerRole.UNKNOWN) return false;
    myRole = role;
    return true;
  }

  public void setClaimedRole(PlayerRole role) {
    claimedRole = role == null ? PlayerRole.UNKNOWN : role;
  }

  public void addMyClaim(String text) {
    myState.claimsMade.add(text);
  }

  /** Trust is expected in 0..1 but is stored as given. */
  public void setAlliance(String player, double trust) {
    myState.alliances.put(player, trust);
  }

  public void setEnemy(String player, String reason) {
    myState.enemies.put(player, reason);
  }

  public void setStrategy(String label) {
    myState.currentStrategy = label == null ? "" : label;
  }

  public void markRoleRevealed() {
    myState.roleRevealed = true;
  }

  public void addThought(String thought) {
    myState.thoughtProcess.add(new MyState.ThoughtEntry(now(), thought));
  }

  public void recordKeyEvent(String type, String details, List<String> involved) {
    myState.keyEvents.add(new MyState.KeyEvent(now(), type, details, involved == null ? List.of() : involved));
  }

  public void addBehavioralNote(String player, String observation) {
    myState.behavioralNotes
        .computeIfAbsent(player, ignored -> new ArrayList<>())
        .add(new MyState.BehavioralNote(now(), observation));
  }

  public void recordVoteJustification(String target, String justification) {
    myState.voteJustifications.put(target, justification);
  }

  public void recordInvestigation(String player, PlayerRole discovered) {
    myState.investigatedPlayers.put(player, discovered == null ? PlayerRole.UNKNOWN : discovered);
    markInvestigated(player);
  }

  public void recordProtection(String player) {
    myState.protectedPlayers.add(player);
    markProtected(player);
  }

  public void addPackMember(String player) {
    if (player == null || player.isBlank() || myState.packMembers.contains(player)) return;
    myState.packMembers.add(player);
  }

  public void recordEliminationTarget(String player) {
    myState.eliminationTargets.add(player);
  }

  private Instant now() {
    return clock.instant();
  }
}
