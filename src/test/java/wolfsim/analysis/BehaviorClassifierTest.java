package wolfsim.analysis;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import wolfsim.memory.MemoryStore;
import wolfsim.memory.MyState;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BehaviorClassifierTest {

  private MemoryStore memory;
  private BehaviorClassifier classifier;

  @BeforeEach
  void setUp() {
    memory = new MemoryStore("me");
    memory.registerPlayer("player1");
    memory.registerPlayer("player2");
    memory.registerPlayer("player3");
    classifier = new BehaviorClassifier(memory);
  }

  private List<String> notes(String player) {
    return memory.myState().behavioralNotesFor(player).stream()
        .map(MyState.BehavioralNote::observation)
        .toList();
  }

  @Test
  void accusation_raisesAccusedAndNotesAccuser() {
    classifier.analyze("player1", "player3 is suspicious");

    assertEquals(0.2, memory.player("player3").suspicionScore, 1e-9);
    assertEquals(0.0, memory.player("player1").suspicionScore);
    assertEquals(List.of("Accused player3 of suspicious behavior"), notes("player1"));
    assertTrue(notes("player3").isEmpty());
  }

  @Test
  void accusation_hitsEveryNamedAlivePlayer() {
    memory.markDead("player2");
    classifier.analyze("player1", "Both PLAYER2 and Player3 smell like a wolf");

    assertEquals(0.0, memory.player("player2").suspicionScore);
    assertEquals(0.2, memory.player("player3").suspicionScore, 1e-9);
  }

  @Test
  void vote_recordsVoteAndNote() {
    classifier.analyze("player1", "I vote for player2");

    assertEquals(List.of("player2"), memory.player("player1").votesCast);
    assertEquals(List.of("player1"), memory.player("player2").votedAgainstBy);
    assertEquals(List.of("Voted for player2"), notes("player1"));
  }

  @Test
  void vote_withoutForKeyword() {
    classifier.analyze("player2", "vote player3");
    assertEquals(List.of("player3"), memory.player("player2").votesCast);
  }

  @Test
  void vote_capturesUnknownTokenPermissively() {
    classifier.analyze("player1", "I vote for nobody today");

    assertEquals(List.of("nobody"), memory.player("player1").votesCast);
    assertEquals(List.of("Voted for nobody"), notes("player1"));
  }

  @Test
  void vote_keywordWithoutTargetIsNoUpdate() {
    classifier.analyze("player1", "voting is tomorrow");
    assertTrue(memory.player("player1").votesCast.isEmpty());
  }

  @Test
  void defensive_penalizesSender() {
    classifier.analyze("player3", "No, player3 is innocent!");

    assertEquals(0.1, memory.player("player3").suspicionScore, 1e-9);
    assertEquals(List.of("Defensive behavior in response to accusations"), notes("player3"));
  }

  @Test
  void rulesAreIndependent() {
    classifier.analyze("player3", "player3 is not a wolf, I vote for player2 who is suspicious");

    // vote, accusation of player2 and self-mention of player3, and the defense all fire
    assertEquals(List.of("player2"), memory.player("player3").votesCast);
    assertEquals(0.2, memory.player("player2").suspicionScore, 1e-9);
    assertEquals(0.3, memory.player("player3").suspicionScore, 1e-9);
    assertEquals(List.of(
        "Voted for player2",
        "Accused player2 of suspicious behavior",
        "Accused player3 of suspicious behavior",
        "Defensive behavior in response to accusations"), notes("player3"));
  }

  @Test
  void unknownSender_isIgnoredForScoresButNoted() {
    classifier.analyze("stranger", "player1 is suspicious");

    assertEquals(0.2, memory.player("player1").suspicionScore, 1e-9);
    assertEquals(1, notes("stranger").size());
  }
}
