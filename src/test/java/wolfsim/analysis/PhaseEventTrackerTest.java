package wolfsim.analysis;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import wolfsim.domain.PlayerRole;
import wolfsim.domain.PlayerStatus;
import wolfsim.memory.MemoryStore;
import wolfsim.memory.MyState;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PhaseEventTrackerTest {

  private MemoryStore memory;
  private PhaseEventTracker tracker;

  @BeforeEach
  void setUp() {
    memory = new MemoryStore("me");
    memory.registerPlayer("player1");
    memory.registerPlayer("player2");
    tracker = new PhaseEventTracker(memory);
  }

  @Test
  void elimination_marksDeadAndRecordsOneEvent() {
    tracker.onModeratorAnnouncement("player2 has been eliminated");

    assertEquals(PlayerStatus.DEAD, memory.player("player2").status);
    List<MyState.KeyEvent> events = memory.myState().keyEvents();
    assertEquals(1, events.size());
    assertEquals("elimination", events.get(0).type());
    assertEquals(List.of("player2"), events.get(0).players());
  }

  @Test
  void elimination_resolvesStoredSpelling() {
    memory.registerPlayer("Carol");
    tracker.onModeratorAnnouncement("Carol has been eliminated. They were a villager.");

    assertEquals(PlayerStatus.DEAD, memory.player("Carol").status);
    assertEquals(List.of("Carol"), memory.myState().keyEvents().get(0).players());
  }

  @Test
  void nightAndDay_toggleClock() {
    tracker.onModeratorAnnouncement("The night phase begins.");
    assertTrue(memory.isNight());
    assertEquals(1, memory.nightCount());

    tracker.onModeratorAnnouncement("The Day Phase begins.");
    assertFalse(memory.isNight());
    assertEquals(1, memory.dayCount());
    assertEquals(2, memory.myState().keyEvents().size());
    assertEquals("phase_change", memory.myState().keyEvents().get(1).type());
  }

  @Test
  void multipleTriggersInOneAnnouncement_allFire() {
    tracker.onModeratorAnnouncement("player1 has been eliminated. The night phase is over, the day phase begins.");

    assertEquals(PlayerStatus.DEAD, memory.player("player1").status);
    assertEquals(1, memory.nightCount());
    assertEquals(1, memory.dayCount());
    assertFalse(memory.isNight());
    assertEquals(3, memory.myState().keyEvents().size());
  }

  @Test
  void unrelatedAnnouncement_changesNothing() {
    tracker.onModeratorAnnouncement("Please discuss.");
    assertTrue(memory.myState().keyEvents().isEmpty());
    assertEquals(0, memory.dayCount());
  }

  @Test
  void investigationResult_recordedForSeer() {
    memory.assignMyRole(PlayerRole.SEER);

    assertTrue(tracker.onInvestigationResult("player1 is a werewolf."));

    assertEquals(PlayerRole.WEREWOLF, memory.myState().investigatedPlayers().get("player1"));
    assertEquals(PlayerRole.WEREWOLF, memory.player("player1").suspectedRole);
    assertEquals("investigation_result", memory.myState().keyEvents().get(0).type());
  }

  @Test
  void investigationResult_ignoredForOtherRolesAndUnknownPlayers() {
    memory.assignMyRole(PlayerRole.DOCTOR);
    assertFalse(tracker.onInvestigationResult("player1 is a werewolf."));

    MemoryStore seerMemory = new MemoryStore("me");
    seerMemory.assignMyRole(PlayerRole.SEER);
    assertFalse(new PhaseEventTracker(seerMemory).onInvestigationResult("ghost is a villager"));
  }
}
