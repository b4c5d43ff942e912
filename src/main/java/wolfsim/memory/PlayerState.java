package wolfsim.memory;

import wolfsim.domain.Claim;
import wolfsim.domain.PlayerRole;
import wolfsim.domain.PlayerStatus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything the agent has observed about one other participant. Dead players stay
 * in the store so their history remains queryable.
 */
public final class PlayerState {
  public final String name;
  public PlayerRole suspectedRole = PlayerRole.UNKNOWN;
  public PlayerStatus status = PlayerStatus.ALIVE;
  final List<Claim> claimLog = new ArrayList<>();
  final List<String> voteLog = new ArrayList<>();
  final List<String> voterLog = new ArrayList<>();
  // read-only views; only MemoryStore appends
  public final List<Claim> claims = Collections.unmodifiableList(claimLog);
  public final List<String> votesCast = Collections.unmodifiableList(voteLog);
  public final List<String> votedAgainstBy = Collections.unmodifiableList(voterLog);
  public double suspicionScore = 0.0;
  public boolean protectedByDoctor = false;
  public boolean investigatedBySeer = false;

  PlayerState(String name) {
    this.name = name;
  }

  public boolean isAlive() {
    return status == PlayerStatus.ALIVE;
  }
}
