package wolfsim.domain;

public enum PlayerStatus {
  ALIVE,
  DEAD
}
