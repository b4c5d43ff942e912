package wolfsim.domain;

import java.util.Locale;

public enum PlayerRole {
  UNKNOWN,
  VILLAGER,
  WEREWOLF,
  SEER,
  DOCTOR;

  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Maps loose moderator wording ("wolf", "Seer") onto a role, or UNKNOWN. */
  public static PlayerRole fromText(String text) {
    if (text == null) return UNKNOWN;
    return switch (text.trim().toLowerCase(Locale.ROOT)) {
      case "villager" -> VILLAGER;
      case "werewolf", "wolf" -> WEREWOLF;
      case "seer" -> SEER;
      case "doctor" -> DOCTOR;
      default -> UNKNOWN;
    };
  }
}
