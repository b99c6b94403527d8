package com.flamingo.ai.deepresearch.service.planning;

import java.util.Locale;
import java.util.Optional;

/** External commands accepted while a session waits in planning. */
public enum PlanningCommand {
  ENTER_PLANNING("enter-planning", "/plan"),
  SKIP_PLANNING("skip-planning", "/end_plan"),
  CONFIRM_PLAN("confirm-plan", "/confirm_plan");

  private final String token;
  private final String alias;

  PlanningCommand(String token, String alias) {
    this.token = token;
    this.alias = alias;
  }

  public String getToken() {
    return token;
  }

  /** Parses a command token or its slash alias, ignoring case and surrounding blanks. */
  public static Optional<PlanningCommand> parse(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    String normalized = raw.strip().toLowerCase(Locale.ROOT);
    for (PlanningCommand command : values()) {
      if (command.token.equals(normalized)
          || command.alias.equals(normalized)
          || command.name().toLowerCase(Locale.ROOT).equals(normalized)) {
        return Optional.of(command);
      }
    }
    return Optional.empty();
  }
}
