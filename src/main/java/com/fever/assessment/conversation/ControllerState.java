package com.fever.assessment.conversation;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a {@link SessionController}. Moving to {@code IDLE} means the current session was
 * discarded by a restart.
 */
public enum ControllerState {
  IDLE,
  STARTING,
  ACTIVE,
  COMPLETED;

  public boolean canTransitionTo(ControllerState next) {
    return allowedNext().contains(next);
  }

  private Set<ControllerState> allowedNext() {
    switch (this) {
      case IDLE:
        return EnumSet.of(STARTING);
      case STARTING:
        return EnumSet.of(ACTIVE, IDLE);
      case ACTIVE:
        // ACTIVE -> ACTIVE covers remote-to-local degrade and a local restart at start.
        return EnumSet.of(ACTIVE, COMPLETED, IDLE);
      case COMPLETED:
        return EnumSet.of(STARTING);
      default:
        return EnumSet.noneOf(ControllerState.class);
    }
  }
}
