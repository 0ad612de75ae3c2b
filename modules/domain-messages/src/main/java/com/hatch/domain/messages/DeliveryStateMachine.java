package com.hatch.domain.messages;

import java.util.EnumSet;
import java.util.Map;

public final class DeliveryStateMachine {
  private static final Map<DeliveryPhase, EnumSet<DeliveryPhase>> ALLOWED_TRANSITIONS =
      Map.of(
          DeliveryPhase.SUBMITTED,
              EnumSet.of(
                  DeliveryPhase.RATE_LIMITED,
                  DeliveryPhase.SENT,
                  DeliveryPhase.DELIVERED,
                  DeliveryPhase.UNDELIVERED,
                  DeliveryPhase.FAILED),
          DeliveryPhase.RATE_LIMITED,
              EnumSet.of(
                  DeliveryPhase.RATE_LIMITED,
                  DeliveryPhase.SENT,
                  DeliveryPhase.DELIVERED,
                  DeliveryPhase.UNDELIVERED,
                  DeliveryPhase.FAILED),
          DeliveryPhase.SENT,
              EnumSet.of(
                  DeliveryPhase.SENT,
                  DeliveryPhase.DELIVERED,
                  DeliveryPhase.UNDELIVERED,
                  DeliveryPhase.FAILED),
          DeliveryPhase.DELIVERED, EnumSet.noneOf(DeliveryPhase.class),
          DeliveryPhase.UNDELIVERED, EnumSet.noneOf(DeliveryPhase.class),
          DeliveryPhase.FAILED, EnumSet.noneOf(DeliveryPhase.class));

  private DeliveryStateMachine() {}

  public static boolean canTransition(DeliveryPhase from, DeliveryPhase to) {
    if (from == null || to == null) {
      return false;
    }
    EnumSet<DeliveryPhase> allowed = ALLOWED_TRANSITIONS.get(from);
    return allowed != null && allowed.contains(to);
  }

  public static void validateTransition(DeliveryPhase from, DeliveryPhase to) {
    if (!canTransition(from, to)) {
      throw new MessageDomainException(
          "Invalid delivery phase transition from " + from + " to " + to);
    }
  }
}
