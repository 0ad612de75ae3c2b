package com.hatch.domain.messages;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Progress of one outbound send. Owned by a single pipeline call and never shared between threads.
 *
 * <p>Submission retries and delivery polls are each capped by the {@link DeliveryBudget}. When a
 * cap is reached the attempt completes with whatever phase was last observed.
 */
public final class DeliveryAttempt {
  private final UUID messageId;
  private final OutboundMessage message;
  private final DeliveryBudget budget;

  private DeliveryPhase phase = DeliveryPhase.SUBMITTED;
  private String carrierRef;
  private DeliveryRecord lastRecord;
  private Integer failureCode;
  private String failureMessage;
  private int retryCount;
  private int deliveryPollCount;
  private boolean budgetExhausted;

  public DeliveryAttempt(UUID messageId, OutboundMessage message, DeliveryBudget budget) {
    this.messageId = Objects.requireNonNull(messageId, "messageId must not be null");
    this.message = Objects.requireNonNull(message, "message must not be null");
    this.budget = Objects.requireNonNull(budget, "budget must not be null");
  }

  public static DeliveryAttempt start(OutboundMessage message, DeliveryBudget budget) {
    return new DeliveryAttempt(UUID.randomUUID(), message, budget);
  }

  /**
   * Records a rate-limited submission.
   *
   * @return {@code true} if the caller may back off and resubmit, {@code false} once the retry
   *     budget is spent and the attempt has failed
   */
  public boolean registerRateLimit(Integer carrierCode, String carrierMessage) {
    requireInProgress();
    if (retryCount >= budget.maxSubmitRetries()) {
      failureCode = carrierCode;
      failureMessage = carrierMessage;
      budgetExhausted = true;
      transitionTo(DeliveryPhase.FAILED);
      return false;
    }
    transitionTo(DeliveryPhase.RATE_LIMITED);
    retryCount++;
    return true;
  }

  public void recordAccepted(DeliveryRecord record) {
    requireInProgress();
    Objects.requireNonNull(record, "record must not be null");
    if (record.sid() == null || record.sid().isBlank()) {
      throw new MessageDomainException("accepted carrier record must carry a sid");
    }
    carrierRef = record.sid();
    apply(record);
    exhaustPollsIfNeeded();
  }

  public boolean needsStatusPoll() {
    return !isComplete() && carrierRef != null;
  }

  public void recordPoll(DeliveryRecord record) {
    Objects.requireNonNull(record, "record must not be null");
    beginPoll();
    apply(record);
    exhaustPollsIfNeeded();
  }

  /** Counts a poll that produced no usable status, for example an I/O failure. */
  public void recordMissedPoll() {
    beginPoll();
    exhaustPollsIfNeeded();
  }

  public boolean isComplete() {
    return phase.isTerminal() || budgetExhausted;
  }

  public DeliveryOutcome toOutcome(Instant completedAt) {
    if (!isComplete()) {
      throw new MessageDomainException("delivery attempt " + messageId + " is still in progress");
    }
    return new DeliveryOutcome(
        messageId,
        message.conversationId(),
        message,
        phase,
        lastRecord,
        failureCode,
        failureMessage,
        retryCount,
        deliveryPollCount,
        budgetExhausted,
        completedAt);
  }

  public UUID messageId() {
    return messageId;
  }

  public OutboundMessage message() {
    return message;
  }

  public DeliveryBudget budget() {
    return budget;
  }

  public DeliveryPhase phase() {
    return phase;
  }

  public String carrierRef() {
    return carrierRef;
  }

  public DeliveryRecord lastRecord() {
    return lastRecord;
  }

  public int retryCount() {
    return retryCount;
  }

  public int deliveryPollCount() {
    return deliveryPollCount;
  }

  public boolean budgetExhausted() {
    return budgetExhausted;
  }

  private void beginPoll() {
    if (!needsStatusPoll()) {
      throw new MessageDomainException(
          "delivery attempt " + messageId + " does not accept polls in phase " + phase);
    }
    deliveryPollCount++;
  }

  private void apply(DeliveryRecord record) {
    transitionTo(record.phase());
    lastRecord = record;
    if (record.hasError()) {
      failureCode = record.errorCode();
      failureMessage = record.errorMessage();
    }
  }

  private void exhaustPollsIfNeeded() {
    if (!phase.isTerminal() && deliveryPollCount >= budget.maxDeliveryPolls()) {
      budgetExhausted = true;
    }
  }

  private void transitionTo(DeliveryPhase next) {
    DeliveryStateMachine.validateTransition(phase, next);
    phase = next;
  }

  private void requireInProgress() {
    if (isComplete()) {
      throw new MessageDomainException("delivery attempt " + messageId + " is already complete");
    }
  }
}
