package com.hatch.domain.messages;

public record DeliveryBudget(int maxSubmitRetries, int maxDeliveryPolls) {
  public static final int DEFAULT_MAX_SUBMIT_RETRIES = 5;
  public static final int DEFAULT_MAX_DELIVERY_POLLS = 5;

  public DeliveryBudget {
    if (maxSubmitRetries < 0) {
      throw new MessageDomainException("maxSubmitRetries must be >= 0");
    }
    if (maxDeliveryPolls < 0) {
      throw new MessageDomainException("maxDeliveryPolls must be >= 0");
    }
  }

  public static DeliveryBudget defaults() {
    return new DeliveryBudget(DEFAULT_MAX_SUBMIT_RETRIES, DEFAULT_MAX_DELIVERY_POLLS);
  }
}
