package com.hatch.integration.twilio;

import com.hatch.domain.messages.OutboundMessage;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/** Replays queued responses or exceptions for submissions and status fetches. */
final class ScriptedTwilioClient implements TwilioMessagingClient {
  private final Deque<Object> submissions = new ArrayDeque<>();
  private final Deque<Object> statuses = new ArrayDeque<>();
  final List<String> fetchedSids = new ArrayList<>();
  int submitCalls;

  ScriptedTwilioClient onSubmit(Object responseOrFailure) {
    submissions.add(responseOrFailure);
    return this;
  }

  ScriptedTwilioClient onFetch(Object responseOrFailure) {
    statuses.add(responseOrFailure);
    return this;
  }

  @Override
  public CarrierResponse submit(OutboundMessage message) {
    submitCalls++;
    return next(submissions, "submit");
  }

  @Override
  public CarrierResponse fetchStatus(String messageSid) {
    fetchedSids.add(messageSid);
    return next(statuses, "fetchStatus");
  }

  private static CarrierResponse next(Deque<Object> script, String operation) {
    Object next = script.poll();
    if (next == null) {
      throw new AssertionError("unexpected " + operation + " call");
    }
    if (next instanceof RuntimeException failure) {
      throw failure;
    }
    return (CarrierResponse) next;
  }
}
