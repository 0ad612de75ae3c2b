package com.hatch.integration.twilio;

import com.hatch.domain.messages.OutboundMessage;

public interface TwilioMessagingClient {
  CarrierResponse submit(OutboundMessage message);

  CarrierResponse fetchStatus(String messageSid);
}
