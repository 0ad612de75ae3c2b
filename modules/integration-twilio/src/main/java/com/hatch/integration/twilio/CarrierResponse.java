package com.hatch.integration.twilio;

import com.hatch.domain.messages.DeliveryRecord;

public record CarrierResponse(int statusCode, DeliveryRecord record, CarrierResponseHeaders headers) {
  public CarrierResponse {
    if (record == null) {
      throw new IllegalArgumentException("record is required");
    }
    if (headers == null) {
      headers = CarrierResponseHeaders.empty();
    }
  }
}
