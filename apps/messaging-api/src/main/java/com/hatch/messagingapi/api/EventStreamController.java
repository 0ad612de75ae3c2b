package com.hatch.messagingapi.api;

import com.hatch.messagingapi.realtime.EventStreamService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@RestController
@RequestMapping("/api")
@ConditionalOnProperty(
    prefix = "realtime.listener",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class EventStreamController {
  private final EventStreamService eventStreamService;

  public EventStreamController(EventStreamService eventStreamService) {
    this.eventStreamService = eventStreamService;
  }

  @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public ResponseEntity<SseEmitter> streamEvents() {
    return ResponseEntity.ok()
        .cacheControl(CacheControl.noCache())
        .header("X-Accel-Buffering", "no")
        .body(eventStreamService.open());
  }
}
