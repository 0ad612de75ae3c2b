package com.hatch.infra.realtime;

public record RawNotification(String channel, String payload, int backendPid) {}
