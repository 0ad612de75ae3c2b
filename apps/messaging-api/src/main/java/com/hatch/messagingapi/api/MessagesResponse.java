package com.hatch.messagingapi.api;

import java.util.List;

public record MessagesResponse(List<MessageResponse> messages) {}
