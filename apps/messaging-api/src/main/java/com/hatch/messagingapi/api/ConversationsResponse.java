package com.hatch.messagingapi.api;

import java.util.List;

public record ConversationsResponse(List<ConversationResponse> conversations) {}
