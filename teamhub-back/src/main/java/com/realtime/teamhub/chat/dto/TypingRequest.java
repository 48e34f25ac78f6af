package com.realtime.teamhub.chat.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TypingRequest(@JsonProperty("is_typing") boolean typing) {}
