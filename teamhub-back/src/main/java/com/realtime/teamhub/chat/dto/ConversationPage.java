package com.realtime.teamhub.chat.dto;

import java.util.List;

public record ConversationPage<T>(
        List<T> conversations,
        long total,
        int limit,
        int offset
) {}
