package com.realtime.teamhub.inbox.dto;

import java.util.List;

public record InboxPage(
        List<InboxItemDto> inbox,
        long total,
        int page,
        int size
) {}
