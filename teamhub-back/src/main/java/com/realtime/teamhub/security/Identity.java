package com.realtime.teamhub.security;

import java.util.UUID;

/** 검증된 토큰의 주체. */
public record Identity(UUID userId, String email) {}
