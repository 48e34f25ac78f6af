package com.realtime.teamhub.security;

import java.util.Optional;

public interface IdentityVerifier {

    /** 액세스 토큰 검증(서명+만료). 실패 시 empty, 예외를 던지지 않는다. */
    Optional<Identity> verify(String accessToken);
}
