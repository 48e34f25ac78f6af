package com.realtime.teamhub.config;

import com.realtime.teamhub.security.IdentityVerifier;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;

/**
 * REST 요청의 Bearer 토큰 인증. principal name = 사용자 UUID 문자열.
 * 토큰이 없거나 무효면 인증을 세팅하지 않고 통과 (보호 리소스는 이후 401).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JWTAuthenticationFilter extends OncePerRequestFilter {

    private static final String BEARER = "Bearer ";

    private final IdentityVerifier identityVerifier;

    /** 소켓 핸드셰이크와 프리플라이트는 건너뜀 */
    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String p = request.getServletPath();
        return p.startsWith("/ws/") || "OPTIONS".equalsIgnoreCase(request.getMethod());
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        String h = req.getHeader(HttpHeaders.AUTHORIZATION);
        if (h != null && h.startsWith(BEARER)
                && SecurityContextHolder.getContext().getAuthentication() == null) {
            identityVerifier.verify(h.substring(BEARER.length()).trim()).ifPresent(identity -> {
                var auth = new UsernamePasswordAuthenticationToken(identity.userId().toString(), null, List.of());
                SecurityContextHolder.getContext().setAuthentication(auth);
            });
        }
        chain.doFilter(req, res);
    }
}
