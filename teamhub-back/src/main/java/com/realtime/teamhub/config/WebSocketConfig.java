package com.realtime.teamhub.config;

import com.realtime.teamhub.realtime.ws.RealtimeSocketHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import java.util.Arrays;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final RealtimeSocketHandler realtimeSocketHandler;

    @Value("${app.cors.allowed-origins:http://localhost:3000}")
    private String allowedOrigins;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        // 쉼표로 여러 Origin 지정 가능
        String[] origins = Arrays.stream(allowedOrigins.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toArray(String[]::new);

        // 인증/권한은 핸드셰이크 이후 핸들러가 직접 확인 (close code 4001/4003)
        registry.addHandler(realtimeSocketHandler, "/ws/project/*", "/ws/dm/*", "/ws/inbox/*")
                .setAllowedOrigins(origins);
    }
}
