package com.realtime.teamhub.user.service;

import com.realtime.teamhub.user.dto.UserSummary;
import com.realtime.teamhub.user.entity.User;
import com.realtime.teamhub.user.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserDirectory {

    private final UserRepository userRepo;

    /**
     * 표시 이름 우선순위: display_name → email → "Unknown".
     * 조회 실패는 메시지 흐름을 막지 않는다.
     */
    @Transactional(readOnly = true)
    public UserSummary summaryOf(UUID userId) {
        if (userId == null) return null;
        try {
            return userRepo.findById(userId)
                    .map(UserDirectory::toSummary)
                    .orElseGet(() -> new UserSummary(userId, "Unknown", null));
        } catch (Exception e) {
            log.warn("User lookup failed for {}: {}", userId, e.getMessage());
            return new UserSummary(userId, "Unknown", null);
        }
    }

    @Transactional(readOnly = true)
    public Map<UUID, UserSummary> summariesOf(Collection<UUID> userIds) {
        Map<UUID, UserSummary> out = new HashMap<>();
        if (userIds == null || userIds.isEmpty()) return out;
        userRepo.findAllById(userIds).forEach(u -> out.put(u.getId(), toSummary(u)));
        for (UUID id : userIds) {
            out.putIfAbsent(id, new UserSummary(id, "Unknown", null));
        }
        return out;
    }

    /**
     * inbox_new 실시간 푸시 여부. 프로필이 없거나 조회에 실패하면 true (기본 수신).
     */
    @Transactional(readOnly = true)
    public boolean browserNotificationsEnabled(UUID userId) {
        try {
            return userRepo.findById(userId)
                    .map(u -> !Boolean.FALSE.equals(u.getBrowserNotifications()))
                    .orElse(true);
        } catch (Exception e) {
            log.warn("Notification preference lookup failed for {}: {}", userId, e.getMessage());
            return true;
        }
    }

    private static UserSummary toSummary(User u) {
        String name = (u.getDisplayName() != null && !u.getDisplayName().isBlank())
                ? u.getDisplayName()
                : (u.getEmail() != null ? u.getEmail() : "Unknown");
        return new UserSummary(u.getId(), name, u.getAvatarUrl());
    }
}
