package com.realtime.teamhub.user.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * 디렉터리 서비스가 관리하는 사용자 프로필(읽기 전용 뷰).
 */
@Entity
@Table(name = "users")
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class User {

    /** 인증 서비스의 subject 와 동일한 UUID */
    @Id
    private UUID id;

    @Column(length = 191)
    private String email;

    /** 표시용 이름 */
    @Column(name = "display_name", length = 100)
    private String displayName;

    @Column(name = "avatar_url", length = 512)
    private String avatarUrl;

    /** 브라우저(실시간) 알림 수신 여부. null 은 기본값 true 로 취급 */
    @Column(name = "browser_notifications")
    private Boolean browserNotifications;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;
}
