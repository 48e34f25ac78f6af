package com.realtime.teamhub.membership.entity;

import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

@Entity
@Table(name = "project_members",
       uniqueConstraints = @UniqueConstraint(name = "uk_project_user", columnNames = {"project_id", "user_id"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ProjectMember {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "project_id", nullable = false)
    private UUID projectId;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    // 프로젝트가 속한 조직. 대화 목록을 조직 단위로 거를 때 사용
    @Column(name = "organization_id")
    private UUID organizationId;

    @Enumerated(EnumType.STRING) @Column(nullable = false, length = 10)
    private MemberRole role;
}
