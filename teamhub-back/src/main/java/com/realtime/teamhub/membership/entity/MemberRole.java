package com.realtime.teamhub.membership.entity;

public enum MemberRole {
    OWNER, ADMIN, MEMBER, VIEWER;

    public boolean isAdmin() {
        return this == OWNER || this == ADMIN;
    }
}
