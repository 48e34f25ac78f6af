package com.realtime.teamhub.chat.entity;

public enum AttachmentScope {
    PROJECT, DIRECT
}
