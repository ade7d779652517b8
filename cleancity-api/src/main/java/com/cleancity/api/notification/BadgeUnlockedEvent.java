package com.cleancity.api.notification;

import com.cleancity.core.domain.Badge;

import java.time.Instant;

public record BadgeUnlockedEvent(String deviceId, Badge badge, Instant occurredAt) {}
