package net.idlease.core.model;

public record Lease(
        int id,          // 임차된 식별자
        long expiresAt   // 만료 시각 (epoch millis)
) {
}
