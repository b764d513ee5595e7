package net.idlease.integration.spring.web;

import net.idlease.core.model.LeaseError;
import net.idlease.core.model.LeaseResult;

/**
 * LeaseResult -> 응답 본문 변환.
 * 성공: {"id": .., "exp": ..} / 실패: {"error": {"code": .., "msg": ..}}
 */
public final class LeasePayloads {

    private LeasePayloads() {}

    public static Object toBody(LeaseResult result) {
        if (result instanceof LeaseResult.Granted g) {
            return new LeaseBody(g.lease().id(), g.lease().expiresAt());
        }
        return toError(((LeaseResult.Denied) result).error());
    }

    private static ErrorBody toError(LeaseError error) {
        return new ErrorBody(new ErrorDetail(error.code(), error.message()));
    }

    public record LeaseBody(int id, long exp) {}

    public record ErrorBody(ErrorDetail error) {}

    public record ErrorDetail(int code, String msg) {}
}
