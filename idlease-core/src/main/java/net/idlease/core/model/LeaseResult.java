package net.idlease.core.model;

/** acquire/heartbeat 결과: 성공(Granted) 또는 거절(Denied) */
public sealed interface LeaseResult permits LeaseResult.Granted, LeaseResult.Denied {

    static LeaseResult granted(Lease lease) { return new Granted(lease); }

    static LeaseResult denied(LeaseError error) { return new Denied(error); }

    record Granted(Lease lease) implements LeaseResult {}

    record Denied(LeaseError error) implements LeaseResult {}
}
