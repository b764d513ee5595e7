package net.idlease.core.model;

/** 호출자에게 값으로 돌려주는 실패 사유. code/message는 응답 페이로드에 그대로 실린다 */
public enum LeaseError {
    NO_ID_AVAILABLE(1, "No id available!"),
    ID_EXPIRED(2, "Id expired!"),
    ID_NONEXISTENT(3, "Id nonexistent!");

    private final int code;
    private final String message;

    LeaseError(int code, String message) {
        this.code = code;
        this.message = message;
    }

    public int code() { return code; }

    public String message() { return message; }
}
