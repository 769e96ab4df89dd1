package net.hexproc.core.model;

/** 취소 요청 응답. 상태와 무관하게 항상 "ok" */
public record CancelAck(String status, long processId) {
    public static final String OK = "ok";

    public static CancelAck ok(long processId) {
        return new CancelAck(OK, processId);
    }
}
