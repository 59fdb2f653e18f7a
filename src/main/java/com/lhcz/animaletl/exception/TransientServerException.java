package com.lhcz.animaletl.exception;

/**
 * 临时性服务端错误 (5xx / 超时 / 连接失败)，可以按退避策略重试。
 */
public class TransientServerException extends ApiException {
    private final int statusCode;

    public TransientServerException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public TransientServerException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /** -1 表示没有拿到响应 (传输层失败) */
    public int getStatusCode() {
        return statusCode;
    }
}
