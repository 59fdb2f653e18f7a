package com.lhcz.animaletl.exception;

/**
 * 客户端请求错误 (4xx、非法 JSON 响应、未预期的状态码)，重试无效。
 */
public class ClientRequestException extends ApiException {
    private final int statusCode;

    public ClientRequestException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public ClientRequestException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
