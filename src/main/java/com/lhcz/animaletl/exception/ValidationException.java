package com.lhcz.animaletl.exception;

/**
 * 本地校验失败：批次超限、记录缺少必填字段等。直接抛给调用方，不重试。
 */
public class ValidationException extends ApiException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
