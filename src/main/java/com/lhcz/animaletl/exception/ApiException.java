package com.lhcz.animaletl.exception;

/**
 * 流水线错误基类
 * 所有分类错误都继承自此类，调用方按子类型决定重试、跳过或上抛。
 */
public class ApiException extends RuntimeException {

    public ApiException(String message) {
        super(message);
    }

    public ApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
