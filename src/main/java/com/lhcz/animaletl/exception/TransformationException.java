package com.lhcz.animaletl.exception;

/**
 * 字段形态不符合预期。转换器记录日志后将字段置为默认值，记录继续流转。
 */
public class TransformationException extends ApiException {
    private final String field;

    public TransformationException(String field, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
