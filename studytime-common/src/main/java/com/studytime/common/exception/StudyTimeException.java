package com.studytime.common.exception;

/**
 * 系统基础异常，所有业务异常的父类。
 */
public class StudyTimeException extends RuntimeException {

    private final String errorCode;

    public StudyTimeException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public StudyTimeException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
