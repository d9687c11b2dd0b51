package com.studytime.common.exception;

/**
 * 主流程（读取/写入进度）的数据库异常。
 */
public class ProgressPersistenceException extends StudyTimeException {

    public ProgressPersistenceException(String message, Throwable cause) {
        super("PERSISTENCE_ERROR", message, cause);
    }
}
