package com.studytime.common.exception;

/**
 * 找不到进度记录，或记录已完成不能再写入。
 */
public class LessonNotFoundException extends StudyTimeException {

    public LessonNotFoundException(String message) {
        super("NOT_FOUND", message);
    }
}
