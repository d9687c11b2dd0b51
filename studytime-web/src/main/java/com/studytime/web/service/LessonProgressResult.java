package com.studytime.web.service;

import com.studytime.web.entity.MemberLessonEntity;
import lombok.Value;

/**
 * 进度上报的成功结果，携带更新前的进度记录。
 */
@Value
public class LessonProgressResult {

    public enum Status {
        UPDATED("Lesson time saved!"),
        NOT_ADVANCED("Current time not updated - new time is not greater than existing time");

        private final String message;

        Status(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }

    Status status;

    /** 写入前的记录 */
    MemberLessonEntity previous;

    public static LessonProgressResult updated(MemberLessonEntity previous) {
        return new LessonProgressResult(Status.UPDATED, previous);
    }

    public static LessonProgressResult notAdvanced(MemberLessonEntity previous) {
        return new LessonProgressResult(Status.NOT_ADVANCED, previous);
    }

    public String getMessage() {
        return status.getMessage();
    }
}
