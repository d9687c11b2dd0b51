package com.studytime.web.service;

import lombok.Value;

/**
 * 学习时长日志的执行结果。调用方可以忽略它，测试用它断言走到了哪一步。
 */
@Value
public class StudyTimeLogResult {

    public enum Outcome {
        /** 已写入一条日志 */
        LOGGED,
        /** 增量为 0，不写日志 */
        ZERO_DELTA,
        /** 重读时进度记录已不存在 */
        PROGRESS_MISSING,
        /** 新旧位置有一个无法解析 */
        UNPARSEABLE_TIME,
        /** 课时或所属课程查不到 */
        LESSON_UNRESOLVED,
        /** 执行中出现异常 */
        FAILED
    }

    Outcome outcome;

    /** 增量秒数，未算出时为 0 */
    long delta;

    public static StudyTimeLogResult of(Outcome outcome) {
        return new StudyTimeLogResult(outcome, 0);
    }

    public static StudyTimeLogResult logged(long delta) {
        return new StudyTimeLogResult(Outcome.LOGGED, delta);
    }

    public boolean isSuccess() {
        return outcome == Outcome.LOGGED || outcome == Outcome.ZERO_DELTA;
    }
}
