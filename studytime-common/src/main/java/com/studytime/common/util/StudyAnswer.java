package com.studytime.common.util;

import java.util.Optional;

/**
 * 学习日志 answer 字段的映射表。
 * <p>
 * 客户端用 {@value #NONE_SENTINEL}（泰语“无”）表示没有答案，入库时存为 NULL：
 * <pre>
 *   null / "ไม่มี"  →  Optional.empty()  →  ANSWER = NULL
 *   其他字符串       →  Optional.of(原值)  →  ANSWER = 原值
 * </pre>
 */
public final class StudyAnswer {

    public static final String NONE_SENTINEL = "ไม่มี";

    private StudyAnswer() {
    }

    public static Optional<String> fromRequest(String raw) {
        if (raw == null || NONE_SENTINEL.equals(raw)) {
            return Optional.empty();
        }
        return Optional.of(raw);
    }
}
