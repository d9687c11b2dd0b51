package com.studytime.common.dto;

import lombok.Builder;
import lombok.Value;

import java.util.Optional;

/**
 * 一次播放进度上报。
 * <p>
 * answer 已在边界处完成“无答案”哨兵值到 {@link Optional#empty()} 的映射，
 * 见 {@link com.studytime.common.util.StudyAnswer}。
 */
@Value
@Builder
public class LessonTimeUpdate {

    Long memberId;

    /** member_lesson 主键 */
    Long lessonId;

    /** 播放位置，"m:ss" 或 "h:mm:ss" */
    String currentTime;

    /** 退出登录时暂停视频（0/1） */
    @Builder.Default
    int logout = 0;

    /** 登录后继续播放（0/1） */
    @Builder.Default
    int login = 0;

    @Builder.Default
    Optional<String> answer = Optional.empty();
}
