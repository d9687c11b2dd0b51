package com.studytime.web.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * 学习时长日志 —— 两次上报之间的播放时长增量，只追加不修改。
 */
@Table("log_study_time")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StudyTimeLogEntity {

    @Id
    private Long id;

    private Long memberId;
    private Long courseId;

    /** course_lesson.id */
    private Long lessonId;

    private Long memberCourseId;

    /** 增量秒数 */
    private Long studyTime;

    /** 因退出登录暂停视频 */
    @Builder.Default
    private Integer pauseVideoLogout = 0;

    /** 登录后继续播放 */
    @Builder.Default
    private Integer loginStartVideo = 0;

    /** 上报位置的紧凑写法，如 "5.30" */
    private String studyTimeVideo;

    /** 无答案时为 NULL */
    private String answer;

    /** SQLite TEXT 格式（yyyy-MM-dd HH:mm:ss） */
    private String createdAt;
}
