package com.studytime.web.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * 学员课时进度表 —— 每个 (学员, 课时) 一行，记录最后播放位置。
 * <p>
 * 本服务只改 current_time，且仅在 finished = 0 时改；其余字段由选课、结课流程维护。
 */
@Table("member_lesson")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemberLessonEntity {

    @Id
    private Long id;

    private Long memberId;

    /** 指向 course_lesson.id */
    private Long lessonId;

    /** 选课（班次）ID */
    private Long memberCourseId;

    /** 播放位置，"m:ss" 或 "h:mm:ss" */
    private String currentTime;

    @Builder.Default
    private Integer finished = 0;
}
