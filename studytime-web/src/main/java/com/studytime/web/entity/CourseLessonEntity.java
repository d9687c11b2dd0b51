package com.studytime.web.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * 课程-课时关系表，用于从课时反查所属课程。
 */
@Table("course_lesson")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CourseLessonEntity {

    @Id
    private Long id;

    private Long courseId;
}
