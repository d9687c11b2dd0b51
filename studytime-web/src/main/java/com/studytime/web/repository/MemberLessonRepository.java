package com.studytime.web.repository;

import com.studytime.web.entity.MemberLessonEntity;
import org.springframework.data.jdbc.repository.query.Modifying;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;

import java.util.Optional;

public interface MemberLessonRepository extends CrudRepository<MemberLessonEntity, Long> {

    @Query("SELECT * FROM member_lesson WHERE member_id = :memberId AND id = :lessonId")
    Optional<MemberLessonEntity> findByMemberAndLesson(Long memberId, Long lessonId);

    /** 只按课时 ID 查，学习日志用它反查 course_lesson */
    @Query("SELECT * FROM member_lesson WHERE id = :lessonId")
    Optional<MemberLessonEntity> findLessonRef(Long lessonId);

    /**
     * 条件写：已完成的记录不动。
     *
     * @return 受影响行数
     */
    @Modifying
    @Query("UPDATE member_lesson SET \"current_time\" = :currentTime "
            + "WHERE member_id = :memberId AND id = :lessonId AND finished = 0")
    int updateCurrentTime(Long memberId, Long lessonId, String currentTime);

    /**
     * 带位置校验的条件写：库中位置必须仍是 expectedTime（NULL 安全比较）。
     */
    @Modifying
    @Query("UPDATE member_lesson SET \"current_time\" = :currentTime "
            + "WHERE member_id = :memberId AND id = :lessonId AND finished = 0 "
            + "AND \"current_time\" IS :expectedTime")
    int compareAndSetCurrentTime(Long memberId, Long lessonId, String currentTime, String expectedTime);
}
