package com.studytime.web.repository;

import com.studytime.web.entity.CourseLessonEntity;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;

import java.util.Optional;

public interface CourseLessonRepository extends CrudRepository<CourseLessonEntity, Long> {

    @Query("SELECT * FROM course_lesson WHERE id = :id")
    Optional<CourseLessonEntity> findCourseLesson(Long id);
}
