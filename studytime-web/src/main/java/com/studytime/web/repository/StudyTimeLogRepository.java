package com.studytime.web.repository;

import com.studytime.web.entity.StudyTimeLogEntity;
import org.springframework.data.repository.CrudRepository;

public interface StudyTimeLogRepository extends CrudRepository<StudyTimeLogEntity, Long> {
}
