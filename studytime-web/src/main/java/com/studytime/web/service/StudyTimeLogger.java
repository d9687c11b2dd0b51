package com.studytime.web.service;

import com.studytime.common.dto.LessonTimeUpdate;
import com.studytime.progress.time.TimeNormalizer;
import com.studytime.web.entity.CourseLessonEntity;
import com.studytime.web.entity.MemberLessonEntity;
import com.studytime.web.entity.StudyTimeLogEntity;
import com.studytime.web.repository.CourseLessonRepository;
import com.studytime.web.repository.MemberLessonRepository;
import com.studytime.web.repository.StudyTimeLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import java.util.OptionalLong;

import static com.studytime.web.service.StudyTimeLogResult.Outcome.*;

/**
 * 学习时长日志 —— 记录两次上报之间的播放时长增量。
 * <p>
 * 尽力而为：任何失败都只打日志并返回失败结果，不向调用方抛异常，也不影响进度更新。
 * 每条 SQL 单独提交，后续进度写入失败时已写入的日志不会回滚。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StudyTimeLogger {

    private static final DateTimeFormatter SQLITE_FMT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final MemberLessonRepository memberLessonRepo;
    private final CourseLessonRepository courseLessonRepo;
    private final StudyTimeLogRepository studyTimeLogRepo;

    /**
     * 计算增量并追加一条日志。
     *
     * @param snapshot 调用方先前读到的进度记录，提供选课 ID
     * @param update   本次上报
     */
    public StudyTimeLogResult logStudyTime(MemberLessonEntity snapshot, LessonTimeUpdate update) {
        try {
            // 重新读一次，不用调用方的快照
            Optional<MemberLessonEntity> stored =
                    memberLessonRepo.findByMemberAndLesson(update.getMemberId(), update.getLessonId());
            if (stored.isEmpty()) {
                return StudyTimeLogResult.of(PROGRESS_MISSING);
            }

            OptionalLong storedSeconds = TimeNormalizer.extendedSeconds(stored.get().getCurrentTime());
            OptionalLong newSeconds = TimeNormalizer.extendedSeconds(update.getCurrentTime());
            if (storedSeconds.isEmpty() || newSeconds.isEmpty()) {
                log.debug("播放位置无法解析，跳过学习日志: stored={}, new={}",
                        stored.get().getCurrentTime(), update.getCurrentTime());
                return StudyTimeLogResult.of(UNPARSEABLE_TIME);
            }

            long delta = Math.abs(newSeconds.getAsLong() - storedSeconds.getAsLong());
            if (delta == 0) {
                return StudyTimeLogResult.of(ZERO_DELTA);
            }

            Optional<MemberLessonEntity> lessonRef = memberLessonRepo.findLessonRef(update.getLessonId());
            Long courseLessonId = lessonRef.map(MemberLessonEntity::getLessonId).orElse(null);
            if (courseLessonId == null) {
                log.warn("课时不存在，跳过学习日志: lessonId={}", update.getLessonId());
                return StudyTimeLogResult.of(LESSON_UNRESOLVED);
            }
            Optional<CourseLessonEntity> courseLesson = courseLessonRepo.findCourseLesson(courseLessonId);
            if (courseLesson.isEmpty()) {
                log.warn("课程课时不存在，跳过学习日志: courseLessonId={}", courseLessonId);
                return StudyTimeLogResult.of(LESSON_UNRESOLVED);
            }

            StudyTimeLogEntity entry = StudyTimeLogEntity.builder()
                    .memberId(update.getMemberId())
                    .courseId(courseLesson.get().getCourseId())
                    .lessonId(courseLessonId)
                    .memberCourseId(snapshot.getMemberCourseId())
                    .studyTime(delta)
                    .pauseVideoLogout(update.getLogout())
                    .loginStartVideo(update.getLogin())
                    .studyTimeVideo(TimeNormalizer.videoPosition(update.getCurrentTime()))
                    .answer(update.getAnswer().orElse(null))
                    .createdAt(LocalDateTime.now().format(SQLITE_FMT))
                    .build();
            studyTimeLogRepo.save(entry);

            log.info("学习时长已记录: memberId={}, courseId={}, lessonId={}, 增量={}s",
                    update.getMemberId(), entry.getCourseId(), courseLessonId, delta);
            return StudyTimeLogResult.logged(delta);

        } catch (Exception e) {
            log.warn("学习时长记录失败（不影响进度更新）: memberId={}, lessonId={}",
                    update.getMemberId(), update.getLessonId(), e);
            return StudyTimeLogResult.of(FAILED);
        }
    }
}
