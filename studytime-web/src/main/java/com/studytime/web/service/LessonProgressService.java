package com.studytime.web.service;

import com.studytime.common.dto.LessonTimeUpdate;
import com.studytime.common.exception.LessonNotFoundException;
import com.studytime.common.exception.ProgressPersistenceException;
import com.studytime.common.exception.ValidationException;
import com.studytime.progress.config.ProgressProperties;
import com.studytime.progress.config.UpdateMode;
import com.studytime.progress.time.ProgressComparator;
import com.studytime.web.entity.MemberLessonEntity;
import com.studytime.web.repository.MemberLessonRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * 课时播放进度更新。
 * <p>
 * 流程：校验 → 读进度 → 记学习日志（结果忽略）→ 比较位置 → 条件写入。
 * <p>
 * 各步骤不在同一事务内。默认 {@link UpdateMode#LAST_WRITE_WINS} 下，
 * 同一 (学员, 课时) 的并发请求可能读到同一个旧位置并先后写入，后写覆盖先写；
 * 需要避免时切换到 {@link UpdateMode#COMPARE_AND_SET}。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LessonProgressService {

    static final String LESSON_NOT_FOUND = "Lesson not found";
    static final String LESSON_NOT_FOUND_OR_FINISHED = "Lesson not found or already finished";
    static final String PERSISTENCE_FAILED = "Error saving lesson time";

    private final MemberLessonRepository memberLessonRepo;
    private final StudyTimeLogger studyTimeLogger;
    private final ProgressProperties properties;

    /**
     * 处理一次播放进度上报。
     *
     * @throws ValidationException          缺少必填字段，未访问数据库
     * @throws LessonNotFoundException      记录不存在或已完成
     * @throws ProgressPersistenceException 读写进度时数据库出错
     */
    public LessonProgressResult updateLessonTime(LessonTimeUpdate update) {
        validate(update);

        MemberLessonEntity snapshot = readProgress(update)
                .orElseThrow(() -> new LessonNotFoundException(LESSON_NOT_FOUND));

        // 尽力而为，结果不参与后续判断
        studyTimeLogger.logStudyTime(snapshot, update);

        boolean advance = ProgressComparator.shouldAdvance(update.getCurrentTime(), snapshot.getCurrentTime());
        log.info("是否更新播放位置: {} (新 {} / 旧 {})", advance, update.getCurrentTime(), snapshot.getCurrentTime());
        if (!advance) {
            return LessonProgressResult.notAdvanced(snapshot);
        }

        if (properties.getUpdateMode() == UpdateMode.COMPARE_AND_SET) {
            return writeWithCompareAndSet(update, snapshot);
        }
        return writeLastWins(update, snapshot);
    }

    // ==================== 写入策略 ====================

    private LessonProgressResult writeLastWins(LessonTimeUpdate update, MemberLessonEntity snapshot) {
        int affected = persist(() -> memberLessonRepo.updateCurrentTime(
                update.getMemberId(), update.getLessonId(), update.getCurrentTime()));
        if (affected != 1) {
            log.warn("进度未写入，记录不存在或已完成: memberId={}, lessonId={}",
                    update.getMemberId(), update.getLessonId());
            throw new LessonNotFoundException(LESSON_NOT_FOUND_OR_FINISHED);
        }
        log.info("播放位置已更新: memberId={}, lessonId={}, currentTime={}",
                update.getMemberId(), update.getLessonId(), update.getCurrentTime());
        return LessonProgressResult.updated(snapshot);
    }

    /**
     * 以读到的位置作为写入条件；被并发请求抢先时重读并重新比较。
     */
    private LessonProgressResult writeWithCompareAndSet(LessonTimeUpdate update, MemberLessonEntity snapshot) {
        int maxAttempts = Math.max(1, properties.getMaxWriteAttempts());
        MemberLessonEntity observed = snapshot;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String expected = observed.getCurrentTime();
            int affected = persist(() -> memberLessonRepo.compareAndSetCurrentTime(
                    update.getMemberId(), update.getLessonId(), update.getCurrentTime(), expected));
            if (affected == 1) {
                log.info("播放位置已更新: memberId={}, lessonId={}, currentTime={} (第 {} 次尝试)",
                        update.getMemberId(), update.getLessonId(), update.getCurrentTime(), attempt);
                return LessonProgressResult.updated(observed);
            }

            MemberLessonEntity fresh = readProgress(update)
                    .filter(row -> !isFinished(row))
                    .orElseThrow(() -> new LessonNotFoundException(LESSON_NOT_FOUND_OR_FINISHED));
            if (!ProgressComparator.shouldAdvance(update.getCurrentTime(), fresh.getCurrentTime())) {
                log.info("播放位置已被并发请求推进到 {}，本次不更新", fresh.getCurrentTime());
                return LessonProgressResult.notAdvanced(fresh);
            }
            log.debug("播放位置在读取后被修改 ({} → {})，重试", expected, fresh.getCurrentTime());
            observed = fresh;
        }

        log.warn("条件写入 {} 次均未成功，放弃本次更新: memberId={}, lessonId={}",
                maxAttempts, update.getMemberId(), update.getLessonId());
        return LessonProgressResult.notAdvanced(observed);
    }

    // ==================== 内部方法 ====================

    private void validate(LessonTimeUpdate update) {
        List<String> missing = new ArrayList<>();
        if (update.getMemberId() == null || update.getMemberId() == 0) {
            missing.add("memberId");
        }
        if (update.getLessonId() == null || update.getLessonId() == 0) {
            missing.add("lessonId");
        }
        if (update.getCurrentTime() == null || update.getCurrentTime().isEmpty()) {
            missing.add("currentTime");
        }
        if (!missing.isEmpty()) {
            throw new ValidationException(missing);
        }
    }

    private Optional<MemberLessonEntity> readProgress(LessonTimeUpdate update) {
        return persist(() -> memberLessonRepo.findByMemberAndLesson(update.getMemberId(), update.getLessonId()));
    }

    private boolean isFinished(MemberLessonEntity row) {
        return row.getFinished() != null && row.getFinished() != 0;
    }

    private <T> T persist(Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.error("进度读写失败", e);
            throw new ProgressPersistenceException(PERSISTENCE_FAILED, e);
        }
    }
}
