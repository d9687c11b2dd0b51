package com.studytime.web.service;

import com.studytime.common.dto.LessonTimeUpdate;
import com.studytime.common.exception.LessonNotFoundException;
import com.studytime.common.exception.ProgressPersistenceException;
import com.studytime.common.exception.ValidationException;
import com.studytime.progress.config.ProgressProperties;
import com.studytime.progress.config.UpdateMode;
import com.studytime.web.entity.MemberLessonEntity;
import com.studytime.web.repository.MemberLessonRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LessonProgressServiceTest {

    private static final long MEMBER = 7L;
    private static final long LESSON = 11L;

    @Mock
    private MemberLessonRepository memberLessonRepo;
    @Mock
    private StudyTimeLogger studyTimeLogger;

    private ProgressProperties properties;
    private LessonProgressService service;

    @BeforeEach
    void setUp() {
        properties = new ProgressProperties();
        service = new LessonProgressService(memberLessonRepo, studyTimeLogger, properties);
    }

    // ==================== 校验 ====================

    @Test
    void missingMemberIdIsRejectedWithoutTouchingTheDatabase() {
        LessonTimeUpdate update = LessonTimeUpdate.builder().lessonId(LESSON).currentTime("05:00").build();

        assertThatThrownBy(() -> service.updateLessonTime(update))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Missing required fields: memberId");

        verifyNoInteractions(memberLessonRepo, studyTimeLogger);
    }

    @Test
    void namesEveryMissingField() {
        LessonTimeUpdate update = LessonTimeUpdate.builder().memberId(0L).currentTime("").build();

        assertThatThrownBy(() -> service.updateLessonTime(update))
                .isInstanceOf(ValidationException.class)
                .satisfies(e -> assertThat(((ValidationException) e).getMissingFields())
                        .containsExactly("memberId", "lessonId", "currentTime"))
                .hasMessage("Missing required fields: memberId, lessonId, currentTime");

        verifyNoInteractions(memberLessonRepo, studyTimeLogger);
    }

    // ==================== 主流程 ====================

    @Test
    void missingProgressRowIsNotFound() {
        when(memberLessonRepo.findByMemberAndLesson(MEMBER, LESSON)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.updateLessonTime(update("05:00")))
                .isInstanceOf(LessonNotFoundException.class)
                .hasMessage("Lesson not found");

        verifyNoInteractions(studyTimeLogger);
    }

    @Test
    void advancingPositionIsWrittenAndPriorRowReturned() {
        MemberLessonEntity row = row("05:00", 0);
        when(memberLessonRepo.findByMemberAndLesson(MEMBER, LESSON)).thenReturn(Optional.of(row));
        when(memberLessonRepo.updateCurrentTime(MEMBER, LESSON, "10:00")).thenReturn(1);

        LessonTimeUpdate update = update("10:00");
        LessonProgressResult result = service.updateLessonTime(update);

        assertThat(result.getStatus()).isEqualTo(LessonProgressResult.Status.UPDATED);
        assertThat(result.getMessage()).isEqualTo("Lesson time saved!");
        assertThat(result.getPrevious()).isSameAs(row);
        assertThat(result.getPrevious().getCurrentTime()).isEqualTo("05:00");
        verify(studyTimeLogger).logStudyTime(row, update);
    }

    @Test
    void equalPositionIsNotWrittenButStillLogged() {
        MemberLessonEntity row = row("05:00", 0);
        when(memberLessonRepo.findByMemberAndLesson(MEMBER, LESSON)).thenReturn(Optional.of(row));

        LessonTimeUpdate update = update("00:05:00");
        LessonProgressResult result = service.updateLessonTime(update);

        assertThat(result.getStatus()).isEqualTo(LessonProgressResult.Status.NOT_ADVANCED);
        assertThat(result.getMessage())
                .isEqualTo("Current time not updated - new time is not greater than existing time");
        assertThat(result.getPrevious()).isSameAs(row);
        verify(studyTimeLogger).logStudyTime(row, update);
        verify(memberLessonRepo, never()).updateCurrentTime(any(), any(), any());
    }

    @Test
    void loggerFailureDoesNotBlockTheUpdate() {
        MemberLessonEntity row = row("05:00", 0);
        when(memberLessonRepo.findByMemberAndLesson(MEMBER, LESSON)).thenReturn(Optional.of(row));
        when(studyTimeLogger.logStudyTime(any(), any()))
                .thenReturn(StudyTimeLogResult.of(StudyTimeLogResult.Outcome.FAILED));
        when(memberLessonRepo.updateCurrentTime(MEMBER, LESSON, "06:00")).thenReturn(1);

        LessonProgressResult result = service.updateLessonTime(update("06:00"));

        assertThat(result.getStatus()).isEqualTo(LessonProgressResult.Status.UPDATED);
    }

    @Test
    void finishedRowRejectsTheWrite() {
        MemberLessonEntity row = row("05:00", 1);
        when(memberLessonRepo.findByMemberAndLesson(MEMBER, LESSON)).thenReturn(Optional.of(row));
        when(memberLessonRepo.updateCurrentTime(MEMBER, LESSON, "10:00")).thenReturn(0);

        assertThatThrownBy(() -> service.updateLessonTime(update("10:00")))
                .isInstanceOf(LessonNotFoundException.class)
                .hasMessage("Lesson not found or already finished");
    }

    @Test
    void readFailureSurfacesAsPersistenceError() {
        when(memberLessonRepo.findByMemberAndLesson(MEMBER, LESSON))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> service.updateLessonTime(update("10:00")))
                .isInstanceOf(ProgressPersistenceException.class)
                .hasMessage("Error saving lesson time")
                .hasCauseInstanceOf(DataAccessResourceFailureException.class);
    }

    @Test
    void writeFailureSurfacesAsPersistenceError() {
        when(memberLessonRepo.findByMemberAndLesson(MEMBER, LESSON)).thenReturn(Optional.of(row("05:00", 0)));
        when(memberLessonRepo.updateCurrentTime(MEMBER, LESSON, "10:00"))
                .thenThrow(new DataAccessResourceFailureException("database is locked"));

        assertThatThrownBy(() -> service.updateLessonTime(update("10:00")))
                .isInstanceOf(ProgressPersistenceException.class);
    }

    /**
     * 两个请求读到同一个旧位置，都判定前进并各自写入，都返回成功。
     * 最终位置取决于哪次写入最后提交，这里只断言两次写入都发出了。
     */
    @Test
    void concurrentStaleWritersBothSucceed() throws Exception {
        MemberLessonEntity stale = row("01:00", 0);
        CyclicBarrier bothRead = new CyclicBarrier(2);
        Queue<String> writes = new ConcurrentLinkedQueue<>();

        when(memberLessonRepo.findByMemberAndLesson(MEMBER, LESSON)).thenAnswer(inv -> {
            bothRead.await(5, TimeUnit.SECONDS);
            return Optional.of(stale);
        });
        when(memberLessonRepo.updateCurrentTime(eq(MEMBER), eq(LESSON), anyString())).thenAnswer(inv -> {
            writes.add(inv.getArgument(2));
            return 1;
        });

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<LessonProgressResult> first = pool.submit(() -> service.updateLessonTime(update("03:00")));
            Future<LessonProgressResult> second = pool.submit(() -> service.updateLessonTime(update("02:00")));

            assertThat(first.get(5, TimeUnit.SECONDS).getStatus()).isEqualTo(LessonProgressResult.Status.UPDATED);
            assertThat(second.get(5, TimeUnit.SECONDS).getStatus()).isEqualTo(LessonProgressResult.Status.UPDATED);
        } finally {
            pool.shutdownNow();
        }
        assertThat(writes).containsExactlyInAnyOrder("03:00", "02:00");
    }

    // ==================== compare-and-set ====================

    @Nested
    class CompareAndSet {

        @BeforeEach
        void enable() {
            properties.setUpdateMode(UpdateMode.COMPARE_AND_SET);
            properties.setMaxWriteAttempts(3);
        }

        @Test
        void writesWhenPositionUnchanged() {
            MemberLessonEntity row = row("01:00", 0);
            when(memberLessonRepo.findByMemberAndLesson(MEMBER, LESSON)).thenReturn(Optional.of(row));
            when(memberLessonRepo.compareAndSetCurrentTime(MEMBER, LESSON, "02:00", "01:00")).thenReturn(1);

            LessonProgressResult result = service.updateLessonTime(update("02:00"));

            assertThat(result.getStatus()).isEqualTo(LessonProgressResult.Status.UPDATED);
            verify(memberLessonRepo, never()).updateCurrentTime(any(), any(), any());
        }

        @Test
        void retriesAgainstFreshPositionAfterConcurrentWrite() {
            MemberLessonEntity stale = row("01:00", 0);
            MemberLessonEntity fresh = row("03:00", 0);
            when(memberLessonRepo.findByMemberAndLesson(MEMBER, LESSON))
                    .thenReturn(Optional.of(stale), Optional.of(fresh));
            when(memberLessonRepo.compareAndSetCurrentTime(MEMBER, LESSON, "10:00", "01:00")).thenReturn(0);
            when(memberLessonRepo.compareAndSetCurrentTime(MEMBER, LESSON, "10:00", "03:00")).thenReturn(1);

            LessonProgressResult result = service.updateLessonTime(update("10:00"));

            assertThat(result.getStatus()).isEqualTo(LessonProgressResult.Status.UPDATED);
            assertThat(result.getPrevious()).isSameAs(fresh);
        }

        @Test
        void concurrentWriterAlreadyFurtherMeansNoUpdate() {
            MemberLessonEntity stale = row("01:00", 0);
            MemberLessonEntity fresh = row("04:00", 0);
            when(memberLessonRepo.findByMemberAndLesson(MEMBER, LESSON))
                    .thenReturn(Optional.of(stale), Optional.of(fresh));
            when(memberLessonRepo.compareAndSetCurrentTime(MEMBER, LESSON, "03:00", "01:00")).thenReturn(0);

            LessonProgressResult result = service.updateLessonTime(update("03:00"));

            assertThat(result.getStatus()).isEqualTo(LessonProgressResult.Status.NOT_ADVANCED);
            assertThat(result.getPrevious().getCurrentTime()).isEqualTo("04:00");
        }

        @Test
        void finishedMeanwhileIsNotFound() {
            when(memberLessonRepo.findByMemberAndLesson(MEMBER, LESSON))
                    .thenReturn(Optional.of(row("01:00", 0)), Optional.of(row("01:00", 1)));
            when(memberLessonRepo.compareAndSetCurrentTime(MEMBER, LESSON, "02:00", "01:00")).thenReturn(0);

            assertThatThrownBy(() -> service.updateLessonTime(update("02:00")))
                    .isInstanceOf(LessonNotFoundException.class)
                    .hasMessage("Lesson not found or already finished");
        }

        @Test
        void givesUpAfterMaxAttempts() {
            properties.setMaxWriteAttempts(2);
            when(memberLessonRepo.findByMemberAndLesson(MEMBER, LESSON))
                    .thenReturn(Optional.of(row("01:00", 0)), Optional.of(row("01:10", 0)), Optional.of(row("01:20", 0)));
            when(memberLessonRepo.compareAndSetCurrentTime(eq(MEMBER), eq(LESSON), eq("09:00"), anyString()))
                    .thenReturn(0);

            LessonProgressResult result = service.updateLessonTime(update("09:00"));

            assertThat(result.getStatus()).isEqualTo(LessonProgressResult.Status.NOT_ADVANCED);
            verify(memberLessonRepo, times(2)).compareAndSetCurrentTime(eq(MEMBER), eq(LESSON), eq("09:00"), anyString());
        }
    }

    // ==================== fixtures ====================

    private static MemberLessonEntity row(String currentTime, int finished) {
        return MemberLessonEntity.builder()
                .id(LESSON)
                .memberId(MEMBER)
                .lessonId(5L)
                .memberCourseId(300L)
                .currentTime(currentTime)
                .finished(finished)
                .build();
    }

    private static LessonTimeUpdate update(String currentTime) {
        return LessonTimeUpdate.builder()
                .memberId(MEMBER)
                .lessonId(LESSON)
                .currentTime(currentTime)
                .build();
    }
}
