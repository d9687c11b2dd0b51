package com.studytime.web.dto;

import com.studytime.common.dto.LessonTimeUpdate;
import com.studytime.common.util.StudyAnswer;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 播放进度上报请求体（JSON 或表单）。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LessonTimeRequest {

    private Long memberId;
    private Long lessonId;
    private String currentTime;

    /** 0/1，缺省 0 */
    private Integer logout;

    /** 0/1，缺省 0 */
    private Integer login;

    /** 缺省或 "ไม่มี" 表示无答案 */
    private String answer;

    public LessonTimeUpdate toUpdate() {
        return LessonTimeUpdate.builder()
                .memberId(memberId)
                .lessonId(lessonId)
                .currentTime(currentTime)
                .logout(logout != null ? logout : 0)
                .login(login != null ? login : 0)
                .answer(StudyAnswer.fromRequest(answer))
                .build();
    }
}
