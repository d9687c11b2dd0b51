package com.studytime.web.controller;

import com.studytime.common.dto.ApiResponse;
import com.studytime.web.dto.LessonTimeRequest;
import com.studytime.web.entity.MemberLessonEntity;
import com.studytime.web.service.LessonProgressResult;
import com.studytime.web.service.LessonProgressService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

/**
 * 课时播放进度上报 API。
 * <p>
 * 播放器定时上报当前位置，位置前进时写库；每次上报都会尝试记一条学习时长日志。
 */
@Slf4j
@RestController
@RequestMapping("/lesson")
@RequiredArgsConstructor
public class LessonProgressController {

    private final LessonProgressService progressService;

    @PostMapping(value = "/dwUpdateTime", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ApiResponse<MemberLessonEntity> updateTime(@RequestBody LessonTimeRequest request) {
        return handle(request);
    }

    /**
     * 表单提交，字段同 JSON。
     */
    @PostMapping(value = "/dwUpdateTime", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public ApiResponse<MemberLessonEntity> updateTimeForm(@ModelAttribute LessonTimeRequest request) {
        return handle(request);
    }

    private ApiResponse<MemberLessonEntity> handle(LessonTimeRequest request) {
        log.info("收到进度上报: memberId={}, lessonId={}, currentTime={}, logout={}, login={}, answer={}",
                request.getMemberId(), request.getLessonId(), request.getCurrentTime(),
                request.getLogout(), request.getLogin(), request.getAnswer());

        LessonProgressResult result = progressService.updateLessonTime(request.toUpdate());
        return ApiResponse.ok(result.getPrevious(), result.getMessage());
    }
}
