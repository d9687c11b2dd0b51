package com.studytime.progress.time;

import lombok.extern.slf4j.Slf4j;

/**
 * 判断新上报的播放位置是否超过已保存的位置。
 */
@Slf4j
public final class ProgressComparator {

    private ProgressComparator() {
    }

    /**
     * 严格大于才算前进，相等不写库。
     */
    public static boolean shouldAdvance(String newTime, String existingTime) {
        long newSeconds = TimeNormalizer.strictSeconds(newTime);
        long existingSeconds = TimeNormalizer.strictSeconds(existingTime);
        log.debug("比较播放位置: {} ({}s) vs {} ({}s)", newTime, newSeconds, existingTime, existingSeconds);
        return newSeconds > existingSeconds;
    }
}
