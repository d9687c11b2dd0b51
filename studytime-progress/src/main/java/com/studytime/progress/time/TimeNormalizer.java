package com.studytime.progress.time;

import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 播放时间字符串解析。
 * <p>
 * 两套换算规则刻意分开，不要合并：
 * <ul>
 *   <li>{@link #strictSeconds(String)}：用于判断进度是否前进，三段式时丢弃第一段</li>
 *   <li>{@link #extendedSeconds(String)}：用于计算学习时长增量，三段式时保留小时</li>
 * </ul>
 * 同一个 "1:05:30"，前者得 330，后者得 3930。
 */
public final class TimeNormalizer {

    /** m:ss / mm:ss，整串匹配 */
    private static final Pattern MINUTES_SECONDS = Pattern.compile("(\\d{1,2}):(\\d{2})");

    /** 任意位置出现的 a:b:c */
    private static final Pattern THREE_GROUPS = Pattern.compile("(\\d+):(\\d+):(\\d+)");

    private static final Pattern LEADING_ZEROS = Pattern.compile("^0+");

    private TimeNormalizer() {
    }

    /**
     * 比较用秒数。
     * <p>
     * "m:ss" 得 m*60+s；含 "a:b:c" 时得 b*60+c，a 无论多大都被丢弃
     * （视频时长默认不超过 100 分钟）；其余输入一律为 0，不抛异常。
     */
    public static long strictSeconds(String time) {
        if (time == null) {
            return 0;
        }
        try {
            Matcher ms = MINUTES_SECONDS.matcher(time);
            if (ms.matches()) {
                return toSeconds(0, Long.parseLong(ms.group(1)), Long.parseLong(ms.group(2)));
            }
            Matcher hms = THREE_GROUPS.matcher(time);
            if (hms.find()) {
                return toSeconds(0, Long.parseLong(hms.group(2)), Long.parseLong(hms.group(3)));
            }
        } catch (NumberFormatException | ArithmeticException e) {
            // 数字段或换算结果超出 long 范围，按无法解析处理
            return 0;
        }
        return 0;
    }

    /**
     * 时长增量用秒数。
     * <p>
     * "m:ss" 先补成 "00:m:ss"，再按 h:m:s 取 h*3600+m*60+s。
     *
     * @return 无法解析时为空
     */
    public static OptionalLong extendedSeconds(String time) {
        if (time == null) {
            return OptionalLong.empty();
        }
        String padded = MINUTES_SECONDS.matcher(time).matches() ? "00:" + time : time;
        Matcher hms = THREE_GROUPS.matcher(padded);
        if (!hms.find()) {
            return OptionalLong.empty();
        }
        try {
            long hours = Long.parseLong(hms.group(1));
            long minutes = Long.parseLong(hms.group(2));
            long seconds = Long.parseLong(hms.group(3));
            return OptionalLong.of(toSeconds(hours, minutes, seconds));
        } catch (NumberFormatException | ArithmeticException e) {
            return OptionalLong.empty();
        }
    }

    /** h*3600+m*60+s，溢出时抛 ArithmeticException */
    private static long toSeconds(long hours, long minutes, long seconds) {
        return Math.addExact(Math.addExact(Math.multiplyExact(hours, 3600L), Math.multiplyExact(minutes, 60L)), seconds);
    }

    /**
     * 日志表 STUDY_TIME_VIDEO 的紧凑写法：":" 全部换成 "."，去掉前导 0，空串记为 "0"。
     * 例如 "05:30" → "5.30"，"00:02:00" → ".02.00"。
     */
    public static String videoPosition(String time) {
        if (time == null) {
            return "0";
        }
        String dotted = LEADING_ZEROS.matcher(time.replace(':', '.')).replaceFirst("");
        return dotted.isEmpty() ? "0" : dotted;
    }
}
