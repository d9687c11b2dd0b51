package com.studytime.progress.config;

/**
 * 进度条件写的并发策略。
 */
public enum UpdateMode {

    /** 读、比较、写不在同一事务内，并发请求后写覆盖先写 */
    LAST_WRITE_WINS,

    /** 写入时校验库中位置仍是读取时的值，不一致则重读重比 */
    COMPARE_AND_SET
}
