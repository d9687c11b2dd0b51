package com.studytime.progress.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 进度更新配置项。
 */
@Data
@ConfigurationProperties(prefix = "studytime.progress")
public class ProgressProperties {

    /** 写入模式: last-write-wins / compare-and-set */
    private UpdateMode updateMode = UpdateMode.LAST_WRITE_WINS;

    /** compare-and-set 模式下条件写的最大尝试次数 */
    private int maxWriteAttempts = 3;
}
