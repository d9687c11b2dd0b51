package com.studytime;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 课时播放进度与学习时长服务 - 启动类。
 */
@SpringBootApplication(scanBasePackages = "com.studytime")
public class StudyTimeApplication {

    public static void main(String[] args) throws Exception {
        // SQLite 不会自动创建父目录，启动前确保 data/ 存在
        Files.createDirectories(Path.of("data"));
        SpringApplication.run(StudyTimeApplication.class, args);
    }
}
