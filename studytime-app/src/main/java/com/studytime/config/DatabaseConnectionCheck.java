package com.studytime.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * 启动时从连接池借一个连接，确认数据库可用；失败则终止启动。
 * <p>
 * 连接池随 Spring 容器创建和关闭，业务代码通过构造器注入的 Repository 访问，不直接持有连接。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DatabaseConnectionCheck implements CommandLineRunner {

    private final DataSource dataSource;

    @Override
    public void run(String... args) {
        try (Connection connection = dataSource.getConnection()) {
            log.info("数据库连接成功: {}", connection.getMetaData().getURL());
        } catch (SQLException e) {
            log.error("数据库连接失败", e);
            throw new IllegalStateException("Error connecting to database", e);
        }
    }
}
