package com.studytime.web.config;

import org.springframework.data.relational.core.dialect.AbstractDialect;
import org.springframework.data.relational.core.dialect.LimitClause;
import org.springframework.data.relational.core.dialect.LockClause;
import org.springframework.data.relational.core.sql.IdentifierProcessing;
import org.springframework.data.relational.core.sql.IdentifierProcessing.LetterCasing;
import org.springframework.data.relational.core.sql.IdentifierProcessing.Quoting;
import org.springframework.data.relational.core.sql.LockOptions;

/**
 * SQLite 方言 —— Spring Data JDBC 内置不支持 SQLite，手动提供。
 * <p>
 * 表名列名全部小写下划线（member_lesson、log_study_time），生成 SQL 时按小写加引号，
 * 顺带避开 current_time 这类 SQLite 关键字。
 */
public class SqliteDialect extends AbstractDialect {

    public static final SqliteDialect INSTANCE = new SqliteDialect();

    private static final IdentifierProcessing LOWER_CASE_QUOTED =
            IdentifierProcessing.create(Quoting.ANSI, LetterCasing.LOWER_CASE);

    @Override
    public IdentifierProcessing getIdentifierProcessing() {
        return LOWER_CASE_QUOTED;
    }

    @Override
    public LimitClause limit() {
        return new LimitClause() {
            @Override
            public String getLimit(long limit) {
                return "LIMIT " + limit;
            }

            @Override
            public String getOffset(long offset) {
                // SQLite 的 OFFSET 必须跟在 LIMIT 后面
                return "LIMIT -1 OFFSET " + offset;
            }

            @Override
            public String getLimitOffset(long limit, long offset) {
                return "LIMIT " + limit + " OFFSET " + offset;
            }

            @Override
            public Position getClausePosition() {
                return Position.AFTER_ORDER_BY;
            }
        };
    }

    @Override
    public LockClause lock() {
        // SQLite 没有 SELECT ... FOR UPDATE，并发控制靠条件 UPDATE
        return new LockClause() {
            @Override
            public String getLock(LockOptions lockOptions) {
                return "";
            }

            @Override
            public Position getClausePosition() {
                return Position.AFTER_ORDER_BY;
            }
        };
    }
}
