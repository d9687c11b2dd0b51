package com.studytime.common.exception;

import java.util.List;

/**
 * 请求参数缺失，在任何数据库访问之前抛出。
 */
public class ValidationException extends StudyTimeException {

    private final List<String> missingFields;

    public ValidationException(List<String> missingFields) {
        super("VALIDATION_FAILED", "Missing required fields: " + String.join(", ", missingFields));
        this.missingFields = List.copyOf(missingFields);
    }

    public List<String> getMissingFields() {
        return missingFields;
    }
}
