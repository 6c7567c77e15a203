package com.pgmgen.ir.pass;

import java.util.Collections;
import java.util.List;

/**
 * 文档不满足结构约束（名称重复或引用未定义函数）
 */
public class PgmValidationException extends RuntimeException {

    private final List<String> problems;

    public PgmValidationException(List<String> problems) {
        super("Invalid PGM document: " + String.join("; ", problems));
        this.problems = Collections.unmodifiableList(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
