package com.pgmgen.ir.pgm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * PGM 文档，组装后不可变
 */
public final class PgmDocument {
    private final String start;
    private final String name;
    private final String dateCreated;
    private final List<PgmFunction> functions;
    private final List<BodyRecord> body;

    public PgmDocument(String start, String name, String dateCreated,
                       List<PgmFunction> functions, List<BodyRecord> body) {
        this.start = start != null ? start : "";
        this.name = name;
        this.dateCreated = dateCreated;
        this.functions = Collections.unmodifiableList(new ArrayList<>(functions));
        this.body = Collections.unmodifiableList(new ArrayList<>(body));
    }

    /** 入口调用名，没有时为空串 */
    public String getStart() {
        return start;
    }

    public String getName() {
        return name;
    }

    public String getDateCreated() {
        return dateCreated;
    }

    public List<PgmFunction> getFunctions() {
        return functions;
    }

    public List<BodyRecord> getBody() {
        return body;
    }

    /**
     * 按名称查找函数，不存在返回 null
     */
    public PgmFunction findFunction(String functionName) {
        for (PgmFunction fn : functions) {
            if (fn.getName().equals(functionName)) {
                return fn;
            }
        }
        return null;
    }
}
