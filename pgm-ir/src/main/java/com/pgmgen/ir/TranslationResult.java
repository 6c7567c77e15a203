package com.pgmgen.ir;

import com.pgmgen.ir.backend.PgmJsonWriter;
import com.pgmgen.ir.pgm.PgmDocument;

/**
 * 一次成功翻译的结果：PGM 文档与全部 lambda 源码
 */
public class TranslationResult {
    private final PgmDocument document;
    private final String lambdaSource;

    public TranslationResult(PgmDocument document, String lambdaSource) {
        this.document = document;
        this.lambdaSource = lambdaSource;
    }

    public PgmDocument getDocument() {
        return document;
    }

    public String getLambdaSource() {
        return lambdaSource;
    }

    public String toJson() {
        return new PgmJsonWriter().toJson(document);
    }
}
