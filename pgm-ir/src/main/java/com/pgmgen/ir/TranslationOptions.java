package com.pgmgen.ir;

import com.pgmgen.compiler.formatter.FormatConfig;

import java.time.Clock;

/**
 * 翻译选项
 */
public class TranslationOptions {
    private String documentName = "pgm.json";
    private Clock clock = Clock.systemDefaultZone();
    private boolean strictRangeBounds = false;
    private boolean validate = true;
    private FormatConfig formatConfig = new FormatConfig();

    public TranslationOptions() {
    }

    /** 文档的 name 字段 */
    public String getDocumentName() {
        return documentName;
    }

    public void setDocumentName(String documentName) {
        this.documentName = documentName;
    }

    public Clock getClock() {
        return clock;
    }

    public void setClock(Clock clock) {
        this.clock = clock;
    }

    /**
     * 为 true 时 range 端点只接受变量，字面量端点报 UnsupportedRange
     */
    public boolean isStrictRangeBounds() {
        return strictRangeBounds;
    }

    public void setStrictRangeBounds(boolean strictRangeBounds) {
        this.strictRangeBounds = strictRangeBounds;
    }

    public boolean isValidate() {
        return validate;
    }

    public void setValidate(boolean validate) {
        this.validate = validate;
    }

    /** lambda 源码的缩进 */
    public FormatConfig getFormatConfig() {
        return formatConfig;
    }

    public void setFormatConfig(FormatConfig formatConfig) {
        this.formatConfig = formatConfig;
    }
}
