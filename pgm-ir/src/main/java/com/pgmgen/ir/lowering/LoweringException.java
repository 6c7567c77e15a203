package com.pgmgen.ir.lowering;

import com.pgmgen.compiler.ast.AstNode;
import com.pgmgen.compiler.ast.SourceLocation;

/**
 * 降级失败。所有降级错误都是致命的，整个翻译中止。
 */
public class LoweringException extends RuntimeException {

    /**
     * 错误分类
     */
    public enum Kind {
        UNSUPPORTED_CONSTRUCT("Unsupported construct"),
        UNSUPPORTED_TYPE("Unsupported type"),
        UNSUPPORTED_RANGE("Unsupported range"),
        MULTIPLE_LOOP_INDICES("Multiple loop indices"),
        ARRAY_INDEXING_UNSUPPORTED("Array indexing unsupported");

        private final String title;

        Kind(String title) {
            this.title = title;
        }

        public String getTitle() {
            return title;
        }
    }

    private final Kind kind;
    private final String constructKind;
    private final SourceLocation location;

    public LoweringException(Kind kind, String message, String constructKind, SourceLocation location) {
        super(message);
        this.kind = kind;
        this.constructKind = constructKind;
        this.location = location;
    }

    public LoweringException(Kind kind, String message, AstNode node) {
        this(kind, message, node.getKindName(), node.getLocation());
    }

    /**
     * 不支持的构造，消息取节点种类名
     */
    public static LoweringException unsupported(AstNode node) {
        return new LoweringException(Kind.UNSUPPORTED_CONSTRUCT,
                "No handler for " + node.getKindName(), node);
    }

    public Kind getKind() {
        return kind;
    }

    public String getConstructKind() {
        return constructKind;
    }

    public SourceLocation getLocation() {
        return location;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(kind.getTitle()).append(": ").append(super.getMessage());
        if (constructKind != null) {
            sb.append(" [").append(constructKind).append(']');
        }
        if (location != null && location.isKnown()) {
            sb.append(" at ").append(location);
        }
        return sb.toString();
    }
}
