package com.pgmgen.compiler.ast;

/**
 * 语法树节点基类
 *
 * <p>节点在构造后不可变。表达式与语句分别通过 {@link ExprVisitor} 和 {@link StmtVisitor} 访问。</p>
 */
public abstract class AstNode {
    protected final SourceLocation location;

    protected AstNode(SourceLocation location) {
        this.location = location;
    }

    public SourceLocation getLocation() {
        return location;
    }

    /** 源码行号，未知位置返回 0 */
    public int getLine() {
        return location != null ? location.getLine() : 0;
    }

    /**
     * 节点种类名称（用于诊断信息和语法树转储）
     */
    public abstract String getKindName();
}
