package com.pgmgen.compiler.ast;

import com.pgmgen.compiler.ast.stmt.Statement;

import java.util.Collections;
import java.util.List;

/**
 * 语法树根节点：一个源文件
 */
public class Module extends AstNode {
    private final String fileName;
    private final List<Statement> body;

    public Module(SourceLocation location, String fileName, List<Statement> body) {
        super(location);
        this.fileName = fileName;
        this.body = Collections.unmodifiableList(body);
    }

    public String getFileName() {
        return fileName;
    }

    public List<Statement> getBody() {
        return body;
    }

    @Override
    public String getKindName() {
        return "Module";
    }
}
