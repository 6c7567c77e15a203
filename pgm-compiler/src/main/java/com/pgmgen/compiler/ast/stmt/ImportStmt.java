package com.pgmgen.compiler.ast.stmt;

import com.pgmgen.compiler.ast.SourceLocation;
import com.pgmgen.compiler.ast.StmtVisitor;

import java.util.Collections;
import java.util.List;

/**
 * 导入语句：{@code import a.b} 或 {@code from a.b import x, y}（{@code *} 记为单个名字 "*"）
 */
public class ImportStmt extends Statement {
    private final String module;     // from 形式的模块名，import 形式为 null
    private final List<String> names;

    public ImportStmt(SourceLocation location, String module, List<String> names) {
        super(location);
        this.module = module;
        this.names = Collections.unmodifiableList(names);
    }

    public String getModule() {
        return module;
    }

    public List<String> getNames() {
        return names;
    }

    public boolean isFromImport() {
        return module != null;
    }

    @Override
    public String getKindName() {
        return isFromImport() ? "ImportFrom" : "Import";
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitImportStmt(this, context);
    }
}
