package com.lslpy.compiler.tree;

import com.lslpy.compiler.ast.decl.Script;

import java.util.List;

/**
 * 前端交付物：类型化的 AST 与累计的诊断
 *
 * <p>错误数不为零时不会进行代码生成，此时 script 可能为 null。</p>
 */
public final class FrontEndResult {
    private final int errorCount;
    private final List<FrontEndDiagnostic> diagnostics;
    private final Script script;

    public FrontEndResult(int errorCount, List<FrontEndDiagnostic> diagnostics, Script script) {
        this.errorCount = errorCount;
        this.diagnostics = diagnostics;
        this.script = script;
    }

    public int getErrorCount() {
        return errorCount;
    }

    public List<FrontEndDiagnostic> getDiagnostics() {
        return diagnostics;
    }

    public Script getScript() {
        return script;
    }

    public boolean hasErrors() {
        return errorCount > 0;
    }
}
