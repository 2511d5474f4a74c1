package com.lslpy.compiler.compiler;

import com.lslpy.compiler.tree.FrontEndDiagnostic;

import java.util.List;

/**
 * 一次编译的结果：前端诊断 + 生成的 Python 源码（前端报错时为 null）
 */
public final class CompileResult {
    private final int errorCount;
    private final List<FrontEndDiagnostic> diagnostics;
    private final String pythonSource;

    public CompileResult(int errorCount, List<FrontEndDiagnostic> diagnostics, String pythonSource) {
        this.errorCount = errorCount;
        this.diagnostics = diagnostics;
        this.pythonSource = pythonSource;
    }

    /** 前端累计的错误数，也是命令行的退出码 */
    public int getErrorCount() {
        return errorCount;
    }

    public List<FrontEndDiagnostic> getDiagnostics() {
        return diagnostics;
    }

    public String getPythonSource() {
        return pythonSource;
    }

    /** 是否执行了代码生成 */
    public boolean isGenerated() {
        return pythonSource != null;
    }
}
