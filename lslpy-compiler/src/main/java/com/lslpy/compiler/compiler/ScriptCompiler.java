package com.lslpy.compiler.compiler;

import com.lslpy.compiler.ast.decl.Script;
import com.lslpy.compiler.codegen.GenerationConfig;
import com.lslpy.compiler.codegen.PythonGenerator;
import com.lslpy.compiler.tree.FrontEndResult;
import com.lslpy.compiler.tree.ScriptTreeReader;

import java.io.Reader;
import java.util.logging.Logger;

/**
 * 编译入口：读取前端交付的树，前端无错误时生成 Python 源码。
 *
 * <p>每次调用互不影响，同一实例可以并发使用。</p>
 */
public class ScriptCompiler {

    private static final Logger LOG = Logger.getLogger(ScriptCompiler.class.getName());

    private final GenerationConfig config;
    private final PythonGenerator generator = new PythonGenerator();

    public ScriptCompiler() {
        this(new GenerationConfig());
    }

    public ScriptCompiler(GenerationConfig config) {
        this.config = config;
    }

    public GenerationConfig getConfig() {
        return config;
    }

    /**
     * 从前端的树文档编译
     *
     * @param treeJson 树文档
     * @param fileName 文件名（用于源码位置）
     * @throws com.lslpy.compiler.tree.TreeFormatException 树文档格式错误
     * @throws com.lslpy.compiler.codegen.GenerationException 树违反前端约定
     */
    public CompileResult compile(Reader treeJson, String fileName) {
        FrontEndResult frontEnd = new ScriptTreeReader(fileName).read(treeJson);
        if (frontEnd.hasErrors()) {
            LOG.fine("前端报告 " + frontEnd.getErrorCount() + " 个错误，跳过代码生成: " + fileName);
            return new CompileResult(frontEnd.getErrorCount(), frontEnd.getDiagnostics(), null);
        }
        String python = generate(frontEnd.getScript());
        LOG.fine("生成完成: " + fileName + " (" + python.length() + " 字符)");
        return new CompileResult(0, frontEnd.getDiagnostics(), python);
    }

    /**
     * 直接从已类型化的 AST 生成
     */
    public String generate(Script script) {
        return generator.generate(script, config);
    }
}
