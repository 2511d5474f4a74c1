package com.lslpy.cli;

import com.lslpy.compiler.codegen.GenerationConfig;
import com.lslpy.compiler.compiler.CompileResult;
import com.lslpy.compiler.compiler.ScriptCompiler;
import com.lslpy.compiler.tree.FrontEndDiagnostic;
import com.lslpy.compiler.tree.TreeFormatException;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 读取树文档、生成并写出 Python 源码
 */
public class CompileRunner {

    private static final Logger LOG = Logger.getLogger(CompileRunner.class.getName());

    /** 表示标准输入/标准输出的路径标记 */
    public static final String STDIO_MARKER = "-";

    /** 输入无法读取或输出无法写入 */
    public static final int EXIT_IO_ERROR = 1;

    private final ScriptCompiler compiler;
    private final InputStream stdin;
    private final OutputStream stdout;
    private final PrintStream stderr;

    public CompileRunner(GenerationConfig config, InputStream stdin, OutputStream stdout, PrintStream stderr) {
        this.compiler = new ScriptCompiler(config);
        this.stdin = stdin;
        this.stdout = stdout;
        this.stderr = stderr;
    }

    /**
     * @return 退出码：前端错误数，或 {@link #EXIT_IO_ERROR}
     */
    public int run(String inputPath, String outputPath) {
        String treeJson;
        try {
            treeJson = readInput(inputPath);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "读取输入失败: " + inputPath, e);
            stderr.println("错误: 无法读取输入 '" + inputPath + "'");
            return EXIT_IO_ERROR;
        }

        CompileResult result;
        try {
            result = compiler.compile(new StringReader(treeJson), displayName(inputPath));
        } catch (TreeFormatException e) {
            stderr.println("错误: 树文档格式错误 - " + e.getMessage());
            return EXIT_IO_ERROR;
        }

        for (FrontEndDiagnostic diagnostic : result.getDiagnostics()) {
            stderr.println(diagnostic);
        }
        if (!result.isGenerated()) {
            return result.getErrorCount();
        }

        try {
            writeOutput(outputPath, result.getPythonSource());
        } catch (IOException e) {
            LOG.log(Level.WARNING, "写入输出失败: " + outputPath, e);
            stderr.println("错误: 无法写入输出文件 '" + outputPath + "'");
            return EXIT_IO_ERROR;
        }
        return 0;
    }

    private String readInput(String inputPath) throws IOException {
        if (STDIO_MARKER.equals(inputPath)) {
            return new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
        }
        Path path = Paths.get(inputPath);
        return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    }

    private void writeOutput(String outputPath, String python) throws IOException {
        byte[] bytes = python.getBytes(StandardCharsets.UTF_8);
        if (STDIO_MARKER.equals(outputPath)) {
            stdout.write(bytes);
            stdout.flush();
            return;
        }
        Files.write(Paths.get(outputPath), bytes);
        LOG.fine("已写入 " + outputPath);
    }

    private static String displayName(String inputPath) {
        if (STDIO_MARKER.equals(inputPath)) {
            return "<stdin>";
        }
        Path fileName = Paths.get(inputPath).getFileName();
        return fileName != null ? fileName.toString() : inputPath;
    }
}
