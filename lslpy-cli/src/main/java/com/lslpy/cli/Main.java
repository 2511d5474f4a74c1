package com.lslpy.cli;

import com.lslpy.compiler.codegen.GenerationConfig;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * lslpy CLI 入口点（picocli）
 *
 * <p>退出码等于前端累计的错误数（0 表示成功并完成生成）；输入/输出失败返回 1。</p>
 */
@Command(name = "lslpy", version = "lslpy v0.1.0",
         mixinStandardHelpOptions = true,
         description = "将前端交付的 LSL 类型化语法树生成为 Python 源码")
public class Main implements Callable<Integer> {

    @Parameters(index = "0", description = "树文档路径，- 表示标准输入")
    String input;

    @Parameters(index = "1", description = "输出 Python 文件路径，- 表示标准输出")
    String output;

    @Option(names = "--indent-size", defaultValue = "4", description = "缩进空格数（默认 4）")
    int indentSize;

    @Option(names = "--use-tabs", description = "使用 Tab 缩进")
    boolean useTabs;

    @Option(names = "--runtime-module", defaultValue = "lummao", description = "运行时支持库模块名（默认 lummao）")
    String runtimeModule;

    @Option(names = "--class-name", defaultValue = "Script", description = "生成的脚本类名（默认 Script）")
    String className;

    @Option(names = {"-v", "--verbose"}, description = "输出调试日志")
    boolean verbose;

    @Override
    public Integer call() {
        if (verbose) {
            enableVerboseLogging();
        }
        return new CompileRunner(toConfig(), System.in, System.out, System.err).run(input, output);
    }

    GenerationConfig toConfig() {
        GenerationConfig config = new GenerationConfig();
        config.setIndentSize(indentSize);
        config.setUseSpaces(!useTabs);
        config.setRuntimeModule(runtimeModule);
        config.setClassName(className);
        return config;
    }

    private static void enableVerboseLogging() {
        Logger logger = Logger.getLogger("com.lslpy");
        logger.setLevel(Level.FINE);
        ConsoleHandler handler = new ConsoleHandler();
        handler.setLevel(Level.FINE);
        logger.addHandler(handler);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }
}
