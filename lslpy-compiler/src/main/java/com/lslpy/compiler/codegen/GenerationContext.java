package com.lslpy.compiler.codegen;

/**
 * 生成上下文，跟踪输出缓冲区和缩进层级
 *
 * <p>每次生成独占一个实例，随访问者逐层传递；缩进只能通过 {@link #indented()} 改变。</p>
 */
public class GenerationContext {
    private final StringBuilder output = new StringBuilder();
    private final GenerationConfig config;
    private final String indentUnit;
    private int indentLevel = 0;
    private boolean atLineStart = true;

    public GenerationContext(GenerationConfig config) {
        this.config = config;
        this.indentUnit = config.getIndentString();
    }

    public GenerationConfig getConfig() {
        return config;
    }

    public int getIndentLevel() {
        return indentLevel;
    }

    /**
     * 进入下一层缩进，关闭返回的作用域时恢复进入前的层级。
     *
     * <pre>{@code
     * try (GenerationContext.IndentScope body = ctx.indented()) {
     *     ...
     * }
     * }</pre>
     */
    public IndentScope indented() {
        IndentScope scope = new IndentScope(this, indentLevel);
        indentLevel++;
        return scope;
    }

    /**
     * 追加文本（自动处理行首缩进）
     */
    public void append(String text) {
        if (text == null || text.isEmpty()) return;
        if (atLineStart) {
            for (int i = 0; i < indentLevel; i++) {
                output.append(indentUnit);
            }
            atLineStart = false;
        }
        output.append(text);
    }

    /**
     * 换行
     */
    public void newLine() {
        output.append('\n');
        atLineStart = true;
    }

    /**
     * 追加一整行
     */
    public void line(String text) {
        append(text);
        newLine();
    }

    /**
     * 获取当前输出
     */
    public String getOutput() {
        return output.toString();
    }

    /**
     * 缩进作用域：close() 无条件恢复到进入时的层级，异常退出时同样生效
     */
    public static final class IndentScope implements AutoCloseable {
        private final GenerationContext context;
        private final int savedLevel;

        private IndentScope(GenerationContext context, int savedLevel) {
            this.context = context;
            this.savedLevel = savedLevel;
        }

        @Override
        public void close() {
            context.indentLevel = savedLevel;
        }
    }
}
