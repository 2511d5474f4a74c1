package com.lslpy.compiler.codegen;

/**
 * 代码生成配置
 *
 * <p>除缩进外，其余字段都是生成代码与 Python 运行时支持库之间的约定名称。</p>
 */
public class GenerationConfig {
    private int indentSize = 4;
    private boolean useSpaces = true;
    private String runtimeModule = "lummao";
    private String className = "Script";
    private String baseClassName = "BaseLSLScript";
    private String builtinNamespace = "lslfuncs";
    private String handlerPrefix = "e";

    public GenerationConfig() {
    }

    public int getIndentSize() {
        return indentSize;
    }

    public void setIndentSize(int indentSize) {
        this.indentSize = indentSize;
    }

    public boolean isUseSpaces() {
        return useSpaces;
    }

    public void setUseSpaces(boolean useSpaces) {
        this.useSpaces = useSpaces;
    }

    /** 运行时支持库的模块名（{@code from <module> import *}） */
    public String getRuntimeModule() {
        return runtimeModule;
    }

    public void setRuntimeModule(String runtimeModule) {
        this.runtimeModule = runtimeModule;
    }

    public String getClassName() {
        return className;
    }

    public void setClassName(String className) {
        this.className = className;
    }

    /** 实现状态机分发的运行时基类 */
    public String getBaseClassName() {
        return baseClassName;
    }

    public void setBaseClassName(String baseClassName) {
        this.baseClassName = baseClassName;
    }

    /** 内置函数所在的运行时命名空间 */
    public String getBuiltinNamespace() {
        return builtinNamespace;
    }

    public void setBuiltinNamespace(String builtinNamespace) {
        this.builtinNamespace = builtinNamespace;
    }

    /** 事件处理器方法名前缀，完整方法名为 前缀 + 状态名 + 事件名 */
    public String getHandlerPrefix() {
        return handlerPrefix;
    }

    public void setHandlerPrefix(String handlerPrefix) {
        this.handlerPrefix = handlerPrefix;
    }

    /**
     * 获取单层缩进字符串
     */
    public String getIndentString() {
        if (useSpaces) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < indentSize; i++) {
                sb.append(' ');
            }
            return sb.toString();
        } else {
            return "\t";
        }
    }
}
