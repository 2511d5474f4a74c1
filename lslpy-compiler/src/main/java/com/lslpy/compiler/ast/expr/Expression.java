package com.lslpy.compiler.ast.expr;

import com.lslpy.compiler.analysis.LslType;
import com.lslpy.compiler.ast.AstNode;
import com.lslpy.compiler.ast.SourceLocation;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {
    // 类型信息（前端类型推导后填充）
    protected final LslType type;
    // 值是否被外层表达式使用（false 表示处于语句上下文）
    private boolean resultNeeded;

    protected Expression(SourceLocation location, LslType type) {
        super(location);
        this.type = type;
    }

    public LslType getType() {
        return type;
    }

    public boolean isResultNeeded() {
        return resultNeeded;
    }

    public void setResultNeeded(boolean resultNeeded) {
        this.resultNeeded = resultNeeded;
    }
}
