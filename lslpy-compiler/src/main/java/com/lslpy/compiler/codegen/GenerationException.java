package com.lslpy.compiler.codegen;

import com.lslpy.compiler.ast.SourceLocation;

/**
 * 代码生成异常
 *
 * <p>只在输入树违反前端约定时抛出（未知运算符、缺少零值的类型、非左值的赋值目标等），
 * 表示前端存在缺陷而不是用户脚本有误。</p>
 */
public class GenerationException extends RuntimeException {
    private final SourceLocation location;

    public GenerationException(String message, SourceLocation location) {
        super(message);
        this.location = location;
    }

    public SourceLocation getLocation() {
        return location;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(super.getMessage());
        if (location != null && location != SourceLocation.UNKNOWN) {
            sb.append(" at ").append(location);
        }
        return sb.toString();
    }
}
