package com.lslpy.compiler.ast.expr;

import com.lslpy.compiler.analysis.LslType;
import com.lslpy.compiler.ast.AstVisitor;
import com.lslpy.compiler.ast.SourceLocation;

/**
 * 字符串常量（值为反转义后的内容）
 */
public class StringConstant extends Expression {
    private final String value;

    public StringConstant(SourceLocation location, String value) {
        super(location, LslType.STRING);
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStringConstant(this, context);
    }
}
