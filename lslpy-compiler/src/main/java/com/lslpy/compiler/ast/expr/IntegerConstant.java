package com.lslpy.compiler.ast.expr;

import com.lslpy.compiler.analysis.LslType;
import com.lslpy.compiler.ast.AstVisitor;
import com.lslpy.compiler.ast.SourceLocation;

/**
 * 整数常量（32 位有符号）
 */
public class IntegerConstant extends Expression {
    private final int value;

    public IntegerConstant(SourceLocation location, int value) {
        super(location, LslType.INTEGER);
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIntegerConstant(this, context);
    }
}
