package com.lslpy.compiler.ast.expr;

import com.lslpy.compiler.analysis.LslType;
import com.lslpy.compiler.ast.AstVisitor;
import com.lslpy.compiler.ast.SourceLocation;

/**
 * 浮点常量（32 位 IEEE-754 单精度）
 */
public class FloatConstant extends Expression {
    private final float value;

    public FloatConstant(SourceLocation location, float value) {
        super(location, LslType.FLOAT);
        this.value = value;
    }

    public float getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFloatConstant(this, context);
    }
}
