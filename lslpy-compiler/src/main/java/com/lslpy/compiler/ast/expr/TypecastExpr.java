package com.lslpy.compiler.ast.expr;

import com.lslpy.compiler.analysis.LslType;
import com.lslpy.compiler.ast.AstVisitor;
import com.lslpy.compiler.ast.SourceLocation;

/**
 * 类型转换 {@code (type)expr}
 *
 * <p>前端的去糖步骤会把所有隐式转换都改写为显式的 TypecastExpr。</p>
 */
public class TypecastExpr extends Expression {
    private final Expression operand;

    public TypecastExpr(SourceLocation location, LslType targetType, Expression operand) {
        super(location, targetType);
        this.operand = operand;
    }

    public Expression getOperand() {
        return operand;
    }

    public LslType getTargetType() {
        return type;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTypecastExpr(this, context);
    }
}
