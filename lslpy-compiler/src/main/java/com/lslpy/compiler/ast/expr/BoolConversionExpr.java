package com.lslpy.compiler.ast.expr;

import com.lslpy.compiler.analysis.LslType;
import com.lslpy.compiler.ast.AstVisitor;
import com.lslpy.compiler.ast.SourceLocation;

/**
 * 条件上下文中的布尔转换（if/while/for 的判断表达式）
 */
public class BoolConversionExpr extends Expression {
    private final Expression operand;

    public BoolConversionExpr(SourceLocation location, Expression operand) {
        super(location, LslType.INTEGER);
        this.operand = operand;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBoolConversionExpr(this, context);
    }
}
