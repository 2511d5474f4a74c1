package com.lslpy.compiler.ast.expr;

import com.lslpy.compiler.ast.AstVisitor;
import com.lslpy.compiler.ast.SourceLocation;

/**
 * 括号表达式，保留源码中的显式分组
 */
public class ParenthesisExpr extends Expression {
    private final Expression operand;

    public ParenthesisExpr(SourceLocation location, Expression operand) {
        super(location, operand.getType());
        this.operand = operand;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitParenthesisExpr(this, context);
    }
}
