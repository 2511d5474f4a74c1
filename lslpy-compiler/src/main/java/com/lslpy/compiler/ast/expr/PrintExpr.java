package com.lslpy.compiler.ast.expr;

import com.lslpy.compiler.ast.AstVisitor;
import com.lslpy.compiler.ast.SourceLocation;

/**
 * print 表达式，值与类型同操作数
 */
public class PrintExpr extends Expression {
    private final Expression operand;

    public PrintExpr(SourceLocation location, Expression operand) {
        super(location, operand.getType());
        this.operand = operand;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitPrintExpr(this, context);
    }
}
