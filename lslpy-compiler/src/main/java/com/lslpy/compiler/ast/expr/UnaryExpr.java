package com.lslpy.compiler.ast.expr;

import com.lslpy.compiler.analysis.LslType;
import com.lslpy.compiler.ast.AstVisitor;
import com.lslpy.compiler.ast.SourceLocation;

/**
 * 一元表达式（含前置/后置自增自减）
 */
public class UnaryExpr extends Expression {
    private final UnaryOp operator;
    private final Expression operand;

    public UnaryExpr(SourceLocation location, LslType type, UnaryOp operator, Expression operand) {
        super(location, type);
        this.operator = operator;
        this.operand = operand;
    }

    public UnaryOp getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitUnaryExpr(this, context);
    }

    /**
     * 一元运算符
     */
    public enum UnaryOp {
        NEG("-"),
        BIT_NOT("~"),
        BOOL_NOT("!"),
        PRE_INCR("pre++"),
        PRE_DECR("pre--"),
        POST_INCR("post++"),
        POST_DECR("post--");

        private final String source;

        UnaryOp(String source) {
            this.source = source;
        }

        public String toSourceString() {
            return source;
        }

        /** 是否为自增/自减（操作数必须是左值） */
        public boolean isIncDec() {
            return this == PRE_INCR || this == PRE_DECR || this == POST_INCR || this == POST_DECR;
        }

        public boolean isPostfix() {
            return this == POST_INCR || this == POST_DECR;
        }

        public boolean isDecrement() {
            return this == PRE_DECR || this == POST_DECR;
        }

        public static UnaryOp fromSource(String source) {
            for (UnaryOp op : values()) {
                if (op.source.equals(source)) {
                    return op;
                }
            }
            return null;
        }
    }
}
