package com.lslpy.compiler.ast.expr;

import com.lslpy.compiler.analysis.LslType;
import com.lslpy.compiler.ast.AstVisitor;
import com.lslpy.compiler.ast.SourceLocation;

/**
 * 二元表达式（含赋值与复合赋值）
 */
public class BinaryExpr extends Expression {
    private final Expression left;
    private final BinaryOp operator;
    private final Expression right;

    public BinaryExpr(SourceLocation location, LslType type, Expression left, BinaryOp operator, Expression right) {
        super(location, type);
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBinaryExpr(this, context);
    }

    /**
     * 二元运算符
     */
    public enum BinaryOp {
        // 算术
        ADD("+"),
        SUB("-"),
        MUL("*"),
        DIV("/"),
        MOD("%"),

        // 比较
        EQ("=="),
        NE("!="),
        GT(">"),
        LT("<"),
        GE(">="),
        LE("<="),

        // 逻辑
        AND("&&"),
        OR("||"),

        // 位运算
        BIT_AND("&"),
        BIT_OR("|"),
        BIT_XOR("^"),
        SHL("<<"),
        SHR(">>"),

        // 赋值
        ASSIGN("="),
        ADD_ASSIGN("+="),
        SUB_ASSIGN("-="),
        MUL_ASSIGN("*="),
        DIV_ASSIGN("/="),
        MOD_ASSIGN("%=");

        private final String source;

        BinaryOp(String source) {
            this.source = source;
        }

        /** 返回 LSL 源码中对应的运算符 */
        public String toSourceString() {
            return source;
        }

        public boolean isAssignment() {
            return this == ASSIGN || this == ADD_ASSIGN || this == SUB_ASSIGN
                    || this == MUL_ASSIGN || this == DIV_ASSIGN || this == MOD_ASSIGN;
        }

        /** 按源码运算符查找，未识别返回 null */
        public static BinaryOp fromSource(String source) {
            for (BinaryOp op : values()) {
                if (op.source.equals(source)) {
                    return op;
                }
            }
            return null;
        }
    }
}
