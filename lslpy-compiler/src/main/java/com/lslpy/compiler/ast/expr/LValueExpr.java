package com.lslpy.compiler.ast.expr;

import com.lslpy.compiler.analysis.LslType;
import com.lslpy.compiler.analysis.Symbol;
import com.lslpy.compiler.ast.AstVisitor;
import com.lslpy.compiler.ast.CoordinateMember;
import com.lslpy.compiler.ast.SourceLocation;

/**
 * 变量引用，可带坐标成员后缀（如 {@code pos.x}）
 */
public class LValueExpr extends Expression {
    private final Symbol symbol;
    private final CoordinateMember member;  // 可选

    public LValueExpr(SourceLocation location, Symbol symbol) {
        this(location, symbol, null);
    }

    public LValueExpr(SourceLocation location, Symbol symbol, CoordinateMember member) {
        // 坐标分量总是 float
        super(location, member != null ? LslType.FLOAT : symbol.getType());
        this.symbol = symbol;
        this.member = member;
    }

    public Symbol getSymbol() {
        return symbol;
    }

    public CoordinateMember getMember() {
        return member;
    }

    public boolean hasMember() {
        return member != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLValueExpr(this, context);
    }
}
