package com.lslpy.compiler.ast.stmt;

import com.lslpy.compiler.analysis.Symbol;
import com.lslpy.compiler.ast.AstVisitor;
import com.lslpy.compiler.ast.SourceLocation;
import com.lslpy.compiler.ast.expr.Expression;

/**
 * 局部变量声明 {@code type name [= init];}
 */
public class DeclarationStmt extends Statement {
    private final Symbol symbol;
    private final Expression initializer;  // 可选

    public DeclarationStmt(SourceLocation location, Symbol symbol, Expression initializer) {
        super(location);
        this.symbol = symbol;
        this.initializer = initializer;
    }

    public Symbol getSymbol() {
        return symbol;
    }

    public Expression getInitializer() {
        return initializer;
    }

    public boolean hasInitializer() {
        return initializer != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitDeclarationStmt(this, context);
    }
}
