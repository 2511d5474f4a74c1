package com.lslpy.compiler.ast.stmt;

import com.lslpy.compiler.ast.AstVisitor;
import com.lslpy.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 代码块 {@code { ... }}
 */
public class CompoundStmt extends Statement {
    private final List<Statement> statements;

    public CompoundStmt(SourceLocation location, List<Statement> statements) {
        super(location);
        this.statements = statements;
    }

    public List<Statement> getStatements() {
        return statements;
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCompoundStmt(this, context);
    }
}
