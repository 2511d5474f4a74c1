package com.lslpy.compiler.ast.stmt;

import com.lslpy.compiler.ast.AstVisitor;
import com.lslpy.compiler.ast.SourceLocation;
import com.lslpy.compiler.ast.expr.Expression;

/**
 * Do-While 语句
 */
public class DoStmt extends Statement {
    private final Statement body;
    private final Expression condition;

    public DoStmt(SourceLocation location, Statement body, Expression condition) {
        super(location);
        this.body = body;
        this.condition = condition;
    }

    public Statement getBody() {
        return body;
    }

    public Expression getCondition() {
        return condition;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitDoStmt(this, context);
    }
}
