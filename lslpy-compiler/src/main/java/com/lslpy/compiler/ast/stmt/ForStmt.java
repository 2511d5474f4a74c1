package com.lslpy.compiler.ast.stmt;

import com.lslpy.compiler.ast.AstVisitor;
import com.lslpy.compiler.ast.SourceLocation;
import com.lslpy.compiler.ast.expr.Expression;

import java.util.List;

/**
 * For 语句 {@code for (init, ...; condition; update, ...) body}
 */
public class ForStmt extends Statement {
    private final List<Expression> initializers;
    private final Expression condition;
    private final List<Expression> updates;
    private final Statement body;

    public ForStmt(SourceLocation location, List<Expression> initializers, Expression condition,
                   List<Expression> updates, Statement body) {
        super(location);
        this.initializers = initializers;
        this.condition = condition;
        this.updates = updates;
        this.body = body;
    }

    public List<Expression> getInitializers() {
        return initializers;
    }

    public Expression getCondition() {
        return condition;
    }

    public List<Expression> getUpdates() {
        return updates;
    }

    public Statement getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitForStmt(this, context);
    }
}
