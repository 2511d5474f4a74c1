package com.lslpy.compiler.ast.stmt;

import com.lslpy.compiler.ast.AstVisitor;
import com.lslpy.compiler.ast.SourceLocation;

/**
 * 状态切换 {@code state name;}
 */
public class StateChangeStmt extends Statement {
    private final String stateName;

    public StateChangeStmt(SourceLocation location, String stateName) {
        super(location);
        this.stateName = stateName;
    }

    public String getStateName() {
        return stateName;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStateChangeStmt(this, context);
    }
}
