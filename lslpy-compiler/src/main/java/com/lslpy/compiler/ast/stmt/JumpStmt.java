package com.lslpy.compiler.ast.stmt;

import com.lslpy.compiler.ast.AstVisitor;
import com.lslpy.compiler.ast.SourceLocation;

/**
 * 跳转语句 {@code jump label;}，目标可以是任意外层作用域中的标签
 */
public class JumpStmt extends Statement {
    private final String label;

    public JumpStmt(SourceLocation location, String label) {
        super(location);
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitJumpStmt(this, context);
    }
}
