package com.lslpy.compiler.ast.decl;

import com.lslpy.compiler.analysis.Symbol;
import com.lslpy.compiler.ast.AstNode;
import com.lslpy.compiler.ast.AstVisitor;
import com.lslpy.compiler.ast.SourceLocation;
import com.lslpy.compiler.ast.stmt.CompoundStmt;

import java.util.List;

/**
 * 状态内的事件处理器，如 {@code touch_start(integer num) { ... }}
 */
public class EventHandler extends AstNode {
    private final String stateName;     // 所属状态
    private final String name;
    private final List<Symbol> params;
    private final CompoundStmt body;

    public EventHandler(SourceLocation location, String stateName, String name,
                        List<Symbol> params, CompoundStmt body) {
        super(location);
        this.stateName = stateName;
        this.name = name;
        this.params = params;
        this.body = body;
    }

    public String getStateName() {
        return stateName;
    }

    public String getName() {
        return name;
    }

    public List<Symbol> getParams() {
        return params;
    }

    public CompoundStmt getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitEventHandler(this, context);
    }
}
