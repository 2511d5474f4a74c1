package com.lslpy.compiler.ast.decl;

import com.lslpy.compiler.ast.AstNode;
import com.lslpy.compiler.ast.AstVisitor;
import com.lslpy.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 状态声明（{@code default} 或 {@code state name}）
 */
public class StateDecl extends AstNode {
    public static final String DEFAULT_STATE = "default";

    private final String name;
    private final List<EventHandler> handlers;

    public StateDecl(SourceLocation location, String name, List<EventHandler> handlers) {
        super(location);
        this.name = name;
        this.handlers = handlers;
    }

    public String getName() {
        return name;
    }

    public List<EventHandler> getHandlers() {
        return handlers;
    }

    public boolean isDefault() {
        return DEFAULT_STATE.equals(name);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitState(this, context);
    }
}
