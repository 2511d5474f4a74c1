package com.lslpy.compiler.analysis;

import com.lslpy.compiler.ast.SourceLocation;

/**
 * 已解析的符号：标识符 + 作用域分类 + 类型标签
 */
public final class Symbol {
    private final String name;
    private final SymbolScope scope;
    private final LslType type;
    private final SourceLocation location;

    public Symbol(String name, SymbolScope scope, LslType type) {
        this(name, scope, type, SourceLocation.UNKNOWN);
    }

    public Symbol(String name, SymbolScope scope, LslType type, SourceLocation location) {
        this.name = name;
        this.scope = scope;
        this.type = type;
        this.location = location;
    }

    public String getName() { return name; }
    public SymbolScope getScope() { return scope; }
    public LslType getType() { return type; }
    public SourceLocation getLocation() { return location; }

    public boolean isGlobal() {
        return scope == SymbolScope.GLOBAL;
    }

    public boolean isBuiltin() {
        return scope == SymbolScope.BUILTIN;
    }

    @Override
    public String toString() {
        return scope.name().toLowerCase() + " " + type.getSourceName() + " " + name;
    }
}
