package com.lslpy.compiler.ast.decl;

import com.lslpy.compiler.ast.AstNode;
import com.lslpy.compiler.ast.AstVisitor;
import com.lslpy.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * 脚本（AST 根节点）
 *
 * <p>全局声明保持源码顺序：全局变量的初始化顺序依赖于此。</p>
 */
public class Script extends AstNode {
    private final List<Declaration> globals;
    private final List<StateDecl> states;

    public Script(SourceLocation location, List<Declaration> globals, List<StateDecl> states) {
        super(location);
        this.globals = globals;
        this.states = states;
    }

    public List<Declaration> getGlobals() {
        return globals;
    }

    public List<StateDecl> getStates() {
        return states;
    }

    /** 按源码顺序返回全局变量 */
    public List<GlobalVariable> getGlobalVariables() {
        List<GlobalVariable> result = new ArrayList<GlobalVariable>();
        for (Declaration decl : globals) {
            if (decl instanceof GlobalVariable) {
                result.add((GlobalVariable) decl);
            }
        }
        return result;
    }

    /** 按源码顺序返回全局函数 */
    public List<GlobalFunction> getGlobalFunctions() {
        List<GlobalFunction> result = new ArrayList<GlobalFunction>();
        for (Declaration decl : globals) {
            if (decl instanceof GlobalFunction) {
                result.add((GlobalFunction) decl);
            }
        }
        return result;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitScript(this, context);
    }
}
