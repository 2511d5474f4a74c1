package com.lslpy.compiler.analysis;

/**
 * 符号作用域分类（由前端符号表给出）
 */
public enum SymbolScope {
    BUILTIN,    // 运行时库提供的内置函数/常量
    GLOBAL,     // 脚本全局变量与全局函数
    LOCAL       // 局部变量与参数
}
