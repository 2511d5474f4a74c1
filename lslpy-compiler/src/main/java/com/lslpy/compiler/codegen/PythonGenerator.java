package com.lslpy.compiler.codegen;

import com.lslpy.compiler.analysis.LslType;
import com.lslpy.compiler.analysis.Symbol;
import com.lslpy.compiler.ast.AstNode;
import com.lslpy.compiler.ast.AstVisitor;
import com.lslpy.compiler.ast.decl.*;
import com.lslpy.compiler.ast.expr.*;
import com.lslpy.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.lslpy.compiler.ast.expr.UnaryExpr.UnaryOp;
import com.lslpy.compiler.ast.stmt.*;

import java.util.List;

/**
 * LSL AST → Python 源码生成器
 *
 * <p>单遍遍历已完成类型检查和去糖的 AST，按节点出现顺序输出 Python 代码。
 * 运算符、类型转换、坐标分量修改、goto 与状态切换都委托给运行时支持库，
 * 生成器只负责按约定的名称和参数顺序调用。</p>
 *
 * <p>实例无状态，可在多个线程中并发使用；输出缓冲与缩进都在 {@link GenerationContext} 中。</p>
 */
public class PythonGenerator implements AstVisitor<Void, GenerationContext> {

    /**
     * 生成整个脚本
     */
    public String generate(Script script, GenerationConfig config) {
        GenerationContext ctx = new GenerationContext(config);
        visitScript(script, ctx);
        return ctx.getOutput();
    }

    /**
     * 使用默认配置生成
     */
    public String generate(Script script) {
        return generate(script, new GenerationConfig());
    }

    // ============ 声明 ============

    @Override
    public Void visitScript(Script node, GenerationContext ctx) {
        GenerationConfig config = ctx.getConfig();
        ctx.line("from " + config.getRuntimeModule() + " import *");
        ctx.newLine();
        ctx.newLine();
        ctx.line("class " + config.getClassName() + "(" + config.getBaseClassName() + "):");

        try (GenerationContext.IndentScope classScope = ctx.indented()) {
            List<GlobalVariable> globals = node.getGlobalVariables();

            // 类作用域只声明类型，赋值统一放进 __init__，后面的全局变量才能读到前面的值
            for (GlobalVariable global : globals) {
                ctx.line(global.getName() + ": " + typeName(global.getSymbol().getType(), global));
            }
            ctx.newLine();

            ctx.line("def __init__(self):");
            try (GenerationContext.IndentScope initScope = ctx.indented()) {
                ctx.line("super().__init__()");
                for (GlobalVariable global : globals) {
                    global.accept(this, ctx);
                }
                ctx.newLine();
            }

            for (GlobalFunction function : node.getGlobalFunctions()) {
                function.accept(this, ctx);
            }

            for (StateDecl state : node.getStates()) {
                state.accept(this, ctx);
            }
        }
        return null;
    }

    @Override
    public Void visitGlobalVariable(GlobalVariable node, GenerationContext ctx) {
        ctx.append("self." + node.getName() + " = ");
        writeInitializer(node.getSymbol(), node.getInitializer(), node, ctx);
        ctx.newLine();
        return null;
    }

    @Override
    public Void visitGlobalFunction(GlobalFunction node, GenerationContext ctx) {
        writeMethod(node.getName(), node.getParams(), node.getReturnType(), node.getBody(), node, ctx);
        return null;
    }

    @Override
    public Void visitState(StateDecl node, GenerationContext ctx) {
        for (EventHandler handler : node.getHandlers()) {
            handler.accept(this, ctx);
        }
        return null;
    }

    @Override
    public Void visitEventHandler(EventHandler node, GenerationContext ctx) {
        // 所有状态共享一个方法命名空间
        String methodName = ctx.getConfig().getHandlerPrefix() + node.getStateName() + node.getName();
        writeMethod(methodName, node.getParams(), LslType.NONE, node.getBody(), node, ctx);
        return null;
    }

    // ============ 语句 ============

    @Override
    public Void visitNopStmt(NopStmt node, GenerationContext ctx) {
        ctx.line("pass");
        return null;
    }

    @Override
    public Void visitCompoundStmt(CompoundStmt node, GenerationContext ctx) {
        if (node.isEmpty()) {
            ctx.line("pass");
            return null;
        }
        for (Statement stmt : node.getStatements()) {
            stmt.accept(this, ctx);
        }
        return null;
    }

    @Override
    public Void visitExpressionStmt(ExpressionStmt node, GenerationContext ctx) {
        node.getExpression().accept(this, ctx);
        ctx.newLine();
        return null;
    }

    @Override
    public Void visitDeclarationStmt(DeclarationStmt node, GenerationContext ctx) {
        Symbol symbol = node.getSymbol();
        ctx.append(symbol.getName() + ": " + typeName(symbol.getType(), node) + " = ");
        writeInitializer(symbol, node.getInitializer(), node, ctx);
        ctx.newLine();
        return null;
    }

    @Override
    public Void visitIfStmt(IfStmt node, GenerationContext ctx) {
        ctx.append("if ");
        node.getCondition().accept(this, ctx);
        ctx.append(":");
        ctx.newLine();
        try (GenerationContext.IndentScope thenScope = ctx.indented()) {
            node.getThenBranch().accept(this, ctx);
        }
        if (node.hasElse()) {
            ctx.line("else:");
            try (GenerationContext.IndentScope elseScope = ctx.indented()) {
                node.getElseBranch().accept(this, ctx);
            }
        }
        return null;
    }

    @Override
    public Void visitForStmt(ForStmt node, GenerationContext ctx) {
        // 初始化表达式提到循环之前，逐条成为语句
        for (Expression init : node.getInitializers()) {
            init.accept(this, ctx);
            ctx.newLine();
        }
        // 所有循环都统一翻译成 while True，保证求值顺序与 LSL 一致
        ctx.line("while True:");
        try (GenerationContext.IndentScope loopScope = ctx.indented()) {
            writeBreakUnless(node.getCondition(), ctx);
            node.getBody().accept(this, ctx);
            for (Expression update : node.getUpdates()) {
                update.accept(this, ctx);
                ctx.newLine();
            }
        }
        return null;
    }

    @Override
    public Void visitWhileStmt(WhileStmt node, GenerationContext ctx) {
        ctx.append("while ");
        node.getCondition().accept(this, ctx);
        ctx.append(":");
        ctx.newLine();
        try (GenerationContext.IndentScope loopScope = ctx.indented()) {
            node.getBody().accept(this, ctx);
        }
        return null;
    }

    @Override
    public Void visitDoStmt(DoStmt node, GenerationContext ctx) {
        ctx.line("while True:");
        try (GenerationContext.IndentScope loopScope = ctx.indented()) {
            node.getBody().accept(this, ctx);
            writeBreakUnless(node.getCondition(), ctx);
        }
        return null;
    }

    @Override
    public Void visitJumpStmt(JumpStmt node, GenerationContext ctx) {
        // 不区分 break/continue 式的跳转，全部交给运行时的 goto
        ctx.line("goto ." + node.getLabel());
        return null;
    }

    @Override
    public Void visitLabelStmt(LabelStmt node, GenerationContext ctx) {
        ctx.line("label ." + node.getName());
        return null;
    }

    @Override
    public Void visitReturnStmt(ReturnStmt node, GenerationContext ctx) {
        if (node.hasValue()) {
            ctx.append("return ");
            node.getValue().accept(this, ctx);
        } else {
            ctx.append("return");
        }
        ctx.newLine();
        return null;
    }

    @Override
    public Void visitStateChangeStmt(StateChangeStmt node, GenerationContext ctx) {
        // 由运行时基类的状态分发循环捕获
        ctx.line("raise StateChangeException('" + node.getStateName() + "')");
        return null;
    }

    // ============ 常量 ============

    @Override
    public Void visitIntegerConstant(IntegerConstant node, GenerationContext ctx) {
        ctx.append(Integer.toString(node.getValue()));
        return null;
    }

    @Override
    public Void visitFloatConstant(FloatConstant node, GenerationContext ctx) {
        ctx.append(FloatLiterals.encode(node.getValue()));
        return null;
    }

    @Override
    public Void visitStringConstant(StringConstant node, GenerationContext ctx) {
        ctx.append(PythonStringUtils.quote(node.getValue()));
        return null;
    }

    @Override
    public Void visitKeyConstant(KeyConstant node, GenerationContext ctx) {
        ctx.append("Key(" + PythonStringUtils.quote(node.getValue()) + ")");
        return null;
    }

    @Override
    public Void visitVectorConstant(VectorConstant node, GenerationContext ctx) {
        writeCoordinateConstant("Vector", node.getComponents(), ctx);
        return null;
    }

    @Override
    public Void visitQuaternionConstant(QuaternionConstant node, GenerationContext ctx) {
        writeCoordinateConstant("Quaternion", node.getComponents(), ctx);
        return null;
    }

    @Override
    public Void visitListConstant(ListConstant node, GenerationContext ctx) {
        ctx.append("[");
        writeJoined(node.getElements(), ctx);
        ctx.append("]");
        return null;
    }

    // ============ 表达式 ============

    @Override
    public Void visitVectorExpr(VectorExpr node, GenerationContext ctx) {
        ctx.append("Vector((");
        writeJoined(node.getComponents(), ctx);
        ctx.append("))");
        return null;
    }

    @Override
    public Void visitQuaternionExpr(QuaternionExpr node, GenerationContext ctx) {
        ctx.append("Quaternion((");
        writeJoined(node.getComponents(), ctx);
        ctx.append("))");
        return null;
    }

    @Override
    public Void visitListExpr(ListExpr node, GenerationContext ctx) {
        ctx.append("[");
        writeJoined(node.getElements(), ctx);
        ctx.append("]");
        return null;
    }

    @Override
    public Void visitTypecastExpr(TypecastExpr node, GenerationContext ctx) {
        Expression operand = node.getOperand();
        if (operand.getType() == LslType.INTEGER && node.getTargetType() == LslType.FLOAT) {
            // 与 typecast(x, float) 等价，但更易读
            ctx.append("float(");
            operand.accept(this, ctx);
            ctx.append(")");
            return null;
        }
        ctx.append("typecast(");
        operand.accept(this, ctx);
        ctx.append(", " + typeName(node.getTargetType(), node) + ")");
        return null;
    }

    @Override
    public Void visitFunctionCallExpr(FunctionCallExpr node, GenerationContext ctx) {
        Symbol function = node.getFunction();
        if (function.isBuiltin()) {
            ctx.append(ctx.getConfig().getBuiltinNamespace() + ".");
        } else {
            ctx.append("self.");
        }
        ctx.append(function.getName() + "(");
        writeJoined(node.getArguments(), ctx);
        ctx.append(")");
        return null;
    }

    @Override
    public Void visitLValueExpr(LValueExpr node, GenerationContext ctx) {
        ctx.append(reference(node.getSymbol()));
        if (node.hasMember()) {
            ctx.append("[" + node.getMember().getOffset() + "]");
        }
        return null;
    }

    @Override
    public Void visitBinaryExpr(BinaryExpr node, GenerationContext ctx) {
        BinaryOp op = node.getOperator();
        if (op == BinaryOp.ASSIGN) {
            writeAssignment(node, ctx);
            return null;
        }
        if (op == BinaryOp.MUL_ASSIGN) {
            writeNarrowingMulAssign(node, ctx);
            return null;
        }
        if (op.isAssignment()) {
            throw new GenerationException("复合赋值 " + op.toSourceString() + " 应已由前端去糖", node.getLocation());
        }
        // 运行时辅助函数约定：右操作数在前，左操作数在后
        ctx.append(binaryHelper(op, node) + "(");
        node.getRight().accept(this, ctx);
        ctx.append(", ");
        node.getLeft().accept(this, ctx);
        ctx.append(")");
        return null;
    }

    @Override
    public Void visitUnaryExpr(UnaryExpr node, GenerationContext ctx) {
        UnaryOp op = node.getOperator();
        if (op.isIncDec()) {
            writeIncDec(node, ctx);
            return null;
        }
        ctx.append(unaryHelper(op, node) + "(");
        node.getOperand().accept(this, ctx);
        ctx.append(")");
        return null;
    }

    @Override
    public Void visitPrintExpr(PrintExpr node, GenerationContext ctx) {
        ctx.append("print(");
        node.getOperand().accept(this, ctx);
        ctx.append(")");
        return null;
    }

    @Override
    public Void visitParenthesisExpr(ParenthesisExpr node, GenerationContext ctx) {
        ctx.append("(");
        node.getOperand().accept(this, ctx);
        ctx.append(")");
        return null;
    }

    @Override
    public Void visitBoolConversionExpr(BoolConversionExpr node, GenerationContext ctx) {
        ctx.append("cond(");
        node.getOperand().accept(this, ctx);
        ctx.append(")");
        return null;
    }

    // ============ 赋值与自增自减 ============

    private void writeAssignment(BinaryExpr node, GenerationContext ctx) {
        LValueExpr target = requireLValue(node.getLeft(), node);
        Symbol symbol = target.getSymbol();

        if (!node.isResultNeeded()) {
            // 语句上下文：直接重新绑定整个变量
            ctx.append(reference(symbol) + " = ");
            writeAssignedValue(target, node.getRight(), ctx);
            return;
        }

        writeBindingOpen(symbol, ctx);
        writeAssignedValue(target, node.getRight(), ctx);
        ctx.append(")");
        if (target.hasMember()) {
            // 表达式的值是被赋值的分量，而不是新的坐标
            ctx.append("[" + target.getMember().getOffset() + "]");
        }
    }

    /**
     * {@code int *= float}：去糖后唯一保留的复合赋值，结果需要收窄回目标类型
     */
    private void writeNarrowingMulAssign(BinaryExpr node, GenerationContext ctx) {
        LValueExpr target = requireLValue(node.getLeft(), node);
        if (target.hasMember()) {
            throw new GenerationException("坐标分量上的 *= 应已由前端去糖", node.getLocation());
        }
        Symbol symbol = target.getSymbol();
        writeBindingOpen(symbol, ctx);
        ctx.append("typecast(" + binaryHelper(BinaryOp.MUL, node) + "(");
        node.getRight().accept(this, ctx);
        ctx.append(", ");
        target.accept(this, ctx);
        ctx.append("), " + typeName(symbol.getType(), node) + "))");
    }

    /**
     * 表达式上下文中的赋值开头：局部变量用海象运算符，属性不支持海象运算符，改用 assign()
     */
    private void writeBindingOpen(Symbol symbol, GenerationContext ctx) {
        if (symbol.isGlobal()) {
            ctx.append("assign(self.__dict__, \"" + symbol.getName() + "\", ");
        } else {
            ctx.append("(" + symbol.getName() + " := ");
        }
    }

    /**
     * 写出赋给变量的新值。坐标分量赋值会构造替换了单个分量的新坐标，原坐标不被修改。
     */
    private void writeAssignedValue(LValueExpr target, Expression value, GenerationContext ctx) {
        if (!target.hasMember()) {
            value.accept(this, ctx);
            return;
        }
        ctx.append("replace_coord_axis(" + reference(target.getSymbol()) + ", "
                + target.getMember().getOffset() + ", ");
        value.accept(this, ctx);
        ctx.append(")");
    }

    private void writeIncDec(UnaryExpr node, GenerationContext ctx) {
        UnaryOp op = node.getOperator();
        LValueExpr target = requireLValue(node.getOperand(), node);
        Symbol symbol = target.getSymbol();

        if (node.isResultNeeded() || target.hasMember()) {
            // Python 没有 ++/--，由运行时按容器 + 名字修改变量并返回前值或后值
            ctx.append((op.isPostfix() ? "post" : "pre") + (op.isDecrement() ? "decr" : "incr") + "(");
            ctx.append(symbol.isGlobal() ? "self.__dict__" : "locals()");
            ctx.append(", \"" + symbol.getName() + "\"");
            if (target.hasMember()) {
                ctx.append(", " + target.getMember().getOffset());
            }
            ctx.append(")");
            return;
        }

        ctx.append(reference(symbol) + (op.isDecrement() ? " -= " : " += "));
        Expression one = target.getType().oneValue(node.getLocation());
        if (one == null) {
            throw new GenerationException("类型 " + target.getType().getSourceName() + " 不支持自增/自减",
                    node.getLocation());
        }
        one.accept(this, ctx);
    }

    // ============ 运行时辅助函数名 ============

    private static String binaryHelper(BinaryOp op, AstNode node) {
        switch (op) {
            case ADD:     return "radd";
            case SUB:     return "rsub";
            case MUL:     return "rmul";
            case DIV:     return "rdiv";
            case MOD:     return "rmod";
            case EQ:      return "req";
            case NE:      return "rneq";
            case GT:      return "rgreater";
            case LT:      return "rless";
            case GE:      return "rgeq";
            case LE:      return "rleq";
            case AND:     return "rbooland";
            case OR:      return "rboolor";
            case BIT_AND: return "rbitand";
            case BIT_OR:  return "rbitor";
            case BIT_XOR: return "rbitxor";
            case SHL:     return "rshl";
            case SHR:     return "rshr";
            default:
                throw new GenerationException("运算符 " + op.toSourceString() + " 应已由前端去糖",
                        node.getLocation());
        }
    }

    private static String unaryHelper(UnaryOp op, AstNode node) {
        switch (op) {
            case NEG:      return "neg";
            case BIT_NOT:  return "bitnot";
            case BOOL_NOT: return "boolnot";
            default:
                throw new GenerationException("未知的一元运算符 " + op.toSourceString(), node.getLocation());
        }
    }

    // ============ 辅助方法 ============

    /**
     * 函数与事件处理器：统一带 @with_goto，使 goto/label 在方法体内可用
     */
    private void writeMethod(String name, List<Symbol> params, LslType returnType, CompoundStmt body,
                             AstNode node, GenerationContext ctx) {
        ctx.line("@with_goto");
        ctx.append("def " + name + "(self");
        for (Symbol param : params) {
            ctx.append(", " + param.getName() + ": " + typeName(param.getType(), node));
        }
        ctx.append(") -> " + typeName(returnType, node) + ":");
        ctx.newLine();
        try (GenerationContext.IndentScope bodyScope = ctx.indented()) {
            body.accept(this, ctx);
        }
        ctx.newLine();
    }

    private void writeInitializer(Symbol symbol, Expression initializer, AstNode node, GenerationContext ctx) {
        if (initializer == null) {
            initializer = symbol.getType().defaultValue(node.getLocation());
            if (initializer == null) {
                throw new GenerationException("类型 " + symbol.getType().getSourceName() + " 没有零值",
                        node.getLocation());
            }
        }
        initializer.accept(this, ctx);
    }

    /** {@code if not <cond>: break} */
    private void writeBreakUnless(Expression condition, GenerationContext ctx) {
        ctx.append("if not ");
        condition.accept(this, ctx);
        ctx.append(":");
        ctx.newLine();
        try (GenerationContext.IndentScope breakScope = ctx.indented()) {
            ctx.line("break");
        }
    }

    private void writeCoordinateConstant(String constructor, float[] components, GenerationContext ctx) {
        StringBuilder sb = new StringBuilder(constructor).append("((");
        for (int i = 0; i < components.length; i++) {
            if (i > 0) sb.append(", ");
            sb.append(FloatLiterals.encode(components[i]));
        }
        sb.append("))");
        ctx.append(sb.toString());
    }

    private void writeJoined(List<Expression> expressions, GenerationContext ctx) {
        for (int i = 0; i < expressions.size(); i++) {
            if (i > 0) ctx.append(", ");
            expressions.get(i).accept(this, ctx);
        }
    }

    /** 全局变量是实例属性，局部变量与参数直接使用名字 */
    private static String reference(Symbol symbol) {
        return symbol.isGlobal() ? "self." + symbol.getName() : symbol.getName();
    }

    private static String typeName(LslType type, AstNode node) {
        return PythonTypeNames.of(type, node.getLocation());
    }

    private static LValueExpr requireLValue(Expression expr, AstNode node) {
        if (!(expr instanceof LValueExpr)) {
            throw new GenerationException("赋值目标必须是左值", node.getLocation());
        }
        return (LValueExpr) expr;
    }
}
