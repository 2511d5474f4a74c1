package com.lslpy.compiler.ast;

import com.lslpy.compiler.ast.decl.*;
import com.lslpy.compiler.ast.expr.*;
import com.lslpy.compiler.ast.stmt.*;

/**
 * AST 访问者接口
 *
 * <p>节点种类是封闭集合：每种节点对应一个抽象方法，实现类必须全部覆盖，
 * 新增节点种类时遗漏的访问者会在编译期报错。</p>
 */
public interface AstVisitor<R, C> {

    // ============ 声明 ============

    R visitScript(Script node, C ctx);

    R visitGlobalVariable(GlobalVariable node, C ctx);

    R visitGlobalFunction(GlobalFunction node, C ctx);

    R visitState(StateDecl node, C ctx);

    R visitEventHandler(EventHandler node, C ctx);

    // ============ 语句 ============

    R visitNopStmt(NopStmt node, C ctx);

    R visitCompoundStmt(CompoundStmt node, C ctx);

    R visitExpressionStmt(ExpressionStmt node, C ctx);

    R visitDeclarationStmt(DeclarationStmt node, C ctx);

    R visitIfStmt(IfStmt node, C ctx);

    R visitForStmt(ForStmt node, C ctx);

    R visitWhileStmt(WhileStmt node, C ctx);

    R visitDoStmt(DoStmt node, C ctx);

    R visitJumpStmt(JumpStmt node, C ctx);

    R visitLabelStmt(LabelStmt node, C ctx);

    R visitReturnStmt(ReturnStmt node, C ctx);

    R visitStateChangeStmt(StateChangeStmt node, C ctx);

    // ============ 表达式 ============

    R visitIntegerConstant(IntegerConstant node, C ctx);

    R visitFloatConstant(FloatConstant node, C ctx);

    R visitStringConstant(StringConstant node, C ctx);

    R visitKeyConstant(KeyConstant node, C ctx);

    R visitVectorConstant(VectorConstant node, C ctx);

    R visitQuaternionConstant(QuaternionConstant node, C ctx);

    R visitListConstant(ListConstant node, C ctx);

    R visitVectorExpr(VectorExpr node, C ctx);

    R visitQuaternionExpr(QuaternionExpr node, C ctx);

    R visitListExpr(ListExpr node, C ctx);

    R visitTypecastExpr(TypecastExpr node, C ctx);

    R visitFunctionCallExpr(FunctionCallExpr node, C ctx);

    R visitLValueExpr(LValueExpr node, C ctx);

    R visitBinaryExpr(BinaryExpr node, C ctx);

    R visitUnaryExpr(UnaryExpr node, C ctx);

    R visitPrintExpr(PrintExpr node, C ctx);

    R visitParenthesisExpr(ParenthesisExpr node, C ctx);

    R visitBoolConversionExpr(BoolConversionExpr node, C ctx);
}
