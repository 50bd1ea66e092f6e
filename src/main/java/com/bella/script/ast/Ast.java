package com.bella.script.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.bella.script.ast.Expr.ArrayLiteral;
import com.bella.script.ast.Expr.BinaryExp;
import com.bella.script.ast.Expr.Bool;
import com.bella.script.ast.Expr.Call;
import com.bella.script.ast.Expr.ConditionalExpression;
import com.bella.script.ast.Expr.ExprInterface;
import com.bella.script.ast.Expr.Identifier;
import com.bella.script.ast.Expr.Numeral;
import com.bella.script.ast.Expr.Subscript;
import com.bella.script.ast.Expr.UnaryExp;
import com.bella.script.ast.Statement.Assignment;
import com.bella.script.ast.Statement.Block;
import com.bella.script.ast.Statement.FunctionDeclaration;
import com.bella.script.ast.Statement.PrintStatement;
import com.bella.script.ast.Statement.Stmt;
import com.bella.script.ast.Statement.VariableDeclaration;
import com.bella.script.ast.Statement.While;

/**
 * Static builders for hosts that assemble trees in code.
 *
 * Usage:
 *   Program p = program(
 *       let("x", num(100)),
 *       assign("x", unary("-", num(20))),
 *       print(binary("*", num(9), id("x"))));
 */
public final class Ast {

    private Ast() {}

    public static Program program(Stmt... statements) {
        return new Program(block(statements));
    }

    public static Block block(Stmt... statements) {
        return new Block(Arrays.asList(statements));
    }

    public static VariableDeclaration let(String name, ExprInterface initializer) {
        return new VariableDeclaration(id(name), initializer);
    }

    public static Assignment assign(String name, ExprInterface source) {
        return new Assignment(id(name), source);
    }

    public static PrintStatement print(ExprInterface expression) {
        return new PrintStatement(expression);
    }

    public static While whileLoop(ExprInterface test, Stmt... body) {
        return new While(test, block(body));
    }

    public static FunctionDeclaration function(String name, List<String> params, ExprInterface body) {
        List<Identifier> ids = new ArrayList<>(params.size());
        for (String p : params) ids.add(id(p));
        return new FunctionDeclaration(id(name), ids, body);
    }

    public static BinaryExp binary(String operator, ExprInterface left, ExprInterface right) {
        return new BinaryExp(operator, left, right);
    }

    public static UnaryExp unary(String operator, ExprInterface operand) {
        return new UnaryExp(operator, operand);
    }

    public static ConditionalExpression conditional(ExprInterface test, ExprInterface consequent, ExprInterface alternate) {
        return new ConditionalExpression(test, consequent, alternate);
    }

    public static Call call(String callee, ExprInterface... args) {
        return new Call(id(callee), Arrays.asList(args));
    }

    public static ArrayLiteral array(ExprInterface... elements) {
        return new ArrayLiteral(Arrays.asList(elements));
    }

    public static Subscript subscript(ExprInterface array, ExprInterface index) {
        return new Subscript(array, index);
    }

    public static Identifier id(String name) {
        return new Identifier(name);
    }

    public static Numeral num(double value) {
        return new Numeral(value);
    }

    public static Bool bool(boolean value) {
        return new Bool(value);
    }
}
