package com.bella.script.interpreter;

import java.util.ArrayList;
import java.util.List;

import com.bella.debug.Debug;
import com.bella.script.BellaScript.PrintSink;
import com.bella.script.ast.Expr;
import com.bella.script.ast.Expr.ArrayLiteral;
import com.bella.script.ast.Expr.BinaryExp;
import com.bella.script.ast.Expr.Bool;
import com.bella.script.ast.Expr.Call;
import com.bella.script.ast.Expr.ConditionalExpression;
import com.bella.script.ast.Expr.ExprVisitor;
import com.bella.script.ast.Expr.Identifier;
import com.bella.script.ast.Expr.Numeral;
import com.bella.script.ast.Expr.Subscript;
import com.bella.script.ast.Expr.UnaryExp;
import com.bella.script.ast.Statement.Assignment;
import com.bella.script.ast.Statement.Block;
import com.bella.script.ast.Statement.FunctionDeclaration;
import com.bella.script.ast.Statement.PrintStatement;
import com.bella.script.ast.Statement.Stmt;
import com.bella.script.ast.Statement.StmtVisitor;
import com.bella.script.ast.Statement.VariableDeclaration;
import com.bella.script.ast.Statement.While;
import com.bella.script.interpreter.BellaError.ArityMismatchError;
import com.bella.script.interpreter.BellaError.IndexOutOfRangeError;
import com.bella.script.interpreter.BellaError.NotCallableError;
import com.bella.script.interpreter.BellaError.TypeError;
import com.bella.script.interpreter.BellaError.UnknownOperatorError;

/**
 * Tree-walking evaluator. Expressions produce a {@link Value}, statements run for effect,
 * both against the current frame held in {@link #env}. Errors are thrown as
 * {@link BellaError} and never caught here.
 */
public class Interpreter implements ExprVisitor<Value>, StmtVisitor {

    private static final String TAG = "bella.interpreter";

    Environment env;
    private final PrintSink out;

    public Interpreter(Environment env, PrintSink out) {
        this.env = env;
        this.out = out;
    }

    // -------------------------
    // Entry points
    // -------------------------

    public void execute(Stmt stmt) {
        stmt.accept(this);
    }

    public Value eval(Expr.ExprInterface expr) {
        return expr.accept(this);
    }

    public Value evaluate(Expr.ExprInterface expr, Environment frame) {
        Environment previous = env;
        env = frame;
        try {
            return expr.accept(this);
        } finally {
            env = previous;
        }
    }

    // -------------------------
    // Statements
    // -------------------------

    @Override
    public void visitBlock(Block stmt) {
        for (Stmt s : stmt.statements) s.accept(this);
    }

    @Override
    public void visitVariableDeclaration(VariableDeclaration stmt) {
        Value value = eval(stmt.initializer);
        env.declare(stmt.id.name, value);
    }

    @Override
    public void visitAssignment(Assignment stmt) {
        Value value = eval(stmt.source);
        env.assign(stmt.target.name, value);
    }

    @Override
    public void visitPrintStatement(PrintStatement stmt) {
        out.println(eval(stmt.expression).toString());
    }

    @Override
    public void visitWhile(While stmt) {
        while (requireBool(eval(stmt.test), "while")) {
            stmt.body.accept(this);
        }
    }

    @Override
    public void visitFunctionDeclaration(FunctionDeclaration stmt) {
        String name = stmt.name.name;
        UserFunction fn = new UserFunction(name, stmt.params, stmt.body, env);
        env.declare(name, Value.func(fn));
    }

    // -------------------------
    // Expressions
    // -------------------------

    @Override
    public Value visitBinaryExp(BinaryExp expr) {
        String op = expr.operator;

        // logical operators short-circuit: right side only when the left does not decide
        if ("&&".equals(op)) {
            if (!requireBool(eval(expr.left), op)) return Value.bool(false);
            return Value.bool(requireBool(eval(expr.right), op));
        }
        if ("||".equals(op)) {
            if (requireBool(eval(expr.left), op)) return Value.bool(true);
            return Value.bool(requireBool(eval(expr.right), op));
        }

        Value left = eval(expr.left);
        Value right = eval(expr.right);

        switch (op) {
            case "+":
                requireNumber(left, right, op);
                return Value.number(left.asNumber() + right.asNumber());
            case "-":
                requireNumber(left, right, op);
                return Value.number(left.asNumber() - right.asNumber());
            case "*":
                requireNumber(left, right, op);
                return Value.number(left.asNumber() * right.asNumber());
            case "/":
                requireNumber(left, right, op);
                return Value.number(left.asNumber() / right.asNumber());
            case "%":
                requireNumber(left, right, op);
                return Value.number(left.asNumber() % right.asNumber());
            case "**":
                requireNumber(left, right, op);
                return Value.number(Math.pow(left.asNumber(), right.asNumber()));

            case "<":
                requireNumber(left, right, op);
                return Value.bool(left.asNumber() < right.asNumber());
            case "<=":
                requireNumber(left, right, op);
                return Value.bool(left.asNumber() <= right.asNumber());
            case "==":
                requireNumber(left, right, op);
                return Value.bool(left.asNumber() == right.asNumber());
            case "!=":
                requireNumber(left, right, op);
                return Value.bool(left.asNumber() != right.asNumber());
            case ">=":
                requireNumber(left, right, op);
                return Value.bool(left.asNumber() >= right.asNumber());
            case ">":
                requireNumber(left, right, op);
                return Value.bool(left.asNumber() > right.asNumber());

            default:
                throw new UnknownOperatorError(op);
        }
    }

    @Override
    public Value visitUnaryExp(UnaryExp expr) {
        String op = expr.operator;
        Value operand = eval(expr.operand);
        switch (op) {
            case "-":
                if (operand.getType() != Value.Type.NUMBER) {
                    throw new TypeError(op, "Unary '-' expects number, got " + operand.getType());
                }
                return Value.number(-operand.asNumber());
            case "!":
                return Value.bool(!requireBool(operand, op));
            default:
                throw new UnknownOperatorError(op);
        }
    }

    @Override
    public Value visitConditionalExpression(ConditionalExpression expr) {
        if (requireBool(eval(expr.test), "?:")) {
            return eval(expr.consequent);
        }
        return eval(expr.alternate);
    }

    @Override
    public Value visitCall(Call expr) {
        String name = expr.callee.name;
        Value callee = env.lookup(name);
        if (callee.getType() != Value.Type.FUNC) {
            throw new NotCallableError(name, callee.getType());
        }
        BellaFunction fn = callee.asFunc();

        List<Value> args = new ArrayList<>(expr.args.size());
        for (Expr.ExprInterface a : expr.args) args.add(eval(a));

        if (args.size() != fn.arity()) {
            throw new ArityMismatchError(name, fn.arity(), args.size());
        }

        Debug.get().t(TAG, "call " + name + "/" + args.size());
        return fn.invoke(this, args);
    }

    @Override
    public Value visitArrayLiteral(ArrayLiteral expr) {
        List<Value> values = new ArrayList<>(expr.elements.size());
        for (Expr.ExprInterface e : expr.elements) values.add(eval(e));
        return Value.array(values);
    }

    @Override
    public Value visitSubscript(Subscript expr) {
        Value target = eval(expr.array);
        if (target.getType() != Value.Type.ARRAY) {
            throw new TypeError("[]", "Subscript expects an array, got " + target.getType());
        }
        Value idx = eval(expr.index);
        if (idx.getType() != Value.Type.NUMBER) {
            throw new TypeError("[]", "Index must be a number, got " + idx.getType());
        }
        double d = idx.asNumber();
        if (d != Math.rint(d) || Double.isInfinite(d)) {
            throw new TypeError("[]", "Index must be an integer, got " + Value.formatNumber(d));
        }

        List<Value> list = target.asArray();
        if (d < 0 || d >= list.size()) {
            throw new IndexOutOfRangeError((int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, d)), list.size());
        }
        return list.get((int) d);
    }

    @Override
    public Value visitIdentifier(Identifier expr) {
        return env.lookup(expr.name);
    }

    @Override
    public Value visitNumeral(Numeral expr) {
        return Value.number(expr.value);
    }

    @Override
    public Value visitBool(Bool expr) {
        return Value.bool(expr.value);
    }

    // -------------------------
    // Helpers
    // -------------------------

    public void requireNumber(Value a, Value b, String op) {
        if (a.getType() != Value.Type.NUMBER || b.getType() != Value.Type.NUMBER) {
            throw new TypeError(op, "Operator '" + op + "' expects numbers, got " + a.getType() + ", " + b.getType());
        }
    }

    public boolean requireBool(Value v, String op) {
        if (v.getType() != Value.Type.BOOL) {
            throw new TypeError(op, "Operator '" + op + "' expects bool, got " + v.getType());
        }
        return v.asBool();
    }
}
