package com.bella.script.ast;

import java.util.List;

/**
 * Expression nodes. The set is closed: every variant has a matching method on
 * {@link ExprVisitor}, so an evaluator that implements the visitor handles all of them.
 */
public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);
    }

    public interface ExprVisitor<R> {
        R visitBinaryExp(BinaryExp expr);
        R visitUnaryExp(UnaryExp expr);
        R visitConditionalExpression(ConditionalExpression expr);
        R visitCall(Call expr);
        R visitArrayLiteral(ArrayLiteral expr);
        R visitSubscript(Subscript expr);
        R visitIdentifier(Identifier expr);
        R visitNumeral(Numeral expr);
        R visitBool(Bool expr);
    }

    private Expr() {}

    // -------------------------
    // Operators
    // -------------------------

    public static final class BinaryExp implements ExprInterface {
        public final String operator;
        public final ExprInterface left;
        public final ExprInterface right;

        public BinaryExp(String operator, ExprInterface left, ExprInterface right) {
            this.operator = operator;
            this.left = left;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinaryExp(this);
        }
    }

    public static final class UnaryExp implements ExprInterface {
        public final String operator;
        public final ExprInterface operand;

        public UnaryExp(String operator, ExprInterface operand) {
            this.operator = operator;
            this.operand = operand;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnaryExp(this);
        }
    }

    /** {@code test ? consequent : alternate}; only the selected branch is evaluated. */
    public static final class ConditionalExpression implements ExprInterface {
        public final ExprInterface test;
        public final ExprInterface consequent;
        public final ExprInterface alternate;

        public ConditionalExpression(ExprInterface test, ExprInterface consequent, ExprInterface alternate) {
            this.test = test;
            this.consequent = consequent;
            this.alternate = alternate;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitConditionalExpression(this);
        }
    }

    // -------------------------
    // Calls
    // -------------------------

    public static final class Call implements ExprInterface {
        public final Identifier callee;
        public final List<ExprInterface> args;

        public Call(Identifier callee, List<ExprInterface> args) {
            this.callee = callee;
            this.args = List.copyOf(args);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCall(this);
        }
    }

    // -------------------------
    // Arrays
    // -------------------------

    public static final class ArrayLiteral implements ExprInterface {
        public final List<ExprInterface> elements;

        public ArrayLiteral(List<ExprInterface> elements) {
            this.elements = List.copyOf(elements);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitArrayLiteral(this);
        }
    }

    public static final class Subscript implements ExprInterface {
        public final ExprInterface array;
        public final ExprInterface index;

        public Subscript(ExprInterface array, ExprInterface index) {
            this.array = array;
            this.index = index;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitSubscript(this);
        }
    }

    // -------------------------
    // Leaves
    // -------------------------

    public static final class Identifier implements ExprInterface {
        public final String name;

        public Identifier(String name) {
            this.name = name;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIdentifier(this);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    public static final class Numeral implements ExprInterface {
        public final double value;

        public Numeral(double value) {
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitNumeral(this);
        }
    }

    public static final class Bool implements ExprInterface {
        public final boolean value;

        public Bool(boolean value) {
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBool(this);
        }
    }
}
