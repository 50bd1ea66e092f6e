package com.bella.script.ast;

import java.util.List;

import com.bella.script.ast.Expr.ExprInterface;
import com.bella.script.ast.Expr.Identifier;

public class Statement {

    public interface Stmt {
        void accept(StmtVisitor visitor);
    }

    public interface StmtVisitor {
        void visitBlock(Block stmt);
        void visitVariableDeclaration(VariableDeclaration stmt);
        void visitAssignment(Assignment stmt);
        void visitPrintStatement(PrintStatement stmt);
        void visitWhile(While stmt);
        void visitFunctionDeclaration(FunctionDeclaration stmt);
    }

    private Statement() {}

    /** A sequence of statements sharing the enclosing frame; it opens no scope of its own. */
    public static final class Block implements Stmt {
        public final List<Stmt> statements;

        public Block(List<Stmt> statements) {
            this.statements = List.copyOf(statements);
        }

        public void accept(StmtVisitor visitor) { visitor.visitBlock(this); }
    }

    public static final class VariableDeclaration implements Stmt {
        public final Identifier id;
        public final ExprInterface initializer;

        public VariableDeclaration(Identifier id, ExprInterface initializer) {
            this.id = id;
            this.initializer = initializer;
        }

        public void accept(StmtVisitor visitor) { visitor.visitVariableDeclaration(this); }
    }

    public static final class Assignment implements Stmt {
        public final Identifier target;
        public final ExprInterface source;

        public Assignment(Identifier target, ExprInterface source) {
            this.target = target;
            this.source = source;
        }

        public void accept(StmtVisitor visitor) { visitor.visitAssignment(this); }
    }

    public static final class PrintStatement implements Stmt {
        public final ExprInterface expression;

        public PrintStatement(ExprInterface expression) {
            this.expression = expression;
        }

        public void accept(StmtVisitor visitor) { visitor.visitPrintStatement(this); }
    }

    public static final class While implements Stmt {
        public final ExprInterface test;
        public final Block body;

        public While(ExprInterface test, Block body) {
            this.test = test;
            this.body = body;
        }

        public void accept(StmtVisitor visitor) { visitor.visitWhile(this); }
    }

    public static final class FunctionDeclaration implements Stmt {
        public final Identifier name;
        public final List<Identifier> params;
        public final ExprInterface body;

        public FunctionDeclaration(Identifier name, List<Identifier> params, ExprInterface body) {
            this.name = name;
            this.params = List.copyOf(params);
            this.body = body;
        }

        public void accept(StmtVisitor visitor) { visitor.visitFunctionDeclaration(this); }
    }
}
