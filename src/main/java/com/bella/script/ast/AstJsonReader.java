package com.bella.script.ast;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

import com.bella.debug.Debug;
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
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Decodes the JSON interchange form emitted by a Bella front-end.
 *
 * Every node is an object whose "type" names the node class:
 *
 *   {"type":"Program","body":{"type":"Block","statements":[
 *       {"type":"PrintStatement","expression":
 *           {"type":"Call","callee":{"type":"Identifier","name":"sqrt"},
 *            "args":[{"type":"Numeral","value":2}]}}]}}
 *
 * Only the shape of the tree is checked here. Operator tokens pass through untouched.
 */
public final class AstJsonReader {

    private static final String TAG = "bella.ast";

    private final ObjectMapper om;

    public AstJsonReader() {
        this(new ObjectMapper());
    }

    public AstJsonReader(ObjectMapper om) {
        this.om = om;
    }

    public Program read(String json) {
        final JsonNode root;
        try {
            root = om.readTree(json);
        } catch (JsonProcessingException e) {
            throw new AstFormatException("$", "invalid JSON: " + e.getOriginalMessage(), e);
        }
        return program(root);
    }

    public Program read(InputStream in) throws IOException {
        final JsonNode root;
        try {
            root = om.readTree(in);
        } catch (JsonProcessingException e) {
            throw new AstFormatException("$", "invalid JSON: " + e.getOriginalMessage(), e);
        }
        return program(root);
    }

    public Program program(JsonNode root) {
        if (root == null || root.isMissingNode()) {
            throw new AstFormatException("$", "empty document");
        }
        expectType(root, "$", "Program");
        Program p = new Program(block(field(root, "$", "body"), "$.body"));
        Debug.get().d(TAG, "decoded program with " + p.body.statements.size() + " top-level statement(s)");
        return p;
    }

    // -------------------------
    // Statements
    // -------------------------

    private Block block(JsonNode node, String path) {
        expectType(node, path, "Block");
        JsonNode items = array(node, path, "statements");
        List<Stmt> out = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            out.add(statement(items.get(i), path + ".statements[" + i + "]"));
        }
        return new Block(out);
    }

    private Stmt statement(JsonNode node, String path) {
        String type = typeOf(node, path);
        switch (type) {
            case "Block":
                return block(node, path);
            case "VariableDeclaration":
                return new VariableDeclaration(
                        identifier(field(node, path, "id"), path + ".id"),
                        expression(field(node, path, "initializer"), path + ".initializer"));
            case "Assignment":
                return new Assignment(
                        identifier(field(node, path, "target"), path + ".target"),
                        expression(field(node, path, "source"), path + ".source"));
            case "PrintStatement":
                return new PrintStatement(expression(field(node, path, "expression"), path + ".expression"));
            case "While":
                return new While(
                        expression(field(node, path, "test"), path + ".test"),
                        block(field(node, path, "body"), path + ".body"));
            case "FunctionDeclaration": {
                JsonNode ps = array(node, path, "params");
                List<Identifier> params = new ArrayList<>(ps.size());
                for (int i = 0; i < ps.size(); i++) {
                    params.add(identifier(ps.get(i), path + ".params[" + i + "]"));
                }
                return new FunctionDeclaration(
                        identifier(field(node, path, "name"), path + ".name"),
                        params,
                        expression(field(node, path, "body"), path + ".body"));
            }
            default:
                throw new AstFormatException(path, "unknown statement type '" + type + "'");
        }
    }

    // -------------------------
    // Expressions
    // -------------------------

    private ExprInterface expression(JsonNode node, String path) {
        String type = typeOf(node, path);
        switch (type) {
            case "BinaryExp":
                return new BinaryExp(
                        text(node, path, "operator"),
                        expression(field(node, path, "left"), path + ".left"),
                        expression(field(node, path, "right"), path + ".right"));
            case "UnaryExp":
                return new UnaryExp(
                        text(node, path, "operator"),
                        expression(field(node, path, "operand"), path + ".operand"));
            case "ConditionalExpression":
                return new ConditionalExpression(
                        expression(field(node, path, "test"), path + ".test"),
                        expression(field(node, path, "consequent"), path + ".consequent"),
                        expression(field(node, path, "alternate"), path + ".alternate"));
            case "Call":
                return new Call(
                        identifier(field(node, path, "callee"), path + ".callee"),
                        expressions(node, path, "args"));
            case "ArrayLiteral":
                return new ArrayLiteral(expressions(node, path, "elements"));
            case "Subscript":
                return new Subscript(
                        expression(field(node, path, "array"), path + ".array"),
                        expression(field(node, path, "index"), path + ".index"));
            case "Identifier":
                return identifier(node, path);
            case "Numeral": {
                JsonNode v = field(node, path, "value");
                if (!v.isNumber()) throw new AstFormatException(path + ".value", "expected a number");
                return new Numeral(v.asDouble());
            }
            case "Bool": {
                JsonNode v = field(node, path, "value");
                if (!v.isBoolean()) throw new AstFormatException(path + ".value", "expected a boolean");
                return new Bool(v.asBoolean());
            }
            default:
                throw new AstFormatException(path, "unknown expression type '" + type + "'");
        }
    }

    private List<ExprInterface> expressions(JsonNode node, String path, String name) {
        JsonNode items = array(node, path, name);
        List<ExprInterface> out = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            out.add(expression(items.get(i), path + "." + name + "[" + i + "]"));
        }
        return out;
    }

    private Identifier identifier(JsonNode node, String path) {
        expectType(node, path, "Identifier");
        return new Identifier(text(node, path, "name"));
    }

    // -------------------------
    // Helpers
    // -------------------------

    private static String typeOf(JsonNode node, String path) {
        if (node == null || !node.isObject()) {
            throw new AstFormatException(path, "expected a node object");
        }
        JsonNode t = node.get("type");
        if (t == null || !t.isTextual()) {
            throw new AstFormatException(path, "missing \"type\" discriminator");
        }
        return t.asText();
    }

    private static void expectType(JsonNode node, String path, String expected) {
        String actual = typeOf(node, path);
        if (!expected.equals(actual)) {
            throw new AstFormatException(path, "expected " + expected + ", got " + actual);
        }
    }

    private static JsonNode field(JsonNode node, String path, String name) {
        JsonNode v = node.get(name);
        if (v == null || v.isNull()) {
            throw new AstFormatException(path, "missing field '" + name + "'");
        }
        return v;
    }

    private static JsonNode array(JsonNode node, String path, String name) {
        JsonNode v = field(node, path, name);
        if (!v.isArray()) throw new AstFormatException(path + "." + name, "expected an array");
        return v;
    }

    private static String text(JsonNode node, String path, String name) {
        JsonNode v = field(node, path, name);
        if (!v.isTextual()) throw new AstFormatException(path + "." + name, "expected a string");
        return v.asText();
    }
}
