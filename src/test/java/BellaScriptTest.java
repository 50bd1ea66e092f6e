import static com.bella.script.ast.Ast.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.bella.script.BellaScript;
import com.bella.script.interpreter.BellaError;
import com.bella.script.interpreter.Value;

public class BellaScriptTest {

    private BellaScript es;
    private List<String> printed;

    @BeforeEach
    void setUp() {
        es = new BellaScript();
        printed = new ArrayList<>();
        es.setOutput(printed::add);
    }

    private static Value v(Map<String, Value> env, String name) {
        Value val = env.get(name);
        assertNotNull(val, "Expected variable in env: " + name);
        return val;
    }

    @Test
    void declareAssignAndPrint() {
        Map<String, Value> env = es.run(program(
                let("x", num(100)),
                assign("x", unary("-", num(20))),
                print(binary("*", num(9), id("x")))));

        assertEquals(List.of("-180"), printed);
        assertEquals(-20.0, v(env, "x").asNumber(), 1e-9);
    }

    @Test
    void builtinSqrt() {
        es.run(program(print(call("sqrt", num(2)))));
        assertEquals(List.of("1.4142135623730951"), printed);
    }

    @Test
    void conditionalPicksAlternate() {
        es.run(program(print(conditional(binary("<", num(3), num(2)), num(1), num(0)))));
        assertEquals(List.of("0"), printed);
    }

    @Test
    void whileLoopCountsToTen() {
        Map<String, Value> env = es.run(program(
                let("y", num(0)),
                whileLoop(binary("<", id("y"), num(10)),
                        assign("y", binary("+", id("y"), num(1)))),
                print(id("y"))));

        assertEquals(List.of("10"), printed);
        assertEquals(10.0, v(env, "y").asNumber(), 1e-9);
    }

    @Test
    void userFunctionSquare() {
        es.run(program(
                function("square", List.of("n"), binary("*", id("n"), id("n"))),
                print(call("square", num(5)))));
        assertEquals(List.of("25"), printed);

        BellaError.ArityMismatchError ex = assertThrows(BellaError.ArityMismatchError.class, () -> es.run(program(
                function("square", List.of("n"), binary("*", id("n"), id("n"))),
                print(call("square", num(1), num(2))))));
        assertEquals("square", ex.subject());
        assertEquals("ArityMismatchError", ex.kind());
    }

    @Test
    void arraySubscript() {
        es.run(program(
                let("a", array(num(1), num(2), num(3))),
                print(subscript(id("a"), num(1)))));
        assertEquals(List.of("2"), printed);

        printed.clear();
        assertThrows(BellaError.IndexOutOfRangeError.class, () -> es.run(program(
                let("a", array(num(1), num(2), num(3))),
                print(subscript(id("a"), num(5))))));
        assertTrue(printed.isEmpty());
    }

    @Test
    void printsStopAtFirstError() {
        assertThrows(BellaError.UnboundVariableError.class, () -> es.run(program(
                print(num(1)),
                print(id("missing")),
                print(num(3)))));
        assertEquals(List.of("1"), printed);
    }

    @Test
    void blockDoesNotOpenScope() {
        Map<String, Value> env = es.run(program(
                block(let("inner", num(42))),
                print(id("inner"))));

        assertEquals(List.of("42"), printed);
        assertEquals(42.0, v(env, "inner").asNumber(), 1e-9);
    }

    @Test
    void declarationInsideLoopBodyFailsOnSecondIteration() {
        assertThrows(BellaError.RedeclarationError.class, () -> es.run(program(
                let("i", num(0)),
                whileLoop(binary("<", id("i"), num(2)),
                        let("t", id("i")),
                        assign("i", binary("+", id("i"), num(1)))))));
    }

    @Test
    void runsAreIndependent() {
        es.run(program(let("x", num(1))));
        Map<String, Value> env = es.run(program(let("x", num(2))));
        assertEquals(2.0, v(env, "x").asNumber(), 1e-9);
    }

    @Test
    void evaluateSingleExpression() {
        Value out = es.evaluate(binary("+", call("hypot", num(3), num(4)), num(1)));
        assertEquals(6.0, out.asNumber(), 1e-12);
    }

    @Test
    void snapshotKeepsBuiltins() {
        Map<String, Value> env = es.run(program(let("x", num(1))));
        assertEquals(Value.Type.FUNC, v(env, "sqrt").getType());
        assertEquals(Math.PI, v(env, "π").asNumber(), 0.0);
        assertThrows(UnsupportedOperationException.class, () -> env.put("y", Value.number(1)));
    }
}
