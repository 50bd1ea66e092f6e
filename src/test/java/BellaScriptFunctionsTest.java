import static com.bella.script.ast.Ast.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.bella.script.BellaScript;
import com.bella.script.interpreter.BellaError;
import com.bella.script.interpreter.UserFunction;
import com.bella.script.interpreter.Value;

public class BellaScriptFunctionsTest {

    private BellaScript es;
    private List<String> printed;

    @BeforeEach
    void setUp() {
        es = new BellaScript();
        printed = new ArrayList<>();
        es.setOutput(printed::add);
    }

    @Test
    void recursiveFunction() {
        es.run(program(
                function("fact", List.of("n"),
                        conditional(binary("<=", id("n"), num(1)),
                                num(1),
                                binary("*", id("n"), call("fact", binary("-", id("n"), num(1)))))),
                print(call("fact", num(5))),
                print(call("fact", num(10)))));

        assertEquals(List.of("120", "3628800"), printed);
    }

    @Test
    void closureSeesLaterBindingsOfItsFrame() {
        es.run(program(
                function("addY", List.of("x"), binary("+", id("x"), id("y"))),
                let("y", num(1)),
                print(call("addY", num(2))),
                assign("y", num(10)),
                print(call("addY", num(2)))));

        assertEquals(List.of("3", "12"), printed);
    }

    @Test
    void scopingIsLexicalNotDynamic() {
        // g's parameter 'a' must not be visible inside f
        BellaError.UnboundVariableError ex = assertThrows(BellaError.UnboundVariableError.class, () -> es.run(program(
                function("f", List.of("n"), binary("+", id("a"), id("n"))),
                function("g", List.of("a"), call("f", id("a"))),
                print(call("g", num(1))))));
        assertEquals("a", ex.subject());
    }

    @Test
    void parametersShadowOuterNames() {
        Map<String, Value> env = es.run(program(
                let("n", num(100)),
                function("twice", List.of("n"), binary("*", num(2), id("n"))),
                print(call("twice", num(4))),
                print(id("n"))));

        assertEquals(List.of("8", "100"), printed);
        assertEquals(100.0, env.get("n").asNumber(), 0.0);
    }

    @Test
    void callFrameDoesNotLeakIntoCaller() {
        assertThrows(BellaError.UnboundVariableError.class, () -> es.run(program(
                function("id1", List.of("p"), id("p")),
                print(call("id1", num(1))),
                print(id("p")))));
        assertEquals(List.of("1"), printed);
    }

    @Test
    void functionValuesAreSharedByReference() {
        Map<String, Value> env = es.run(program(
                function("square", List.of("n"), binary("*", id("n"), id("n"))),
                let("sq", id("square")),
                print(call("sq", num(6))),
                print(id("sq"))));

        assertEquals(List.of("36", "<function square>"), printed);
        assertSame(env.get("square").asFunc(), env.get("sq").asFunc());
        UserFunction fn = (UserFunction) env.get("square").asFunc();
        assertEquals(List.of("n"), fn.params());
    }

    @Test
    void arraysPassedToFunctionsAreNotCopied() {
        Map<String, Value> env = es.run(program(
                let("a", array(num(1), num(2))),
                function("same", List.of("x"), id("x")),
                let("b", call("same", id("a")))));

        assertSame(env.get("a").asArray(), env.get("b").asArray());
    }

    @Test
    void zeroArityFunction() {
        es.run(program(
                function("answer", List.of(), num(42)),
                print(call("answer"))));
        assertEquals(List.of("42"), printed);
    }

    @Test
    void arityIsChecked() {
        BellaError.ArityMismatchError few = assertThrows(BellaError.ArityMismatchError.class, () -> es.run(program(
                function("add", List.of("a", "b"), binary("+", id("a"), id("b"))),
                print(call("add", num(1))))));
        assertTrue(few.getMessage().contains("expects 2"));

        assertThrows(BellaError.ArityMismatchError.class, () -> es.evaluate(call("sqrt", num(1), num(2))));
        assertThrows(BellaError.ArityMismatchError.class, () -> es.evaluate(call("hypot", num(1))));
    }

    @Test
    void callingNonFunctionFails() {
        BellaError.NotCallableError ex = assertThrows(BellaError.NotCallableError.class, () -> es.run(program(
                let("x", num(3)),
                print(call("x", num(1))))));
        assertEquals("x", ex.subject());

        assertThrows(BellaError.NotCallableError.class, () -> es.evaluate(call("π")));
        assertThrows(BellaError.UnboundVariableError.class, () -> es.evaluate(call("nothing")));
    }

    @Test
    void calleeIsResolvedBeforeArguments() {
        List<Double> seen = new ArrayList<>();
        es.registerFunction("probe", 1, args -> {
            seen.add(args[0]);
            return Value.number(args[0]);
        });
        assertThrows(BellaError.NotCallableError.class, () -> es.evaluate(call("π", call("probe", num(1)))));
        assertTrue(seen.isEmpty());
    }

    @Test
    void duplicateParameterNamesFailAtCall() {
        assertThrows(BellaError.RedeclarationError.class, () -> es.run(program(
                function("bad", List.of("a", "a"), id("a")),
                print(call("bad", num(1), num(2))))));
    }

    @Test
    void functionNameCannotBeDeclaredTwice() {
        assertThrows(BellaError.RedeclarationError.class, () -> es.run(program(
                function("f", List.of(), num(1)),
                function("f", List.of(), num(2)))));

        assertThrows(BellaError.RedeclarationError.class, () -> es.run(program(
                function("sqrt", List.of("x"), id("x")))));
    }

    @Test
    void nativeFunctionsRejectNonNumbers() {
        BellaError.TypeError ex = assertThrows(BellaError.TypeError.class,
                () -> es.evaluate(call("sqrt", array(num(4)))));
        assertEquals("sqrt", ex.subject());
        assertThrows(BellaError.TypeError.class, () -> es.evaluate(call("cos", bool(true))));
    }

    @Test
    void hostRegisteredFunction() {
        es.registerFunction("clamp01", 1, args -> Value.number(Math.max(0, Math.min(1, args[0]))));
        es.run(program(
                print(call("clamp01", num(3))),
                print(call("clamp01", num(0.5)))));
        assertEquals(List.of("1", "0.5"), printed);
    }

    @Test
    void functionBodyMayCallOtherFunctions() {
        es.run(program(
                function("sq", List.of("x"), binary("*", id("x"), id("x"))),
                function("norm", List.of("x", "y"), call("sqrt", binary("+", call("sq", id("x")), call("sq", id("y"))))),
                print(call("norm", num(3), num(4)))));
        assertEquals(List.of("5"), printed);
    }
}
