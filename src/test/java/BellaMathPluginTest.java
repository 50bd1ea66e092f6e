import static com.bella.script.ast.Ast.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.bella.script.BellaScript;
import com.bella.script.ast.Expr.ExprInterface;
import com.bella.script.interpreter.NativeFunction;
import com.bella.script.interpreter.Value;

public class BellaMathPluginTest {

    private final BellaScript es = new BellaScript();

    private double eval(String fn, double... args) {
        ExprInterface[] exprs = new ExprInterface[args.length];
        for (int i = 0; i < args.length; i++) exprs[i] = num(args[i]);
        return es.evaluate(call(fn, exprs)).asNumber();
    }

    @Test
    void unaryFunctions() {
        assertEquals(Math.sin(1.0), eval("sin", 1.0), 0.0);
        assertEquals(Math.cos(1.0), eval("cos", 1.0), 0.0);
        assertEquals(3.0, eval("sqrt", 9.0), 0.0);
        assertEquals(Math.E, eval("exp", 1.0), 1e-15);
    }

    @Test
    void lnIsNaturalLogarithmFunction() {
        assertEquals(1.0, eval("ln", Math.E), 1e-15);
        assertEquals(0.0, eval("ln", 1.0), 0.0);
        assertEquals(Math.log(10), eval("ln", 10.0), 0.0);
        assertTrue(Double.isNaN(eval("ln", -1.0)));
    }

    @Test
    void hypotTakesTwoArguments() {
        assertEquals(5.0, eval("hypot", 3.0, 4.0), 0.0);
        NativeFunction hypot = (NativeFunction) es.evaluate(id("hypot")).asFunc();
        assertEquals(2, hypot.arity());
    }

    @Test
    void piIsConstant() {
        Value pi = es.evaluate(id("π"));
        assertEquals(Value.Type.NUMBER, pi.getType());
        assertEquals(Math.PI, pi.asNumber(), 0.0);
        assertEquals(0.0, eval("sin", Math.PI), 1e-15);
    }

    @Test
    void builtinNamesAreExposed() {
        assertTrue(es.builtinNames().containsAll(List.of("sin", "cos", "hypot", "sqrt", "exp", "ln", "π")));
    }
}
