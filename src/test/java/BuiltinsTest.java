import com.txscript.script.error.ErrorKind;
import com.txscript.script.runtime.Value;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class BuiltinsTest {

    @Test
    void pure_builtins() {
        ScriptHarness h = new ScriptHarness().start(
                "var a = abs(-5)",
                "var b = min(3, 1, 2)",
                "var c = max(1, 2.5)",
                "var d = len([1, 2, 3])",
                "var e = hex(255)",
                "var f = hex([0x0A, 0xFF])",
                "var g = int(\"0x1F\") + int(2.9)",
                "var s = str(12) + \"!\"",
                "var r = random(5, 5)");

        assertTrue(h.runtimeErrors().isEmpty(), () -> h.runtimeErrors().toString());
        assertEquals(5, h.intGlobal("a"));
        assertEquals(1, h.intGlobal("b"));
        assertEquals(Value.floating(2.5), h.global("c"));
        assertEquals(3, h.intGlobal("d"));
        assertEquals("0xFF", h.global("e").asString());
        assertEquals("0A FF", h.global("f").asString());
        assertEquals(33, h.intGlobal("g"));
        assertEquals("12!", h.global("s").asString());
        assertEquals(5, h.intGlobal("r"));
    }

    @Test
    void bad_arguments_become_runtime_errors() {
        ScriptHarness h = new ScriptHarness().start(
                "var a = len(5)",
                "var b = abs(1, 2)",
                "var c = int(\"nope\")",
                "var d = 1 / 0");

        List<ErrorKind> kinds = h.runtimeErrors().stream().map(e -> e.getKind()).collect(Collectors.toList());
        assertEquals(List.of(ErrorKind.TYPE_ERROR, ErrorKind.ARITY_MISMATCH, ErrorKind.INVALID_ARGUMENT,
                ErrorKind.INVALID_ARGUMENT), kinds);
    }

    @Test
    void host_functions_are_callable_and_runtime_names_are_reserved() {
        ScriptHarness h = new ScriptHarness();
        h.engine.registerFunction("crc8", args -> Value.integer(args.get(0).asBytes().length * 7L));

        assertThrows(IllegalArgumentException.class, () -> h.engine.registerFunction("now", args -> Value.voidValue()));
        assertTrue(h.engine.builtinNames().contains("now"));
        assertTrue(h.engine.parse("function crc8(b) { return 0 }").hasErrors());
    }
}
