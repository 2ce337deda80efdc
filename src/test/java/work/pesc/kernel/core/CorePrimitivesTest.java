package work.pesc.kernel.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.pesc.kernel.runtime.ErrorKind;
import work.pesc.kernel.runtime.EvalException;
import work.pesc.kernel.runtime.Value;
import work.pesc.kernel.support.KernelTestSupport;

class CorePrimitivesTest {
    @Test
    void arithmeticUsesTheDeeperOperandOnTheLeft() throws Exception {
        var session = KernelTestSupport.session();
        assertEquals(KernelTestSupport.numbers(7, -1, 12, 0.5, 1, 8), session.run("3 4+ 3 4- 3 4* 2 4/ 7 3% 2 3^"));
    }

    @Test
    void divisionByZeroFollowsFloatingPoint() throws Exception {
        var session = KernelTestSupport.session();
        var stack = session.run("1 0/");
        assertTrue(Double.isInfinite(((Value.Num) stack.get(0)).value()));
    }

    @Test
    void comparisonsAndLogic() throws Exception {
        var session = KernelTestSupport.session();
        var stack = session.run("1 2< 1 2> \"a\" \"a\"= 1 \"1\"= T F& T F| 0'");
        assertEquals(List.of(
            Value.bool(true),
            Value.bool(false),
            Value.bool(true),
            Value.bool(false),
            Value.bool(false),
            Value.bool(true),
            Value.bool(true)
        ), stack);
    }

    @Test
    void equalityComparesBlocksStructurally() throws Exception {
        var session = KernelTestSupport.session();
        assertEquals(List.of(Value.bool(true)), session.run("{1 {2}} {1 {2}}="));
    }

    @Test
    void stringHelpers() throws Exception {
        var session = KernelTestSupport.session();
        var stack = session.run("\"ab\" \"cd\"[concat]! \"héllo\"[len]! 12.5[str]! \" 1_0 \"[num]! [f][type]!");
        assertEquals(List.of(
            Value.text("abcd"),
            Value.number(5),
            Value.text("12.5"),
            Value.number(10),
            Value.text("function")
        ), stack);
    }

    @Test
    void numRejectsNonNumericText() {
        var session = KernelTestSupport.session();
        var ex = assertThrows(EvalException.class, () -> session.run("\"abc\"[num]!"));
        assertEquals(new ErrorKind.InvalidNumberLit("abc"), ex.kind());
        assertEquals(List.of(Value.text("abc"), Value.function("num")), session.engine().stack());
    }

    @Test
    void typeMismatchRollsBackTheOperands() {
        var session = KernelTestSupport.session();
        var ex = assertThrows(EvalException.class, () -> session.run("1 \"two\"+"));
        assertEquals(new ErrorKind.InvalidArgumentType("number", "\"two\""), ex.kind());
        assertEquals(Value.operator('+'), ex.token().orElseThrow());
        assertEquals(List.of(Value.number(1), Value.text("two")), session.engine().stack());
    }
}
