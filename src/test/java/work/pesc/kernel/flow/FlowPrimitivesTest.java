package work.pesc.kernel.flow;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.pesc.kernel.runtime.ErrorKind;
import work.pesc.kernel.runtime.EvalException;
import work.pesc.kernel.runtime.Value;
import work.pesc.kernel.support.KernelTestSupport;

class FlowPrimitivesTest {
    @Test
    void execRunsBlocksAndFunctionReferences() throws Exception {
        var session = KernelTestSupport.session();
        assertEquals(KernelTestSupport.numbers(3, 12), session.run("{1 2+}! 3 4[mul]!"));
    }

    @Test
    void execOfALiteralFails() {
        var session = KernelTestSupport.session();
        var ex = assertThrows(EvalException.class, () -> session.run("5!"));
        assertEquals(new ErrorKind.InvalidArgumentType("macro/function", "5"), ex.kind());
        assertEquals(KernelTestSupport.numbers(5), session.engine().stack());
    }

    @Test
    void ifChoosesABranchByCoercedCondition() throws Exception {
        var session = KernelTestSupport.session();
        assertEquals(List.of(Value.text("yes"), Value.text("no")),
            session.run("1 {\"yes\"} {\"no\"}? \"\" {\"yes\"} {\"no\"}?"));
    }

    @Test
    void whenSkipsFalseConditions() throws Exception {
        var session = KernelTestSupport.session();
        assertEquals(KernelTestSupport.numbers(1), session.run("T {1}[when]! F {2}[when]!"));
    }

    @Test
    void whileLoopsUntilTheConditionFails() throws Exception {
        var session = KernelTestSupport.session();
        assertEquals(KernelTestSupport.numbers(5), session.run("0 {$5<} {1+}[while]!"));
    }

    @Test
    void timesRepeatsTheBody() throws Exception {
        var session = KernelTestSupport.session();
        assertEquals(KernelTestSupport.numbers(8), session.run("1 3 {2*}[times]! 0 {1+}[times]!"));
    }

    @Test
    void mapReplacesTheTopValues() throws Exception {
        var session = KernelTestSupport.session();
        assertEquals(KernelTestSupport.numbers(9, 1, 4, 9), session.run("9 1 2 3 {$*} 3[map]!"));
    }

    @Test
    void mapFailureRollsBackEverything() {
        var session = KernelTestSupport.session();
        assertThrows(EvalException.class, () -> session.run("1 \"two\" {1+} 2[map]!"));
        assertEquals(List.of(
            Value.number(1),
            Value.text("two"),
            Value.block(List.of(Value.number(1), Value.operator('+'))),
            Value.number(2),
            Value.function("map")
        ), session.engine().stack());
    }

    @Test
    void tryRestoresTheStackAndRunsTheHandler() throws Exception {
        var session = KernelTestSupport.session();
        var stack = session.run("7 {1 2 \"x\"+} {[type]!}[try]!");
        assertEquals(List.of(Value.number(7), Value.text("string")), stack);
    }

    @Test
    void tryLeavesSuccessfulBodiesAlone() throws Exception {
        var session = KernelTestSupport.session();
        assertEquals(KernelTestSupport.numbers(3), session.run("{1 2+} {\"unused\"}[try]!"));
    }

    @Test
    void recursionThroughDefinedFunctions() throws Exception {
        var session = KernelTestSupport.session();
        session.run("{$ 1> {$ 1- [fact]! *} {} ?} [fact][def]!");
        assertEquals(KernelTestSupport.numbers(120), session.run("5[fact]!"));
    }

    @Test
    void mapChecksTheCountBeforeTakingItems() {
        var session = KernelTestSupport.session();
        var ex = assertThrows(EvalException.class, () -> session.run("1 {1+} 3[map]!"));
        assertEquals(new ErrorKind.NotEnoughArguments(), ex.kind());
        assertEquals(List.of(Value.number(1), Value.block(List.of(Value.number(1), Value.operator('+'))),
            Value.number(3), Value.function("map")), session.engine().stack());
    }

    @Test
    void mapRejectsCountsThatAreNotIndices() {
        var session = KernelTestSupport.session();
        var ex = assertThrows(EvalException.class, () -> session.run("1 {1+} 3000000000[map]!"));
        assertEquals(new ErrorKind.InvalidArgumentType("index", "3000000000"), ex.kind());
        assertEquals(4, session.engine().depth());

        session.engine().clear();
        ex = assertThrows(EvalException.class, () -> session.run("1 {1+} 0.5[map]!"));
        assertEquals(new ErrorKind.InvalidArgumentType("index", "0.5"), ex.kind());
    }
}
