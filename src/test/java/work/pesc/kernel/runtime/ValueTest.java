package work.pesc.kernel.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.Test;

class ValueTest {
    @Test
    void displaysEachVariant() {
        assertEquals("\"hi there\"", Value.text("hi there").toString());
        assertEquals("3", Value.number(3).toString());
        assertEquals("1000.5", Value.number(1_000.5).toString());
        assertEquals("-0", Value.number(-0.0).toString());
        assertEquals("inf", Value.number(Double.POSITIVE_INFINITY).toString());
        assertEquals("<fn add>", Value.function("add").toString());
        assertEquals("<sym '+'>", Value.operator('+').toString());
        assertEquals("(true)", Value.bool(true).toString());
        assertEquals("<mac {1 \"a\"}>", Value.block(List.of(Value.number(1), Value.text("a"))).toString());
    }

    @Test
    void formatsNumbersWithoutExponents() {
        assertEquals("100000000000000000000", Value.formatNumber(1e20));
        assertEquals("0.0001", Value.formatNumber(1e-4));
        assertEquals("-2.5", Value.formatNumber(-2.5));
        assertEquals("NaN", Value.formatNumber(Double.NaN));
    }

    @Test
    void sourceFormReadsBackAsTheSameValue() throws Exception {
        var registry = new Registry().alias('+', "add");
        var engine = new Engine(registry);
        var values = List.of(
            Value.text("a \\ b"),
            Value.number(1000.5),
            Value.number(-3),
            Value.number(Double.NEGATIVE_INFINITY),
            Value.function("do it"),
            Value.bool(false),
            Value.operator('+'),
            Value.block(List.of(Value.number(1), Value.block(List.of(Value.operator('+'))), Value.bool(true)))
        );
        for (Value value : values) {
            assertEquals(List.of(value), engine.parse(value.toSource()).tokens(), value.toSource());
        }
    }

    @Test
    void typeNames() {
        assertEquals("string", Value.text("").typeName());
        assertEquals("number", Value.number(0).typeName());
        assertEquals("function", Value.function("f").typeName());
        assertEquals("macro", Value.block(List.of()).typeName());
        assertEquals("symbol", Value.operator('x').typeName());
        assertEquals("boolean", Value.bool(true).typeName());
    }
}
