package work.pesc.kernel.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.pesc.kernel.runtime.Value;
import work.pesc.kernel.support.KernelTestSupport;

class PescRunnerTest {
    private static final ObjectMapper JSON = new ObjectMapper();

    @Test
    void runsSourceAgainstALongLivedEngine() {
        var runner = new PescRunner(KernelTestSupport.session().engine());
        var first = runner.run("1 2");
        assertEquals(RunResult.Status.SUCCESS, first.status());
        var second = runner.run("+");
        assertTrue(second.succeeded());
        assertEquals(List.of(Value.number(3)), second.stack());
        assertEquals(0, second.status().exitCode());
    }

    @Test
    void reportsParseErrorsWithPosition() {
        var runner = new PescRunner(KernelTestSupport.session().engine());
        var result = runner.run("1 2 `");
        assertEquals(RunResult.Status.PARSE_ERROR, result.status());
        assertEquals(4, result.position());
        assertEquals("at 4: unknown function: '`'", result.error());
        assertEquals(1, result.status().exitCode());
        assertTrue(result.stack().isEmpty());
    }

    @Test
    void reportsEvaluationErrorsWithBothStacks() {
        var runner = new PescRunner(KernelTestSupport.session().engine());
        var result = runner.run("1 \"a\" +");
        assertEquals(RunResult.Status.EVAL_ERROR, result.status());
        assertEquals("<sym '+'>: expected number, got \"a\"", result.error());
        assertEquals(List.of(Value.number(1), Value.text("a")), result.stack());
        assertEquals(List.of(Value.number(1)), result.failedStack());
        assertFalse(result.succeeded());
    }

    @Test
    void serializesToJson() throws Exception {
        var runner = new PescRunner(KernelTestSupport.session().engine());
        var result = runner.run("\"s\" 2 {T} [f]");
        JsonNode json = JSON.readTree(result.toPrettyJson());
        assertEquals("success", json.get("status").asText());
        var stack = json.get("stack");
        assertEquals(4, stack.size());
        assertEquals("string", stack.get(0).get("type").asText());
        assertEquals(2.0, stack.get(1).get("value").asDouble());
        assertEquals("macro", stack.get(2).get("type").asText());
        assertTrue(stack.get(2).get("value").get(0).get("value").asBoolean());
        assertEquals("f", stack.get(3).get("value").asText());
    }

    @Test
    void uncheckedFailuresBecomeEvaluationErrors() {
        var engine = KernelTestSupport.session().engine();
        engine.register('x', "explode", e -> {
            e.clear();
            throw new IllegalStateException("boom");
        });
        var runner = new PescRunner(engine);
        var result = runner.run("1 x 2");
        assertEquals(RunResult.Status.EVAL_ERROR, result.status());
        assertEquals("IllegalStateException: boom", result.error());
        assertEquals(List.of(Value.number(1)), result.stack());

        assertTrue(runner.run("2+").succeeded());
        assertEquals(List.of(Value.number(3)), engine.stack());
    }
}
