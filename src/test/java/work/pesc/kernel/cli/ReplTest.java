package work.pesc.kernel.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import work.pesc.kernel.api.OutputMode;
import work.pesc.kernel.api.PescConfiguration;
import work.pesc.kernel.api.PescRunner;
import work.pesc.kernel.support.KernelTestSupport;

class ReplTest {
    @Test
    void countsOpenBlocksOutsideStringsAndComments() {
        assertEquals(0, Repl.openBlocks("1 2 {3}"));
        assertEquals(1, Repl.openBlocks("{1 {2}"));
        assertEquals(2, Repl.openBlocks("{{"));
        assertEquals(0, Repl.openBlocks("\"{\" [{] \\ { \\"));
        assertEquals(1, Repl.openBlocks("{ \\ } comment\n"));
        assertEquals(0, Repl.openBlocks("} {"));
    }

    @Test
    void stackSurvivesErrorsBetweenLines() {
        var buffer = new ByteArrayOutputStream();
        var out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        var config = PescConfiguration.builder().outputMode(OutputMode.SIMPLE).color(false).build();
        var repl = new Repl(new PescRunner(KernelTestSupport.session().engine()), config, out);

        repl.evaluateAndPrint("1 2", 80);
        repl.evaluateAndPrint("\"x\" +", 80);
        repl.evaluateAndPrint("`", 80);
        repl.evaluateAndPrint(",+", 80);

        String[] lines = buffer.toString(StandardCharsets.UTF_8).split("\\R");
        assertEquals("1 2", lines[0]);
        assertEquals("error: <sym '+'>: expected number, got \"x\"", lines[1]);
        assertEquals("1 2 \"x\"", lines[2]);
        assertEquals("error: at 0: unknown function: '`'", lines[3]);
        assertEquals("3", lines[4]);
    }

    @Test
    void sessionContinuesAfterAnExplodingFunction() {
        var buffer = new ByteArrayOutputStream();
        var out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        var config = PescConfiguration.builder().outputMode(OutputMode.SIMPLE).color(false).build();
        var engine = KernelTestSupport.session().engine();
        engine.register('x', "explode", e -> {
            throw new IllegalStateException("boom");
        });
        var repl = new Repl(new PescRunner(engine), config, out);

        repl.evaluateAndPrint("1 x", 80);
        repl.evaluateAndPrint("1+", 80);

        String[] lines = buffer.toString(StandardCharsets.UTF_8).split("\\R");
        assertEquals("error: IllegalStateException: boom", lines[0]);
        assertEquals("1", lines[1]);
        assertEquals("2", lines[2]);
    }
}
