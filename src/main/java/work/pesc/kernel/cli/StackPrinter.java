package work.pesc.kernel.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.PrintStream;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.jline.utils.AttributedStringBuilder;
import org.jline.utils.AttributedStyle;
import work.pesc.kernel.api.OutputMode;
import work.pesc.kernel.api.RunResult;
import work.pesc.kernel.runtime.Registry;
import work.pesc.kernel.runtime.Value;

/**
 * Renders the stack after each evaluation in one of the {@link OutputMode}s.
 */
final class StackPrinter {
    static final int PADDING = 11;
    static final String EMPTY = "(empty stack)";

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final AttributedStyle FRAME = AttributedStyle.DEFAULT.foreground(AttributedStyle.BRIGHT | AttributedStyle.BLACK);

    private final OutputMode mode;
    private final boolean color;
    private final int width;
    private final PrintStream out;

    StackPrinter(OutputMode mode, boolean color, int width, PrintStream out) {
        this.mode = Objects.requireNonNull(mode, "mode");
        this.color = color;
        this.width = width > 0 ? width : 80;
        this.out = Objects.requireNonNull(out, "out");
    }

    void print(List<Value> stack, Registry registry) {
        switch (mode) {
            case HUMAN:
                out.println(human(stack, registry));
                break;
            case SIMPLE:
                out.println(simple(stack));
                break;
            case MACHINE:
                out.println(machine(stack));
                break;
            case QUIET:
            default:
                break;
        }
        out.flush();
    }

    /**
     * Top of the stack first, one padded cell per value, with the depth of each cell on a second line.
     */
    String human(List<Value> stack, Registry registry) {
        if (stack.isEmpty()) {
            return EMPTY;
        }
        var items = new AttributedStringBuilder();
        var ruler = new AttributedStringBuilder().style(FRAME);
        int index = 0;
        for (int i = stack.size() - 1; i >= 0; i--) {
            Value value = stack.get(i);
            String item = String.format("%" + PADDING + "s", value.toString());
            int cellLength = item.length() + 2;
            if (items.length() + cellLength + 1 >= width) {
                items.append(" »");
                break;
            }
            items.styled(FRAME, "[").styled(styleOf(value, registry), item).styled(FRAME, "]");
            ruler.append(String.format("%" + cellLength + "d", index));
            index++;
        }
        return render(items) + System.lineSeparator() + render(ruler);
    }

    String simple(List<Value> stack) {
        if (stack.isEmpty()) {
            return EMPTY;
        }
        return stack.stream().map(Value::toString).collect(Collectors.joining(" "));
    }

    String machine(List<Value> stack) {
        try {
            return JSON.writeValueAsString(RunResult.serialize(stack));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize stack: " + ex.getMessage(), ex);
        }
    }

    private String render(AttributedStringBuilder builder) {
        return color ? builder.toAttributedString().toAnsi() : builder.toString();
    }

    private static AttributedStyle styleOf(Value value, Registry registry) {
        if (value instanceof Value.Text) {
            return AttributedStyle.DEFAULT.foreground(AttributedStyle.CYAN);
        }
        if (value instanceof Value.Num) {
            return AttributedStyle.DEFAULT.foreground(AttributedStyle.BRIGHT | AttributedStyle.WHITE);
        }
        if (value instanceof Value.FunctionRef ref) {
            return registry.contains(ref.name())
                ? AttributedStyle.DEFAULT.foreground(AttributedStyle.WHITE)
                : AttributedStyle.DEFAULT.foreground(AttributedStyle.RED);
        }
        if (value instanceof Value.Bool) {
            return AttributedStyle.DEFAULT.foreground(AttributedStyle.YELLOW);
        }
        return AttributedStyle.DEFAULT.foreground(AttributedStyle.WHITE);
    }
}
