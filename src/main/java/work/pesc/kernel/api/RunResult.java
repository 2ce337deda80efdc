package work.pesc.kernel.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.pesc.kernel.runtime.Value;

/**
 * Outcome of a {@link PescRunner} execution (usable by the CLI and embedding apps).
 *
 * @param stack the live stack after the run, rolled back past any failed call
 * @param failedStack the stack as the failing call left it, empty unless evaluation failed
 */
public record RunResult(
    Status status,
    List<Value> stack,
    List<Value> failedStack,
    String error,
    Integer position,
    Instant startedAt,
    Instant finishedAt
) {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectWriter WRITER = JSON.writerWithDefaultPrettyPrinter();

    public RunResult {
        stack = List.copyOf(stack);
        failedStack = List.copyOf(failedStack);
    }

    public static RunResult success(List<Value> stack, Instant startedAt) {
        return new RunResult(Status.SUCCESS, stack, List.of(), null, null, startedAt, Instant.now());
    }

    public static RunResult parseFailure(String message, Integer position, List<Value> stack, Instant startedAt) {
        return new RunResult(Status.PARSE_ERROR, stack, List.of(), message, position, startedAt, Instant.now());
    }

    public static RunResult evalFailure(String message, List<Value> stack, List<Value> failedStack, Instant startedAt) {
        return new RunResult(Status.EVAL_ERROR, stack, failedStack, message, null, startedAt, Instant.now());
    }

    public boolean succeeded() {
        return status == Status.SUCCESS;
    }

    public Optional<String> errorMessage() {
        return Optional.ofNullable(error);
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase());
        serializable.put("stack", serialize(stack));
        if (error != null) {
            serializable.put("error", error);
        }
        if (position != null) {
            serializable.put("position", position);
        }
        if (!failedStack.isEmpty()) {
            serializable.put("failedStack", serialize(failedStack));
        }
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getMessage() + "\"}";
        }
    }

    public static List<Object> serialize(List<Value> values) {
        List<Object> out = new ArrayList<>(values.size());
        for (Value value : values) {
            out.add(serialize(value));
        }
        return out;
    }

    /**
     * JSON-friendly shape of a value: {@code {"type": ..., "value": ...}}; blocks nest their tokens.
     */
    public static Map<String, Object> serialize(Value value) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("type", value.typeName());
        if (value instanceof Value.Text text) {
            node.put("value", text.text());
        } else if (value instanceof Value.Num num) {
            double n = num.value();
            node.put("value", Double.isFinite(n) ? (Object) n : Value.formatNumber(n));
        } else if (value instanceof Value.FunctionRef ref) {
            node.put("value", ref.name());
        } else if (value instanceof Value.Block block) {
            node.put("value", serialize(block.tokens()));
        } else if (value instanceof Value.Operator op) {
            node.put("value", String.valueOf(op.symbol()));
        } else if (value instanceof Value.Bool bool) {
            node.put("value", bool.value());
        }
        return node;
    }

    public enum Status {
        SUCCESS(0),
        PARSE_ERROR(1),
        EVAL_ERROR(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
