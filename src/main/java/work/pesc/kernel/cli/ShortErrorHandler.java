package work.pesc.kernel.cli;

import picocli.CommandLine;
import work.pesc.kernel.api.RunResult;
import work.pesc.kernel.runtime.PescException;

/**
 * Prints one {@code error: ...} line for a failed command, in the same form the interpreter reports language errors.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        commandLine.getErr().println(commandLine.getColorScheme().errorText("error: " + describe(ex)));
        if (Boolean.getBoolean("pesc.debug")) {
            ex.printStackTrace(commandLine.getErr());
        }
        if (languageError(ex) != null) {
            return RunResult.Status.EVAL_ERROR.exitCode();
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    static String describe(Throwable ex) {
        PescException language = languageError(ex);
        if (language != null) {
            return language.getMessage();
        }
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            return ex.getClass().getSimpleName();
        }
        return message;
    }

    private static PescException languageError(Throwable ex) {
        for (Throwable current = ex; current != null; current = current.getCause()) {
            if (current instanceof PescException pesc) {
                return pesc;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return null;
    }
}
