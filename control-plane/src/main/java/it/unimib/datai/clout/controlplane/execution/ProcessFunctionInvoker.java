package it.unimib.datai.clout.controlplane.execution;

import it.unimib.datai.clout.common.model.FunctionRegistration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Base for runtimes that run code in a child process: input goes to stdin, stdout is the output,
 * and a non-zero exit status is a failure. All three streams are redirected to workspace files so
 * neither side can block on a full pipe.
 */
public abstract class ProcessFunctionInvoker implements FunctionInvoker {
    private static final Logger log = LoggerFactory.getLogger(ProcessFunctionInvoker.class);
    private static final int STDERR_TAIL_CHARS = 2048;

    protected abstract List<String> command(FunctionRegistration function, Path code) throws IOException;

    @Override
    public String invoke(FunctionRegistration function, Path code, byte[] input, FunctionWorkspace workspace)
            throws Exception {
        List<String> command = command(function, code);
        Path stdin = workspace.write(input, ".in");
        Path stdout = workspace.newFile(".out");
        Path stderr = workspace.newFile(".err");
        Process process = new ProcessBuilder(command)
                .directory(workspace.directory().toFile())
                .redirectInput(stdin.toFile())
                .redirectOutput(stdout.toFile())
                .redirectError(stderr.toFile())
                .start();
        workspace.attach(process);
        log.debug("Function {} started process {} ({})", function.name(), process.pid(), command.get(0));
        try {
            int exitCode = process.waitFor();
            if (exitCode != 0) {
                throw new ProcessExitException(exitCode, tail(stderr));
            }
            return new String(Files.readAllBytes(stdout), StandardCharsets.UTF_8);
        } finally {
            workspace.destroyProcesses();
        }
    }

    protected static List<String> arguments(String argumentLine) {
        if (argumentLine == null || argumentLine.isBlank()) {
            return List.of();
        }
        return Arrays.asList(argumentLine.trim().split("\\s+"));
    }

    protected static Verification requireContent(Path code) {
        try {
            return Files.size(code) > 0 ? null : Verification.failed("Function code is empty");
        } catch (IOException e) {
            return Verification.failed("Function code is unreadable: " + e.getMessage());
        }
    }

    private static String tail(Path stderr) throws IOException {
        String text = new String(Files.readAllBytes(stderr), StandardCharsets.UTF_8).trim();
        return text.length() > STDERR_TAIL_CHARS ? text.substring(text.length() - STDERR_TAIL_CHARS) : text;
    }
}
