package it.unimib.datai.clout.controlplane.execution;

import it.unimib.datai.clout.common.model.FunctionRegistration;
import it.unimib.datai.clout.common.model.RuntimeKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessFunctionInvokerTest {

    @TempDir
    Path tempDir;

    private String runScript(String interpreter, String script, String input) throws Exception {
        ScriptFunctionInvoker invoker = new ScriptFunctionInvoker();
        FunctionRegistration function = new FunctionRegistration("id", "script", RuntimeKind.SCRIPT, interpreter,
                null, true, "blob", null, Instant.now());
        try (FunctionWorkspace workspace = FunctionWorkspace.open(tempDir, "script")) {
            Path code = workspace.write(script.getBytes(StandardCharsets.UTF_8), invoker.codeFileSuffix());
            return invoker.invoke(function, code, input.getBytes(StandardCharsets.UTF_8), workspace);
        }
    }

    @Test
    void script_readsStdin_andWritesStdout() throws Exception {
        String output = runScript("sh", "read line\necho \"got:$line\"\n", "hello\n");

        assertThat(output).isEqualTo("got:hello\n");
        try (var files = Files.list(tempDir)) {
            assertThat(files).isEmpty();
        }
    }

    @Test
    void script_nonZeroExit_carriesStderr() {
        assertThatThrownBy(() -> runScript("sh", "echo broken >&2\nexit 3\n", ""))
                .isInstanceOfSatisfying(ProcessExitException.class, e -> {
                    assertThat(e.exitCode()).isEqualTo(3);
                    assertThat(e.stderr()).isEqualTo("broken");
                });
    }

    @Test
    void script_interrupted_killsProcess() throws Exception {
        CompletableFuture<Thread> runner = new CompletableFuture<>();
        CompletableFuture<String> result = CompletableFuture.supplyAsync(() -> {
            runner.complete(Thread.currentThread());
            try {
                return runScript("sh", "sleep 30\n", "");
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        });
        Thread thread = runner.get(5, TimeUnit.SECONDS);
        Thread.sleep(300);
        thread.interrupt();

        assertThatThrownBy(() -> result.get(10, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasRootCauseInstanceOf(InterruptedException.class);
    }

    @Test
    void script_verify_requiresInterpreterAndContent() throws Exception {
        ScriptFunctionInvoker invoker = new ScriptFunctionInvoker();
        Path empty = Files.createFile(tempDir.resolve("empty.sh"));
        Path script = Files.writeString(tempDir.resolve("ok.sh"), "echo hi");

        assertThat(invoker.verify(script, "sh", null).resolved()).isTrue();
        assertThat(invoker.verify(script, " ", null).resolved()).isFalse();
        assertThat(invoker.verify(empty, "sh", null).resolved()).isFalse();
    }

    @Test
    void native_runsExecutableWithArguments() throws Exception {
        NativeFunctionInvoker invoker = new NativeFunctionInvoker();
        FunctionRegistration function = new FunctionRegistration("id", "native", RuntimeKind.NATIVE, "one two",
                null, true, "blob", null, Instant.now());
        try (FunctionWorkspace workspace = FunctionWorkspace.open(tempDir, "native")) {
            Path code = workspace.write("#!/bin/sh\necho \"$1-$2\"\n".getBytes(StandardCharsets.UTF_8),
                    invoker.codeFileSuffix());

            assertThat(invoker.invoke(function, code, new byte[0], workspace)).isEqualTo("one-two\n");
        }
    }
}
