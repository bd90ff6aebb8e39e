package it.unimib.datai.clout.controlplane.execution;

import it.unimib.datai.clout.common.model.FunctionRegistration;
import it.unimib.datai.clout.common.model.RuntimeKind;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Hands the script to the interpreter command named by the entrypoint, e.g. {@code sh} or {@code python3 -u}.
 */
public class ScriptFunctionInvoker extends ProcessFunctionInvoker {

    @Override
    public RuntimeKind runtime() {
        return RuntimeKind.SCRIPT;
    }

    @Override
    public String codeFileSuffix() {
        return ".script";
    }

    @Override
    public Verification verify(Path code, String entrypoint, String declaringType) {
        if (entrypoint == null || entrypoint.isBlank()) {
            return Verification.failed("Script functions need an interpreter as entrypoint");
        }
        Verification content = requireContent(code);
        return content != null ? content : Verification.ok(null);
    }

    @Override
    protected List<String> command(FunctionRegistration function, Path code) {
        List<String> command = new ArrayList<>(arguments(function.entrypoint()));
        command.add(code.toAbsolutePath().toString());
        return command;
    }
}
