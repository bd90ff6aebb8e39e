package it.unimib.datai.clout.controlplane.execution;

import it.unimib.datai.clout.common.model.FunctionRegistration;
import it.unimib.datai.clout.common.model.RuntimeKind;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the blob itself as an executable; the entrypoint, if any, is its argument line.
 */
public class NativeFunctionInvoker extends ProcessFunctionInvoker {

    @Override
    public RuntimeKind runtime() {
        return RuntimeKind.NATIVE;
    }

    @Override
    public Verification verify(Path code, String entrypoint, String declaringType) {
        Verification content = requireContent(code);
        return content != null ? content : Verification.ok(null);
    }

    @Override
    protected List<String> command(FunctionRegistration function, Path code) throws IOException {
        if (!code.toFile().setExecutable(true, true)) {
            throw new IOException("Cannot mark " + code + " as executable");
        }
        List<String> command = new ArrayList<>();
        command.add(code.toAbsolutePath().toString());
        command.addAll(arguments(function.entrypoint()));
        return command;
    }
}
