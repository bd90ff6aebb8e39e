package it.unimib.datai.clout.controlplane.execution;

import it.unimib.datai.clout.common.model.FunctionRegistration;
import it.unimib.datai.clout.common.model.RuntimeKind;

import java.nio.file.Path;

/**
 * Runtime strategy: knows how to check and run code of one {@link RuntimeKind}.
 */
public interface FunctionInvoker {

    RuntimeKind runtime();

    default String codeFileSuffix() {
        return ".bin";
    }

    Verification verify(Path code, String entrypoint, String declaringType);

    /**
     * Runs the function and returns its output. Must honour thread interruption, which is
     * how timeouts and cancellation are delivered.
     */
    String invoke(FunctionRegistration function, Path code, byte[] input, FunctionWorkspace workspace)
            throws Exception;
}
