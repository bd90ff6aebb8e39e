package it.unimib.datai.clout.controlplane.execution;

/**
 * A function process exited with a non-zero status.
 */
public class ProcessExitException extends Exception {
    private final int exitCode;
    private final String stderr;

    public ProcessExitException(int exitCode, String stderr) {
        super("Process exited with code " + exitCode + (stderr == null || stderr.isBlank() ? "" : ": " + stderr));
        this.exitCode = exitCode;
        this.stderr = stderr;
    }

    public int exitCode() {
        return exitCode;
    }

    public String stderr() {
        return stderr;
    }
}
