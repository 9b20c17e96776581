package com.dbdrive.server.model.internal;

import lombok.Data;
import lombok.experimental.Accessors;

@Data
@Accessors(chain = true)
public class CommandResult {

    private boolean success;

    // -1 when the process threw before returning an exit code
    private int exitCode;

    private String output;

    private String error;

    private CommandResult() {}

    public static CommandResult success(int exitCode, String output) {
        return new CommandResult().setSuccess(true).setExitCode(exitCode).setOutput(output);
    }

    public static CommandResult failed(int exitCode, String error) {
        return new CommandResult().setSuccess(false).setExitCode(exitCode).setError(error);
    }
}
