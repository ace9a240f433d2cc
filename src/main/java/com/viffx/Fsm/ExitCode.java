package com.viffx.Fsm;

/**
 * Unix exit codes of the command line front end
 */
public enum ExitCode {
    /** Successful exit */
    SUCCESS(0),
    /** Source or output file could not be read or written */
    ERROR_IO(2),
    /** The source does not match the grammar */
    ERROR_PARSER(3),
    /** Bad command line argument */
    ERROR_COMMAND(5);

    final int code;

    ExitCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
