package com.mlops.cleanup.helm;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Exit status and captured output of an external command.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ShellResponse {

    public static final int ERROR_CODE_SUCCESS = 0;
    public static final int ERROR_CODE_TIMED_OUT = -1;

    private int code;

    private String output = "";

    private String error = "";

    public boolean isSuccess() {
        return code == ERROR_CODE_SUCCESS;
    }

    public boolean isTimedOut() {
        return code == ERROR_CODE_TIMED_OUT;
    }
}
