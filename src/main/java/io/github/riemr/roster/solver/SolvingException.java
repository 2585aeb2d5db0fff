package io.github.riemr.roster.solver;

/**
 * The solving backend failed for a reason other than infeasibility or timeout.
 */
public class SolvingException extends RuntimeException {

    public SolvingException(String message) {
        super(message);
    }

    public SolvingException(String message, Throwable cause) {
        super(message, cause);
    }
}
