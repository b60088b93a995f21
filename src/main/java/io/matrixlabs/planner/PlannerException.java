package io.matrixlabs.planner;

/** Bad planner input: an invalid configuration or a malformed JSON document */
public class PlannerException extends Exception {

    private static final long serialVersionUID = 3187224915046301723L;

    public PlannerException(String message) {
        super(message);
    }

    public PlannerException(String message, Throwable e) {
        super(message, e);
    }
}
