package stressrunner;

public class WorkerFailedException extends Exception {
    private static final long serialVersionUID = 1L;

    public WorkerFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
