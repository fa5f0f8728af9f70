package stressrunner;

public class Killed extends Exception {
    private static final long serialVersionUID = 1L;

    public Killed(String message) {
        super(message);
    }
}
