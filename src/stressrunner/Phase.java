package stressrunner;

public enum Phase {
    CREATE, STRESS, TEST, RECOVER;

    public String label() {
        return name().toLowerCase();
    }
}
