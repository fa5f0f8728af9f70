package stressrunner;

public interface Rebuilder {
    void rebuild() throws BuildException;

    String revision() throws BuildException;
}
