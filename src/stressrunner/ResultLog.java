package stressrunner;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;

public class ResultLog {
    private final File file;

    public ResultLog(File file) {
        this.file = file;
    }

    public File getFile() {
        return file;
    }

    public void passed(RunInfo info) throws IOException {
        append("PASSED " + info.toTabString());
    }

    public void failed(RunInfo info) throws IOException {
        append("FAILED " + info.toTabString());
    }

    private synchronized void append(String line) throws IOException {
        FileUtils.writeStringToFile(file, line + "\n", StandardCharsets.UTF_8, true);
    }
}
