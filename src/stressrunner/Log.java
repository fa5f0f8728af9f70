package stressrunner;

import java.text.SimpleDateFormat;
import java.util.Date;

public class Log {
    public static final int ERROR = 0;
    public static final int WARN = 1;
    public static final int INFO = 2;
    public static final int DEBUG = 3;

    private static volatile int logLevel = WARN;

    private static String PREFIX_ERROR = (char) 27 + "[91mERROR: ";
    private static String PREFIX_WARN = (char) 27 + "[95mWARN: ";
    private static String SUFFIX_CLEAR = (char) 27 + "[0m";

    public static void setLevel(int level) {
        logLevel = level;
    }

    public static int getLevel() {
        return logLevel;
    }

    public static boolean isDebug() {
        return logLevel >= DEBUG;
    }

    public static void error(String message) {
        if (logLevel >= ERROR)
            print(PREFIX_ERROR + message + SUFFIX_CLEAR);
    }

    public static void warn(String message) {
        if (logLevel >= WARN)
            print(PREFIX_WARN + message + SUFFIX_CLEAR);
    }

    public static void info(String message) {
        if (logLevel >= INFO)
            print("INFO:  " + message);
    }

    public static void debug(String message) {
        if (logLevel >= DEBUG)
            print("    DEBUG: [" + Thread.currentThread().getName() + "] " + message);
    }

    public static void debug(Throwable e) {
        if (logLevel >= DEBUG) {
            synchronized (System.out) {
                e.printStackTrace(System.out);
            }
        }
    }

    public static void warn(String message, Throwable e) {
        if (logLevel >= WARN) {
            synchronized (System.out) {
                System.out.println(stamp() + PREFIX_WARN + message);
                e.printStackTrace(System.out);
                System.out.println(SUFFIX_CLEAR);
            }
        }
    }

    public static void error(String message, Throwable e) {
        if (logLevel >= ERROR) {
            synchronized (System.out) {
                System.out.println(stamp() + PREFIX_ERROR + message);
                e.printStackTrace(System.out);
                System.out.println(SUFFIX_CLEAR);
            }
        }
    }

    private static void print(String line) {
        synchronized (System.out) {
            System.out.println(stamp() + line);
        }
    }

    private static String stamp() {
        return new SimpleDateFormat("yyyy-MM-dd HH:mm:ss ").format(new Date());
    }
}
