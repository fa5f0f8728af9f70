package stressrunner;

import java.util.ArrayList;
import java.util.List;
import java.util.ListIterator;

public class CmdUtils {
    public static String getArgForKey(List<String> a, String... keys) {
        ListIterator<String> it = a.listIterator();
        boolean found = false;
        while (it.hasNext()) {
            String val = it.next();
            if (!found && matches(val, keys)) {
                it.remove();
                found = true;
            } else if (found) {
                it.remove();
                return val;
            }
        }
        if (found)
            throw new IllegalArgumentException("Option " + keys[0] + " requires a value");
        return null;
    }

    public static List<String> getArgsForKey(List<String> a, String... keys) {
        List<String> result = new ArrayList<String>();
        String val;
        while ((val = getArgForKey(a, keys)) != null) {
            result.add(val);
        }
        return result;
    }

    public static Integer getIntArgForKey(List<String> a, String... keys) {
        String val = getArgForKey(a, keys);
        if (val == null)
            return null;
        try {
            return Integer.parseInt(val);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Option " + keys[0] + " expects a number, got '" + val + "'");
        }
    }

    public static boolean hasKey(List<String> a, String... keys) {
        boolean found = false;
        ListIterator<String> it = a.listIterator();
        while (it.hasNext()) {
            String val = it.next();
            if (matches(val, keys)) {
                it.remove();
                found = true;
            }
        }
        return found;
    }

    private static boolean matches(String val, String[] keys) {
        for (String key : keys) {
            if (key.equals(val))
                return true;
        }
        return false;
    }
}
