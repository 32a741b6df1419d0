package symtab.hir;

import symtab.exec.Driver;

import java.util.*;

/**
* <b>PrintTools</b> provides tools that perform printing of collections of IR
* or debug messages.
*/
public final class PrintTools {

    // Short names for system properties
    public static final String line_sep = System.getProperty("line.separator");

    private PrintTools() {
    }

    /**
    * Prints a string to System.err if the
    * verbosity level is greater than min_verbosity.
    *
    * @param message The message to be printed.
    * @param min_verbosity An integer to compare with the value
    *   set by the -verbosity command-line flag.
    */
    public static void printlnStatus(String message, int min_verbosity) {
        if (getVerbosity() >= min_verbosity) {
            System.err.println(message);
        }
    }

    /**
    * Prints the specified items to {@link System#err} with separating
    * white spaces if verbosity is greater than {@code min_verbosity}.
    * This method minimizes overheads from string composition since it is done
    * only if the verbosity level is met.
    * @param min_verbosity the minium verbosity.
    * @param items the list of items to be printed.
    */
    public static void printlnStatus(int min_verbosity, Object... items) {
        if (min_verbosity <= getVerbosity()) {
            if (items.length > 0) {
                StringBuilder sb = new StringBuilder(80);
                sb.append(items[0]);
                for (int i = 1; i < items.length; i++) {
                    sb.append(" ").append(items[i]);
                }
                System.err.println(sb.toString());
            }
        }
    }

    /**
    * Prints a string to System.out if the
    * verbosity level is greater than min_verbosity.
    *
    * @param message The message to be printed.
    * @param min_verbosity An integer to compare with the value
    *   set by the -verbosity command-line flag.
    */
    public static void println(String message, int min_verbosity) {
        if (getVerbosity() >= min_verbosity) {
            System.out.println(message);
        }
    }

    /**
    * Returns the global verbosity level. The level is read from the option
    * set on every call, so a change through
    * {@link Driver#setOptionValue(String, String)} takes effect immediately.
    */
    public static int getVerbosity() {
        String value = Driver.getOptionValue("verbosity");
        if (value == null) {
            return 0;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            return 0;
        }
    }

    /**
    * Converts a list of objects to a string with the given separator.
    *
    * @param list the list to be converted.
    * @param separator the separating string.
    * @return the converted string.
    */
    public static String listToString(List<?> list, String separator) {
        if (list == null || list.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(80);
        sb.append(list.get(0));
        int list_size = list.size();
        for (int i = 1; i < list_size; i++) {
            sb.append(separator).append(list.get(i));
        }
        return sb.toString();
    }

    /** Converts a map to a string. */
    public static String mapToString(Map<?, ?> map, String separator) {
        if (map == null || map.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(80);
        Iterator<?> iter = map.keySet().iterator();
        Object key = iter.next();
        sb.append(key).append(":").append(map.get(key));
        while (iter.hasNext()) {
            key = iter.next();
            sb.append(separator).append(key).append(":").append(map.get(key));
        }
        return sb.toString();
    }
}
