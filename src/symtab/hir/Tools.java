package symtab.hir;

/**
* Miscellaneous utilities shared by the passes.
*/
public final class Tools {

    private Tools() {
    }

    /**
    * Returns the current system time in seconds.
    *
    * @return the current time in seconds
    */
    public static double getTime() {
        return (System.currentTimeMillis() / 1000.0);
    }

    /**
    * Returns the elapsed time in seconds since the given reference time.
    *
    * @param since the reference time
    * @return the elapsed time in seconds
    */
    public static double getTime(double since) {
        return (System.currentTimeMillis() / 1000.0 - since);
    }
}
