package symtab.exec;

import symtab.analysis.AnalysisPass;
import symtab.analysis.RangePropagation;
import symtab.hir.PrintTools;
import symtab.hir.Program;

import java.io.*;

/**
 * Holds the global option set and controls pass ordering.
 * The IR is built by a front end and handed to the constructor; the driver
 * then parses the command line and runs the range analyses over it.
 * Users may extend this class by overriding runPasses
 * (which provides a default sequence of passes).
 */
public class Driver
{
  /** Name of the options file read by -load-options. */
  public static final String OPTIONS_FILE = "options.symtab";

  /**
   * A mapping from option names to option values.
   */
  protected static CommandLineOptionSet options = new CommandLineOptionSet();

  static {
    registerOptions();
  }

  /**
   * The program the passes work on.
   */
  protected Program program;

  /** Result of the last range propagation run. */
  protected RangePropagation range_propagation;

  /**
   * Constructs a driver for the given program.
   *
   * @param program the program to be analyzed.
   */
  public Driver(Program program)
  {
    this.program = program;
  }

    /**
     * Register default legal set of options and default values for Driver.
     * Only registers options can have values set.
     */
  public static void registerOptions()
  {
    options.add(options.UTILITY, "dump-options",
                "Create file " + OPTIONS_FILE + " with default options");
    options.add(options.UTILITY, "load-options",
                "Load options from file " + OPTIONS_FILE);
    options.add(options.UTILITY, "help",
                "Print this message");
    options.add(options.UTILITY, "verbosity", "0", "N",
                "Degree of status messages (0-4) that you wish to see (default is 0)");
    options.add(options.ANALYSIS, "range", "1", "N",
      "Specifies the use of branch conditions in value ranges\n"
      + "      =0 disable refinement from branch conditions\n"
      + "      =1 refine value ranges on branch entry (default)");
    options.add(options.ANALYSIS, "simplify-steps", "4096", "N",
      "Maximum number of rewrite steps in a single symbolic simplification");
    options.add(options.ANALYSIS, "dnf-terms", "64", "N",
      "Maximum number of disjuncts when normalizing a condition");
  }

  /**
   * Returns the value of the given key or null
   * if the value is not set.  Key values are
   * set on the command line as <b>-option_name=value</b>.
   *
   * @param key The key to search
   * @return the value of the given key or null if the
   *   value is not set.
   */
  public static String getOptionValue(String key)
  {
    return options.getValue(key);
  }

  /**
   * Returns the integer value of the given key.
   *
   * @param key The key to search
   * @param default_value the value returned for unset or malformed options.
   * @return the integer value of the option.
   */
  public static int getIntOptionValue(String key, int default_value)
  {
    String value = getOptionValue(key);
    if (value == null)
      return default_value;
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException ex) {
      PrintTools.printlnStatus(0, "ignoring malformed value", value,
                               "of option", key);
      return default_value;
    }
  }

  /**
   * Sets the value of the option represented by <i>key</i> to
   * <i>value</i>. Unregistered options are ignored.
   *
   * @param key The option name.
   * @param value The option value.
   */
  public static void setOptionValue(String key, String value)
  {
    options.setValue(key, value);
  }

  protected void parseOption(String opt)
  {
      opt = opt.trim();
      // empty line
      if(opt.length()<2)
          return;
      int eq = opt.indexOf('=');

      // if value is not set
      if (eq == -1)
      {
        if (options.contains(opt))
          setOptionValue(opt, null);
        else
          System.err.println("ignoring unrecognized option " + opt);
      }
      // if value is set
      else
      {
        String option_name = opt.substring(0, eq);
        if (options.contains(option_name))
          setOptionValue(option_name, opt.substring(eq + 1));
        else
          System.err.println("ignoring unrecognized option " + option_name);
      }
  }

  /**
   * Parses command line options.
   *
   * @param args The String array passed to the driver.
   * @return true if the passes should run, false if the command line only
   *   asked for usage or an options dump.
   */
  public boolean parseCommandLine(String[] args)
  {
    for (int i = 0; i < args.length; ++i)
    {
      String opt = args[i];
      // options start with "-"
      if (opt.length() < 2 || opt.charAt(0) != '-')
      {
        System.err.println("ignoring argument " + opt);
        continue;
      }

      int eq = opt.indexOf('=');

      // if value is not set
      if (eq == -1)
      {
        String option_name = opt.substring(1);
        // no value on the command line, so just set it to "1"
        if (options.contains(option_name))
          setOptionValue(option_name, "1");
        else
          System.err.println("ignoring unrecognized option " + option_name);
      }
      // if value is set
      else
      {
        String option_name = opt.substring(1, eq);
        if (options.contains(option_name))
          setOptionValue(option_name, opt.substring(eq + 1));
        else
          System.err.println("ignoring unrecognized option " + option_name);
      }

      if (getOptionValue("help") != null)
      {
        setOptionValue("help", null);
        printUsage();
        return false;
      }

      if (getOptionValue("dump-options") != null)
      {
        setOptionValue("dump-options", null);
        dumpOptionsFile(new File(OPTIONS_FILE));
        return false;
      }

      // load options file and then proceed with rest
      // of command line options
      if (getOptionValue("load-options") != null)
      {
        setOptionValue("load-options", null);
        loadOptionsFile(new File(OPTIONS_FILE));
        // prevent reentering this handler
        setOptionValue("load-options", null);
      }
    }
    return true;
  }

  public void printUsage()
  {
    String usage = "\nsymtab.exec.Driver [option]...\n";
    usage += options.getUsage();
    System.err.println(usage);
  }

    /**
     * Dumps the current options to the given file; an existing file is not
     * overwritten.
     *
     * @param options_file the file to be created.
     */
  public void dumpOptionsFile(File options_file)
  {
    try {
      if (options_file.createNewFile()) {
        PrintStream ps = new PrintStream(new FileOutputStream(options_file));
        ps.println(options.dumpOptions().trim());
        ps.close();
      }
    } catch (IOException e) {
      System.err.println("Error: Failed to dump " + options_file + ": " + e);
    }
  }

    /**
     * Loads options from the given file, one <b>name=value</b> per line.
     * Lines starting with '#' are comments.
     *
     * @param options_file the file to be read.
     */
  public void loadOptionsFile(File options_file)
  {
    if (!options_file.exists()) {
      System.err.println("Error: Failed to load " + options_file);
      System.err.println("Use option -dump-options to create "
                         + OPTIONS_FILE + " with default values");
      return;
    }
    BufferedReader br = null;
    try {
      br = new BufferedReader(new FileReader(options_file));
      String line;
      while ((line = br.readLine()) != null)
      {
        // Remove comments
        if (line.startsWith("#"))
          continue;
        parseOption(line);
      }
    } catch (IOException e) {
      System.err.println("Error while loading options file: " + e);
    } finally {
      if (br != null) {
        try {
          br.close();
        } catch (IOException e) {
          System.err.println("Error while closing options file: " + e);
        }
      }
    }
  }

  /**
   * Runs the default sequence of passes over the program.
   */
  public void runPasses()
  {
    range_propagation = new RangePropagation(program);
    AnalysisPass.run(range_propagation);
  }

  /**
   * Runs this driver with args as the command line.
   *
   * @param args The command line options.
   */
  public void run(String[] args)
  {
    if (!parseCommandLine(args))
      return;

    runPasses();

    PrintTools.printlnStatus(1, "[Driver]",
                             range_propagation.getSafeIndexings().size(),
                             "indexing(s) proved to be within bounds");
  }

  /**
   * Returns the range propagation computed by the last run.
   *
   * @return the pass object, or null if no pass has run.
   */
  public RangePropagation getRangePropagation()
  {
    return range_propagation;
  }
}
