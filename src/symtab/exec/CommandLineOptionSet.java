package symtab.exec;

import java.util.*;
import symtab.hir.PrintTools;

public class CommandLineOptionSet
{
  public final int ANALYSIS = 1;
  public final int UTILITY = 3;

  private class OptionRecord
  {
    public int option_type;
    public String value;
    public String arg;
    public String usage;

    public OptionRecord(int type, String usage)
    {
      this.option_type = type;
      this.value = null;
      this.arg = null;
      this.usage = usage;
    }

    public OptionRecord(int type, String value, String arg, String usage)
    {
      this.option_type = type;
      this.value = value;
      this.arg = arg;
      this.usage = usage;
    }
  }

  private TreeMap<String, OptionRecord> name_to_record;

  public CommandLineOptionSet()
  {
    name_to_record = new TreeMap<String, OptionRecord>();
  }

  public void add(int type, String name, String usage)
  {
    name_to_record.put(name, new OptionRecord(type, usage));
  }

  public void add(int type, String name, String value, String arg, String usage)
  {
    name_to_record.put(name, new OptionRecord(type, value, arg, usage));
  }

  public boolean contains(String name)
  {
    return name_to_record.containsKey(name);
  }

  /**
   * Returns the content of an options file that sets every option to its
   * current value. Lines starting with '#' describe the options.
   */
  public String dumpOptions()
  {
    StringBuilder sb = new StringBuilder(1024);
    String sep = PrintTools.line_sep;
    for (Map.Entry<String, OptionRecord> entry : name_to_record.entrySet()) {
      OptionRecord record = entry.getValue();
      sb.append("#Option: ").append(entry.getKey()).append(sep);
      sb.append("#").append(entry.getKey());
      if (record.arg != null) {
        sb.append("=").append(record.arg);
      }
      sb.append(sep);
      sb.append("#").append(record.usage.replaceAll("\n", "\n#")).append(sep);
      sb.append(entry.getKey());
      if (record.value != null) {
        sb.append("=").append(record.value);
      }
      sb.append(sep);
    }
    return sb.toString();
  }

  public String getUsage()
  {
    StringBuilder sb = new StringBuilder(2000);
    String sep = PrintTools.line_sep;
    for (int i = 0; i < 80; i++) sb.append("-");
    sb.append(sep).append("UTILITY").append(sep);
    for (int i = 0; i < 80; i++) sb.append("-");
    sb.append(sep).append(getUsage(UTILITY));
    for (int i = 0; i < 80; i++) sb.append("-");
    sb.append(sep).append("ANALYSIS").append(sep);
    for (int i = 0; i < 80; i++) sb.append("-");
    sb.append(sep).append(getUsage(ANALYSIS));
    return sb.toString();
  }

  public String getUsage(int type)
  {
    StringBuilder usage = new StringBuilder(1000);
    for (Map.Entry<String, OptionRecord> entry : name_to_record.entrySet()) {
      OptionRecord record = entry.getValue();
      if (record.option_type == type) {
        usage.append("-").append(entry.getKey());
        if (record.arg != null) {
          usage.append("=").append(record.arg);
        }
        usage.append("\n    ").append(record.usage).append("\n\n");
      }
    }
    return usage.toString();
  }

  public String getValue(String name)
  {
    OptionRecord record = name_to_record.get(name);
    if (record == null)
      return null;
    else
      return record.value;
  }

  public void setValue(String name, String value)
  {
    OptionRecord record = name_to_record.get(name);
    if (record != null)
      record.value = value;
  }
}
