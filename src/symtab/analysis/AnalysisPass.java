package symtab.analysis;

import symtab.hir.PrintTools;
import symtab.hir.Program;
import symtab.hir.Tools;

/**
* Base class of the analyses run by the driver over a whole program.
*/
public abstract class AnalysisPass
{
  protected Program program;

  protected AnalysisPass(Program program)
  {
    if (program == null)
      throw new IllegalArgumentException("null program");
    this.program = program;
  }

  public abstract String getPassName();

  public static void run(AnalysisPass pass)
  {
    double timer = Tools.getTime();
    PrintTools.println(pass.getPassName() + " begin", 1);
    pass.start();
    PrintTools.println(pass.getPassName() + " end in " +
      String.format("%.2f seconds", Tools.getTime(timer)), 1);
  }

  public abstract void start();
}
