package symtab.analysis;

import symtab.hir.*;
import symtab.scalar.AlgSimplify;
import symtab.scalar.ScalExp;
import symtab.scalar.ScalExpConverter;
import symtab.scalar.ScalTools;
import symtab.scalar.SimplifyException;

import java.util.*;

/**
* Forward pass that builds the symbol table of every binding in a program and
* uses the ranges it finds to prove array indexings within bounds.
* <p>
* Each function is traversed once, in program order, starting from an empty
* table holding the function parameters. The table valid just before a
* binding is recorded for that binding. The branches of a conditional are
* traversed with the table refined by the condition, loop bodies and the
* bodies of map and filter lambdas with a deepened table that also holds the
* loop variable or lambda parameters.
* <p>
* An indexing {@code a[i_1,...,i_k]} is safe if, under the table valid at the
* indexing, {@code 0 <= i_j} and {@code i_j < d_j} simplify to true for every
* index, where {@code d_j} is the size of dimension {@code j} of {@code a}.
*/
public class RangePropagation extends AnalysisPass
{
  private static final String tag = "[RangePropagation]";

  private static final String pass_name = "[RangePropagation]";

  // Table valid before each binding
  private Map<Binding, SymbolTable<Void>> tables;

  // Bindings in traversal order
  private List<Binding> visited;

  private List<Binding> safe_indexings;

  public RangePropagation(Program program)
  {
    super(program);
    tables = new IdentityHashMap<Binding, SymbolTable<Void>>();
    visited = new ArrayList<Binding>();
    safe_indexings = new ArrayList<Binding>();
  }

  public String getPassName()
  {
    return pass_name;
  }

  public void start()
  {
    tables.clear();
    visited.clear();
    safe_indexings.clear();
    for (FunDec fun : program.getFunctions())
    {
      SymbolTable<Void> table = SymbolTable.empty(AnnotationFunction.NONE);
      for (Ident param : fun.getParams())
        table = table.insertParameter(param);
      analyzeBody(fun.getBody(), table);
      PrintTools.printlnStatus(2, tag, fun.getName() + ":",
                               tables.size(), "binding(s) visited");
    }
  }

  /**
  * Returns the table valid just before the given binding.
  *
  * @param binding a binding of the analyzed program.
  * @return the table, or null if the binding was not visited.
  */
  public SymbolTable<Void> getTable(Binding binding)
  {
    return tables.get(binding);
  }

  /**
  * Returns the bindings whose indexing expression is proved within bounds,
  * in traversal order.
  */
  public List<Binding> getSafeIndexings()
  {
    return Collections.unmodifiableList(safe_indexings);
  }

  /** Returns every visited binding in traversal order. */
  public List<Binding> getBindings()
  {
    return Collections.unmodifiableList(visited);
  }

  private SymbolTable<Void> analyzeBody(Body body, SymbolTable<Void> table)
  {
    for (Binding binding : body.getBindings())
    {
      tables.put(binding, table);
      visited.add(binding);
      Exp e = binding.getExp();
      analyzeNested(e, table);
      if (e instanceof Index && isSafe((Index)e, table))
      {
        PrintTools.printlnStatus(2, tag, "safe indexing", binding);
        safe_indexings.add(binding);
      }
      table = table.insertBinding(binding);
    }
    return table;
  }

  private void analyzeNested(Exp e, SymbolTable<Void> table)
  {
    if (e instanceof If)
    {
      If branch = (If)e;
      analyzeBody(branch.getThenBody(),
                  table.updateBounds(true, branch.getCondition()));
      analyzeBody(branch.getElseBody(),
                  table.updateBounds(false, branch.getCondition()));
    }
    else if (e instanceof DoLoop)
    {
      DoLoop loop = (DoLoop)e;
      SymbolTable<Void> inner = table.deepen();
      for (Ident param : loop.getMergeParams())
        inner = inner.insertParameter(param);
      inner = inner.insertLoopVariable(loop.getLoopVar().getName(),
                                       loop.getBound());
      analyzeBody(loop.getBody(), inner);
    }
    else if (e instanceof ArrayMap)
    {
      ArrayMap map = (ArrayMap)e;
      analyzeLambda(map.getLambda(), map.getInputs(), table);
    }
    else if (e instanceof Filter)
    {
      Filter filter = (Filter)e;
      analyzeLambda(filter.getLambda(), filter.getInputs(), table);
    }
  }

  private void analyzeLambda(Lambda lambda, List<SubExp> inputs,
                             SymbolTable<Void> table)
  {
    SymbolTable<Void> inner = table.deepen();
    List<Ident> params = lambda.getParams();
    for (int i = 0; i < params.size(); i++)
    {
      if (i < inputs.size())
        inner = inner.insertArrayParameter(params.get(i), inputs.get(i));
      else
        inner = inner.insertParameter(params.get(i));
    }
    analyzeBody(lambda.getBody(), inner);
  }

  private boolean isSafe(Index e, SymbolTable<Void> table)
  {
    List<SubExp> dims = e.getArray().getType().arrayDims();
    List<SubExp> indices = e.getIndices();
    if (indices.isEmpty() || indices.size() > dims.size())
      return false;
    ScalExp cond = null;
    for (int i = 0; i < indices.size(); i++)
    {
      ScalExp index = ScalExpConverter.subExpToScalExp(table, indices.get(i));
      ScalExp size = ScalExpConverter.subExpToScalExp(table, dims.get(i));
      if (index == null || size == null)
        return false;
      ScalExp in_bounds = ScalTools.and(
          ScalTools.leq0(ScalTools.neg(index)),
          ScalTools.lth0(ScalTools.minus(index, size)));
      cond = (cond == null) ? in_bounds : ScalTools.and(cond, in_bounds);
    }
    try {
      return AlgSimplify.isTrue(cond, e.getLocation(),
                                table.getRangeContext());
    } catch (SimplifyException ex) {
      PrintTools.printlnStatus(3, tag, "cannot check", e + ":",
                               ex.getMessage());
      return false;
    }
  }
}
