package symtab.hir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Root of the IR: the list of function definitions. */
public class Program {

    private final List<FunDec> functions;

    public Program(List<FunDec> functions) {
        this.functions = Collections.unmodifiableList(
                new ArrayList<FunDec>(functions));
    }

    public List<FunDec> getFunctions() {
        return functions;
    }

    @Override
    public String toString() {
        return PrintTools.listToString(functions, PrintTools.line_sep);
    }
}
