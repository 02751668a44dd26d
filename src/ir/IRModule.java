package ir;

import exception.CompileException;
import ir.type.FunctionType;
import ir.value.Function;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The unit handed to the pass manager: an ordered collection of functions.
 */
public class IRModule {
    private static IRModule INSTANCE = new IRModule("");

    private String moduleName;

    // function name -> function, in definition order
    private final Map<String, Function> functions = new LinkedHashMap<>();

    private IRModule(String name) {
        this.moduleName = name;
    }

    public static IRModule getModule() {
        return INSTANCE;
    }

    /**
     * Drop the current module and start an empty one (used between compilations and by tests)
     */
    public static IRModule reset(String name) {
        INSTANCE = new IRModule(name);
        return INSTANCE;
    }

    public String getName() {
        return moduleName;
    }

    public void setName(String name) {
        this.moduleName = name;
    }

    public Function addFunction(String name, FunctionType type) {
        if (functions.containsKey(name)) {
            throw CompileException.duplicateSymbol("function '" + name + "' has already been declared");
        }
        Function newFunc = new Function(this, type, name);
        functions.put(name, newFunc);
        return newFunc;
    }

    public Function getFunction(String name) {
        return functions.get(name);
    }

    public Collection<Function> getFunctions() {
        return Collections.unmodifiableCollection(functions.values());
    }

    public String toIR() {
        StringBuilder sb = new StringBuilder();
        sb.append("; ModuleID = '").append(moduleName).append("'\n");
        for (Function f : functions.values()) {
            sb.append("\n").append(f.toIR());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return toIR();
    }
}
