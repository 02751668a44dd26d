package ir.value;

import ir.IRModule;
import ir.type.FunctionType;
import ir.type.Type;
import util.IList;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public class Function extends Value {
    private final IRModule module;
    private final ArrayList<Argument> arguments;
    private final IList<BasicBlock, Function> blocks;

    // per function name space of SSA values and blocks
    private final Map<String, Integer> nameCounts;

    public Function(IRModule parent, FunctionType type, String name) {
        super(type, name);
        this.module = parent;
        this.arguments = new ArrayList<>();
        this.nameCounts = new HashMap<>();
        this.blocks = new IList<>(this);

        List<Type> paramTypes = type.getParamTypes();
        for (int i = 0; i < paramTypes.size(); i++) {
            String argName = getUniqueName("arg" + i);
            arguments.add(new Argument(paramTypes.get(i), argName));
        }
    }

    /* getter setter */
    public IRModule getParent() {
        return module;
    }

    public FunctionType getFunctionType() {
        return (FunctionType) super.getType();
    }

    public Argument getParam(int index) {
        return arguments.get(index);
    }

    public IList<BasicBlock, Function> getBlocks() {
        return blocks;
    }

    public BasicBlock appendBasicBlock(String name) {
        return new BasicBlock(getUniqueName(name), this);
    }

    /* a fresh name in this function, "name", then "name.1", "name.2", ... */
    public String getUniqueName(String name) {
        int count = nameCounts.getOrDefault(name, 0);
        nameCounts.put(name, count + 1);
        if (count == 0) {
            return name;
        }
        String candidate = name + "." + count;
        // "x.1" may itself have been handed out as a base name
        while (nameCounts.containsKey(candidate)) {
            count++;
            candidate = name + "." + count;
        }
        nameCounts.put(name, count + 1);
        nameCounts.put(candidate, 1);
        return candidate;
    }

    /* a function without a body */
    public boolean isDeclaration() {
        return blocks.isEmpty();
    }

    @Override
    public String getReference() {
        return "@" + getName();
    }

    @Override
    public String toIR() {
        FunctionType fnType = getFunctionType();
        String argsStr = arguments.stream()
                .map(Argument::toIR)
                .collect(Collectors.joining(", "));
        if (isDeclaration()) {
            return "declare " + fnType.getReturnType().toIR() + " @" + getName() + "(" + argsStr + ")\n";
        }
        StringBuilder sb = new StringBuilder();
        sb.append("define ").append(fnType.getReturnType().toIR())
                .append(" @").append(getName()).append("(")
                .append(argsStr).append(") {\n");
        for (var node : blocks) {
            sb.append(node.getVal().toIR());
        }
        sb.append("}\n");
        return sb.toString();
    }
}
