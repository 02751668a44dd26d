package ir.value.instructions;

import java.util.List;
import java.util.stream.Collectors;

import ir.value.Function;
import ir.value.Opcode;
import ir.value.Value;

/**
 * call; always treated as having side effects
 */
public class CallInst extends Instruction {

    private final Function func;

    public CallInst(Function func, List<Value> args, String name) {
        super(func.getFunctionType().getReturnType(), name);
        this.func = func;
        for (Value arg : args) {
            addOperand(arg);
        }
    }

    public List<Value> getArgs() {
        return getOperands();
    }

    public boolean isVoid() {
        return getType().isVoid();
    }

    @Override
    public Opcode opCode() {
        return Opcode.CALL;
    }

    @Override
    public String toIR() {
        String args = getArgs().stream()
                .map(a -> a.getType().toIR() + " " + a.getReference())
                .collect(Collectors.joining(", "));
        String call = "call " + getType().toIR() + " @" + func.getName() + "(" + args + ")";
        return isVoid() ? call : "%" + getName() + " = " + call;
    }
}
