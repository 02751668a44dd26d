package ir.value;

import ir.type.Type;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public abstract class User extends Value {

    private final ArrayList<Value> operands;

    protected User(Type type, String name) {
        super(type, name);
        this.operands = new ArrayList<>();
    }

    protected User(Type type, String name, Value... operands) {
        this(type, name);
        for (var operand : operands) {
            addOperand(operand);
        }
    }

    /* getter */
    public int getNumOperands() { return operands.size(); }
    public Value getOperand(int index) { return operands.get(index); }

    // to assure the consistency, you can only get a read only list
    public List<Value> getOperands() {
        return Collections.unmodifiableList(operands);
    }

    /* updater: every change keeps the usee's use list in step */
    public void setOperand(int index, Value value) {
        assert index >= 0 && index < getNumOperands();
        Objects.requireNonNull(value, "Operand value cannot be null");

        operands.get(index).removeUseBy(this, index);
        operands.set(index, value);
        value.addUse(new Use(this, value, index));
    }

    protected void addOperand(Value value) {
        Objects.requireNonNull(value, "Operand value cannot be null");
        this.operands.add(value);
        value.addUse(new Use(this, value, operands.size() - 1));
    }

    /* drop every operand together with its use */
    public void clearOperands() {
        for (int i = 0; i < operands.size(); i++) {
            operands.get(i).removeUseBy(this, i);
        }
        operands.clear();
    }

    // index of the first operand slot holding value, -1 if none
    public int getOperandIndex(Value value) {
        for (int i = 0; i < operands.size(); i++) {
            if (operands.get(i) == value) {
                return i;
            }
        }
        return -1;
    }
}
