package ir.value;

import ir.type.Type;

// formal parameter of a function
public class Argument extends Value {

    public Argument(Type type, String name) {
        super(type, name);
    }

    @Override
    public String toIR() {
        return getType().toIR() + " %" + getName();
    }
}
