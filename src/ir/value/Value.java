package ir.value;

import ir.type.Type;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedList;
import java.util.List;
import java.util.Objects;

public abstract class Value {
    private final Type type;
    private String name;

    // who uses me
    private final LinkedList<Use> usesList;

    protected Value(Type type, String name) {
        this.type = Objects.requireNonNull(type, "type");
        this.name = name;
        this.usesList = new LinkedList<>();
    }

    /** textual form of the definition, e.g. "%x = add i32 %a, 1" */
    public abstract String toIR();

    /* getter setter */
    public String getName() { return this.name; }
    public Type getType() { return this.type; }

    public void setName(String name) { this.name = name; }

    /**
     * read only view; the use list is only changed through {@link User}
     */
    public List<Use> getUses() {
        return Collections.unmodifiableList(usesList);
    }

    /**
     * users in use order; a user reading this value twice appears twice
     */
    public List<User> getUsers() {
        List<User> users = new ArrayList<>(usesList.size());
        for (Use use : usesList) {
            users.add(use.getUser());
        }
        return users;
    }

    public int getNumUses() {
        return usesList.size();
    }

    public boolean hasNoUses() {
        return usesList.isEmpty();
    }

    /**
     * how this value is spelled when it appears as an operand,
     * "%name" for SSA values, the literal for constants
     */
    public String getReference() {
        return "%" + getName();
    }

    /* use field */
    /**
     * Re-point every operand slot that reads this value at {@code newValue}.
     * Afterwards this value has no uses; it is not removed from its parent.
     */
    public void replaceAllUsesWith(Value newValue) {
        Objects.requireNonNull(newValue, "newValue");
        if (this == newValue) return;
        assert newValue.getType().equals(getType())
            : "replaceAllUsesWith with a different type: " + getType() + " -> " + newValue.getType();
        // setOperand edits usesList, iterate over a copy
        for (Use use : new ArrayList<>(usesList)) {
            use.getUser().setOperand(use.getOperandIndex(), newValue);
        }
        assert usesList.isEmpty();
    }

    void addUse(Use use) {
        Objects.requireNonNull(use, "use");
        this.usesList.add(use);
    }

    void removeUseBy(User user, int index) {
        usesList.removeIf(use -> use.getUser() == user && use.getOperandIndex() == index);
    }

    @Override
    public String toString() {
        return toIR();
    }
}
