package ir.value;

/*
 * one edge of the use-def graph, a row of the table user--usee--index
 *   op(a, b, c): user: op, usee: b, index: 1
 * created and dropped only by User, so both sides always agree
 */
public final class Use {
    private final User user;
    private final Value usee;
    private final int operandIndex;

    Use(User user, Value usee, int index) {
        this.user = user;
        this.usee = usee;
        this.operandIndex = index;
    }

    public User getUser() { return user; }
    public Value getUsee() { return usee; }
    public int getOperandIndex() { return operandIndex; }

    @Override
    public String toString() {
        return "Use(" + user.getName() + " -> " + usee.getReference() + ", index=" + operandIndex + ")";
    }
}
