package ir.value;

import ir.value.instructions.BinOperator;
import ir.value.instructions.ReturnInst;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import pass.IRPass.localopts.BlockFixture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ValueTest extends BlockFixture {

    @Test
    void operandsRegisterAsUses() {
        BinOperator a = builder.buildAdd(x, x, "a");

        assertThat(x.getNumUses()).isEqualTo(2);
        assertThat(x.getUsers()).containsExactly(a, a);
        assertThat(x.getUses()).extracting(Use::getOperandIndex).containsExactly(0, 1);
    }

    @Test
    void setOperandMovesTheUse() {
        BinOperator a = builder.buildAdd(x, c(1), "a");
        BinOperator b = builder.buildAdd(x, c(2), "b");

        b.setOperand(0, a);

        assertThat(x.getUsers()).containsExactly(a);
        assertThat(a.getUsers()).containsExactly(b);
        assertThat(b.getOperandIndex(a)).isZero();
        assertUseDefConsistent();
    }

    @Test
    void replaceAllUsesWithRedirectsEveryUser() {
        BinOperator a = builder.buildAdd(x, c(1), "a");
        BinOperator b = builder.buildMul(a, a, "b");
        ReturnInst ret = builder.buildRet(a);

        a.replaceAllUsesWith(x);

        assertThat(a.hasNoUses()).isTrue();
        assertThat(b.getLhs()).isSameAs(x);
        assertThat(b.getRhs()).isSameAs(x);
        assertThat(ret.getReturnValue()).isSameAs(x);
        // still in its block
        assertThat(a.getParent()).isSameAs(entry);
        assertUseDefConsistent();
    }

    @Test
    void replaceWithItselfIsNoOp() {
        BinOperator a = builder.buildAdd(x, c(1), "a");
        builder.buildRet(a);

        a.replaceAllUsesWith(a);

        assertThat(a.getNumUses()).isEqualTo(1);
    }

    @Test
    void replaceWithDifferentTypeIsRejected() {
        BinOperator a = builder.buildAdd(x, c(1), "a");
        builder.buildRet(a);

        assertThatThrownBy(() -> a.replaceAllUsesWith(p)).isInstanceOf(AssertionError.class);
    }

    @Test
    void useListIsReadOnly() {
        builder.buildAdd(x, c(1), "a");

        assertThatThrownBy(() -> x.getUses().clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void clearOperandsDropsUses() {
        BinOperator a = builder.buildAdd(x, x, "a");

        a.clearOperands();

        assertThat(a.getNumOperands()).isZero();
        assertThat(x.hasNoUses()).isTrue();
    }
}
