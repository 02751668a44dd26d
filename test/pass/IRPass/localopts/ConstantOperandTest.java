package pass.IRPass.localopts;

import ir.value.instructions.BinOperator;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class ConstantOperandTest extends BlockFixture {

    @Test
    void constantOnTheRight() {
        BinOperator add = builder.buildAdd(x, c(3), "a");

        ConstantOperand co = ConstantOperand.of(add);

        assertThat(co).isNotNull();
        assertThat(co.constant().getValue()).isEqualTo(3);
        assertThat(co.other()).isSameAs(x);
    }

    @Test
    void constantOnTheLeft() {
        BinOperator add = builder.buildAdd(c(3), x, "a");

        ConstantOperand co = ConstantOperand.of(add);

        assertThat(co.constant().getValue()).isEqualTo(3);
        assertThat(co.other()).isSameAs(x);
    }

    @Test
    void operandZeroWinsWhenBothAreConstant() {
        BinOperator add = builder.buildAdd(c(1), c(2), "a");

        ConstantOperand co = ConstantOperand.of(add);

        assertThat(co.constant().getValue()).isEqualTo(1);
        assertThat(co.other()).isSameAs(add.getRhs());
    }

    @Test
    void noConstantOperand() {
        BinOperator add = builder.buildAdd(x, x, "a");

        assertThat(ConstantOperand.of(add)).isNull();
        assertThat(ConstantOperand.ofDivisor(add)).isNull();
    }

    @Test
    void divisorOnlyAcceptsOperandOne() {
        BinOperator leading = builder.buildSDiv(c(8), x, "d");
        BinOperator trailing = builder.buildSDiv(x, c(8), "e");

        assertThat(ConstantOperand.ofDivisor(leading)).isNull();
        assertThat(ConstantOperand.ofDivisor(trailing).other()).isSameAs(x);
    }
}
