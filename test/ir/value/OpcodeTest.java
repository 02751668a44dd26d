package ir.value;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class OpcodeTest {

    @Test
    void binaryOpcodes() {
        assertThat(Arrays.stream(Opcode.values()).filter(Opcode::isBinary))
                .containsExactlyInAnyOrderElementsOf(EnumSet.of(
                        Opcode.ADD, Opcode.SUB, Opcode.MUL, Opcode.SDIV, Opcode.UDIV,
                        Opcode.SREM, Opcode.UREM, Opcode.SHL, Opcode.LSHR, Opcode.ASHR,
                        Opcode.AND, Opcode.OR, Opcode.XOR));
    }

    @Test
    void terminatorsAndCommutativity() {
        assertThat(Opcode.RET.isTerminator()).isTrue();
        assertThat(Opcode.BR.isTerminator()).isTrue();
        assertThat(Opcode.CALL.isTerminator()).isFalse();
        assertThat(Opcode.MUL.isCommutative()).isTrue();
        assertThat(Opcode.SUB.isCommutative()).isFalse();
        assertThat(Opcode.SDIV.getMnemonic()).isEqualTo("sdiv");
    }
}
