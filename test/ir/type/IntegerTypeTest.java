package ir.type;

import exception.CompileException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class IntegerTypeTest {

    @Test
    void typesArePooled() {
        assertThat(IntegerType.getInteger(32)).isSameAs(IntegerType.getI32());
        assertThat(PointerType.get(IntegerType.getI8())).isSameAs(PointerType.get(IntegerType.getI8()));
        assertThat(FunctionType.get(IntegerType.getI32(), List.of(IntegerType.getI1())))
                .isEqualTo(FunctionType.get(IntegerType.getI32(), List.of(IntegerType.getI1())));
    }

    @Test
    void masksCoverTheWidth() {
        assertThat(IntegerType.getI1().getMask()).isEqualTo(1L);
        assertThat(IntegerType.getI32().getMask()).isEqualTo(0xFFFFFFFFL);
        assertThat(IntegerType.getI64().getMask()).isEqualTo(-1L);
    }

    @Test
    void widthsOutsideOneToSixtyFourAreUnsupported() {
        assertThatThrownBy(() -> IntegerType.getInteger(0)).isInstanceOf(CompileException.class);
        assertThatThrownBy(() -> IntegerType.getInteger(128))
                .isInstanceOf(CompileException.class)
                .hasMessageContaining("128");
    }

    @Test
    void printsLikeLlvm() {
        assertThat(IntegerType.getI32().toIR()).isEqualTo("i32");
        assertThat(PointerType.get(IntegerType.getI32()).toIR()).isEqualTo("i32*");
        assertThat(VoidType.getVoid().toIR()).isEqualTo("void");
    }
}
