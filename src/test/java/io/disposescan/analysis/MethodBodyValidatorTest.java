package io.disposescan.analysis;

import io.disposescan.model.BranchTarget;
import io.disposescan.model.FlowControl;
import io.disposescan.model.Instruction;
import io.disposescan.model.MethodInfo;
import io.disposescan.model.OpCode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class MethodBodyValidatorTest {

    @Test
    void validate_acceptsWellFormedBody() {
        MethodInfo method = builder()
                .instruction(new Instruction(0, OpCode.OTHER, "iload_1", null, 0, 1, null))
                .instruction(new Instruction(1, OpCode.OTHER, "ifeq", BranchTarget.of(3), 1, 0, FlowControl.CONDITIONAL_BRANCH))
                .instruction(new Instruction(2, OpCode.OTHER, "nop", null, 0, 0, null))
                .instruction(new Instruction(3, OpCode.OTHER, "return", null, 0, 0, FlowControl.RETURN))
                .handlerOffset(2)
                .build();

        assertThatCode(() -> MethodBodyValidator.validate(method)).doesNotThrowAnyException();
    }

    @Test
    void validate_rejectsDuplicateOffsets() {
        MethodInfo method = builder()
                .instruction(new Instruction(0, OpCode.OTHER, "nop", null, 0, 0, null))
                .instruction(new Instruction(0, OpCode.OTHER, "return", null, 0, 0, FlowControl.RETURN))
                .build();

        assertThatThrownBy(() -> MethodBodyValidator.validate(method))
                .isInstanceOf(MalformedMethodBodyException.class)
                .hasMessageContaining("does not follow");
    }

    @Test
    void validate_rejectsBranchToMissingOffset() {
        MethodInfo method = builder()
                .instruction(new Instruction(0, OpCode.OTHER, "goto", BranchTarget.of(-1), 0, 0, FlowControl.BRANCH))
                .build();

        assertThatThrownBy(() -> MethodBodyValidator.validate(method))
                .isInstanceOf(MalformedMethodBodyException.class)
                .hasMessageContaining("missing offset -1");
    }

    @Test
    void validate_rejectsHandlerAtMissingOffset() {
        MethodInfo method = builder()
                .instruction(new Instruction(0, OpCode.OTHER, "return", null, 0, 0, FlowControl.RETURN))
                .handlerOffset(5)
                .build();

        MalformedMethodBodyException e = catchThrowableOfType(
                () -> MethodBodyValidator.validate(method), MalformedMethodBodyException.class);

        assertThat(e).hasMessageContaining("handler at missing offset 5");
        assertThat(e.getMethod()).isEqualTo("com.example.Resource.run()V");
    }

    @Test
    void validate_rejectsNegativeStackEffect() {
        MethodInfo method = builder()
                .instruction(new Instruction(0, OpCode.OTHER, "pop", null, -1, 0, null))
                .build();

        assertThatThrownBy(() -> MethodBodyValidator.validate(method))
                .isInstanceOf(MalformedMethodBodyException.class)
                .hasMessageContaining("negative stack effect");
    }

    private static MethodInfo.Builder builder() {
        return MethodInfo.builder()
                .declaringType("com.example.Resource")
                .name("run");
    }
}
