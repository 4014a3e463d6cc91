// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.core.model;

/**
 * Public classification of an execution outcome.
 *
 * <p>Codes are stable and exposed to clients; do not renumber.
 */
public enum ExitCode {
    SUCCESS(0),
    REVERT(1),
    OUT_OF_GAS(2),
    INTERNAL_ERROR(3),
    INVALID_OPCODE(4),
    STACK_UNDERFLOW(5),
    CODESIZE_EXCEEDS_MAXIMUM(6),
    CREATE_COLLISION(7),
    UNKNOWN_HALT_REASON(8);

    private final int code;

    ExitCode(final int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static ExitCode of(final ExecutionResult result) {
        if (result instanceof ExecutionResult.Success) {
            return SUCCESS;
        }
        if (result instanceof ExecutionResult.Revert) {
            return REVERT;
        }
        return of(((ExecutionResult.Halt) result).reason());
    }

    /**
     * Classifies a halt reason.
     *
     * @throws AssertionError if the reason is internal to the engine
     */
    public static ExitCode of(final HaltReason reason) {
        return switch (reason) {
            case OUT_OF_GAS_BASIC, OUT_OF_GAS_MEMORY_LIMIT, OUT_OF_GAS_MEMORY, OUT_OF_GAS_PRECOMPILE,
                    OUT_OF_GAS_INVALID_OPERAND -> OUT_OF_GAS;
            case OPCODE_NOT_FOUND, INVALID_FE_OPCODE, NOT_ACTIVATED -> INVALID_OPCODE;
            case STACK_UNDERFLOW -> STACK_UNDERFLOW;
            case CREATE_CONTRACT_SIZE_LIMIT -> CODESIZE_EXCEEDS_MAXIMUM;
            case CREATE_COLLISION -> CREATE_COLLISION;
            case FATAL_EXTERNAL_ERROR -> INTERNAL_ERROR;
            case INVALID_JUMP, STACK_OVERFLOW, OUT_OF_OFFSET, PRECOMPILE_ERROR, NONCE_OVERFLOW,
                    CREATE_CONTRACT_STARTING_WITH_EF, CREATE_INIT_CODE_SIZE_LIMIT -> UNKNOWN_HALT_REASON;
            case OVERFLOW_PAYMENT, STATE_CHANGE_DURING_STATIC_CALL, CALL_NOT_ALLOWED_INSIDE_STATIC, OUT_OF_FUNDS,
                    CALL_TOO_DEEP -> throw new AssertionError(
                            "Internal halt reason should not escape the engine: " + reason);
        };
    }
}
