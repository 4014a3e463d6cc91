// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.core.model;

/**
 * Why the EVM stopped execution exceptionally.
 *
 * <p>The last five constants are internal to the engine and never reach
 * {@link ExitCode#of(HaltReason)}.
 */
public enum HaltReason {
    OUT_OF_GAS_BASIC,
    OUT_OF_GAS_MEMORY_LIMIT,
    OUT_OF_GAS_MEMORY,
    OUT_OF_GAS_PRECOMPILE,
    OUT_OF_GAS_INVALID_OPERAND,
    OPCODE_NOT_FOUND,
    INVALID_FE_OPCODE,
    INVALID_JUMP,
    NOT_ACTIVATED,
    STACK_UNDERFLOW,
    STACK_OVERFLOW,
    OUT_OF_OFFSET,
    CREATE_COLLISION,
    PRECOMPILE_ERROR,
    NONCE_OVERFLOW,
    CREATE_CONTRACT_SIZE_LIMIT,
    CREATE_CONTRACT_STARTING_WITH_EF,
    CREATE_INIT_CODE_SIZE_LIMIT,
    FATAL_EXTERNAL_ERROR,

    OVERFLOW_PAYMENT,
    STATE_CHANGE_DURING_STATIC_CALL,
    CALL_NOT_ALLOWED_INSIDE_STATIC,
    OUT_OF_FUNDS,
    CALL_TOO_DEEP;

    public boolean isInternal() {
        return ordinal() >= OVERFLOW_PAYMENT.ordinal();
    }
}
