// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.core.error;

import org.jspecify.annotations.Nullable;

/**
 * A JSON-RPC method failed. Carries the error code and optional data of the error
 * object returned to the client.
 *
 * <p><strong>Codes used by the provider:</strong>
 * <ul>
 * <li><strong>-32700</strong>: parse error (invalid JSON)</li>
 * <li><strong>-32603</strong>: internal error</li>
 * <li><strong>-32000</strong>: invalid input</li>
 * <li><strong>-32003</strong>: transaction failed</li>
 * <li><strong>-32004</strong>: method not supported</li>
 * </ul>
 */
public non-sealed class ProviderException extends DevnodeException {
    public static final int PARSE_ERROR = -32700;
    public static final int INTERNAL_ERROR = -32603;
    public static final int INVALID_INPUT = -32000;
    public static final int TRANSACTION_REJECTED = -32003;
    public static final int METHOD_NOT_SUPPORTED = -32004;

    private final int code;
    private final @Nullable String data;

    public ProviderException(final int code, final String message, final @Nullable String data) {
        super(message);
        this.code = code;
        this.data = data;
    }

    public ProviderException(final int code, final String message, final @Nullable String data,
            final Throwable cause) {
        super(message, cause);
        this.code = code;
        this.data = data;
    }

    public int code() {
        return code;
    }

    public @Nullable String data() {
        return data;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{code=" + code + ", message=" + getMessage() + ", data=" + data + "}";
    }
}
