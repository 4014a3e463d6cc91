// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.core.error;

/**
 * The requested JSON-RPC method is not implemented. Rendered minimally by the
 * activity logger.
 */
public final class UnsupportedMethodException extends ProviderException {

    private final String method;

    public UnsupportedMethodException(final String method) {
        super(METHOD_NOT_SUPPORTED, "Method " + method + " is not supported", null);
        this.method = method;
    }

    public String method() {
        return method;
    }
}
