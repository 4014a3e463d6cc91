// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.bridge;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One invocation waiting in the host mailbox: the request and the one-shot channel
 * its response is delivered through.
 */
final class PendingCall<Q, R> {

    private static final Logger log = LoggerFactory.getLogger(PendingCall.class);

    private final String bridgeName;
    private final Function<Q, ? extends CompletionStage<R>> handler;
    private final Q request;
    final CompletableFuture<R> result = new CompletableFuture<>();

    PendingCall(final String bridgeName, final Function<Q, ? extends CompletionStage<R>> handler, final Q request) {
        this.bridgeName = bridgeName;
        this.handler = handler;
        this.request = request;
    }

    /**
     * Runs the handler. Called only on the dispatch thread.
     */
    void dispatch() {
        if (result.isDone()) {
            return;
        }
        final CompletionStage<R> stage;
        try {
            stage = handler.apply(request);
        } catch (Throwable t) {
            fail(t);
            return;
        }
        if (stage == null) {
            fail(new NullPointerException("handler returned no completion stage"));
            return;
        }
        stage.whenComplete((response, error) -> {
            if (error != null) {
                fail(error);
            } else {
                result.complete(response);
            }
        });
    }

    void abort(final BridgeFault fault) {
        result.completeExceptionally(fault);
    }

    private void fail(final Throwable cause) {
        log.error("Host handler of bridge '{}' failed", bridgeName, cause);
        result.completeExceptionally(new BridgeFault("Host handler of bridge '" + bridgeName + "' failed", cause));
    }
}
