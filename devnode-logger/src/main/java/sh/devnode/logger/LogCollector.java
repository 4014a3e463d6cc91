// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.logger;

import java.util.ArrayList;
import java.util.List;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.devnode.bridge.CallbackBridge;
import sh.devnode.core.AnsiColors;
import sh.devnode.core.error.ChainMismatchException;
import sh.devnode.core.error.LoggerException;
import sh.devnode.core.error.ProviderException;
import sh.devnode.core.error.TransactionFailedException;
import sh.devnode.core.error.UnsupportedMethodException;
import sh.devnode.core.model.BlockHeader;
import sh.devnode.core.model.BlockTransaction;
import sh.devnode.core.model.CallResult;
import sh.devnode.core.model.DebugMineBlockResult;
import sh.devnode.core.model.EstimateGasFailure;
import sh.devnode.core.model.ExecutableTransaction;
import sh.devnode.core.model.ExecutionResult;
import sh.devnode.core.model.MinedBlock;
import sh.devnode.core.model.Output;
import sh.devnode.core.model.Precompiles;
import sh.devnode.core.model.SpecId;
import sh.devnode.core.model.Trace;
import sh.devnode.core.model.TraceMessage;
import sh.devnode.core.model.TransactionFailure;
import sh.devnode.core.types.Address;
import sh.devnode.core.types.Hash;
import sh.devnode.core.types.HexData;

/**
 * Line buffer, indentation and {@link LoggingState} of one activity logger, plus the
 * rendering of every engine event.
 *
 * <p>Lines are buffered with the indentation in effect when they were logged and
 * printed on {@link #flush()}. Titled lines are aligned on the longest title buffered
 * since the last flush.
 *
 * <p>Single-writer: only the worker thread driving the owning logger may call in.
 */
final class LogCollector {

    private static final Logger LOG = LoggerFactory.getLogger(LogCollector.class);

    private static final int INDENT_STEP = 2;
    static final String METAMASK_HINT =
            "If you are using MetaMask, you can learn how to fix this error here: https://hardhat.org/metamask-issue";

    private final CallbackBridge<List<HexData>, List<String>> decoder;
    private final CallbackBridge<HostRequests.Resolve, ContractAndFunctionName> resolver;
    private final CallbackBridge<HostRequests.Print, PrintOutcome> printer;
    private final boolean colors;

    private final List<LogLine> lines = new ArrayList<>();
    private boolean enabled;
    private int indentation = 0;
    private int titleLength = 0;
    private LoggingState state = LoggingState.EMPTY;

    LogCollector(
            final boolean enabled,
            final boolean colors,
            final CallbackBridge<List<HexData>, List<String>> decoder,
            final CallbackBridge<HostRequests.Resolve, ContractAndFunctionName> resolver,
            final CallbackBridge<HostRequests.Print, PrintOutcome> printer) {
        this.enabled = enabled;
        this.colors = colors;
        this.decoder = decoder;
        this.resolver = resolver;
        this.printer = printer;
    }

    boolean isEnabled() {
        return enabled;
    }

    void setEnabled(final boolean enabled) {
        this.enabled = enabled;
    }

    LoggingState state() {
        return state;
    }

    List<LogLine> bufferedLines() {
        return List.copyOf(lines);
    }

    // ---------------------------------------------------------------------
    // Calls
    // ---------------------------------------------------------------------

    void logCall(final SpecId specId, final ExecutableTransaction transaction, final CallResult result) {
        state = LoggingState.EMPTY;
        indented(() -> logCallDetails(specId, transaction, result.trace(), result.consoleLogInputs(),
                result.failure()));
    }

    void logEstimateGasFailure(final SpecId specId, final ExecutableTransaction transaction,
            final EstimateGasFailure failure) {
        state = LoggingState.EMPTY;
        indented(() -> logCallDetails(specId, transaction, failure.trace(), failure.consoleLogInputs(),
                failure.failure()));
    }

    private void logCallDetails(final SpecId specId, final ExecutableTransaction transaction, final Trace trace,
            final List<HexData> consoleLogInputs, final @Nullable TransactionFailure failure) {
        logContractAndFunctionName(specId, trace, true);
        logWithTitle("From", transaction.caller().toString());
        if (transaction.to() != null) {
            logWithTitle("To", transaction.to().toString());
        }
        if (!transaction.value().isZero()) {
            logWithTitle("Value", transaction.value().toHumanReadable());
        }
        logConsoleLogMessages(consoleLogInputs);
        if (failure != null) {
            logTransactionFailure(failure);
        }
    }

    // ---------------------------------------------------------------------
    // Mining
    // ---------------------------------------------------------------------

    void logMinedBlock(final SpecId specId, final List<DebugMineBlockResult> results) {
        for (int idx = 0; idx < results.size(); idx++) {
            final DebugMineBlockResult result = results.get(idx);
            final Long rangeStart = state instanceof LoggingState.HardhatMining mining
                    ? mining.emptyBlocksRangeStart()
                    : null;
            final BlockHeader header = result.block().header();

            if (result.block().isEmpty()) {
                indented(() -> {
                    if (rangeStart != null) {
                        replaceLastLine(emptyBlockRange(rangeStart, header.number()));
                    } else {
                        log(emptyBlock(header));
                    }
                });
                state = new LoggingState.HardhatMining(rangeStart != null ? rangeStart : header.number());
            } else {
                state = LoggingState.EMPTY;
                logHardhatMinedBlock(specId, result);
                if (idx < results.size() - 1) {
                    logEmptyLine();
                }
            }
        }
    }

    private void logHardhatMinedBlock(final SpecId specId, final DebugMineBlockResult result) {
        final MinedBlock block = result.block();
        indented(() -> {
            log("Mined block #" + block.header().number());
            indented(() -> {
                log("Block: " + block.header().hash());
                indented(() -> logBlockBody(specId, result, null));
            });
        });
    }

    void logIntervalMined(final SpecId specId, final DebugMineBlockResult result) {
        final BlockHeader header = result.block().header();

        if (result.block().isEmpty()) {
            final Long rangeStart = state instanceof LoggingState.IntervalMining mining
                    ? mining.emptyBlocksRangeStart()
                    : null;
            if (rangeStart != null) {
                print(emptyBlockRange(rangeStart, header.number()), true);
            } else {
                print(emptyBlock(header), false);
            }
            state = new LoggingState.IntervalMining(rangeStart != null ? rangeStart : header.number());
            return;
        }

        state = LoggingState.EMPTY;
        indented(() -> {
            log("Block: " + header.hash());
            indented(() -> logBlockBody(specId, result, null));
        });
        print("Mined block #" + header.number(), false);
        if (flush()) {
            printEmptyLine();
        }
    }

    private static String emptyBlock(final BlockHeader header) {
        final String baseFee = header.baseFeePerGas() != null ? " with base fee " + header.baseFeePerGas() : "";
        return "Mined empty block #" + header.number() + baseFee;
    }

    private static String emptyBlockRange(final long start, final long end) {
        return "Mined empty block range #" + start + " to #" + end;
    }

    // ---------------------------------------------------------------------
    // Sent transactions
    // ---------------------------------------------------------------------

    void logSendTransaction(final SpecId specId, final ExecutableTransaction transaction,
            final List<DebugMineBlockResult> results) {
        if (results.isEmpty()) {
            return;
        }
        state = LoggingState.EMPTY;

        final Hash sentHash = transaction.hash();
        DebugMineBlockResult sentBlock = null;
        BlockTransaction sent = null;
        for (DebugMineBlockResult result : results) {
            for (BlockTransaction candidate : result.block().transactions()) {
                if (candidate.transaction().hash().equals(sentHash)) {
                    sentBlock = result;
                    sent = candidate;
                    break;
                }
            }
            if (sent != null) {
                break;
            }
        }
        if (sent == null) {
            throw new IllegalStateException("Transaction result not found");
        }

        if (results.size() > 1) {
            logWarning("There were other pending transactions. More than one block had to be mined:");
            for (DebugMineBlockResult result : results) {
                logAutominedBlock(specId, result, sentHash);
                logEmptyLine();
            }
            logCurrentlySentTransaction(specId, sentBlock, sent);
        } else if (results.get(0).block().transactions().size() > 1) {
            logWarning("There were other pending transactions mined in the same block:");
            logAutominedBlock(specId, results.get(0), sentHash);
            logEmptyLine();
            logCurrentlySentTransaction(specId, sentBlock, sent);
        } else {
            logTransaction(specId, sentBlock, sent);
        }
    }

    private void logWarning(final String warning) {
        indented(() -> {
            log(paint(AnsiColors.AMBER, warning));
            logEmptyLine();
        });
    }

    private void logAutominedBlock(final SpecId specId, final DebugMineBlockResult result, final Hash sentHash) {
        final BlockHeader header = result.block().header();
        indented(() -> {
            log("Block #" + header.number() + ": " + header.hash());
            indented(() -> logBlockBody(specId, result, sentHash));
        });
    }

    private void logCurrentlySentTransaction(final SpecId specId, final DebugMineBlockResult block,
            final BlockTransaction sent) {
        indented(() -> {
            log("Currently sent transaction:");
            log("");
        });
        logTransaction(specId, block, sent);
    }

    private void logTransaction(final SpecId specId, final DebugMineBlockResult result,
            final BlockTransaction sent) {
        final ExecutableTransaction transaction = sent.transaction();
        final BlockHeader header = result.block().header();
        indented(() -> {
            logContractAndFunctionName(specId, sent.trace(), false);
            logWithTitle("Transaction", transaction.hash().toString());
            logWithTitle("From", transaction.caller().toString());
            if (transaction.to() != null) {
                logWithTitle("To", transaction.to().toString());
            }
            logWithTitle("Value", transaction.value().toHumanReadable());
            logWithTitle("Gas used", gasUsed(sent));
            logWithTitle("Block #" + header.number(), header.hash().toString());
            logConsoleLogMessages(result.consoleLogInputs());
            if (sent.failure() != null) {
                logTransactionFailure(sent.failure());
            }
        });
    }

    // ---------------------------------------------------------------------
    // Shared block rendering
    // ---------------------------------------------------------------------

    /**
     * Base fee and every transaction of a block, blank lines between transactions.
     *
     * @param highlight hash rendered in bold, or {@code null}
     */
    private void logBlockBody(final SpecId specId, final DebugMineBlockResult result,
            final @Nullable Hash highlight) {
        final MinedBlock block = result.block();
        if (block.header().baseFeePerGas() != null) {
            log("Base fee: " + block.header().baseFeePerGas());
        }
        final List<BlockTransaction> transactions = block.transactions();
        for (int idx = 0; idx < transactions.size(); idx++) {
            final BlockTransaction transaction = transactions.get(idx);
            logBlockTransaction(specId, transaction, result.consoleLogInputs(),
                    transaction.transaction().hash().equals(highlight));
            if (idx < transactions.size() - 1) {
                logEmptyLine();
            }
        }
    }

    private void logBlockTransaction(final SpecId specId, final BlockTransaction blockTransaction,
            final List<HexData> consoleLogInputs, final boolean highlight) {
        final ExecutableTransaction transaction = blockTransaction.transaction();
        final String hash = transaction.hash().toString();
        logWithTitle("Transaction", highlight ? paint(AnsiColors.BOLD, hash) : hash);

        indented(() -> {
            logContractAndFunctionName(specId, blockTransaction.trace(), false);
            logWithTitle("From", transaction.caller().toString());
            if (transaction.to() != null) {
                logWithTitle("To", transaction.to().toString());
            }
            logWithTitle("Value", transaction.value().toHumanReadable());
            logWithTitle("Gas used", gasUsed(blockTransaction));
            logConsoleLogMessages(consoleLogInputs);
            if (blockTransaction.failure() != null) {
                logTransactionFailure(blockTransaction.failure());
            }
        });
    }

    private static String gasUsed(final BlockTransaction blockTransaction) {
        return blockTransaction.result().gasUsed() + " of " + blockTransaction.transaction().gasLimit();
    }

    // ---------------------------------------------------------------------
    // Contracts, console.log, failures
    // ---------------------------------------------------------------------

    private void logContractAndFunctionName(final SpecId specId, final Trace trace,
            final boolean warnOnMissingCode) {
        if (!(trace.first().orElse(null) instanceof TraceMessage.Before before)) {
            return;
        }

        final Address to = before.to();
        if (to != null) {
            if (Precompiles.isPrecompile(specId, to)) {
                logWithTitle("Precompile call", "<PrecompileContract " + Precompiles.lowBytes(to) + ">");
                return;
            }
            final HexData code = before.code();
            if (code == null || code.isEmpty()) {
                if (warnOnMissingCode) {
                    log(paint(AnsiColors.AMBER, "WARNING: Calling an account which is not a contract"));
                }
                return;
            }
            logWithTitle("Contract call", resolve(code, before.data()).label());
            return;
        }

        if (!(trace.last().orElse(null) instanceof TraceMessage.After after)) {
            throw new IllegalStateException("Last trace message of a deployment must be an after message");
        }
        logWithTitle("Contract deployment", resolve(before.data(), null).contractName());
        if (after.executionResult() instanceof ExecutionResult.Success success
                && success.output() instanceof Output.Create create
                && create.address() != null) {
            logWithTitle("Contract address", create.address().toString());
        }
    }

    private ContractAndFunctionName resolve(final HexData code, final @Nullable HexData calldata) {
        final ContractAndFunctionName name = resolver.invoke(new HostRequests.Resolve(code, calldata));
        if (name == null) {
            throw new IllegalStateException("Contract name resolver returned no result");
        }
        return name;
    }

    /**
     * Decodes {@code console.log} inputs on the host. Enabled loggers buffer the output
     * with the narrative; disabled ones print each message right away.
     */
    private void logConsoleLogMessages(final List<HexData> inputs) {
        final List<String> messages = decoder.invoke(inputs);
        if (messages == null || messages.isEmpty()) {
            return;
        }
        if (enabled) {
            logEmptyLine();
            log("console.log:");
            indented(() -> messages.forEach(this::log));
        } else {
            for (String message : messages) {
                printLine(message, false);
            }
        }
    }

    private void logTransactionFailure(final TransactionFailure failure) {
        final String errorType = failure.revert() ? "Error" : "TransactionExecutionError";
        logEmptyLine();
        log(errorType + ": " + failure.message());
    }

    // ---------------------------------------------------------------------
    // Method lines
    // ---------------------------------------------------------------------

    void printMethodLogs(final String method, final @Nullable ProviderException error) {
        if (error == null) {
            printMethod(method);
            if (flush()) {
                printEmptyLine();
            }
            return;
        }

        state = LoggingState.EMPTY;
        if (error instanceof UnsupportedMethodException) {
            print(paint(AnsiColors.CORAL, error.getMessage()), false);
            return;
        }

        print(paint(AnsiColors.CORAL, method), false);
        flush();

        if (!(error instanceof TransactionFailedException)) {
            printEmptyLine();
            indented(() -> {
                print(error.getMessage(), false);
                if (error instanceof ChainMismatchException) {
                    print(paint(AnsiColors.AMBER, METAMASK_HINT), false);
                }
            });
        }
        printEmptyLine();
    }

    private void printMethod(final String method) {
        if (state instanceof LoggingState.CollapsingMethod collapsing && collapsing.method().equals(method)) {
            final int count = collapsing.count() + 1;
            state = new LoggingState.CollapsingMethod(method, count);
            print(paint(AnsiColors.TEAL, method + " (" + count + ")"), true);
        } else {
            state = new LoggingState.CollapsingMethod(method, 1);
            print(paint(AnsiColors.TEAL, method), false);
        }
    }

    // ---------------------------------------------------------------------
    // Buffer primitives
    // ---------------------------------------------------------------------

    private void indented(final Runnable body) {
        indentation += INDENT_STEP;
        try {
            body.run();
        } finally {
            indentation -= INDENT_STEP;
        }
    }

    private String format(final String message) {
        if (message.isEmpty()) {
            return message;
        }
        final String prefix = " ".repeat(indentation);
        final StringBuilder formatted = new StringBuilder();
        final String[] parts = message.split("\n", -1);
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                formatted.append('\n');
            }
            formatted.append(prefix).append(parts[i]);
        }
        return formatted.toString();
    }

    private void log(final String message) {
        lines.add(new LogLine.Single(format(message)));
    }

    private void logEmptyLine() {
        lines.add(new LogLine.Single(""));
    }

    private void logWithTitle(final String title, final String message) {
        final String indentedTitle = " ".repeat(indentation) + title;
        titleLength = Math.max(titleLength, indentedTitle.length());
        lines.add(new LogLine.WithTitle(indentedTitle, message));
    }

    private void replaceLastLine(final String message) {
        if (lines.isEmpty()) {
            throw new IllegalStateException("There must be a buffered line to replace");
        }
        lines.set(lines.size() - 1, new LogLine.Single(format(message)));
    }

    /**
     * Prints and clears the buffer.
     *
     * @return whether anything was buffered
     */
    boolean flush() {
        if (lines.isEmpty()) {
            return false;
        }
        final List<LogLine> drained = new ArrayList<>(lines);
        final int width = titleLength + 1;
        lines.clear();
        titleLength = 0;

        for (LogLine line : drained) {
            if (line instanceof LogLine.Single single) {
                print(single.text(), false);
            } else if (line instanceof LogLine.WithTitle titled) {
                print(String.format("%-" + width + "s %s", titled.title() + ":", titled.message()), false);
            }
        }
        return true;
    }

    private void printEmptyLine() {
        print("", false);
    }

    private void print(final String message, final boolean replace) {
        if (!enabled) {
            return;
        }
        printLine(format(message), replace);
    }

    private void printLine(final String line, final boolean replace) {
        final PrintOutcome outcome = printer.invoke(new HostRequests.Print(line, replace));
        if (outcome != PrintOutcome.PRINTED) {
            LOG.debug("Host failed to print line: {}", line);
            throw new LoggerException("Failed to print line");
        }
    }

    private String paint(final String code, final String text) {
        return AnsiColors.paint(code, text, colors);
    }
}
