// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.logger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static sh.devnode.logger.Fixtures.CALLDATA;
import static sh.devnode.logger.Fixtures.CODE;
import static sh.devnode.logger.Fixtures.CONSOLE_INPUT;
import static sh.devnode.logger.Fixtures.CONTRACT;
import static sh.devnode.logger.Fixtures.SENDER;
import static sh.devnode.logger.Fixtures.block;
import static sh.devnode.logger.Fixtures.emptyBlock;
import static sh.devnode.logger.Fixtures.hash;
import static sh.devnode.logger.Fixtures.mined;
import static sh.devnode.logger.Fixtures.tx;

import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import sh.devnode.bridge.HostScheduler;
import sh.devnode.core.AnsiColors;
import sh.devnode.core.error.ChainMismatchException;
import sh.devnode.core.error.LoggerException;
import sh.devnode.core.error.ProviderException;
import sh.devnode.core.error.TransactionFailedException;
import sh.devnode.core.error.UnsupportedMethodException;
import sh.devnode.core.model.CallResult;
import sh.devnode.core.model.EstimateGasFailure;
import sh.devnode.core.model.ExecutableTransaction;
import sh.devnode.core.model.ExecutionResult;
import sh.devnode.core.model.Output;
import sh.devnode.core.model.SpecId;
import sh.devnode.core.model.Trace;
import sh.devnode.core.model.TraceMessage;
import sh.devnode.core.model.TransactionFailure;
import sh.devnode.core.types.Address;
import sh.devnode.core.types.HexData;
import sh.devnode.core.types.Wei;

class DefaultActivityLoggerTest {

    private static final Wei ONE_ETH = Wei.of(1_000_000_000_000_000_000L);

    private HostScheduler scheduler;
    private TerminalPrinter printer;
    private DefaultActivityLogger logger;

    @BeforeEach
    void setUp() {
        scheduler = HostScheduler.start();
        printer = new TerminalPrinter();
        logger = newLogger(true, false);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    private DefaultActivityLogger newLogger(final boolean enabled, final boolean colors) {
        LoggerConfig config = LoggerConfig.builder()
                .enabled(enabled)
                .colors(colors)
                .printer(printer)
                .decoder(inputs -> inputs.isEmpty() ? List.of() : List.of("hello"))
                .resolver((code, calldata) -> new ContractAndFunctionName("Token", calldata == null ? null : "transfer"))
                .build();
        return new DefaultActivityLogger(config, scheduler);
    }

    private List<String> screen() {
        return printer.screen;
    }

    private static String titled(final String title, final int width, final String message) {
        return title + ":" + " ".repeat(width - title.length() - 1) + " " + message;
    }

    @Nested
    class MethodCollapsing {

        @Test
        void repeatedSuccessesShareOneLine() {
            for (int n = 1; n <= 5; n++) {
                logger.printMethodLogs("eth_blockNumber", null);

                assertEquals(1, screen().size());
                assertEquals(n == 1 ? "eth_blockNumber" : "eth_blockNumber (" + n + ")", screen().get(0));
            }
            assertEquals(4, printer.replaceCount);
            assertEquals(new LoggingState.CollapsingMethod("eth_blockNumber", 5), logger.state());
        }

        @Test
        void differentMethodStartsANewLine() {
            logger.printMethodLogs("eth_chainId", null);
            logger.printMethodLogs("eth_chainId", null);
            logger.printMethodLogs("net_version", null);
            logger.printMethodLogs("eth_chainId", null);

            assertEquals(List.of("eth_chainId (2)", "net_version", "eth_chainId"), screen());
        }

        @Test
        void errorResetsTheCount() {
            logger.printMethodLogs("eth_call", null);
            logger.printMethodLogs("eth_call", null);
            logger.printMethodLogs("eth_call", null);
            logger.printMethodLogs("eth_call",
                    new ProviderException(ProviderException.INVALID_INPUT, "execution reverted", null));
            logger.printMethodLogs("eth_call", null);

            assertEquals(List.of("eth_call (3)", "eth_call", "", "  execution reverted", "", "eth_call"), screen());
            assertEquals(new LoggingState.CollapsingMethod("eth_call", 1), logger.state());
        }

        @Test
        void blankLineFollowsOnlyWhenSomethingWasFlushed() {
            logger.logCall(SpecId.CANCUN, tx(1, CONTRACT, Wei.ZERO), callResult(Fixtures.callTrace(CONTRACT), null));
            logger.printMethodLogs("eth_call", null);

            assertEquals("", screen().get(screen().size() - 1));
            int printed = screen().size();

            logger.printMethodLogs("eth_chainId", null);
            assertEquals(printed + 1, screen().size());
        }

        @Test
        void methodIsColouredWhenColorsAreOn() {
            DefaultActivityLogger coloured = newLogger(true, true);

            coloured.printMethodLogs("eth_chainId", null);

            assertEquals(List.of("\u001B[38;5;44meth_chainId\u001B[0m"), screen());
        }
    }

    @Nested
    class MethodErrors {

        @Test
        void unsupportedMethodIsRenderedMinimally() {
            logger.printMethodLogs("eth_mining", new UnsupportedMethodException("eth_mining"));

            assertEquals(List.of("Method eth_mining is not supported"), screen());
            assertEquals(LoggingState.EMPTY, logger.state());
        }

        @Test
        void chainMismatchAddsTheMetaMaskHint() {
            logger.printMethodLogs("eth_sendRawTransaction", new ChainMismatchException(31337, 1));

            assertEquals(List.of(
                    "eth_sendRawTransaction",
                    "",
                    "  Trying to send an incompatible EIP-155 transaction, signed for another chain.",
                    "  " + LogCollector.METAMASK_HINT,
                    ""), screen());
        }

        @Test
        void transactionFailureIsNotRenderedTwice() {
            TransactionFailure failure = new TransactionFailure("reverted with reason string 'nope'", true, null);
            ExecutableTransaction sent = tx(1, CONTRACT, Wei.ZERO);
            logger.logSendTransaction(SpecId.CANCUN, sent, List.of(block(1, null, List.of(), mined(sent, failure))));

            logger.printMethodLogs("eth_sendTransaction", new TransactionFailedException(failure));

            assertEquals("eth_sendTransaction", screen().get(0));
            assertEquals(1, screen().stream().filter(line -> line.contains("nope")).count());
            assertEquals("  Error: reverted with reason string 'nope'", screen().get(screen().size() - 2));
            assertEquals("", screen().get(screen().size() - 1));
        }
    }

    @Nested
    class HardhatMining {

        @Test
        void emptyBlocksCoalesceIntoARange() {
            ExecutableTransaction sent = tx(1, CONTRACT, Wei.ZERO);
            logger.logMinedBlock(SpecId.CANCUN, List.of(emptyBlock(10, Wei.of(7))));
            assertEquals(List.of(new LogLine.Single("  Mined empty block #10 with base fee 7")), logger.bufferedLines());

            logger.logMinedBlock(SpecId.CANCUN, List.of(
                    emptyBlock(11, Wei.of(7)),
                    emptyBlock(12, Wei.of(7)),
                    block(13, Wei.of(7), List.of(), mined(sent))));

            assertEquals(LoggingState.EMPTY, logger.state());
            assertEquals(1, logger.bufferedLines().stream()
                    .filter(line -> line instanceof LogLine.Single single && single.text().contains("empty block"))
                    .count());

            logger.printMethodLogs("hardhat_mine", null);

            int width = "        Contract call".length() + 1;
            assertEquals(List.of(
                    "hardhat_mine",
                    "  Mined empty block range #10 to #12",
                    "  Mined block #13",
                    "    Block: " + hash(13),
                    "      Base fee: 7",
                    titled("      Transaction", width, sent.hash().toString()),
                    titled("        Contract call", width, "Token#transfer"),
                    titled("        From", width, SENDER.toString()),
                    titled("        To", width, CONTRACT.toString()),
                    titled("        Value", width, "0 ETH"),
                    titled("        Gas used", width, "21000 of 30000"),
                    ""), screen());
        }

        @Test
        void rangeStartIsTracked() {
            logger.logMinedBlock(SpecId.CANCUN, List.of(emptyBlock(10, null), emptyBlock(11, null)));

            assertEquals(new LoggingState.HardhatMining(10L), logger.state());
            assertEquals(List.of(new LogLine.Single("  Mined empty block range #10 to #11")), logger.bufferedLines());
        }

        @Test
        void blankLineSeparatesNonEmptyBlocksFromFollowingResults() {
            logger.logMinedBlock(SpecId.CANCUN, List.of(
                    block(5, null, List.of(), mined(tx(1, CONTRACT, Wei.ZERO))),
                    emptyBlock(6, null)));

            List<LogLine> lines = logger.bufferedLines();
            assertEquals(new LogLine.Single(""), lines.get(lines.size() - 2));
            assertEquals(new LogLine.Single("  Mined empty block #6"), lines.get(lines.size() - 1));
            assertEquals(new LoggingState.HardhatMining(6L), logger.state());
        }

        @Test
        void transactionsAreSeparatedByBlankLines() {
            ExecutableTransaction first = tx(1, CONTRACT, Wei.ZERO);
            ExecutableTransaction second = tx(2, CONTRACT, Wei.ZERO);
            logger.logMinedBlock(SpecId.CANCUN, List.of(block(3, null, List.of(), mined(first), mined(second))));

            List<LogLine> lines = logger.bufferedLines();
            int secondTx = lines.indexOf(new LogLine.WithTitle("      Transaction", second.hash().toString()));
            assertTrue(secondTx > 0);
            assertEquals(new LogLine.Single(""), lines.get(secondTx - 1));
        }
    }

    @Nested
    class IntervalMining {

        @Test
        void emptyBlocksAreReplacedInPlace() {
            logger.logIntervalMined(SpecId.CANCUN, emptyBlock(1, null));
            logger.logIntervalMined(SpecId.CANCUN, emptyBlock(2, null));
            logger.logIntervalMined(SpecId.CANCUN, emptyBlock(3, null));

            assertEquals(List.of("Mined empty block range #1 to #3"), screen());
            assertEquals(new LoggingState.IntervalMining(1L), logger.state());
        }

        @Test
        void nonEmptyBlockIsPrintedAndResetsTheRange() {
            ExecutableTransaction sent = tx(1, CONTRACT, Wei.ZERO);
            logger.logIntervalMined(SpecId.CANCUN, emptyBlock(1, null));
            logger.logIntervalMined(SpecId.CANCUN, block(2, null, List.of(), mined(sent)));
            logger.logIntervalMined(SpecId.CANCUN, emptyBlock(3, null));

            assertEquals("Mined empty block #1", screen().get(0));
            assertEquals("Mined block #2", screen().get(1));
            assertEquals("  Block: " + hash(2), screen().get(2));
            assertEquals("", screen().get(screen().size() - 2));
            assertEquals("Mined empty block #3", screen().get(screen().size() - 1));
            assertTrue(logger.bufferedLines().isEmpty());
        }

        @Test
        void intervalAndRequestMiningNeverMergeRanges() {
            logger.logIntervalMined(SpecId.CANCUN, emptyBlock(5, null));
            logger.logMinedBlock(SpecId.CANCUN, List.of(emptyBlock(6, null)));
            logger.logIntervalMined(SpecId.CANCUN, emptyBlock(7, null));

            assertEquals(List.of("Mined empty block #5", "Mined empty block #7"), screen());
            assertEquals(List.of(new LogLine.Single("  Mined empty block #6")), logger.bufferedLines());

            logger.logIntervalMined(SpecId.CANCUN, emptyBlock(8, null));
            assertEquals(List.of("Mined empty block #5", "Mined empty block range #7 to #8"), screen());
        }
    }

    @Nested
    class SendTransaction {

        @Test
        void singleTransactionRendersCompactly() {
            ExecutableTransaction sent = tx(1, CONTRACT, ONE_ETH);
            logger.logSendTransaction(SpecId.CANCUN, sent,
                    List.of(block(1, null, List.of(CONSOLE_INPUT), mined(sent))));
            logger.printMethodLogs("eth_sendTransaction", null);

            int width = "  Contract call".length() + 1;
            assertEquals(List.of(
                    "eth_sendTransaction",
                    titled("  Contract call", width, "Token#transfer"),
                    titled("  Transaction", width, sent.hash().toString()),
                    titled("  From", width, SENDER.toString()),
                    titled("  To", width, CONTRACT.toString()),
                    titled("  Value", width, "1 ETH"),
                    titled("  Gas used", width, "21000 of 30000"),
                    titled("  Block #1", width, hash(1).toString()),
                    "",
                    "  console.log:",
                    "    hello",
                    ""), screen());
        }

        @Test
        void otherTransactionsInTheSameBlockAreListed() {
            ExecutableTransaction other = tx(1, CONTRACT, Wei.ZERO);
            ExecutableTransaction sent = tx(2, CONTRACT, Wei.ZERO);
            logger.logSendTransaction(SpecId.CANCUN, sent,
                    List.of(block(4, null, List.of(), mined(other), mined(sent))));
            logger.printMethodLogs("eth_sendTransaction", null);

            assertTrue(screen().contains("  There were other pending transactions mined in the same block:"));
            assertTrue(screen().contains("  Block #4: " + hash(4)));
            assertTrue(screen().contains("  Currently sent transaction:"));
        }

        @Test
        void multipleBlocksAreListedWithTheSentHashHighlighted() {
            DefaultActivityLogger coloured = newLogger(true, true);
            ExecutableTransaction earlier = tx(1, CONTRACT, Wei.ZERO);
            ExecutableTransaction sent = tx(2, CONTRACT, Wei.ZERO);

            coloured.logSendTransaction(SpecId.CANCUN, sent, List.of(
                    block(4, null, List.of(), mined(earlier)),
                    block(5, null, List.of(), mined(sent))));

            List<LogLine> lines = coloured.bufferedLines();
            assertTrue(lines.contains(new LogLine.Single(
                    "  \u001B[38;5;214mThere were other pending transactions. More than one block had to be mined:\u001B[0m")));
            assertTrue(lines.contains(new LogLine.Single("  Block #4: " + hash(4))));
            assertTrue(lines.contains(new LogLine.Single("  Block #5: " + hash(5))));
            assertTrue(lines.contains(new LogLine.WithTitle("    Transaction", earlier.hash().toString())));
            assertTrue(lines.contains(new LogLine.WithTitle("    Transaction",
                    "\u001B[1m" + sent.hash() + "\u001B[0m")));
            assertTrue(lines.contains(new LogLine.WithTitle("  Block #5", hash(5).toString())));
        }

        @Test
        void missingTransactionIsAnInvariantViolation() {
            ExecutableTransaction sent = tx(9, CONTRACT, Wei.ZERO);

            assertThrows(IllegalStateException.class, () -> logger.logSendTransaction(SpecId.CANCUN, sent,
                    List.of(block(1, null, List.of(), mined(tx(1, CONTRACT, Wei.ZERO))))));
        }

        @Test
        void noResultsRendersNothing() {
            logger.printMethodLogs("eth_sendTransaction", null);
            logger.logSendTransaction(SpecId.CANCUN, tx(1, CONTRACT, Wei.ZERO), List.of());

            assertTrue(logger.bufferedLines().isEmpty());
            assertEquals(new LoggingState.CollapsingMethod("eth_sendTransaction", 1), logger.state());
        }
    }

    @Nested
    class Calls {

        @Test
        void precompileCallIsNamedByItsIndex() {
            Address sha256 = Address.ofLowBytes(2);
            logger.logCall(SpecId.CANCUN, tx(1, sha256, Wei.ZERO), callResult(new Trace(List.of(
                    new TraceMessage.Before(sha256, CALLDATA, null))), null));

            assertEquals(new LogLine.WithTitle("  Precompile call", "<PrecompileContract 2>"),
                    logger.bufferedLines().get(0));
        }

        @Test
        void accountWithoutCodeIsFlagged() {
            Address eoa = new Address("0x70997970c51812dc3a010c7d01b50e0d17dc79c8");
            logger.logCall(SpecId.CANCUN, tx(1, eoa, Wei.ZERO), callResult(new Trace(List.of(
                    new TraceMessage.Before(eoa, HexData.EMPTY, HexData.EMPTY))), null));

            List<LogLine> lines = logger.bufferedLines();
            assertEquals(new LogLine.Single("  WARNING: Calling an account which is not a contract"), lines.get(0));
            assertFalse(lines.stream().anyMatch(line -> line instanceof LogLine.WithTitle titled
                    && titled.title().trim().equals("Value")));
        }

        @Test
        void accountWithoutCodeWarningIsAmberWithColours() {
            DefaultActivityLogger coloured = newLogger(true, true);
            Address eoa = new Address("0x70997970c51812dc3a010c7d01b50e0d17dc79c8");
            coloured.logCall(SpecId.CANCUN, tx(1, eoa, Wei.ZERO), callResult(new Trace(List.of(
                    new TraceMessage.Before(eoa, HexData.EMPTY, HexData.EMPTY))), null));

            String warning = "WARNING: Calling an account which is not a contract";
            assertEquals(new LogLine.Single("  " + AnsiColors.paint(AnsiColors.AMBER, warning, true)),
                    coloured.bufferedLines().get(0));
        }

        @Test
        void contractCallShowsContractFunctionAndValue() {
            logger.logCall(SpecId.CANCUN, tx(1, CONTRACT, Wei.gwei(150)),
                    callResult(Fixtures.callTrace(CONTRACT), null));

            assertEquals(List.of(
                    new LogLine.WithTitle("  Contract call", "Token#transfer"),
                    new LogLine.WithTitle("  From", SENDER.toString()),
                    new LogLine.WithTitle("  To", CONTRACT.toString()),
                    new LogLine.WithTitle("  Value", "150 gwei")), logger.bufferedLines());
        }

        @Test
        void deploymentShowsTheCreatedAddress() {
            Address created = new Address("0xe7f1725e7734ce288f8367e1bb143e90bb3f0512");
            logger.logCall(SpecId.CANCUN, tx(1, null, Wei.ZERO), callResult(new Trace(List.of(
                    new TraceMessage.Before(null, CODE, null),
                    new TraceMessage.After(new ExecutionResult.Success(50_000,
                            new Output.Create(HexData.EMPTY, created))))), null));

            assertEquals(List.of(
                    new LogLine.WithTitle("  Contract deployment", "Token"),
                    new LogLine.WithTitle("  Contract address", created.toString()),
                    new LogLine.WithTitle("  From", SENDER.toString())), logger.bufferedLines());
        }

        @Test
        void deploymentTraceMustEndWithAnAfterMessage() {
            Trace truncated = new Trace(List.of(new TraceMessage.Before(null, CODE, null)));

            assertThrows(IllegalStateException.class,
                    () -> logger.logCall(SpecId.CANCUN, tx(1, null, Wei.ZERO), callResult(truncated, null)));
        }

        @Test
        void revertAndHaltFailuresAreLabelled() {
            logger.logCall(SpecId.CANCUN, tx(1, CONTRACT, Wei.ZERO), callResult(Fixtures.callTrace(CONTRACT),
                    new TransactionFailure("reverted with reason string 'nope'", true, null)));
            logger.logEstimateGasFailure(SpecId.CANCUN, tx(2, CONTRACT, Wei.ZERO), new EstimateGasFailure(
                    List.of(), Fixtures.callTrace(CONTRACT), new TransactionFailure("out of gas", false, null)));

            List<LogLine> lines = logger.bufferedLines();
            assertTrue(lines.contains(new LogLine.Single("  Error: reverted with reason string 'nope'")));
            assertTrue(lines.contains(new LogLine.Single("  TransactionExecutionError: out of gas")));
        }

        @Test
        void titleColumnWidthResetsOnFlush() {
            logger.logCall(SpecId.CANCUN, tx(1, null, Wei.ZERO), callResult(new Trace(List.of(
                    new TraceMessage.Before(null, CODE, null),
                    new TraceMessage.After(new ExecutionResult.Revert(10, HexData.EMPTY)))), null));
            logger.printMethodLogs("eth_call", null);
            printer.screen.clear();

            Address eoa = new Address("0x70997970c51812dc3a010c7d01b50e0d17dc79c8");
            logger.logCall(SpecId.CANCUN, tx(2, eoa, Wei.ZERO), callResult(new Trace(List.of()), null));
            logger.printMethodLogs("eth_estimateGas", null);

            assertEquals(List.of("eth_estimateGas", "  From: " + SENDER, "  To:   " + eoa, ""), screen());
        }
    }

    @Nested
    class ConsoleLogs {

        @Test
        void enabledLoggerBuffersMessagesUnderAHeading() {
            ExecutableTransaction call = tx(1, CONTRACT, Wei.ZERO);
            logger.logCall(SpecId.CANCUN, call,
                    new CallResult(success(), Fixtures.callTrace(CONTRACT), List.of(CONSOLE_INPUT), null));

            assertTrue(screen().isEmpty());
            List<LogLine> lines = logger.bufferedLines();
            assertEquals(List.of(new LogLine.Single(""), new LogLine.Single("  console.log:"),
                    new LogLine.Single("    hello")), lines.subList(lines.size() - 3, lines.size()));
        }

        @Test
        void disabledLoggerPrintsMessagesImmediately() {
            DefaultActivityLogger quiet = newLogger(false, false);
            quiet.logCall(SpecId.CANCUN, tx(1, CONTRACT, Wei.ZERO),
                    new CallResult(success(), Fixtures.callTrace(CONTRACT), List.of(CONSOLE_INPUT), null));
            quiet.printMethodLogs("eth_call", null);

            assertEquals(List.of("hello"), screen());
        }
    }

    @Nested
    class PrintFailures {

        @Test
        void failedPrintRaisesLoggerException() {
            printer.failing = true;

            LoggerException e = assertThrows(LoggerException.class,
                    () -> logger.printMethodLogs("eth_chainId", null));
            assertEquals("Failed to print line", e.getMessage());
        }

        @Test
        void loggerStaysUsableWithIndentationRestored() {
            DefaultActivityLogger quiet = newLogger(false, false);
            printer.failing = true;
            assertThrows(LoggerException.class, () -> quiet.logCall(SpecId.CANCUN, tx(1, CONTRACT, Wei.ZERO),
                    new CallResult(success(), Fixtures.callTrace(CONTRACT), List.of(CONSOLE_INPUT), null)));

            printer.failing = false;
            quiet.setEnabled(true);
            quiet.printMethodLogs("eth_call", null);
            printer.screen.clear();
            quiet.logCall(SpecId.CANCUN, tx(2, CONTRACT, Wei.ZERO), callResult(new Trace(List.of()), null));

            assertEquals(new LogLine.WithTitle("  From", SENDER.toString()), quiet.bufferedLines().get(0));
        }
    }

    @Test
    void createUsesTheDefaultImplementation() {
        ActivityLogger created = ActivityLogger.create(LoggerConfig.builder().printer(printer).build(), scheduler);

        assertInstanceOf(DefaultActivityLogger.class, created);
        assertTrue(created.isEnabled());
    }

    private static ExecutionResult success() {
        return new ExecutionResult.Success(21_000, new Output.Call(HexData.EMPTY));
    }

    private static CallResult callResult(final Trace trace, final TransactionFailure failure) {
        return new CallResult(success(), trace, List.of(), failure);
    }
}
