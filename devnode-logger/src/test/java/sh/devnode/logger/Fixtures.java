// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.logger;

import java.util.List;

import org.jspecify.annotations.Nullable;

import sh.devnode.core.model.BlockHeader;
import sh.devnode.core.model.BlockTransaction;
import sh.devnode.core.model.DebugMineBlockResult;
import sh.devnode.core.model.ExecutableTransaction;
import sh.devnode.core.model.ExecutionResult;
import sh.devnode.core.model.MinedBlock;
import sh.devnode.core.model.Output;
import sh.devnode.core.model.Trace;
import sh.devnode.core.model.TraceMessage;
import sh.devnode.core.model.TransactionFailure;
import sh.devnode.core.types.Address;
import sh.devnode.core.types.Hash;
import sh.devnode.core.types.HexData;
import sh.devnode.core.types.Wei;

final class Fixtures {

    static final Address SENDER = new Address("0xf39fd6e51aad88f6f4ce6ab8827279cfffb92266");
    static final Address CONTRACT = new Address("0x5fbdb2315678afecb367f032d93f642f64180aa3");
    static final HexData CODE = new HexData("0x6080604052");
    static final HexData CALLDATA = new HexData("0xa9059cbb");
    static final HexData CONSOLE_INPUT = new HexData("0x41304fac");

    private Fixtures() {}

    static Hash hash(final long n) {
        return new Hash(String.format("0x%064x", n));
    }

    static ExecutableTransaction tx(final long n, final @Nullable Address to, final Wei value) {
        return new ExecutableTransaction(hash(0x1000 + n), SENDER, to, value, 30_000);
    }

    static Trace callTrace(final Address to) {
        return new Trace(List.of(
                new TraceMessage.Before(to, CALLDATA, CODE),
                new TraceMessage.After(new ExecutionResult.Success(21_000, new Output.Call(HexData.EMPTY)))));
    }

    static BlockTransaction mined(final ExecutableTransaction tx) {
        return mined(tx, null);
    }

    static BlockTransaction mined(final ExecutableTransaction tx, final @Nullable TransactionFailure failure) {
        ExecutionResult result = failure == null
                ? new ExecutionResult.Success(21_000, new Output.Call(HexData.EMPTY))
                : new ExecutionResult.Revert(21_000, HexData.EMPTY);
        return new BlockTransaction(tx, result, callTrace(CONTRACT), failure);
    }

    static BlockHeader header(final long number, final @Nullable Wei baseFee) {
        return new BlockHeader(hash(number), number, hash(number - 1), 1_700_000_000L + number, baseFee);
    }

    static DebugMineBlockResult emptyBlock(final long number, final @Nullable Wei baseFee) {
        return new DebugMineBlockResult(new MinedBlock(header(number, baseFee), List.of()), List.of());
    }

    static DebugMineBlockResult block(final long number, final @Nullable Wei baseFee,
            final List<HexData> consoleLogInputs, final BlockTransaction... transactions) {
        return new DebugMineBlockResult(new MinedBlock(header(number, baseFee), List.of(transactions)),
                consoleLogInputs);
    }
}
