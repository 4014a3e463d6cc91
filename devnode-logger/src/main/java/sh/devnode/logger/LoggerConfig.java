// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.logger;

import java.util.List;

import sh.devnode.core.AnsiColors;

/**
 * Configuration of the activity logger.
 *
 * <p>Null callbacks are replaced by defaults: a decoder that decodes nothing, a resolver
 * that reports {@code <UnrecognizedContract>}, and a printer writing to standard out.
 *
 * @param enabled  whether the narrative is printed at all; {@code console.log} output is
 *                 printed either way
 * @param colors   whether lines carry ANSI colour codes
 * @param decoder  host function decoding {@code console.log} inputs
 * @param resolver host function naming contracts and functions
 * @param printer  host function displaying lines
 */
public record LoggerConfig(
        boolean enabled,
        boolean colors,
        ConsoleLogDecoder decoder,
        ContractNameResolver resolver,
        LinePrinter printer) {

    static final String UNRECOGNIZED_CONTRACT = "<UnrecognizedContract>";

    public LoggerConfig {
        if (decoder == null)
            decoder = inputs -> List.of();
        if (resolver == null)
            resolver = (code, calldata) -> new ContractAndFunctionName(UNRECOGNIZED_CONTRACT, null);
        if (printer == null)
            printer = ConsoleLinePrinter.stdout();
    }

    public static LoggerConfig disabled() {
        return builder().enabled(false).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean enabled = true;
        private boolean colors = AnsiColors.isTty();
        private ConsoleLogDecoder decoder;
        private ContractNameResolver resolver;
        private LinePrinter printer;

        private Builder() {}

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder colors(boolean colors) {
            this.colors = colors;
            return this;
        }

        public Builder decoder(ConsoleLogDecoder decoder) {
            this.decoder = decoder;
            return this;
        }

        public Builder resolver(ContractNameResolver resolver) {
            this.resolver = resolver;
            return this;
        }

        public Builder printer(LinePrinter printer) {
            this.printer = printer;
            return this;
        }

        public LoggerConfig build() {
            return new LoggerConfig(enabled, colors, decoder, resolver, printer);
        }
    }
}
