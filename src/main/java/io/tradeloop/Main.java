package io.tradeloop;

import io.tradeloop.cli.TradeLoopCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new TradeLoopCommand()).execute(args);
        System.exit(code);
    }
}
