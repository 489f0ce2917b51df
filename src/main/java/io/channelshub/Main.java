package io.channelshub;

import io.channelshub.cli.ChannelsHubCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new ChannelsHubCommand()).execute(args);
        System.exit(code);
    }
}
