package com.alterante.drop;

import com.alterante.drop.command.InboxCommand;
import com.alterante.drop.command.OnlineCommand;
import com.alterante.drop.command.SendCommand;
import com.alterante.drop.command.ServerCommand;
import picocli.CommandLine;

@CommandLine.Command(
        name = "alt-drop",
        description = "Hybrid live / store-and-forward file drop for Alterante",
        mixinStandardHelpOptions = true,
        version = "0.1.0",
        subcommands = {
                ServerCommand.class,
                OnlineCommand.class,
                SendCommand.class,
                InboxCommand.class,
        }
)
public class Main implements Runnable {

    @Override
    public void run() {
        new CommandLine(this).usage(System.out);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }
}
