package com.alterante.drop.command;

import com.alterante.drop.config.DropConfig;
import com.alterante.drop.server.DropServer;
import picocli.CommandLine;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@CommandLine.Command(
        name = "server",
        description = "Run the presence server, delivery queue and HTTP API",
        mixinStandardHelpOptions = true
)
public class ServerCommand implements Callable<Integer> {

    @CommandLine.Option(names = {"--config", "-c"}, description = "Properties file")
    private Path configFile;

    @CommandLine.Option(names = {"--data-dir"}, description = "Data directory (default: data)")
    private Path dataDir;

    @CommandLine.Option(names = {"--http-port"}, description = "HTTP API port (default: 8080)")
    private Integer httpPort;

    @CommandLine.Option(names = {"--presence-port", "-p"}, description = "UDP presence port (default: 9700)")
    private Integer presencePort;

    @CommandLine.Option(names = {"--public-url"}, description = "Base URL peers use to reach the API")
    private String publicUrl;

    @CommandLine.Option(names = {"--psk"}, description = "Pre-shared key for presence packets")
    private String psk;

    @Override
    public Integer call() throws Exception {
        DropConfig config = configFile != null ? DropConfig.load(configFile) : DropConfig.defaults();
        if (dataDir != null) { config = config.withDataDir(dataDir); }
        if (httpPort != null) { config = config.withHttpPort(httpPort); }
        if (presencePort != null) { config = config.withPresencePort(presencePort); }
        if (publicUrl != null) { config = config.withPublicUrl(publicUrl); }
        if (psk != null) { config = config.withPsk(psk); }

        DropServer server = new DropServer(config, Clock.systemUTC());
        CountDownLatch stopped = new CountDownLatch(1);

        // Shut down cleanly on Ctrl+C
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            System.out.println("Shutting down...");
            server.close();
            stopped.countDown();
        }));

        server.start();
        System.out.println("HTTP API on port " + server.httpPort() + ", presence on UDP port " + server.presencePort());
        stopped.await();
        return 0;
    }
}
