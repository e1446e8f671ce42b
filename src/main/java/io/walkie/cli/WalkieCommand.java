package io.walkie.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.walkie.config.DaemonSettings;
import io.walkie.config.WalkieConfig;
import io.walkie.crypto.TopicDerivation;
import io.walkie.ipc.IpcClient;
import io.walkie.ipc.IpcServer;
import io.walkie.lifecycle.DaemonLifecycle;
import io.walkie.mesh.LanMesh;
import io.walkie.observability.DaemonLog;
import io.walkie.runtime.WalkieDaemon;
import io.walkie.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "walkie",
        mixinStandardHelpOptions = true,
        description = "Secret-keyed peer channels for local programs",
        subcommands = {
                WalkieCommand.DaemonCommand.class,
                WalkieCommand.JoinCommand.class,
                WalkieCommand.SendCommand.class,
                WalkieCommand.ReadCommand.class,
                WalkieCommand.LeaveCommand.class,
                WalkieCommand.StatusCommand.class,
                WalkieCommand.PingCommand.class,
                WalkieCommand.StopCommand.class,
                WalkieCommand.SelfTestCommand.class
        }
)
public final class WalkieCommand implements Runnable {

    @Option(names = {"--home"}, description = "Daemon directory (default: $WALKIE_DIR or ~/.walkie)")
    String home;

    @Override
    public void run() {
        System.out.println("Use subcommands: daemon | join | send | read | leave | status | ping | stop | self-test");
    }

    WalkieConfig config() {
        return WalkieConfig.resolve(home);
    }

    int call(ObjectNode request) {
        WalkieConfig config = config();
        try {
            JsonNode reply = new IpcClient(config.socketPath()).call(request);
            System.out.println(Jsons.toPrettyJson(reply));
            return reply.path("ok").asBoolean(false) ? 0 : 1;
        } catch (IOException e) {
            System.err.println("ERROR cannot reach daemon at " + config.socketPath() + ": " + e.getMessage());
            return 1;
        }
    }

    @Command(name = "daemon", description = "Run the daemon in the foreground")
    static final class DaemonCommand implements Callable<Integer> {
        @ParentCommand
        WalkieCommand parent;

        @Override
        public Integer call() throws Exception {
            WalkieConfig config = parent.config();
            String instanceId = TopicDerivation.newInstanceId();
            DaemonLifecycle.ensurePrivateDirectory(config.homeDir());
            DaemonLog log = new DaemonLog(config.logFile(), instanceId);
            DaemonLifecycle lifecycle = new DaemonLifecycle(config, log);
            try {
                lifecycle.acquire();
            } catch (IllegalStateException | IOException e) {
                System.err.println("ERROR " + e.getMessage());
                return 1;
            }
            DaemonSettings settings;
            LanMesh mesh;
            WalkieDaemon daemon;
            IpcServer server;
            try {
                settings = DaemonSettings.load(config.settingsFile());
                mesh = new LanMesh(
                        settings.meshPort(),
                        settings.discoveryPort(),
                        settings.announceIntervalMs(),
                        settings.seeds(),
                        log
                );
                daemon = new WalkieDaemon(instanceId, settings, mesh, log);
                server = new IpcServer(config.socketPath(), daemon, () -> {
                    Thread stopper = new Thread(lifecycle::shutdown, "walkie-stop");
                    stopper.start();
                });
                lifecycle.onShutdown(server);
                lifecycle.onShutdown(daemon);
                server.start();
                lifecycle.secureSocket();
                daemon.start();
                mesh.start();
            } catch (IOException | RuntimeException e) {
                log.log("daemon.start_failed", Map.of("error", String.valueOf(e.getMessage())));
                System.err.println("ERROR failed to start daemon: " + e.getMessage());
                lifecycle.shutdown();
                return 1;
            }
            Runtime.getRuntime().addShutdownHook(new Thread(lifecycle::shutdown, "walkie-shutdown"));
            System.out.println("walkie daemon " + instanceId + " listening on " + config.socketPath());
            lifecycle.awaitShutdown();
            return 0;
        }
    }

    @Command(name = "join", description = "Join a channel with a shared secret")
    static final class JoinCommand implements Callable<Integer> {
        @ParentCommand
        WalkieCommand parent;

        @Parameters(index = "0", description = "Channel name")
        String channel;

        @Option(names = {"--secret", "-s"}, required = true, description = "Shared channel secret")
        String secret;

        @Override
        public Integer call() {
            return parent.call(IpcClient.request("join").put("channel", channel).put("secret", secret));
        }
    }

    @Command(name = "send", description = "Send a message to every matched peer of a channel")
    static final class SendCommand implements Callable<Integer> {
        @ParentCommand
        WalkieCommand parent;

        @Parameters(index = "0", description = "Channel name")
        String channel;

        @Parameters(index = "1", description = "Message text")
        String message;

        @Override
        public Integer call() {
            return parent.call(IpcClient.request("send").put("channel", channel).put("message", message));
        }
    }

    @Command(name = "read", description = "Read buffered messages, optionally waiting for the next one")
    static final class ReadCommand implements Callable<Integer> {
        @ParentCommand
        WalkieCommand parent;

        @Parameters(index = "0", description = "Channel name")
        String channel;

        @Option(names = {"--wait", "-w"}, description = "Wait for a message when none is buffered")
        boolean wait;

        @Option(names = {"--timeout", "-t"}, defaultValue = "30", description = "Wait timeout in seconds")
        double timeout;

        @Override
        public Integer call() {
            return parent.call(IpcClient.request("read")
                    .put("channel", channel)
                    .put("wait", wait)
                    .put("timeout", timeout));
        }
    }

    @Command(name = "leave", description = "Leave a channel")
    static final class LeaveCommand implements Callable<Integer> {
        @ParentCommand
        WalkieCommand parent;

        @Parameters(index = "0", description = "Channel name")
        String channel;

        @Override
        public Integer call() {
            return parent.call(IpcClient.request("leave").put("channel", channel));
        }
    }

    @Command(name = "status", description = "Show joined channels, matched peers and buffered counts")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        WalkieCommand parent;

        @Override
        public Integer call() {
            return parent.call(IpcClient.request("status"));
        }
    }

    @Command(name = "ping", description = "Check that the daemon is running")
    static final class PingCommand implements Callable<Integer> {
        @ParentCommand
        WalkieCommand parent;

        @Override
        public Integer call() {
            return parent.call(IpcClient.request("ping"));
        }
    }

    @Command(name = "stop", description = "Stop the daemon")
    static final class StopCommand implements Callable<Integer> {
        @ParentCommand
        WalkieCommand parent;

        @Override
        public Integer call() {
            return parent.call(IpcClient.request("stop"));
        }
    }

    @Command(name = "self-test", description = "Run in-process daemons against each other over the control protocol")
    static final class SelfTestCommand implements Callable<Integer> {
        @Option(names = {"--timeout-ms"}, defaultValue = "5000", description = "Per-step timeout in ms")
        long timeoutMs;

        @Override
        public Integer call() {
            SelfTest.Result result = new SelfTest(timeoutMs).run();
            System.out.println(Jsons.toPrettyJson(result));
            return result.passed() ? 0 : 1;
        }
    }
}
