package com.batchq;

import com.batchq.Models.Submission;
import com.fasterxml.jackson.databind.ObjectMapper;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Command(name = "batchq", mixinStandardHelpOptions = true, description = "Batch job scheduler", subcommands = {
        Cli.DaemonCmd.class,
        Cli.Submit.class,
        Cli.Remove.class,
        Cli.RunCmd.class,
        Cli.ListCmd.class,
        Cli.Show.class,
        Cli.Cpus.class,
        Cli.ConfigCmd.class
})
public class Cli implements Runnable {
    private static final ObjectMapper JSON = Models.JSON;

    public void run() { new CommandLine(this).usage(System.out); }

    public static void main(String[] args) { System.exit(new CommandLine(new Cli()).execute(args)); }

    static class ClientOptions {
        @Option(names = "--host", defaultValue = "localhost", description = "Daemon host")
        String host;
        @Option(names = "--port", defaultValue = "" + Config.DEFAULT_PORT, description = "Daemon port")
        int port;

        RpcClient connect() throws IOException { return new RpcClient(host, port); }
    }

    interface ClientCall {
        Object call(RpcClient client);
    }

    /** Runs one call against the daemon and prints its result; RPC errors exit with status 1. */
    private static void withClient(ClientOptions options, ClientCall call) {
        try (RpcClient client = options.connect()) {
            Object result = call.call(client);
            if (result != null) printJson(result);
        } catch (BatchException e) {
            System.err.println(e.getCode() + ": " + e.getMessage());
            System.exit(1);
        } catch (IOException | UncheckedIOException e) {
            System.err.println("Cannot reach daemon at " + options.host + ":" + options.port + ": " + e.getMessage());
            System.exit(1);
        }
    }

    @Command(name = "daemon", description = "Run the scheduler daemon in the foreground")
    static class DaemonCmd implements Runnable {
        @Option(names = "--config", defaultValue = "batchq.json", description = "Config file, created with defaults if missing")
        File configFile;
        @Option(names = "--port", description = "Override the configured RPC port")
        Integer port;
        @Option(names = "--bind", defaultValue = Daemon.DEFAULT_HOST, description = "Address to listen on")
        String bind;

        public void run() {
            Daemon daemon;
            try {
                Config config = Config.load(configFile);
                if (port != null) config.port = port;
                daemon = Daemon.start(config, bind);
            } catch (BatchException | UncheckedIOException e) {
                System.err.println("Daemon failed to start: " + e.getMessage());
                System.exit(1);
                return;
            }
            Runtime.getRuntime().addShutdownHook(new Thread(daemon::close));
            try {
                daemon.awaitShutdown();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @Command(name = "submit", description = "Submit an executable script")
    static class Submit implements Runnable {
        @Mixin ClientOptions client;
        @Parameters(index = "0", paramLabel = "SCRIPT") File script;
        @Option(names = "--cpus", required = true, description = "Number of CPUs the job needs") int cpus;
        @Option(names = {"-N", "--name"}) String name;
        @Option(names = {"-p", "--priority"}) Integer priority;
        @Option(names = {"-o", "--output"}, description = "stdout file, relative to the script's directory") String output;
        @Option(names = {"-e", "--error"}, description = "stderr file, relative to the script's directory") String error;
        @Option(names = "--nodes", split = ",", description = "Only run on these nodes") List<String> nodes;

        public void run() {
            Submission s = new Submission(script.getAbsolutePath(), cpus);
            s.name = name;
            s.priority = priority;
            s.stdout_path = output;
            s.stderr_path = error;
            s.allowed_nodes = nodes;
            s.username = System.getProperty("user.name");
            withClient(client, c -> Map.of("id", c.submit(s)));
        }
    }

    @Command(name = "rm", description = "Delete a job, killing it if it runs")
    static class Remove implements Runnable {
        @Mixin ClientOptions client;
        @Parameters(index = "0") long jobId;

        public void run() {
            withClient(client, c -> { c.remove(jobId); return null; });
            System.out.println("Removed job " + jobId);
        }
    }

    @Command(name = "run", description = "Consider a waiting job first, if its CPUs are free")
    static class RunCmd implements Runnable {
        @Mixin ClientOptions client;
        @Parameters(index = "0") long jobId;

        public void run() {
            withClient(client, c -> { c.run(jobId); return null; });
            System.out.println("Requested start of job " + jobId);
        }
    }

    @Command(name = "list", description = "List jobs")
    static class ListCmd implements Runnable {
        @Mixin ClientOptions client;
        @Option(names = "--waiting") boolean waiting;
        @Option(names = "--running") boolean running;
        @Option(names = "--finished", arity = "0..1", fallbackValue = "" + Scheduler.DEFAULT_FINISHED_LIMIT,
                description = "Show up to N finished jobs") Integer finished;

        public void run() {
            boolean all = !waiting && !running && finished == null;
            withClient(client, c -> {
                Map<String, Object> out = new LinkedHashMap<>();
                if (all || running) out.put("running", c.listRunning());
                if (all || waiting) out.put("waiting", c.listWaiting());
                if (all || finished != null) out.put("finished", c.listFinished(finished != null ? finished : Scheduler.DEFAULT_FINISHED_LIMIT));
                return out;
            });
        }
    }

    @Command(name = "show", description = "Show one job")
    static class Show implements Runnable {
        @Mixin ClientOptions client;
        @Parameters(index = "0") long jobId;

        public void run() { withClient(client, c -> c.getJob(jobId)); }
    }

    @Command(name = "cpus", description = "Show used and total CPUs")
    static class Cpus implements Runnable {
        @Mixin ClientOptions client;

        public void run() {
            withClient(client, c -> {
                int[] cpus = c.cpus();
                return Map.of("used", cpus[0], "total", cpus[1]);
            });
        }
    }

    @Command(name = "config", description = "Manage daemon configuration", subcommands = {ConfigCmd.Get.class, ConfigCmd.Set.class})
    static class ConfigCmd implements Runnable {
        public void run() { CommandLine.usage(this, System.out); }

        @Command(name = "get", description = "Show current config")
        static class Get implements Runnable {
            @Mixin ClientOptions client;
            public void run() { withClient(client, RpcClient::getConfig); }
        }

        @Command(name = "set", description = "Set a config key")
        static class Set implements Runnable {
            @Mixin ClientOptions client;
            @Parameters(index = "0") String key; @Parameters(index = "1") String value;
            public void run() { withClient(client, c -> c.setConfig(key, value)); }
        }
    }

    private static void printJson(Object value) {
        try {
            System.out.println(JSON.writerWithDefaultPrettyPrinter().writeValueAsString(value));
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
    }
}
