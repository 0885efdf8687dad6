package com.batchq;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;

/** Wires store, registry, ledger, supervisor, scheduler and RPC server into one running daemon. */
public final class Daemon implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Daemon.class);

    public static final String DEFAULT_HOST = "127.0.0.1";

    private final JobStore store;
    private final Scheduler scheduler;
    private final RpcServer server;
    private final CountDownLatch closed = new CountDownLatch(1);

    private Daemon(JobStore store, Scheduler scheduler, RpcServer server) {
        this.store = store;
        this.scheduler = scheduler;
        this.server = server;
    }

    public static Daemon start(Config config, String host) {
        return start(config, new SqliteJobStore(config.database), new LocalProcessSupervisor(Map.of("BATCHQ_ROOT", config.root)), host);
    }

    /**
     * Starts a daemon over the given store and supervisor. Failing to bind the RPC port is fatal
     * and reported as an {@link UncheckedIOException}.
     */
    public static Daemon start(Config config, JobStore store, ProcessSupervisor supervisor, String host) {
        JobRegistry registry = new JobRegistry(store);
        ResourceLedger ledger = new ResourceLedger(config.nodename, config.ncpus);
        Notifier notifier = new CompositeNotifier(List.of(new LoggingNotifier(), new SlackNotifier(config)));
        Scheduler scheduler = new Scheduler(config, registry, ledger, supervisor, notifier);
        RpcServer server;
        try {
            server = new RpcServer(new RpcDispatcher(scheduler), host, config.port);
        } catch (IOException e) {
            scheduler.close();
            store.close();
            throw new UncheckedIOException("Cannot bind RPC port " + config.port + ": " + e.getMessage(), e);
        }
        scheduler.start();
        server.start();
        log.info("Daemon up on node {} with {} cpu(s)", config.nodename, config.ncpus);
        return new Daemon(store, scheduler, server);
    }

    public int getPort() {
        return server.getPort();
    }

    public void awaitShutdown() throws InterruptedException {
        closed.await();
    }

    @Override
    public synchronized void close() {
        if (closed.getCount() == 0) return;
        server.close();
        scheduler.close();
        store.close();
        closed.countDown();
        log.info("Daemon stopped");
    }
}
