package com.batchq;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Line-delimited JSON-RPC over TCP. Each connection gets its own thread and may carry any number
 * of requests; responses are written in request order.
 */
public final class RpcServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RpcServer.class);

    public static final int DEFAULT_MAX_LINE = 1 << 20;
    private static final int EOF = -1;
    private static final int LINE = 0;
    private static final int OVERSIZED = 1;

    private final RpcDispatcher dispatcher;
    private final int maxLine;
    private final ServerSocket serverSocket;
    private final ExecutorService connections = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "batchq-rpc");
        t.setDaemon(true);
        return t;
    });
    private final Set<Socket> open = ConcurrentHashMap.newKeySet();
    private volatile boolean running = true;

    /** Binds immediately; a port of 0 picks a free one. */
    public RpcServer(RpcDispatcher dispatcher, String host, int port) throws IOException {
        this(dispatcher, host, port, DEFAULT_MAX_LINE);
    }

    /** Request lines longer than {@code maxLine} chars are skipped and answered with an invalid-request error. */
    public RpcServer(RpcDispatcher dispatcher, String host, int port, int maxLine) throws IOException {
        this.dispatcher = dispatcher;
        this.maxLine = maxLine;
        this.serverSocket = new ServerSocket();
        serverSocket.setReuseAddress(true);
        serverSocket.bind(new InetSocketAddress(InetAddress.getByName(host), port));
    }

    public int getPort() {
        return serverSocket.getLocalPort();
    }

    public void start() {
        Thread acceptor = new Thread(this::acceptLoop, "batchq-rpc-accept");
        acceptor.setDaemon(true);
        acceptor.start();
        log.info("RPC server listening on {}", serverSocket.getLocalSocketAddress());
    }

    private void acceptLoop() {
        while (running) {
            try {
                Socket socket = serverSocket.accept();
                open.add(socket);
                connections.submit(() -> serve(socket));
            } catch (IOException e) {
                if (running) log.warn("Accept failed: {}", e.getMessage());
            }
        }
    }

    private void serve(Socket socket) {
        try (socket;
             BufferedReader in = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
             BufferedWriter out = new BufferedWriter(new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8))) {
            StringBuilder line = new StringBuilder();
            int status;
            while ((status = readLine(in, line)) != EOF) {
                String response;
                if (status == OVERSIZED) {
                    log.warn("Dropped request from {} longer than {} chars", socket.getRemoteSocketAddress(), maxLine);
                    response = RpcDispatcher.errorLine(new BatchException(ErrorCode.INVALID_REQUEST,
                            "Invalid request: line longer than " + maxLine + " chars"));
                } else {
                    if (line.toString().isBlank()) continue;
                    response = dispatcher.handle(line.toString());
                }
                if (response == null) continue;
                out.write(response);
                out.write('\n');
                out.flush();
            }
        } catch (SocketException e) {
            log.debug("Connection from {} closed: {}", socket.getRemoteSocketAddress(), e.getMessage());
        } catch (IOException e) {
            log.warn("Connection from {} failed: {}", socket.getRemoteSocketAddress(), e.getMessage());
        } finally {
            open.remove(socket);
        }
    }

    /**
     * Reads up to the next newline into {@code line}, keeping at most {@code maxLine} chars. The rest
     * of an oversized line is read and thrown away so the connection stays usable.
     */
    private int readLine(BufferedReader in, StringBuilder line) throws IOException {
        line.setLength(0);
        boolean oversized = false;
        int c;
        while ((c = in.read()) != -1 && c != '\n') {
            if (oversized) continue;
            if (line.length() >= maxLine) {
                oversized = true;
                line.setLength(0);
            } else {
                line.append((char) c);
            }
        }
        if (c == -1 && line.length() == 0 && !oversized) return EOF;
        if (oversized) return OVERSIZED;
        if (line.length() > 0 && line.charAt(line.length() - 1) == '\r') line.setLength(line.length() - 1);
        return LINE;
    }

    @Override
    public void close() {
        running = false;
        try {
            serverSocket.close();
        } catch (IOException e) {
            log.warn("Could not close server socket: {}", e.getMessage());
        }
        for (Socket s : open) {
            try {
                s.close();
            } catch (IOException e) {
                log.debug("Could not close connection: {}", e.getMessage());
            }
        }
        connections.shutdownNow();
    }
}
