package com.pagerwatch.service.api;

import com.pagerwatch.core.error.CapcodeLoadException;
import com.pagerwatch.core.model.Alert;
import com.pagerwatch.core.model.AlertFilter;
import com.pagerwatch.core.model.CapcodeRecord;
import com.pagerwatch.core.util.JsonUtils;
import com.pagerwatch.pipeline.capcode.CapcodeRegistry;
import com.pagerwatch.pipeline.capcode.CapcodeTable;
import com.pagerwatch.service.store.AlertStore;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

public class ApiServer {
    private static final Logger LOGGER = Logger.getLogger(ApiServer.class.getName());
    private static final DiagnosticsTracker EMPTY_DIAGNOSTICS = DiagnosticsTracker.empty();
    private static final int DEFAULT_HISTORY_LIMIT = 200;
    private static final int MAX_HISTORY_LIMIT = 5_000;
    private static final String CAPCODES_PATH = "/api/capcodes/";

    private final int port;
    private final AlertStore store;
    private final AlertStreamHandler streamHandler;
    private final CapcodeRegistry capcodes;
    private final DiagnosticsTracker diagnosticsTracker;

    private HttpServer server;
    private ExecutorService executor;

    public ApiServer(int port, AlertStore store, AlertStreamHandler streamHandler, CapcodeRegistry capcodes) {
        this(port, store, streamHandler, capcodes, null);
    }

    public ApiServer(
            int port,
            AlertStore store,
            AlertStreamHandler streamHandler,
            CapcodeRegistry capcodes,
            DiagnosticsTracker diagnosticsTracker
    ) {
        this.port = port;
        this.store = store;
        this.streamHandler = streamHandler;
        this.capcodes = capcodes;
        this.diagnosticsTracker = diagnosticsTracker;
    }

    public void start() {
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            // stream connections each hold a thread for their lifetime
            executor = Executors.newCachedThreadPool();
            server.setExecutor(executor);
            server.createContext("/api/health", this::handleHealth);
            server.createContext("/api/alerts", this::handleAlerts);
            server.createContext("/api/metrics", this::handleMetrics);
            server.createContext("/api/capcodes", this::handleCapcodeLookup);
            server.createContext("/api/capcodes/reload", this::handleCapcodeReload);
            server.createContext("/api/stream", streamHandler::handle);
            server.start();
            LOGGER.info("API listening on port " + actualPort());
        } catch (IOException e) {
            throw new IllegalStateException("Failed starting API server", e);
        }
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
        }
        if (executor != null) {
            executor.shutdownNow();
            try {
                executor.awaitTermination(2, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    public int actualPort() {
        if (server == null) {
            return port;
        }
        return server.getAddress().getPort();
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        writeJson(exchange, 200, Map.of("status", "ok"));
    }

    private void handleAlerts(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }

        AlertFilter filter;
        Optional<Duration> maxAge;
        int limit;
        try {
            QueryParams params = QueryParams.of(exchange.getRequestURI());
            filter = params.filter();
            maxAge = params.maxAge();
            limit = params.limit(DEFAULT_HISTORY_LIMIT, MAX_HISTORY_LIMIT);
        } catch (RuntimeException invalidParamError) {
            writeJson(exchange, 400, Map.of("error", "invalid_query_params"));
            return;
        }

        List<Alert> alerts = store.query(filter, maxAge, limit);
        writeJson(exchange, 200, alerts);
    }

    private void handleMetrics(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        writeJson(exchange, 200, diagnostics().metricsSnapshot());
    }

    private void handleCapcodeLookup(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        String path = exchange.getRequestURI().getPath();
        if (!path.startsWith(CAPCODES_PATH) || path.length() == CAPCODES_PATH.length()) {
            writeJson(exchange, 404, Map.of("error", "capcode_required"));
            return;
        }
        String capcode = path.substring(CAPCODES_PATH.length());
        writeJson(exchange, 200, capcodeView(capcodes.lookup(capcode)));
    }

    private void handleCapcodeReload(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "POST")) {
            return;
        }
        try {
            CapcodeTable table = capcodes.reload();
            writeJson(exchange, 200, Map.of(
                    "records", table.size(),
                    "skippedRows", table.skippedRows()
            ));
        } catch (CapcodeLoadException e) {
            LOGGER.log(Level.WARNING, "Capcode reload failed; keeping previous table", e);
            writeJson(exchange, 500, Map.of("error", "capcode_reload_failed", "message", e.getMessage()));
        }
    }

    private static Map<String, Object> capcodeView(CapcodeRecord record) {
        Map<String, Object> view = new HashMap<>();
        view.put("capcode", record.capcode());
        view.put("alias", record.alias());
        view.put("service", record.service());
        view.put("colorClass", record.service().colorClass());
        view.put("known", !record.isUnknown());
        record.priorityHint().ifPresent(priority -> view.put("priorityHint", priority));
        return view;
    }

    private boolean ensureMethod(HttpExchange exchange, String method) throws IOException {
        if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
            exchange.getResponseHeaders().set("Access-Control-Allow-Methods", method + ",OPTIONS");
            exchange.getResponseHeaders().set("Access-Control-Allow-Headers", "Content-Type");
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
            return false;
        }
        if (!method.equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.sendResponseHeaders(405, -1);
            exchange.close();
            return false;
        }
        return true;
    }

    private void writeJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload = JsonUtils.objectMapper().writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(payload);
        }
    }

    private DiagnosticsTracker diagnostics() {
        return diagnosticsTracker != null ? diagnosticsTracker : EMPTY_DIAGNOSTICS;
    }
}
