package com.pagerwatch.service.api;

import com.pagerwatch.core.model.Alert;
import com.pagerwatch.core.model.AlertFilter;
import com.pagerwatch.core.util.JsonUtils;
import com.pagerwatch.service.hub.BroadcastHub;
import com.pagerwatch.service.hub.Subscriber;
import com.pagerwatch.service.hub.SubscriberState;
import com.pagerwatch.service.hub.Subscription;
import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Server-Sent Events live feed. Each connection is one hub subscriber: the filtered snapshot goes
 * out first as a single {@code snapshot} frame, then every matching alert as an {@code alert}
 * frame. The connection's thread blocks on its own queue only.
 */
public class AlertStreamHandler {
    private static final Logger LOGGER = Logger.getLogger(AlertStreamHandler.class.getName());

    private final BroadcastHub hub;
    private final Duration keepAliveInterval;
    private final int snapshotLimit;

    public AlertStreamHandler(BroadcastHub hub, Duration keepAliveInterval, int snapshotLimit) {
        this.hub = hub;
        this.keepAliveInterval = keepAliveInterval;
        this.snapshotLimit = snapshotLimit;
    }

    public void handle(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.sendResponseHeaders(405, -1);
            exchange.close();
            return;
        }

        AlertFilter filter;
        Optional<Duration> maxAge;
        try {
            QueryParams params = QueryParams.of(exchange.getRequestURI());
            filter = params.filter();
            maxAge = params.maxAge();
        } catch (RuntimeException invalidParamError) {
            byte[] payload = JsonUtils.toJson(Map.of("error", "invalid_query_params")).getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "application/json");
            exchange.sendResponseHeaders(400, payload.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(payload);
            }
            return;
        }

        exchange.getResponseHeaders().set("Content-Type", "text/event-stream");
        exchange.getResponseHeaders().set("Cache-Control", "no-cache");
        exchange.getResponseHeaders().set("Connection", "keep-alive");
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.sendResponseHeaders(200, 0);

        OutputStream out = exchange.getResponseBody();
        Subscription subscription;
        try {
            subscription = hub.subscribe(filter, maxAge, snapshotLimit);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Stream subscription failed", e);
            closeQuietly(out);
            exchange.close();
            return;
        }
        Subscriber subscriber = subscription.subscriber();
        try {
            write(out, ": connected\n\n");
            write(out, frame("snapshot", subscriber.id(), JsonUtils.toJson(subscription.snapshot())));
            while (!Thread.currentThread().isInterrupted()) {
                Optional<Alert> next = subscriber.poll(keepAliveInterval);
                if (next.isPresent()) {
                    write(out, frame("alert", next.get().id(), JsonUtils.toJson(next.get())));
                } else if (subscriber.state() != SubscriberState.ACTIVE) {
                    break;
                } else {
                    write(out, ": keepalive\n\n");
                }
            }
        } catch (IOException disconnected) {
            LOGGER.fine(() -> "Stream client " + subscriber.id() + " went away: " + disconnected.getMessage());
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
        } finally {
            hub.unsubscribe(subscriber);
            closeQuietly(out);
            exchange.close();
        }
    }

    private static String frame(String event, long id, String data) {
        return "event: " + event + "\n" +
                "id: " + id + "\n" +
                "data: " + data + "\n\n";
    }

    private static void write(OutputStream out, String data) throws IOException {
        out.write(data.getBytes(StandardCharsets.UTF_8));
        out.flush();
    }

    private static void closeQuietly(OutputStream out) {
        try {
            out.close();
        } catch (IOException ignored) {
            // peer already gone
        }
    }
}
