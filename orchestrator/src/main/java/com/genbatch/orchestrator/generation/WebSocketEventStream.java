package com.genbatch.orchestrator.generation;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link EventStream} over the service's {@code /ws?clientId=} WebSocket.
 *
 * The JDK WebSocket is callback based; complete text messages are handed to
 * the reading thread through a queue. Close and error callbacks enqueue a
 * terminal signal so a blocked reader wakes up and sees the failure.
 */
public class WebSocketEventStream implements EventStream {

    private static final String CLOSED = "\u0000closed";

    private final WebSocket             socket;
    private final BlockingQueue<String> inbox;
    private volatile Throwable          failure;

    private WebSocketEventStream(WebSocket socket, BlockingQueue<String> inbox, Listener listener) {
        this.socket = socket;
        this.inbox  = inbox;
        listener.owner = this;
    }

    /** Factory bound to one service base URL ({@code http(s)://host:port}). */
    public static EventStream.Factory factory(HttpClient http, String baseUrl, Duration connectTimeout) {
        String wsBase = baseUrl.replaceFirst("^https://", "wss://").replaceFirst("^http://", "ws://");
        return correlationId -> open(http,
                URI.create(wsBase + "/ws?clientId=" + URLEncoder.encode(correlationId, StandardCharsets.UTF_8)),
                connectTimeout);
    }

    static WebSocketEventStream open(HttpClient http, URI uri, Duration connectTimeout) throws IOException {
        BlockingQueue<String> inbox = new LinkedBlockingQueue<>();
        Listener listener = new Listener(inbox);
        try {
            WebSocket socket = http.newWebSocketBuilder()
                    .connectTimeout(connectTimeout)
                    .buildAsync(uri, listener)
                    .get(connectTimeout.toMillis() + 1000, TimeUnit.MILLISECONDS);
            return new WebSocketEventStream(socket, inbox, listener);
        } catch (ExecutionException e) {
            throw new IOException("WebSocket connect to " + uri + " failed", e.getCause());
        } catch (TimeoutException e) {
            throw new IOException("WebSocket connect to " + uri + " timed out", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted connecting to " + uri, e);
        }
    }

    @Override
    public Optional<String> next(Duration wait) throws IOException, InterruptedException {
        String msg = inbox.poll(wait.toMillis(), TimeUnit.MILLISECONDS);
        if (msg == null) return Optional.empty();
        if (CLOSED.equals(msg)) {
            inbox.offer(CLOSED);
            throw new IOException("Event stream closed", failure);
        }
        return Optional.of(msg);
    }

    @Override
    public void close() {
        if (!socket.isOutputClosed()) {
            socket.sendClose(WebSocket.NORMAL_CLOSURE, "done");
        }
        socket.abort();
    }

    // ------------------------------------------------------------------
    // Listener
    // ------------------------------------------------------------------

    private static final class Listener implements WebSocket.Listener {

        private final BlockingQueue<String> inbox;
        private final StringBuilder         partial = new StringBuilder();
        private volatile WebSocketEventStream owner;

        Listener(BlockingQueue<String> inbox) {
            this.inbox = inbox;
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                inbox.offer(partial.toString());
                partial.setLength(0);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            inbox.offer(CLOSED);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            if (owner != null) owner.failure = error;
            inbox.offer(CLOSED);
        }
    }
}
