package com.genbatch.orchestrator.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Waits on the service's event stream.
 *
 * Event handling:
 *   progress                                   → logged
 *   executing, node = null, prompt_id = ours   → run the completion check
 *   execution_error for our request            → {@link GenerationFailedException}
 *
 * When no message arrives within the per-message wait the completion check
 * runs once and the stream stays open. If the stream cannot be opened or
 * drops, this backend returns empty and the caller continues with polling.
 */
public class StreamingCompletionBackend implements CompletionBackend {

    private static final Logger log = LoggerFactory.getLogger(StreamingCompletionBackend.class);

    private final EventStream.Factory streams;
    private final ObjectMapper        json;
    private final Duration            messageWait;
    private final Clock               clock;

    public StreamingCompletionBackend(EventStream.Factory streams, ObjectMapper json,
                                      Duration messageWait, Clock clock) {
        this.streams     = streams;
        this.json        = json;
        this.messageWait = messageWait;
        this.clock       = clock;
    }

    @Override
    public String name() {
        return "streaming";
    }

    @Override
    public Optional<HistoryEntry> await(WaitRequest request, CompletionCheck check) {
        try (EventStream stream = streams.open(request.correlationId())) {
            while (clock.instant().isBefore(request.deadline())) {
                Duration left = Duration.between(clock.instant(), request.deadline());
                Optional<String> message = stream.next(left.compareTo(messageWait) < 0 ? left : messageWait);
                if (message.isEmpty()) {
                    Optional<HistoryEntry> done = check.check();
                    if (done.isPresent()) return done;
                    continue;
                }
                Optional<HistoryEntry> done = handle(message.get(), request, check);
                if (done.isPresent()) return done;
            }
            return Optional.empty();
        } catch (IOException e) {
            log.warn("[{}] Event stream unavailable for {} ({}), polling instead",
                    request.label(), request.requestId(), e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationException("Interrupted while waiting for " + request.requestId(), e);
        }
    }

    private Optional<HistoryEntry> handle(String text, WaitRequest request, CompletionCheck check) {
        JsonNode event;
        try {
            event = json.readTree(text);
        } catch (JsonProcessingException e) {
            log.debug("[{}] Ignoring unparseable event: {}", request.label(), e.getOriginalMessage());
            return Optional.empty();
        }
        String   type = event.path("type").asText("");
        JsonNode data = event.path("data");

        switch (type) {
            case "progress" -> {
                int value = data.path("value").asInt(0);
                int max   = data.path("max").asInt(0);
                if (max > 0) {
                    log.info("[{}]   Progress: {}/{} ({}%)", request.label(), value, max, value * 100 / max);
                }
            }
            case "executing" -> {
                if (data.path("node").isNull() && forRequest(data, request)) {
                    return check.check();
                }
            }
            case "execution_error" -> {
                if (forRequest(data, request) || !data.has("prompt_id")) {
                    String detail = data.toString();
                    throw new GenerationFailedException("Execution error for " + request.requestId() + ": "
                            + (detail.length() > 500 ? detail.substring(0, 500) : detail));
                }
            }
            default -> { }
        }
        return Optional.empty();
    }

    private static boolean forRequest(JsonNode data, WaitRequest request) {
        return request.requestId().equals(data.path("prompt_id").asText(null));
    }
}
