package com.taskfleet.orchestrator.worker;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Reads the stream-json chunks emitted by interactive CLI agents.
 *
 * Upstream CLIs disagree on how to say "I'm done", so completion is an OR
 * over independent markers, checked in declaration order; the first match
 * wins. Content extraction is likewise a priority list of known chunk shapes.
 *
 * Pure functions over Jackson trees, no I/O.
 */
public final class StreamProtocol {

    /** One upstream convention for marking the last chunk of a response. */
    record CompletionMarker(String name, Predicate<JsonNode> matches) {}

    private static final List<CompletionMarker> COMPLETION_MARKERS = List.of(
            // OpenAI-style chat chunks (Qwen CLI): the final chunk carries a finish_reason.
            new CompletionMarker("finish_reason", chunk -> chunk.hasNonNull("finish_reason")),
            // Streams that flag the final chunk with a boolean.
            new CompletionMarker("done", chunk -> chunk.path("done").isBoolean()
                    && chunk.path("done").booleanValue()),
            // Typed event streams that end with a completion/done event.
            new CompletionMarker("type", chunk -> "completion".equals(textField(chunk, "type"))
                    || "done".equals(textField(chunk, "type"))),
            // Status objects reporting the whole request as finished.
            new CompletionMarker("status", chunk -> "completed".equals(textField(chunk, "status")))
    );

    private StreamProtocol() {}

    /** True if {@code chunk} signals the end of the response stream. */
    public static boolean isComplete(JsonNode chunk) {
        return completionMarker(chunk).isPresent();
    }

    /** Name of the first completion marker {@code chunk} satisfies. */
    public static Optional<String> completionMarker(JsonNode chunk) {
        if (chunk == null || !chunk.isObject()) return Optional.empty();
        return COMPLETION_MARKERS.stream()
                .filter(marker -> marker.matches().test(chunk))
                .map(CompletionMarker::name)
                .findFirst();
    }

    /**
     * Extract the text a chunk contributes to the response, in priority order:
     * <ol>
     *   <li>{@code delta.content}</li>
     *   <li>{@code text}</li>
     *   <li>{@code content} as a list of fragments, each fragment's {@code text} concatenated</li>
     *   <li>{@code content} as a plain string</li>
     * </ol>
     * Any other shape contributes the empty string.
     */
    public static String extractContent(JsonNode chunk) {
        if (chunk == null || !chunk.isObject()) return "";

        JsonNode delta = chunk.path("delta");
        if (delta.isObject() && delta.hasNonNull("content")) {
            return scalarText(delta.get("content"));
        }

        if (chunk.hasNonNull("text")) {
            return scalarText(chunk.get("text"));
        }

        JsonNode content = chunk.path("content");
        if (content.isArray()) {
            StringBuilder sb = new StringBuilder();
            for (JsonNode fragment : content) {
                if (fragment.isObject() && fragment.path("text").isValueNode()) {
                    sb.append(fragment.get("text").asText());
                }
            }
            return sb.toString();
        }
        if (content.isTextual()) {
            return content.asText();
        }
        return "";
    }

    private static String textField(JsonNode chunk, String field) {
        JsonNode value = chunk.path(field);
        return value.isTextual() ? value.asText() : null;
    }

    private static String scalarText(JsonNode value) {
        return value.isValueNode() ? value.asText() : "";
    }
}
