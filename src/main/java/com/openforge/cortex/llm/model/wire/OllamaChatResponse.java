package com.openforge.cortex.llm.model.wire;

/**
 * Response body of /api/chat. Also the shape of each NDJSON line when streaming;
 * older servers put streamed text in {@code response} instead of {@code message.content}.
 */
public record OllamaChatResponse(
        String model,
        WireMessage message,
        String response,
        Boolean done,
        String error
) {

    public boolean isDone() {
        return Boolean.TRUE.equals(done);
    }

    /** Text fragment carried by this response, or "" when none. */
    public String textFragment() {
        if (message != null && message.content() != null) {
            return message.content();
        }
        return response == null ? "" : response;
    }
}
