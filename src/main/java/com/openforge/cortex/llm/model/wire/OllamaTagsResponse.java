package com.openforge.cortex.llm.model.wire;

import java.util.List;

/**
 * Response body of /api/tags: the models installed on the server.
 */
public record OllamaTagsResponse(List<InstalledModel> models) {

    public record InstalledModel(String name) {}
}
