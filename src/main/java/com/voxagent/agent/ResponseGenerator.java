package com.voxagent.agent;

import java.util.concurrent.CompletableFuture;

/** Produces the spoken answer for one task. */
public interface ResponseGenerator {
    CompletableFuture<String> generate(GenerationRequest request);
}
