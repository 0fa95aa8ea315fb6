package com.voxagent.memory;

@FunctionalInterface
public interface Embedder {
    /** Returns the embedding vector, or null when none is available. */
    float[] embed(String text);
}
