package com.voxagent.memory;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Session-scoped memo of query embeddings keyed by the normalized query text. Holds at
 * most {@code capacity} vectors and evicts the oldest insertion first. Null vectors are
 * not cached so a transient embedding failure is retried on the next query. Stored
 * vectors are copied on the way in and out.
 */
public class EmbeddingCache implements Embedder {

    public static final int DEFAULT_CAPACITY = 100;

    private final Embedder delegate;
    private final Map<String, float[]> entries;

    public EmbeddingCache(Embedder delegate) {
        this(delegate, DEFAULT_CAPACITY);
    }

    public EmbeddingCache(Embedder delegate, int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be positive");
        this.delegate = delegate;
        this.entries = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, float[]> eldest) {
                return size() > capacity;
            }
        };
    }

    @Override
    public float[] embed(String text) {
        var key = normalize(text);
        synchronized (entries) {
            var hit = entries.get(key);
            if (hit != null) return hit.clone();
        }
        var vec = delegate.embed(text);
        if (vec != null) {
            synchronized (entries) {
                entries.putIfAbsent(key, vec.clone());
            }
        }
        return vec;
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    static String normalize(String text) {
        return text == null ? "" : text.strip().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }
}
