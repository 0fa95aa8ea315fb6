package com.voxagent.memory;

import java.util.List;

public interface DocumentStore {
    void add(String collection, String source, String content);
    boolean hasCollection(String collection);
    List<Passage> search(String collection, String query, float[] queryVector, int topK);
}
