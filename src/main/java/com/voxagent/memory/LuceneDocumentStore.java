package com.voxagent.memory;

import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.document.*;
import org.apache.lucene.index.*;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.store.FSDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Local retrieval store: one Lucene index holding every collection, each document
 * tagged with its collection name and source. Vectors are optional per document.
 */
public class LuceneDocumentStore implements DocumentStore, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LuceneDocumentStore.class);

    static final String FIELD_ID = "id";
    static final String FIELD_COLLECTION = "collection";
    static final String FIELD_SOURCE = "source";
    static final String FIELD_CONTENT = "content";
    static final String FIELD_EMBEDDING = "embedding";

    private final Embedder embedder;
    private final FSDirectory directory;
    private final StandardAnalyzer analyzer = new StandardAnalyzer();
    private final HybridSearcher hybridSearcher = new HybridSearcher(analyzer);
    private final IndexWriter writer;
    private volatile int vectorDimension = -1;

    public LuceneDocumentStore(Embedder embedder, String indexPath) throws IOException {
        this.embedder = embedder;
        var path = Path.of(indexPath);
        Files.createDirectories(path);
        this.directory = FSDirectory.open(path);
        var config = new IndexWriterConfig(analyzer);
        config.setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
        this.writer = new IndexWriter(directory, config);
        this.vectorDimension = storedVectorDimension();
    }

    private int storedVectorDimension() throws IOException {
        if (!DirectoryReader.indexExists(directory)) return -1;
        try (var reader = DirectoryReader.open(directory)) {
            var info = FieldInfos.getMergedFieldInfos(reader).fieldInfo(FIELD_EMBEDDING);
            return info != null ? info.getVectorDimension() : -1;
        }
    }

    @Override
    public void add(String collection, String source, String content) {
        try {
            var doc = new Document();
            doc.add(new StringField(FIELD_ID, UUID.randomUUID().toString(), Field.Store.YES));
            doc.add(new StringField(FIELD_COLLECTION, collection, Field.Store.YES));
            doc.add(new StoredField(FIELD_SOURCE, source != null ? source : "Unknown"));
            doc.add(new TextField(FIELD_CONTENT, content, Field.Store.YES));

            var vec = embedder.embed(content);
            if (vec != null) {
                if (vectorDimension < 0) vectorDimension = vec.length;
                if (vec.length == vectorDimension) {
                    doc.add(new KnnFloatVectorField(FIELD_EMBEDDING, vec));
                } else {
                    log.warn("Skipping vector of dimension {} (index uses {})", vec.length, vectorDimension);
                }
            }

            writer.addDocument(doc);
            writer.commit();
        } catch (Exception e) {
            log.error("Failed to index document from {}", source, e);
        }
    }

    @Override
    public boolean hasCollection(String collection) {
        try {
            if (!DirectoryReader.indexExists(directory)) return false;
            try (var reader = DirectoryReader.open(directory)) {
                var searcher = new IndexSearcher(reader);
                return searcher.count(new TermQuery(new Term(FIELD_COLLECTION, collection))) > 0;
            }
        } catch (IOException e) {
            log.error("Failed to inspect collection {}", collection, e);
            return false;
        }
    }

    @Override
    public List<Passage> search(String collection, String query, float[] queryVector, int topK) {
        try {
            if (!DirectoryReader.indexExists(directory)) return List.of();
            try (var reader = DirectoryReader.open(directory)) {
                var searcher = new IndexSearcher(reader);
                var vector = queryVector != null && queryVector.length == vectorDimension ? queryVector : null;
                return hybridSearcher.search(searcher, collection, query, vector, topK);
            }
        } catch (Exception e) {
            log.error("Failed to search collection {}", collection, e);
            return List.of();
        }
    }

    @Override
    public void close() {
        try {
            writer.close();
            directory.close();
            analyzer.close();
        } catch (IOException e) {
            log.error("Failed to close document store", e);
        }
    }
}
