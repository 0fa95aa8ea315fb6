package com.voxagent.memory;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.index.Term;
import org.apache.lucene.queryparser.classic.QueryParser;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.KnnFloatVectorQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.TermQuery;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Vector and BM25 search over one collection, fused with reciprocal rank fusion.
 * Either leg may be skipped: no query vector means keyword-only, a blank query
 * means vector-only.
 */
class HybridSearcher {

    static final int RRF_K = 60;

    private final Analyzer analyzer;

    HybridSearcher(Analyzer analyzer) {
        this.analyzer = analyzer;
    }

    List<Passage> search(IndexSearcher searcher, String collection, String query,
                         float[] queryVector, int topK) throws Exception {
        int depth = topK * 2;
        var filter = new TermQuery(new Term(LuceneDocumentStore.FIELD_COLLECTION, collection));
        var fused = new LinkedHashMap<String, Double>();
        var docs = new HashMap<String, Document>();

        if (queryVector != null) {
            var knn = new KnnFloatVectorQuery(LuceneDocumentStore.FIELD_EMBEDDING, queryVector, depth, filter);
            accumulate(searcher, knn, depth, fused, docs);
        }
        if (query != null && !query.isBlank()) {
            accumulate(searcher, keywordQuery(query, filter), depth, fused, docs);
        }

        var passages = new ArrayList<Passage>(fused.size());
        fused.forEach((id, score) -> {
            var doc = docs.get(id);
            passages.add(new Passage(id, doc.get(LuceneDocumentStore.FIELD_CONTENT),
                    doc.get(LuceneDocumentStore.FIELD_SOURCE), score));
        });
        passages.sort(Comparator.comparingDouble(Passage::score).reversed());
        return passages.subList(0, Math.min(topK, passages.size()));
    }

    private Query keywordQuery(String query, Query filter) throws Exception {
        var parsed = new QueryParser(LuceneDocumentStore.FIELD_CONTENT, analyzer).parse(QueryParser.escape(query));
        return new BooleanQuery.Builder()
                .add(parsed, BooleanClause.Occur.MUST)
                .add(filter, BooleanClause.Occur.FILTER)
                .build();
    }

    // adds 1 / (RRF_K + rank) for every hit of one ranked list
    private static void accumulate(IndexSearcher searcher, Query query, int depth,
                                   Map<String, Double> fused, Map<String, Document> docs) throws IOException {
        var hits = searcher.search(query, depth).scoreDocs;
        var stored = searcher.storedFields();
        for (int i = 0; i < hits.length; i++) {
            var doc = stored.document(hits[i].doc);
            var id = doc.get(LuceneDocumentStore.FIELD_ID);
            fused.merge(id, 1.0 / (RRF_K + i + 1), Double::sum);
            docs.putIfAbsent(id, doc);
        }
    }
}
