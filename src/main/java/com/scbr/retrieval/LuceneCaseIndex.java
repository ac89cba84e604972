package com.scbr.retrieval;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.cjk.CJKAnalyzer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.MatchAllDocsQuery;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * LuceneCaseIndex - Hybrid case search using Apache Lucene.
 *
 * <p>Lexical half: BM25 over CJK-bigram analyzed fields. Semantic half: cosine between the query
 * embedding and the case's full text embedding, cached in memory. The two are blended as
 * {@code alpha * similarity + (1 - alpha) * lexical}, with lexical normalized by the best BM25
 * score of the query.</p>
 */
public class LuceneCaseIndex implements HybridSearchCapability, Closeable {

    private static final Logger log = LoggerFactory.getLogger(LuceneCaseIndex.class);

    public static final String FIELD_SYMPTOM_TERMS = "symptom_terms";
    public static final String FIELD_FULL_TEXT = "full_text";
    public static final String FIELD_CHIEF_COMPLAINT = "chief_complaint";
    public static final Set<String> SEARCHABLE_FIELDS =
        Set.of(FIELD_SYMPTOM_TERMS, FIELD_FULL_TEXT, FIELD_CHIEF_COMPLAINT);

    private static final String FIELD_ID = "case_id";
    private static final String FIELD_SOURCE = "source";
    private static final int CANDIDATE_MULTIPLIER = 3;

    private final Directory directory;
    private final EmbeddingsClient embedClient;
    private final double alpha;
    private final Analyzer analyzer = new CJKAnalyzer();
    private final ObjectMapper mapper = new ObjectMapper();
    private final Map<String, float[]> vectorCache = new ConcurrentHashMap<>();

    private DirectoryReader reader;
    private IndexSearcher searcher;

    public LuceneCaseIndex(Directory directory, EmbeddingsClient embedClient, double alpha) {
        this.directory = directory;
        this.embedClient = embedClient;
        this.alpha = alpha;
    }

    /**
     * Opens the on-disk index from config, building it from the bundled corpus when asked to or
     * when no index exists yet.
     */
    public static LuceneCaseIndex open(RetrievalConfig config) throws IOException {
        Directory dir = FSDirectory.open(Paths.get(config.indexPath));
        LuceneCaseIndex index = new LuceneCaseIndex(dir, config.embeddingsClient(), config.hybridAlpha);
        if (config.rebuildOnStart || !DirectoryReader.indexExists(dir)) {
            try (InputStream corpus = LuceneCaseIndex.class.getResourceAsStream(config.corpusResource)) {
                if (corpus == null) {
                    throw new IOException("Corpus resource not found: " + config.corpusResource);
                }
                index.buildIndexFromCorpus(corpus);
            }
        }
        index.openForSearch();
        return index;
    }

    /**
     * Build the index from a JSONL corpus, one case object per line. Lines that fail to parse
     * or lack a case id are skipped.
     */
    public int buildIndexFromCorpus(InputStream corpusJsonl) throws IOException {
        IndexWriterConfig config = new IndexWriterConfig(analyzer);
        config.setOpenMode(IndexWriterConfig.OpenMode.CREATE);
        vectorCache.clear();

        int count = 0;
        try (IndexWriter writer = new IndexWriter(directory, config);
             BufferedReader lines = new BufferedReader(new InputStreamReader(corpusJsonl, StandardCharsets.UTF_8))) {
            String line;
            while ((line = lines.readLine()) != null) {
                if (line.isBlank()) continue;
                JsonNode json;
                try {
                    json = mapper.readTree(line);
                } catch (IOException e) {
                    log.warn("⚠️ Skipping unparseable corpus line: {}", e.getMessage());
                    continue;
                }
                String id = json.path(FIELD_ID).asText("");
                if (id.isBlank()) {
                    log.warn("⚠️ Skipping corpus line without case_id");
                    continue;
                }

                String fullText = fullText(json);
                vectorCache.put(id, embedClient.embed(fullText));

                Document doc = new Document();
                doc.add(new StringField(FIELD_ID, id, Field.Store.YES));
                doc.add(new TextField(FIELD_SYMPTOM_TERMS, joined(json.path("symptom_terms")), Field.Store.NO));
                doc.add(new TextField(FIELD_CHIEF_COMPLAINT, json.path("chief_complaint").asText(""), Field.Store.NO));
                doc.add(new TextField(FIELD_FULL_TEXT, fullText, Field.Store.YES));
                doc.add(new StoredField(FIELD_SOURCE, line));
                writer.addDocument(doc);
                count++;
            }
            writer.commit();
        }
        log.info("📚 Indexed {} cases, {} vectors cached", count, vectorCache.size());
        return count;
    }

    public void openForSearch() throws IOException {
        if (reader != null) {
            reader.close();
        }
        this.reader = DirectoryReader.open(directory);
        this.searcher = new IndexSearcher(reader);
    }

    public int size() {
        return reader == null ? 0 : reader.numDocs();
    }

    /**
     * Lexical hits come first in the candidate pool; the semantic half then adds the best
     * cosine matches among the remaining cases with {@code lexical = 0}. A non-empty index
     * therefore always yields {@code min(limit, size())} records for a known field.
     */
    @Override
    public List<JsonNode> search(String query, String field, int limit) throws IOException {
        if (searcher == null) {
            throw new IllegalStateException("Index not opened for search");
        }
        if (!SEARCHABLE_FIELDS.contains(field)) {
            log.warn("⚠️ Unknown search field '{}', returning no hits", field);
            return List.of();
        }
        if (limit <= 0 || reader.numDocs() == 0) {
            return List.of();
        }

        float[] queryVector = embedClient.embed(query);
        Map<String, ObjectNode> pool = new LinkedHashMap<>();

        Set<String> tokens = analyze(field, query);
        if (!tokens.isEmpty()) {
            BooleanQuery.Builder builder = new BooleanQuery.Builder();
            int maxClauses = IndexSearcher.getMaxClauseCount();
            tokens.stream().limit(maxClauses)
                .forEach(token -> builder.add(new TermQuery(new Term(field, token)), BooleanClause.Occur.SHOULD));

            TopDocs hits = searcher.search(builder.build(), limit * CANDIDATE_MULTIPLIER);
            float maxLexical = hits.scoreDocs.length == 0 ? 0f : hits.scoreDocs[0].score;
            for (ScoreDoc scoreDoc : hits.scoreDocs) {
                Document doc = searcher.storedFields().document(scoreDoc.doc);
                double lexical = maxLexical > 0 ? scoreDoc.score / maxLexical : 0.0;
                pool.put(doc.get(FIELD_ID), record(doc, queryVector, lexical));
            }
        }

        int lexicalHits = pool.size();
        addSemanticHits(pool, queryVector, limit);
        log.debug("🔍 '{}' on {}: {} lexical, {} semantic", query, field, lexicalHits, pool.size() - lexicalHits);

        return pool.values().stream()
            .sorted(Comparator.comparingDouble((ObjectNode n) -> n.get("score").asDouble()).reversed())
            .limit(limit)
            .collect(Collectors.toList());
    }

    private void addSemanticHits(Map<String, ObjectNode> pool, float[] queryVector, int limit) throws IOException {
        TopDocs all = searcher.search(new MatchAllDocsQuery(), reader.numDocs());
        List<Document> rest = new ArrayList<>();
        List<Double> similarities = new ArrayList<>();
        for (ScoreDoc scoreDoc : all.scoreDocs) {
            Document doc = searcher.storedFields().document(scoreDoc.doc);
            if (pool.containsKey(doc.get(FIELD_ID))) continue;
            rest.add(doc);
            similarities.add(VectorMath.unitCosine(queryVector, vectorFor(doc)));
        }

        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < rest.size(); i++) order.add(i);
        order.sort(Comparator.comparingDouble((Integer i) -> similarities.get(i)).reversed());

        for (int i : order.subList(0, Math.min(limit, order.size()))) {
            Document doc = rest.get(i);
            pool.put(doc.get(FIELD_ID), record(doc, queryVector, 0.0));
        }
    }

    private ObjectNode record(Document doc, float[] queryVector, double lexical) throws IOException {
        double similarity = VectorMath.unitCosine(queryVector, vectorFor(doc));
        ObjectNode record = (ObjectNode) mapper.readTree(doc.get(FIELD_SOURCE));
        record.put("similarity", similarity);
        record.put("lexical", lexical);
        record.put("score", alpha * similarity + (1 - alpha) * lexical);
        return record;
    }

    private float[] vectorFor(Document doc) {
        return vectorCache.computeIfAbsent(doc.get(FIELD_ID), k -> embedClient.embed(doc.get(FIELD_FULL_TEXT)));
    }

    private Set<String> analyze(String field, String text) throws IOException {
        Set<String> tokens = new LinkedHashSet<>();
        try (TokenStream stream = analyzer.tokenStream(field, text)) {
            CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
            stream.reset();
            while (stream.incrementToken()) {
                tokens.add(term.toString());
            }
            stream.end();
        }
        return tokens;
    }

    private static String fullText(JsonNode json) {
        return String.join(" ",
            json.path("pattern").asText(""),
            json.path("chief_complaint").asText(""),
            json.path("present_illness").asText(""),
            json.path("summary").asText(""),
            joined(json.path("symptom_terms")),
            joined(json.path("tongue_pulse_terms")),
            joined(json.path("zangfu_terms"))).trim();
    }

    private static String joined(JsonNode array) {
        if (!array.isArray()) {
            return array.asText("");
        }
        List<String> parts = new ArrayList<>();
        array.forEach(node -> parts.add(node.asText()));
        return String.join(" ", parts);
    }

    @Override
    public void close() throws IOException {
        if (reader != null) reader.close();
        directory.close();
        analyzer.close();
    }
}
