package com.hailmary.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.ErrorCause;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.rest_client.RestClientTransport;
import com.hailmary.config.ElasticsearchConfig;
import com.hailmary.model.BulkLoadResult;
import com.hailmary.model.IndexDocument;
import lombok.extern.slf4j.Slf4j;
import org.apache.http.HttpHost;
import org.apache.http.auth.AuthScope;
import org.apache.http.auth.UsernamePasswordCredentials;
import org.apache.http.impl.client.BasicCredentialsProvider;
import org.elasticsearch.client.RestClient;
import org.elasticsearch.client.RestClientBuilder;

import java.io.Closeable;
import java.io.IOException;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Service that wraps Elasticsearch interactions for the sync pipelines.
 *
 * <p>Responsible for:
 * <ul>
 *   <li>Bulk upserting documents with per-document outcome reporting</li>
 *   <li>Counting documents per index (sync statistics and duplicate detection)</li>
 *   <li>Creating destination indices on first use</li>
 * </ul>
 *
 * <p>Upserts use bulk {@code index} operations with an explicit {@code _id}, which
 * create the document if absent and replace it otherwise.</p>
 */
@Slf4j
public class ElasticsearchService implements IndexWriter, Closeable {

    private final ElasticsearchClient client;
    private final RestClient restClient;

    public ElasticsearchService(ElasticsearchConfig config) {
        HttpHost[] hosts = config.getHosts().stream()
                .map(HttpHost::create)
                .toArray(HttpHost[]::new);

        RestClientBuilder builder = RestClient.builder(hosts)
                .setRequestConfigCallback(rcb -> rcb
                        .setConnectTimeout(config.getConnectTimeoutMs())
                        .setSocketTimeout(config.getSocketTimeoutMs()));

        if (config.getUsername() != null && !config.getUsername().isEmpty()) {
            BasicCredentialsProvider credentialsProvider = new BasicCredentialsProvider();
            credentialsProvider.setCredentials(AuthScope.ANY,
                    new UsernamePasswordCredentials(config.getUsername(), config.getPassword()));
            builder.setHttpClientConfigCallback(hcb ->
                    hcb.setDefaultCredentialsProvider(credentialsProvider));
        }

        this.restClient = builder.build();
        RestClientTransport transport = new RestClientTransport(restClient, new JacksonJsonpMapper());
        this.client = new ElasticsearchClient(transport);
    }

    @Override
    public BulkLoadResult bulkUpsert(String index, List<IndexDocument> documents) throws IOException {
        if (documents.isEmpty()) {
            return BulkLoadResult.empty();
        }

        BulkRequest.Builder bulk = new BulkRequest.Builder();
        for (IndexDocument document : documents) {
            bulk.operations(op -> op.index(idx -> idx
                    .index(index)
                    .id(document.getDocumentId())
                    .document(document.getBody())));
        }

        BulkResponse response = client.bulk(bulk.build());
        BulkLoadResult result = toLoadResult(documents, response.items());
        if (!result.isComplete()) {
            log.warn("Bulk upsert into index={} rejected {} of {} documents",
                    index, result.getFailures().size(), documents.size());
        } else {
            log.debug("Bulk upsert into index={} accepted {} documents in {}ms",
                    index, documents.size(), response.took());
        }
        return result;
    }

    /**
     * Matches bulk response items back to the submitted documents.  A document with no
     * matching item is counted as rejected.
     */
    static BulkLoadResult toLoadResult(List<IndexDocument> documents, List<BulkResponseItem> items) {
        Map<String, BulkResponseItem> itemsById = new HashMap<>();
        for (int i = 0; i < items.size(); i++) {
            BulkResponseItem item = items.get(i);
            String id = item.id() != null ? item.id()
                    : (i < documents.size() ? documents.get(i).getDocumentId() : null);
            if (id != null) {
                itemsById.put(id, item);
            }
        }

        Set<String> accepted = new LinkedHashSet<>();
        Map<String, String> failures = new LinkedHashMap<>();
        for (IndexDocument document : documents) {
            BulkResponseItem item = itemsById.get(document.getDocumentId());
            if (item == null) {
                failures.put(document.getDocumentId(), "no bulk response item");
            } else if (item.error() != null) {
                failures.put(document.getDocumentId(), describe(item.error()));
            } else {
                accepted.add(document.getDocumentId());
            }
        }
        return new BulkLoadResult(accepted, failures);
    }

    private static String describe(ErrorCause error) {
        return error.type() + ": " + error.reason();
    }

    @Override
    public long countDocuments(String index) throws IOException {
        long count = client.count(c -> c.index(index)).count();
        log.debug("Count for index={}: {}", index, count);
        return count;
    }

    @Override
    public void ensureIndex(String index) throws IOException {
        if (client.indices().exists(e -> e.index(index)).value()) {
            return;
        }
        try {
            client.indices().create(c -> c.index(index));
            log.info("Created Elasticsearch index: {}", index);
        } catch (ElasticsearchException e) {
            if (!"resource_already_exists_exception".equals(e.error().type())) {
                throw e;
            }
            log.debug("Index {} was created concurrently", index);
        }
    }

    @Override
    public boolean ping() {
        try {
            return client.ping().value();
        } catch (IOException | RuntimeException e) {
            log.warn("Elasticsearch ping failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public void close() throws IOException {
        if (restClient != null) {
            restClient.close();
        }
    }
}
