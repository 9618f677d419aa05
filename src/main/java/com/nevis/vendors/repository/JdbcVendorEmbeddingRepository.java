package com.nevis.vendors.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.vendors.model.EmbeddingFilter;
import com.nevis.vendors.model.EmbeddingRecord;
import com.pgvector.PGvector;
import lombok.RequiredArgsConstructor;
import lombok.SneakyThrows;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

@Repository
@RequiredArgsConstructor
public class JdbcVendorEmbeddingRepository implements VendorEmbeddingRepository {

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private final JdbcClient jdbcClient;
    private final ObjectMapper objectMapper;

    private final RowMapper<EmbeddingRecord> recordMapper = (rs, rowNum) -> new EmbeddingRecord(
        rs.getString("id"),
        rs.getString("embedding") == null ? null : new PGvector(rs.getString("embedding")).toArray(),
        rs.getArray("categories") == null ? List.of() :
            Arrays.asList((String[]) rs.getArray("categories").getArray()),
        readMetadata(rs.getString("metadata"))
    );

    @Override
    public void upsert(EmbeddingRecord record) {
        // a vendor found under a new category keeps the categories it already had
        jdbcClient.sql("""
                INSERT INTO vendor_embeddings (id, categories, embedding, metadata)
                VALUES (:id, :categories, :embedding, CAST(:metadata AS jsonb))
                ON CONFLICT (id) DO UPDATE SET
                    categories = ARRAY(
                        SELECT DISTINCT c
                        FROM unnest(vendor_embeddings.categories || EXCLUDED.categories) AS c
                        ORDER BY c
                    ),
                    embedding = EXCLUDED.embedding,
                    metadata = EXCLUDED.metadata,
                    updated_at = NOW()
                """)
            .param("id", record.id())
            .param("categories", record.categories().toArray(new String[0]))
            .param("embedding", new PGvector(record.vector()))
            .param("metadata", writeMetadata(record.metadata()))
            .update();
    }

    @Override
    @Transactional(readOnly = true)
    public List<EmbeddingRecord> fetchAll(EmbeddingFilter filter) {
        return filtered(filter).query(recordMapper).list();
    }

    @Override
    public Stream<EmbeddingRecord> streamAll(EmbeddingFilter filter) {
        return filtered(filter).query(recordMapper).stream();
    }

    private JdbcClient.StatementSpec filtered(EmbeddingFilter filter) {
        List<String> conditions = new ArrayList<>();
        if (filter.hasCategory()) {
            conditions.add(":category = ANY(categories)");
        }
        if (!filter.ids().isEmpty()) {
            conditions.add("id IN (:ids)");
        }

        String sql = "SELECT * FROM vendor_embeddings"
            + (conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions))
            + " ORDER BY id ASC";

        var statement = jdbcClient.sql(sql);
        if (filter.hasCategory()) {
            statement = statement.param("category", filter.category());
        }
        if (!filter.ids().isEmpty()) {
            statement = statement.param("ids", List.copyOf(filter.ids()));
        }
        return statement;
    }

    @SneakyThrows
    private String writeMetadata(Map<String, Object> metadata) {
        return objectMapper.writeValueAsString(metadata);
    }

    @SneakyThrows
    private Map<String, Object> readMetadata(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        return objectMapper.readValue(json, METADATA_TYPE);
    }
}
