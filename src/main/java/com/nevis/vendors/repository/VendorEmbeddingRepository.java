package com.nevis.vendors.repository;

import com.nevis.vendors.model.EmbeddingFilter;
import com.nevis.vendors.model.EmbeddingRecord;

import java.util.List;
import java.util.stream.Stream;

public interface VendorEmbeddingRepository {
    void upsert(EmbeddingRecord record);
    List<EmbeddingRecord> fetchAll(EmbeddingFilter filter);

    /**
     * Lazily reads matching records. The stream holds a connection and must be closed.
     */
    Stream<EmbeddingRecord> streamAll(EmbeddingFilter filter);
}
