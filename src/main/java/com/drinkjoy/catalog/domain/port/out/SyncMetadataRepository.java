package com.drinkjoy.catalog.domain.port.out;

import com.drinkjoy.catalog.domain.model.SyncMetadata;

import java.util.Optional;

public interface SyncMetadataRepository {

    Optional<SyncMetadata> find(String sourceId);

    void save(SyncMetadata metadata);
}
