package com.vestpod.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for assets. Used by the price update job (read listed assets, write prices) and the alert check job.
 */
public interface AssetRepository extends MongoRepository<Asset, String> {

    List<Asset> findByOwnerIdAndSymbolIsNotNullAndAssetClassNot(String ownerId, AssetClass excluded);

    Optional<Asset> findFirstByOwnerIdAndSymbolIsNotNullAndAssetClassNotOrderByLastPriceUpdateTimeDesc(
            String ownerId, AssetClass excluded);

    default List<Asset> findListedByOwnerId(String ownerId) {
        return findByOwnerIdAndSymbolIsNotNullAndAssetClassNot(ownerId, AssetClass.UNLISTED);
    }

    /**
     * Most recently priced listed asset of the owner; empty when the owner holds no listed assets.
     */
    default Optional<Asset> findMostRecentlyUpdatedListed(String ownerId) {
        return findFirstByOwnerIdAndSymbolIsNotNullAndAssetClassNotOrderByLastPriceUpdateTimeDesc(
                ownerId, AssetClass.UNLISTED);
    }
}
