package com.vestpod.priceupdate;

/**
 * Outcome of one user's refresh.
 *
 * @param assetsFailed listed assets left with their old price (no quote, or the write failed)
 * @param eventPublished false when there was nothing to announce or publishing failed
 */
public record UserPriceRefreshResult(
        String ownerId,
        int assetsConsidered,
        int assetsUpdated,
        int assetsFailed,
        int degradedQuotes,
        boolean eventPublished) {

    public static UserPriceRefreshResult empty(String ownerId) {
        return new UserPriceRefreshResult(ownerId, 0, 0, 0, 0, false);
    }
}
