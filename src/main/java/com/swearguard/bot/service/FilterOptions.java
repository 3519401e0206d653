package com.swearguard.bot.service;

/**
 * Tunables for one {@link SwearFilter}.
 *
 * @param cacheMaxSize        maximum number of cached verdicts
 * @param expansionCap        maximum number of variants considered per token or window
 * @param maxSuffixLength     letters allowed after a matched root ("fuckers" keeps a root of "fuck")
 * @param minRootLength       shortest banned term the root+suffix stage considers
 * @param phoneticKeyLength   truncation length of phonetic keys
 * @param strictMode          enables the suffix/prefix rule stage
 */
public record FilterOptions(
        int cacheMaxSize,
        int expansionCap,
        int maxSuffixLength,
        int minRootLength,
        int phoneticKeyLength,
        boolean strictMode
) {
    public static final int DEFAULT_CACHE_SIZE = 1000;
    public static final int DEFAULT_EXPANSION_CAP = 50_000;

    public FilterOptions {
        if (cacheMaxSize < 1) {
            throw new IllegalArgumentException("cacheMaxSize must be positive: " + cacheMaxSize);
        }
        if (expansionCap < 1) {
            throw new IllegalArgumentException("expansionCap must be positive: " + expansionCap);
        }
        if (maxSuffixLength < 0 || minRootLength < 1 || phoneticKeyLength < 1) {
            throw new IllegalArgumentException("Invalid suffix, root or phonetic length");
        }
    }

    public static FilterOptions defaults() {
        return new FilterOptions(
                DEFAULT_CACHE_SIZE,
                DEFAULT_EXPANSION_CAP,
                3,
                3,
                8,
                false
        );
    }

    public FilterOptions withStrictMode(boolean enabled) {
        return new FilterOptions(cacheMaxSize, expansionCap, maxSuffixLength, minRootLength,
                phoneticKeyLength, enabled);
    }

    public FilterOptions withCacheMaxSize(int size) {
        return new FilterOptions(size, expansionCap, maxSuffixLength, minRootLength,
                phoneticKeyLength, strictMode);
    }

    public FilterOptions withExpansionCap(int cap) {
        return new FilterOptions(cacheMaxSize, cap, maxSuffixLength, minRootLength,
                phoneticKeyLength, strictMode);
    }
}
