package com.chaincustody.deposit.fetch;

import com.chaincustody.chain.ChainRegistry;
import com.chaincustody.chain.UnsupportedChainException;
import com.chaincustody.config.CaffeineConfig;
import com.chaincustody.domain.ChainDescriptor;
import com.chaincustody.domain.ChainFamily;
import com.chaincustody.domain.ObservedTransaction;
import com.chaincustody.domain.TransactionDetail;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves the fetcher for a chain by its family. Cacheable non-UTXO chains are served from the
 * observed-transaction cache for its expiry window.
 */
@Slf4j
public class TransactionFetcherDispatcher {

    private final ChainRegistry chainRegistry;
    private final Map<ChainFamily, TransactionFetcher> fetchers = new EnumMap<>(ChainFamily.class);
    private final CacheManager cacheManager;

    public TransactionFetcherDispatcher(ChainRegistry chainRegistry, Collection<TransactionFetcher> fetchers,
                                        CacheManager cacheManager) {
        this.chainRegistry = chainRegistry;
        this.cacheManager = cacheManager;
        for (TransactionFetcher f : fetchers) {
            this.fetchers.put(f.family(), f);
        }
    }

    /**
     * @throws UnsupportedChainException when the chain is unknown or its family has no fetcher
     */
    public List<ObservedTransaction> fetch(String chainId, String address) {
        ChainDescriptor chain = chainRegistry.resolve(chainId);
        TransactionFetcher fetcher = fetcherFor(chain);
        Cache cache = useCache(chain) ? cacheManager.getCache(CaffeineConfig.OBSERVED_TRANSACTION_CACHE) : null;
        if (cache == null) {
            return fetcher.fetch(chain, address);
        }
        String key = cacheKey(address, chain.id());
        Cache.ValueWrapper cached = cache.get(key);
        if (cached != null && cached.get() != null) {
            log.debug("Cache hit {}", key);
            @SuppressWarnings("unchecked")
            List<ObservedTransaction> hit = (List<ObservedTransaction>) cached.get();
            return hit;
        }
        List<ObservedTransaction> fresh = List.copyOf(fetcher.fetch(chain, address));
        cache.put(key, fresh);
        return fresh;
    }

    public Optional<TransactionDetail> fetchDetail(String chainId, String hash) {
        ChainDescriptor chain = chainRegistry.resolve(chainId);
        return fetcherFor(chain).fetchDetail(chain, hash);
    }

    /** Drops the cached view of an address, e.g. after a withdrawal from it. */
    public void evict(String chainId, String address) {
        Cache cache = cacheManager.getCache(CaffeineConfig.OBSERVED_TRANSACTION_CACHE);
        if (cache != null) {
            cache.evict(cacheKey(address, chainRegistry.resolve(chainId).id()));
        }
    }

    static String cacheKey(String address, String chain) {
        return "wallet:" + address + ":transactions:" + chain;
    }

    private TransactionFetcher fetcherFor(ChainDescriptor chain) {
        TransactionFetcher fetcher = fetchers.get(chain.family());
        if (fetcher == null) {
            throw new UnsupportedChainException(chain.id());
        }
        return fetcher;
    }

    private static boolean useCache(ChainDescriptor chain) {
        return chain.cacheable() && chain.family() != ChainFamily.UTXO;
    }
}
