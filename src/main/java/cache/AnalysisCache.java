package cache;

import module.ExplorationResult;
import module.PropertyUnderTest;
import utils.Log;
import utils.ResultExporter;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Outcomes of explored properties, so a batch never explores the same
 * property twice. Evicts the oldest entries first once full.
 */
public class AnalysisCache {

    private final ConcurrentHashMap<String, CachedResult> resultCache;
    // insertion order, oldest first
    private final ConcurrentLinkedQueue<String> insertionOrder = new ConcurrentLinkedQueue<>();

    private final AtomicLong hitCount = new AtomicLong(0);
    private final AtomicLong missCount = new AtomicLong(0);

    private static volatile AnalysisCache instance;
    private static final Object lock = new Object();

    private final int maxCacheSize;

    AnalysisCache(int maxCacheSize) {
        this.maxCacheSize = maxCacheSize;
        this.resultCache = new ConcurrentHashMap<>(maxCacheSize);
        Log.info("AnalysisCache initialized with max size: " + maxCacheSize);
    }

    public static AnalysisCache getInstance() {
        if (instance == null) {
            synchronized (lock) {
                if (instance == null) {
                    instance = new AnalysisCache(10000);
                }
            }
        }
        return instance;
    }

    public CachedResult getResult(PropertyUnderTest<?> property) {
        String key = property.cacheKey();
        CachedResult result = resultCache.get(key);
        if (result == null) {
            missCount.incrementAndGet();
            Log.debug("Cache miss for: " + key);
            return null;
        }
        hitCount.incrementAndGet();
        Log.debug("Cache hit for: " + key);
        return result;
    }

    /** Records a finished exploration. */
    public void putResult(PropertyUnderTest<?> property, ExplorationResult exploration) {
        put(property.cacheKey(), new CachedResult(exploration, ResultExporter.CODE_SUCCESS, ""));
    }

    /** Records an exploration that ended without a result. */
    public void putFailure(PropertyUnderTest<?> property, int resultCode, String errorMessage) {
        put(property.cacheKey(), new CachedResult(null, resultCode, errorMessage));
    }

    private void put(String key, CachedResult cachedResult) {
        if (resultCache.put(key, cachedResult) == null) {
            insertionOrder.add(key);
        }
        while (resultCache.size() > maxCacheSize) {
            String oldest = insertionOrder.poll();
            if (oldest == null) {
                break;
            }
            resultCache.remove(oldest);
            Log.debug("Evicted cached result for: " + oldest);
        }
        Log.debug("Cached result for: " + key);
    }

    public int size() {
        return resultCache.size();
    }

    public String getCacheStats() {
        long hits = hitCount.get();
        long misses = missCount.get();
        long total = hits + misses;
        double hitRate = total > 0 ? (double) hits / total * 100 : 0;
        return String.format("AnalysisCache[size=%d, hits=%d, misses=%d, hitRate=%.2f%%]",
                resultCache.size(), hits, misses, hitRate);
    }

    public void clear() {
        resultCache.clear();
        insertionOrder.clear();
        hitCount.set(0);
        missCount.set(0);
        Log.info("AnalysisCache cleared");
    }

    public static class CachedResult {
        private final ExplorationResult exploration;
        private final int resultCode;
        private final String errorMessage;
        private final long cacheTime = System.currentTimeMillis();

        CachedResult(ExplorationResult exploration, int resultCode, String errorMessage) {
            this.exploration = exploration;
            this.resultCode = resultCode;
            this.errorMessage = errorMessage;
        }

        /** Null unless the exploration finished. */
        public ExplorationResult getExploration() {
            return exploration;
        }

        public boolean isSuccess() {
            return resultCode == ResultExporter.CODE_SUCCESS;
        }

        public int getResultCode() {
            return resultCode;
        }

        public String getErrorMessage() {
            return errorMessage;
        }

        public long getCacheTime() {
            return cacheTime;
        }
    }
}
