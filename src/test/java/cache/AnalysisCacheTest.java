package cache;

import main.SampleProperties;
import module.ExplorationResult;
import module.PropertyUnderTest;
import module.SymbolicArgs;
import org.junit.jupiter.api.Test;
import report.CallAnalysis;
import report.VerificationStatus;
import utils.ResultExporter;

import static org.junit.jupiter.api.Assertions.*;

public class AnalysisCacheTest {

    private static PropertyUnderTest<Object> named(String name) {
        return new PropertyUnderTest<Object>(name, (space, args) -> null, null)
                .withInput("x", SymbolicArgs.Kind.INT);
    }

    @Test
    public void missThenHit() {
        AnalysisCache cache = new AnalysisCache(8);
        PropertyUnderTest<?> abs = SampleProperties.abs();
        assertNull(cache.getResult(abs));

        ExplorationResult explored = new ExplorationResult("abs", new CallAnalysis(VerificationStatus.CONFIRMED),
                true, 2, null, 5);
        cache.putResult(abs, explored);

        AnalysisCache.CachedResult cached = cache.getResult(SampleProperties.abs());
        assertNotNull(cached);
        assertTrue(cached.isSuccess());
        assertSame(explored, cached.getExploration());
        assertTrue(cache.getCacheStats().contains("hits=1, misses=1"));
    }

    @Test
    public void failuresAreKeptWithTheirCode() {
        AnalysisCache cache = new AnalysisCache(8);
        cache.putFailure(named("slow"), ResultExporter.CODE_TIMEOUT, "timeout");

        AnalysisCache.CachedResult cached = cache.getResult(named("slow"));
        assertFalse(cached.isSuccess());
        assertNull(cached.getExploration());
        assertEquals(ResultExporter.CODE_TIMEOUT, cached.getResultCode());
        assertEquals("timeout", cached.getErrorMessage());
    }

    @Test
    public void oldestEntriesAreEvictedFirst() {
        AnalysisCache cache = new AnalysisCache(4);
        for (int i = 0; i < 10; i++) {
            cache.putFailure(named("p" + i), ResultExporter.CODE_ERROR, "e" + i);
        }
        assertEquals(4, cache.size());
        assertNull(cache.getResult(named("p5")));
        assertNotNull(cache.getResult(named("p6")));
        assertNotNull(cache.getResult(named("p9")));

        cache.clear();
        assertEquals(0, cache.size());
    }
}
