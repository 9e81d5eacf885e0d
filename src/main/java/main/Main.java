package main;

import cache.AnalysisCache;
import init.Config;
import module.AnalysisOptions;
import module.ExplorationResult;
import module.PathExplorer;
import module.PropertyUnderTest;
import utils.Log;
import utils.ResultExporter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;


public class Main {

    public static void init() {
        Log.initLogLevel();
    }

    /**
     * Explores every property on its own explorer and writes one result line
     * per property. Properties already in the cache are not explored again.
     *
     * @return the finished explorations by property name
     */
    public static Map<String, ExplorationResult> analyzeAll(List<PropertyUnderTest<?>> properties,
                                                            AnalysisOptions options,
                                                            ResultExporter resultExporter) {
        int processors = Config.threads;
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                processors,
                processors * 2,
                0L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                new ThreadPoolExecutor.CallerRunsPolicy()
        );
        AnalysisCache cache = AnalysisCache.getInstance();
        Map<String, ExplorationResult> results = new LinkedHashMap<>();
        Map<PropertyUnderTest<?>, Future<ExplorationResult>> futures = new LinkedHashMap<>();

        for (PropertyUnderTest<?> property : properties) {
            AnalysisCache.CachedResult cached = cache.getResult(property);
            if (cached != null && cached.isSuccess()) {
                Log.info("Skipping already analyzed property: " + property.getName());
                results.put(property.getName(), cached.getExploration());
                continue;
            }
            futures.put(property, executor.submit(() -> processProperty(property, options)));
        }

        // leave room past the per-condition deadline for the last iteration and the detach grace
        long waitMillis = (long) ((options.getPerConditionTimeout() + options.getPerPathTimeout()
                + Config.detachGraceSeconds) * 1000);
        for (Map.Entry<PropertyUnderTest<?>, Future<ExplorationResult>> entry : futures.entrySet()) {
            PropertyUnderTest<?> property = entry.getKey();
            long startTime = System.currentTimeMillis();
            try {
                ExplorationResult result = entry.getValue().get(waitMillis, TimeUnit.MILLISECONDS);
                results.put(property.getName(), result);
                cache.putResult(property, result);
                resultExporter.writeResult(ResultExporter.CODE_SUCCESS, property.getName(), result,
                        result.getElapsedMillis(), "");
            } catch (TimeoutException e) {
                entry.getValue().cancel(true);
                Log.warn("[-] Analysis timed out: " + property.getName());
                cache.putFailure(property, ResultExporter.CODE_TIMEOUT, "timeout");
                resultExporter.writeResult(ResultExporter.CODE_TIMEOUT, property.getName(), null,
                        System.currentTimeMillis() - startTime, "timeout");
            } catch (ExecutionException e) {
                handleError(property, resultExporter, e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                handleError(property, resultExporter, e);
            }
        }

        executor.shutdown();
        try {
            executor.awaitTermination(Long.MAX_VALUE, TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Log.error("Executor termination interrupted: " + e.getMessage());
            Thread.currentThread().interrupt();
        }
        Log.info(cache.getCacheStats());
        return results;
    }

    private static ExplorationResult processProperty(PropertyUnderTest<?> property, AnalysisOptions options) {
        try (PathExplorer explorer = new PathExplorer(options)) {
            return explorer.explore(property);
        }
    }

    private static void handleError(PropertyUnderTest<?> property, ResultExporter resultExporter, Throwable e) {
        Log.errorStack("[-] Analyse error: " + property.getName(), e);
        AnalysisCache.getInstance().putFailure(property, ResultExporter.CODE_ERROR, e.toString());
        resultExporter.writeResult(ResultExporter.CODE_ERROR, property.getName(), null, 0, e.toString());
    }

    public static void main(String[] args) {
        if (args.length > 0) {
            Config.resultPath = args[0];
        }
        init();
        long startTime = System.currentTimeMillis();
        List<PropertyUnderTest<?>> properties = new ArrayList<>(SampleProperties.all());
        try (ResultExporter resultExporter = new ResultExporter(Config.resultPath)) {
            Map<String, ExplorationResult> results = analyzeAll(properties, AnalysisOptions.fromConfig(),
                    resultExporter);
            for (ExplorationResult result : results.values()) {
                Log.info("[-] " + result);
                result.getMessages().forEach(message -> Log.info("    " + message));
            }
        }
        Log.printTime("[+] Total time", startTime);
    }
}
