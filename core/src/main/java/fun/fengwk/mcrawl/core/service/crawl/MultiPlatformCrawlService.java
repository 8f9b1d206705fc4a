package fun.fengwk.mcrawl.core.service.crawl;

import fun.fengwk.mcrawl.core.model.Platform;
import fun.fengwk.mcrawl.core.service.client.PlatformApi;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs several platform crawls side by side, one thread per platform.
 *
 * @author fengwk
 */
@Slf4j
public class MultiPlatformCrawlService {

    private final CrawlOrchestratorFactory orchestratorFactory;
    private final Map<Platform, PlatformApi> platformApis = new EnumMap<>(Platform.class);
    private final PersistenceSink persistenceSink;
    private final Set<CrawlOrchestrator> running = ConcurrentHashMap.newKeySet();

    public MultiPlatformCrawlService(CrawlOrchestratorFactory orchestratorFactory, List<PlatformApi> platformApis,
                                     PersistenceSink persistenceSink) {
        this.orchestratorFactory = orchestratorFactory;
        this.persistenceSink = persistenceSink;
        for (PlatformApi platformApi : platformApis) {
            PlatformApi previous = this.platformApis.put(platformApi.platform(), platformApi);
            if (previous != null) {
                throw new IllegalStateException("duplicate platform api, platform=" + platformApi.platform());
            }
        }
    }

    public Set<Platform> supportedPlatforms() {
        return platformApis.keySet();
    }

    /**
     * Run the requests concurrently and wait for all of them.
     *
     * @return report per platform
     */
    public Map<Platform, CrawlReport> crawl(List<CrawlRequest> requests) {
        if (requests.isEmpty()) {
            return Map.of();
        }
        AtomicInteger threadIndex = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(requests.size(), runnable -> {
            Thread thread = new Thread(runnable, "mcrawl-platform-" + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        try {
            List<CompletableFuture<CrawlReport>> futures = new ArrayList<>();
            for (CrawlRequest request : requests) {
                futures.add(CompletableFuture.supplyAsync(() -> crawlPlatform(request), executor));
            }
            Map<Platform, CrawlReport> reports = new EnumMap<>(Platform.class);
            for (CompletableFuture<CrawlReport> future : futures) {
                CrawlReport report = future.join();
                reports.put(report.getPlatform(), report);
            }
            return reports;
        } finally {
            executor.shutdownNow();
        }
    }

    @PreDestroy
    public void cancelAll() {
        for (CrawlOrchestrator orchestrator : running) {
            orchestrator.cancel();
        }
    }

    private CrawlReport crawlPlatform(CrawlRequest request) {
        PlatformApi platformApi = platformApis.get(request.getPlatform());
        if (platformApi == null) {
            log.warn("no platform api registered, platform={}", request.getPlatform());
            return CrawlReport.aborted(request.getPlatform(), request.getMode(), "no platform api registered");
        }
        CrawlOrchestrator orchestrator = orchestratorFactory.create(platformApi, persistenceSink);
        running.add(orchestrator);
        try {
            return orchestrator.start(request);
        } catch (Exception ex) {
            log.error("platform crawl failed, platform={}, mode={}, error={}",
                request.getPlatform(), request.getMode(), ex.getMessage(), ex);
            CrawlReport report = orchestrator.getReport();
            report.abort(ex.getMessage());
            return report;
        } finally {
            running.remove(orchestrator);
        }
    }

}
