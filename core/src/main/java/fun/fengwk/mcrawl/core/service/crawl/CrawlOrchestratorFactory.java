package fun.fengwk.mcrawl.core.service.crawl;

import fun.fengwk.mcrawl.core.configuration.CrawlerProperties;
import fun.fengwk.mcrawl.core.configuration.PlatformSearchConfigResolver;
import fun.fengwk.mcrawl.core.configuration.RetryProperties;
import fun.fengwk.mcrawl.core.service.client.PlatformApi;
import fun.fengwk.mcrawl.core.service.login.SessionBootstrap;
import fun.fengwk.mcrawl.core.service.proxy.ProxyIpPool;
import fun.fengwk.mcrawl.core.service.retry.BackoffScheduler;
import fun.fengwk.mcrawl.core.service.retry.RetryPolicy;

/**
 * Builds one {@link CrawlOrchestrator} per platform run from the shared components.
 *
 * @author fengwk
 */
public class CrawlOrchestratorFactory {

    private final CrawlerProperties crawlerProperties;
    private final RetryProperties retryProperties;
    private final PlatformSearchConfigResolver searchConfigResolver;
    private final ProxyIpPool proxyIpPool;
    private final SessionBootstrap sessionBootstrap;

    /**
     * @param proxyIpPool      null when proxies are disabled
     * @param sessionBootstrap null to skip the login gate
     */
    public CrawlOrchestratorFactory(CrawlerProperties crawlerProperties, RetryProperties retryProperties,
                                    PlatformSearchConfigResolver searchConfigResolver, ProxyIpPool proxyIpPool,
                                    SessionBootstrap sessionBootstrap) {
        this.crawlerProperties = crawlerProperties;
        this.retryProperties = retryProperties;
        this.searchConfigResolver = searchConfigResolver;
        this.proxyIpPool = proxyIpPool;
        this.sessionBootstrap = sessionBootstrap;
    }

    public CrawlOrchestrator create(PlatformApi platformApi, PersistenceSink persistenceSink) {
        RetryPolicy retryPolicy = new RetryPolicy(
            retryProperties.getMaxAttempts(),
            retryProperties.getWaitMs(),
            retryProperties.getMultiplier(),
            RequestExecutor::isRetryable
        );
        return new CrawlOrchestrator(
            platformApi,
            crawlerProperties,
            searchConfigResolver.resolve(platformApi.platform()),
            new RequestExecutor(retryPolicy),
            proxyIpPool,
            new BackoffScheduler(crawlerProperties.getCrawlIntervalMs()),
            persistenceSink,
            sessionBootstrap
        );
    }

}
