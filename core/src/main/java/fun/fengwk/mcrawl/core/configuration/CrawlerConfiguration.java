package fun.fengwk.mcrawl.core.configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.mcrawl.core.service.browser.BrowserLoginRuntime;
import fun.fengwk.mcrawl.core.service.browser.BrowserProperties;
import fun.fengwk.mcrawl.core.service.client.PlatformApi;
import fun.fengwk.mcrawl.core.service.crawl.CrawlOrchestratorFactory;
import fun.fengwk.mcrawl.core.service.crawl.LoggingPersistenceSink;
import fun.fengwk.mcrawl.core.service.crawl.MultiPlatformCrawlService;
import fun.fengwk.mcrawl.core.service.crawl.PersistenceSink;
import fun.fengwk.mcrawl.core.service.login.InMemorySmsCodeSource;
import fun.fengwk.mcrawl.core.service.login.LoginPageFactory;
import fun.fengwk.mcrawl.core.service.login.LoginStateMachine;
import fun.fengwk.mcrawl.core.service.login.SessionBootstrap;
import fun.fengwk.mcrawl.core.service.login.SessionStateStore;
import fun.fengwk.mcrawl.core.service.login.SliderGapLocator;
import fun.fengwk.mcrawl.core.service.login.SliderTrajectoryGenerator;
import fun.fengwk.mcrawl.core.service.login.SmsCodeSource;
import fun.fengwk.mcrawl.core.service.proxy.HttpProxyValidator;
import fun.fengwk.mcrawl.core.service.proxy.JishuHttpProxyProvider;
import fun.fengwk.mcrawl.core.service.proxy.ProxyHttpClients;
import fun.fengwk.mcrawl.core.service.proxy.ProxyIpPool;
import fun.fengwk.mcrawl.core.service.proxy.ProxyLeaseCache;
import fun.fengwk.mcrawl.core.service.proxy.ProxyProvider;
import fun.fengwk.mcrawl.core.service.proxy.ProxyValidator;
import fun.fengwk.mcrawl.core.service.proxy.StaticProxyProvider;
import fun.fengwk.mcrawl.core.service.proxy.WandouHttpProxyProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.stream.Collectors;

/**
 * Wiring of the crawl components.
 *
 * @author fengwk
 */
@Slf4j
@Configuration
public class CrawlerConfiguration {

    @Bean
    @ConditionalOnProperty(prefix = "mcrawl.proxy", name = "enabled", havingValue = "true")
    public ProxyProvider proxyProvider(ProxyProperties proxyProperties, ObjectMapper objectMapper) {
        String provider = proxyProperties.getProvider();
        if ("static".equalsIgnoreCase(provider)) {
            return new StaticProxyProvider(proxyProperties.getStaticProxies());
        }
        if ("wandouhttp".equalsIgnoreCase(provider)) {
            ProxyProperties.Wandou wandou = proxyProperties.getWandou();
            HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(Math.max(1, wandou.getTimeoutMs())))
                .build();
            return new WandouHttpProxyProvider(wandou, httpClient, objectMapper,
                new ProxyLeaseCache("WANDOUHTTP", Duration.ofSeconds(5)));
        }
        if ("jisuhttp".equalsIgnoreCase(provider)) {
            ProxyProperties.Jishu jishu = proxyProperties.getJishu();
            HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(Math.max(1, jishu.getTimeoutMs())))
                .build();
            return new JishuHttpProxyProvider(jishu, httpClient, objectMapper,
                new ProxyLeaseCache("JISUHTTP", Duration.ofSeconds(5)));
        }
        throw new IllegalArgumentException("unsupported proxy provider: " + provider);
    }

    @Bean
    @ConditionalOnMissingBean
    public ProxyHttpClients proxyHttpClients(ProxyProperties proxyProperties) {
        return new ProxyHttpClients(Duration.ofMillis(Math.max(1, proxyProperties.getConnectTimeoutMs())));
    }

    @Bean
    @ConditionalOnProperty(prefix = "mcrawl.proxy", name = "enabled", havingValue = "true")
    public ProxyValidator proxyValidator(ProxyProperties proxyProperties, ProxyHttpClients proxyHttpClients) {
        return new HttpProxyValidator(proxyProperties.getValidateUrl(), proxyProperties.getValidateTimeoutMs(),
            proxyHttpClients);
    }

    @Bean
    @ConditionalOnProperty(prefix = "mcrawl.proxy", name = "enabled", havingValue = "true")
    public ProxyIpPool proxyIpPool(ProxyProvider proxyProvider, ProxyValidator proxyValidator,
                                   ProxyProperties proxyProperties) {
        ProxyIpPool pool = new ProxyIpPool(
            proxyProvider,
            proxyValidator,
            proxyProperties.normalizePoolSize(),
            proxyProperties.isValidateIp(),
            proxyProperties.getAcquireAttempts(),
            proxyProperties.getAcquireWaitMs()
        );
        log.info("proxy pool created, provider={}, poolSize={}, validateIp={}",
            proxyProvider.name(), proxyProperties.normalizePoolSize(), proxyProperties.isValidateIp());
        return pool;
    }

    @Bean
    @ConditionalOnMissingBean
    public SmsCodeSource smsCodeSource() {
        return new InMemorySmsCodeSource();
    }

    @Bean
    @ConditionalOnMissingBean
    public SliderGapLocator sliderGapLocator() {
        // gap geometry comes from the platform layer, without it every drag counts as unlocated
        return page -> 0;
    }

    @Bean
    public LoginStateMachine loginStateMachine(LoginProperties loginProperties, SliderGapLocator sliderGapLocator,
                                               SmsCodeSource smsCodeSource) {
        return new LoginStateMachine(loginProperties, new SliderTrajectoryGenerator(), sliderGapLocator, smsCodeSource);
    }

    @Bean
    public SessionStateStore sessionStateStore(LoginProperties loginProperties, ObjectMapper objectMapper) {
        return new SessionStateStore(loginProperties, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public LoginPageFactory loginPageFactory(BrowserProperties browserProperties, LoginProperties loginProperties) {
        return new BrowserLoginRuntime(browserProperties, loginProperties);
    }

    @Bean
    public SessionBootstrap sessionBootstrap(LoginProperties loginProperties, LoginStateMachine loginStateMachine,
                                             SessionStateStore sessionStateStore, LoginPageFactory loginPageFactory) {
        return new SessionBootstrap(loginProperties, loginStateMachine, sessionStateStore, loginPageFactory);
    }

    @Bean
    public CrawlOrchestratorFactory crawlOrchestratorFactory(CrawlerProperties crawlerProperties,
                                                             RetryProperties retryProperties,
                                                             PlatformSearchConfigResolver searchConfigResolver,
                                                             ObjectProvider<ProxyIpPool> proxyIpPool,
                                                             SessionBootstrap sessionBootstrap) {
        return new CrawlOrchestratorFactory(crawlerProperties, retryProperties, searchConfigResolver,
            proxyIpPool.getIfAvailable(), sessionBootstrap);
    }

    @Bean
    @ConditionalOnMissingBean
    public PersistenceSink persistenceSink(ObjectMapper objectMapper) {
        return new LoggingPersistenceSink(objectMapper);
    }

    @Bean
    public MultiPlatformCrawlService multiPlatformCrawlService(CrawlOrchestratorFactory crawlOrchestratorFactory,
                                                               ObjectProvider<PlatformApi> platformApis,
                                                               PersistenceSink persistenceSink) {
        return new MultiPlatformCrawlService(crawlOrchestratorFactory,
            platformApis.orderedStream().collect(Collectors.toList()), persistenceSink);
    }

}
