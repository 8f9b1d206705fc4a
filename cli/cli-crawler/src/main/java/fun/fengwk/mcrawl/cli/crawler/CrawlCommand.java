package fun.fengwk.mcrawl.cli.crawler;

import fun.fengwk.mcrawl.core.model.Platform;
import fun.fengwk.mcrawl.core.service.crawl.CrawlReport;
import fun.fengwk.mcrawl.core.service.crawl.CrawlRequest;
import fun.fengwk.mcrawl.core.service.crawl.MultiPlatformCrawlService;
import fun.fengwk.mcrawl.core.service.crawl.TaskFailure;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Runs the configured crawl job when started with {@code --crawl}.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CrawlCommand implements ApplicationRunner {

    private final MultiPlatformCrawlService crawlService;
    private final JobProperties jobProperties;

    @Override
    public void run(ApplicationArguments args) {
        if (!args.containsOption("crawl")) {
            return;
        }
        List<CrawlRequest> requests = buildRequests();
        if (requests.isEmpty()) {
            log.warn("no platform configured, set mcrawl.job.platforms");
            return;
        }
        log.info("crawl job started, platforms={}, mode={}, supported={}",
            requests.stream().map(CrawlRequest::getPlatform).collect(Collectors.toList()),
            jobProperties.getMode(),
            crawlService.supportedPlatforms());
        Map<Platform, CrawlReport> reports = crawlService.crawl(requests);
        for (CrawlReport report : reports.values()) {
            log.info("crawl job finished, report={}", report);
            for (TaskFailure failure : report.getFailures()) {
                log.info("crawl failure, platform={}, kind={}, target={}, reason={}, attempts={}, message={}",
                    report.getPlatform(), failure.kind(), failure.target(), failure.reason(),
                    failure.attempts(), failure.message());
            }
        }
    }

    List<CrawlRequest> buildRequests() {
        List<String> keywords = splitKeywords(jobProperties.getKeywords());
        List<CrawlRequest> requests = new ArrayList<>();
        for (String code : jobProperties.getPlatforms()) {
            Platform platform = Platform.fromValue(code);
            requests.add(CrawlRequest.builder()
                .platform(platform)
                .mode(jobProperties.getMode())
                .keywords(keywords)
                .contentIds(List.copyOf(jobProperties.getIds()))
                .creatorIds(List.copyOf(jobProperties.getCreatorIds()))
                .pageLimit(jobProperties.getPageLimit())
                .build());
        }
        return requests;
    }

    static List<String> splitKeywords(String keywords) {
        if (!StringUtils.hasText(keywords)) {
            return List.of();
        }
        return Arrays.stream(keywords.split(","))
            .map(String::trim)
            .filter(StringUtils::hasText)
            .collect(Collectors.toList());
    }

}
