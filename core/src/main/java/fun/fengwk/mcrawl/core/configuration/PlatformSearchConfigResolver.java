package fun.fengwk.mcrawl.core.configuration;

import fun.fengwk.mcrawl.core.model.Platform;
import fun.fengwk.mcrawl.core.model.search.BilibiliSearchConfig;
import fun.fengwk.mcrawl.core.model.search.DouyinSearchConfig;
import fun.fengwk.mcrawl.core.model.search.KuaishouSearchConfig;
import fun.fengwk.mcrawl.core.model.search.PlatformSearchConfig;
import fun.fengwk.mcrawl.core.model.search.TiebaSearchConfig;
import fun.fengwk.mcrawl.core.model.search.WeiboSearchConfig;
import fun.fengwk.mcrawl.core.model.search.XhsSearchConfig;
import fun.fengwk.mcrawl.core.model.search.ZhihuSearchConfig;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns {@link SearchProperties} into one typed search config per platform.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PlatformSearchConfigResolver {

    private static final Set<String> XHS_SORT_TYPES = Set.of("general", "popularity_descending", "time_descending");
    private static final Set<Integer> DOUYIN_PUBLISH_TIME_TYPES = Set.of(0, 1, 7, 180);
    private static final Set<String> BILIBILI_ORDERS = Set.of("totalrank", "pubdate", "click", "dm", "stow");
    private static final Set<String> ZHIHU_SORTS = Set.of("", "upvoted_count", "created_time");
    private static final Set<String> ZHIHU_TIME_RANGES = Set.of("", "a_day", "a_week", "a_month", "three_months");

    private final SearchProperties searchProperties;

    private final Map<Platform, PlatformSearchConfig> configs = new ConcurrentHashMap<>();

    @PostConstruct
    public void init() {
        for (Platform platform : Platform.values()) {
            configs.put(platform, build(platform));
        }
        log.debug("platform search configs resolved, configs={}", configs);
    }

    public PlatformSearchConfig resolve(Platform platform) {
        return configs.computeIfAbsent(platform, this::build);
    }

    private PlatformSearchConfig build(Platform platform) {
        switch (platform) {
            case XHS: {
                SearchProperties.Xhs xhs = searchProperties.getXhs();
                require(XHS_SORT_TYPES.contains(xhs.getSortType()), "xhs sortType", xhs.getSortType());
                require(xhs.getNoteType() >= 0 && xhs.getNoteType() <= 2, "xhs noteType", xhs.getNoteType());
                return new XhsSearchConfig(xhs.getSortType(), xhs.getNoteType());
            }
            case DOUYIN: {
                SearchProperties.Douyin douyin = searchProperties.getDouyin();
                require(DOUYIN_PUBLISH_TIME_TYPES.contains(douyin.getPublishTimeType()),
                    "douyin publishTimeType", douyin.getPublishTimeType());
                require(douyin.getSortType() >= 0 && douyin.getSortType() <= 2, "douyin sortType", douyin.getSortType());
                return new DouyinSearchConfig(douyin.getPublishTimeType(), douyin.getSortType());
            }
            case KUAISHOU:
                return new KuaishouSearchConfig();
            case BILIBILI: {
                String order = searchProperties.getBilibili().getOrder();
                require(BILIBILI_ORDERS.contains(order), "bilibili order", order);
                return new BilibiliSearchConfig(order);
            }
            case WEIBO: {
                String searchType = searchProperties.getWeibo().getSearchType();
                require(WeiboSearchConfig.isSupported(searchType), "weibo searchType", searchType);
                return new WeiboSearchConfig(searchType);
            }
            case TIEBA: {
                SearchProperties.Tieba tieba = searchProperties.getTieba();
                require(tieba.getSortType() >= 0 && tieba.getSortType() <= 2, "tieba sortType", tieba.getSortType());
                require(tieba.getNoteType() == 0 || tieba.getNoteType() == 1, "tieba noteType", tieba.getNoteType());
                return new TiebaSearchConfig(tieba.getSortType(), tieba.getNoteType());
            }
            case ZHIHU: {
                SearchProperties.Zhihu zhihu = searchProperties.getZhihu();
                String sort = zhihu.getSort() == null ? "" : zhihu.getSort();
                String timeRange = zhihu.getTimeRange() == null ? "" : zhihu.getTimeRange();
                require(ZHIHU_SORTS.contains(sort), "zhihu sort", sort);
                require(ZHIHU_TIME_RANGES.contains(timeRange), "zhihu timeRange", timeRange);
                return new ZhihuSearchConfig(sort, timeRange);
            }
            default:
                throw new IllegalArgumentException("unsupported platform: " + platform);
        }
    }

    private void require(boolean valid, String name, Object value) {
        if (!valid) {
            throw new IllegalArgumentException("invalid search setting, " + name + "=" + value);
        }
    }

}
