package fun.fengwk.mcrawl.core.configuration;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Per-platform search settings.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "mcrawl.search")
public class SearchProperties {

    private Xhs xhs = new Xhs();

    private Douyin douyin = new Douyin();

    private Bilibili bilibili = new Bilibili();

    private Weibo weibo = new Weibo();

    private Tieba tieba = new Tieba();

    private Zhihu zhihu = new Zhihu();

    @Data
    public static class Xhs {

        private String sortType = "general";

        private int noteType = 0;

    }

    @Data
    public static class Douyin {

        private int publishTimeType = 0;

        private int sortType = 0;

    }

    @Data
    public static class Bilibili {

        private String order = "totalrank";

    }

    @Data
    public static class Weibo {

        private String searchType = "default";

    }

    @Data
    public static class Tieba {

        private int sortType = 0;

        private int noteType = 0;

    }

    @Data
    public static class Zhihu {

        private String sort = "";

        private String timeRange = "";

    }

}
