package fun.fengwk.mcrawl.core.configuration;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class CrawlerPropertiesTest {

    @Test
    public void shouldDerivePageLimitFromMaxNotes() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setMaxNotesCount(45);

        assertThat(properties.resolveSearchPageLimit(20)).isEqualTo(3);
        assertThat(properties.resolveSearchPageLimit(0)).isEqualTo(45);
    }

    @Test
    public void shouldPreferExplicitPageLimit() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setSearchPageLimit(2);

        assertThat(properties.resolveSearchPageLimit(20)).isEqualTo(2);
    }

    @Test
    public void shouldNotBoundPagesWhenMaxNotesIsUnbounded() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setMaxNotesCount(0);

        assertThat(properties.resolveSearchPageLimit(20)).isEqualTo(Integer.MAX_VALUE);
    }

    @Test
    public void shouldRunAtLeastOneWorker() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setMaxConcurrency(0);

        assertThat(properties.normalizeMaxConcurrency()).isEqualTo(1);
    }

}
