package fun.fengwk.mcrawl.core.service.crawl;

import fun.fengwk.mcrawl.core.model.CrawlRecord;

import java.util.List;

/**
 * Destination of crawled records, must tolerate redelivery of the same record.
 *
 * @author fengwk
 */
@FunctionalInterface
public interface PersistenceSink {

    void save(List<CrawlRecord> records);

}
