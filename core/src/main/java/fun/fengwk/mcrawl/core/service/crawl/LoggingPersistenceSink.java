package fun.fengwk.mcrawl.core.service.crawl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.mcrawl.core.model.CrawlRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Writes crawled records to the log as json lines.
 *
 * @author fengwk
 */
@Slf4j
@RequiredArgsConstructor
public class LoggingPersistenceSink implements PersistenceSink {

    private final ObjectMapper objectMapper;

    @Override
    public void save(List<CrawlRecord> records) {
        for (CrawlRecord record : records) {
            try {
                log.info("crawl record, json={}", objectMapper.writeValueAsString(record));
            } catch (JsonProcessingException ex) {
                log.warn("serialize crawl record failed, platform={}, type={}, id={}, error={}",
                    record.getPlatform(), record.getType(), record.getId(), ex.getMessage());
            }
        }
    }

}
