package fun.fengwk.mcrawl.core.configuration;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Retry configuration of platform requests.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "mcrawl.retry")
public class RetryProperties {

    /**
     * Max attempts per request including the first one.
     */
    private int maxAttempts = 3;

    /**
     * Wait before the first retry.
     */
    private long waitMs = 1000;

    /**
     * Backoff multiplier, values above 1 switch to exponential backoff.
     */
    private double multiplier = 1.0;

}
