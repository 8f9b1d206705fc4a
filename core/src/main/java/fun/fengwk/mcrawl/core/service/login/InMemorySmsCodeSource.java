package fun.fengwk.mcrawl.core.service.login;

import fun.fengwk.mcrawl.core.model.Platform;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Sms codes pushed in by a forwarder and handed to waiting logins.
 *
 * @author fengwk
 */
@Slf4j
public class InMemorySmsCodeSource implements SmsCodeSource {

    private final Map<String, BlockingQueue<String>> codes = new ConcurrentHashMap<>();

    public void submit(Platform platform, String phone, String code) {
        queue(platform, phone).offer(code);
        log.info("sms code received, platform={}, phone={}", platform, mask(phone));
    }

    @Override
    public String awaitCode(Platform platform, String phone, Duration timeout) {
        try {
            return queue(platform, phone).poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.info("sms code wait interrupted, platform={}, phone={}", platform, mask(phone));
            return null;
        }
    }

    private BlockingQueue<String> queue(Platform platform, String phone) {
        return codes.computeIfAbsent(platform.getCode() + "_" + phone, key -> new LinkedBlockingQueue<>());
    }

    private String mask(String phone) {
        if (phone == null || phone.length() < 4) {
            return "***";
        }
        return "***" + phone.substring(phone.length() - 4);
    }

}
