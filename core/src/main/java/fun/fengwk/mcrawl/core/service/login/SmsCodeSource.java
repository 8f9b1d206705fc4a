package fun.fengwk.mcrawl.core.service.login;

import fun.fengwk.mcrawl.core.model.Platform;

import java.time.Duration;

/**
 * @author fengwk
 */
@FunctionalInterface
public interface SmsCodeSource {

    /**
     * Block until the sms code for the phone arrives.
     *
     * @return code, or null when none arrived within the timeout
     */
    String awaitCode(Platform platform, String phone, Duration timeout);

}
