package fun.fengwk.mcrawl.core.service.crawl;

import fun.fengwk.mcrawl.core.exception.BlockedException;
import fun.fengwk.mcrawl.core.exception.LoginFailedException;
import fun.fengwk.mcrawl.core.exception.NotFoundException;
import fun.fengwk.mcrawl.core.exception.PlatformRequestException;
import fun.fengwk.mcrawl.core.exception.PoolExhaustedException;
import fun.fengwk.mcrawl.core.exception.TransientRequestException;

/**
 * @author fengwk
 */
public enum FailureReason {

    NOT_FOUND,
    BLOCKED,
    TRANSIENT,
    REJECTED,
    POOL_EXHAUSTED,
    LOGIN_FAILED,
    ERROR;

    public static FailureReason of(Throwable throwable) {
        if (throwable instanceof NotFoundException) {
            return NOT_FOUND;
        }
        if (throwable instanceof BlockedException) {
            return BLOCKED;
        }
        if (throwable instanceof TransientRequestException) {
            return TRANSIENT;
        }
        if (throwable instanceof PlatformRequestException) {
            return REJECTED;
        }
        if (throwable instanceof PoolExhaustedException) {
            return POOL_EXHAUSTED;
        }
        if (throwable instanceof LoginFailedException) {
            return LOGIN_FAILED;
        }
        return ERROR;
    }

}
