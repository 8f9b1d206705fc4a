package fun.fengwk.mcrawl.core.service.login;

/**
 * Coarse session status visible to crawl workers.
 *
 * @author fengwk
 */
public enum SessionStatus {

    NOT_LOGGED_IN,
    AWAITING_VERIFICATION,
    LOGGED_IN;

    static SessionStatus of(LoginState state) {
        switch (state) {
            case LOGGED_IN:
                return LOGGED_IN;
            case AWAITING_QRCODE:
            case AWAITING_SMS_CODE:
            case AWAITING_COOKIE_INJECTION:
            case SOLVING_SLIDER:
                return AWAITING_VERIFICATION;
            default:
                return NOT_LOGGED_IN;
        }
    }

}
