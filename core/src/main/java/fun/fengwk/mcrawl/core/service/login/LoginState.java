package fun.fengwk.mcrawl.core.service.login;

/**
 * States of the login state machine.
 *
 * @author fengwk
 */
public enum LoginState {

    UNCHECKED,
    LOGGED_IN,
    LOGGED_OUT,
    AWAITING_QRCODE,
    AWAITING_SMS_CODE,
    AWAITING_COOKIE_INJECTION,
    SOLVING_SLIDER,
    LOGIN_FAILED

}
