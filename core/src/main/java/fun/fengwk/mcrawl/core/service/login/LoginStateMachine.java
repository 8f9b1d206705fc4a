package fun.fengwk.mcrawl.core.service.login;

import fun.fengwk.mcrawl.core.configuration.LoginProperties;
import fun.fengwk.mcrawl.core.exception.LoginFailedException;
import fun.fengwk.mcrawl.core.model.LoginType;
import fun.fengwk.mcrawl.core.model.ProxyLease;
import fun.fengwk.mcrawl.core.service.retry.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Drives a platform session from unchecked to logged in.
 *
 * <pre>
 * UNCHECKED -> LOGGED_IN | LOGGED_OUT
 * LOGGED_OUT -> AWAITING_QRCODE | AWAITING_SMS_CODE | AWAITING_COOKIE_INJECTION
 * AWAITING_* <-> SOLVING_SLIDER
 * AWAITING_* -> LOGGED_IN | LOGIN_FAILED
 * </pre>
 *
 * A browser page is opened only when the session probe reports the session as logged out.
 *
 * @author fengwk
 */
@Slf4j
public class LoginStateMachine {

    private final LoginProperties loginProperties;
    private final SliderTrajectoryGenerator trajectoryGenerator;
    private final SliderGapLocator gapLocator;
    private final SmsCodeSource smsCodeSource;
    private final Sleeper sleeper;

    public LoginStateMachine(LoginProperties loginProperties, SliderTrajectoryGenerator trajectoryGenerator,
                             SliderGapLocator gapLocator, SmsCodeSource smsCodeSource) {
        this(loginProperties, trajectoryGenerator, gapLocator, smsCodeSource, Sleeper.THREAD);
    }

    LoginStateMachine(LoginProperties loginProperties, SliderTrajectoryGenerator trajectoryGenerator,
                      SliderGapLocator gapLocator, SmsCodeSource smsCodeSource, Sleeper sleeper) {
        this.loginProperties = loginProperties;
        this.trajectoryGenerator = trajectoryGenerator;
        this.gapLocator = gapLocator;
        this.smsCodeSource = smsCodeSource;
        this.sleeper = sleeper;
    }

    /**
     * Make sure the session is logged in.
     *
     * @param session     session to check and update
     * @param guard       liveness check of the session
     * @param pageFactory opens a browser login page, may be null when no browser is available
     * @param lease       proxy lease of the login task, may be null
     * @return result with the visited states
     * @throws LoginFailedException if verification attempts were exhausted
     */
    public LoginResult ensureLoggedIn(SessionState session, SessionGuard guard, LoginPageFactory pageFactory,
                                      ProxyLease lease) {
        LoginRun run = new LoginRun(session);
        try {
            while (true) {
                switch (run.state) {
                    case UNCHECKED:
                        run.moveTo(guard.isAuthenticated(session, lease) ? LoginState.LOGGED_IN : LoginState.LOGGED_OUT);
                        break;
                    case LOGGED_OUT:
                        openLoginPage(run, pageFactory, lease);
                        break;
                    case AWAITING_QRCODE:
                        handleQrcode(run);
                        break;
                    case AWAITING_SMS_CODE:
                        handleSmsCode(run);
                        break;
                    case AWAITING_COOKIE_INJECTION:
                        handleCookieInjection(run);
                        break;
                    case SOLVING_SLIDER:
                        handleSlider(run);
                        break;
                    case LOGGED_IN:
                        if (run.page != null) {
                            session.replaceCookies(run.page.cookies());
                        }
                        log.info("login succeeded, platform={}, path={}", session.getPlatform(), run.path);
                        return new LoginResult(LoginState.LOGGED_IN, run.path, run.sliderDrags);
                    case LOGIN_FAILED:
                    default:
                        throw new LoginFailedException("login failed, platform=" + session.getPlatform().getCode()
                            + ", reason=" + run.failureReason);
                }
            }
        } finally {
            closeQuietly(run.page);
        }
    }

    private void openLoginPage(LoginRun run, LoginPageFactory pageFactory, ProxyLease lease) {
        if (pageFactory == null) {
            run.fail("no browser available for login");
            return;
        }
        run.page = pageFactory.open(run.session.getPlatform(), lease);
        run.page.openLoginDialog();
        LoginType loginType = loginProperties.getLoginType();
        if (loginType == LoginType.PHONE) {
            run.moveTo(LoginState.AWAITING_SMS_CODE);
        } else if (loginType == LoginType.COOKIE) {
            run.moveTo(LoginState.AWAITING_COOKIE_INJECTION);
        } else {
            run.moveTo(LoginState.AWAITING_QRCODE);
        }
    }

    private void handleQrcode(LoginRun run) {
        if (!run.actionDone) {
            if (!run.page.displayQrCode()) {
                run.fail("login qrcode not found");
                return;
            }
            run.actionDone = true;
        }
        pollConfirmation(run);
    }

    private void handleSmsCode(LoginRun run) {
        String phone = loginProperties.getPhone();
        if (!run.actionDone) {
            if (!StringUtils.hasText(phone)) {
                run.fail("phone is not configured");
                return;
            }
            run.page.requestSmsCode(phone);
            run.actionDone = true;
            if (run.page.isSliderVisible()) {
                run.enterSlider();
                return;
            }
        }
        if (!run.smsSubmitted) {
            Duration timeout = Duration.ofMillis(Math.max(1, loginProperties.getSmsCodeTimeoutMs()));
            String code = smsCodeSource.awaitCode(run.session.getPlatform(), phone, timeout);
            if (!StringUtils.hasText(code)) {
                run.fail("sms code not received within " + timeout.toMillis() + "ms");
                return;
            }
            run.page.submitSmsCode(code);
            run.smsSubmitted = true;
        }
        pollConfirmation(run);
    }

    private void handleCookieInjection(LoginRun run) {
        if (!run.actionDone) {
            Map<String, String> cookies = CookieUtils.parse(loginProperties.getCookies());
            if (cookies.isEmpty()) {
                run.fail("login cookies are not configured");
                return;
            }
            run.page.injectCookies(cookies);
            run.actionDone = true;
        }
        pollConfirmation(run);
    }

    private void pollConfirmation(LoginRun run) {
        int maxChecks = Math.max(1, loginProperties.getLoginCheckAttempts());
        while (run.confirmChecks < maxChecks) {
            run.confirmChecks++;
            if (run.page.isLoginConfirmed()) {
                run.moveTo(LoginState.LOGGED_IN);
                return;
            }
            if (run.page.isSliderVisible()) {
                run.enterSlider();
                return;
            }
            sleep(loginProperties.getLoginCheckIntervalMs());
            if (Thread.currentThread().isInterrupted()) {
                run.fail("login confirmation interrupted");
                return;
            }
        }
        run.fail("login not confirmed after " + maxChecks + " checks");
    }

    private void handleSlider(LoginRun run) {
        int maxDrags = Math.max(1, loginProperties.getMaxSliderAttempts());
        int perChallenge = Math.max(1, loginProperties.getSliderAttemptsPerChallenge());
        int dragsOnChallenge = 0;
        while (run.sliderDrags < maxDrags) {
            if (dragsOnChallenge >= perChallenge) {
                log.info("slider challenge refreshed, platform={}, drags={}", run.session.getPlatform(), run.sliderDrags);
                run.page.refreshSliderChallenge();
                dragsOnChallenge = 0;
            }
            run.sliderDrags++;
            dragsOnChallenge++;
            int offset = gapLocator.locateGap(run.page);
            if (offset <= 0) {
                log.info("slider gap not located, platform={}, drag={}", run.session.getPlatform(), run.sliderDrags);
                dragsOnChallenge = perChallenge;
                continue;
            }
            List<Integer> track = trajectoryGenerator.generate(offset);
            run.page.dragSlider(track);
            if (run.page.awaitSliderHidden(loginProperties.getSliderHiddenTimeoutMs())) {
                log.info("slider solved, platform={}, drags={}", run.session.getPlatform(), run.sliderDrags);
                run.moveTo(run.resumeState);
                return;
            }
            log.info("slider drag rejected, platform={}, drag={}, offset={}", run.session.getPlatform(), run.sliderDrags, offset);
        }
        run.fail("slider attempts exhausted after " + run.sliderDrags + " drags");
    }

    private void sleep(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

    private void closeQuietly(LoginPage page) {
        if (page == null) {
            return;
        }
        try {
            page.close();
        } catch (Exception ex) {
            log.debug("close login page failed, error={}", ex.getMessage());
        }
    }

    private static final class LoginRun {

        private final SessionState session;
        private final List<LoginState> path = new ArrayList<>();
        private LoginState state = LoginState.UNCHECKED;
        private LoginState resumeState;
        private LoginPage page;
        private boolean actionDone;
        private boolean smsSubmitted;
        private int confirmChecks;
        private int sliderDrags;
        private String failureReason;

        private LoginRun(SessionState session) {
            this.session = session;
            this.path.add(LoginState.UNCHECKED);
            session.updateStatus(SessionStatus.NOT_LOGGED_IN);
        }

        private void moveTo(LoginState next) {
            log.info("login state transition, platform={}, from={}, to={}", session.getPlatform(), state, next);
            state = next;
            path.add(next);
            session.updateStatus(SessionStatus.of(next));
        }

        private void enterSlider() {
            resumeState = state;
            moveTo(LoginState.SOLVING_SLIDER);
        }

        private void fail(String reason) {
            failureReason = reason;
            log.warn("login failed, platform={}, state={}, reason={}", session.getPlatform(), state, reason);
            moveTo(LoginState.LOGIN_FAILED);
        }

    }

}
