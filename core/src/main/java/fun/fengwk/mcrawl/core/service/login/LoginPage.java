package fun.fengwk.mcrawl.core.service.login;

import java.util.List;
import java.util.Map;

/**
 * Browser primitives the login state machine drives.
 *
 * @author fengwk
 */
public interface LoginPage extends AutoCloseable {

    void openLoginDialog();

    /**
     * Show the login qrcode to the operator.
     *
     * @return false if no qrcode could be found
     */
    boolean displayQrCode();

    void requestSmsCode(String phone);

    void submitSmsCode(String code);

    void injectCookies(Map<String, String> cookies);

    boolean isSliderVisible();

    /**
     * Press the slider handle, move it by each delta and release it.
     */
    void dragSlider(List<Integer> track);

    /**
     * @return true if the verification overlay disappeared within the timeout
     */
    boolean awaitSliderHidden(long timeoutMs);

    void refreshSliderChallenge();

    boolean isLoginConfirmed();

    Map<String, String> cookies();

    @Override
    default void close() {
    }

}
