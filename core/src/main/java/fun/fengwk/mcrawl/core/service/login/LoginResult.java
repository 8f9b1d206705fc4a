package fun.fengwk.mcrawl.core.service.login;

import java.util.List;

/**
 * @param finalState  terminal state reached
 * @param path        visited states in order, starting with UNCHECKED
 * @param sliderDrags slider drags performed
 * @author fengwk
 */
public record LoginResult(LoginState finalState, List<LoginState> path, int sliderDrags) {

    public LoginResult {
        path = List.copyOf(path);
    }

    public boolean usedBrowser() {
        return path.contains(LoginState.LOGGED_OUT);
    }

}
