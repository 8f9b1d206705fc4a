package fun.fengwk.mcrawl.core.service.login;

/**
 * Computes how far the slider must travel to close the puzzle gap.
 *
 * @author fengwk
 */
@FunctionalInterface
public interface SliderGapLocator {

    /**
     * @return offset in pixels, a non-positive value means the gap was not found
     */
    int locateGap(LoginPage page);

}
