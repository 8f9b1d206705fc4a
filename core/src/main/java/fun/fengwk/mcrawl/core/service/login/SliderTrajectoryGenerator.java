package fun.fengwk.mcrawl.core.service.login;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Generates human-like slider drag tracks.
 *
 * <p>Each step covers a random share of the remaining distance, so steps start large and tail off to
 * single pixels. Steps are positive, never grow, and sum exactly to the requested distance.
 *
 * @author fengwk
 */
public class SliderTrajectoryGenerator {

    private static final double MIN_RATIO = 0.25;
    private static final double MAX_RATIO = 0.4;

    private final Random random;

    public SliderTrajectoryGenerator() {
        this(null);
    }

    public SliderTrajectoryGenerator(Random random) {
        this.random = random;
    }

    public List<Integer> generate(int distance) {
        if (distance <= 0) {
            throw new IllegalArgumentException("slider distance must be positive: " + distance);
        }
        List<Integer> steps = new ArrayList<>();
        int remaining = distance;
        int previous = Integer.MAX_VALUE;
        while (remaining > 0) {
            double ratio = MIN_RATIO + nextDouble() * (MAX_RATIO - MIN_RATIO);
            int step = (int) Math.max(1, Math.round(remaining * ratio));
            step = Math.min(step, Math.min(remaining, previous));
            steps.add(step);
            remaining -= step;
            previous = step;
        }
        return steps;
    }

    private double nextDouble() {
        return random == null ? ThreadLocalRandom.current().nextDouble() : random.nextDouble();
    }

}
