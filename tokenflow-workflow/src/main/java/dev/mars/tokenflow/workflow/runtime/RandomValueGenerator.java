/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.tokenflow.workflow.runtime;

import java.util.Random;

/**
 * Seeded uniform sampling. When both bounds are whole numbers the result is a {@link Long} in
 * {@code [min, max]}; otherwise a {@link Double} in {@code [min, max)}.
 * <p>
 * Every draw consumes exactly one {@code nextDouble()}, so restoring replays the draw count.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-08
 * @version 1.0
 */
public class RandomValueGenerator implements ValueGenerator {

    private final long seed;
    private Random random;
    private long drawCount;

    public RandomValueGenerator(long seed) {
        this.seed = seed;
        this.random = new Random(seed);
    }

    /**
     * Generator for one node, derived from the run seed so that nodes draw independent streams.
     */
    public static RandomValueGenerator forNode(long runSeed, String nodeId) {
        return new RandomValueGenerator(runSeed * 31 + nodeId.hashCode());
    }

    @Override
    public Object next(double min, double max) {
        double sample = random.nextDouble();
        drawCount++;
        if (isWhole(min) && isWhole(max)) {
            long low = (long) min;
            long high = (long) max;
            try {
                long span = Math.addExact(Math.subtractExact(high, low), 1);
                return Math.min(high, low + (long) Math.floor(sample * span));
            } catch (ArithmeticException overflow) {
                long drawn = (long) Math.floor(min + sample * (max - min));
                return Math.max(low, Math.min(high, drawn));
            }
        }
        return min + sample * (max - min);
    }

    @Override
    public long getDrawCount() {
        return drawCount;
    }

    @Override
    public void restore(long drawCount) {
        reset();
        for (long i = 0; i < drawCount; i++) {
            random.nextDouble();
        }
        this.drawCount = drawCount;
    }

    @Override
    public void reset() {
        random = new Random(seed);
        drawCount = 0;
    }

    public long getSeed() {
        return seed;
    }

    private static boolean isWhole(double value) {
        return value == Math.rint(value) && !Double.isInfinite(value);
    }
}
