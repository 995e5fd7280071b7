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

package dev.mars.tokenflow.workflow.engine;

import dev.mars.tokenflow.config.TokenflowConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ticks an engine until a tick or token budget is spent, or the engine is stopped.
 * A budget of zero is unlimited; at least one budget must be set.
 * <p>
 * A run with only a token budget also ends once the engine has gone {@code idleTickLimit}
 * consecutive ticks without creating a token, since a scenario whose sources have gone quiet
 * would otherwise never reach the budget.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-10
 * @version 1.0
 */
public class BudgetedRunner {

    private static final Logger logger = LoggerFactory.getLogger(BudgetedRunner.class);

    public enum StopReason {
        TICK_BUDGET,
        TOKEN_BUDGET,
        IDLE,
        STOPPED
    }

    public record RunSummary(long ticks, long tokensCreated, StopReason reason) {
    }

    public static final long DEFAULT_IDLE_TICK_LIMIT = 1000;

    private final long maxTicks;
    private final long maxTokens;
    private final long idleTickLimit;

    public BudgetedRunner(long maxTicks, long maxTokens) {
        this(maxTicks, maxTokens, DEFAULT_IDLE_TICK_LIMIT);
    }

    public BudgetedRunner(long maxTicks, long maxTokens, long idleTickLimit) {
        if (idleTickLimit <= 0) {
            throw new IllegalArgumentException("Idle tick limit must be positive");
        }
        if (maxTicks < 0 || maxTokens < 0) {
            throw new IllegalArgumentException("Budgets cannot be negative");
        }
        if (maxTicks == 0 && maxTokens == 0) {
            throw new IllegalArgumentException("At least one of the tick and token budgets must be set");
        }
        this.maxTicks = maxTicks;
        this.maxTokens = maxTokens;
        this.idleTickLimit = idleTickLimit;
    }

    public static BudgetedRunner fromConfiguration(TokenflowConfiguration configuration) {
        return new BudgetedRunner(configuration.getMaxTicks(), configuration.getMaxTokens());
    }

    /**
     * Runs from wherever the engine currently is. Budgets count ticks and tokens of this call only.
     */
    public RunSummary run(SimulationEngine engine) {
        long startTokens = engine.getTokenCount();
        long ticks = 0;
        long idleTicks = 0;
        StopReason reason;
        while (true) {
            if (engine.isStopped()) {
                reason = StopReason.STOPPED;
                break;
            }
            if (maxTicks > 0 && ticks >= maxTicks) {
                reason = StopReason.TICK_BUDGET;
                break;
            }
            if (maxTokens > 0 && engine.getTokenCount() - startTokens >= maxTokens) {
                reason = StopReason.TOKEN_BUDGET;
                break;
            }
            if (maxTicks == 0 && idleTicks >= idleTickLimit) {
                reason = StopReason.IDLE;
                break;
            }
            long before = engine.getTokenCount();
            engine.tick();
            ticks++;
            idleTicks = engine.getTokenCount() == before ? idleTicks + 1 : 0;
        }
        RunSummary summary = new RunSummary(ticks, engine.getTokenCount() - startTokens, reason);
        logger.info("Run finished after {} ticks and {} tokens ({})", summary.ticks(), summary.tokensCreated(), reason);
        return summary;
    }
}
