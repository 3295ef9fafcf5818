package com.gridcalc.grid;

import com.gridcalc.engine.Evaluator;
import com.gridcalc.fn.FunctionRegistry;

import java.time.Duration;

import lombok.Builder;
import lombok.Value;

/** Grid dimensions and engine limits. Defaults match a fresh sheet. */
@Value
@Builder(toBuilder = true)
public class GridConfig {
    @Builder.Default
    int rows = 100;
    @Builder.Default
    int cols = 26;
    @Builder.Default
    int defaultColumnWidth = 8;
    /** Maximum AST nesting evaluated before a DEPTH_EXCEEDED error. */
    @Builder.Default
    int maxEvalDepth = Evaluator.DEFAULT_MAX_DEPTH;
    /** Connect and response timeout for GET. */
    @Builder.Default
    Duration httpTimeout = FunctionRegistry.DEFAULT_HTTP_TIMEOUT;

    public static GridConfig defaults() {
        return builder().build();
    }
}
