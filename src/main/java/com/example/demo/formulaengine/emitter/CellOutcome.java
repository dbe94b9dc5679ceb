package com.example.demo.formulaengine.emitter;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Code produced for one cell or group: either a translated expression, or a fallback literal
 * with the reason the expression could not be produced.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class CellOutcome {

    private final boolean ok;

    /** Expression for ok outcomes, sentinel literal for fallbacks */
    private final String code;

    /** Null for ok outcomes */
    private final String reason;

    public static CellOutcome ok(String expression) {
        return new CellOutcome(true, expression, null);
    }

    public static CellOutcome fallback(String sentinel, String reason) {
        return new CellOutcome(false, sentinel, reason);
    }
}
