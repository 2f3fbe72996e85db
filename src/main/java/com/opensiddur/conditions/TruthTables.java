package com.opensiddur.conditions;

import java.util.List;

import static com.opensiddur.conditions.Truth.FALSE;
import static com.opensiddur.conditions.Truth.TRUE;
import static com.opensiddur.conditions.Truth.UNDEFINED;

/**
 * Lookup tables for the condition combinators. Rows and columns are indexed by
 * {@link Truth#ordinal()}: TRUE, FALSE, UNDEFINED. Every operand is looked up;
 * nothing short-circuits.
 */
public final class TruthTables {

    private static final Truth[][] AND = {
        //            TRUE       FALSE  UNDEFINED
        /* TRUE */  { TRUE,      FALSE, UNDEFINED },
        /* FALSE */ { FALSE,     FALSE, FALSE },
        /* UNDEF */ { UNDEFINED, FALSE, UNDEFINED }
    };

    private static final Truth[][] OR = {
        //            TRUE  FALSE      UNDEFINED
        /* TRUE */  { TRUE, TRUE,      TRUE },
        /* FALSE */ { TRUE, FALSE,     UNDEFINED },
        /* UNDEF */ { TRUE, UNDEFINED, UNDEFINED }
    };

    private static final Truth[] NOT = { FALSE, TRUE, UNDEFINED };

    /**
     * Progress of an "exactly one" count over the operands seen so far.
     */
    private enum OneState {
        NO_TRUE,
        NO_TRUE_SOME_UNDEFINED,
        ONE_TRUE,
        ONE_TRUE_SOME_UNDEFINED,
        SEVERAL_TRUE
    }

    private static final OneState[][] ONE_STEP = {
        //                              TRUE                              FALSE                             UNDEFINED
        /* NO_TRUE */                 { OneState.ONE_TRUE,                OneState.NO_TRUE,                 OneState.NO_TRUE_SOME_UNDEFINED },
        /* NO_TRUE_SOME_UNDEFINED */  { OneState.ONE_TRUE_SOME_UNDEFINED, OneState.NO_TRUE_SOME_UNDEFINED,  OneState.NO_TRUE_SOME_UNDEFINED },
        /* ONE_TRUE */                { OneState.SEVERAL_TRUE,            OneState.ONE_TRUE,                OneState.ONE_TRUE_SOME_UNDEFINED },
        /* ONE_TRUE_SOME_UNDEFINED */ { OneState.SEVERAL_TRUE,            OneState.ONE_TRUE_SOME_UNDEFINED, OneState.ONE_TRUE_SOME_UNDEFINED },
        /* SEVERAL_TRUE */            { OneState.SEVERAL_TRUE,            OneState.SEVERAL_TRUE,            OneState.SEVERAL_TRUE }
    };

    private static final Truth[] ONE_RESULT = {
        /* NO_TRUE */                 FALSE,
        /* NO_TRUE_SOME_UNDEFINED */  UNDEFINED,
        /* ONE_TRUE */                TRUE,
        /* ONE_TRUE_SOME_UNDEFINED */ UNDEFINED,
        /* SEVERAL_TRUE */            FALSE
    };

    private TruthTables() {}

    public static Truth and(Truth a, Truth b) {
        return AND[a.ordinal()][b.ordinal()];
    }

    public static Truth or(Truth a, Truth b) {
        return OR[a.ordinal()][b.ordinal()];
    }

    public static Truth not(Truth a) {
        return NOT[a.ordinal()];
    }

    /**
     * TRUE for no operands.
     */
    public static Truth all(List<Truth> operands) {
        Truth result = TRUE;
        for (Truth operand : operands) {
            result = and(result, operand);
        }
        return result;
    }

    /**
     * FALSE for no operands.
     */
    public static Truth any(List<Truth> operands) {
        Truth result = FALSE;
        for (Truth operand : operands) {
            result = or(result, operand);
        }
        return result;
    }

    public static Truth none(List<Truth> operands) {
        return not(any(operands));
    }

    public static Truth one(List<Truth> operands) {
        OneState state = OneState.NO_TRUE;
        for (Truth operand : operands) {
            state = ONE_STEP[state.ordinal()][operand.ordinal()];
        }
        return ONE_RESULT[state.ordinal()];
    }
}
