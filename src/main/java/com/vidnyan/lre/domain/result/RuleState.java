package com.vidnyan.lre.domain.result;

/**
 * Terminal state of one rule in one evaluation.
 */
public enum RuleState {
    NOT_EVALUABLE,  // required variables absent; excluded from evaluated rules
    DISCARDED,      // condition false or unevaluable
    TRIGGERED,      // condition true; produced a finding
    ERRORED;        // failed while building the finding; counts as discarded

    public boolean isEvaluated() {
        return this != NOT_EVALUABLE;
    }
}
