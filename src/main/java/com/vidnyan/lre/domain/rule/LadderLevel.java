package com.vidnyan.lre.domain.rule;

/**
 * A discrete level of an escalation ladder.
 * {@link #key()} is the name used in rulebooks, {@link #label()} the term used in findings.
 */
public interface LadderLevel {

    String key();

    String label();

    boolean isIndeterminate();
}
