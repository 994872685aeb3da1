package com.judgmentbell.common.statistics;

/** When, relative to the decision, the judged act is presented. */
public enum Timing {
    BEFORE, DURING, AFTER
}
