package com.judgmentbell.common.aggregation;

/** Why a trial did not contribute a correlation sample. */
public enum DropReason {
    /** No recoverable verdict in the oracle response, or the request failed. */
    PARSE_FAILURE,
    /** Neither the manifest nor the result record describes the trial. */
    MISSING_CONDITION,
    /** Identifier matched no known layout. */
    DECODE_FAILURE,
    /** Neither the condition nor the identifier names the judged party. */
    UNKNOWN_SUBJECT,
    /** A second verdict for an already-seen party and trial key; the later one wins. */
    DUPLICATE_TRIAL,
    /** Resolved verdict whose counterpart party has no verdict for the same trial key. */
    UNMATCHED
}
