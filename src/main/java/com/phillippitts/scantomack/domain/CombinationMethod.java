package com.phillippitts.scantomack.domain;

/**
 * How an ensemble picks its base result.
 */
public enum CombinationMethod {

    /** Highest overall confidence wins. */
    CONFIDENCE_WEIGHTED,

    /** First engine of a configured preference order wins. */
    PREFERENCE,

    /** Result with the highest mean text similarity to the others wins. */
    CONSENSUS
}
