package com.phillippitts.scantomack.domain;

/**
 * One edit applied by text post-processing.
 *
 * @param position   character offset in the text the rule ran on
 * @param original   replaced span
 * @param corrected  replacement
 * @param rule       human-readable rule description
 * @param confidence rule confidence in [0,1]
 */
public record TextCorrection(int position, String original, String corrected, String rule, double confidence) {
}
