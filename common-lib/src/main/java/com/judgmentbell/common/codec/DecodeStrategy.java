package com.judgmentbell.common.codec;

import java.util.List;
import java.util.Optional;

/**
 * One identifier layout reader. Implementations are pure functions over the
 * {@code _}-separated tokens and return empty when the layout does not match.
 */
public interface DecodeStrategy {

    String name();

    Optional<DecodedIdentifier> decode(List<String> tokens);
}
