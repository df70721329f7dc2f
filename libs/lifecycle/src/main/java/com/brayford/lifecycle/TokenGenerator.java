package com.brayford.lifecycle;

/**
 * Source of unguessable link tokens. Each call returns a fresh value.
 */
@FunctionalInterface
public interface TokenGenerator {

    String newToken();
}
