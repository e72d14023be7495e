package com.nova.script;

/**
 * Blocks the interpreter at a {@code pause} until the user acknowledges.
 * There is no timeout: implementations return only once acknowledged.
 */
@FunctionalInterface
public interface AcknowledgmentSource {
    void waitForAck();
}
