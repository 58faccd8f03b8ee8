package dev.bykey;

import java.util.NoSuchElementException;

/**
 * Thrown when a value-bearing result is asked for a key it does not hold.
 */
public class MissingKeyException extends NoSuchElementException {

    private final transient Object key;

    public MissingKeyException(Object key) {
        super("No entry for key: " + key);
        this.key = key;
    }

    public Object getKey() {
        return key;
    }
}
