package org.sn.wordtrie;

import java.io.Serial;
import java.util.NoSuchElementException;


/**
 * Thrown when a key is not stored in a trie.
 */
public class KeyNotFoundException extends NoSuchElementException {
    @Serial
    private static final long serialVersionUID = 1L;

    public KeyNotFoundException(Object key) {
        super("key not found: " + key);
    }
}
