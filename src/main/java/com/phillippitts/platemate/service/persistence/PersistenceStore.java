package com.phillippitts.platemate.service.persistence;

import java.util.Optional;

/**
 * Byte-level storage for the serialized assistant state.
 */
public interface PersistenceStore {

    /**
     * @return the last saved state, empty if nothing was saved yet
     * @throws com.phillippitts.platemate.exception.PersistenceException on read failure
     */
    Optional<byte[]> loadState();

    /**
     * Replaces the saved state.
     *
     * @throws com.phillippitts.platemate.exception.PersistenceException on write failure
     */
    void saveState(byte[] state);
}
