package org.gridsweep.runtime.spi;

/**
 * State that can be captured and restored, e.g. to roll back a failed tick.
 */
public interface ISerializable {

    /**
     * Captures the current state.
     * @return An opaque snapshot.
     */
    byte[] saveState();

    /**
     * Restores a snapshot taken by {@link #saveState()} on an instance of the same type.
     * @param state The snapshot.
     */
    void loadState(byte[] state);
}
