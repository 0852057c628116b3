package io.github.manjago.gbacore.sim;

/**
 * Thrown when a cartridge image cannot be loaded. Nothing has been changed
 * when it is thrown.
 */
public class InvalidRomException extends IllegalArgumentException {

    public InvalidRomException(String message) {
        super(message);
    }
}
