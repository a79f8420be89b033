package edu.brandeis.cosi103a.lycans.viewer;

/**
 * Thrown when a requested game log, or a game inside it, cannot be found.
 */
public class GameLogNotFoundException extends RuntimeException {
    public GameLogNotFoundException(String message) {
        super(message);
    }
}
