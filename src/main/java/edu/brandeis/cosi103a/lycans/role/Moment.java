package edu.brandeis.cosi103a.lycans.role;

/**
 * Point of the game at which a player's camp is read.
 */
public enum Moment {
    INITIAL,
    FINAL
}
