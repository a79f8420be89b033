package edu.brandeis.cosi103a.lycans.scoring;

import edu.brandeis.cosi103a.lycans.role.Camp;

/**
 * One game of a player's history: the camp they ended in and whether they won.
 */
public record Outcome(Camp camp, boolean won) {}
