package edu.brandeis.cosi103a.lycans;

import edu.brandeis.cosi103a.lycans.model.ActionEvent;
import edu.brandeis.cosi103a.lycans.model.GameLog;
import edu.brandeis.cosi103a.lycans.model.GameRecord;
import edu.brandeis.cosi103a.lycans.model.LegacyRoles;
import edu.brandeis.cosi103a.lycans.model.PlayerRecord;
import edu.brandeis.cosi103a.lycans.model.RoleChange;
import edu.brandeis.cosi103a.lycans.model.VoteEvent;
import edu.brandeis.cosi103a.lycans.report.GameLogReader;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Builders for small hand-made games, plus access to the sample game log on the test classpath.
 */
public final class GameFixtures {

    public static final String SAMPLE_LOG = "sample-gamelog/gamelog.json";

    private GameFixtures() {}

    /** Player with no death, votes, actions or loot. */
    public static PlayerRecord player(String id, String name, String role, boolean victorious) {
        return new PlayerRecord(id, name, null, role, null, null, null, null, null, null, null, null,
            victorious, null, null, null);
    }

    public static PlayerRecord player(String name, String role, boolean victorious) {
        return player("id-" + name.toLowerCase(), name, role, victorious);
    }

    public static PlayerRecord winner(String name, String role) {
        return player(name, role, true);
    }

    public static PlayerRecord loser(String name, String role) {
        return player(name, role, false);
    }

    public static PlayerRecord withDeath(PlayerRecord p, String date, String timing, String type, String killer) {
        return new PlayerRecord(p.id(), p.username(), p.color(), p.mainRoleInitial(), p.mainRoleChanges(), p.power(),
            p.secondaryRole(), date, timing, p.deathPosition(), type, killer, p.victorious(), p.votes(), p.actions(),
            p.totalCollectedLoot());
    }

    public static PlayerRecord withRoleChanges(PlayerRecord p, List<RoleChange> changes) {
        return new PlayerRecord(p.id(), p.username(), p.color(), p.mainRoleInitial(), changes, p.power(),
            p.secondaryRole(), p.deathDateIrl(), p.deathTiming(), p.deathPosition(), p.deathType(), p.killerName(),
            p.victorious(), p.votes(), p.actions(), p.totalCollectedLoot());
    }

    public static PlayerRecord withPower(PlayerRecord p, String power, String secondaryRole) {
        return new PlayerRecord(p.id(), p.username(), p.color(), p.mainRoleInitial(), p.mainRoleChanges(), power,
            secondaryRole, p.deathDateIrl(), p.deathTiming(), p.deathPosition(), p.deathType(), p.killerName(),
            p.victorious(), p.votes(), p.actions(), p.totalCollectedLoot());
    }

    public static PlayerRecord withVotesAndActions(PlayerRecord p, List<VoteEvent> votes, List<ActionEvent> actions) {
        return new PlayerRecord(p.id(), p.username(), p.color(), p.mainRoleInitial(), p.mainRoleChanges(), p.power(),
            p.secondaryRole(), p.deathDateIrl(), p.deathTiming(), p.deathPosition(), p.deathType(), p.killerName(),
            p.victorious(), votes, actions, p.totalCollectedLoot());
    }

    public static PlayerRecord withLoot(PlayerRecord p, Integer loot) {
        return new PlayerRecord(p.id(), p.username(), p.color(), p.mainRoleInitial(), p.mainRoleChanges(), p.power(),
            p.secondaryRole(), p.deathDateIrl(), p.deathTiming(), p.deathPosition(), p.deathType(), p.killerName(),
            p.victorious(), p.votes(), p.actions(), loot);
    }

    public static GameRecord game(String id, String startDate, String endTiming, List<PlayerRecord> players) {
        return new GameRecord(id, id, startDate, null, null, null, null, endTiming, null, false, null, null, players);
    }

    public static GameRecord game(String id, String startDate, PlayerRecord... players) {
        return game(id, startDate, "N3", List.of(players));
    }

    public static GameRecord game(String id, PlayerRecord... players) {
        return game(id, "2024-03-01T20:00:00Z", players);
    }

    public static GameRecord withLegacyRoles(GameRecord g, LegacyRoles roles) {
        return new GameRecord(g.id(), g.displayedId(), g.startDate(), g.endDate(), g.mapName(), g.harvestGoal(),
            g.harvestDone(), g.endTiming(), g.version(), g.modded(), g.legacyData(), roles, g.playerStats());
    }

    public static GameRecord withEndDate(GameRecord g, String endDate) {
        return new GameRecord(g.id(), g.displayedId(), g.startDate(), endDate, g.mapName(), g.harvestGoal(),
            g.harvestDone(), g.endTiming(), g.version(), g.modded(), g.legacyData(), g.legacyRoles(), g.playerStats());
    }

    public static GameRecord withMap(GameRecord g, String mapName) {
        return new GameRecord(g.id(), g.displayedId(), g.startDate(), g.endDate(), mapName, g.harvestGoal(),
            g.harvestDone(), g.endTiming(), g.version(), g.modded(), g.legacyData(), g.legacyRoles(), g.playerStats());
    }

    public static GameRecord withHarvest(GameRecord g, Integer done, Integer goal) {
        return new GameRecord(g.id(), g.displayedId(), g.startDate(), g.endDate(), g.mapName(), goal, done,
            g.endTiming(), g.version(), g.modded(), g.legacyData(), g.legacyRoles(), g.playerStats());
    }

    public static GameLog sampleLog() {
        try (InputStream in = GameFixtures.class.getClassLoader().getResourceAsStream(SAMPLE_LOG)) {
            if (in == null) {
                throw new IllegalStateException("Resource not found: " + SAMPLE_LOG);
            }
            return new GameLogReader().read(in, SAMPLE_LOG);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static List<GameRecord> sampleGames() {
        return sampleLog().gameStats();
    }

    public static void copySampleLog(Path target) throws IOException {
        try (InputStream in = GameFixtures.class.getClassLoader().getResourceAsStream(SAMPLE_LOG)) {
            if (in == null) {
                throw new IllegalStateException("Resource not found: " + SAMPLE_LOG);
            }
            Files.createDirectories(target.getParent());
            Files.copy(in, target);
        }
    }
}
