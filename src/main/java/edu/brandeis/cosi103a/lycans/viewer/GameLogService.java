package edu.brandeis.cosi103a.lycans.viewer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import edu.brandeis.cosi103a.lycans.model.GameLog;
import edu.brandeis.cosi103a.lycans.model.GameRecord;
import edu.brandeis.cosi103a.lycans.report.GameFilter;
import edu.brandeis.cosi103a.lycans.report.GameLogReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Service for reading game logs from the data directory. Each log lives in its own
 * subdirectory as {@code <name>/gamelog.json} and is re-read on every request.
 */
@Service
public class GameLogService {
    private static final Logger logger = LoggerFactory.getLogger(GameLogService.class);

    static final String GAMELOG_FILE = "gamelog.json";

    private final Path dataDir;
    private final GameLogReader reader;

    public GameLogService(
            @Value("${lycans.data-dir:./data}") String dataDir,
            ObjectMapper objectMapper) {
        this.dataDir = Path.of(dataDir);
        this.reader = new GameLogReader(objectMapper);
    }

    /**
     * Lists every subdirectory holding a readable game log. Unreadable logs are skipped.
     */
    public List<GameLogSummary> listLogs() throws IOException {
        List<GameLogSummary> result = new ArrayList<>();
        if (!Files.isDirectory(dataDir)) {
            return result;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dataDir)) {
            for (Path entry : stream) {
                Path logPath = entry.resolve(GAMELOG_FILE);
                if (!Files.isDirectory(entry) || !Files.exists(logPath)) {
                    continue;
                }
                String name = entry.getFileName().toString();
                try {
                    GameLog log = reader.read(logPath);
                    result.add(new GameLogSummary(name, log.modVersion(), log.gameStats().size()));
                } catch (IOException e) {
                    logger.warn("Skipping unreadable game log {}: {}", logPath, e.getMessage());
                }
            }
        }
        result.sort(Comparator.comparing(GameLogSummary::name));
        return result;
    }

    public GameLog getLog(String name) throws IOException {
        validateName(name);
        Path logPath = dataDir.resolve(name).resolve(GAMELOG_FILE);
        if (!Files.exists(logPath)) {
            throw new GameLogNotFoundException("No gamelog.json for: " + name);
        }
        return reader.read(logPath);
    }

    /**
     * Games of a log passing the filter, in log order.
     */
    public ImmutableList<GameRecord> getGames(String name, GameFilter filter) throws IOException {
        ImmutableList<GameRecord> games = filter.apply(getLog(name).gameStats());
        if (!filter.isEmpty()) {
            logger.debug("{}: {} games after filter {}", name, games.size(), filter);
        }
        return games;
    }

    public GameRecord getGame(String name, String gameId) throws IOException {
        return getLog(name).gameStats().stream()
            .filter(g -> gameId.equals(g.id()) || gameId.equals(g.displayedId()))
            .findFirst()
            .orElseThrow(() -> new GameLogNotFoundException("No game " + gameId + " in " + name));
    }

    private static void validateName(String name) {
        if (name.contains("/") || name.contains("\\") || name.contains("..")) {
            throw new GameLogNotFoundException("Invalid game log name: " + name);
        }
    }

    public record GameLogSummary(String name, String modVersion, int gameCount) {}
}
