package edu.brandeis.cosi103a.lycans.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import edu.brandeis.cosi103a.lycans.model.GameLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@code gamelog.json} exports into {@link GameLog} records.
 */
public class GameLogReader {
    private static final Logger logger = LoggerFactory.getLogger(GameLogReader.class);

    private final ObjectMapper objectMapper;

    public GameLogReader() {
        this(ObjectMapperFactory.create());
    }

    public GameLogReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public GameLog read(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new IllegalArgumentException("Game log not found: " + file);
        }
        GameLog log = objectMapper.readValue(file.toFile(), GameLog.class);
        logCounts(file.toString(), log);
        return log;
    }

    public GameLog read(InputStream in, String source) throws IOException {
        GameLog log = objectMapper.readValue(in, GameLog.class);
        logCounts(source, log);
        return log;
    }

    private static void logCounts(String source, GameLog log) {
        if (log.totalRecords() != log.gameStats().size()) {
            logger.warn("{} declares {} records but contains {}", source, log.totalRecords(),
                log.gameStats().size());
        } else {
            logger.debug("Read {} games from {}", log.gameStats().size(), source);
        }
    }
}
