package edu.brandeis.cosi103a.lycans.viewer;

import edu.brandeis.cosi103a.lycans.model.GameRecord;
import edu.brandeis.cosi103a.lycans.report.GameFilter;
import edu.brandeis.cosi103a.lycans.report.StatsReport;
import edu.brandeis.cosi103a.lycans.scoring.PlayerComparison;
import edu.brandeis.cosi103a.lycans.stats.CampPerformance;
import edu.brandeis.cosi103a.lycans.stats.CampWinStats;
import edu.brandeis.cosi103a.lycans.stats.ColorStats;
import edu.brandeis.cosi103a.lycans.stats.KillerStatistics;
import edu.brandeis.cosi103a.lycans.stats.MapStats;
import edu.brandeis.cosi103a.lycans.stats.MonthlyRanking;
import edu.brandeis.cosi103a.lycans.stats.PairingStats;
import edu.brandeis.cosi103a.lycans.stats.PlayerStats;
import edu.brandeis.cosi103a.lycans.stats.SeriesStats;
import edu.brandeis.cosi103a.lycans.stats.SurvivalAnalysis;
import edu.brandeis.cosi103a.lycans.stats.TeamCompositionStats;
import edu.brandeis.cosi103a.lycans.stats.VotingStats;
import edu.brandeis.cosi103a.lycans.timeline.GameTimeline;
import edu.brandeis.cosi103a.lycans.timeline.TimelineBuilder;
import edu.brandeis.cosi103a.lycans.wolf.WolfTransformCalculator;
import edu.brandeis.cosi103a.lycans.wolf.WolfTransformStats;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

/**
 * REST controller exposing the reports of each game log. Every report endpoint accepts the
 * same optional filter parameters: {@code modOnly}, {@code map}, {@code from} and {@code to}
 * (ISO dates, {@code to} inclusive).
 */
@RestController
@RequestMapping("/api/stats")
@Validated
public class StatsController {

    private static final String MONTH_PATTERN = "\\d{4}-\\d{2}";

    private final GameLogService gameLogService;
    private final int comparisonMinGames;

    public StatsController(
            GameLogService gameLogService,
            @Value("${lycans.comparison.min-games:30}") int comparisonMinGames) {
        this.gameLogService = gameLogService;
        this.comparisonMinGames = comparisonMinGames;
    }

    @GetMapping
    public List<GameLogService.GameLogSummary> listLogs() throws IOException {
        return gameLogService.listLogs();
    }

    @GetMapping("/{name}/report")
    public StatsReport getReport(@PathVariable String name, FilterParams filter) throws IOException {
        return StatsReport.build(gameLogService.getLog(name).modVersion(), games(name, filter));
    }

    @GetMapping("/{name}/camps")
    public CampWinStats getCampWins(@PathVariable String name, FilterParams filter) throws IOException {
        return CampWinStats.compute(games(name, filter));
    }

    @GetMapping("/{name}/players")
    public PlayerStats getPlayers(@PathVariable String name, FilterParams filter) throws IOException {
        return PlayerStats.compute(games(name, filter));
    }

    @GetMapping("/{name}/players/{player}")
    public ResponseEntity<PlayerStats.PlayerSummary> getPlayer(
            @PathVariable String name, @PathVariable String player, FilterParams filter) throws IOException {
        return ResponseEntity.of(PlayerStats.compute(games(name, filter)).find(player));
    }

    @GetMapping("/{name}/pairings")
    public PairingStats getPairings(@PathVariable String name, FilterParams filter) throws IOException {
        return PairingStats.compute(games(name, filter));
    }

    @GetMapping("/{name}/compositions")
    public TeamCompositionStats getCompositions(@PathVariable String name, FilterParams filter) throws IOException {
        return TeamCompositionStats.compute(games(name, filter));
    }

    @GetMapping("/{name}/colors")
    public ColorStats getColors(@PathVariable String name, FilterParams filter) throws IOException {
        return ColorStats.compute(games(name, filter));
    }

    @GetMapping("/{name}/survival")
    public SurvivalAnalysis getSurvival(@PathVariable String name, FilterParams filter) throws IOException {
        return SurvivalAnalysis.compute(games(name, filter));
    }

    @GetMapping("/{name}/killers")
    public List<KillerStatistics.KillerProfile> getKillers(@PathVariable String name, FilterParams filter)
            throws IOException {
        return KillerStatistics.profiles(games(name, filter));
    }

    @GetMapping("/{name}/camp-performance")
    public List<CampPerformance.Row> getCampPerformance(
            @PathVariable String name,
            @RequestParam(defaultValue = "" + CampPerformance.MIN_GAMES) @Min(1) int minGames,
            FilterParams filter) throws IOException {
        return CampPerformance.compute(games(name, filter), minGames);
    }

    @GetMapping("/{name}/monthly")
    public List<MonthlyRanking.Ranking> getMonthlyRankings(@PathVariable String name, FilterParams filter)
            throws IOException {
        return MonthlyRanking.all(games(name, filter));
    }

    @GetMapping("/{name}/monthly/{month}")
    public ResponseEntity<MonthlyRanking.Ranking> getMonthlyRanking(
            @PathVariable String name,
            @PathVariable @Pattern(regexp = MONTH_PATTERN) String month,
            FilterParams filter) throws IOException {
        return ResponseEntity.of(MonthlyRanking.rank(games(name, filter), month));
    }

    @GetMapping("/{name}/monthly/{month}/progression")
    public List<MonthlyRanking.Ranking> getProgression(
            @PathVariable String name,
            @PathVariable @Pattern(regexp = MONTH_PATTERN) String month,
            FilterParams filter) throws IOException {
        return MonthlyRanking.progression(games(name, filter), month);
    }

    @GetMapping("/{name}/wolves")
    public List<WolfTransformStats> getWolfTransforms(@PathVariable String name, FilterParams filter)
            throws IOException {
        return WolfTransformCalculator.compute(games(name, filter));
    }

    @GetMapping("/{name}/voting")
    public VotingStats getVoting(@PathVariable String name, FilterParams filter) throws IOException {
        return VotingStats.compute(games(name, filter));
    }

    @GetMapping("/{name}/voting/{player}")
    public ResponseEntity<VotingStats.PlayerVoting> getPlayerVoting(
            @PathVariable String name, @PathVariable String player, FilterParams filter) throws IOException {
        return ResponseEntity.of(VotingStats.compute(games(name, filter)).player(player));
    }

    @GetMapping("/{name}/series")
    public SeriesStats getSeries(@PathVariable String name, FilterParams filter) throws IOException {
        return SeriesStats.compute(games(name, filter));
    }

    @GetMapping("/{name}/maps")
    public MapStats getMaps(@PathVariable String name, FilterParams filter) throws IOException {
        return MapStats.compute(games(name, filter));
    }

    @GetMapping("/{name}/maps/{map}")
    public ResponseEntity<MapStats.MapSummary> getMap(
            @PathVariable String name, @PathVariable String map, FilterParams filter) throws IOException {
        return ResponseEntity.of(MapStats.compute(games(name, filter)).map(map));
    }

    @GetMapping("/{name}/games/{gameId}/timeline")
    public GameTimeline getTimeline(@PathVariable String name, @PathVariable String gameId) throws IOException {
        return TimelineBuilder.buildTimeline(gameLogService.getGame(name, gameId));
    }

    /**
     * Compares two players given by key or name. 404 when either is absent from the selected games.
     */
    @GetMapping("/{name}/compare")
    public ResponseEntity<PlayerComparison.Comparison> compare(
            @PathVariable String name,
            @RequestParam @NotBlank String first,
            @RequestParam @NotBlank String second,
            @RequestParam(required = false) @Min(1) Integer minGames,
            FilterParams filter) throws IOException {
        int floor = minGames != null ? minGames : comparisonMinGames;
        return ResponseEntity.of(PlayerComparison.compare(games(name, filter), first, second, floor));
    }

    private List<GameRecord> games(String name, FilterParams params) throws IOException {
        return gameLogService.getGames(name, params.toFilter());
    }

    @ExceptionHandler(GameLogNotFoundException.class)
    public ResponseEntity<String> handleNotFound(GameLogNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ex.getMessage());
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<String> handleInvalid(ConstraintViolationException ex) {
        return ResponseEntity.badRequest().body(ex.getMessage());
    }

    /**
     * Filter query parameters shared by the report endpoints.
     */
    public record FilterParams(
            Boolean modOnly,
            String map,
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {

        GameFilter toFilter() {
            return new GameFilter(
                Boolean.TRUE.equals(modOnly),
                Optional.ofNullable(map),
                Optional.ofNullable(from).map(d -> d.atStartOfDay().toInstant(ZoneOffset.UTC)),
                Optional.ofNullable(to).map(d -> d.plusDays(1).atStartOfDay().toInstant(ZoneOffset.UTC)));
        }
    }
}
