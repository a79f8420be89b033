package edu.brandeis.cosi103a.lycans.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.brandeis.cosi103a.lycans.GameFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ReportBuilderTest {

    @Test
    void parseArgs_defaultsOutputNextToInput() {
        ReportOptions options = ReportBuilder.parseArgs(new String[]{"--input", "data/s3/gamelog.json"});

        assertEquals(Path.of("data/s3/gamelog.json"), options.input());
        assertEquals(Path.of("data/s3/reports.json"), options.output());
        assertTrue(options.filter().isEmpty());
    }

    @Test
    void parseArgs_filters() {
        ReportOptions options = ReportBuilder.parseArgs(new String[]{
            "--input", "in.json", "--output", "out.json", "--mod-only", "--map", "Village"});

        assertEquals(Path.of("out.json"), options.output());
        assertTrue(options.filter().modOnly());
        assertEquals(Optional.of("Village"), options.filter().map());
    }

    @Test
    void parseArgs_missingInput() {
        assertThrows(IllegalArgumentException.class, () -> ReportBuilder.parseArgs(new String[]{"--mod-only"}));
    }

    @Test
    void parseArgs_unknownArgument() {
        assertThrows(IllegalArgumentException.class,
            () -> ReportBuilder.parseArgs(new String[]{"--input", "a.json", "--verbose"}));
    }

    @Test
    void parseArgs_flagWithoutValue() {
        assertThrows(IllegalArgumentException.class, () -> ReportBuilder.parseArgs(new String[]{"--input"}));
    }

    @Test
    void buildReport_writesReportFile(@TempDir Path tempDir) throws Exception {
        Path input = tempDir.resolve("season/gamelog.json");
        GameFixtures.copySampleLog(input);

        StatsReport report = ReportBuilder.buildReport(
            ReportBuilder.parseArgs(new String[]{"--input", input.toString()}));

        Path output = tempDir.resolve("season/reports.json");
        assertTrue(Files.exists(output), "reports.json should be created");
        assertFalse(Files.exists(tempDir.resolve("season/reports.json.tmp")));
        assertEquals(3, report.gamesAnalyzed());

        JsonNode json = new ObjectMapper().readTree(output.toFile());
        assertEquals("0.212", json.get("modVersion").asText());
        assertEquals(3, json.get("campWins").get("gamesWithWinner").asInt());
        assertEquals(5, json.get("players").get("players").size());
        assertEquals("Chaman Mystère", json.get("unmappedRoles").get(0).asText());
        assertTrue(json.get("survival").get("overall").get("averageDeathTiming").isNumber());
    }

    @Test
    void buildReport_appliesFilter(@TempDir Path tempDir) throws Exception {
        Path input = tempDir.resolve("gamelog.json");
        GameFixtures.copySampleLog(input);

        StatsReport report = ReportBuilder.buildReport(ReportBuilder.parseArgs(new String[]{
            "--input", input.toString(), "--output", tempDir.resolve("out/modded.json").toString(),
            "--mod-only", "--map", "village"}));

        assertEquals(2, report.gamesAnalyzed());
        assertTrue(Files.exists(tempDir.resolve("out/modded.json")));
    }

    @Test
    void buildReport_missingInput(@TempDir Path tempDir) {
        ReportOptions options = ReportBuilder.parseArgs(new String[]{"--input", tempDir.resolve("none.json").toString()});
        assertThrows(IllegalArgumentException.class, () -> ReportBuilder.buildReport(options));
    }

    @Test
    void buildReport_rerunGivesSameReport(@TempDir Path tempDir) throws Exception {
        Path input = tempDir.resolve("gamelog.json");
        GameFixtures.copySampleLog(input);
        ReportOptions options = ReportBuilder.parseArgs(new String[]{"--input", input.toString()});

        StatsReport first = ReportBuilder.buildReport(options);
        String firstJson = Files.readString(options.output());
        StatsReport second = ReportBuilder.buildReport(options);

        assertEquals(first, second);
        assertEquals(firstJson, Files.readString(options.output()));
    }
}
