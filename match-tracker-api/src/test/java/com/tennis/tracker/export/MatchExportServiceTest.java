package com.tennis.tracker.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tennis.engine.MatchController;
import com.tennis.engine.event.RallyOutcome;
import com.tennis.engine.event.ReturnOutcome;
import com.tennis.engine.event.ServeOutcome;
import com.tennis.engine.model.MatchFormat;
import com.tennis.engine.model.MatchState;
import com.tennis.engine.model.Player;
import com.tennis.tracker.config.TrackerProperties;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MatchExportServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MatchExportService exportService;
    private MatchController match;

    @BeforeEach
    void setUp() {
        exportService = new MatchExportService(new TrackerProperties(), objectMapper);
        match = MatchController.startMatch(MatchFormat.shortSets(), "Rafa N", "Roger F", "Court Philippe-Chatrier", Player.ONE);
    }

    @Test
    void fileBaseReplacesSpaces() {
        String base = exportService.fileBase(match.snapshot(), LocalDateTime.of(2024, 6, 9, 15, 4, 5));

        assertThat(base).isEqualTo("Rafa_N_vs_Roger_F_2024-06-09_15-04-05");
    }

    @Test
    void textSummaryShowsTiebreakSetsAndPressureTags() {
        reachFourAll();
        for (int i = 0; i < 7; i++) {
            winPoint(Player.TWO);
        }

        String text = exportService.textSummary(match.snapshot());

        assertThat(text).startsWith("Match Summary\n=============\n");
        assertThat(text).contains("Players: Rafa N vs Roger F");
        assertThat(text).contains("Format: Best-of-3; sets to 4 (TB7 at 4-4)");
        assertThat(text).contains("  Set 1: 4-4 (TB 0-7)");
        assertThat(text).contains("  Set 2: 0-0");
        assertThat(text).contains("Player: Rafa N (Match Totals)");
        assertThat(text).contains("Net: 0/0 (--)");
        assertThat(text).contains("# | Set | Game | TB | Server | Serve | Winner | BP/GP/SP/MP | Event");
        assertThat(text).contains(" | Y | ");
        assertThat(text).contains(" | GP | Ace (1st).");
    }

    @Test
    void matchTiebreakFormatLine() {
        MatchController tb = MatchController.startMatch(MatchFormat.withMatchTiebreak(), "A", "B", "", Player.ONE);

        assertThat(exportService.textSummary(tb.snapshot())).contains("Format: Best-of-3; sets to 6 (TB7 at 6-6); deciding TB10");
    }

    @Test
    void csvTablesFollowColumnLayout() throws Exception {
        match.submitServeOutcome(ServeOutcome.FIRST_IN);
        match.submitReturnOutcome(ReturnOutcome.RETURN_IN);
        match.submitRallyOutcome(RallyOutcome.SERVER_WINNER, Player.ONE);
        MatchState state = match.snapshot();

        String totals = exportService.csvMatchTotals(state);
        assertThat(totals.lines()).hasSize(3);
        assertThat(totals.lines().skip(1).findFirst().orElseThrow())
                .isEqualTo("Rafa N,1,1,1,0,0,0,0,0,0,0,0,0,0,0,0,0,1,0,0,1,1,0,0,1,1");

        String perSet = exportService.csvPerSet(state);
        assertThat(perSet).startsWith("Set,Player,FirstServIn");
        assertThat(perSet.lines()).hasSize(3);
        assertThat(perSet).contains("1,Roger F,0,0,0,0,0,0,0,0,0,0,0,0,0,0,0,0,0,0,0,0,0,0,0,0,1");

        List<CSVRecord> points = parse(exportService.csvPoints(state));
        assertThat(points).hasSize(1);
        assertThat(points.get(0).get("Server")).isEqualTo("P1");
        assertThat(points.get(0).get("ServeType")).isEqualTo("1st");
        assertThat(points.get(0).get("Event")).isEqualTo("1st in; Return in; Rally: server winner.");
    }

    @Test
    void csvKeepsNamesWithCommasAndQuotesInOneColumn() throws Exception {
        MatchController named = MatchController.startMatch(MatchFormat.fullSets(), "Smith, John", "\"Big\" Doe", "", Player.ONE);
        named.submitServeOutcome(ServeOutcome.ACE_FIRST);
        MatchState state = named.snapshot();

        List<CSVRecord> totals = parse(exportService.csvMatchTotals(state));
        assertThat(totals).hasSize(2);
        assertThat(totals.get(0).size()).isEqualTo(26);
        assertThat(totals.get(0).get("Player")).isEqualTo("Smith, John");
        assertThat(totals.get(0).get("Aces1")).isEqualTo("1");
        assertThat(totals.get(1).get("Player")).isEqualTo("\"Big\" Doe");
        assertThat(totals.get(1).get("PtsPlayed")).isEqualTo("1");

        List<CSVRecord> perSet = parse(exportService.csvPerSet(state));
        assertThat(perSet.get(0).size()).isEqualTo(27);
        assertThat(perSet.get(0).get("Player")).isEqualTo("Smith, John");
        assertThat(perSet.get(1).get("Player")).isEqualTo("\"Big\" Doe");
    }

    @Test
    void jsonDocumentCarriesSetsStatisticsAndLog() throws Exception {
        winPoint(Player.ONE);
        winPoint(Player.TWO);

        JsonNode json = objectMapper.readTree(exportService.json(match.snapshot()));

        assertThat(json.get("players").get(0).asText()).isEqualTo("Rafa N");
        assertThat(json.get("location").asText()).isEqualTo("Court Philippe-Chatrier");
        assertThat(json.get("format").get("tiebreakAtGames").asInt()).isEqualTo(4);
        assertThat(json.get("sets")).hasSize(1);
        assertThat(json.get("sets").get(0).get("statistics").get("p2").get("pointsWon").asInt()).isEqualTo(1);
        assertThat(json.get("statistics").get("p1").get("acesFirst").asInt()).isEqualTo(1);
        assertThat(json.get("log")).hasSize(2);
        assertThat(json.get("log").get(1).get("event").asText()).isEqualTo("double fault.");
    }

    @Test
    void ratiosRenderDashForEmptyDenominator() {
        assertThat(Ratios.ratioWithPercent(2, 3)).isEqualTo("2/3 (66.7%)");
        assertThat(Ratios.ratioWithPercent(0, 0)).isEqualTo("0/0 (--)");
    }

    private static List<CSVRecord> parse(String csv) throws IOException {
        CSVFormat fmt = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .build();
        try (CSVParser parser = CSVParser.parse(csv, fmt)) {
            return parser.getRecords();
        }
    }

    private void reachFourAll() {
        for (int i = 0; i < 3; i++) {
            winGame(Player.ONE);
        }
        for (int i = 0; i < 4; i++) {
            winGame(Player.TWO);
        }
        winGame(Player.ONE);
    }

    private void winGame(Player player) {
        for (int i = 0; i < 4; i++) {
            winPoint(player);
        }
    }

    private void winPoint(Player player) {
        if (match.currentScoreboard().server() == player) {
            match.submitServeOutcome(ServeOutcome.ACE_FIRST);
        } else {
            match.submitServeOutcome(ServeOutcome.DOUBLE_FAULT);
        }
    }
}
