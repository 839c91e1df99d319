package com.tennis.tracker.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tennis.engine.model.MatchFormat;
import com.tennis.engine.model.MatchState;
import com.tennis.engine.model.Player;
import com.tennis.engine.model.PlayerStatistics;
import com.tennis.engine.model.PointRecord;
import com.tennis.engine.model.SetRecord;
import com.tennis.tracker.config.TrackerProperties;
import com.tennis.tracker.dto.PointResponse;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders a match snapshot as a text summary, a JSON document or CSV tables.
 * Exports only read the snapshot; they never touch the live match.
 */
@Service
public class MatchExportService {

    private static final Logger log = LoggerFactory.getLogger(MatchExportService.class);

    private static final String[] STAT_COLUMNS = {
            "FirstServIn", "FirstServAtt", "FirstPtsWon", "SecondServIn", "SecondServAtt", "SecondPtsWon",
            "Aces1", "Aces2", "SrvW1", "SrvW2", "DF", "RetWonV1", "RetWonV2", "RetW", "RetUE", "RetFE",
            "RallyW", "UE", "FEdrawn", "NetWon", "NetTot", "BPWon", "BPTot", "PtsWon", "PtsPlayed"
    };

    private static final String[] POINT_COLUMNS = {
            "Idx", "Set", "Game", "TB", "Server", "ServeType", "Winner", "BP", "GP", "SP", "MP", "Event"
    };

    private final TrackerProperties properties;
    private final ObjectMapper objectMapper;

    public MatchExportService(TrackerProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    /**
     * Download name without extension: {@code <p1>_vs_<p2>_<timestamp>}, spaces replaced by underscores.
     */
    public String fileBase(MatchState state, LocalDateTime now) {
        DateTimeFormatter pattern = DateTimeFormatter.ofPattern(properties.getExport().getTimestampPattern(), Locale.ROOT);
        String base = state.getPlayerOneName() + "_vs_" + state.getPlayerTwoName() + "_" + now.format(pattern);
        return base.replace(' ', '_');
    }

    // ============ TEXT ============

    public String textSummary(MatchState state) {
        StringBuilder txt = new StringBuilder();
        txt.append("Match Summary\n=============\n");
        txt.append("Players: ").append(state.getPlayerOneName()).append(" vs ").append(state.getPlayerTwoName()).append('\n');
        txt.append("Location: ").append(state.getLocation()).append('\n');
        txt.append("Format: ").append(formatLine(state.getFormat())).append("\n\n");

        txt.append("Final Set Scores:\n");
        List<SetRecord> sets = state.getSets();
        for (int i = 0; i < sets.size(); i++) {
            txt.append("  Set ").append(i + 1).append(": ").append(sets.get(i)).append('\n');
        }

        statBlock(txt, state.matchStatistics(Player.ONE), "Player: " + state.getPlayerOneName() + " (Match Totals)");
        statBlock(txt, state.matchStatistics(Player.TWO), "Player: " + state.getPlayerTwoName() + " (Match Totals)");

        txt.append("\nPer-set stats\n-------------\n");
        for (int i = 0; i < sets.size(); i++) {
            txt.append("Set ").append(i + 1).append(":\n");
            statBlock(txt, state.setStatistics(i, Player.ONE), "  " + state.getPlayerOneName());
            statBlock(txt, state.setStatistics(i, Player.TWO), "  " + state.getPlayerTwoName());
        }

        txt.append("\nPoint-by-point log\n-------------------\n");
        txt.append("# | Set | Game | TB | Server | Serve | Winner | BP/GP/SP/MP | Event\n");
        List<PointRecord> points = state.getPointLog();
        for (int i = 0; i < points.size(); i++) {
            PointRecord p = points.get(i);
            txt.append(i + 1).append(" | ")
                    .append(p.setIndex() + 1).append(" | ")
                    .append(p.gameIndex() + 1).append(" | ")
                    .append(yesNo(p.tiebreak())).append(" | ")
                    .append(state.getPlayerName(p.server())).append(" | ")
                    .append(p.serveType().label()).append(" | ")
                    .append(state.getPlayerName(p.winner())).append(" | ")
                    .append(p.pressureTags()).append(" | ")
                    .append(EventDescriber.describe(p.event())).append('\n');
        }
        return txt.toString();
    }

    static String formatLine(MatchFormat format) {
        StringBuilder line = new StringBuilder()
                .append("Best-of-").append(format.bestOfSets())
                .append("; sets to ").append(format.gamesToWinSet())
                .append(" (TB").append(format.setTiebreakTarget())
                .append(" at ").append(format.tiebreakAtGames()).append('-').append(format.tiebreakAtGames()).append(')');
        if (format.hasMatchTiebreak()) {
            line.append("; deciding TB").append(format.decidingTiebreakTarget());
        }
        return line.toString();
    }

    private static void statBlock(StringBuilder txt, PlayerStatistics s, String title) {
        txt.append('\n').append(title).append("\n----------------------------------------\n");
        txt.append("First serve: ").append(Ratios.ratioWithPercent(s.getFirstServesIn(), s.getFirstServesAttempted())).append('\n');
        txt.append("1st pts won: ").append(Ratios.ratioWithPercent(s.getPointsWonOnFirstServe(), s.getFirstServesIn())).append('\n');
        txt.append("Second srv:  ").append(Ratios.ratioWithPercent(s.getSecondServesIn(), s.getSecondServesAttempted())).append('\n');
        txt.append("2nd pts won: ").append(Ratios.ratioWithPercent(s.getPointsWonOnSecondServe(), s.getSecondServesIn())).append('\n');
        txt.append("Aces (1/2):  ").append(s.getAcesFirst()).append(" / ").append(s.getAcesSecond()).append('\n');
        txt.append("Srv winners: ").append(s.getServiceWinnersFirst()).append(" / ").append(s.getServiceWinnersSecond()).append('\n');
        txt.append("Double faults: ").append(s.getDoubleFaults()).append('\n');
        txt.append("Return vs1st: ").append(s.getReturnPointsWonVsFirst()).append('\n');
        txt.append("Return vs2nd: ").append(s.getReturnPointsWonVsSecond()).append('\n');
        txt.append("Return W/UE/FE: ").append(s.getReturnWinners()).append('/')
                .append(s.getReturnUnforcedErrors()).append('/').append(s.getReturnForcedErrors()).append('\n');
        txt.append("Rally winners: ").append(s.getRallyWinners()).append('\n');
        txt.append("Unforced err: ").append(s.getUnforcedErrors()).append('\n');
        txt.append("Forced drawn: ").append(s.getForcedErrorsDrawn()).append('\n');
        txt.append("Net: ").append(Ratios.ratioWithPercent(s.getNetPointsWon(), s.getNetPointsTotal())).append('\n');
        txt.append("Break points: ").append(Ratios.ratio(s.getBreakPointsWon(), s.getBreakPointsTotal())).append('\n');
        txt.append("Total points: ").append(Ratios.ratioWithPercent(s.getPointsWon(), s.getPointsPlayed())).append('\n');
    }

    // ============ JSON ============

    public String json(MatchState state) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("players", List.of(state.getPlayerOneName(), state.getPlayerTwoName()));
        document.put("location", state.getLocation());
        document.put("format", state.getFormat());
        document.put("winner", state.getWinner());

        List<Map<String, Object>> sets = new ArrayList<>();
        for (int i = 0; i < state.getSets().size(); i++) {
            SetRecord set = state.getSets().get(i);
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("set", i + 1);
            row.put("p1", set.getGamesA());
            row.put("p2", set.getGamesB());
            row.put("tb", set.isTiebreakPlayed());
            row.put("tbP1", set.getTiebreakScoreA());
            row.put("tbP2", set.getTiebreakScoreB());
            row.put("statistics", Map.of(
                    "p1", state.setStatistics(i, Player.ONE),
                    "p2", state.setStatistics(i, Player.TWO)));
            sets.add(row);
        }
        document.put("sets", sets);
        document.put("statistics", Map.of(
                "p1", state.matchStatistics(Player.ONE),
                "p2", state.matchStatistics(Player.TWO)));

        List<PointResponse> points = new ArrayList<>();
        List<PointRecord> entries = state.getPointLog();
        for (int i = 0; i < entries.size(); i++) {
            points.add(PointResponse.from(entries.get(i), i + 1));
        }
        document.put("log", points);

        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(document);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize match {} vs {}: {}", state.getPlayerOneName(), state.getPlayerTwoName(), e.getMessage());
            throw new IllegalStateException("Could not render match as JSON", e);
        }
    }

    // ============ CSV ============

    public String csvMatchTotals(MatchState state) {
        return csv(withLeading(STAT_COLUMNS, "Player"), printer -> {
            printer.printRecord(statRow(state.matchStatistics(Player.ONE), state.getPlayerOneName()));
            printer.printRecord(statRow(state.matchStatistics(Player.TWO), state.getPlayerTwoName()));
        });
    }

    public String csvPerSet(MatchState state) {
        return csv(withLeading(STAT_COLUMNS, "Set", "Player"), printer -> {
            for (int i = 0; i < state.getSets().size(); i++) {
                printer.printRecord(statRow(state.setStatistics(i, Player.ONE), i + 1, state.getPlayerOneName()));
                printer.printRecord(statRow(state.setStatistics(i, Player.TWO), i + 1, state.getPlayerTwoName()));
            }
        });
    }

    public String csvPoints(MatchState state) {
        return csv(POINT_COLUMNS, printer -> {
            List<PointRecord> entries = state.getPointLog();
            for (int i = 0; i < entries.size(); i++) {
                PointRecord p = entries.get(i);
                printer.printRecord(
                        i + 1,
                        p.setIndex() + 1,
                        p.gameIndex() + 1,
                        yesNo(p.tiebreak()),
                        p.server().label(),
                        p.serveType().label(),
                        p.winner().label(),
                        yesNo(p.breakPoint()),
                        yesNo(p.gamePoint()),
                        yesNo(p.setPoint()),
                        yesNo(p.matchPoint()),
                        EventDescriber.describe(p.event()));
            }
        });
    }

    @FunctionalInterface
    private interface Rows {
        void print(CSVPrinter printer) throws IOException;
    }

    private static String csv(String[] header, Rows rows) {
        CSVFormat fmt = CSVFormat.DEFAULT.builder()
                .setHeader(header)
                .setRecordSeparator('\n')
                .build();
        StringWriter out = new StringWriter();
        try (CSVPrinter printer = new CSVPrinter(out, fmt)) {
            rows.print(printer);
        } catch (IOException e) {
            log.error("Failed to write CSV table {}: {}", header[0], e.getMessage());
            throw new UncheckedIOException("Could not render CSV table", e);
        }
        return out.toString();
    }

    private static String[] withLeading(String[] columns, String... leading) {
        String[] header = new String[leading.length + columns.length];
        System.arraycopy(leading, 0, header, 0, leading.length);
        System.arraycopy(columns, 0, header, leading.length, columns.length);
        return header;
    }

    private static List<Object> statRow(PlayerStatistics s, Object... leading) {
        List<Object> row = new ArrayList<>(List.of(leading));
        row.addAll(List.of(
                s.getFirstServesIn(), s.getFirstServesAttempted(), s.getPointsWonOnFirstServe(),
                s.getSecondServesIn(), s.getSecondServesAttempted(), s.getPointsWonOnSecondServe(),
                s.getAcesFirst(), s.getAcesSecond(), s.getServiceWinnersFirst(), s.getServiceWinnersSecond(),
                s.getDoubleFaults(), s.getReturnPointsWonVsFirst(), s.getReturnPointsWonVsSecond(),
                s.getReturnWinners(), s.getReturnUnforcedErrors(), s.getReturnForcedErrors(),
                s.getRallyWinners(), s.getUnforcedErrors(), s.getForcedErrorsDrawn(),
                s.getNetPointsWon(), s.getNetPointsTotal(), s.getBreakPointsWon(), s.getBreakPointsTotal(),
                s.getPointsWon(), s.getPointsPlayed()));
        return row;
    }

    private static String yesNo(boolean flag) {
        return flag ? "Y" : "N";
    }
}
