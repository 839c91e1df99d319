package com.tennis.tracker.dto;

import com.tennis.engine.model.PlayerStatistics;
import com.tennis.tracker.export.Ratios;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Both players' counters for one scope, with the derived percentages shown on the scoreboard.
 *
 * @param scope {@code "match"} or {@code "set N"}
 */
public record StatisticsResponse(String scope, PlayerLine playerOne, PlayerLine playerTwo) {

    public record PlayerLine(String name, PlayerStatistics counters, Map<String, String> percentages) {

        public static PlayerLine from(String name, PlayerStatistics s) {
            Map<String, String> percentages = new LinkedHashMap<>();
            percentages.put("firstServeIn", Ratios.percent(s.getFirstServesIn(), s.getFirstServesAttempted()));
            percentages.put("firstServePointsWon", Ratios.percent(s.getPointsWonOnFirstServe(), s.getFirstServesIn()));
            percentages.put("secondServeIn", Ratios.percent(s.getSecondServesIn(), s.getSecondServesAttempted()));
            percentages.put("secondServePointsWon", Ratios.percent(s.getPointsWonOnSecondServe(), s.getSecondServesIn()));
            percentages.put("netPointsWon", Ratios.percent(s.getNetPointsWon(), s.getNetPointsTotal()));
            percentages.put("breakPointsWon", Ratios.percent(s.getBreakPointsWon(), s.getBreakPointsTotal()));
            percentages.put("totalPointsWon", Ratios.percent(s.getPointsWon(), s.getPointsPlayed()));
            return new PlayerLine(name, s, percentages);
        }
    }
}
