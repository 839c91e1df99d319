package com.tennis.engine.rules;

import com.tennis.engine.model.DecidingPolicy;
import com.tennis.engine.model.MatchFormat;
import com.tennis.engine.model.MatchPhase;
import com.tennis.engine.model.MatchState;
import com.tennis.engine.model.Player;
import com.tennis.engine.model.SetRecord;
import org.junit.jupiter.api.Test;

import static com.tennis.engine.model.Player.ONE;
import static com.tennis.engine.model.Player.TWO;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScoreKeeperTest {

    private final ScoreKeeper scoreKeeper = new ScoreKeeper();

    @Test
    void gameNeedsFourPointsAndTwoClear() {
        MatchState state = fullSets();
        points(state, ONE, 3);
        points(state, TWO, 3);
        assertThat(scoreKeeper.awardPoint(state, ONE)).isEqualTo(ScoreKeeper.Transition.POINT);
        assertThat(scoreKeeper.awardPoint(state, TWO)).isEqualTo(ScoreKeeper.Transition.POINT);
        assertThat(scoreKeeper.awardPoint(state, TWO)).isEqualTo(ScoreKeeper.Transition.POINT);
        assertThat(scoreKeeper.awardPoint(state, TWO)).isEqualTo(ScoreKeeper.Transition.GAME);

        assertThat(state.currentSet().getGamesB()).isEqualTo(1);
        assertThat(state.getGamePoints(ONE)).isZero();
        assertThat(state.getGamePoints(TWO)).isZero();
    }

    @Test
    void serverFlipsAfterEveryGame() {
        MatchState state = fullSets();
        games(state, TWO, 1);
        assertThat(state.getCurrentServer()).isEqualTo(TWO);
        games(state, TWO, 1);
        assertThat(state.getCurrentServer()).isEqualTo(ONE);
    }

    @Test
    void setIsNotWonWithOneGameMargin() {
        MatchState state = fullSets();
        games(state, ONE, 5);
        games(state, TWO, 5);
        games(state, ONE, 1);
        assertThat(state.getSetsWon(ONE)).isZero();
        assertThat(state.currentSet().isFinished()).isFalse();

        assertThat(scoreKeeperGame(state, ONE)).isEqualTo(ScoreKeeper.Transition.SET);
        SetRecord first = state.getSets().get(0);
        assertThat(first.getGamesA()).isEqualTo(7);
        assertThat(first.getGamesB()).isEqualTo(5);
        assertThat(first.isFinished()).isTrue();
        assertThat(first.isTiebreakPlayed()).isFalse();
        assertThat(state.getSets()).hasSize(2);
        assertThat(state.getCurrentSetIndex()).isEqualTo(1);
    }

    @Test
    void sixFourClosesTheSet() {
        MatchState state = fullSets();
        games(state, TWO, 4);
        games(state, ONE, 5);
        assertThat(state.getSetsWon(ONE)).isZero();
        games(state, ONE, 1);
        assertThat(state.getSetsWon(ONE)).isEqualTo(1);
        assertThat(state.getSets().get(0).toString()).isEqualTo("6-4");
    }

    @Test
    void sixAllStartsTiebreakServedByNextServer() {
        MatchState state = fullSets();
        games(state, ONE, 6);
        assertThat(state.getSetsWon(ONE)).isEqualTo(1);

        // Set two: level to 6-6
        games(state, ONE, 5);
        games(state, TWO, 6);
        Player nextServer = state.getCurrentServer();
        games(state, ONE, 1);

        assertThat(state.isInSetTiebreak()).isTrue();
        assertThat(state.getPhase()).isEqualTo(MatchPhase.SET_TIEBREAK);
        assertThat(state.currentSet().isTiebreakPlayed()).isTrue();
        assertThat(state.getTiebreakStartServer()).isEqualTo(nextServer.opponent());
        assertThat(state.getCurrentServer()).isEqualTo(state.getTiebreakStartServer());
    }

    @Test
    void sevenStraightTiebreakPointsEndTheSet() {
        MatchState state = toSixAll(fullSets());
        Player start = state.getTiebreakStartServer();

        for (int i = 0; i < 6; i++) {
            assertThat(scoreKeeper.awardPoint(state, ONE)).isEqualTo(ScoreKeeper.Transition.POINT);
        }
        assertThat(scoreKeeper.awardPoint(state, ONE)).isEqualTo(ScoreKeeper.Transition.SET);

        SetRecord set = state.getSets().get(0);
        assertThat(set.getTiebreakScoreA()).isEqualTo(7);
        assertThat(set.getTiebreakScoreB()).isZero();
        assertThat(set.getGamesA()).isEqualTo(6);
        assertThat(set.getGamesB()).isEqualTo(6);
        assertThat(set.toString()).isEqualTo("6-6 (TB 7-0)");
        assertThat(set.isFinished()).isTrue();
        assertThat(state.getSetsWon(ONE)).isEqualTo(1);
        assertThat(state.isInSetTiebreak()).isFalse();
        // Seventh point was served by the opponent of the tiebreak's first server
        assertThat(state.getCurrentServer()).isEqualTo(ServeRotation.serverFor(start, 6));
        assertThat(state.getTiebreakPoints(ONE)).isZero();
    }

    @Test
    void tiebreakNeedsTwoPointMargin() {
        MatchState state = toSixAll(fullSets());
        for (int i = 0; i < 6; i++) {
            scoreKeeper.awardPoint(state, ONE);
            scoreKeeper.awardPoint(state, TWO);
        }
        assertThat(scoreKeeper.awardPoint(state, TWO)).isEqualTo(ScoreKeeper.Transition.POINT);
        assertThat(scoreKeeper.awardPoint(state, ONE)).isEqualTo(ScoreKeeper.Transition.POINT);
        assertThat(scoreKeeper.awardPoint(state, ONE)).isEqualTo(ScoreKeeper.Transition.POINT);
        assertThat(scoreKeeper.awardPoint(state, ONE)).isEqualTo(ScoreKeeper.Transition.SET);

        SetRecord set = state.getSets().get(0);
        assertThat(set.getTiebreakScoreA()).isEqualTo(9);
        assertThat(set.getTiebreakScoreB()).isEqualTo(7);
        assertThat(set.toString()).isEqualTo("6-6 (TB 9-7)");
    }

    @Test
    void serverOfLastTiebreakPointOpensNextSet() {
        MatchState state = toSixAll(fullSets());
        Player start = state.getTiebreakStartServer();
        for (int i = 0; i < 7; i++) {
            scoreKeeper.awardPoint(state, ONE);
            scoreKeeper.awardPoint(state, TWO);
        }
        scoreKeeper.awardPoint(state, TWO);
        Player lastPointServer = state.getCurrentServer();
        assertThat(scoreKeeper.awardPoint(state, TWO)).isEqualTo(ScoreKeeper.Transition.SET);

        // 16 points: the last one is slot 3 of the rotation, served by the starting server
        assertThat(lastPointServer).isEqualTo(ServeRotation.serverFor(start, 15));
        assertThat(lastPointServer).isEqualTo(start);
        assertThat(state.getCurrentServer()).isEqualTo(start);
        assertThat(state.getSets().get(0).toString()).isEqualTo("6-6 (TB 7-9)");
        assertThat(state.getSetsWon(TWO)).isEqualTo(1);
        assertThat(state.getCurrentSetIndex()).isEqualTo(1);
    }

    @Test
    void tiebreakServerFollowsRotationAfterEachPoint() {
        MatchState state = toSixAll(fullSets());
        Player start = state.getTiebreakStartServer();
        for (int t = 1; t <= 5; t++) {
            scoreKeeper.awardPoint(state, t % 2 == 0 ? ONE : TWO);
            assertThat(state.getCurrentServer()).isEqualTo(ServeRotation.serverFor(start, t));
        }
    }

    @Test
    void splitSetsUnderMatchTiebreakPolicyStartMatchTiebreak() {
        MatchState state = new MatchState(MatchFormat.withMatchTiebreak(), "A", "B", "Court 1", ONE);
        games(state, ONE, 6);
        assertThat(scoreKeeperGames(state, TWO, 6)).isEqualTo(ScoreKeeper.Transition.SET);

        assertThat(state.isInMatchTiebreak()).isTrue();
        assertThat(state.getPhase()).isEqualTo(MatchPhase.MATCH_TIEBREAK);
        assertThat(state.getSets()).hasSize(2);
        assertThat(state.getTiebreakStartServer()).isNull();
        assertThatThrownBy(() -> scoreKeeper.awardPoint(state, ONE))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void matchTiebreakToTenAppendsDeciderRow() {
        MatchState state = new MatchState(MatchFormat.withMatchTiebreak(), "A", "B", "Court 1", ONE);
        games(state, ONE, 6);
        games(state, TWO, 4);
        games(state, ONE, 2);
        games(state, TWO, 2);
        assertThat(state.isInMatchTiebreak()).isTrue();
        state.setTiebreakStartServer(TWO);
        state.setCurrentServer(TWO);

        for (int i = 0; i < 9; i++) {
            scoreKeeper.awardPoint(state, ONE);
            scoreKeeper.awardPoint(state, TWO);
        }
        assertThat(scoreKeeper.awardPoint(state, TWO)).isEqualTo(ScoreKeeper.Transition.POINT);
        assertThat(scoreKeeper.awardPoint(state, TWO)).isEqualTo(ScoreKeeper.Transition.MATCH);

        assertThat(state.isMatchComplete()).isTrue();
        assertThat(state.getWinner()).isEqualTo(TWO);
        assertThat(state.getSets()).hasSize(3);
        SetRecord decider = state.getSets().get(2);
        assertThat(decider.isTiebreakPlayed()).isTrue();
        assertThat(decider.isFinished()).isTrue();
        assertThat(decider.getTiebreakScoreA()).isEqualTo(9);
        assertThat(decider.getTiebreakScoreB()).isEqualTo(11);
        assertThat(decider.getGamesA()).isEqualTo(2);
        assertThat(decider.getGamesB()).isEqualTo(6);
        assertThat(state.getPhase()).isEqualTo(MatchPhase.MATCH_COMPLETE);
    }

    @Test
    void fullSetsFormatPlaysARegularThirdSet() {
        MatchState state = fullSets();
        games(state, ONE, 6);
        games(state, TWO, 6);
        assertThat(state.isInMatchTiebreak()).isFalse();
        assertThat(state.getSets()).hasSize(3);
        assertThat(state.getPhase()).isEqualTo(MatchPhase.REGULAR_GAME);

        games(state, ONE, 6);
        assertThat(state.isMatchComplete()).isTrue();
        assertThat(state.getWinner()).isEqualTo(ONE);
        assertThat(state.getSets()).hasSize(3);
    }

    @Test
    void straightSetsEndTheMatch() {
        MatchState state = new MatchState(MatchFormat.shortSets(), "A", "B", "Court 1", TWO);
        games(state, TWO, 4);
        assertThat(scoreKeeperGames(state, TWO, 4)).isEqualTo(ScoreKeeper.Transition.MATCH);
        assertThat(state.getSetsWon(TWO)).isEqualTo(2);
        assertThat(state.getSets()).hasSize(2);
        assertThatThrownBy(() -> scoreKeeper.awardPoint(state, ONE))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("complete");
    }

    @Test
    void customFormatTargetsAreHonoured() {
        MatchFormat format = new MatchFormat(3, 3, 5, DecidingPolicy.REGULAR_THIRD_SET, 10, 3);
        MatchState state = new MatchState(format, "A", "B", "Court 1", ONE);
        games(state, ONE, 2);
        games(state, TWO, 3);
        games(state, ONE, 1);
        assertThat(state.isInSetTiebreak()).isTrue();
        points(state, TWO, 5);
        assertThat(state.getSetsWon(TWO)).isEqualTo(1);
    }

    private MatchState fullSets() {
        return new MatchState(MatchFormat.fullSets(), "A", "B", "Court 1", ONE);
    }

    private MatchState toSixAll(MatchState state) {
        games(state, ONE, 5);
        games(state, TWO, 6);
        games(state, ONE, 1);
        assertThat(state.isInSetTiebreak()).isTrue();
        return state;
    }

    private void points(MatchState state, Player player, int count) {
        for (int i = 0; i < count; i++) {
            scoreKeeper.awardPoint(state, player);
        }
    }

    private void games(MatchState state, Player player, int count) {
        scoreKeeperGames(state, player, count);
    }

    private ScoreKeeper.Transition scoreKeeperGames(MatchState state, Player player, int count) {
        ScoreKeeper.Transition last = null;
        for (int i = 0; i < count; i++) {
            last = scoreKeeperGame(state, player);
        }
        return last;
    }

    private ScoreKeeper.Transition scoreKeeperGame(MatchState state, Player player) {
        ScoreKeeper.Transition last = null;
        for (int i = 0; i < 4; i++) {
            last = scoreKeeper.awardPoint(state, player);
        }
        return last;
    }
}
