package edu.brandeis.cosi103a.lycans.stats;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import edu.brandeis.cosi103a.lycans.model.GameRecord;
import edu.brandeis.cosi103a.lycans.model.PlayerRecord;
import edu.brandeis.cosi103a.lycans.model.Timestamps;
import edu.brandeis.cosi103a.lycans.model.VoteEvent;
import edu.brandeis.cosi103a.lycans.role.PlayerIdentity;
import edu.brandeis.cosi103a.lycans.role.TimingCode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Meeting behavior of every player: how often they vote, skip or abstain, whether their votes
 * land on the other side, how early they commit, and how often they are voted against.
 *
 * <p>A player sits at meeting {@code m} while alive for it: a death at {@code Mk} still sits
 * at every meeting up to {@code k}, a death at {@code Jk} or {@code Nk} only before {@code k}.
 * When a player votes more than once in a meeting, the last vote counts.
 */
public record VotingStats(
    @JsonProperty("players") List<PlayerVoting> players
) {

    /** Portion of a meeting's dated votes, earliest first, that count as early. */
    static final double EARLY_SHARE = 0.33;

    /** Death types recorded for a player voted out. */
    private static final Set<String> VOTE_DEATHS = Set.of("vote", "voted");

    /**
     * @param aggressiveness vote rate minus half the skip rate minus 0.7 of the abstention rate,
     *                       in points; absent without any meeting
     * @param accuracy       votes for another alliance over votes whose target was found
     */
    public record PlayerVoting(
        @JsonProperty("playerKey") String playerKey,
        @JsonProperty("playerName") String playerName,
        @JsonProperty("meetings") int meetings,
        @JsonProperty("votes") int votes,
        @JsonProperty("skips") int skips,
        @JsonProperty("abstentions") int abstentions,
        @JsonProperty("votingRate") Rate votingRate,
        @JsonProperty("skippingRate") Rate skippingRate,
        @JsonProperty("abstentionRate") Rate abstentionRate,
        @JsonProperty("aggressiveness") OptionalDouble aggressiveness,
        @JsonProperty("votesForEnemyCamp") int votesForEnemyCamp,
        @JsonProperty("votesForOwnCamp") int votesForOwnCamp,
        @JsonProperty("accuracy") Rate accuracy,
        @JsonProperty("timesFirstToVote") int timesFirstToVote,
        @JsonProperty("timesEarlyVote") int timesEarlyVote,
        @JsonProperty("earlyVoteRate") Rate earlyVoteRate,
        @JsonProperty("timesTargeted") int timesTargeted,
        @JsonProperty("timesTargetedByEnemyCamp") int timesTargetedByEnemyCamp,
        @JsonProperty("eliminationsByVote") int eliminationsByVote
    ) {}

    /** A living player at one meeting and the ballot they left there. */
    private record Seat(PlayerInGame voter, Optional<VoteEvent> ballot, Optional<PlayerInGame> target,
                        boolean first, boolean early) {}

    /** A vote cast against a player found in the game. */
    private record Ballot(PlayerInGame voter, PlayerInGame target, int meeting) {}

    private static final class SeatTotals {
        final String key;
        int meetings;
        int votes;
        int skips;
        int abstentions;
        int enemy;
        int own;
        int first;
        int early;

        SeatTotals(String key) {
            this.key = key;
        }

        void add(Seat seat) {
            meetings++;
            if (seat.ballot().isEmpty()) {
                abstentions++;
                return;
            }
            if (seat.ballot().get().isSkip()) {
                skips++;
                return;
            }
            votes++;
            if (seat.first()) {
                first++;
            }
            if (seat.early()) {
                early++;
            }
            seat.target().ifPresent(t -> {
                if (isEnemy(seat.voter(), t)) {
                    enemy++;
                } else {
                    own++;
                }
            });
        }
    }

    private static final class TargetTotals {
        final String key;
        int targeted;
        int byEnemy;
        final Set<String> eliminations = new HashSet<>();

        TargetTotals(String key) {
            this.key = key;
        }

        void add(Ballot ballot) {
            targeted++;
            if (isEnemy(ballot.voter(), ballot.target())) {
                byEnemy++;
            }
            if (votedOutAt(ballot.target().player(), ballot.meeting())) {
                eliminations.add(ballot.target().game().id() + "#" + ballot.meeting());
            }
        }
    }

    public static VotingStats compute(List<GameRecord> games) {
        List<Seat> seats = new ArrayList<>();
        List<Ballot> ballots = new ArrayList<>();
        Map<String, String> names = new LinkedHashMap<>();
        for (GameRecord game : games) {
            ImmutableList<PlayerInGame> rows = PlayerInGame.of(game);
            rows.forEach(row -> names.putIfAbsent(row.key(), row.displayName()));
            collectMeetings(rows, seats, ballots);
        }

        Aggregation<Seat, String, SeatTotals, SeatTotals> bySeat = Aggregation.of(
            seat -> seat.voter().key(), SeatTotals::new, SeatTotals::add, (key, acc) -> acc);
        Aggregation<Ballot, String, TargetTotals, TargetTotals> byTarget = Aggregation.of(
            ballot -> ballot.target().key(), TargetTotals::new, TargetTotals::add, (key, acc) -> acc);
        ImmutableMap<String, SeatTotals> seated = Maps.uniqueIndex(bySeat.run(seats), t -> t.key);
        ImmutableMap<String, TargetTotals> targeted = Maps.uniqueIndex(byTarget.run(ballots), t -> t.key);

        List<PlayerVoting> players = new ArrayList<>();
        names.forEach((key, name) -> players.add(toPlayer(key, name,
            seated.getOrDefault(key, new SeatTotals(key)),
            targeted.getOrDefault(key, new TargetTotals(key)))));
        players.sort(Comparator.comparingInt(PlayerVoting::meetings).reversed()
            .thenComparing(PlayerVoting::playerName));
        return new VotingStats(ImmutableList.copyOf(players));
    }

    public Optional<PlayerVoting> player(String nameOrKey) {
        return players.stream()
            .filter(p -> p.playerKey().equals(nameOrKey) || PlayerIdentity.sameName(p.playerName(), nameOrKey))
            .findFirst();
    }

    private static void collectMeetings(List<PlayerInGame> rows, List<Seat> seats, List<Ballot> ballots) {
        Map<String, PlayerInGame> byName = new HashMap<>();
        int lastMeeting = 0;
        for (PlayerInGame row : rows) {
            byName.putIfAbsent(PlayerIdentity.normalize(row.player().username()), row);
            for (VoteEvent v : row.player().votes()) {
                lastMeeting = Math.max(lastMeeting, v.day());
            }
        }

        for (int meeting = 1; meeting <= lastMeeting; meeting++) {
            Map<String, VoteEvent> cast = new LinkedHashMap<>();
            for (PlayerInGame row : rows) {
                for (VoteEvent v : row.player().votes()) {
                    if (v.day() == meeting) {
                        cast.put(row.key(), v);
                    }
                }
            }
            int m = meeting;
            List<String> order = votingOrder(cast);
            int earlyCount = (int) Math.ceil(order.size() * EARLY_SHARE);

            for (PlayerInGame row : rows) {
                VoteEvent v = cast.get(row.key());
                Optional<PlayerInGame> target = Optional.ofNullable(v)
                    .filter(vote -> !vote.isSkip())
                    .map(vote -> byName.get(PlayerIdentity.normalize(vote.target())));
                target.ifPresent(t -> ballots.add(new Ballot(row, t, m)));
                if (aliveAtMeeting(row.player(), m)) {
                    int position = order.indexOf(row.key());
                    seats.add(new Seat(row, Optional.ofNullable(v), target, position == 0,
                        position >= 0 && position < earlyCount));
                }
            }
        }
    }

    // Keys of the real, dated votes of one meeting, earliest first.
    private static List<String> votingOrder(Map<String, VoteEvent> cast) {
        List<Map.Entry<String, Instant>> dated = new ArrayList<>();
        cast.forEach((key, v) -> {
            if (!v.isSkip()) {
                Timestamps.parse(v.date()).ifPresent(at -> dated.add(Map.entry(key, at)));
            }
        });
        dated.sort(Map.Entry.comparingByValue());
        return dated.stream().map(Map.Entry::getKey).toList();
    }

    static boolean aliveAtMeeting(PlayerRecord p, int meeting) {
        Optional<TimingCode> death = TimingCode.parse(p.deathTiming());
        if (death.isEmpty()) {
            return true;
        }
        int number = death.get().number();
        return switch (death.get().phase()) {
            case MEETING -> meeting <= number;
            case DAY, NIGHT -> meeting < number;
            case UNKNOWN -> true;
        };
    }

    private static boolean votedOutAt(PlayerRecord p, int meeting) {
        return p.deathType() != null
            && VOTE_DEATHS.contains(p.deathType().trim().toLowerCase())
            && TimingCode.parse(p.deathTiming()).equals(Optional.of(TimingCode.meeting(meeting)));
    }

    private static boolean isEnemy(PlayerInGame voter, PlayerInGame target) {
        return voter.finalCamp().alliance() != target.finalCamp().alliance();
    }

    private static PlayerVoting toPlayer(String key, String name, SeatTotals s, TargetTotals t) {
        Rate voting = Rate.of(s.votes, s.meetings);
        Rate skipping = Rate.of(s.skips, s.meetings);
        Rate abstaining = Rate.of(s.abstentions, s.meetings);
        OptionalDouble aggressiveness = s.meetings == 0
            ? OptionalDouble.empty()
            : OptionalDouble.of(voting.percentOr(0) - 0.5 * skipping.percentOr(0) - 0.7 * abstaining.percentOr(0));
        return new PlayerVoting(key, name, s.meetings, s.votes, s.skips, s.abstentions, voting, skipping, abstaining,
            aggressiveness, s.enemy, s.own, Rate.of(s.enemy, s.enemy + s.own), s.first, s.early,
            Rate.of(s.early, s.votes), t.targeted, t.byEnemy, t.eliminations.size());
    }
}
