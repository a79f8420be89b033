package edu.brandeis.cosi103a.lycans.stats;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import edu.brandeis.cosi103a.lycans.model.GameRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Popularity and win rate of the cosmetic colors players pick.
 */
public record ColorStats(
    @JsonProperty("totalGames") int totalGames,
    @JsonProperty("colors") List<ColorStat> colors
) {

    /**
     * @param averageUsesPerGame instances of this color divided by every game in the input,
     *                           whether the color appeared in it or not
     */
    public record ColorStat(
        @JsonProperty("color") String color,
        @JsonProperty("appearances") int appearances,
        @JsonProperty("wins") int wins,
        @JsonProperty("winRate") Rate winRate,
        @JsonProperty("averageUsesPerGame") double averageUsesPerGame
    ) {}

    public static ColorStats compute(List<GameRecord> games) {
        int totalGames = games.size();
        Aggregation<PlayerInGame, String, int[], ColorStat> byColor = Aggregation.of(
            row -> {
                String color = row.player().color();
                return color == null || color.isBlank() ? null : color.trim();
            },
            color -> new int[2],
            (acc, row) -> {
                acc[0]++;
                if (row.won()) {
                    acc[1]++;
                }
            },
            (color, acc) -> new ColorStat(color, acc[0], acc[1], Rate.of(acc[1], acc[0]),
                totalGames == 0 ? 0 : (double) acc[0] / totalGames));

        List<ColorStat> colors = new ArrayList<>(byColor.run(PlayerInGame.flatten(games)));
        colors.sort(Comparator.comparingInt(ColorStat::appearances).reversed()
            .thenComparing(ColorStat::color));
        return new ColorStats(totalGames, ImmutableList.copyOf(colors));
    }

    public Optional<ColorStat> color(String name) {
        return colors.stream().filter(c -> c.color().equalsIgnoreCase(name)).findFirst();
    }
}
