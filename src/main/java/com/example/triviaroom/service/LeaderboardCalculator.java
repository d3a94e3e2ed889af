package com.example.triviaroom.service;

import com.example.triviaroom.model.LeaderboardEntry;
import com.example.triviaroom.model.Player;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Ranks players: score desc, correctAnswers desc, joinedAt asc, userId asc.
 * The userId step makes the order total, so repeated ranking of unchanged input is stable.
 */
@Component
public class LeaderboardCalculator {

    static final Comparator<Player> ORDER = Comparator
            .comparingInt(Player::getScore).reversed()
            .thenComparing(Comparator.comparingInt(Player::getCorrectAnswers).reversed())
            .thenComparing(Player::getJoinedAt)
            .thenComparing(Player::getUserId);

    public List<LeaderboardEntry> rank(Collection<Player> players) {
        List<Player> sorted = new ArrayList<>(players);
        sorted.sort(ORDER);

        List<LeaderboardEntry> out = new ArrayList<>(sorted.size());
        int rank = 1;
        for (Player p : sorted) {
            out.add(new LeaderboardEntry(rank++, p.getUserId(), p.getDisplayName(),
                    p.getScore(), p.getCorrectAnswers(), p.getStatus()));
        }
        return out;
    }

    public Optional<Player> winner(Collection<Player> players) {
        return players.stream().min(ORDER);
    }
}
