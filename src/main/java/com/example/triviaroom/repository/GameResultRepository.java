package com.example.triviaroom.repository;

import com.example.triviaroom.model.GameResult;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface GameResultRepository extends JpaRepository<GameResult, Long> {

    List<GameResult> findByRoomIdOrderByFinalRankAsc(String roomId);

    List<GameResult> findTop20ByUserIdOrderByFinishedAtDesc(String userId);

    boolean existsByRoomId(String roomId);
}
