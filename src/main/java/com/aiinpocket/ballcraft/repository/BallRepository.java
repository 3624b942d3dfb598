package com.aiinpocket.ballcraft.repository;

import com.aiinpocket.ballcraft.model.entity.Ball;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface BallRepository extends JpaRepository<Ball, Long> {

    Optional<Ball> findByNameIgnoreCase(String name);
}
