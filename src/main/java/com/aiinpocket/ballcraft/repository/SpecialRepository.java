package com.aiinpocket.ballcraft.repository;

import com.aiinpocket.ballcraft.model.entity.Special;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SpecialRepository extends JpaRepository<Special, Long> {
}
