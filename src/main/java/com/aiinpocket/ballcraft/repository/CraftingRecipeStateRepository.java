package com.aiinpocket.ballcraft.repository;

import com.aiinpocket.ballcraft.model.entity.CraftingRecipeState;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface CraftingRecipeStateRepository extends JpaRepository<CraftingRecipeState, Long> {

    Optional<CraftingRecipeState> findByPlayerIdAndRecipeId(Long playerId, Long recipeId);

    List<CraftingRecipeState> findByPlayerIdAndAutoEnabledTrue(Long playerId);
}
