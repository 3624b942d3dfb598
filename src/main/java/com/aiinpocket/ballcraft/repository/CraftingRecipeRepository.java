package com.aiinpocket.ballcraft.repository;

import com.aiinpocket.ballcraft.model.entity.CraftingRecipe;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface CraftingRecipeRepository extends JpaRepository<CraftingRecipe, Long> {

    /** 啟用中的配方，依名稱排序（eager fetch 材料與產物，避免 open-in-view=false 時 LazyInit） */
    @EntityGraph(attributePaths = {"ingredients", "ingredients.ball", "resultBall", "resultSpecial"})
    List<CraftingRecipe> findByEnabledTrueOrderByNameAsc();

    @EntityGraph(attributePaths = {"ingredients", "ingredients.ball", "resultBall", "resultSpecial"})
    Optional<CraftingRecipe> findByNameIgnoreCase(String name);
}
