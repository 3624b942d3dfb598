package com.aiinpocket.ballcraft.service.catalog;

import com.aiinpocket.ballcraft.model.entity.CraftingRecipe;
import com.aiinpocket.ballcraft.repository.CraftingRecipeRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class JpaRecipeCatalog implements RecipeCatalog {

    private final CraftingRecipeRepository recipeRepo;

    @Override
    @Transactional(readOnly = true)
    public List<CraftingRecipe> listEnabledRecipes() {
        return recipeRepo.findByEnabledTrueOrderByNameAsc();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<CraftingRecipe> getRecipeByName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return recipeRepo.findByNameIgnoreCase(name.trim());
    }
}
