package com.aiinpocket.ballcraft.service;

import com.aiinpocket.ballcraft.model.dto.IngredientDemand;
import com.aiinpocket.ballcraft.model.entity.CraftingIngredient;
import com.aiinpocket.ballcraft.model.entity.CraftingRecipe;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 配方比對。
 * 給定各球種的持有數量，判斷哪些配方可以合成。純計算、無副作用、無隨機性：
 * 相同的輸入永遠得到相同的結果與順序。
 */
@Component
public class RecipeMatcher {

    /**
     * 將配方材料依球種加總（同一球種出現多筆時合併），保留首次出現的順序。
     */
    public List<IngredientDemand> demandsOf(CraftingRecipe recipe) {
        Map<Long, IngredientDemand> merged = new LinkedHashMap<>();
        for (CraftingIngredient ingredient : recipe.getIngredients()) {
            merged.merge(ingredient.getBall().getId(),
                    new IngredientDemand(ingredient.getBall(), ingredient.getQuantity()),
                    (a, b) -> new IngredientDemand(a.ball(), a.quantity() + b.quantity()));
        }
        return new ArrayList<>(merged.values());
    }

    /**
     * 判斷單一配方是否可由持有數量滿足。
     *
     * @param ownedCounts 球種 ID → 持有數量
     */
    public boolean isSatisfiable(CraftingRecipe recipe, Map<Long, ? extends Number> ownedCounts) {
        for (IngredientDemand demand : demandsOf(recipe)) {
            Number owned = ownedCounts.get(demand.ball().getId());
            long count = owned != null ? owned.longValue() : 0L;
            if (count < demand.quantity()) {
                return false;
            }
        }
        return true;
    }

    /**
     * 列出所有可合成的配方，維持目錄順序。停用的配方一律略過。
     */
    public List<CraftingRecipe> findCraftable(Map<Long, ? extends Number> ownedCounts,
                                              List<CraftingRecipe> recipes) {
        return recipes.stream()
                .filter(CraftingRecipe::isEnabled)
                .filter(r -> isSatisfiable(r, ownedCounts))
                .toList();
    }

    /**
     * 自動挑選配方：目錄順序中第一個啟用且可完全滿足的配方。
     */
    public Optional<CraftingRecipe> firstCraftable(Map<Long, ? extends Number> ownedCounts,
                                                   List<CraftingRecipe> recipes) {
        return recipes.stream()
                .filter(CraftingRecipe::isEnabled)
                .filter(r -> isSatisfiable(r, ownedCounts))
                .findFirst();
    }
}
