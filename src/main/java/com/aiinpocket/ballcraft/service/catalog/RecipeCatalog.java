package com.aiinpocket.ballcraft.service.catalog;

import com.aiinpocket.ballcraft.model.entity.CraftingRecipe;

import java.util.List;
import java.util.Optional;

/**
 * 配方目錄（唯讀）。
 * 配方的新增與編輯由管理介面負責，合成核心只透過此介面讀取。
 *
 * <p>回傳的配方必須已載入材料、材料球種與產物，呼叫端可在交易外讀取。
 */
public interface RecipeCatalog {

    /**
     * 列出所有啟用中的配方。
     * 順序固定（依名稱），自動挑選配方時「第一個可合成的配方」依此順序決定。
     */
    List<CraftingRecipe> listEnabledRecipes();

    /**
     * 依名稱查詢配方（不分大小寫）。停用的配方也會回傳，由呼叫端判斷。
     */
    Optional<CraftingRecipe> getRecipeByName(String name);
}
