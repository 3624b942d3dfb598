package com.aiinpocket.ballcraft.service;

import com.aiinpocket.ballcraft.model.entity.CraftingProfile;
import com.aiinpocket.ballcraft.model.entity.CraftingRecipeState;
import com.aiinpocket.ballcraft.repository.CraftingProfileRepository;
import com.aiinpocket.ballcraft.repository.CraftingRecipeRepository;
import com.aiinpocket.ballcraft.repository.CraftingRecipeStateRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * 冷卻狀態列的延遲建立。
 * 在獨立交易（REQUIRES_NEW）中插入，讓外層合成交易可以立即對剛建立的列加鎖。
 * 並行建立時第二個插入會違反唯一鍵，由呼叫端忽略後重新讀取。
 */
@Service
@RequiredArgsConstructor
public class CraftingStateRegistry {

    private final CraftingProfileRepository profileRepo;
    private final CraftingRecipeStateRepository stateRepo;
    private final CraftingRecipeRepository recipeRepo;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void createProfileIfAbsent(Long playerId) {
        if (profileRepo.findByPlayerId(playerId).isPresent()) {
            return;
        }
        profileRepo.saveAndFlush(CraftingProfile.builder().playerId(playerId).build());
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void createRecipeStateIfAbsent(Long playerId, Long recipeId) {
        if (stateRepo.findByPlayerIdAndRecipeId(playerId, recipeId).isPresent()) {
            return;
        }
        stateRepo.saveAndFlush(CraftingRecipeState.builder()
                .playerId(playerId)
                .recipe(recipeRepo.getReferenceById(recipeId))
                .build());
    }
}
