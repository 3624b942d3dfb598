package com.aiinpocket.ballcraft.controller;

import com.aiinpocket.ballcraft.model.dto.AutoCraftSummary;
import com.aiinpocket.ballcraft.model.dto.CooldownStatus;
import com.aiinpocket.ballcraft.model.dto.CraftOutcome;
import com.aiinpocket.ballcraft.model.dto.RecipeView;
import com.aiinpocket.ballcraft.model.dto.SessionView;
import com.aiinpocket.ballcraft.model.entity.CraftingLog;
import com.aiinpocket.ballcraft.service.AutoCraftService;
import com.aiinpocket.ballcraft.service.CraftingService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 合成系統 REST API。
 * 提供配方列表、直接合成、工作階段暫存與合成、自動合成、冷卻與紀錄查詢。
 *
 * <p>球的編號在路徑上以十六進位表示，可帶或不帶 "#"（例如 {@code 1A} 或 {@code %231A}）。
 */
@RestController
@RequestMapping("/api/players/{playerId}/crafting")
@RequiredArgsConstructor
public class CraftingController {

    private final CraftingService craftingService;
    private final AutoCraftService autoCraftService;

    /** 啟用中的配方 */
    @GetMapping("/recipes")
    public ResponseEntity<List<RecipeView>> listRecipes(@PathVariable Long playerId) {
        return ResponseEntity.ok(craftingService.listRecipes());
    }

    /** 指定配方直接合成 */
    @PostMapping("/craft/{recipeName}")
    public ResponseEntity<CraftOutcome> craft(@PathVariable Long playerId, @PathVariable String recipeName) {
        CraftOutcome result = craftingService.craftDirect(playerId, recipeName);
        return result.success() ? ResponseEntity.ok(result) : ResponseEntity.badRequest().body(result);
    }

    // ===== 工作階段 =====

    @GetMapping("/session")
    public ResponseEntity<SessionView> viewSession(@PathVariable Long playerId) {
        return ResponseEntity.ok(craftingService.viewSession(playerId));
    }

    @PostMapping("/session/items/{instanceId}")
    public ResponseEntity<CraftOutcome> stageAdd(@PathVariable Long playerId, @PathVariable String instanceId) {
        CraftOutcome result = craftingService.stageAdd(playerId, parseInstanceId(instanceId));
        return result.success() ? ResponseEntity.ok(result) : ResponseEntity.badRequest().body(result);
    }

    @DeleteMapping("/session/items/{instanceId}")
    public ResponseEntity<CraftOutcome> stageRemove(@PathVariable Long playerId, @PathVariable String instanceId) {
        CraftOutcome result = craftingService.stageRemove(playerId, parseInstanceId(instanceId));
        return result.success() ? ResponseEntity.ok(result) : ResponseEntity.badRequest().body(result);
    }

    @DeleteMapping("/session")
    public ResponseEntity<CraftOutcome> stageClear(@PathVariable Long playerId) {
        CraftOutcome result = craftingService.stageClear(playerId);
        return result.success() ? ResponseEntity.ok(result) : ResponseEntity.badRequest().body(result);
    }

    /** 以暫存的球合成 */
    @PostMapping("/session/craft")
    public ResponseEntity<CraftOutcome> stageCraft(@PathVariable Long playerId) {
        CraftOutcome result = craftingService.stageCraft(playerId);
        return result.success() ? ResponseEntity.ok(result) : ResponseEntity.badRequest().body(result);
    }

    // ===== 自動合成 =====

    /**
     * 開始自動合成。迴圈在背景執行，這裡不等待結束；
     * 迴圈已立即結束（例如配方不存在）時直接回傳摘要。
     */
    @PostMapping("/auto")
    public ResponseEntity<?> startAuto(@PathVariable Long playerId, @RequestBody AutoCraftRequest body) {
        CompletableFuture<AutoCraftSummary> future =
                autoCraftService.setAutoCraft(playerId, body.recipeName(), body.loopBound());
        if (future.isDone() && !future.isCompletedExceptionally()) {
            return ResponseEntity.ok(future.join());
        }
        return ResponseEntity.accepted().body(Map.of(
                "running", autoCraftService.isRunning(playerId),
                "recipeName", String.valueOf(body.recipeName())));
    }

    @GetMapping("/auto")
    public ResponseEntity<Map<String, Boolean>> autoStatus(@PathVariable Long playerId) {
        return ResponseEntity.ok(Map.of("running", autoCraftService.isRunning(playerId)));
    }

    @DeleteMapping("/auto")
    public ResponseEntity<?> stopAuto(@PathVariable Long playerId) {
        CompletableFuture<AutoCraftSummary> future = autoCraftService.stop(playerId);
        if (future.isDone() && !future.isCompletedExceptionally()) {
            return ResponseEntity.ok(future.join());
        }
        return ResponseEntity.accepted().body(Map.of("message", "已要求停止自動合成"));
    }

    // ===== 查詢 =====

    @GetMapping("/cooldown/{recipeName}")
    public ResponseEntity<CooldownStatus> cooldown(@PathVariable Long playerId, @PathVariable String recipeName) {
        return ResponseEntity.ok(craftingService.checkCooldown(playerId, recipeName));
    }

    /** 最近 20 筆合成紀錄 */
    @GetMapping("/logs")
    public ResponseEntity<List<CraftingLogDto>> logs(@PathVariable Long playerId) {
        return ResponseEntity.ok(craftingService.recentLogs(playerId).stream().map(this::toDto).toList());
    }

    /**
     * 解析十六進位的球編號（可帶 "#"）。格式錯誤丟出 NumberFormatException。
     */
    static Long parseInstanceId(String raw) {
        String hex = raw.trim();
        if (hex.startsWith("#")) {
            hex = hex.substring(1);
        }
        return Long.parseLong(hex, 16);
    }

    // ===== DTO =====

    private CraftingLogDto toDto(CraftingLog entry) {
        return new CraftingLogDto(
                entry.getId(),
                entry.getRecipeName(),
                entry.getMode().name(),
                entry.isSuccess(),
                entry.getMessage(),
                entry.getCreatedAt().toString()
        );
    }

    record AutoCraftRequest(String recipeName, Integer loopBound) {}

    record CraftingLogDto(Long id, String recipeName, String mode, boolean success,
                          String message, String createdAt) {}
}
