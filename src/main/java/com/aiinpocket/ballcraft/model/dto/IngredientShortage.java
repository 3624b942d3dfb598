package com.aiinpocket.ballcraft.model.dto;

/**
 * 材料不足的明細。
 *
 * @param kind     球種名稱
 * @param required 配方需要的數量（同球種已加總）
 * @param owned    目前可用數量
 */
public record IngredientShortage(String kind, int required, long owned) {}
