package com.aiinpocket.ballcraft.model.dto;

import com.aiinpocket.ballcraft.model.entity.Ball;

/**
 * 配方對單一球種的總需求（同球種多筆材料已加總）。
 */
public record IngredientDemand(Ball ball, int quantity) {}
