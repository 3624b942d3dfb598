package com.aiinpocket.ballcraft.model.enums;

public enum AutoCraftStopReason {
    BOUND_REACHED,
    FAILED,
    CANCELLED
}
