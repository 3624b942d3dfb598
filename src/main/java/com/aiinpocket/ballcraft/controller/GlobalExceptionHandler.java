package com.aiinpocket.ballcraft.controller;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * 全域 REST API 異常處理器。
 * 預期內的合成失敗已由服務層轉成結果物件；這裡只處理邊界的格式錯誤與未預期的系統錯誤。
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(NumberFormatException.class)
    public ResponseEntity<Map<String, String>> handleNumberFormat(NumberFormatException e) {
        return ResponseEntity.badRequest().body(Map.of("error", "球的編號格式不正確，請使用十六進位（例如 #1A2B）"));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleIllegalArgument(IllegalArgumentException e) {
        String msg = sanitizeMessage(e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", msg));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest().body(Map.of("error", "請求格式不正確，請檢查欄位型別"));
    }

    @ExceptionHandler(TaskRejectedException.class)
    public ResponseEntity<Map<String, String>> handleRejected(TaskRejectedException e) {
        log.warn("[自動合成] 執行緒池已滿: {}", e.getMessage());
        return ResponseEntity.status(429).body(Map.of("error", "自動合成人數已滿，請稍後再試"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleGeneral(Exception e) {
        log.error("[GlobalExceptionHandler] 未預期的錯誤", e);
        return ResponseEntity.internalServerError()
                .body(Map.of("error", "系統發生錯誤，請稍後重試"));
    }

    /** 過濾可能含有敏感資訊的錯誤訊息 */
    static String sanitizeMessage(String msg) {
        if (msg == null || msg.length() > 200) return "操作失敗，請稍後重試";
        String lower = msg.toLowerCase();
        if (lower.contains("sql") || lower.contains("exception") || lower.contains("constraint")
                || lower.contains("connection") || lower.contains("timeout")) {
            return "操作失敗，請稍後重試";
        }
        return msg;
    }
}
