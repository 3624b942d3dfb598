package com.aiinpocket.ballcraft.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 時間來源。冷卻、工作階段到期與合成時間戳都從這個 Clock 取得。
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock craftingClock() {
        return Clock.systemUTC();
    }
}
