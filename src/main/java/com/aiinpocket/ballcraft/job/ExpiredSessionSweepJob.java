package com.aiinpocket.ballcraft.job;

import com.aiinpocket.ballcraft.service.CraftingSessionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.quartz.JobExecutionContext;
import org.springframework.scheduling.quartz.QuartzJobBean;
import org.springframework.stereotype.Component;

/**
 * 過期合成工作階段清理任務（預設每 5 分鐘）。
 * 工作階段是否過期以存取當下判斷為準，此任務只回收沒人再存取的殘留資料列。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ExpiredSessionSweepJob extends QuartzJobBean {

    private final CraftingSessionService sessionService;

    @Override
    protected void executeInternal(JobExecutionContext context) {
        try {
            int purged = sessionService.purgeExpired();
            if (purged > 0) {
                log.info("[合成工作階段] 已清理 {} 個過期的工作階段", purged);
            }
        } catch (Exception e) {
            log.error("[合成工作階段] 清理過期工作階段失敗", e);
        }
    }
}
