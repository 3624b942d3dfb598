package com.aiinpocket.ballcraft.config;

import com.aiinpocket.ballcraft.job.ExpiredSessionSweepJob;
import org.quartz.*;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class QuartzConfig {

    // 過期工作階段清理：到期判斷本身在存取時進行，這裡只是定期回收殘留資料列
    @Bean
    public JobDetail expiredSessionSweepJobDetail() {
        return JobBuilder.newJob(ExpiredSessionSweepJob.class)
                .withIdentity("expiredSessionSweepJob", "crafting")
                .storeDurably()
                .build();
    }

    @Bean
    public Trigger expiredSessionSweepTrigger(JobDetail expiredSessionSweepJobDetail,
                                              CraftingProperties properties) {
        return TriggerBuilder.newTrigger()
                .forJob(expiredSessionSweepJobDetail)
                .withIdentity("expiredSessionSweepTrigger", "crafting")
                .withSchedule(CronScheduleBuilder.cronSchedule(properties.sessionSweepCron()))
                .build();
    }
}
