package com.aiinpocket.ballcraft;

import com.aiinpocket.ballcraft.config.CraftingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(CraftingProperties.class)
public class BallCraftApplication {

    public static void main(String[] args) {
        SpringApplication.run(BallCraftApplication.class, args);
    }

}
