package com.cardwar.warservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * war-service 启动入口。
 * 对局服务本身无状态，对外通过 WarGameService 暴露。
 */
@SpringBootApplication
public class WarServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(WarServiceApplication.class, args);
    }
}
