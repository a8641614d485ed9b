package com.ninesync;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * NineSync IMAP client
 *
 * - Netty-based IMAP client engine (pipelined, tag-correlated commands)
 * - Flag/mark synchronisation into MyBatis + SQLite
 * - Header-rule mail splitting
 * - Reactor keepalive sweep
 * - Prometheus metrics monitoring
 */
@SpringBootApplication
@EnableConfigurationProperties
@MapperScan("com.ninesync.mapper")
public class NineSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(NineSyncApplication.class, args);
    }
}
