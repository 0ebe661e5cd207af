/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class ConductoApplication {
    public static void main(String[] args) {
        SpringApplication.run(ConductoApplication.class, args);
    }
}
