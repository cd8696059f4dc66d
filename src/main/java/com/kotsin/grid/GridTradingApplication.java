package com.kotsin.grid;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main Spring Boot application for the hedge grid execution module.
 *
 * Keeps long and short grids resting around the live price of one perpetual
 * futures instrument and flattens everything when the market runs away in one
 * direction.
 */
@SpringBootApplication
public class GridTradingApplication {

    public static void main(String[] args) {
        SpringApplication.run(GridTradingApplication.class, args);
    }
}
