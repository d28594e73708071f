/*
 * Copyright Lealone Database Group.
 * Licensed under the Server Side Public License, v 1.
 * Initial Developer: zhh
 */
package com.walpool.common.logging.impl;

import com.walpool.common.logging.LoggerFactory;

public class ConsoleLoggerFactory extends LoggerFactory {

    public static final String CONSOLE_LOGGER_LEVEL = "walpool.logger.console.level";

    private final ConsoleLogger.Level level;

    public ConsoleLoggerFactory() {
        String name = System.getProperty(CONSOLE_LOGGER_LEVEL, ConsoleLogger.Level.INFO.name());
        level = ConsoleLogger.Level.valueOf(name.trim().toUpperCase());
    }

    @Override
    public ConsoleLogger createLogger(String name) {
        return new ConsoleLogger(name, level);
    }
}
