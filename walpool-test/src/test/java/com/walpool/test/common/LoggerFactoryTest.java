/*
 * Copyright Lealone Database Group.
 * Licensed under the Server Side Public License, v 1.
 * Initial Developer: zhh
 */
package com.walpool.test.common;

import org.junit.Test;

import com.walpool.common.logging.Logger;
import com.walpool.common.logging.LoggerFactory;
import com.walpool.common.logging.impl.Log4j2LoggerFactory;
import com.walpool.test.TestBase;

public class LoggerFactoryTest extends TestBase {
    @Test
    public void run() {
        // log4j-core在classpath中
        assertEquals(Log4j2LoggerFactory.class.getName(), LoggerFactory.getLoggerFactoryName());

        Logger logger = LoggerFactory.getLogger(LoggerFactoryTest.class);
        assertSame(logger, LoggerFactory.getLogger(LoggerFactoryTest.class.getCanonicalName()));
        assertTrue(logger.isWarnEnabled());
        logger.info("Logger {} works", logger.getClass().getSimpleName());
    }
}
