/*
 * Copyright 2026 The Bytesearch Project
 *
 * The Bytesearch Project licenses this file to you under the Apache License,
 * version 2.0 (the "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at:
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */
package io.bytesearch.util.internal.logging;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class Slf4JLoggerTest {
    private static final Exception e = new Exception();

    private Logger mockLogger;
    private InternalLogger logger;

    @BeforeEach
    public void setUp() {
        mockLogger = mock(Logger.class);
        when(mockLogger.getName()).thenReturn("foo");
        logger = new Slf4JLogger(mockLogger);
    }

    @Test
    public void testName() {
        assertEquals("foo", logger.name());
        assertEquals("Slf4JLogger(foo)", logger.toString());
    }

    @Test
    public void testRejectsNullLogger() {
        assertThrows(NullPointerException.class, () -> new Slf4JLogger(null));
    }

    @Test
    public void testIsEnabled() {
        when(mockLogger.isTraceEnabled()).thenReturn(false);
        when(mockLogger.isDebugEnabled()).thenReturn(true);
        when(mockLogger.isWarnEnabled()).thenReturn(true);

        assertFalse(logger.isEnabled(InternalLogLevel.TRACE));
        assertTrue(logger.isEnabled(InternalLogLevel.DEBUG));
        assertTrue(logger.isEnabled(InternalLogLevel.WARN));

        verify(mockLogger).isTraceEnabled();
        verify(mockLogger).isDebugEnabled();
        verify(mockLogger).isWarnEnabled();
    }

    @Test
    public void testTrace() {
        logger.trace("a {}", "b");
        verify(mockLogger).trace("a {}", new Object[] { "b" });
    }

    @Test
    public void testDebug() {
        logger.debug("a");
        logger.debug("a {}", 1);
        logger.debug("a {} {}", 1, 2);
        logger.debug("a {} {} {}", 1, 2, 3);

        verify(mockLogger).debug("a");
        verify(mockLogger).debug("a {}", (Object) 1);
        verify(mockLogger).debug("a {} {}", 1, 2);
        verify(mockLogger).debug("a {} {} {}", 1, 2, 3);
    }

    @Test
    public void testInfoWithException() {
        logger.info("a", e);
        verify(mockLogger).info("a", e);
    }

    @Test
    public void testWarn() {
        logger.warn("a {} {}", "b", e);
        logger.warn("a", e);

        verify(mockLogger).warn("a {} {}", "b", e);
        verify(mockLogger).warn("a", e);
    }

    @Test
    public void testError() {
        logger.error("a");
        logger.error("a", e);

        verify(mockLogger).error("a");
        verify(mockLogger).error("a", e);
    }

    @Test
    public void testLogDispatchesByLevel() {
        logger.log(InternalLogLevel.INFO, "a");
        logger.log(InternalLogLevel.WARN, "a {}", 1, 2);
        logger.log(InternalLogLevel.ERROR, "a", e);

        verify(mockLogger).info("a");
        verify(mockLogger).warn("a {}", new Object[] { 1, 2 });
        verify(mockLogger).error("a", e);
    }
}
