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

/**
 * An <em>internal use only</em> logger used by bytesearch.
 * <strong>DO NOT</strong> use this class outside of bytesearch!
 * <p>
 * Messages may carry {@code {}} placeholders which are substituted with the given arguments, the same way
 * <a href="https://www.slf4j.org/">SLF4J</a> formats its messages. A trailing {@link Throwable} argument is
 * logged as the cause.
 */
public interface InternalLogger {

    /**
     * Returns the name of this logger.
     */
    String name();

    /**
     * Is this logger instance enabled for the TRACE level?
     */
    boolean isTraceEnabled();

    /**
     * Log a message at the TRACE level according to the specified format and arguments.
     */
    void trace(String format, Object... arguments);

    /**
     * Is this logger instance enabled for the DEBUG level?
     */
    boolean isDebugEnabled();

    /**
     * Log a message at the DEBUG level.
     */
    void debug(String msg);

    /**
     * Log a message at the DEBUG level according to the specified format and argument.
     */
    void debug(String format, Object arg);

    /**
     * Log a message at the DEBUG level according to the specified format and arguments.
     */
    void debug(String format, Object argA, Object argB);

    /**
     * Log a message at the DEBUG level according to the specified format and arguments.
     */
    void debug(String format, Object... arguments);

    /**
     * Log an exception (throwable) at the DEBUG level with an accompanying message.
     */
    void debug(String msg, Throwable t);

    /**
     * Is this logger instance enabled for the INFO level?
     */
    boolean isInfoEnabled();

    void info(String msg);

    void info(String format, Object arg);

    void info(String format, Object argA, Object argB);

    void info(String format, Object... arguments);

    void info(String msg, Throwable t);

    /**
     * Is this logger instance enabled for the WARN level?
     */
    boolean isWarnEnabled();

    void warn(String msg);

    void warn(String format, Object arg);

    void warn(String format, Object argA, Object argB);

    void warn(String format, Object... arguments);

    void warn(String msg, Throwable t);

    /**
     * Is this logger instance enabled for the ERROR level?
     */
    boolean isErrorEnabled();

    void error(String msg);

    void error(String format, Object arg);

    void error(String format, Object argA, Object argB);

    void error(String format, Object... arguments);

    void error(String msg, Throwable t);

    /**
     * Is the logger instance enabled for the specified {@code level}?
     *
     * @return True if this Logger is enabled for the specified {@code level}, false otherwise.
     */
    boolean isEnabled(InternalLogLevel level);

    /**
     * Log a message at the specified {@code level}.
     */
    void log(InternalLogLevel level, String msg);

    /**
     * Log a message at the specified {@code level} according to the specified format and arguments.
     */
    void log(InternalLogLevel level, String format, Object... arguments);

    /**
     * Log an exception (throwable) at the specified {@code level} with an accompanying message.
     */
    void log(InternalLogLevel level, String msg, Throwable t);
}
