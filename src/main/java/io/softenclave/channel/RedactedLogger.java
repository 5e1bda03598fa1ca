/*
 * Copyright 2022 Neil Madden.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 *
 */

package io.softenclave.channel;

import java.security.Key;
import java.util.Arrays;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A thin wrapper around an slf4j {@link Logger} that redacts byte arrays and keys passed as log arguments, so that
 * nonces, public keys and session secrets never end up in log files in full. Only the handful of logging methods the
 * channel actually needs are exposed.
 */
public final class RedactedLogger {
    private final Logger delegate;

    private RedactedLogger(Logger delegate) {
        this.delegate = Objects.requireNonNull(delegate);
    }

    public static RedactedLogger getLogger(Class<?> forClass) {
        return new RedactedLogger(LoggerFactory.getLogger(forClass));
    }

    public boolean isTraceEnabled() {
        return delegate.isTraceEnabled();
    }

    public void trace(String format, Object... args) {
        if (isTraceEnabled()) {
            delegate.trace(format, redactAll(args));
        }
    }

    public boolean isDebugEnabled() {
        return delegate.isDebugEnabled();
    }

    public void debug(String format, Object... args) {
        if (isDebugEnabled()) {
            delegate.debug(format, redactAll(args));
        }
    }

    public void info(String format, Object... args) {
        if (delegate.isInfoEnabled()) {
            delegate.info(format, redactAll(args));
        }
    }

    public void warn(String format, Object... args) {
        if (delegate.isWarnEnabled()) {
            delegate.warn(format, redactAll(args));
        }
    }

    public void error(String format, Object... args) {
        if (delegate.isErrorEnabled()) {
            delegate.error(format, redactAll(args));
        }
    }

    static Object redact(Object arg) {
        if (arg instanceof byte[] bytes) {
            return maskForLog(bytes);
        } else if (arg instanceof Key key) {
            return key instanceof DestroyableSecretKey dsk && dsk.isDestroyed()
                    ? "<destroyed>" : maskForLog(key.getEncoded());
        } else {
            return arg;
        }
    }

    // Throwables pass through untouched so that slf4j still treats a trailing exception as the cause
    private static Object[] redactAll(Object[] args) {
        return Arrays.stream(args).map(RedactedLogger::redact).toArray();
    }

    static String maskForLog(byte[] secret) {
        return secret == null
                ? "null"
                : secret.length < 16
                ? "<redacted>"
                : Utils.hex(Arrays.copyOf(secret, 3)) + "..." +
                Utils.hex(Arrays.copyOfRange(secret, secret.length - 3, secret.length));
    }
}
