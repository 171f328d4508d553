/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements. See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License. You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package org.tdi.internal.logger;

import java.lang.System.Logger.Level;
import org.tdi.internal.lang.TdiStringFormatter;

class TdiLoggerImpl implements TdiLogger {
    private final System.Logger delegate;

    TdiLoggerImpl(System.Logger delegate) {
        this.delegate = delegate;
    }

    @Override
    public void info(String msg, Object... params) {
        log(Level.INFO, msg, params);
    }

    @Override
    public void debug(String msg, Object... params) {
        log(Level.DEBUG, msg, params);
    }

    @Override
    public void trace(String msg, Object... params) {
        log(Level.TRACE, msg, params);
    }

    @Override
    public boolean isTraceEnabled() {
        return delegate.isLoggable(Level.TRACE);
    }

    private void log(Level level, String msg, Object... params) {
        if (delegate.isLoggable(level)) {
            delegate.log(level, TdiStringFormatter.format(msg, params));
        }
    }
}
