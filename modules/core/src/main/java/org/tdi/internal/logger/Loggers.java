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

import java.util.Objects;

/**
 * This class contains different static factory methods to create an instance of logger.
 */
public final class Loggers {
    private Loggers() {
    }

    /**
     * Creates logger for given class with system logger as a backend.
     *
     * @param cls The class for a logger.
     * @return TDI logger.
     */
    public static TdiLogger forClass(Class<?> cls) {
        return forName(Objects.requireNonNull(cls, "cls").getName());
    }

    /**
     * Creates logger with the given name and system logger as a backend.
     *
     * @param name The name for a logger.
     * @return TDI logger.
     */
    public static TdiLogger forName(String name) {
        var delegate = System.getLogger(name);

        return new TdiLoggerImpl(delegate);
    }

    /**
     * Creates logger on top of the given system logger. Useful in tests that need to observe logged records.
     *
     * @param delegate System logger to delegate to.
     * @return TDI logger.
     */
    public static TdiLogger forSystemLogger(System.Logger delegate) {
        return new TdiLoggerImpl(Objects.requireNonNull(delegate, "delegate"));
    }
}
