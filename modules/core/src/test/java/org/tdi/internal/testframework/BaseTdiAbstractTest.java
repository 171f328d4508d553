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

package org.tdi.internal.testframework;

import static org.tdi.internal.lang.TdiSystemProperties.TDI_SENSITIVE_DATA_LOGGING;
import static org.tdi.internal.lang.TdiSystemProperties.getEnum;

import java.lang.reflect.Method;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.mockito.Mockito;
import org.tdi.internal.logger.Loggers;
import org.tdi.internal.logger.TdiLogger;
import org.tdi.internal.tostring.S;
import org.tdi.internal.tostring.SensitiveDataLoggingPolicy;

/**
 * TDI base test class.
 */
public abstract class BaseTdiAbstractTest {
    /** Logger. */
    protected final TdiLogger log = Loggers.forClass(getClass());

    /** Test start time in nanoseconds. */
    private long testStartNanos;

    @BeforeAll
    static void setLoggingPolicy() {
        S.setSensitiveDataLoggingPolicySupplier(() -> getEnum(TDI_SENSITIVE_DATA_LOGGING, SensitiveDataLoggingPolicy.PLAIN));
    }

    @AfterAll
    static void resetLoggingPolicy() {
        S.setSensitiveDataLoggingPolicySupplier(null);
    }

    /**
     * Prevents accidental leaks from Mockito.
     */
    @AfterAll
    static void clearInlineMocks() {
        Mockito.framework().clearInlineMocks();
    }

    @BeforeEach
    void printStartMessage(TestInfo testInfo) {
        log.info(">>> Starting test: {}#{}, displayName: {}",
                testInfo.getTestClass().map(Class::getSimpleName).orElse("<null>"),
                testInfo.getTestMethod().map(Method::getName).orElse("<null>"),
                testInfo.getDisplayName()
        );

        this.testStartNanos = System.nanoTime();
    }

    @AfterEach
    void printStopMessage(TestInfo testInfo) {
        log.info(">>> Stopping test: {}#{}, displayName: {}, cost: {}ms.",
                testInfo.getTestClass().map(Class::getSimpleName).orElse("<null>"),
                testInfo.getTestMethod().map(Method::getName).orElse("<null>"),
                testInfo.getDisplayName(),
                (System.nanoTime() - testStartNanos) / 1_000_000
        );
    }
}
