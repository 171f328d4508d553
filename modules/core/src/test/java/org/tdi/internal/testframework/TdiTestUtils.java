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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

import org.jetbrains.annotations.Nullable;
import org.junit.jupiter.api.function.Executable;
import org.tdi.lang.TdiException;

/**
 * Utility methods for tests.
 */
public final class TdiTestUtils {
    private TdiTestUtils() {
    }

    /**
     * Checks whether runnable throws the correct {@link TdiException}, which is itself of a specified class.
     *
     * @param expectedClass Expected exception class.
     * @param expectedErrorCode Expected error code of the {@link TdiException}.
     * @param run Runnable to check.
     * @param errorMessageFragment Fragment of the error text in the expected exception, {@code null} if not to be checked.
     * @return Thrown throwable.
     */
    public static <T extends TdiException> T assertThrowsWithCode(
            Class<T> expectedClass,
            int expectedErrorCode,
            Executable run,
            @Nullable String errorMessageFragment
    ) {
        try {
            run.execute();
        } catch (Throwable throwable) {
            try {
                assertInstanceOf(expectedClass, throwable);
            } catch (AssertionError err) {
                // An AssertionError from assertInstanceOf has nothing but a class name of the original exception.
                AssertionError assertionError = new AssertionError(err);

                assertionError.addSuppressed(throwable);

                throw assertionError;
            }

            T tdiException = expectedClass.cast(throwable);
            assertEquals(expectedErrorCode, tdiException.code(), "Invalid error code: " + tdiException.codeAsString());

            if (errorMessageFragment != null) {
                assertThat(throwable.getMessage(), containsString(errorMessageFragment));
            }

            return tdiException;
        }

        throw new AssertionError("Exception has not been thrown.");
    }

    /**
     * Same as {@link #assertThrowsWithCode(Class, int, Executable, String)} without a message check.
     *
     * @param expectedClass Expected exception class.
     * @param expectedErrorCode Expected error code of the {@link TdiException}.
     * @param run Runnable to check.
     * @return Thrown throwable.
     */
    public static <T extends TdiException> T assertThrowsWithCode(Class<T> expectedClass, int expectedErrorCode, Executable run) {
        return assertThrowsWithCode(expectedClass, expectedErrorCode, run, null);
    }
}
