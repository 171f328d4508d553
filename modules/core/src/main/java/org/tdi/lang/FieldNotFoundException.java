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

package org.tdi.lang;

import static org.tdi.lang.ErrorGroups.TableData.UNKNOWN_FIELD_ERR;

/**
 * Exception is thrown when the indicated field is not found in a table data schema.
 */
public class FieldNotFoundException extends TableDataException {
    /** Serial version UID. */
    private static final long serialVersionUID = 0L;

    /**
     * Creates an exception with a given field id.
     *
     * @param schemaName Name of the schema.
     * @param fieldId Field id.
     */
    public FieldNotFoundException(String schemaName, int fieldId) {
        super(UNKNOWN_FIELD_ERR, "Field does not exist [schema=" + schemaName + ", fieldId=" + fieldId + ']');
    }

    /**
     * Creates an exception with a given field name.
     *
     * @param schemaName Name of the schema.
     * @param fieldName Field name.
     */
    public FieldNotFoundException(String schemaName, String fieldName) {
        super(UNKNOWN_FIELD_ERR, "Field does not exist [schema=" + schemaName + ", fieldName=" + fieldName + ']');
    }
}
