/*
 * Anarres C Preprocessor
 * Copyright (c) 2007-2015, Shevek
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied.  See the License for the specific language governing
 * permissions and limitations under the License.
 */
package org.anarres.dts;

import javax.annotation.Nonnull;

/**
 * The shape of a property's value list, as used by binding schemas.
 */
public enum PropertyType {
    BOOLEAN("boolean"),
    INT("int"),
    ARRAY("array"),
    PHANDLE("phandle"),
    PHANDLES("phandles"),
    PHANDLE_ARRAY("phandle-array"),
    STRING("string"),
    STRING_ARRAY("string-array"),
    UINT8_ARRAY("uint8-array"),
    PATH("path"),
    COMPOUND("compound"),
    INVALID("invalid");

    private final String text;

    private PropertyType(@Nonnull String text) {
        this.text = text;
    }

    /** Returns the name used for this type in binding files. */
    @Nonnull
    public String getText() {
        return text;
    }
}
