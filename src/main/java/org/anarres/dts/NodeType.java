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

import java.util.List;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * The semantic type of a node, as resolved from a binding.
 */
public interface NodeType {

    @Nonnull
    public String getName();

    /**
     * Returns false if the type was resolved from incomplete information
     * and should be resolved again after the next parse.
     */
    public boolean isValid();

    /** Returns the names of the cells in a specifier, such as {@code gpio-cells}, or null. */
    @CheckForNull
    public List<String> getCells(@Nonnull String cellName);
}
