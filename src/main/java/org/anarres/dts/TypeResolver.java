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

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * Classifies nodes into semantic types.
 *
 * Implementations must not modify the node graph. Results are cached on
 * the node until a parse touches it.
 */
public interface TypeResolver {

    /** A resolver that never finds a type. */
    public static final TypeResolver NONE = new TypeResolver() {
        @Override
        public NodeType resolve(Node node, NodeType parentType) {
            return null;
        }
    };

    @CheckForNull
    public NodeType resolve(@Nonnull Node node, @CheckForNull NodeType parentType);
}
