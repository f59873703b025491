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
 * Receives context events from a {@link Parser}.
 *
 * Events are delivered on the parser's executor.
 */
public interface ContextListener {

    /** A parse of the context has completed, and the context is consistent. */
    public void onChange(@Nonnull DtsContext ctx);

    /** A context was created for a file opened through {@link Parser#open}. */
    public void onOpen(@Nonnull DtsContext ctx);

    /** The context was removed. */
    public void onDelete(@Nonnull DtsContext ctx);
}
