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

import java.net.URI;
import java.util.concurrent.CompletableFuture;
import javax.annotation.Nonnull;

/**
 * Retrieves file text.
 *
 * Failure to read a file should complete with {@link FileContent#unavailable}.
 * Callers treat a future that completes exceptionally the same way.
 */
public interface FileContentProvider {

    @Nonnull
    public CompletableFuture<FileContent> read(@Nonnull URI uri);

    /** Returns true if the file can be read. Used to search include paths. */
    public boolean exists(@Nonnull URI uri);
}
