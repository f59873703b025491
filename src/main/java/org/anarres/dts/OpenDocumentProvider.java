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
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * Serves the unsaved text of open editor documents, falling back to
 * another provider for files that are not open.
 */
public class OpenDocumentProvider implements FileContentProvider {

    private final Map<URI, String> documents = new ConcurrentHashMap<URI, String>();
    @CheckForNull
    private final FileContentProvider delegate;

    public OpenDocumentProvider(@CheckForNull FileContentProvider delegate) {
        this.delegate = delegate;
    }

    /** Constructs a provider that only serves open documents. */
    public OpenDocumentProvider() {
        this(null);
    }

    public void open(@Nonnull URI uri, @Nonnull String text) {
        documents.put(uri, text);
    }

    public void update(@Nonnull URI uri, @Nonnull String text) {
        documents.put(uri, text);
    }

    public void close(@Nonnull URI uri) {
        documents.remove(uri);
    }

    public boolean isOpen(@Nonnull URI uri) {
        return documents.containsKey(uri);
    }

    @Override
    public CompletableFuture<FileContent> read(URI uri) {
        String text = documents.get(uri);
        if (text != null)
            return CompletableFuture.completedFuture(FileContent.of(uri, text));
        if (delegate != null)
            return delegate.read(uri);
        return CompletableFuture.completedFuture(FileContent.unavailable(uri, "File not found"));
    }

    @Override
    public boolean exists(URI uri) {
        if (documents.containsKey(uri))
            return true;
        return delegate != null && delegate.exists(uri);
    }
}
