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
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * The text of a file, or the reason it could not be read.
 */
public final class FileContent {

    private final URI uri;
    @CheckForNull
    private final String text;
    @CheckForNull
    private final String reason;

    private FileContent(@Nonnull URI uri, @CheckForNull String text, @CheckForNull String reason) {
        this.uri = uri;
        this.text = text;
        this.reason = reason;
    }

    @Nonnull
    public static FileContent of(@Nonnull URI uri, @Nonnull String text) {
        return new FileContent(uri, text, null);
    }

    @Nonnull
    public static FileContent unavailable(@Nonnull URI uri, @Nonnull String reason) {
        return new FileContent(uri, null, reason);
    }

    @Nonnull
    public URI getUri() {
        return uri;
    }

    public boolean isAvailable() {
        return text != null;
    }

    /**
     * Returns the text.
     *
     * @throws IllegalStateException if the content is unavailable.
     */
    @Nonnull
    public String getText() {
        if (text == null)
            throw new IllegalStateException("Content of " + uri + " is unavailable: " + reason);
        return text;
    }

    @CheckForNull
    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        if (text == null)
            return uri + " (unavailable: " + reason + ")";
        return uri + " (" + text.length() + " chars)";
    }
}
