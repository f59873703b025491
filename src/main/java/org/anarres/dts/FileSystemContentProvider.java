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

import java.io.File;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import javax.annotation.Nonnull;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads {@code file:} URIs from the local file system as UTF-8.
 */
public class FileSystemContentProvider implements FileContentProvider {

    private static final Logger LOG = LoggerFactory.getLogger(FileSystemContentProvider.class);

    @Override
    public CompletableFuture<FileContent> read(URI uri) {
        return CompletableFuture.completedFuture(readNow(uri));
    }

    @Nonnull
    private FileContent readNow(@Nonnull URI uri) {
        if (!"file".equals(uri.getScheme()))
            return FileContent.unavailable(uri, "Unsupported scheme " + uri.getScheme());
        File file = new File(uri);
        if (!file.isFile())
            return FileContent.unavailable(uri, "File not found");
        try {
            return FileContent.of(uri, FileUtils.readFileToString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            LOG.warn("Failed to read " + file + ": " + e);
            return FileContent.unavailable(uri, String.valueOf(e.getMessage()));
        }
    }

    @Override
    public boolean exists(URI uri) {
        return "file".equals(uri.getScheme()) && new File(uri).isFile();
    }
}
