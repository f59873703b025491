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
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.function.BiConsumer;
import java.util.function.Function;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import org.pcollections.PMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the contexts, and keeps them up to date as files change.
 *
 * All context mutation happens on the executor. Callers query contexts
 * from the thread that runs the executor's tasks, or after the future
 * of the last operation (or {@link #stable()}) has completed; a context
 * is never observed halfway through a reparse. A context is never
 * parsed twice at the same time: changes arriving during a parse are
 * collected, and parsed in one go once the running parse completes.
 * File contents are read before the parse starts, so a parse never
 * waits for a file except for includes.
 *
 * There is no current context in the parser; operations that depend
 * on the context in focus take it as a parameter.
 */
public class Parser {

    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

    /** Runs tasks on the calling thread. */
    public static final Executor DIRECT_EXECUTOR = new Executor() {
        @Override
        public void execute(Runnable command) {
            command.run();
        }
    };

    private final FileContentProvider provider;
    private final TypeResolver resolver;
    private final Map<String, String> defines;
    private final List<String> includes;
    private final Executor executor;
    private final Set<Feature> features = EnumSet.of(Feature.DISABLED_NODE_HINTS);
    private final List<DtsContext> appContexts = new CopyOnWriteArrayList<DtsContext>();
    private final List<DtsContext> boardContexts = new CopyOnWriteArrayList<DtsContext>();
    private final List<ContextListener> listeners = new CopyOnWriteArrayList<ContextListener>();

    private final Object lock = new Object();
    private int inFlight;
    private final Deque<CompletableFuture<Void>> waiters = new ArrayDeque<CompletableFuture<Void>>();

    public Parser(@Nonnull FileContentProvider provider, @Nonnull TypeResolver resolver,
            @Nonnull Map<String, String> defines, @Nonnull List<String> includes, @Nonnull Executor executor) {
        this.provider = provider;
        this.resolver = resolver;
        this.defines = new LinkedHashMap<String, String>(defines);
        this.includes = new ArrayList<String>(includes);
        this.executor = executor;
    }

    public void addFeature(@Nonnull Feature f) {
        features.add(f);
    }

    public void removeFeature(@Nonnull Feature f) {
        features.remove(f);
    }

    public boolean getFeature(@Nonnull Feature f) {
        return features.contains(f);
    }

    public void addListener(@Nonnull ContextListener listener) {
        listeners.add(listener);
    }

    public void removeListener(@Nonnull ContextListener listener) {
        listeners.remove(listener);
    }

    @Nonnull
    public List<String> getIncludes() {
        return Collections.unmodifiableList(includes);
    }

    /** Returns the application contexts, followed by the board-only contexts. */
    @Nonnull
    public List<DtsContext> getContexts() {
        List<DtsContext> contexts = new ArrayList<DtsContext>(appContexts);
        contexts.addAll(boardContexts);
        return contexts;
    }

    @CheckForNull
    public DtsContext ctx(@Nonnull URI uri, @CheckForNull DtsContext focus) {
        if (focus != null && focus.has(uri))
            return focus;
        for (DtsContext ctx : getContexts())
            if (ctx.has(uri))
                return ctx;
        return null;
    }

    @CheckForNull
    public DtsFile file(@Nonnull URI uri, @CheckForNull DtsContext focus) {
        DtsContext ctx = ctx(uri, focus);
        return (ctx == null) ? null : ctx.file(uri);
    }

    /** Returns a future completing once no context is being parsed. */
    @Nonnull
    public CompletableFuture<Void> stable() {
        synchronized (lock) {
            if (inFlight == 0)
                return CompletableFuture.completedFuture(null);
            CompletableFuture<Void> waiter = new CompletableFuture<Void>();
            waiters.add(waiter);
            return waiter;
        }
    }

    private void begin() {
        synchronized (lock) {
            inFlight++;
        }
    }

    private void end() {
        List<CompletableFuture<Void>> ready = new ArrayList<CompletableFuture<Void>>();
        synchronized (lock) {
            if (--inFlight > 0)
                return;
            ready.addAll(waiters);
            waiters.clear();
        }
        for (CompletableFuture<Void> waiter : ready)
            waiter.complete(null);
    }

    /**
     * Creates a context for a board file and overlays.
     *
     * The future completes with null if the board cannot be found, or
     * if none of the overlays could be read.
     */
    @Nonnull
    public CompletableFuture<DtsContext> addContext(@CheckForNull final URI board, @Nonnull final List<URI> overlays, @CheckForNull String name) {
        if (board == null && overlays.isEmpty())
            return CompletableFuture.completedFuture(null);
        if (board != null && !provider.exists(board)) {
            LOG.warn("Board file {} not found", board);
            return CompletableFuture.completedFuture(null);
        }

        final DtsContext ctx = new DtsContext();
        ctx.setName(name);
        if (board != null)
            ctx.setBoard(board);
        for (URI overlay : overlays)
            ctx.addOverlay(overlay);

        return reparse(ctx).thenApply(new Function<DtsContext, DtsContext>() {
            @Override
            public DtsContext apply(DtsContext c) {
                if (!overlays.isEmpty()) {
                    boolean any = false;
                    for (DtsFile overlay : ctx.getOverlays())
                        any |= overlay.isAvailable();
                    if (!any)
                        return null;
                }

                /* Board contexts of .dtsi files are incomplete; drop those included by a complete board. */
                if (board != null && board.getPath().endsWith(".dts")) {
                    List<DtsContext> obsolete = new ArrayList<DtsContext>();
                    for (DtsContext existing : boardContexts) {
                        DtsFile existingBoard = existing.getBoard();
                        if (existingBoard != null && !existingBoard.getUri().getPath().endsWith(".dts") && ctx.has(existingBoard.getUri()))
                            obsolete.add(existing);
                    }
                    boardContexts.removeAll(obsolete);
                }

                if (overlays.isEmpty())
                    boardContexts.add(ctx);
                else
                    appContexts.add(ctx);
                for (ContextListener l : listeners)
                    l.onChange(ctx);
                return ctx;
            }
        });
    }

    /**
     * Returns the context holding the file, creating one if needed.
     * Overlay files get an application context, other files a board context.
     */
    @Nonnull
    public CompletableFuture<DtsContext> open(@Nonnull URI uri) {
        DtsContext existing = ctx(uri, null);
        if (existing != null)
            return CompletableFuture.completedFuture(existing);

        CompletableFuture<DtsContext> created;
        if (uri.getPath().endsWith(".overlay"))
            created = addContext(null, Collections.singletonList(uri), null);
        else
            created = addContext(uri, Collections.<URI>emptyList(), null);
        return created.thenApply(new Function<DtsContext, DtsContext>() {
            @Override
            public DtsContext apply(DtsContext ctx) {
                if (ctx != null)
                    for (ContextListener l : listeners)
                        l.onOpen(ctx);
                return ctx;
            }
        });
    }

    /** Makes a context the focus, bringing it up to date if changes were postponed. */
    @Nonnull
    public CompletableFuture<DtsContext> focus(@Nonnull DtsContext ctx) {
        if (ctx.isValid())
            return CompletableFuture.completedFuture(ctx);
        return reparse(ctx);
    }

    /**
     * Records a change to a file in every context that depends on it.
     * Only the focused context is parsed right away; the others are
     * parsed when they get focus.
     */
    @Nonnull
    public CompletableFuture<DtsContext> fileChanged(@Nonnull URI uri, @CheckForNull DtsContext focus) {
        for (DtsContext ctx : getContexts())
            if (ctx.has(uri))
                ctx.markDirty(uri);
        if (focus != null && !focus.getDirty().isEmpty())
            return reparse(focus);
        return CompletableFuture.completedFuture(focus);
    }

    /**
     * Removes the contexts built around a deleted file, and marks the
     * file changed in the others.
     */
    @Nonnull
    public CompletableFuture<DtsContext> fileDeleted(@Nonnull URI uri, @CheckForNull DtsContext focus) {
        for (DtsContext ctx : getContexts()) {
            List<DtsFile> overlays = ctx.getOverlays();
            DtsFile board = ctx.getBoard();
            if ((overlays.size() == 1 && overlays.get(0).getUri().equals(uri))
                    || (board != null && board.getUri().equals(uri)))
                removeContext(ctx);
        }
        if (focus != null && !getContexts().contains(focus))
            focus = null;
        return fileChanged(uri, focus);
    }

    public void removeContext(@Nonnull DtsContext ctx) {
        ctx.cancelled = true;
        appContexts.remove(ctx);
        boardContexts.remove(ctx);
        for (ContextListener l : listeners)
            l.onDelete(ctx);
    }

    @Nonnull
    private CompletableFuture<DtsContext> mutate(@Nonnull final DtsContext ctx, @Nonnull Runnable change) {
        return CompletableFuture.runAsync(change, executor).thenCompose(new Function<Void, CompletionStage<DtsContext>>() {
            @Override
            public CompletionStage<DtsContext> apply(Void v) {
                return reparse(ctx);
            }
        });
    }

    @Nonnull
    public CompletableFuture<DtsContext> setBoard(@Nonnull final DtsContext ctx, @Nonnull final URI board) {
        return mutate(ctx, new Runnable() {
            @Override
            public void run() {
                ctx.setBoard(board);
            }
        });
    }

    /** Adds overlays in front of the existing ones, preserving their order. */
    @Nonnull
    public CompletableFuture<DtsContext> insertOverlays(@Nonnull final DtsContext ctx, @Nonnull final URI... uris) {
        return mutate(ctx, new Runnable() {
            @Override
            public void run() {
                List<URI> reversed = new ArrayList<URI>(Arrays.asList(uris));
                Collections.reverse(reversed);
                for (URI uri : reversed)
                    ctx.insertOverlay(uri);
            }
        });
    }

    @Nonnull
    public CompletableFuture<DtsContext> setOverlays(@Nonnull final DtsContext ctx, @Nonnull final List<URI> uris) {
        return mutate(ctx, new Runnable() {
            @Override
            public void run() {
                ctx.setOverlays(uris);
            }
        });
    }

    /** Parses whatever changed in the context. Without changes, the context is left as it is. */
    @Nonnull
    public CompletableFuture<DtsContext> refresh(@Nonnull DtsContext ctx) {
        return reparse(ctx);
    }

    @Nonnull
    private CompletableFuture<DtsContext> reparse(@Nonnull DtsContext ctx) {
        CompletableFuture<DtsContext> done;
        synchronized (ctx) {
            if (ctx.parsing)
                return ctx.completion;
            ctx.parsing = true;
            done = new CompletableFuture<DtsContext>();
            ctx.completion = done;
        }
        begin();
        parse(ctx, done);
        return done;
    }

    /* Reads the files to parse, then parses them on the executor. */
    private void parse(@Nonnull final DtsContext ctx, @Nonnull final CompletableFuture<DtsContext> done) {
        executor.execute(new Runnable() {
            @Override
            public void run() {
                try {
                    final Set<URI> changed = ctx.getDirty();
                    final Map<URI, CompletableFuture<FileContent>> reads = new LinkedHashMap<URI, CompletableFuture<FileContent>>();
                    for (DtsFile f : ctx.getStaleFiles())
                        reads.put(f.getUri(), provider.read(f.getUri()));
                    CompletableFuture.allOf(reads.values().toArray(new CompletableFuture<?>[reads.size()]))
                            .whenCompleteAsync(new BiConsumer<Void, Throwable>() {
                                @Override
                                public void accept(Void v, Throwable t) {
                                    commit(ctx, changed, reads, done);
                                }
                            }, executor);
                } catch (RuntimeException e) {
                    fail(ctx, done, e);
                }
            }
        });
    }

    @Nonnull
    private FileContent content(@Nonnull URI uri, @CheckForNull CompletableFuture<FileContent> read) {
        if (read == null)
            read = provider.read(uri);
        try {
            return read.join();
        } catch (CompletionException e) {
            LOG.warn("Unable to read {}", uri, e.getCause());
            return FileContent.unavailable(uri, String.valueOf(e.getCause()));
        }
    }

    private void commit(@Nonnull DtsContext ctx, @Nonnull Set<URI> changed,
            @Nonnull Map<URI, CompletableFuture<FileContent>> reads, @Nonnull CompletableFuture<DtsContext> done) {
        try {
            if (ctx.cancelled) {
                LOG.debug("{}: parse cancelled", ctx.getName());
                finish(ctx, done);
                return;
            }

            List<DtsFile> stale = ctx.reset(changed);
            List<DtsFile> files = ctx.getFiles();
            PMap<String, Macro> macros = baseMacros();
            if (getFeature(Feature.DEBUG) && !stale.isEmpty())
                LOG.info("{}: include path {}", ctx.getName(), includePath(ctx));

            for (int i = 0; i < files.size(); i++) {
                DtsFile file = files.get(i);
                file.setPriority(i);
                if (stale.contains(file))
                    parseFile(ctx, file, content(file.getUri(), reads.get(file.getUri())), macros);
                else
                    ctx.adopt(file);
                macros = file.getMacros();

                long start = System.nanoTime();
                ctx.resolveTypes(resolver);
                log("Resolved types for {} in {} ms", file.getUri(), (System.nanoTime() - start) / 1000000);
            }

            ctx.prune();
            ctx.refreshContextDiagnostics(getFeature(Feature.DISABLED_NODE_HINTS));

            synchronized (ctx) {
                if (!ctx.getDirty().isEmpty() && !ctx.cancelled) {
                    LOG.debug("{}: changed during parse, parsing again", ctx.getName());
                    parse(ctx, done);
                    return;
                }
                ctx.parsing = false;
            }

            if (getContexts().contains(ctx))
                for (ContextListener l : listeners)
                    l.onChange(ctx);
            done.complete(ctx);
            end();
        } catch (RuntimeException e) {
            fail(ctx, done, e);
        }
    }

    private void finish(@Nonnull DtsContext ctx, @Nonnull CompletableFuture<DtsContext> done) {
        synchronized (ctx) {
            ctx.parsing = false;
        }
        done.complete(ctx);
        end();
    }

    private void fail(@Nonnull DtsContext ctx, @Nonnull CompletableFuture<DtsContext> done, @Nonnull RuntimeException e) {
        LOG.error("{}: parse failed", ctx.getName(), e);
        synchronized (ctx) {
            ctx.parsing = false;
        }
        done.completeExceptionally(e);
        end();
    }

    @Nonnull
    private List<String> includePath(@Nonnull DtsContext ctx) {
        List<String> path = new ArrayList<String>(includes);
        path.addAll(ctx.getIncludes());
        return path;
    }

    @Nonnull
    private PMap<String, Macro> baseMacros() {
        Preprocessor pp = new Preprocessor(provider);
        for (Map.Entry<String, String> e : defines.entrySet()) {
            if (e.getValue() == null)
                pp.addMacro(e.getKey());
            else
                pp.addMacro(e.getKey(), e.getValue());
        }
        return pp.getMacros();
    }

    private void log(@Nonnull String format, Object... args) {
        if (getFeature(Feature.DEBUG))
            LOG.info(format, args);
        else
            LOG.debug(format, args);
    }

    private void parseFile(@Nonnull DtsContext ctx, @Nonnull DtsFile file, @Nonnull FileContent content, @Nonnull PMap<String, Macro> macros) {
        long start = System.nanoTime();
        DiagnosticSet diags = new DiagnosticSet();
        if (!content.isAvailable()) {
            diags.push(Span.at(file.getUri(), new Position(0, 0)), "Unable to read file: " + content.getReason(), Severity.ERROR);
            file.setAvailable(false);
            file.setMacros(macros);
            file.setDiags(diags);
            file.setDirty(false);
            return;
        }

        Preprocessor pp = new Preprocessor(provider, macros);
        pp.setIncludePath(includePath(ctx));
        PreprocessedFile preprocessed = pp.preprocess(file.getUri(), content.getText(), diags);
        file.setPreprocessed(preprocessed);

        TokenCursor cursor = new TokenCursor(file.getUri(), preprocessed.getLines(), diags);
        new DtsFileParser(ctx, file, cursor).parse();
        file.setDiags(diags);
        file.setDirty(false);

        log("Parsed {} in {} ms", file.getUri(), (System.nanoTime() - start) / 1000000);
        log("Nodes: {} entries: {}", ctx.getRegistry().size(), ctx.getEntries().size());
    }

    @Override
    public String toString() {
        return "Parser" + getContexts();
    }
}
