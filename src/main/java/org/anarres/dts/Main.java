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
import java.io.PrintStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nonnull;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import joptsimple.OptionException;
import joptsimple.OptionParser;
import joptsimple.OptionSet;
import joptsimple.OptionSpec;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses a board file and its overlays, and reports diagnostics.
 */
public class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        try {
            System.exit(run(args, System.out, System.err));
        } catch (Exception e) {
            LOG.error("Failed: " + e, e);
            System.exit(2);
        }
    }

    /**
     * Runs the command line.
     *
     * @return the exit status: 0 on success, 1 if errors were reported.
     */
    public static int run(@Nonnull String[] args, @Nonnull PrintStream out, @Nonnull PrintStream err) throws IOException {
        OptionParser parser = new OptionParser();
        OptionSpec<?> helpOption = parser.accepts("help",
                "Displays command-line help.")
                .forHelp();
        OptionSpec<?> debugOption = parser.acceptsAll(Arrays.asList("debug"),
                "Enables debug output.");
        OptionSpec<String> defineOption = parser.acceptsAll(Arrays.asList("define", "D"),
                "Defines the given macro.")
                .withRequiredArg().ofType(String.class).describedAs("name[=definition]");
        OptionSpec<File> incdirOption = parser.acceptsAll(Arrays.asList("incdir", "I"),
                "Adds the directory dir to the list of directories to be searched for included files.")
                .withRequiredArg().ofType(File.class).describedAs("dir");
        OptionSpec<File> overlayOption = parser.acceptsAll(Arrays.asList("overlay", "o"),
                "Applies the overlay file on top of the board. May be repeated; later overlays win.")
                .withRequiredArg().ofType(File.class).describedAs("file");
        OptionSpec<File> outputOption = parser.accepts("output",
                "Writes the composed device tree to the file.")
                .withRequiredArg().ofType(File.class).describedAs("file");
        OptionSpec<?> jsonOption = parser.accepts("json",
                "Prints diagnostics as JSON.");
        OptionSpec<?> preprocessOption = parser.accepts("preprocess",
                "Prints the preprocessed board file and exits.");
        OptionSpec<File> boardOption = parser.nonOptions()
                .ofType(File.class).describedAs("Board file.");

        OptionSet options;
        try {
            options = parser.parse(args);
        } catch (OptionException e) {
            err.println(e.getMessage());
            parser.printHelpOn(err);
            return 1;
        }

        if (options.has(helpOption)) {
            parser.printHelpOn(out);
            return 0;
        }

        Map<String, String> defines = new LinkedHashMap<String, String>();
        for (String arg : options.valuesOf(defineOption)) {
            int idx = arg.indexOf('=');
            if (idx == -1)
                defines.put(arg, null);
            else
                defines.put(arg.substring(0, idx), arg.substring(idx + 1));
        }

        List<String> includes = new ArrayList<String>();
        for (File dir : options.valuesOf(incdirOption))
            includes.add(dir.getAbsolutePath());

        List<File> boards = options.valuesOf(boardOption);
        List<URI> overlays = new ArrayList<URI>();
        for (File overlay : options.valuesOf(overlayOption))
            overlays.add(overlay.getAbsoluteFile().toPath().toUri());
        if (boards.size() > 1) {
            err.println("Expected a single board file, got " + boards);
            return 1;
        }
        URI board = boards.isEmpty() ? null : boards.get(0).getAbsoluteFile().toPath().toUri();
        if (board == null && overlays.isEmpty()) {
            parser.printHelpOn(err);
            return 1;
        }

        FileContentProvider provider = new FileSystemContentProvider();

        if (options.has(preprocessOption)) {
            if (board == null) {
                err.println("--preprocess requires a board file");
                return 1;
            }
            return preprocess(provider, board, defines, includes, options.has(debugOption), out, err);
        }

        Parser dts = new Parser(provider, TypeResolver.NONE, defines, includes, Parser.DIRECT_EXECUTOR);
        if (options.has(debugOption))
            dts.addFeature(Feature.DEBUG);

        if (dts.getFeature(Feature.DEBUG)) {
            LOG.info("/include/ search starts here:");
            for (String dir : includes)
                LOG.info("  " + dir);
            LOG.info("End of search list.");
        }

        DtsContext ctx = dts.addContext(board, overlays, null).join();
        if (ctx == null) {
            err.println("Unable to read " + (board != null ? board.getPath() : overlays));
            return 1;
        }

        DiagnosticSet diags = ctx.getDiagnostics();
        if (options.has(jsonOption)) {
            Gson gson = new GsonBuilder().setPrettyPrinting().create();
            out.println(gson.toJson(diags.toJson()));
        } else {
            for (Diagnostic d : diags.all())
                err.println(d);
        }

        File output = options.valueOf(outputOption);
        if (output != null)
            FileUtils.writeStringToFile(output, ctx.toString() + "\n", StandardCharsets.UTF_8);

        return diags.count(Severity.ERROR) > 0 ? 1 : 0;
    }

    private static int preprocess(@Nonnull FileContentProvider provider, @Nonnull URI board,
            @Nonnull Map<String, String> defines, @Nonnull List<String> includes, boolean debug,
            @Nonnull PrintStream out, @Nonnull PrintStream err) {
        FileContent content = provider.read(board).join();
        if (!content.isAvailable()) {
            err.println("Unable to read " + board.getPath() + ": " + content.getReason());
            return 1;
        }
        Preprocessor pp = new Preprocessor(provider);
        for (Map.Entry<String, String> e : defines.entrySet()) {
            if (e.getValue() == null)
                pp.addMacro(e.getKey());
            else
                pp.addMacro(e.getKey(), e.getValue());
        }
        pp.setIncludePath(includes);
        if (debug)
            LOG.info("Preprocessing {} with {} macros", board, pp.getMacros().size());
        DiagnosticSet diags = new DiagnosticSet();
        PreprocessedFile result = pp.preprocess(board, content.getText(), diags);
        out.print(result.getText());
        for (Diagnostic d : diags.all())
            err.println(d);
        return diags.count(Severity.ERROR) > 0 ? 1 : 0;
    }
}
