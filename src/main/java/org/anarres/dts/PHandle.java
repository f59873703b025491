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

import java.util.regex.MatchResult;
import java.util.regex.Pattern;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * A reference to a node.
 */
public class PHandle extends PropertyValue {

    public enum RefKind {
        /** {@code &label}. The reference includes the ampersand. */
        LABEL_REF,
        /** {@code &{/path/to/node}}. The reference is the path. */
        PATH_REF,
        /** A quoted path, as used by aliases. */
        STRING_REF,
        /** A lone ampersand, typically while the user is typing. */
        INCOMPLETE
    }

    private static final Pattern PATH_REF = Pattern.compile("&\\{([\\w/@,.+-]+)\\}");
    private static final Pattern LABEL_REF = Pattern.compile("&[\\w-]+");
    private static final Pattern STRING_REF = Pattern.compile("\"(.+?)\"");
    private static final Pattern INCOMPLETE = Pattern.compile("&");

    private final String reference;
    private final RefKind refKind;

    public PHandle(@Nonnull String reference, @Nonnull RefKind refKind, @Nonnull Span span) {
        super(Kind.PHANDLE, span);
        this.reference = reference;
        this.refKind = refKind;
    }

    @CheckForNull
    public static PHandle match(@Nonnull TokenCursor cursor) {
        MatchResult m = cursor.match(PATH_REF);
        if (m != null)
            return new PHandle(m.group(1), RefKind.PATH_REF, cursor.location());
        m = cursor.match(LABEL_REF);
        if (m != null)
            return new PHandle(m.group(), RefKind.LABEL_REF, cursor.location());
        m = cursor.match(STRING_REF);
        if (m != null)
            return new PHandle(m.group(1), RefKind.STRING_REF, cursor.location());
        m = cursor.match(INCOMPLETE);
        if (m != null)
            return new PHandle(m.group(), RefKind.INCOMPLETE, cursor.location());
        return null;
    }

    @Nonnull
    public String getReference() {
        return reference;
    }

    @Nonnull
    public RefKind getRefKind() {
        return refKind;
    }

    /** Returns the label this handle refers to, or null if it is not a label reference. */
    @CheckForNull
    public String getLabel() {
        if (refKind != RefKind.LABEL_REF)
            return null;
        return reference.substring(1);
    }

    /** Returns true if this handle points at the given node. */
    public boolean is(@Nonnull Node node) {
        switch (refKind) {
            case LABEL_REF:
                return node.hasLabel(reference.substring(1));
            case PATH_REF:
            case STRING_REF:
                return normalizePath(reference).equals(node.getPath());
            default:
                return false;
        }
    }

    @Nonnull
    /* pp */ static String normalizePath(@Nonnull String path) {
        return path.endsWith("/") ? path : path + "/";
    }

    @Override
    public String toString() {
        switch (refKind) {
            case LABEL_REF:
                return reference;
            case PATH_REF:
                return "&{" + reference + "}";
            case STRING_REF:
                return "\"" + reference + "\"";
            default:
                return "";
        }
    }
}
