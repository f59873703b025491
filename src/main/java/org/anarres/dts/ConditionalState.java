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
 * The state of one level of {@code #if} nesting.
 */
/* pp */ class ConditionalState {

    private final boolean parent;
    private final boolean active;
    private final boolean sawElse;
    /* Whether any branch of this conditional has been taken yet. Required for #elif. */
    private final boolean taken;
    @CheckForNull
    private final Span opener;

    /* pp */ ConditionalState() {
        this(true, true, false, true, null);
    }

    private ConditionalState(boolean parent, boolean active, boolean sawElse, boolean taken, @CheckForNull Span opener) {
        this.parent = parent;
        this.active = active;
        this.sawElse = sawElse;
        this.taken = taken;
        this.opener = opener;
    }

    /** Opens a nested conditional whose first branch is {@code active}. */
    @Nonnull
    /* pp */ ConditionalState push(boolean active, @Nonnull Span opener) {
        boolean p = isParentActive() && isActive();
        return new ConditionalState(p, p && active, false, active, opener);
    }

    /* pp */ boolean isParentActive() {
        return parent;
    }

    /* pp */ boolean isActive() {
        return active;
    }

    /* pp */ boolean sawElse() {
        return sawElse;
    }

    /* pp */ boolean isTaken() {
        return taken;
    }

    @CheckForNull
    /* pp */ Span getOpener() {
        return opener;
    }

    /** Moves to the next {@code #elif} branch. */
    @Nonnull
    /* pp */ ConditionalState elif(boolean condition) {
        boolean a = parent && !taken && condition;
        return new ConditionalState(parent, a, sawElse, taken || condition, opener);
    }

    /** Moves to the {@code #else} branch. */
    @Nonnull
    /* pp */ ConditionalState withElse() {
        return new ConditionalState(parent, parent && !taken, true, true, opener);
    }

    @Override
    public String toString() {
        return "parent=" + parent
                + ", active=" + active
                + ", sawelse=" + sawElse
                + ", taken=" + taken;
    }
}
