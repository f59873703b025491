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
import java.nio.file.Paths;
import java.util.Arrays;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

public class LineTest {

    private static final URI URI = Paths.get("/board/test.dts").toUri();

    private static Line line() {
        return new Line("foo MACRO_1 MACRO_2", 0, URI, Arrays.asList(
                new MacroInstance(null, "MACRO_1", "bar", 4),
                new MacroInstance(null, "MACRO_2", "1234", 12)));
    }

    @Test
    public void testText() {
        Line line = line();
        assertEquals("foo bar 1234", line.getText());
        assertEquals("foo MACRO_1 MACRO_2", line.getRaw());
        assertEquals(12, line.length());
    }

    @Test
    public void testRawPos() {
        Line line = line();
        assertEquals(0, line.rawPos(0, true));
        assertEquals(4, line.rawPos(4, true));
        // Inside an expansion, earliest maps to its start and latest to its end.
        assertEquals(4, line.rawPos(5, true));
        assertEquals(11, line.rawPos(5, false));
        assertEquals(12, line.rawPos(9, true));
        assertEquals(19, line.rawPos(12, true));
    }

    @Test
    public void testNoMacros() {
        Line line = new Line("reg = <1>;", 3, URI);
        assertEquals("reg = <1>;", line.getText());
        assertEquals(7, line.rawPos(7, true));
        assertEquals(new Position(3, 7), line.rawPosition(7, true));
    }
}
