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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;
import static org.junit.jupiter.api.Assertions.*;

public class ExpressionEvaluatorTest {

    private static String fail(final String expr) {
        ExpressionException e = assertThrows(ExpressionException.class, new Executable() {
            @Override
            public void execute() throws Throwable {
                ExpressionEvaluator.evaluate(expr);
            }
        });
        return e.getMessage();
    }

    @Test
    public void testPrecedence() throws Exception {
        assertEquals(7, ExpressionEvaluator.evaluate("1 + 2 * 3"));
        assertEquals(9, ExpressionEvaluator.evaluate("(1 + 2) * 3"));
        assertEquals(19, ExpressionEvaluator.evaluate("(1 << 4) | 3"));
        assertEquals(1, ExpressionEvaluator.evaluate("1 < 2 && 2 < 3"));
        assertEquals(0, ExpressionEvaluator.evaluate("!1"));
        assertEquals(-4, ExpressionEvaluator.evaluate("-(2 + 2)"));
    }

    @Test
    public void testLiterals() throws Exception {
        assertEquals(24, ExpressionEvaluator.evaluate("0x10 + 010"));
        assertEquals(97, ExpressionEvaluator.evaluate("'a'"));
        assertEquals(255, ExpressionEvaluator.evaluate("0xFF"));
    }

    @Test
    public void testTernary() throws Exception {
        assertEquals(2, ExpressionEvaluator.evaluate("1 ? 2 : 3"));
        assertEquals(3, ExpressionEvaluator.evaluate("0 ? 2 : 3"));
    }

    @Test
    public void testErrors() {
        assertEquals("Division by zero", fail("1 / 0"));
        assertEquals("Modulus by zero", fail("1 % 0"));
        assertEquals("Expected expression", fail("1 +"));
        assertTrue(fail("(1 + 2").startsWith("Missing ) in expression"), "missing paren");
        fail("FOO");
        fail("1 2");
    }
}
