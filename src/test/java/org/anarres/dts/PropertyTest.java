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

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

public class PropertyTest {

    private ContextFixture fixture;

    @BeforeEach
    public void setUp() {
        fixture = new ContextFixture();
    }

    private Property prop(String decl) {
        DtsContext ctx = fixture.board("/ { " + decl + " };");
        String name = decl.substring(0, decl.indexOf(decl.contains("=") ? " =" : ";"));
        Property p = ctx.getRoot().property(name);
        assertNotNull(p, name);
        return p;
    }

    @Test
    public void testNumber() {
        Property p = prop("a = <5>;");
        assertEquals(Long.valueOf(5), p.getNumber());
        assertEquals(PropertyType.INT, p.getType());
        assertArrayEquals(new long[]{5}, p.getArray());
        assertNull(p.getString());
        assertFalse(p.isBoolean());
    }

    @Test
    public void testString() {
        Property p = prop("s = \"x\";");
        assertEquals("x", p.getString());
        assertEquals(PropertyType.STRING, p.getType());
        assertNull(p.getNumber());
        assertNull(p.getArray());
        assertNull(p.getEntries());
        assertNull(p.getRegs());
        assertNull(p.getNexusMap());
    }

    @Test
    public void testStringArray() {
        Property p = prop("c = \"a\", \"b\";");
        assertEquals(Arrays.asList("a", "b"), p.getStringArray());
        assertEquals(PropertyType.STRING_ARRAY, p.getType());
        assertNull(p.getString());
    }

    @Test
    public void testBoolean() {
        Property p = prop("b;");
        assertTrue(p.isBoolean());
        assertEquals(PropertyType.BOOLEAN, p.getType());
        assertNull(p.getNumber());
        assertEquals("b", p.toString());
    }

    @Test
    public void testArrays() {
        Property p = prop("arr = <1 2 3>;");
        assertArrayEquals(new long[]{1, 2, 3}, p.getArray());
        assertEquals(PropertyType.ARRAY, p.getType());

        Property multi = prop("arr = <1 2>, <3>;");
        assertNull(multi.getArray());
        List<long[]> arrays = multi.getArrays();
        assertEquals(2, arrays.size());
        assertArrayEquals(new long[]{3}, arrays.get(1));
        assertEquals(PropertyType.ARRAY, multi.getType());
    }

    @Test
    public void testBytestring() {
        Property p = prop("data = [01 02];");
        assertEquals(PropertyType.UINT8_ARRAY, p.getType());
        assertEquals(2, p.getBytestring().size());
    }

    @Test
    public void testPHandles() {
        Property single = prop("p = <&foo>;");
        assertEquals(PropertyType.PHANDLE, single.getType());
        assertEquals("foo", single.getPHandle().getLabel());

        Property many = prop("p = <&a &b>;");
        assertEquals(PropertyType.PHANDLES, many.getType());
        assertEquals(2, many.getPHandles().size());

        Property path = prop("p = &foo;");
        assertEquals(PropertyType.PATH, path.getType());
        assertEquals("foo", path.getPHandle().getLabel());
    }

    @Test
    public void testCompound() {
        assertEquals(PropertyType.COMPOUND, prop("x = \"a\", <1>;").getType());
    }

    @Test
    public void testEntries() {
        Property p = prop("gpios = <&gpio0 1 2>, <&gpio0 3 4>;");
        assertEquals(PropertyType.PHANDLE_ARRAY, p.getType());
        List<Property.PHandleEntry> entries = p.getEntries();
        assertEquals(2, entries.size());
        assertEquals("gpio0", entries.get(0).getTarget().getLabel());
        assertEquals(2, entries.get(0).getCells().size());
        assertEquals(3, entries.get(1).getCells().get(0).getValue());

        assertEquals(2, prop("gpios = <&gpio0 1 2 &gpio1 3 4>;").getEntries().size());
    }

    @Test
    public void testRegs() {
        DtsContext ctx = fixture.board("/ {\n\t#address-cells = <1>;\n\t#size-cells = <1>;\n"
                + "\tdev@1000 {\n\t\treg = <0x1000 0x100 0x2000 0x200>;\n\t};\n};");
        Node dev = ctx.lookupNode("/dev@1000");
        List<Property.Reg> regs = dev.regs();
        assertEquals(2, regs.size());
        assertEquals(0x2000, regs.get(1).getAddrs().get(0).getValue());
        assertEquals(0x200, regs.get(1).getSizes().get(0).getValue());

        assertEquals(Arrays.asList(Arrays.asList("addr", "size")), dev.property("reg").cellNames(ctx));
    }

    @Test
    public void testRegsDefaultCells() {
        DtsContext ctx = fixture.board("/ { dev { reg = <0 0x1000 0x100>; }; };");
        List<Property.Reg> regs = ctx.lookupNode("/dev").regs();
        assertEquals(1, regs.size());
        assertEquals(2, regs.get(0).getAddrs().size());
        assertEquals(1, regs.get(0).getSizes().size());
    }

    @Test
    public void testRegsImplausibleCells() {
        DtsContext ctx = fixture.board("/ {\n\t#address-cells = <0xffffffff>;\n\t#size-cells = <0>;\n"
                + "\tdev { reg = <1 2 3>; };\n};");
        List<Property.Reg> regs = ctx.lookupNode("/dev").regs();
        assertEquals(1, regs.size());
        assertEquals(2, regs.get(0).getAddrs().size());
        assertTrue(regs.get(0).getSizes().isEmpty());

        ctx = fixture.board("/ {\n\t#address-cells = <3>;\n\t#size-cells = <0xfffffffe>;\n"
                + "\tdev { reg = <1 2 3>; };\n};");
        assertTrue(ctx.lookupNode("/dev").regs().isEmpty());
    }

    @Test
    public void testCellNamesImplausibleCells() {
        DtsContext ctx = fixture.board("/ {\n\t#address-cells = <0x7fffffff>;\n"
                + "\tdev { reg = <1 2 3>; };\n};");
        assertEquals(Arrays.asList(Arrays.asList("addr", "addr", "size")),
                ctx.lookupNode("/dev").property("reg").cellNames(ctx));

        ctx = fixture.board("/ {\n\tgpio0: gpio { #gpio-cells = <0xffffffff>; };\n\tled { gpios = <&gpio0 1>; };\n};");
        Node gpio = ctx.lookupNode("&gpio0");
        assertEquals(1, gpio.cellCount("gpios"));
        assertNull(gpio.refCellNames("gpios"));
        assertEquals(2, gpio.addrCells());
        assertNotNull(ctx.lookupNode("/led").property("gpios").cellNames(ctx));
    }

    @Test
    public void testNexusMap() {
        Property p = prop("gpio-map = <0 0 &gpio0 3 0>, <0 1 &gpio0 4 0>;");
        List<Property.NexusEntry> map = p.getNexusMap();
        assertEquals(2, map.size());
        assertEquals(2, map.get(1).getIn().size());
        assertEquals(1, map.get(1).getIn().get(1).getValue());
        assertEquals("gpio0", map.get(1).getTarget().getLabel());
        assertEquals(4, map.get(1).getOut().get(0).getValue());
    }

    @Test
    public void testCellName() {
        assertEquals("gpio-cells", Property.cellName("cs-gpios"));
        assertEquals("gpio-cells", Property.cellName("gpios"));
        assertEquals("clock-cells", Property.cellName("clocks"));
        assertEquals("interrupt-cells", Property.cellName("interrupt-map"));
        assertEquals("interrupt-cells", Property.cellName("interrupts-extended"));
        assertNull(Property.cellName("reg"));
    }

    @Test
    public void testCellCount() {
        DtsContext ctx = fixture.board("/ {\n\tgpio0: gpio { #gpio-cells = <2>; };\n\tled { gpios = <&gpio0 1 0>; };\n};");
        Node gpio = ctx.lookupNode("&gpio0");
        assertEquals(2, gpio.cellCount("gpios"));
        assertEquals(Arrays.asList("gpio-0", "gpio-1"), gpio.refCellNames("gpios"));
        assertEquals(1, ctx.lookupNode("/led").cellCount("gpios"));

        List<List<String>> names = ctx.lookupNode("/led").property("gpios").cellNames(ctx);
        assertEquals(Arrays.asList(Arrays.asList("&gpio0", "gpio-0", "gpio-1")), names);
    }

    @Test
    public void testValueAt() {
        DtsContext ctx = fixture.board("/ { a = <1>, \"two\"; };");
        Property p = ctx.getRoot().property("a");
        PropertyValue v = p.valueAt(ContextFixture.BOARD, new Position(0, 15));
        assertEquals(PropertyValue.Kind.STRING, v.getKind());
        assertNull(p.valueAt(ContextFixture.BOARD, new Position(0, 4)));
    }

    @Test
    public void testToString() {
        assertEquals("a = < 0x10 >, \"x\"", prop("a = <0x10>, \"x\";").toString());
    }
}
