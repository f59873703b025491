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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import org.pcollections.PVector;
import org.pcollections.TreePVector;

/**
 * A property declaration in one {@link NodeEntry}.
 *
 * The typed accessors interpret the value list in context. They return
 * null when the values do not have the requested shape, and never throw.
 *
 * A property created by {@code /delete-property/} is a tombstone: it
 * has no values, and hides earlier declarations of the same name.
 */
public class Property {

    /** A phandle followed by its specifier cells, as in {@code <&gpio0 1 2>}. */
    public static class PHandleEntry {

        private final PHandle target;
        private final List<IntValue> cells;

        public PHandleEntry(@Nonnull PHandle target, @Nonnull List<IntValue> cells) {
            this.target = target;
            this.cells = Collections.unmodifiableList(cells);
        }

        @Nonnull
        public PHandle getTarget() {
            return target;
        }

        @Nonnull
        public List<IntValue> getCells() {
            return cells;
        }
    }

    /** One address and size group of a {@code reg} property. */
    public static class Reg {

        private final List<IntValue> addrs;
        private final List<IntValue> sizes;

        public Reg(@Nonnull List<IntValue> addrs, @Nonnull List<IntValue> sizes) {
            this.addrs = Collections.unmodifiableList(addrs);
            this.sizes = Collections.unmodifiableList(sizes);
        }

        @Nonnull
        public List<IntValue> getAddrs() {
            return addrs;
        }

        @Nonnull
        public List<IntValue> getSizes() {
            return sizes;
        }
    }

    /** One entry of a nexus {@code *-map} property. */
    public static class NexusEntry {

        private final List<IntValue> in;
        private final PHandle target;
        private final List<IntValue> out;

        public NexusEntry(@Nonnull List<IntValue> in, @Nonnull PHandle target, @Nonnull List<IntValue> out) {
            this.in = Collections.unmodifiableList(in);
            this.target = target;
            this.out = Collections.unmodifiableList(out);
        }

        @Nonnull
        public List<IntValue> getIn() {
            return in;
        }

        @Nonnull
        public PHandle getTarget() {
            return target;
        }

        @Nonnull
        public List<IntValue> getOut() {
            return out;
        }
    }

    private final String name;
    private final Span span;
    private final PVector<String> labels;
    private final PVector<PropertyValue> values;
    private final Span fullSpan;
    private final NodeEntry entry;
    private final boolean deleted;

    private Property(@Nonnull String name, @Nonnull Span span, @Nonnull List<String> labels,
            @Nonnull List<PropertyValue> values, @Nonnull Span fullSpan, @Nonnull NodeEntry entry, boolean deleted) {
        this.name = name;
        this.span = span;
        this.labels = TreePVector.from(labels);
        this.values = TreePVector.from(values);
        this.fullSpan = fullSpan;
        this.entry = entry;
        this.deleted = deleted;
    }

    public Property(@Nonnull String name, @Nonnull Span span, @Nonnull List<String> labels,
            @Nonnull List<PropertyValue> values, @Nonnull Span fullSpan, @Nonnull NodeEntry entry) {
        this(name, span, labels, values, fullSpan, entry, false);
    }

    /** Creates the marker left by {@code /delete-property/}. */
    @Nonnull
    public static Property tombstone(@Nonnull String name, @Nonnull Span span, @Nonnull NodeEntry entry) {
        return new Property(name, span, Collections.<String>emptyList(),
                Collections.<PropertyValue>emptyList(), span, entry, true);
    }

    @Nonnull
    public String getName() {
        return name;
    }

    /** Returns the location of the name. */
    @Nonnull
    public Span getSpan() {
        return span;
    }

    /** Returns the location of the whole declaration, from the name to the last value. */
    @Nonnull
    public Span getFullSpan() {
        return fullSpan;
    }

    @Nonnull
    public PVector<String> getLabels() {
        return labels;
    }

    @Nonnull
    public PVector<PropertyValue> getValues() {
        return values;
    }

    @Nonnull
    public NodeEntry getEntry() {
        return entry;
    }

    public boolean isDeleted() {
        return deleted;
    }

    @Nonnull
    public String getPath() {
        return entry.getNode().getPath() + name;
    }

    /** Returns the location covering all values, or the name if there are none. */
    @Nonnull
    public Span getValueSpan() {
        Span result = null;
        for (PropertyValue v : values)
            result = (result == null) ? v.getSpan() : result.union(v.getSpan());
        return (result == null) ? span : result;
    }

    @CheckForNull
    public PropertyValue valueAt(@Nonnull URI uri, @Nonnull Position position) {
        for (PropertyValue v : values) {
            if (v.contains(uri, position))
                return v;
        }
        return null;
    }

    private boolean allOf(@Nonnull PropertyValue.Kind kind) {
        for (PropertyValue v : values) {
            if (v.getKind() != kind)
                return false;
        }
        return true;
    }

    @CheckForNull
    private ArrayValue singleArray() {
        if (values.size() == 1 && values.get(0).getKind() == PropertyValue.Kind.ARRAY)
            return (ArrayValue) values.get(0);
        return null;
    }

    public boolean isBoolean() {
        return values.size() == 1 && values.get(0).getKind() == PropertyValue.Kind.BOOL;
    }

    /** Returns the value of a single cell property such as {@code <5>}. */
    @CheckForNull
    public Long getNumber() {
        ArrayValue a = singleArray();
        if (a == null || a.size() != 1 || !a.getCells().get(0).isNumeric())
            return null;
        return ((IntValue) a.getCells().get(0)).getValue();
    }

    @CheckForNull
    public String getString() {
        if (values.size() == 1 && values.get(0).getKind() == PropertyValue.Kind.STRING)
            return ((StringValue) values.get(0)).getValue();
        return null;
    }

    /** Returns the handle of {@code <&label>} or {@code &label}. */
    @CheckForNull
    public PHandle getPHandle() {
        ArrayValue a = singleArray();
        if (a != null && a.size() == 1 && a.getCells().get(0).getKind() == PropertyValue.Kind.PHANDLE)
            return (PHandle) a.getCells().get(0);
        if (values.size() == 1 && values.get(0).getKind() == PropertyValue.Kind.PHANDLE)
            return (PHandle) values.get(0);
        return null;
    }

    @CheckForNull
    public BytestringValue getBytestring() {
        if (values.size() == 1 && values.get(0).getKind() == PropertyValue.Kind.BYTESTRING)
            return (BytestringValue) values.get(0);
        return null;
    }

    /** Returns the cells of a single all-integer array. */
    @CheckForNull
    public long[] getArray() {
        ArrayValue a = singleArray();
        if (a == null)
            return null;
        return a.toLongArray();
    }

    /** Returns the cells of each array, if every value is an all-integer array. */
    @CheckForNull
    public List<long[]> getArrays() {
        if (!allOf(PropertyValue.Kind.ARRAY))
            return null;
        List<long[]> result = new ArrayList<long[]>();
        for (PropertyValue v : values) {
            long[] cells = ((ArrayValue) v).toLongArray();
            if (cells == null)
                return null;
            result.add(cells);
        }
        return result;
    }

    /** Returns the handles of {@code <&a &b>} or {@code &a, &b}. */
    @CheckForNull
    public List<PHandle> getPHandles() {
        ArrayValue a = singleArray();
        List<PHandle> result = new ArrayList<PHandle>();
        if (a != null && a.isPHandleArray()) {
            for (PropertyValue cell : a.getCells())
                result.add((PHandle) cell);
            return result;
        }
        if (!allOf(PropertyValue.Kind.PHANDLE))
            return null;
        for (PropertyValue v : values)
            result.add((PHandle) v);
        return result;
    }

    /** Returns the arrays, if every value is an array. */
    @CheckForNull
    public List<ArrayValue> getPHandleArray() {
        if (!allOf(PropertyValue.Kind.ARRAY))
            return null;
        List<ArrayValue> result = new ArrayList<ArrayValue>();
        for (PropertyValue v : values)
            result.add((ArrayValue) v);
        return result;
    }

    @CheckForNull
    public List<String> getStringArray() {
        if (!allOf(PropertyValue.Kind.STRING))
            return null;
        List<String> result = new ArrayList<String>();
        for (PropertyValue v : values)
            result.add(((StringValue) v).getValue());
        return result;
    }

    @CheckForNull
    private static List<IntValue> numericCells(@Nonnull List<PropertyValue> cells) {
        List<IntValue> result = new ArrayList<IntValue>();
        for (PropertyValue cell : cells) {
            if (!cell.isNumeric())
                return null;
            result.add((IntValue) cell);
        }
        return result;
    }

    /**
     * Splits the arrays into phandles followed by their cells.
     * <code>&lt;&amp;gpio0 1 2&gt;, &lt;&amp;gpio0 2 3&gt;</code> and
     * <code>&lt;&amp;gpio0 1 2 &amp;gpio0 2 3&gt;</code> both have two entries.
     */
    @CheckForNull
    public List<PHandleEntry> getEntries() {
        List<ArrayValue> arrays = getPHandleArray();
        if (arrays == null || arrays.isEmpty())
            return null;
        List<PHandleEntry> result = new ArrayList<PHandleEntry>();
        for (ArrayValue a : arrays) {
            PVector<PropertyValue> cells = a.getCells();
            int i = 0;
            while (i < cells.size()) {
                PropertyValue target = cells.get(i++);
                if (target.getKind() != PropertyValue.Kind.PHANDLE)
                    break;
                int end = i;
                while (end < cells.size() && cells.get(end).getKind() != PropertyValue.Kind.PHANDLE)
                    end++;
                List<IntValue> numbers = numericCells(cells.subList(i, end));
                if (numbers == null)
                    break;
                result.add(new PHandleEntry((PHandle) target, numbers));
                i = end;
            }
        }
        return result;
    }

    /** Splits a {@code reg} property into groups using the parent's cell counts. */
    @CheckForNull
    public List<Reg> getRegs() {
        List<ArrayValue> arrays = getPHandleArray();
        if (arrays == null || arrays.isEmpty())
            return null;
        Node parent = entry.getNode().getParent();
        int addrCells = (parent == null) ? 2 : parent.addrCells();
        int sizeCells = (parent == null) ? 1 : parent.sizeCells();
        int width = addrCells + sizeCells;
        List<Reg> result = new ArrayList<Reg>();
        if (addrCells < 0 || sizeCells < 0 || width == 0)
            return result;
        for (ArrayValue a : arrays) {
            PVector<PropertyValue> cells = a.getCells();
            for (int i = 0; i + width <= cells.size(); i += width) {
                List<IntValue> addrs = numericCells(cells.subList(i, i + addrCells));
                List<IntValue> sizes = numericCells(cells.subList(i + addrCells, i + width));
                if (addrs == null || sizes == null)
                    break;
                result.add(new Reg(addrs, sizes));
            }
        }
        return result;
    }

    /**
     * Splits a nexus map into input cells, target and output cells.
     * The number of input cells is the position of the first phandle.
     */
    @CheckForNull
    public List<NexusEntry> getNexusMap() {
        if (!name.endsWith("-map"))
            return null;
        List<NexusEntry> result = new ArrayList<NexusEntry>();
        List<ArrayValue> arrays = getPHandleArray();
        if (arrays == null || arrays.isEmpty())
            return result;
        int targetIdx = -1;
        PVector<PropertyValue> first = arrays.get(0).getCells();
        for (int i = 0; i < first.size(); i++) {
            if (first.get(i).getKind() == PropertyValue.Kind.PHANDLE) {
                targetIdx = i;
                break;
            }
        }
        if (targetIdx < 0)
            return result;

        for (ArrayValue a : arrays) {
            PVector<PropertyValue> cells = a.getCells();
            int i = 0;
            while (i + targetIdx + 1 < cells.size()) {
                List<IntValue> in = numericCells(cells.subList(i, i + targetIdx));
                if (in == null)
                    break;
                i += targetIdx;
                PropertyValue target = cells.get(i++);
                if (target.getKind() != PropertyValue.Kind.PHANDLE)
                    break;
                int end = i;
                while (end < cells.size() && cells.get(end).isNumeric())
                    end++;
                /* Numbers up to the next phandle include the input cells of the next entry. */
                int outCount = (end == cells.size()) ? end - i : end - i - targetIdx;
                if (outCount < 0)
                    break;
                List<IntValue> out = numericCells(cells.subList(i, i + outCount));
                if (out == null)
                    break;
                result.add(new NexusEntry(in, (PHandle) target, out));
                i += outCount;
            }
        }
        return result;
    }

    /**
     * Returns the name of the property holding the cell count for the
     * specifiers in the given property, without the leading {@code #}.
     *
     * Specifier cell counts come from {@code #XXX-cells}, where XXX is the
     * singular form of the property name, except that {@code *-gpios}
     * properties use {@code #gpio-cells}.
     */
    @CheckForNull
    public static String cellName(@Nonnull String propName) {
        if (propName.endsWith("s")) {
            if (propName.endsWith("-gpios"))
                return "gpio-cells";
            return propName.substring(0, propName.length() - 1) + "-cells";
        }
        if (propName.endsWith("-map"))
            return propName.substring(0, propName.length() - "-map".length()) + "-cells";
        if ("interrupts-extended".equals(propName))
            return "interrupt-cells";
        return null;
    }

    @Nonnull
    private static List<String> fill(int count, @Nonnull String name) {
        return new ArrayList<String>(Collections.nCopies(Math.max(count, 0), name));
    }

    /**
     * Returns the expected name of each cell of each array value, for
     * hover and signature help.
     */
    @Nonnull
    public List<List<String>> cellNames(@Nonnull DtsContext ctx) {
        List<ArrayValue> arrays = getPHandleArray();
        List<List<String>> result = new ArrayList<List<String>>();
        if (arrays == null)
            return result;
        Node node = entry.getNode();
        Node parent = node.getParent();
        for (ArrayValue a : arrays) {
            PVector<PropertyValue> contents = a.getCells();
            if ("reg".equals(name)) {
                List<String> names = fill(parent == null ? 2 : parent.addrCells(), "addr");
                names.addAll(fill(parent == null ? 1 : parent.sizeCells(), "size"));
                result.add(names);
                continue;
            }
            if ("ranges".equals(name)) {
                List<String> names = fill(node.addrCells(), "child-addr");
                names.addAll(fill(parent == null ? 2 : parent.addrCells(), "parent-addr"));
                names.addAll(fill(node.sizeCells(), "size"));
                result.add(names);
                continue;
            }
            if (name.endsWith("s") && parent != null) {
                Property controller = parent.property(name.substring(0, name.length() - 1) + "-parent");
                PHandle handle = (controller == null) ? null : controller.getPHandle();
                Node target = (handle == null) ? null : ctx.lookupNode(handle);
                if (target != null) {
                    int count = target.cellCount(name);
                    List<String> names = new ArrayList<String>();
                    for (int i = 0; i < count; i++)
                        names.add("cell-" + i);
                    NodeType type = target.getType();
                    String cellName = cellName(name);
                    List<String> typed = (type == null || cellName == null) ? null : type.getCells(cellName);
                    if (typed != null)
                        for (int i = 0; i < typed.size() && i < names.size(); i++)
                            names.set(i, typed.get(i));
                    result.add(names);
                    continue;
                }
            }
            if (name.endsWith("-map")) {
                int inputCells = -1;
                for (int i = 0; i < contents.size(); i++) {
                    if (contents.get(i).getKind() == PropertyValue.Kind.PHANDLE) {
                        inputCells = i;
                        break;
                    }
                }
                if (inputCells >= 0) {
                    Node target = ctx.lookupNode((PHandle) contents.get(inputCells));
                    List<String> names = new ArrayList<String>();
                    if ("interrupt-map".equals(name)) {
                        int irqCount = Math.max(node.cells("#interrupt-cells"), 0);
                        names.addAll(fill(inputCells - irqCount, "addr-in"));
                        names.addAll(fill(irqCount, "irq-in"));
                        names.add("&target");
                        if (target != null) {
                            names.addAll(fill(target.addrCells(), "addr-out"));
                            names.addAll(fill(Math.max(target.cells("#interrupt-cells"), 0), "irq-out"));
                        }
                    } else {
                        List<String> inputNames = fill(inputCells, "input");
                        List<String> own = node.refCellNames(name);
                        if (own != null)
                            for (int i = 0; i < own.size() && i < inputCells; i++)
                                inputNames.set(i, own.get(i));
                        names.addAll(inputNames);
                        names.add("&target");
                        List<String> outputNames = (target == null) ? null : target.refCellNames(name);
                        if (outputNames != null)
                            names.addAll(outputNames);
                    }
                    result.add(names);
                    continue;
                }
            }

            /* Names from the referenced nodes. */
            List<String> names = new ArrayList<String>();
            List<String> refCells = new ArrayList<String>();
            for (PropertyValue c : contents) {
                if (c.getKind() == PropertyValue.Kind.PHANDLE) {
                    Node target = ctx.lookupNode((PHandle) c);
                    List<String> cells = (target == null) ? null : target.refCellNames(name);
                    refCells = (cells == null) ? new ArrayList<String>() : new ArrayList<String>(cells);
                    names.add(c.toString());
                } else if (!refCells.isEmpty()) {
                    names.add(refCells.remove(0));
                } else if (contents.size() == 1) {
                    names.add(name.replace("#", "Number of ").replace('-', ' '));
                } else {
                    names.add("cell");
                }
            }
            result.add(names);
        }
        return result;
    }

    @Nonnull
    public PropertyType getType() {
        if (values.isEmpty())
            return PropertyType.INVALID;

        if (values.size() == 1) {
            PropertyValue v = values.get(0);
            switch (v.getKind()) {
                case ARRAY: {
                    ArrayValue a = (ArrayValue) v;
                    if (a.size() == 1) {
                        if (a.getCells().get(0).isNumeric())
                            return PropertyType.INT;
                        if (a.getCells().get(0).getKind() == PropertyValue.Kind.PHANDLE)
                            return PropertyType.PHANDLE;
                        return PropertyType.INVALID;
                    }
                    if (a.size() > 1) {
                        if (a.isPHandleArray())
                            return PropertyType.PHANDLES;
                        if (a.isNumberArray())
                            return PropertyType.ARRAY;
                        return PropertyType.PHANDLE_ARRAY;
                    }
                    return PropertyType.INVALID;
                }
                case STRING:
                    return PropertyType.STRING;
                case BYTESTRING:
                    return PropertyType.UINT8_ARRAY;
                case BOOL:
                    return PropertyType.BOOLEAN;
                case PHANDLE:
                    return PropertyType.PATH;
                default:
                    return PropertyType.INVALID;
            }
        }

        if (allOf(PropertyValue.Kind.ARRAY)) {
            boolean phandles = true;
            boolean numbers = true;
            for (PropertyValue v : values) {
                phandles &= ((ArrayValue) v).isPHandleArray();
                numbers &= ((ArrayValue) v).isNumberArray();
            }
            if (phandles)
                return PropertyType.PHANDLES;
            if (numbers)
                return PropertyType.ARRAY;
            return PropertyType.PHANDLE_ARRAY;
        }

        if (allOf(PropertyValue.Kind.STRING))
            return PropertyType.STRING_ARRAY;

        return PropertyType.COMPOUND;
    }

    /**
     * Returns the values as DTS text. Long lists are wrapped, aligned
     * to the given column.
     */
    @Nonnull
    public String valueString(int indent) {
        if (isBoolean())
            return "true";
        List<String> strings = new ArrayList<String>();
        for (PropertyValue v : values)
            strings.add(v.toString());
        String joined = join(strings, ", ");
        if (strings.size() > 1 && indent + joined.length() > 80) {
            char[] pad = new char[indent];
            Arrays.fill(pad, ' ');
            return join(strings, ",\n" + new String(pad));
        }
        return joined;
    }

    @Nonnull
    private static String join(@Nonnull List<String> parts, @Nonnull String separator) {
        StringBuilder buf = new StringBuilder();
        for (String part : parts) {
            if (buf.length() > 0)
                buf.append(separator);
            buf.append(part);
        }
        return buf.toString();
    }

    /** Returns the declaration as DTS text, without the trailing semicolon. */
    @Nonnull
    public String toString(int indent) {
        if (deleted)
            return "/delete-property/ " + name;
        if (isBoolean())
            return name;
        return name + " = " + valueString(indent + name.length() + 3);
    }

    @Override
    public String toString() {
        return toString(0);
    }
}
