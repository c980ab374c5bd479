package com.example.fastercsv;

import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class ConverterPipelineTest extends Assert {

    @Test
    public void testEmptyPipelineLeavesFieldsAlone() {
        ConverterPipeline pipeline = new ConverterPipeline(ConverterRegistry.fieldConverters());
        assertTrue(pipeline.isEmpty());
        assertEquals(Arrays.asList("1", null, "x"), pipeline.apply(Arrays.asList("1", null, "x"), 1));
    }

    @Test
    public void testNumeric() {
        ConverterPipeline pipeline = new ConverterPipeline(ConverterRegistry.fieldConverters());
        pipeline.add("numeric");
        assertEquals(2, pipeline.size());
        assertEquals(Arrays.asList(1L, 2.5, "abc", null, ""),
                pipeline.apply(Arrays.asList("1", "2.5", "abc", null, ""), 1));
    }

    @Test
    public void testAllExpandsNestedCombinations() {
        ConverterPipeline pipeline = new ConverterPipeline(ConverterRegistry.fieldConverters());
        pipeline.add("all");
        assertEquals(3, pipeline.size());
        List<Object> converted = pipeline.apply(Arrays.asList("2006-02-25T10:30:00", "7", "7.5"), 1);
        assertEquals(java.time.LocalDateTime.of(2006, 2, 25, 10, 30), converted.get(0));
        assertEquals(7L, converted.get(1));
        assertEquals(7.5, converted.get(2));
    }

    @Test
    public void testConversionStopsOnceAFieldIsNoLongerAString() {
        List<Object> seen = new ArrayList<>();
        ConverterPipeline pipeline = new ConverterPipeline(ConverterRegistry.fieldConverters());
        pipeline.add("integer");
        pipeline.add((FieldConverter) field -> {
            seen.add(field);
            return field;
        });
        assertEquals(Arrays.asList(5L, "five"), pipeline.apply(Arrays.asList("5", "five"), 1));
        assertEquals(Collections.singletonList("five"), seen);
    }

    @Test
    public void testConvertersRunInOrder() {
        ConverterPipeline pipeline = new ConverterPipeline(ConverterRegistry.fieldConverters());
        pipeline.add((FieldConverter) field -> field + "a");
        pipeline.add((FieldConverter) field -> field + "b");
        assertEquals(Collections.singletonList("xab"), pipeline.apply(Collections.singletonList("x"), 1));
    }

    @Test
    public void testFieldInfoConverterSeesPosition() {
        ConverterPipeline pipeline = new ConverterPipeline(ConverterRegistry.fieldConverters());
        pipeline.add((FieldInfoConverter) (field, info) -> info.getLine() + ":" + info.getIndex() + ":" + field);
        assertEquals(Arrays.asList("3:0:a", "3:1:b"), pipeline.apply(Arrays.asList("a", "b"), 3));
    }

    @Test
    public void testCustomConverterFailurePropagates() {
        ConverterPipeline pipeline = new ConverterPipeline(ConverterRegistry.fieldConverters());
        IllegalStateException failure = new IllegalStateException("boom");
        pipeline.add((FieldConverter) field -> {
            throw failure;
        });
        try {
            pipeline.apply(Collections.singletonList("x"), 1);
            fail();
        } catch (IllegalStateException e) {
            assertSame(failure, e);
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownName() {
        new ConverterPipeline(ConverterRegistry.fieldConverters()).add("no_such_converter");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNotAConverter() {
        new ConverterPipeline(ConverterRegistry.fieldConverters()).addEntry(42);
    }

    @Test
    public void testHeaderRegistryIsSeparate() {
        assertTrue(ConverterRegistry.headerConverters().contains("symbol"));
        assertFalse(ConverterRegistry.headerConverters().contains("numeric"));
        assertFalse(ConverterRegistry.fieldConverters().contains("symbol"));
    }
}
