package com.example.fastercsv;

import org.junit.Assert;
import org.junit.Test;

import java.util.Collections;

public class ConverterRegistryTest extends Assert {

    @Test
    public void testRegisteringNames() {
        ConverterRegistry registry = new ConverterRegistry()
                .register("upcase", (FieldConverter) field -> ((String) field).toUpperCase())
                .register("tagged", (FieldInfoConverter) (field, info) -> field + "@" + info.getIndex())
                .registerCombination("both", "upcase", "tagged")
                .registerCombination("twice", "both", "both");
        assertTrue(registry.contains("twice"));
        assertEquals(4, registry.resolve("twice").size());

        ConverterPipeline pipeline = new ConverterPipeline(registry);
        pipeline.add("both");
        assertEquals(Collections.singletonList("X@0"), pipeline.apply(Collections.singletonList("x"), 1));
    }

    @Test
    public void testReplacingAName() {
        ConverterRegistry registry = new ConverterRegistry()
                .registerCombination("name", "a", "b")
                .register("name", (FieldConverter) field -> "replaced");
        assertEquals(1, registry.resolve("name").size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testCombinationWithUnknownName() {
        new ConverterRegistry().registerCombination("broken", "missing").resolve("broken");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSelfReferencingCombination() {
        new ConverterRegistry().registerCombination("loop", "loop").resolve("loop");
    }

    @Test
    public void testGlobalRegistryCanBeExtended() throws Exception {
        ConverterRegistry.fieldConverters().register("test_reverse",
                (FieldConverter) field -> new StringBuilder((String) field).reverse().toString());
        CsvOptions options = CsvOptions.defaults().withConverters("test_reverse");
        assertEquals(java.util.Arrays.asList("cba", "fed"), FasterCsv.parseLine("abc,def", options));
    }
}
