package com.cso.plugin;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PluginOptionsTest {

    @Test
    void getString_treatsBlankAsAbsent() {
        Map<String, Object> options = Map.of("a", "  ", "b", 12);

        assertNull(PluginOptions.getString(options, "a"));
        assertEquals("12", PluginOptions.getString(options, "b"));
        assertEquals("dflt", PluginOptions.getString(options, "c", "dflt"));
    }

    @Test
    void getBoolean_acceptsStringsAndBooleans() {
        Map<String, Object> options = Map.of("t", true, "s", "TRUE", "one", "1", "f", "no");

        assertTrue(PluginOptions.getBoolean(options, "t", false));
        assertTrue(PluginOptions.getBoolean(options, "s", false));
        assertTrue(PluginOptions.getBoolean(options, "one", false));
        assertFalse(PluginOptions.getBoolean(options, "f", true));
        assertTrue(PluginOptions.getBoolean(options, "missing", true));
    }

    @Test
    void getStringList_splitsScalarsAndCopiesLists() {
        Map<String, Object> options = Map.of(
                "list", List.of("linux/amd64", "darwin/arm64"),
                "csv", "a, b,,c");

        assertEquals(List.of("linux/amd64", "darwin/arm64"), PluginOptions.getStringList(options, "list"));
        assertEquals(List.of("a", "b", "c"), PluginOptions.getStringList(options, "csv"));
        assertEquals(List.of(), PluginOptions.getStringList(options, "none"));
    }

    @Test
    void getStringMap_convertsValues() {
        Map<String, Object> options = Map.of("args", Map.of("NODE_ENV", "production", "PORT", 8080));

        Map<String, String> args = PluginOptions.getStringMap(options, "args");

        assertEquals("production", args.get("NODE_ENV"));
        assertEquals("8080", args.get("PORT"));
        assertEquals(Map.of(), PluginOptions.getStringMap(options, "missing"));
    }

    @Test
    void getInt_fallsBackOnGarbage() {
        assertEquals(3, PluginOptions.getInt(Map.of("n", "3"), "n", 1));
        assertEquals(1, PluginOptions.getInt(Map.of("n", "x"), "n", 1));
    }
}
