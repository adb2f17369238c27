package io.hyperfoil.tools.select.lsp;

import org.junit.Test;

import java.util.Map;
import java.util.Properties;

import static org.junit.Assert.*;

public class ServerSettingsTest {

    @Test
    public void testClasspathDefaults() {
        ServerSettings settings = ServerSettings.load(new Properties());
        assertEquals("Lisp Select Language Server", settings.getServerName());
        assertEquals(64, settings.getSelectionRangeMaxDepth());
        assertTrue(settings.isSelectionRangeIncludeInside());
    }

    @Test
    public void testSystemPropertiesOverride() {
        Properties system = new Properties();
        system.setProperty("lisp-select.selection-range.max-depth", "3");
        system.setProperty("lisp-select.selection-range.include-inside", "false");
        system.setProperty("selection-range.max-depth", "9");
        ServerSettings settings = ServerSettings.load(system);
        assertEquals(3, settings.getSelectionRangeMaxDepth());
        assertFalse(settings.isSelectionRangeIncludeInside());
    }

    @Test
    public void testInvalidDepthFallsBack() {
        Properties props = new Properties();
        props.setProperty(ServerSettings.MAX_DEPTH, "deep");
        assertEquals(64, new ServerSettings(props).getSelectionRangeMaxDepth());
        props.setProperty(ServerSettings.MAX_DEPTH, "0");
        assertEquals(64, new ServerSettings(props).getSelectionRangeMaxDepth());
    }

    @Test
    public void testMissingKeysUseDefaults() {
        ServerSettings settings = new ServerSettings(new Properties());
        assertEquals("Lisp Select Language Server", settings.getServerName());
        assertEquals("0.1.0-SNAPSHOT", settings.getServerVersion());
        assertTrue(settings.isSelectionRangeIncludeInside());
    }

    @Test
    public void testWithLeavesOriginalUnchanged() {
        ServerSettings base = new ServerSettings(new Properties());
        ServerSettings changed = base.with(Map.of(ServerSettings.MAX_DEPTH, "5"));
        assertEquals(5, changed.getSelectionRangeMaxDepth());
        assertEquals(64, base.getSelectionRangeMaxDepth());
    }
}
