package com.cso.plugin.goreleaser;

import com.cso.plugin.PluginConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GoReleaserBuilderTest {

    @Test
    void command_stampsVersionAndAppendsBuildArgs() throws Exception {
        GoReleaserBuilder builder = new GoReleaserBuilder();
        builder.configure(Map.of(
                "name", "cs",
                "path", "./cmd/cs",
                "version", "1.4.0",
                "ldflags", "-X main.commit=abc",
                "build_args", Map.of("trimpath", "true")));

        assertEquals(List.of("go", "build",
                "-ldflags", "-s -w -X main.Version=1.4.0 -X main.version=1.4.0 -X main.commit=abc",
                "-o", "dist/cs-linux-amd64", "-trimpath=true", "./cmd/cs"), builder.command("dist/cs-linux-amd64"));
    }

    @Test
    void binaryName_addsExeForWindows() throws Exception {
        GoReleaserBuilder builder = new GoReleaserBuilder();
        builder.configure(Map.of("name", "cs"));

        assertEquals("cs-windows-amd64.exe", builder.binaryName("windows", "amd64"));
        assertEquals("cs-darwin-arm64", builder.binaryName("darwin", "arm64"));
        assertEquals("-s -w", builder.ldflags());
    }

    @Test
    void configure_rejectsMalformedTarget() {
        PluginConfigurationException e = assertThrows(PluginConfigurationException.class,
                () -> new GoReleaserBuilder().configure(Map.of("name", "cs", "targets", List.of("linux"))));
        assertTrue(e.getMessage().contains("GOOS/GOARCH"));
    }

    @Test
    void configure_requiresName() {
        assertThrows(PluginConfigurationException.class, () -> new GoReleaserBuilder().configure(Map.of()));
    }
}
