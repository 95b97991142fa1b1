package com.vsref.core.project;

import com.vsref.core.VsRefTestBase;
import com.vsref.core.error.NotFoundException;
import com.vsref.core.model.SourceFile;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Functional tests for {@link WebSiteDirectory}.
 */
class WebSiteDirectoryTest extends VsRefTestBase {

    @Test
    void load_nestedSources_collectsByLanguage() throws IOException {
        // Given
        createFile("Site/Default.aspx.cs", "");
        createFile("Site/App_Code/Helper.vb", "");
        createFile("Site/App_Code/Data/Repository.cs", "");
        createFile("Site/web.config", "");

        // When
        WebSiteDirectory site = new WebSiteDirectory("Site", tempDir.resolve("Site"));
        site.load();

        // Then
        assertThat(site.csharpSourceFiles()).extracting(SourceFile::fileName)
            .containsExactlyInAnyOrder("Default.aspx.cs", "Repository.cs");
        assertThat(site.basicSourceFiles()).extracting(SourceFile::fileName).containsExactly("Helper.vb");
    }

    @Test
    void load_missingDirectory_throwsNotFound() {
        WebSiteDirectory site = new WebSiteDirectory("Site", tempDir.resolve("Missing"));

        assertThatThrownBy(site::load)
            .isInstanceOf(NotFoundException.class)
            .hasMessageContaining("Directory");
    }

    @Test
    void load_calledTwice_replacesSources() throws IOException {
        Path dir = createDirectory("Site");
        createFile("Site/First.cs", "");
        WebSiteDirectory site = new WebSiteDirectory("Site", dir);
        site.load();

        createFile("Site/Second.cs", "");
        site.load();

        assertThat(site.csharpSourceFiles()).extracting(SourceFile::fileName).containsExactly("First.cs", "Second.cs");
    }

    @Test
    void constructor_windowsPath_convertsSeparators() {
        WebSiteDirectory site = new WebSiteDirectory("Site", "Sites\\Site");

        assertThat(site.directoryPath()).isEqualTo(Path.of("Sites", "Site"));
    }

    @Test
    void constructor_blankArguments_throwIllegalArgument() {
        assertThatThrownBy(() -> new WebSiteDirectory(" ", "Site")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new WebSiteDirectory("Site", "")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void equals_sameNameAndDirectory_isEqualByValue() throws IOException {
        Path dir = createDirectory("Site");
        createFile("Site/Default.aspx.cs", "");
        WebSiteDirectory loaded = new WebSiteDirectory("Site", dir);
        loaded.load();

        assertThat(loaded).isEqualTo(new WebSiteDirectory("Site", dir))
            .hasSameHashCodeAs(new WebSiteDirectory("Site", dir))
            .isNotEqualTo(new WebSiteDirectory("Other", dir));
    }
}
