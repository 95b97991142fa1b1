package com.vsref.core.model;

import com.vsref.core.VsRefTestBase;
import com.vsref.core.error.NotFoundException;
import com.vsref.core.error.WrongExtensionException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link VisualStudioFile}.
 */
class VisualStudioFileTest extends VsRefTestBase {

    @Test
    void of_windowsPath_convertsSeparators() {
        VisualStudioFile file = VisualStudioFile.of("src\\App\\App.csproj", ".csproj");

        assertThat(file.path()).isEqualTo(Paths.get("src", "App", "App.csproj"));
        assertThat(file.fileName()).isEqualTo("App.csproj");
        assertThat(file.fileNameNoExtension()).isEqualTo("App");
    }

    @Test
    void directory_bareFileName_isCurrentDirectory() {
        VisualStudioFile file = VisualStudioFile.of("App.sln", ".sln");

        assertThat(file.directory()).isEqualTo(Paths.get("").toAbsolutePath());
    }

    @Test
    void resolve_relativeWindowsPath_isJoinedToDirectory() {
        VisualStudioFile file = new VisualStudioFile(tempDir.resolve("App.sln"), ".sln");

        assertThat(file.resolve("Lib\\Lib.vbproj")).isEqualTo(tempDir.resolve("Lib").resolve("Lib.vbproj"));
    }

    @Test
    void checkLoadable_existingFileWithExpectedExtension_passes() throws IOException {
        Path sln = createFile("App.Sln", "");

        assertThatCode(() -> new VisualStudioFile(sln, ".sln").checkLoadable()).doesNotThrowAnyException();
    }

    @Test
    void checkLoadable_missingFile_throwsNotFound() {
        VisualStudioFile file = new VisualStudioFile(tempDir.resolve("App.sln"), ".sln");

        assertThatThrownBy(file::checkLoadable).isInstanceOf(NotFoundException.class);
    }

    @Test
    void checkLoadable_directory_throwsNotFound() throws IOException {
        Path dir = createDirectory("Folder.sln");

        assertThatThrownBy(() -> new VisualStudioFile(dir, ".sln").checkLoadable())
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    void checkLoadable_otherExtension_throwsWrongExtension() throws IOException {
        Path file = createFile("App.csproj", "");

        assertThatThrownBy(() -> new VisualStudioFile(file, ".sln").checkLoadable())
            .isInstanceOf(WrongExtensionException.class);
    }

    @Test
    void of_blankPath_throwsIllegalArgument() {
        assertThatThrownBy(() -> VisualStudioFile.of("", ".sln")).isInstanceOf(IllegalArgumentException.class);
    }
}
