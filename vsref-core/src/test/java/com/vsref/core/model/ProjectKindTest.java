package com.vsref.core.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ProjectKind} and {@link Language}.
 */
class ProjectKindTest {

    @Test
    void fromTypeId_knownGuidsInAnyCaseAndBraces_returnsKind() {
        assertThat(ProjectKind.fromTypeId("FAE04EC0-301F-11D3-BF4B-00C04F79EFBC")).hasValue(ProjectKind.CSHARP);
        assertThat(ProjectKind.fromTypeId("{f184b08f-c81c-45f6-a57f-5abd9991f28f}")).hasValue(ProjectKind.BASIC);
        assertThat(ProjectKind.fromTypeId("f2a71f9b-5d33-465a-a702-920d77279786")).hasValue(ProjectKind.FSHARP);
        assertThat(ProjectKind.fromTypeId("E24C65DC-7377-472B-9ABA-BC803B73C61A")).hasValue(ProjectKind.WEB_SITE);
    }

    @Test
    void fromTypeId_solutionFolderOrNull_returnsEmpty() {
        assertThat(ProjectKind.fromTypeId("2150E333-8FDC-42A3-9474-1A3956D46DE8")).isEmpty();
        assertThat(ProjectKind.fromTypeId(null)).isEmpty();
    }

    @Test
    void language_webSite_hasNone() {
        assertThat(ProjectKind.WEB_SITE.language()).isEmpty();
        assertThat(ProjectKind.WEB_SITE.isProjectFile()).isFalse();
        assertThat(ProjectKind.CSHARP.language()).hasValue(Language.CSHARP);
        assertThat(ProjectKind.CSHARP.isProjectFile()).isTrue();
    }

    @Test
    void language_extensionLookup_isCaseInsensitive() {
        assertThat(Language.fromProjectFileExtension(".VBPROJ")).hasValue(Language.BASIC);
        assertThat(Language.fromSourceFileExtension(".fs")).hasValue(Language.FSHARP);
        assertThat(Language.fromSourceFileExtension(".csproj")).isEmpty();
        assertThat(Language.fromProjectFileExtension("")).isEmpty();
    }
}
