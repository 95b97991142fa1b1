package com.vsref.cli;

import com.vsref.core.model.ProjectKind;
import com.vsref.core.solution.PathResolverRegistration;
import com.vsref.core.solution.ProjectPathResolvers;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * Command to list the supported project types and the registered path resolvers.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * vsref list
 * }</pre>
 */
@Command(
    name = "list",
    description = "List supported project types and path resolvers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    @Override
    public Integer call() {
        System.out.println("Supported Project Types:");
        System.out.println();

        for (ProjectKind kind : ProjectKind.values()) {
            String name = kind.language().map(language -> language.displayName() + " project").orElse("Web site");
            System.out.printf("  • %s (GUID: {%s})%n", name, kind.typeId());
            kind.language().ifPresent(language -> System.out.printf("    Extensions: %s, %s%n",
                language.projectFileExtension(), language.sourceFileExtension()));
        }

        System.out.println();
        System.out.println("Path Resolvers:");
        System.out.println();

        for (PathResolverRegistration registration : ProjectPathResolvers.registrations()) {
            String kind = ProjectKind.fromTypeId(registration.typeId()).map(Enum::name).orElse("?");
            System.out.printf("  • %s for %s (from format version %d)%n",
                registration.factory().get().getClass().getSimpleName(), kind,
                registration.minimumFormatVersion());
        }

        return 0;
    }
}
