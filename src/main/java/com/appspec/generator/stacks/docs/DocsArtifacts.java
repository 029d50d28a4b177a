package com.appspec.generator.stacks.docs;

import java.util.List;

import com.appspec.generator.codegen.artifact.ArtifactKey;

public final class DocsArtifacts {

    public static final ArtifactKey<List<DocPage>> ENTITY_PAGES = ArtifactKey.listOf("docs.entity_pages", DocPage.class);

    public static final ArtifactKey<List<DocPage>> SURFACE_PAGES = ArtifactKey.listOf("docs.surface_pages", DocPage.class);

    public static final ArtifactKey<List<DocPage>> WORKSPACE_PAGES =
            ArtifactKey.listOf("docs.workspace_pages", DocPage.class);

    private DocsArtifacts() {
    }
}
