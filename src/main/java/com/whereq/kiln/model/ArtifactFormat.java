package com.whereq.kiln.model;

/**
 * Artifacts a build can be asked to produce
 */
public enum ArtifactFormat {
    /**
     * Exported container image (tarball or registry reference)
     */
    DOCKER_IMAGE,

    /**
     * Bootable installation image
     */
    ISO
}
