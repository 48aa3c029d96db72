package com.whereq.kiln.lifecycle;

import com.whereq.kiln.scheduler.StepContext;

import java.util.List;

/**
 * The external tooling behind the standard build steps (package mapping,
 * Dockerfile generation, docker, ISO assembly, artifact storage).
 *
 * <p>Implementations own their subprocesses: they enforce the tier limits and the
 * deadline carried by the {@link BuildContext}, and stop their work when
 * {@link StepContext#isCancelled()} turns true. Failures are reported by throwing,
 * typically a {@link com.whereq.kiln.exception.StepExecutionException}.
 */
public interface BuildToolchain {

    /**
     * Create the workspace and write the normalized spec into it
     */
    void prepareWorkspace(BuildContext build, StepContext step) throws Exception;

    /**
     * Check the spec against what the base distribution supports
     */
    void validateSpec(BuildContext build, StepContext step) throws Exception;

    /**
     * Map generic package names onto distribution package names
     */
    List<String> resolvePackages(BuildContext build, StepContext step) throws Exception;

    void generateDockerfile(BuildContext build, StepContext step) throws Exception;

    /**
     * Init system, service and filesystem configuration files
     */
    void generateConfigs(BuildContext build, StepContext step) throws Exception;

    void buildImage(BuildContext build, StepContext step) throws Exception;

    /**
     * @return local path of the exported image tarball
     */
    String exportImage(BuildContext build, StepContext step) throws Exception;

    /**
     * @return local path of the bootable ISO
     */
    String generateIso(BuildContext build, StepContext step) throws Exception;

    /**
     * @param localPaths artifacts produced by this attempt
     * @return durable references of the uploaded artifacts, primary artifact first
     */
    List<String> uploadArtifacts(BuildContext build, List<String> localPaths, StepContext step) throws Exception;

    /**
     * Remove the workspace of a build attempt. Called once per attempt, whatever the outcome.
     */
    void cleanup(BuildContext build);
}
