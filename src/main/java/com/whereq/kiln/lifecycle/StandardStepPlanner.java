package com.whereq.kiln.lifecycle;

import com.whereq.kiln.model.ArtifactFormat;
import com.whereq.kiln.model.BuildPhase;
import com.whereq.kiln.scheduler.StepContext;
import com.whereq.kiln.scheduler.StepDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Default step plan of an image build. Every step delegates to the {@link BuildToolchain}.
 *
 * <pre>
 * PARSING              parse-spec
 * VALIDATING           validate-spec
 * RESOLVING            resolve-packages
 * GENERATING           generate-dockerfile, generate-configs (parallel)
 * BUILDING             docker-build
 * ARTIFACT_GENERATING  export-image, generate-iso (only when an ISO is requested)
 * UPLOADING            upload-artifacts
 * </pre>
 */
@Slf4j
@Component
public class StandardStepPlanner implements StepPlanner {

    private final BuildToolchain toolchain;

    public StandardStepPlanner(BuildToolchain toolchain) {
        this.toolchain = toolchain;
    }

    @Override
    public Map<BuildPhase, List<StepDefinition>> plan(BuildContext build) {
        Map<BuildPhase, List<StepDefinition>> plan = new EnumMap<>(BuildPhase.class);

        plan.put(BuildPhase.PARSING, List.of(
            StepDefinition.of("parse-spec", step -> toolchain.prepareWorkspace(build, step))
                .withName("Parse spec")));

        plan.put(BuildPhase.VALIDATING, List.of(
            StepDefinition.of("validate-spec", step -> toolchain.validateSpec(build, step))
                .withName("Validate spec")));

        plan.put(BuildPhase.RESOLVING, List.of(
            StepDefinition.of("resolve-packages",
                    step -> build.setResolvedPackages(toolchain.resolvePackages(build, step)))
                .withName("Resolve packages")));

        plan.put(BuildPhase.GENERATING, List.of(
            StepDefinition.of("generate-dockerfile", step -> toolchain.generateDockerfile(build, step))
                .withName("Generate Dockerfile")
                .withWeight(2),
            StepDefinition.of("generate-configs", step -> toolchain.generateConfigs(build, step))
                .withName("Generate configs")));

        plan.put(BuildPhase.BUILDING, List.of(
            StepDefinition.of("docker-build", step -> toolchain.buildImage(build, step))
                .withName("Build image")
                .withWeight(10)));

        List<StepDefinition> artifactSteps = new ArrayList<>();
        artifactSteps.add(StepDefinition.of("export-image",
                step -> build.addLocalArtifact(ArtifactFormat.DOCKER_IMAGE, toolchain.exportImage(build, step)))
            .withName("Export image")
            .withWeight(3));
        if (build.getSpec().produces(ArtifactFormat.ISO)) {
            artifactSteps.add(StepDefinition.of("generate-iso",
                    step -> build.addLocalArtifact(ArtifactFormat.ISO, toolchain.generateIso(build, step)))
                .withName("Generate ISO")
                .withWeight(5));
        }
        plan.put(BuildPhase.ARTIFACT_GENERATING, artifactSteps);

        plan.put(BuildPhase.UPLOADING, List.of(
            StepDefinition.of("upload-artifacts", step -> upload(build, step))
                .withName("Upload artifacts")));

        log.debug("Planned build {}: {} phases, iso={}", build.getBuildId(), plan.size(),
            build.getSpec().produces(ArtifactFormat.ISO));
        return plan;
    }

    private void upload(BuildContext build, StepContext step) throws Exception {
        if (build.isCacheHit()) {
            build.addUploadedArtifacts(List.of(build.getCachedArtifact()));
            return;
        }
        // primary artifact first: the docker image when there is one
        List<String> localPaths = new ArrayList<>(build.getLocalArtifacts().values());
        build.addUploadedArtifacts(toolchain.uploadArtifacts(build, localPaths, step));
    }
}
