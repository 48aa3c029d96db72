package com.whereq.kiln.lifecycle;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableTable;
import com.whereq.kiln.exception.BuildCancelledException;
import com.whereq.kiln.exception.StepExecutionException;
import com.whereq.kiln.model.Distro;
import com.whereq.kiln.model.InitSystem;
import com.whereq.kiln.scheduler.StepContext;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Toolchain that performs no real work: it maps packages, checks the spec and
 * hands out artifact references as if docker and the ISO tooling had run.
 * Used when no real toolchain bean is configured.
 */
@Slf4j
public class SimulatedBuildToolchain implements BuildToolchain {

    private static final Set<String> FILESYSTEMS = ImmutableSet.of("ext4", "btrfs", "xfs", "f2fs");

    private static final ImmutableTable<String, Distro, String> PACKAGE_NAMES =
        ImmutableTable.<String, Distro, String>builder()
            .put("docker", Distro.DEBIAN, "docker.io")
            .put("docker", Distro.UBUNTU, "docker.io")
            .put("docker", Distro.FEDORA, "docker-ce")
            .put("docker", Distro.GENTOO, "app-containers/docker")
            .put("python", Distro.DEBIAN, "python3")
            .put("python", Distro.UBUNTU, "python3")
            .put("python", Distro.ALPINE, "python3")
            .put("python", Distro.FEDORA, "python3")
            .put("python", Distro.GENTOO, "dev-lang/python")
            .put("go", Distro.DEBIAN, "golang")
            .put("go", Distro.UBUNTU, "golang")
            .put("go", Distro.FEDORA, "golang")
            .put("java", Distro.ARCH, "jdk-openjdk")
            .put("java", Distro.DEBIAN, "default-jdk")
            .put("java", Distro.UBUNTU, "default-jdk")
            .put("java", Distro.ALPINE, "openjdk17")
            .put("java", Distro.FEDORA, "java-17-openjdk")
            .put("networkmanager", Distro.DEBIAN, "network-manager")
            .put("networkmanager", Distro.UBUNTU, "network-manager")
            .put("networkmanager", Distro.FEDORA, "NetworkManager")
            .put("wireguard", Distro.ARCH, "wireguard-tools")
            .put("wireguard", Distro.ALPINE, "wireguard-tools")
            .put("wireguard", Distro.FEDORA, "wireguard-tools")
            .build();

    private final Clock clock;
    private final Duration stepDelay;

    public SimulatedBuildToolchain(Clock clock, Duration stepDelay) {
        this.clock = clock;
        this.stepDelay = stepDelay;
    }

    @Override
    public void prepareWorkspace(BuildContext build, StepContext step) {
        work(build, step);
        log.debug("[{}] Workspace {} prepared", build.getBuildId(), workspace(build));
    }

    @Override
    public void validateSpec(BuildContext build, StepContext step) {
        work(build, step);
        if (!FILESYSTEMS.contains(build.getSpec().getFilesystem())) {
            throw new StepExecutionException("Unsupported filesystem: " + build.getSpec().getFilesystem());
        }
        if (build.getSpec().getInit() == InitSystem.SYSTEMD && build.getSpec().getBase() == Distro.ALPINE) {
            throw new StepExecutionException("systemd is not available on alpine");
        }
    }

    @Override
    public List<String> resolvePackages(BuildContext build, StepContext step) {
        work(build, step);
        Distro distro = build.getSpec().getBase();
        List<String> resolved = new ArrayList<>();
        for (String pkg : build.getSpec().getPackages()) {
            String mapped = PACKAGE_NAMES.get(pkg, distro);
            resolved.add(mapped != null ? mapped : pkg);
        }
        log.debug("[{}] Resolved {} packages for {}", build.getBuildId(), resolved.size(), distro);
        return resolved;
    }

    @Override
    public void generateDockerfile(BuildContext build, StepContext step) {
        work(build, step);
    }

    @Override
    public void generateConfigs(BuildContext build, StepContext step) {
        work(build, step);
    }

    @Override
    public void buildImage(BuildContext build, StepContext step) {
        work(build, step);
        log.debug("[{}] Image built with memory={}, cpus={}, pids={}", build.getBuildId(),
            build.getLimits().getMemory(), build.getLimits().getCpus(), build.getLimits().getPidsLimit());
    }

    @Override
    public String exportImage(BuildContext build, StepContext step) {
        work(build, step);
        return workspace(build) + "/image.tar";
    }

    @Override
    public String generateIso(BuildContext build, StepContext step) {
        work(build, step);
        return workspace(build) + "/" + imageName(build) + ".iso";
    }

    @Override
    public List<String> uploadArtifacts(BuildContext build, List<String> localPaths, StepContext step) {
        work(build, step);
        List<String> refs = new ArrayList<>();
        for (String path : localPaths) {
            refs.add("kiln://artifacts/" + build.getSpecHash() + "/" + path.substring(path.lastIndexOf('/') + 1));
        }
        return refs;
    }

    @Override
    public void cleanup(BuildContext build) {
        log.debug("[{}] Workspace {} removed", build.getBuildId(), workspace(build));
    }

    private void work(BuildContext build, StepContext step) {
        if (step.isCancelled()) {
            throw new BuildCancelledException(build.getBuildId());
        }
        if (build.isPastDeadline(clock.instant())) {
            throw new StepExecutionException("Build exceeded its " + build.getLimits().getTimeout().toSeconds()
                + "s time limit in step " + step.getStepId());
        }
        if (!stepDelay.isZero()) {
            try {
                Thread.sleep(stepDelay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new StepExecutionException("Interrupted in step " + step.getStepId(), e);
            }
        }
    }

    private String workspace(BuildContext build) {
        return "/tmp/kiln/" + build.getBuildId() + "-" + build.getAttempt();
    }

    private String imageName(BuildContext build) {
        return build.getSpec().getName() != null
            ? build.getSpec().getName().replaceAll("[^A-Za-z0-9._-]", "-")
            : build.getSpec().getBase().name().toLowerCase(Locale.ROOT) + "-" + build.getSpecHash();
    }
}
