package com.whereq.kiln.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Declarative build specification. Immutable once a job is admitted:
 * the queue only ever hands out the normalized copy.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BuildSpec implements Serializable {
    private static final long serialVersionUID = 1L;

    private static final String PACKAGE_NAME = "^[A-Za-z0-9][A-Za-z0-9+._@-]*$";

    /**
     * Optional display name of the image
     */
    @Size(max = 64)
    private String name;

    /**
     * Base distribution
     */
    @NotNull
    private Distro base;

    @Builder.Default
    private Architecture architecture = Architecture.X86_64;

    /**
     * Kernel flavour, e.g. linux-lts, linux-zen, linux-hardened
     */
    @NotBlank
    @Builder.Default
    private String kernel = "linux-lts";

    @Builder.Default
    private InitSystem init = InitSystem.SYSTEMD;

    /**
     * Root filesystem type
     */
    @NotBlank
    @Builder.Default
    private String filesystem = "ext4";

    /**
     * Generic package names, mapped per distribution by the toolchain
     */
    @Builder.Default
    private List<@Pattern(regexp = PACKAGE_NAME) String> packages = new ArrayList<>();

    /**
     * Services enabled at boot
     */
    @Builder.Default
    private List<@Pattern(regexp = PACKAGE_NAME) String> services = new ArrayList<>();

    /**
     * Artifacts to produce
     */
    @NotEmpty
    @Builder.Default
    private Set<ArtifactFormat> outputs = EnumSet.of(ArtifactFormat.DOCKER_IMAGE);

    /**
     * Canonical form: defaults filled, names lower-cased, lists sorted and de-duplicated.
     * Two specs that differ only in ordering normalize to equal values.
     */
    public BuildSpec normalized() {
        return BuildSpec.builder()
            .name(name == null || name.isBlank() ? null : name.trim())
            .base(base)
            .architecture(architecture != null ? architecture : Architecture.X86_64)
            .kernel(lower(kernel, "linux-lts"))
            .init(init != null ? init : InitSystem.SYSTEMD)
            .filesystem(lower(filesystem, "ext4"))
            .packages(sortedUnique(packages))
            .services(sortedUnique(services))
            .outputs(outputs == null || outputs.isEmpty()
                ? EnumSet.of(ArtifactFormat.DOCKER_IMAGE)
                : EnumSet.copyOf(outputs))
            .build();
    }

    /**
     * Deep copy; the copy shares no collections with this spec
     */
    public BuildSpec copy() {
        return toBuilder()
            .packages(packages == null ? null : new ArrayList<>(packages))
            .services(services == null ? null : new ArrayList<>(services))
            .outputs(outputs == null ? null : copyOutputs(outputs))
            .build();
    }

    private static Set<ArtifactFormat> copyOutputs(Set<ArtifactFormat> outputs) {
        Set<ArtifactFormat> copy = EnumSet.noneOf(ArtifactFormat.class);
        copy.addAll(outputs);
        return copy;
    }

    public boolean produces(ArtifactFormat format) {
        return outputs != null && outputs.contains(format);
    }

    private static String lower(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim().toLowerCase(Locale.ROOT);
    }

    private static List<String> sortedUnique(Collection<String> values) {
        if (values == null) {
            return new ArrayList<>();
        }
        Set<String> sorted = new TreeSet<>();
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                sorted.add(value.trim().toLowerCase(Locale.ROOT));
            }
        }
        return new ArrayList<>(sorted);
    }
}
