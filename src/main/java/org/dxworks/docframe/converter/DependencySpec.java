package org.dxworks.docframe.converter;

import java.util.Objects;

/**
 * An optional capability a format needs: the artifact to install, a class whose presence
 * proves it is on the classpath, and an optional version constraint such as {@code ">=5.0"}.
 */
public final class DependencySpec {

    private final String artifact;
    private final String probeClass;
    private final String versionConstraint;

    public DependencySpec(String artifact, String probeClass, String versionConstraint) {
        if (artifact == null || artifact.isBlank()) {
            throw new IllegalArgumentException("Dependency artifact must not be blank");
        }
        if (probeClass == null || probeClass.isBlank()) {
            throw new IllegalArgumentException("Probe class for " + artifact + " must not be blank");
        }
        this.artifact = artifact;
        this.probeClass = probeClass;
        this.versionConstraint = versionConstraint == null || versionConstraint.isBlank() ? null : versionConstraint.trim();
    }

    public static DependencySpec of(String artifact, String probeClass) {
        return new DependencySpec(artifact, probeClass, null);
    }

    public String getArtifact() {
        return artifact;
    }

    public String getProbeClass() {
        return probeClass;
    }

    /** Null when any installed version is acceptable. */
    public String getVersionConstraint() {
        return versionConstraint;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DependencySpec other)) return false;
        return artifact.equals(other.artifact) && probeClass.equals(other.probeClass)
                && Objects.equals(versionConstraint, other.versionConstraint);
    }

    @Override
    public int hashCode() {
        return Objects.hash(artifact, probeClass, versionConstraint);
    }

    @Override
    public String toString() {
        return versionConstraint == null ? artifact : artifact + versionConstraint;
    }
}
