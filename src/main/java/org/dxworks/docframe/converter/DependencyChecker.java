package org.dxworks.docframe.converter;

import org.dxworks.docframe.exception.DependencyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Checks that the optional libraries a format needs are on the classpath in an acceptable version.
 * <p>
 * A library counts as present when its probe class loads. Its version comes from an explicit
 * override, else from the {@code Implementation-Version} of the jar that holds the probe class.
 * When neither is known the version constraint is not enforced.
 */
public class DependencyChecker {

    private static final Logger LOG = LoggerFactory.getLogger(DependencyChecker.class);

    private final ClassLoader classLoader;
    private final Map<String, String> versionOverrides = new ConcurrentHashMap<>();

    public DependencyChecker() {
        this(DependencyChecker.class.getClassLoader());
    }

    public DependencyChecker(ClassLoader classLoader) {
        this.classLoader = classLoader;
    }

    /**
     * Pins the version reported for {@code artifact}, for libraries whose jars carry no version.
     */
    public void setInstalledVersion(String artifact, String version) {
        versionOverrides.put(artifact, version);
    }

    public boolean isAvailable(DependencySpec dependency) {
        return loadProbe(dependency).isPresent();
    }

    public Optional<String> installedVersion(DependencySpec dependency) {
        String override = versionOverrides.get(dependency.getArtifact());
        if (override != null) {
            return Optional.of(override);
        }
        return loadProbe(dependency)
                .map(Class::getPackage)
                .map(Package::getImplementationVersion);
    }

    /**
     * Describes every unsatisfied dependency, e.g. {@code "org.apache.poi:poi-ooxml>=5.0 (not installed)"}.
     * Empty when all are satisfied.
     */
    public List<String> findMissing(List<DependencySpec> dependencies) {
        List<String> missing = new ArrayList<>();
        for (DependencySpec dependency : dependencies) {
            if (!isAvailable(dependency)) {
                missing.add(dependency + " (not installed)");
                continue;
            }
            if (dependency.getVersionConstraint() == null) {
                continue;
            }
            VersionConstraint constraint = VersionConstraint.parse(dependency.getVersionConstraint());
            Optional<String> version = installedVersion(dependency);
            if (version.isEmpty()) {
                LOG.debug("Version of {} is unknown, not enforcing {}", dependency.getArtifact(), constraint);
            } else if (!constraint.isSatisfiedBy(version.get())) {
                missing.add(dependency + " (installed " + version.get() + ")");
            }
        }
        return missing;
    }

    /**
     * @throws DependencyException naming the format and the unsatisfied dependencies
     */
    public void check(String formatName, List<DependencySpec> dependencies) {
        List<String> missing = findMissing(dependencies);
        if (!missing.isEmpty()) {
            throw new DependencyException(formatName, missing, remediationHint(formatName, dependencies));
        }
    }

    static String remediationHint(String formatName, List<DependencySpec> dependencies) {
        String artifacts = dependencies.stream()
                .map(DependencySpec::toString)
                .collect(Collectors.joining(", "));
        return "Add " + artifacts + " to the classpath (e.g. as Maven dependencies) to enable the '"
                + formatName + "' format.";
    }

    private Optional<Class<?>> loadProbe(DependencySpec dependency) {
        try {
            return Optional.of(Class.forName(dependency.getProbeClass(), false, classLoader));
        } catch (ClassNotFoundException | LinkageError e) {
            LOG.debug("Probe class {} for {} not loadable: {}", dependency.getProbeClass(),
                    dependency.getArtifact(), e.toString());
            return Optional.empty();
        }
    }
}
