package io.github.eutro.exnorm.conf;

import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Project-wide configuration consulted by the passes that need it.
 * <p>
 * Instances are immutable, and are built once per normalization, then handed to
 * passes through their constructors.
 */
public final class NormalizerConfig {
    /**
     * Names that are never discarded or renamed, because framework code reads them implicitly.
     */
    public static final Set<String> DEFAULT_RESERVED_NAMES = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(
            "socket", "conn", "assigns", "params", "session", "state", "env", "__MODULE__", "__CALLER__"
    )));

    /**
     * Descriptive replacements for a numeric-suffixed name whose base is taken, in order of preference.
     */
    public static final List<String> DEFAULT_ALTERNATIVE_NAMES = Collections.unmodifiableList(Arrays.asList(
            "value", "item", "elem", "entry", "current", "result", "other", "next"
    ));

    /**
     * Bare module names generated code refers to, which live under the project namespace.
     */
    public static final Set<String> DEFAULT_APP_LOCAL_MODULES = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(
            "Repo", "PubSub", "Endpoint", "Router", "Telemetry", "Mailer", "Gettext"
    )));

    public static final NormalizerConfig DEFAULT = builder().build();

    @Nullable
    private final String projectModule;
    private final Set<String> reservedNames;
    private final List<String> tempPrefixes;
    private final List<String> alternativeNames;
    private final Set<String> appLocalModules;

    private NormalizerConfig(Builder builder) {
        this.projectModule = builder.projectModule;
        this.reservedNames = Collections.unmodifiableSet(new LinkedHashSet<>(builder.reservedNames));
        this.tempPrefixes = Collections.unmodifiableList(new ArrayList<>(builder.tempPrefixes));
        this.alternativeNames = Collections.unmodifiableList(new ArrayList<>(builder.alternativeNames));
        this.appLocalModules = Collections.unmodifiableSet(new LinkedHashSet<>(builder.appLocalModules));
    }

    /**
     * The root module of the project, such as {@code MyApp}, or null if unknown.
     *
     * @return The module name.
     */
    @Nullable
    public String getProjectModule() {
        return projectModule;
    }

    public Set<String> getReservedNames() {
        return reservedNames;
    }

    public boolean isReserved(String name) {
        return reservedNames.contains(name);
    }

    /**
     * Extra prefixes marking compiler temporaries, on top of the built-in naming conventions.
     *
     * @return The prefixes.
     */
    public List<String> getTempPrefixes() {
        return tempPrefixes;
    }

    public List<String> getAlternativeNames() {
        return alternativeNames;
    }

    public Set<String> getAppLocalModules() {
        return appLocalModules;
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "NormalizerConfig{" +
                "projectModule=" + projectModule +
                ", reservedNames=" + reservedNames +
                ", tempPrefixes=" + tempPrefixes +
                ", alternativeNames=" + alternativeNames +
                ", appLocalModules=" + appLocalModules +
                '}';
    }

    public static class Builder {
        @Nullable
        private String projectModule;
        private final Set<String> reservedNames;
        private final List<String> tempPrefixes;
        private final List<String> alternativeNames;
        private final Set<String> appLocalModules;

        private Builder() {
            reservedNames = new LinkedHashSet<>(DEFAULT_RESERVED_NAMES);
            tempPrefixes = new ArrayList<>();
            alternativeNames = new ArrayList<>(DEFAULT_ALTERNATIVE_NAMES);
            appLocalModules = new LinkedHashSet<>(DEFAULT_APP_LOCAL_MODULES);
        }

        private Builder(NormalizerConfig config) {
            projectModule = config.projectModule;
            reservedNames = new LinkedHashSet<>(config.reservedNames);
            tempPrefixes = new ArrayList<>(config.tempPrefixes);
            alternativeNames = new ArrayList<>(config.alternativeNames);
            appLocalModules = new LinkedHashSet<>(config.appLocalModules);
        }

        public Builder setProjectModule(@Nullable String projectModule) {
            this.projectModule = projectModule;
            return this;
        }

        public Builder addReservedName(String name) {
            reservedNames.add(Objects.requireNonNull(name));
            return this;
        }

        public Builder addTempPrefix(String prefix) {
            if (prefix.isEmpty()) throw new IllegalArgumentException("empty temporary prefix");
            tempPrefixes.add(prefix);
            return this;
        }

        public Builder setAlternativeNames(List<String> names) {
            alternativeNames.clear();
            alternativeNames.addAll(names);
            return this;
        }

        public Builder addAppLocalModule(String module) {
            appLocalModules.add(Objects.requireNonNull(module));
            return this;
        }

        public NormalizerConfig build() {
            return new NormalizerConfig(this);
        }
    }
}
