package com.backport.transpiler.config;

import java.util.Set;

import com.backport.transpiler.version.Version;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Build settings for one transpile run.
 * An empty allowlist means "everything required for the target version".
 */
@Value
@Builder(toBuilder = true)
public class BuildConfig {

    @NonNull
    Version targetVersion;

    /**
     * Bypass any cache kept by the caller.
     */
    boolean force;

    @Singular("fixer")
    Set<String> fixerAllowlist;

    @Singular("checker")
    Set<String> checkerAllowlist;

    public static BuildConfig forTarget(String version) {
        return BuildConfig.builder().targetVersion(Version.parse(version)).build();
    }

    public boolean hasFixerAllowlist() {
        return !fixerAllowlist.isEmpty();
    }

    public boolean hasCheckerAllowlist() {
        return !checkerAllowlist.isEmpty();
    }
}
