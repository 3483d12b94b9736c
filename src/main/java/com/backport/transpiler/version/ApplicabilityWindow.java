package com.backport.transpiler.version;

import java.util.Optional;

import com.backport.transpiler.exception.ConfigurationException;

import lombok.Getter;

/**
 * Versions for which a fixer (or checker) must run, and versions for which
 * running it is harmless.
 *
 * <p>The apply window {@code [applySince, applyUntil]} is where the rewrite is
 * required for correct output. The works window {@code [worksSince, worksUntil]}
 * is where running it does not break anything; {@code worksSince} defaults to
 * {@code applySince} and an absent {@code worksUntil} is open-ended.
 */
@Getter
public final class ApplicabilityWindow {

    private final Version applySince;
    private final Version applyUntil;
    private final Version worksSince;
    private final Version worksUntil;

    private ApplicabilityWindow(Version applySince, Version applyUntil, Version worksSince, Version worksUntil) {
        this.applySince = applySince;
        this.applyUntil = applyUntil;
        this.worksSince = worksSince != null ? worksSince : applySince;
        this.worksUntil = worksUntil;
        checkInvariants();
    }

    public static ApplicabilityWindow of(String applySince, String applyUntil) {
        return new ApplicabilityWindow(Version.parse(applySince), Version.parse(applyUntil), null, null);
    }

    public static ApplicabilityWindow of(String applySince, String applyUntil, String worksSince, String worksUntil) {
        return new ApplicabilityWindow(
                Version.parse(applySince),
                Version.parse(applyUntil),
                worksSince != null ? Version.parse(worksSince) : null,
                worksUntil != null ? Version.parse(worksUntil) : null);
    }

    private void checkInvariants() {
        if (applySince.compareTo(applyUntil) > 0) {
            throw new ConfigurationException("Impossible version window: apply since " + applySince
                    + " is after apply until " + applyUntil);
        }
        if (worksSince.compareTo(applySince) > 0) {
            throw new ConfigurationException("Impossible version window: works since " + worksSince
                    + " is after apply since " + applySince);
        }
        if (worksUntil != null && worksUntil.compareTo(applyUntil) < 0) {
            throw new ConfigurationException("Impossible version window: works until " + worksUntil
                    + " is before apply until " + applyUntil);
        }
    }

    public Optional<Version> getWorksUntil() {
        return Optional.ofNullable(worksUntil);
    }

    /**
     * True if the rewrite is mandatory for the given target.
     */
    public boolean isRequiredFor(Version version) {
        return applySince.isAtMost(version) && version.isAtMost(applyUntil);
    }

    /**
     * True if running the rewrite for the given target keeps output correct.
     */
    public boolean isCompatibleWith(Version version) {
        return worksSince.isAtMost(version) && (worksUntil == null || version.isAtMost(worksUntil));
    }

    @Override
    public String toString() {
        return "apply " + applySince + ".." + applyUntil
                + ", works " + worksSince + ".." + (worksUntil != null ? worksUntil : "*");
    }
}
