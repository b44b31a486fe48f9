package in.warroom.domain.model;

import java.util.Objects;

/**
 * Code change attached to an incident: the faulty source and its corrected version.
 */
public record FixPatch(String buggyCode, String fixedCode) {
    public FixPatch {
        Objects.requireNonNull(buggyCode, "buggyCode");
        Objects.requireNonNull(fixedCode, "fixedCode");
    }
}
